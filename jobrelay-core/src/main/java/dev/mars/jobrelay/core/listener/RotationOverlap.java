/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.jobrelay.core.listener;

import dev.mars.jobrelay.api.JobStatusEvent;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Payloads drained from a rotated-out connection, kept until the overlap with
 * its replacement ends.
 *
 * While both connections listen, a notification committed in that gap reaches
 * both of them. Each drained payload cancels at most one identical payload on
 * the replacement, and only until the overlap expires, so repeated identical
 * notifications outside a rotation are always delivered. Not thread safe;
 * owned by a single supervisor.
 */
final class RotationOverlap {

    private final int capacity;
    private final Map<String, Integer> pending = new HashMap<>();
    private int size;
    private Instant expiresAt;

    RotationOverlap(int capacity) {
        this.capacity = capacity;
    }

    /**
     * Starts a new overlap, discarding any previous one.
     */
    void begin(List<JobStatusEvent> drained, Instant expiresAt) {
        clear();
        this.expiresAt = expiresAt;
        for (JobStatusEvent event : drained) {
            if (size >= capacity) {
                break;
            }
            if (event.rawPayload() != null) {
                pending.merge(event.rawPayload(), 1, Integer::sum);
                size++;
            }
        }
    }

    /**
     * @return true if the payload was already delivered from the retired connection
     */
    boolean consume(String payload, Instant now) {
        if (size == 0 || payload == null) {
            return false;
        }
        if (!now.isBefore(expiresAt)) {
            clear();
            return false;
        }
        Integer remaining = pending.get(payload);
        if (remaining == null) {
            return false;
        }
        if (remaining == 1) {
            pending.remove(payload);
        } else {
            pending.put(payload, remaining - 1);
        }
        size--;
        return true;
    }

    void clear() {
        pending.clear();
        size = 0;
        expiresAt = null;
    }

    int size() {
        return size;
    }
}
