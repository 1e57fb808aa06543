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
package dev.mars.jobrelay.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded job status notification.
 *
 * Transient: produced by a channel client, handed straight to the dispatcher
 * and never persisted.
 *
 * @param serverId   Server the notification originated from
 * @param jobId      Scheduler job identifier
 * @param status     Decoded run state
 * @param rawStatus  Status value exactly as it appeared in the payload
 * @param startTime  Run start, may be null
 * @param endTime    Run end, may be null
 * @param eventTime  Time the scheduler emitted the notification, may be null
 * @param details    Any additional payload keys, never null
 * @param rawPayload The undecoded payload, used to recognise redelivery across a connection rotation
 */
public record JobStatusEvent(
        ServerId serverId,
        long jobId,
        JobStatus status,
        String rawStatus,
        Instant startTime,
        Instant endTime,
        Instant eventTime,
        Map<String, Object> details,
        String rawPayload) {

    public JobStatusEvent {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        // values may be JSON null
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
