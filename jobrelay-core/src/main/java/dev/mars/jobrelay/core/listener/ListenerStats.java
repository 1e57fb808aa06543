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

import dev.mars.jobrelay.api.ServerId;
import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Point-in-time view of one listener, exposed for status reporting.
 */
public record ListenerStats(
    ServerId serverId,
    ListenerState state,
    int consecutiveFailures,
    long connectionAgeMs,
    Instant lastSuccessfulPoll,
    Instant lastRotation,
    int subscriberCount
) {
    public JsonObject toJson() {
        return new JsonObject()
            .put("serverId", serverId.value())
            .put("state", state.name())
            .put("consecutiveFailures", consecutiveFailures)
            .put("connectionAgeMs", connectionAgeMs)
            .put("lastSuccessfulPoll", lastSuccessfulPoll == null ? null : lastSuccessfulPoll.toString())
            .put("lastRotation", lastRotation == null ? null : lastRotation.toString())
            .put("subscriberCount", subscriberCount);
    }

    ListenerStats withSubscriberCount(int count) {
        return new ListenerStats(serverId, state, consecutiveFailures, connectionAgeMs, lastSuccessfulPoll, lastRotation, count);
    }
}
