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
package dev.mars.jobrelay.core.registry;

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;

import java.time.Instant;
import java.util.Objects;

/**
 * One client session's interest in one server's job status stream.
 *
 * @param serverId  The server subscribed to
 * @param sessionId The subscribing session
 * @param identity  Identity whose credentials the listener may use
 * @param createdAt Time of the first subscribe for this pair, kept across duplicate subscribes
 */
public record Subscription(ServerId serverId, ClientSessionId sessionId, SubscriberIdentity identity, Instant createdAt) {

    public Subscription {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
