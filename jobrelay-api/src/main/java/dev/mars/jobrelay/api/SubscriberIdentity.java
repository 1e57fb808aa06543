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

import java.util.Objects;

/**
 * The principal a session subscribed as.
 *
 * Captured once at subscribe time and handed to every connection attempt made
 * on the subscriber's behalf, so that a background listener never depends on
 * request-scoped authentication state.
 *
 * @param principal The authenticated principal name
 */
public record SubscriberIdentity(String principal) {

    public static final SubscriberIdentity ANONYMOUS = new SubscriberIdentity("anonymous");

    public SubscriberIdentity {
        Objects.requireNonNull(principal, "principal must not be null");
        if (principal.isBlank()) {
            throw new IllegalArgumentException("principal must not be blank");
        }
    }

    public static SubscriberIdentity of(String principal) {
        return new SubscriberIdentity(principal);
    }
}
