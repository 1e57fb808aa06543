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
 * Identifier of one real-time transport connection (one browser tab, one socket).
 * Unique per connected session and invalid once the session disconnects.
 *
 * @param value The identifier
 */
public record ClientSessionId(String value) {

    public ClientSessionId {
        Objects.requireNonNull(value, "sessionId must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }

    public static ClientSessionId of(String value) {
        return new ClientSessionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
