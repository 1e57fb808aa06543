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
 * Opaque identifier of a configured database server.
 *
 * Clients may send the identifier as a JSON string or number; both are
 * normalised to their trimmed string form so that {@code 7} and {@code "7"}
 * address the same server.
 *
 * @param value The identifier, never blank
 */
public record ServerId(String value) {

    public ServerId {
        Objects.requireNonNull(value, "serverId must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("serverId must not be blank");
        }
        value = value.trim();
    }

    /**
     * Creates a server id from a raw JSON value (string or number).
     *
     * @param raw The raw value
     * @return The server id
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static ServerId of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("serverId must not be null");
        }
        if (raw instanceof Number number && number.doubleValue() == number.longValue()) {
            return new ServerId(Long.toString(number.longValue()));
        }
        return new ServerId(raw.toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
