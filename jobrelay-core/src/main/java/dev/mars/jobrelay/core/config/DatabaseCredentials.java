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
package dev.mars.jobrelay.core.config;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Database login for one principal.
 *
 * @param user     Database role
 * @param password Password, may be empty for trust authentication
 */
public record DatabaseCredentials(String user, String password) {

    public DatabaseCredentials {
        Objects.requireNonNull(user, "user must not be null");
        if (user.isBlank()) {
            throw new IllegalArgumentException("user must not be blank");
        }
        password = password == null ? "" : password;
    }

    public static DatabaseCredentials fromJson(JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("credentials must be an object with 'user' and 'password'");
        }
        String user = json.getString("user");
        if (user == null) {
            throw new IllegalArgumentException("credentials are missing 'user'");
        }
        return new DatabaseCredentials(user, json.getString("password"));
    }

    @Override
    public String toString() {
        return "DatabaseCredentials{user='" + user + "', password='***'}";
    }
}
