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
package dev.mars.jobrelay.rest.config;

import dev.mars.jobrelay.core.config.ListenerConfig;
import dev.mars.jobrelay.core.config.ServerDirectory;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, validated configuration for the job relay server.
 * Parsed once at bootstrap, injected into the server verticle.
 *
 * @param port           HTTP port, 0 picks a free port
 * @param allowedOrigins CORS origins, {@code *} allows any
 * @param listener       Listener timing and retry settings
 * @param servers        Database servers clients may subscribe to
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public record RelayServerConfig(
        int port,
        List<String> allowedOrigins,
        ListenerConfig listener,
        ServerDirectory servers) {

    public RelayServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535, got: " + port);
        }
        Objects.requireNonNull(allowedOrigins, "allowedOrigins must not be null");
        if (allowedOrigins.isEmpty()) {
            throw new IllegalArgumentException("allowedOrigins must not be empty");
        }
        allowedOrigins = List.copyOf(allowedOrigins);
        Objects.requireNonNull(listener, "listener config must not be null");
        Objects.requireNonNull(servers, "servers must not be null");
    }

    /**
     * Parse and validate configuration from JsonObject.
     * Called once at bootstrap after ConfigRetriever merges all sources.
     *
     * @param json Merged configuration from ConfigRetriever
     * @return Validated, immutable configuration
     * @throws IllegalArgumentException if validation fails
     */
    public static RelayServerConfig from(JsonObject json) {
        int port = readPort(json.getValue("port"));

        JsonArray originsArray = json.getJsonArray("allowedOrigins");
        if (originsArray == null || originsArray.isEmpty()) {
            throw new IllegalArgumentException("allowedOrigins must be provided and non-empty");
        }
        List<String> allowedOrigins = originsArray.stream()
                .map(Object::toString)
                .toList();

        ListenerConfig listener = ListenerConfig.fromJson(json.getJsonObject("listener"));
        ServerDirectory servers = ServerDirectory.fromJson(json.getJsonArray("servers"));

        return new RelayServerConfig(port, allowedOrigins, listener, servers);
    }

    // env and system property stores deliver the port as text
    private static int readPort(Object value) {
        if (value == null) {
            return 8080;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be a number, got: " + value, e);
        }
    }

    public boolean allowsAnyOrigin() {
        return allowedOrigins.contains("*");
    }
}
