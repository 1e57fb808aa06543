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

import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import io.vertx.core.json.JsonObject;
import io.vertx.pgclient.SslMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One configured database server.
 *
 * @param id                 Identifier clients subscribe with
 * @param host               Host name
 * @param port               Port
 * @param database           Database the scheduler schema lives in
 * @param sslMode            SSL mode, defaults to {@link SslMode#DISABLE}
 * @param credentials        Per-principal logins
 * @param defaultCredentials Login used for principals without their own entry, may be null
 */
public record ServerDefinition(
    ServerId id,
    String host,
    int port,
    String database,
    SslMode sslMode,
    Map<String, DatabaseCredentials> credentials,
    DatabaseCredentials defaultCredentials
) {
    public ServerDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Server " + id + ": host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Server " + id + ": port must be between 1 and 65535, got: " + port);
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Server " + id + ": database must not be blank");
        }
        sslMode = sslMode == null ? SslMode.DISABLE : sslMode;
        credentials = credentials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
    }

    public Optional<DatabaseCredentials> credentialsFor(SubscriberIdentity identity) {
        DatabaseCredentials own = credentials.get(identity.principal());
        return Optional.ofNullable(own != null ? own : defaultCredentials);
    }

    /**
     * Reads one entry of the {@code servers} configuration list.
     */
    public static ServerDefinition fromJson(JsonObject json) {
        Object rawId = json.getValue("id");
        if (rawId == null) {
            throw new IllegalArgumentException("Server entry is missing 'id': " + json.encode());
        }
        ServerId id = ServerId.of(rawId);

        Map<String, DatabaseCredentials> credentials = new LinkedHashMap<>();
        JsonObject credentialsJson = json.getJsonObject("credentials");
        if (credentialsJson != null) {
            for (String principal : credentialsJson.fieldNames()) {
                credentials.put(principal, DatabaseCredentials.fromJson(credentialsJson.getJsonObject(principal)));
            }
        }
        JsonObject defaultJson = json.getJsonObject("defaultCredentials");
        String sslMode = json.getString("sslMode");

        return new ServerDefinition(
            id,
            json.getString("host", "localhost"),
            json.getInteger("port", 5432),
            json.getString("database", "postgres"),
            sslMode == null ? null : SslMode.of(sslMode),
            credentials,
            defaultJson == null ? null : DatabaseCredentials.fromJson(defaultJson));
    }
}
