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
import dev.mars.jobrelay.api.credentials.ConnectOptionsResolver;
import dev.mars.jobrelay.api.credentials.CredentialsUnavailableException;
import dev.mars.jobrelay.api.credentials.UnknownServerException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.pgclient.PgConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configured database servers and the logins each principal may use on them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ServerDirectory implements ConnectOptionsResolver {
    private static final Logger logger = LoggerFactory.getLogger(ServerDirectory.class);

    private final Map<ServerId, ServerDefinition> servers;

    public ServerDirectory(Collection<ServerDefinition> definitions) {
        Map<ServerId, ServerDefinition> byId = new LinkedHashMap<>();
        for (ServerDefinition definition : definitions) {
            if (byId.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalArgumentException("Duplicate server id: " + definition.id());
            }
        }
        this.servers = Collections.unmodifiableMap(byId);
        logger.debug("Server directory created with {} server(s): {}", servers.size(), servers.keySet());
    }

    /**
     * Reads the {@code servers} configuration list.
     */
    public static ServerDirectory fromJson(JsonArray json) {
        if (json == null) {
            return new ServerDirectory(List.of());
        }
        List<ServerDefinition> definitions = json.stream()
            .map(entry -> {
                if (!(entry instanceof JsonObject object)) {
                    throw new IllegalArgumentException("Server entries must be objects, got: " + entry);
                }
                return ServerDefinition.fromJson(object);
            })
            .toList();
        return new ServerDirectory(definitions);
    }

    public Optional<ServerDefinition> find(ServerId serverId) {
        return Optional.ofNullable(servers.get(serverId));
    }

    public Collection<ServerDefinition> servers() {
        return servers.values();
    }

    @Override
    public boolean isKnownServer(ServerId serverId) {
        return servers.containsKey(serverId);
    }

    @Override
    public boolean hasCredentials(ServerId serverId, SubscriberIdentity identity) {
        ServerDefinition definition = servers.get(serverId);
        return definition != null && definition.credentialsFor(identity).isPresent();
    }

    @Override
    public PgConnectOptions resolve(ServerId serverId, SubscriberIdentity identity) {
        ServerDefinition definition = servers.get(serverId);
        if (definition == null) {
            throw new UnknownServerException(serverId);
        }
        DatabaseCredentials credentials = definition.credentialsFor(identity)
            .orElseThrow(() -> new CredentialsUnavailableException(serverId, identity));

        return new PgConnectOptions()
            .setHost(definition.host())
            .setPort(definition.port())
            .setDatabase(definition.database())
            .setUser(credentials.user())
            .setPassword(credentials.password())
            .setSslMode(definition.sslMode());
    }
}
