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
package dev.mars.jobrelay.api.credentials;

import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import io.vertx.pgclient.PgConnectOptions;

/**
 * Resolves connection options for dedicated listener connections.
 *
 * Listener connections are opened from background supervisors that have no
 * request context, so credentials are resolved per attempt from the explicit
 * identity rather than from any cached, thread-bound session. A fresh
 * {@link PgConnectOptions} instance is returned on every call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public interface ConnectOptionsResolver {

    /**
     * @return true if the server is configured
     */
    boolean isKnownServer(ServerId serverId);

    /**
     * @return true if credentials can be resolved for the identity on the server
     */
    boolean hasCredentials(ServerId serverId, SubscriberIdentity identity);

    /**
     * Resolves options for one connection attempt.
     *
     * @throws UnknownServerException if the server is not configured
     * @throws CredentialsUnavailableException if the identity has no credentials for the server
     */
    PgConnectOptions resolve(ServerId serverId, SubscriberIdentity identity);
}
