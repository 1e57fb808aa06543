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

/**
 * Thrown when no credentials can be resolved for an identity on a server.
 * Not retryable: the same attempt will fail the same way.
 */
public class CredentialsUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CredentialsUnavailableException(ServerId serverId, SubscriberIdentity identity) {
        super("No credentials for principal '" + identity.principal() + "' on server " + serverId);
    }
}
