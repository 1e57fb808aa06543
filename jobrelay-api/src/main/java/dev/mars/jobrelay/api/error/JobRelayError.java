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
package dev.mars.jobrelay.api.error;

import java.time.Instant;

/**
 * Immutable error record delivered to a client session.
 *
 * @param code      The standard error code (e.g., JRERR0100)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param terminal  True if the listener for the server has been given up and the
 *                  session's subscription has been dropped
 */
public record JobRelayError(
    String code,
    String message,
    Instant timestamp,
    boolean terminal
) {
    public static JobRelayError of(String code, String message) {
        return new JobRelayError(code, message, Instant.now(), false);
    }

    public static JobRelayError terminal(String code, String message) {
        return new JobRelayError(code, message, Instant.now(), true);
    }

    public static JobRelayError invalidRequest(String message) {
        return of(JobRelayErrorCodes.INVALID_REQUEST, message);
    }

    public static JobRelayError serverNotFound(Object serverId) {
        return of(JobRelayErrorCodes.SERVER_NOT_FOUND, "Server not found: " + serverId);
    }

    public static JobRelayError connectionUnavailable(Object serverId) {
        return of(JobRelayErrorCodes.CONNECTION_UNAVAILABLE,
                  "No connection credentials available for server " + serverId);
    }

    /**
     * Creates a subscribe failure, reported when the listener could not be started.
     */
    public static JobRelayError subscribeFailed(Object serverId, String reason) {
        return of(JobRelayErrorCodes.SUBSCRIBE_FAILED,
                  "Failed to start job status listener for server " + serverId + ": " + reason);
    }

    public static JobRelayError authenticationFailed(Object serverId, String reason) {
        return terminal(JobRelayErrorCodes.AUTHENTICATION_FAILED,
                        "Authentication failed for server " + serverId + ": " + reason);
    }

    public static JobRelayError listenerExhausted(Object serverId, int attempts, String reason) {
        return terminal(JobRelayErrorCodes.LISTENER_EXHAUSTED,
                        "Job status listener for server " + serverId + " gave up after "
                        + attempts + " consecutive failures: " + reason);
    }

    public static JobRelayError unknownMessageType(String type) {
        return of(JobRelayErrorCodes.UNKNOWN_MESSAGE_TYPE, "Unknown message type: " + type);
    }

    public static JobRelayError internalError(String message) {
        return of(JobRelayErrorCodes.INTERNAL_ERROR, message);
    }
}
