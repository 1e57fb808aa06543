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

/**
 * Standard error codes for the job status relay.
 *
 * Error code ranges:
 * - JRERR0001-0049: General/System errors
 * - JRERR0100-0149: Server directory errors
 * - JRERR0500-0549: Listener/Connection errors
 */
public final class JobRelayErrorCodes {

    private JobRelayErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "JRERR0001";
    public static final String INVALID_REQUEST = "JRERR0002";
    public static final String AUTHENTICATION_FAILED = "JRERR0003";
    public static final String UNKNOWN_MESSAGE_TYPE = "JRERR0004";

    // ========================================================================
    // Server Directory Errors (0100-0149)
    // ========================================================================
    public static final String SERVER_NOT_FOUND = "JRERR0100";

    // ========================================================================
    // Listener/Connection Errors (0500-0549)
    // ========================================================================
    public static final String CONNECTION_UNAVAILABLE = "JRERR0500";
    public static final String SUBSCRIBE_FAILED = "JRERR0501";
    public static final String LISTENER_EXHAUSTED = "JRERR0502";
}
