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
package dev.mars.jobrelay.rest.error;

import dev.mars.jobrelay.api.error.JobRelayError;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Utility class for sending standardized error responses in REST handlers.
 */
public final class ErrorResponse {

    private ErrorResponse() {
        // Utility class - no instantiation
    }

    /**
     * Sends an error response with the given JobRelayError.
     *
     * @param ctx        The routing context
     * @param statusCode HTTP status code
     * @param error      The relay error
     */
    public static void send(RoutingContext ctx, int statusCode, JobRelayError error) {
        ctx.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(toJson(error).encode());
    }

    /**
     * Sends a 404 Not Found error.
     */
    public static void notFound(RoutingContext ctx, JobRelayError error) {
        send(ctx, 404, error);
    }

    /**
     * Converts a JobRelayError to a JsonObject for embedding in other responses.
     */
    public static JsonObject toJson(JobRelayError error) {
        return new JsonObject()
            .put("code", error.code())
            .put("error", error.message())
            .put("timestamp", error.timestamp().toEpochMilli());
    }
}
