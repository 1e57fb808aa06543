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
package dev.mars.jobrelay.rest.handlers;

import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.api.error.JobRelayErrorCodes;
import dev.mars.jobrelay.core.listener.ListenerManager;
import dev.mars.jobrelay.core.listener.ListenerStats;
import dev.mars.jobrelay.rest.error.ErrorResponse;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * REST handler for listener status endpoints.
 *
 * Provides endpoints for:
 * - GET /api/v1/listeners - status of every running listener
 * - GET /api/v1/listeners/:serverId - status of one server's listener
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ListenerStatusHandler {

    private static final Logger logger = LoggerFactory.getLogger(ListenerStatusHandler.class);

    private final ListenerManager listenerManager;

    public ListenerStatusHandler(ListenerManager listenerManager) {
        this.listenerManager = listenerManager;
    }

    /**
     * GET /api/v1/listeners
     */
    public void listListeners(RoutingContext ctx) {
        List<ListenerStats> stats = listenerManager.stats();
        JsonArray listeners = new JsonArray();
        stats.stream()
            .sorted(Comparator.comparing(s -> s.serverId().value()))
            .forEach(s -> listeners.add(s.toJson()));

        logger.debug("Listing {} listener(s)", stats.size());
        ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("count", listeners.size())
                .put("listeners", listeners)
                .encode());
    }

    /**
     * GET /api/v1/listeners/:serverId
     */
    public void getListener(RoutingContext ctx) {
        ServerId serverId;
        try {
            serverId = ServerId.of(ctx.pathParam("serverId"));
        } catch (IllegalArgumentException e) {
            ErrorResponse.send(ctx, 400, JobRelayError.invalidRequest(e.getMessage()));
            return;
        }

        listenerManager.stats().stream()
            .filter(s -> s.serverId().equals(serverId))
            .findFirst()
            .ifPresentOrElse(
                s -> ctx.response()
                    .putHeader("content-type", "application/json")
                    .end(s.toJson().encode()),
                () -> ErrorResponse.notFound(ctx, JobRelayError.of(
                    JobRelayErrorCodes.SERVER_NOT_FOUND,
                    "No running listener for server " + serverId)));
    }
}
