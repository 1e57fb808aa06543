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

import dev.mars.jobrelay.core.JobRelayContext;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * GET /health
 */
public class HealthHandler {

    private final JobRelayContext relay;
    private final WebSocketSessions sessions;

    public HealthHandler(JobRelayContext relay, WebSocketSessions sessions) {
        this.relay = relay;
        this.sessions = sessions;
    }

    public void getHealth(RoutingContext ctx) {
        JsonObject response = new JsonObject()
            .put("status", "UP")
            .put("service", "jobrelay")
            .put("listeners", relay.listenerManager().activeCount())
            .put("sessions", sessions.count())
            .put("subscriptions", relay.registry().subscriptionCount())
            .put("timestamp", System.currentTimeMillis());

        ctx.response()
            .putHeader("content-type", "application/json")
            .end(response.encode());
    }
}
