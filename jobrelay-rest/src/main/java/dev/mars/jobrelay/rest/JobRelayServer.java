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
package dev.mars.jobrelay.rest;

import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.core.JobRelayContext;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.rest.config.RelayServerConfig;
import dev.mars.jobrelay.rest.handlers.HealthHandler;
import dev.mars.jobrelay.rest.handlers.JobStatusWebSocketHandler;
import dev.mars.jobrelay.rest.handlers.ListenerStatusHandler;
import dev.mars.jobrelay.rest.handlers.WebSocketSessions;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * HTTP and WebSocket server relaying job status updates to browser sessions.
 *
 * Endpoints:
 * - WS  /ws/job-status - real-time job status stream
 * - GET /health - liveness and listener/session counts
 * - GET /api/v1/listeners - per-server listener status
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class JobRelayServer extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(JobRelayServer.class);

    private final RelayServerConfig config;
    private final MeterRegistry meterRegistry;
    private final Function<RelayMetrics, NotificationChannelClient> clientFactory;

    private HttpServer server;
    private WebSocketSessions sessions;
    private JobRelayContext relay;

    /**
     * Creates a server that listens on the configured PostgreSQL servers.
     *
     * @param config        Validated server configuration
     * @param meterRegistry Registry for relay metrics, may be null
     */
    public JobRelayServer(RelayServerConfig config, MeterRegistry meterRegistry) {
        this(config, meterRegistry, null);
    }

    /**
     * Creates a server with a caller-supplied channel client.
     *
     * @param clientFactory Creates the channel client, or null for the PostgreSQL client
     */
    public JobRelayServer(RelayServerConfig config, MeterRegistry meterRegistry,
                          Function<RelayMetrics, NotificationChannelClient> clientFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.meterRegistry = meterRegistry;
        this.clientFactory = clientFactory;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        sessions = new WebSocketSessions();
        relay = clientFactory == null
            ? JobRelayContext.create(vertx, config.listener(), config.servers(), sessions, meterRegistry)
            : JobRelayContext.create(vertx, config.listener(), config.servers(), sessions, meterRegistry, clientFactory);

        Future.succeededFuture()
                .compose(v -> {
                    Router router = createRouter();
                    logger.debug("Router created successfully");
                    return Future.succeededFuture(router);
                })
                .compose(router -> vertx.createHttpServer()
                        .requestHandler(router)
                        .listen(config.port()))
                .compose(httpServer -> {
                    server = httpServer;
                    logger.info("Job relay server started on port {} serving {} configured server(s)",
                        httpServer.actualPort(), config.servers().servers().size());
                    return Future.succeededFuture();
                })
                .onSuccess(v -> startPromise.complete())
                .onFailure(cause -> {
                    logger.error("Failed to start job relay server", cause);
                    startPromise.fail(cause);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping job relay server - closing listeners and sessions first");

        // listeners first so subscribed sessions still receive listener_stopped
        Future<Void> listenersClosed = relay != null ? relay.close() : Future.succeededFuture();
        if (sessions != null) {
            sessions.closeAll();
        }

        listenersClosed
                .transform(ar -> {
                    if (ar.failed()) {
                        logger.warn("Error closing listeners during shutdown: {}", ar.cause().getMessage());
                    }
                    return server != null ? server.close() : Future.<Void>succeededFuture();
                })
                .onSuccess(v -> {
                    logger.info("Job relay server stopped");
                    stopPromise.complete();
                })
                .onFailure(cause -> {
                    logger.error("Failed to stop job relay server", cause);
                    stopPromise.fail(cause);
                });
    }

    private Router createRouter() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(createCorsHandler());

        HealthHandler healthHandler = new HealthHandler(relay, sessions);
        ListenerStatusHandler listenerStatusHandler = new ListenerStatusHandler(relay.listenerManager());
        JobStatusWebSocketHandler webSocketHandler = new JobStatusWebSocketHandler(sessions, relay.hooks());

        // Real-time job status stream
        router.get(JobStatusWebSocketHandler.PATH).handler(webSocketHandler::upgrade);

        router.get("/health").handler(healthHandler::getHealth);
        router.get("/api/v1/listeners").handler(listenerStatusHandler::listListeners);
        router.get("/api/v1/listeners/:serverId").handler(listenerStatusHandler::getListener);

        return router;
    }

    private CorsHandler createCorsHandler() {
        CorsHandler cors = config.allowsAnyOrigin()
                ? CorsHandler.create()
                : CorsHandler.create().addOrigins(config.allowedOrigins());
        return cors
                .allowedMethod(HttpMethod.GET)
                .allowedMethod(HttpMethod.OPTIONS)
                .allowedHeader("Content-Type")
                .allowedHeader("Authorization");
    }

    /**
     * Port the server is bound to, available once started.
     */
    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    /**
     * The relay wired by this server, available once started.
     */
    public JobRelayContext relay() {
        return relay;
    }
}
