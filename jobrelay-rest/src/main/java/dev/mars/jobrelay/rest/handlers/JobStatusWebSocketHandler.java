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

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.core.dispatch.OutboundEvents;
import dev.mars.jobrelay.core.hooks.SessionLifecycleHooks;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * WebSocket handler for real-time job status updates.
 *
 * WebSocket URL: /ws/job-status?principal={name}
 *
 * Inbound frames:
 * - {@code subscribe{serverId}} starts receiving updates for a server
 * - {@code unsubscribe{serverId}} stops them
 * - {@code ping{id}} is answered with {@code pong{id}}
 * Closing the socket drops every subscription of the session.
 *
 * The {@code principal} query parameter is chosen by the client and taken as
 * claimed; it selects which database login the listener uses. This handler
 * does not authenticate it, so the endpoint must only be reachable through a
 * gateway or reverse proxy that authenticates the caller and sets the
 * parameter itself. A missing or blank principal maps to {@code anonymous}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class JobStatusWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(JobStatusWebSocketHandler.class);

    public static final String PATH = "/ws/job-status";
    static final String ANONYMOUS = "anonymous";

    private final WebSocketSessions sessions;
    private final SessionLifecycleHooks hooks;
    private final AtomicLong sessionIdCounter = new AtomicLong(0);

    public JobStatusWebSocketHandler(WebSocketSessions sessions, SessionLifecycleHooks hooks) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
    }

    /**
     * GET /ws/job-status
     * Upgrades the request and accepts the session.
     */
    public void upgrade(RoutingContext ctx) {
        SubscriberIdentity identity = SubscriberIdentity.of(principalOf(ctx.queryParams().get("principal")));
        ctx.request().toWebSocket()
            .onSuccess(webSocket -> accept(webSocket, identity))
            .onFailure(err -> {
                logger.warn("WebSocket upgrade failed from {}: {}", ctx.request().remoteAddress(), err.getMessage());
                if (!ctx.response().ended()) {
                    ctx.fail(400, err);
                }
            });
    }

    /**
     * Accepts an upgraded WebSocket connection.
     */
    public void accept(ServerWebSocket webSocket, SubscriberIdentity identity) {
        ClientSessionId sessionId = ClientSessionId.of("ws-" + sessionIdCounter.incrementAndGet());
        WebSocketSession session = new WebSocketSession(sessionId, webSocket, identity);
        sessions.register(session);

        logger.info("WebSocket session {} connected for principal '{}' from {}",
            sessionId, identity.principal(), webSocket.remoteAddress());

        webSocket.textMessageHandler(message -> handleTextMessage(session, message));
        webSocket.binaryMessageHandler(buffer -> handleBinaryMessage(session, buffer));
        webSocket.exceptionHandler(throwable -> logger.warn("WebSocket error for session {}: {}",
            sessionId, throwable.getMessage()));
        webSocket.closeHandler(v -> handleClose(session));

        session.send(OutboundEvents.connected(sessionId));
    }

    private static String principalOf(String value) {
        if (value == null || value.isBlank()) {
            return ANONYMOUS;
        }
        return value.trim();
    }

    /**
     * Handles incoming text frames from WebSocket clients.
     */
    private void handleTextMessage(WebSocketSession session, String message) {
        logger.debug("Received WebSocket text message from {}: {}", session.getSessionId(), message);

        JsonObject frame;
        try {
            frame = new JsonObject(message);
        } catch (DecodeException e) {
            logger.warn("Invalid frame from session {}: {}", session.getSessionId(), e.getMessage());
            session.send(OutboundEvents.error(JobRelayError.invalidRequest("Invalid message format: " + e.getMessage())));
            return;
        }

        String type = frame.getValue("type") instanceof String value ? value : null;
        if (type == null) {
            session.send(OutboundEvents.error(JobRelayError.invalidRequest("Message type is required")));
            return;
        }

        switch (type) {
            case "subscribe":
                handleSubscribe(session, frame);
                break;
            case "unsubscribe":
                handleUnsubscribe(session, frame);
                break;
            case "ping":
                session.send(OutboundEvents.pong(frame.getValue("id")));
                break;
            default:
                session.send(OutboundEvents.error(JobRelayError.unknownMessageType(type)));
        }
    }

    private void handleSubscribe(WebSocketSession session, JsonObject frame) {
        ClientSessionId sessionId = session.getSessionId();
        invoke(session, "subscribe", () -> hooks.onSubscribe(frame.getValue("serverId"), sessionId, session.getIdentity()))
            .onComplete(ar -> {
                // the socket may have closed while the listener was starting
                if (!session.isOpen()) {
                    hooks.onDisconnect(sessionId);
                }
            });
    }

    private void handleUnsubscribe(WebSocketSession session, JsonObject frame) {
        invoke(session, "unsubscribe", () -> hooks.onUnsubscribe(frame.getValue("serverId"), session.getSessionId()));
    }

    private Future<JsonObject> invoke(WebSocketSession session, String operation, Supplier<Future<JsonObject>> hook) {
        Future<JsonObject> result;
        try {
            result = hook.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.onFailure(err -> {
            logger.error("Failed to {} session {}: {}", operation, session.getSessionId(), err.getMessage(), err);
            session.send(OutboundEvents.error(JobRelayError.internalError("Failed to " + operation + ": " + err.getMessage())));
        });
    }

    private void handleBinaryMessage(WebSocketSession session, Buffer buffer) {
        logger.debug("Received WebSocket binary message from {}: {} bytes", session.getSessionId(), buffer.length());
        session.send(OutboundEvents.error(JobRelayError.invalidRequest("Binary messages are not supported")));
    }

    private void handleClose(WebSocketSession session) {
        ClientSessionId sessionId = session.getSessionId();
        sessions.remove(sessionId);
        logger.info("WebSocket session {} closed. Active sessions: {}", sessionId, sessions.count());

        hooks.onDisconnect(sessionId)
            .onFailure(err -> logger.error("Failed to clean up subscriptions of session {}: {}",
                sessionId, err.getMessage(), err));
    }
}
