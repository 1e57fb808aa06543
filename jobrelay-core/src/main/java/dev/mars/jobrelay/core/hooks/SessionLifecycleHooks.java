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
package dev.mars.jobrelay.core.hooks;

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.credentials.ConnectOptionsResolver;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.core.dispatch.EventDispatcher;
import dev.mars.jobrelay.core.dispatch.OutboundEvents;
import dev.mars.jobrelay.core.listener.ListenerManager;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SessionRemoval;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import dev.mars.jobrelay.core.registry.SubscriptionResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry points the real-time transport calls for subscribe, unsubscribe and disconnect.
 *
 * Replies only report whether the registration succeeded. The long-run health
 * of a listener is reported separately through {@code listener_error} frames.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class SessionLifecycleHooks {
    private static final Logger logger = LoggerFactory.getLogger(SessionLifecycleHooks.class);

    private final SubscriptionRegistry registry;
    private final ListenerManager listenerManager;
    private final ConnectOptionsResolver resolver;
    private final EventDispatcher dispatcher;
    private final RelayMetrics metrics;

    public SessionLifecycleHooks(SubscriptionRegistry registry,
                                 ListenerManager listenerManager,
                                 ConnectOptionsResolver resolver,
                                 EventDispatcher dispatcher,
                                 RelayMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.listenerManager = Objects.requireNonNull(listenerManager, "listenerManager must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Registers the session for the server's job status updates and starts the
     * server's listener if this is its first subscriber.
     *
     * @param rawServerId Server id as sent by the client, a string or a number
     * @return the reply frame, already sent to the session
     */
    public Future<JsonObject> onSubscribe(Object rawServerId, ClientSessionId sessionId, SubscriberIdentity identity) {
        ServerId serverId = parseServerId(rawServerId);
        if (serverId == null) {
            return reply(sessionId, null, JobRelayError.invalidRequest("subscribe requires a non-blank serverId"));
        }
        if (!resolver.isKnownServer(serverId)) {
            logger.warn("Session {} tried to subscribe to unknown server {}", sessionId, serverId);
            return reply(sessionId, serverId, JobRelayError.serverNotFound(serverId));
        }
        if (!resolver.hasCredentials(serverId, identity)) {
            logger.warn("Session {} has no credentials for principal '{}' on server {}", sessionId, identity.principal(), serverId);
            return reply(sessionId, serverId, JobRelayError.connectionUnavailable(serverId));
        }

        SubscriptionResult result = registry.subscribe(serverId, sessionId, identity);
        dispatcher.joinServerRoom(serverId, sessionId);
        Future<Void> listenerReady;
        if (result.first()) {
            listenerReady = listenerManager.start(serverId, identity);
        } else if (!listenerManager.isRunning(serverId)) {
            logger.error("Server {} has subscribers but no running listener, restarting it", serverId);
            metrics.recordInvariantViolation();
            listenerReady = listenerManager.start(serverId, identity);
        } else {
            listenerReady = Future.succeededFuture();
        }

        return listenerReady.transform(ar -> {
            if (ar.succeeded()) {
                logger.info("Session {} subscribed to job status updates for server {}{}",
                    sessionId, serverId, result.replaced() ? " (resubscribe)" : "");
                return Future.succeededFuture(send(sessionId, OutboundEvents.listenerStarted(serverId, sessionId, Instant.now())));
            }
            logger.error("Failed to start job status listener for server {}: {}", serverId, ar.cause().getMessage());
            rollback(serverId, sessionId);
            return reply(sessionId, serverId, JobRelayError.subscribeFailed(serverId, ar.cause().getMessage()));
        });
    }

    /**
     * Removes the session's subscription to the server and stops the server's
     * listener if no subscribers remain. Idempotent.
     *
     * @return the reply frame, already sent to the session
     */
    public Future<JsonObject> onUnsubscribe(Object rawServerId, ClientSessionId sessionId) {
        ServerId serverId = parseServerId(rawServerId);
        if (serverId == null) {
            return reply(sessionId, null, JobRelayError.invalidRequest("unsubscribe requires a non-blank serverId"));
        }

        boolean last = registry.unsubscribe(serverId, sessionId);
        dispatcher.leaveServerRoom(serverId, sessionId);
        Future<Void> stopped = last ? listenerManager.stop(serverId) : Future.succeededFuture();
        logger.info("Session {} unsubscribed from server {} (last={})", sessionId, serverId, last);
        return stopped.transform(ar -> Future.succeededFuture(send(sessionId, OutboundEvents.listenerStopped(serverId))));
    }

    /**
     * Drops every subscription of a closed session and stops listeners left
     * without subscribers. Safe to call for sessions that never subscribed.
     */
    public Future<Void> onDisconnect(ClientSessionId sessionId) {
        List<SessionRemoval> removals = registry.removeSession(sessionId);
        if (removals.isEmpty()) {
            logger.debug("Session {} disconnected without subscriptions", sessionId);
            return Future.succeededFuture();
        }

        List<Future<Void>> stops = new ArrayList<>();
        for (SessionRemoval removal : removals) {
            dispatcher.leaveServerRoom(removal.serverId(), sessionId);
            if (removal.becameEmpty()) {
                stops.add(listenerManager.stop(removal.serverId()));
            }
        }
        logger.info("Session {} disconnected, removed from {} server(s), stopping {} listener(s)",
            sessionId, removals.size(), stops.size());
        return Future.join(stops).mapEmpty();
    }

    private void rollback(ServerId serverId, ClientSessionId sessionId) {
        dispatcher.leaveServerRoom(serverId, sessionId);
        if (registry.unsubscribe(serverId, sessionId)) {
            listenerManager.stop(serverId);
        }
    }

    private Future<JsonObject> reply(ClientSessionId sessionId, ServerId serverId, JobRelayError error) {
        return Future.succeededFuture(send(sessionId, OutboundEvents.listenerError(serverId, error)));
    }

    private JsonObject send(ClientSessionId sessionId, JsonObject frame) {
        dispatcher.reply(sessionId, frame);
        return frame;
    }

    private static ServerId parseServerId(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return ServerId.of(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
