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
package dev.mars.jobrelay.core.dispatch;

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Fans decoded job status events out to the sessions subscribed to a server.
 *
 * The dispatcher only reads registry snapshots. A failed delivery to one
 * session is counted and logged and never stops delivery to the others.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class EventDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final SubscriptionRegistry registry;
    private final SessionTransport transport;
    private final RelayMetrics metrics;

    public EventDispatcher(SubscriptionRegistry registry, SessionTransport transport, RelayMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Delivers one event to every session currently subscribed to the server.
     *
     * @return number of sessions the event was delivered to
     */
    public int dispatch(ServerId serverId, JobStatusEvent event) {
        JsonObject frame = OutboundEvents.jobStatusUpdate(event);
        int delivered = deliverToAll(serverId, registry.sessionsFor(serverId), frame);
        logger.debug("Dispatched job {} status '{}' from server {} to {} session(s)",
            event.jobId(), event.status().wireName(), serverId, delivered);
        return delivered;
    }

    /**
     * Delivers a terminal listener error to an explicit set of sessions, used once
     * the server's subscriptions have already been drained from the registry.
     */
    public int dispatchTerminal(ServerId serverId, Collection<ClientSessionId> sessions, JobRelayError reason) {
        JsonObject frame = OutboundEvents.listenerError(serverId, reason);
        int delivered = deliverToAll(serverId, sessions, frame);
        logger.error("Job status listener for server {} failed permanently [{}]: {} (notified {} session(s))",
            serverId, reason.code(), reason.message(), delivered);
        return delivered;
    }

    /**
     * Room shared by every session subscribed to a server.
     */
    public static String roomFor(ServerId serverId) {
        return "server_" + serverId.value();
    }

    public void joinServerRoom(ServerId serverId, ClientSessionId sessionId) {
        try {
            transport.joinRoom(roomFor(serverId), sessionId);
        } catch (RuntimeException e) {
            logger.warn("Failed to add session {} to room of server {}: {}", sessionId, serverId, e.getMessage());
        }
    }

    public void leaveServerRoom(ServerId serverId, ClientSessionId sessionId) {
        try {
            transport.leaveRoom(roomFor(serverId), sessionId);
        } catch (RuntimeException e) {
            logger.warn("Failed to remove session {} from room of server {}: {}", sessionId, serverId, e.getMessage());
        }
    }

    /**
     * Broadcast-by-room fallback: sends a frame to every session in the
     * server's room without reading the registry.
     *
     * @return number of sessions the frame was delivered to
     */
    public int broadcast(ServerId serverId, JsonObject frame) {
        try {
            int delivered = transport.broadcast(roomFor(serverId), frame);
            logger.debug("Broadcast {} frame to {} session(s) in room of server {}",
                frame.getString("type"), delivered, serverId);
            return delivered;
        } catch (RuntimeException e) {
            logger.warn("Failed to broadcast {} frame for server {}: {}", frame.getString("type"), serverId, e.getMessage());
            return 0;
        }
    }

    /**
     * Sends a frame to a single session, used for direct replies.
     */
    public boolean reply(ClientSessionId sessionId, JsonObject frame) {
        try {
            return transport.deliver(sessionId, frame);
        } catch (RuntimeException e) {
            logger.warn("Failed to send {} reply to session {}: {}", frame.getString("type"), sessionId, e.getMessage());
            return false;
        }
    }

    private int deliverToAll(ServerId serverId, Collection<ClientSessionId> sessions, JsonObject frame) {
        int delivered = 0;
        for (ClientSessionId sessionId : sessions) {
            // one copy per session
            if (deliverTo(serverId, sessionId, frame.copy())) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliverTo(ServerId serverId, ClientSessionId sessionId, JsonObject frame) {
        try {
            if (transport.deliver(sessionId, frame)) {
                metrics.recordEventDelivered();
                return true;
            }
            logger.debug("Session {} is no longer connected, skipped {} frame for server {}",
                sessionId, frame.getString("type"), serverId);
        } catch (RuntimeException e) {
            logger.warn("Failed to deliver {} frame for server {} to session {}: {}",
                frame.getString("type"), serverId, sessionId, e.getMessage());
        }
        metrics.recordDeliveryFailed();
        return false;
    }
}
