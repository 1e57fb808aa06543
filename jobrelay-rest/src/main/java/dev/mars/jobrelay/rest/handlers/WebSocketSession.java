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
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connected browser session on the job status WebSocket.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class WebSocketSession {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketSession.class);

    private final ClientSessionId sessionId;
    private final ServerWebSocket webSocket;
    private final SubscriberIdentity identity;

    // Connection state
    private volatile boolean active = true;

    public WebSocketSession(ClientSessionId sessionId, ServerWebSocket webSocket, SubscriberIdentity identity) {
        this.sessionId = sessionId;
        this.webSocket = webSocket;
        this.identity = identity;

        logger.debug("Created WebSocket session {} for principal '{}'", sessionId, identity.principal());
    }

    /**
     * Checks if the session can still receive frames.
     */
    public boolean isOpen() {
        if (!active) {
            return false;
        }
        if (webSocket.isClosed()) {
            logger.debug("WebSocket session {} is closed", sessionId);
            active = false;
            return false;
        }
        return true;
    }

    /**
     * Sends a frame to the client.
     *
     * @return false if the session is no longer open or the write failed
     */
    public boolean send(JsonObject frame) {
        if (!isOpen()) {
            logger.debug("Cannot send {} frame to closed session: {}", frame.getString("type"), sessionId);
            return false;
        }

        try {
            webSocket.writeTextMessage(frame.encode());
            logger.trace("Sent frame to WebSocket session {}: {}", sessionId, frame.encode());
            return true;
        } catch (Exception e) {
            logger.error("Error sending frame to WebSocket session {}: {}", sessionId, e.getMessage(), e);
            active = false;
            return false;
        }
    }

    void markClosed() {
        active = false;
    }

    public ClientSessionId getSessionId() { return sessionId; }
    public SubscriberIdentity getIdentity() { return identity; }
    public ServerWebSocket getWebSocket() { return webSocket; }

    @Override
    public String toString() {
        return "WebSocketSession{" +
                "sessionId=" + sessionId +
                ", principal='" + identity.principal() + '\'' +
                ", active=" + active +
                '}';
    }
}
