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
import dev.mars.jobrelay.core.dispatch.SessionRooms;
import dev.mars.jobrelay.core.dispatch.SessionTransport;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open WebSocket sessions, addressed by session id or by room. Frames for
 * sessions that have already gone are reported as undeliverable, and a
 * removed session leaves every room it was in.
 */
public class WebSocketSessions implements SessionTransport {

    private final Map<ClientSessionId, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final SessionRooms rooms = new SessionRooms();

    void register(WebSocketSession session) {
        sessions.put(session.getSessionId(), session);
    }

    void remove(ClientSessionId sessionId) {
        WebSocketSession removed = sessions.remove(sessionId);
        rooms.leaveAll(sessionId);
        if (removed != null) {
            removed.markClosed();
        }
    }

    @Override
    public boolean deliver(ClientSessionId sessionId, JsonObject frame) {
        WebSocketSession session = sessions.get(sessionId);
        return session != null && session.send(frame);
    }

    @Override
    public void joinRoom(String room, ClientSessionId sessionId) {
        // a session that closed while subscribing is not re-added
        if (sessions.containsKey(sessionId)) {
            rooms.join(room, sessionId);
        }
    }

    @Override
    public void leaveRoom(String room, ClientSessionId sessionId) {
        rooms.leave(room, sessionId);
    }

    @Override
    public int broadcast(String room, JsonObject frame) {
        int delivered = 0;
        for (ClientSessionId sessionId : rooms.members(room)) {
            if (deliver(sessionId, frame.copy())) {
                delivered++;
            }
        }
        return delivered;
    }

    public int count() {
        return sessions.size();
    }

    /**
     * Closes every open socket, used at shutdown.
     */
    public void closeAll() {
        for (WebSocketSession session : sessions.values()) {
            if (session.isOpen()) {
                session.getWebSocket().close();
            }
        }
    }
}
