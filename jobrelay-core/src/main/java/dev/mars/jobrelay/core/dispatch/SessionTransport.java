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
import io.vertx.core.json.JsonObject;

/**
 * Outbound side of the real-time transport.
 *
 * Implementations own the client connections; the relay core addresses them
 * by session id, or by room for broadcasts.
 */
public interface SessionTransport {

    /**
     * Sends one frame to a session.
     *
     * @return false if the session is unknown or its connection is already closed
     */
    boolean deliver(ClientSessionId sessionId, JsonObject frame);

    /**
     * Adds the session to a room. Joining twice is a no-op.
     */
    void joinRoom(String room, ClientSessionId sessionId);

    void leaveRoom(String room, ClientSessionId sessionId);

    /**
     * Sends a copy of the frame to every session in the room.
     *
     * @return number of sessions the frame was delivered to
     */
    int broadcast(String room, JsonObject frame);
}
