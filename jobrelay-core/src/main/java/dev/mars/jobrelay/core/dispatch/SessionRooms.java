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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named groups of sessions for room-addressed broadcasts.
 * Empty rooms are dropped.
 */
public class SessionRooms {

    private final Map<String, Set<ClientSessionId>> members = new ConcurrentHashMap<>();

    /**
     * @return true if the session was not already in the room
     */
    public boolean join(String room, ClientSessionId sessionId) {
        boolean[] added = new boolean[1];
        members.compute(room, (name, sessions) -> {
            Set<ClientSessionId> next = sessions != null ? sessions : ConcurrentHashMap.newKeySet();
            added[0] = next.add(sessionId);
            return next;
        });
        return added[0];
    }

    /**
     * @return true if the session was in the room
     */
    public boolean leave(String room, ClientSessionId sessionId) {
        boolean[] removed = new boolean[1];
        members.computeIfPresent(room, (name, sessions) -> {
            removed[0] = sessions.remove(sessionId);
            return sessions.isEmpty() ? null : sessions;
        });
        return removed[0];
    }

    public void leaveAll(ClientSessionId sessionId) {
        for (String room : Set.copyOf(members.keySet())) {
            leave(room, sessionId);
        }
    }

    public Set<ClientSessionId> members(String room) {
        Set<ClientSessionId> sessions = members.get(room);
        return sessions == null ? Set.of() : Set.copyOf(sessions);
    }
}
