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
import dev.mars.jobrelay.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SessionRoomsTest {

    private static final ClientSessionId SESSION_A = ClientSessionId.of("A");
    private static final ClientSessionId SESSION_B = ClientSessionId.of("B");

    @Test
    void joinAndLeaveReportMembershipChanges() {
        SessionRooms rooms = new SessionRooms();

        assertTrue(rooms.join("server_7", SESSION_A));
        assertFalse(rooms.join("server_7", SESSION_A));
        assertTrue(rooms.join("server_7", SESSION_B));
        assertEquals(Set.of(SESSION_A, SESSION_B), rooms.members("server_7"));

        assertTrue(rooms.leave("server_7", SESSION_A));
        assertFalse(rooms.leave("server_7", SESSION_A));
        assertFalse(rooms.leave("server_9", SESSION_A));
        assertEquals(Set.of(SESSION_B), rooms.members("server_7"));
    }

    @Test
    void leaveAllRemovesSessionFromEveryRoom() {
        SessionRooms rooms = new SessionRooms();
        rooms.join("server_7", SESSION_A);
        rooms.join("server_9", SESSION_A);
        rooms.join("server_9", SESSION_B);

        rooms.leaveAll(SESSION_A);

        assertTrue(rooms.members("server_7").isEmpty());
        assertEquals(Set.of(SESSION_B), rooms.members("server_9"));
    }

    @Test
    void membersIsASnapshot() {
        SessionRooms rooms = new SessionRooms();
        rooms.join("server_7", SESSION_A);

        Set<ClientSessionId> snapshot = rooms.members("server_7");
        rooms.join("server_7", SESSION_B);

        assertEquals(Set.of(SESSION_A), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(SESSION_B));
    }
}
