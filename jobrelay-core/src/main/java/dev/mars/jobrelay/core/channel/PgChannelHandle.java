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
package dev.mars.jobrelay.core.channel;

import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.channel.ChannelHandle;
import io.vertx.pgclient.PgConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle over one dedicated PostgreSQL connection in LISTEN mode.
 *
 * Notifications pushed by the server are buffered here until the owning
 * supervisor drains them. A connection failure is recorded and reported
 * after the buffered payloads have been handed out.
 */
final class PgChannelHandle implements ChannelHandle {

    private final ServerId serverId;
    private final PgConnection connection;
    private final Instant openedAt;
    private final Queue<String> pendingPayloads = new ConcurrentLinkedQueue<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean closedLocally = new AtomicBoolean(false);

    PgChannelHandle(ServerId serverId, PgConnection connection, Instant openedAt) {
        this.serverId = serverId;
        this.connection = connection;
        this.openedAt = openedAt;
    }

    @Override
    public ServerId serverId() {
        return serverId;
    }

    @Override
    public Instant openedAt() {
        return openedAt;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    PgConnection connection() {
        return connection;
    }

    void enqueue(String payload) {
        pendingPayloads.add(payload);
    }

    List<String> drain() {
        List<String> drained = new ArrayList<>();
        String payload;
        while ((payload = pendingPayloads.poll()) != null) {
            drained.add(payload);
        }
        return drained;
    }

    /**
     * Records the first failure seen on the connection; later ones are ignored.
     */
    void recordFailure(Throwable error) {
        failure.compareAndSet(null, error);
    }

    Throwable failure() {
        return failure.get();
    }

    void markClosed() {
        closed.set(true);
    }

    /**
     * @return true for the first caller only
     */
    boolean markClosedLocally() {
        closed.set(true);
        return closedLocally.compareAndSet(false, true);
    }

    boolean isClosedLocally() {
        return closedLocally.get();
    }

    @Override
    public String toString() {
        return "PgChannelHandle{server=" + serverId + ", openedAt=" + openedAt + ", closed=" + closed.get() + "}";
    }
}
