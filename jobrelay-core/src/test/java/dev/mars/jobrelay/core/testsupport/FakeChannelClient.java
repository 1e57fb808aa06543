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
package dev.mars.jobrelay.core.testsupport;

import dev.mars.jobrelay.api.JobStatus;
import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.channel.ChannelException;
import dev.mars.jobrelay.api.channel.ChannelFailureKind;
import dev.mars.jobrelay.api.channel.ChannelHandle;
import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Scripted in-memory channel client for driving the listener state machine without a database.
 *
 * Every open handle receives every emitted event, which mirrors two real
 * connections listening on the same channel.
 */
public class FakeChannelClient implements NotificationChannelClient {

    public final class FakeHandle implements ChannelHandle {
        private final ServerId serverId;
        private final Instant openedAt;
        private final Queue<JobStatusEvent> queued = new ConcurrentLinkedQueue<>();
        private final AtomicReference<ChannelException> failure = new AtomicReference<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean alive = new AtomicBoolean(true);
        private final AtomicBoolean listening = new AtomicBoolean(true);

        private FakeHandle(ServerId serverId, Instant openedAt) {
            this.serverId = serverId;
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

        public void fail(ChannelFailureKind kind) {
            failure.set(new ChannelException(kind, "scripted " + kind + " failure", null));
        }

        public void setAlive(boolean value) {
            alive.set(value);
        }

        public void setListening(boolean value) {
            listening.set(value);
        }
    }

    private final Map<ServerId, List<FakeHandle>> handles = new ConcurrentHashMap<>();
    private final Map<ServerId, Queue<ChannelException>> scriptedOpenFailures = new ConcurrentHashMap<>();
    private final List<SubscriberIdentity> openIdentities = new CopyOnWriteArrayList<>();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final AtomicInteger relistens = new AtomicInteger();
    private volatile boolean failAllOpens = false;
    private volatile ChannelFailureKind failAllOpensKind = ChannelFailureKind.TRANSIENT_IO;
    private volatile Instant openedAtOverride;
    private final AtomicReference<Consumer<FakeHandle>> nextOpenAction = new AtomicReference<>();

    @Override
    public Future<ChannelHandle> open(ServerId serverId, SubscriberIdentity identity) {
        opens.incrementAndGet();
        openIdentities.add(identity);
        if (failAllOpens) {
            return Future.failedFuture(new ChannelException(failAllOpensKind, "scripted open failure", null));
        }
        Queue<ChannelException> failures = scriptedOpenFailures.get(serverId);
        ChannelException scripted = failures == null ? null : failures.poll();
        if (scripted != null) {
            return Future.failedFuture(scripted);
        }
        Instant openedAt = openedAtOverride != null ? openedAtOverride : Instant.now();
        FakeHandle handle = new FakeHandle(serverId, openedAt);
        handles.computeIfAbsent(serverId, id -> new CopyOnWriteArrayList<>()).add(handle);
        Consumer<FakeHandle> action = nextOpenAction.getAndSet(null);
        if (action != null) {
            action.accept(handle);
        }
        return Future.succeededFuture(handle);
    }

    @Override
    public Future<List<JobStatusEvent>> pollOnce(ChannelHandle channelHandle) {
        FakeHandle handle = (FakeHandle) channelHandle;
        List<JobStatusEvent> drained = new ArrayList<>();
        JobStatusEvent event;
        while ((event = handle.queued.poll()) != null) {
            drained.add(event);
        }
        if (!drained.isEmpty()) {
            return Future.succeededFuture(drained);
        }
        ChannelException failure = handle.failure.get();
        if (failure != null) {
            return Future.failedFuture(failure);
        }
        if (handle.closed.get()) {
            return Future.failedFuture(ChannelException.transientIo("handle closed", null));
        }
        return Future.succeededFuture(List.of());
    }

    @Override
    public Future<Boolean> isAlive(ChannelHandle channelHandle) {
        FakeHandle handle = (FakeHandle) channelHandle;
        return Future.succeededFuture(!handle.closed.get() && handle.alive.get());
    }

    @Override
    public Future<Boolean> isListening(ChannelHandle channelHandle) {
        FakeHandle handle = (FakeHandle) channelHandle;
        return Future.succeededFuture(handle.listening.get());
    }

    @Override
    public Future<Void> relisten(ChannelHandle channelHandle) {
        FakeHandle handle = (FakeHandle) channelHandle;
        relistens.incrementAndGet();
        handle.listening.set(true);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> close(ChannelHandle channelHandle) {
        FakeHandle handle = (FakeHandle) channelHandle;
        if (handle.closed.compareAndSet(false, true)) {
            closes.incrementAndGet();
        }
        return Future.succeededFuture();
    }

    /** Queues an event on every open handle of the server. */
    public void emit(ServerId serverId, long jobId, JobStatus status) {
        String payload = "{\"job_id\":" + jobId + ",\"status\":\"" + status.code() + "\",\"seq\":\"" + System.nanoTime() + "\"}";
        emitPayload(new JobStatusEvent(serverId, jobId, status, status.code(), null, null, Instant.now(), Map.of(), payload));
    }

    public void emitPayload(JobStatusEvent event) {
        for (FakeHandle handle : openHandles(event.serverId())) {
            handle.queued.add(event);
        }
    }

    /**
     * Runs once for the next successfully opened handle, while every earlier
     * handle is still open.
     */
    public void onNextOpen(Consumer<FakeHandle> action) {
        nextOpenAction.set(action);
    }

    public void scriptOpenFailure(ServerId serverId, ChannelFailureKind kind) {
        scriptedOpenFailures.computeIfAbsent(serverId, id -> new ConcurrentLinkedQueue<>())
            .add(new ChannelException(kind, "scripted open " + kind + " failure", null));
    }

    public void failAllOpens(ChannelFailureKind kind) {
        this.failAllOpensKind = kind;
        this.failAllOpens = true;
    }

    public void allowOpens() {
        this.failAllOpens = false;
    }

    /** Makes subsequently opened handles look older than they are. */
    public void openHandlesAt(Instant openedAt) {
        this.openedAtOverride = openedAt;
    }

    public List<FakeHandle> openHandles(ServerId serverId) {
        List<FakeHandle> open = new ArrayList<>();
        for (FakeHandle handle : handles.getOrDefault(serverId, List.of())) {
            if (!handle.isClosed()) {
                open.add(handle);
            }
        }
        return open;
    }

    public FakeHandle currentHandle(ServerId serverId) {
        List<FakeHandle> open = openHandles(serverId);
        return open.isEmpty() ? null : open.get(open.size() - 1);
    }

    public int openedCount(ServerId serverId) {
        return handles.getOrDefault(serverId, List.of()).size();
    }

    public int openCount() {
        return opens.get();
    }

    public int closeCount() {
        return closes.get();
    }

    public int relistenCount() {
        return relistens.get();
    }

    public List<SubscriberIdentity> openIdentities() {
        return List.copyOf(openIdentities);
    }
}
