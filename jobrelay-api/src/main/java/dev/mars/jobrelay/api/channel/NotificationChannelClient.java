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
package dev.mars.jobrelay.api.channel;

import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import io.vertx.core.Future;

import java.util.List;

/**
 * Client for the job status notification channel of one database server.
 *
 * Every operation completes within a bounded time; failed futures always carry
 * a {@link ChannelException}. Implementations must tolerate being called from
 * the event loop of the supervisor that owns the handle and must never block it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public interface NotificationChannelClient {

    /** Channel the scheduler publishes job status changes on. */
    String CHANNEL = "job_status_update";

    /**
     * Opens a dedicated connection authenticated as {@code identity}, subscribes to
     * {@link #CHANNEL} and confirms server-side that the subscription is active.
     *
     * @param serverId The server to connect to
     * @param identity The subscribing identity whose credentials are resolved for this attempt
     * @return The listening handle
     */
    Future<ChannelHandle> open(ServerId serverId, SubscriberIdentity identity);

    /**
     * Drains every notification currently queued on the handle.
     * Buffered notifications are returned even if the connection has since failed;
     * the failure is reported by the following call.
     *
     * @param handle The handle to drain
     * @return Decoded events in arrival order, possibly empty
     */
    Future<List<JobStatusEvent>> pollOnce(ChannelHandle handle);

    /**
     * Issues a trivial round trip.
     *
     * @return true only if the socket is open and the backend answered
     */
    Future<Boolean> isAlive(ChannelHandle handle);

    /**
     * Checks server-side that {@link #CHANNEL} is still registered for the handle's session.
     */
    Future<Boolean> isListening(ChannelHandle handle);

    /**
     * Re-issues the subscribe command in place and confirms it.
     */
    Future<Void> relisten(ChannelHandle handle);

    /**
     * Unsubscribes (best effort) and releases the connection. Never fails.
     */
    Future<Void> close(ChannelHandle handle);
}
