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
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Builders for the JSON frames sent to client sessions.
 * Every frame carries a {@code type} and an epoch-millis {@code timestamp}.
 */
public final class OutboundEvents {

    public static final String CONNECTED = "connected";
    public static final String LISTENER_STARTED = "listener_started";
    public static final String LISTENER_STOPPED = "listener_stopped";
    public static final String LISTENER_ERROR = "listener_error";
    public static final String JOB_STATUS_UPDATE = "job_status_update";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    private OutboundEvents() {
        // Utility class - no instantiation
    }

    private static JsonObject frame(String type) {
        return new JsonObject()
            .put("type", type)
            .put("timestamp", System.currentTimeMillis());
    }

    public static JsonObject connected(ClientSessionId sessionId) {
        return frame(CONNECTED).put("sessionId", sessionId.value());
    }

    public static JsonObject listenerStarted(ServerId serverId, ClientSessionId sessionId, Instant startedAt) {
        return frame(LISTENER_STARTED)
            .put("serverId", serverId.value())
            .put("listenerInfo", new JsonObject()
                .put("sessionId", sessionId.value())
                .put("startedAt", startedAt.toString()));
    }

    public static JsonObject listenerStopped(ServerId serverId) {
        return frame(LISTENER_STOPPED).put("serverId", serverId.value());
    }

    public static JsonObject listenerError(ServerId serverId, JobRelayError error) {
        return frame(LISTENER_ERROR)
            .put("serverId", serverId == null ? null : serverId.value())
            .put("code", error.code())
            .put("message", error.message())
            .put("terminal", error.terminal());
    }

    public static JsonObject jobStatusUpdate(JobStatusEvent event) {
        return frame(JOB_STATUS_UPDATE)
            .put("serverId", event.serverId().value())
            .put("jobId", event.jobId())
            .put("status", event.status().wireName())
            .put("statusCode", event.rawStatus())
            .put("startTime", format(event.startTime()))
            .put("endTime", format(event.endTime()))
            .put("eventTime", format(event.eventTime()))
            .put("details", new JsonObject(new LinkedHashMap<>(event.details())));
    }

    public static JsonObject pong(Object id) {
        return frame(PONG).put("id", id);
    }

    public static JsonObject error(JobRelayError error) {
        return frame(ERROR)
            .put("code", error.code())
            .put("message", error.message());
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
