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

import dev.mars.jobrelay.api.JobStatus;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.error.JobRelayErrorCodes;
import dev.mars.jobrelay.core.config.DatabaseCredentials;
import dev.mars.jobrelay.core.config.ListenerConfig;
import dev.mars.jobrelay.core.config.ServerDefinition;
import dev.mars.jobrelay.core.config.ServerDirectory;
import dev.mars.jobrelay.core.testsupport.FakeChannelClient;
import dev.mars.jobrelay.rest.JobRelayServer;
import dev.mars.jobrelay.rest.config.RelayServerConfig;
import dev.mars.jobrelay.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the job status WebSocket and the status endpoints.
 * Runs the real server verticle against a scripted channel client.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class JobStatusWebSocketHandlerTest {

    private static final Logger logger = LoggerFactory.getLogger(JobStatusWebSocketHandlerTest.class);
    private static final ServerId SERVER_7 = ServerId.of(7);

    private Vertx vertx;
    private FakeChannelClient client;
    private JobRelayServer server;
    private String deploymentId;
    private WebClient webClient;
    private WebSocketClient wsClient;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        this.vertx = vertx;
        client = new FakeChannelClient();
        ServerDirectory directory = new ServerDirectory(List.of(
            new ServerDefinition(SERVER_7, "localhost", 5432, "postgres", null, Map.of(),
                new DatabaseCredentials("relay", "secret"))));
        ListenerConfig listener = ListenerConfig.builder()
            .pollInterval(Duration.ofMillis(20))
            .initialBackoff(Duration.ofMillis(20))
            .maxBackoff(Duration.ofMillis(100))
            .build();
        RelayServerConfig config = new RelayServerConfig(0, List.of("*"), listener, directory);

        server = new JobRelayServer(config, new SimpleMeterRegistry(), metrics -> client);
        deploymentId = result(vertx.deployVerticle(server));
        webClient = WebClient.create(vertx);
        wsClient = vertx.createWebSocketClient();
        logger.info("Job relay server deployed on port {}", server.actualPort());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (wsClient != null) {
            result(wsClient.close());
        }
        if (webClient != null) {
            webClient.close();
        }
        if (deploymentId != null) {
            result(vertx.undeploy(deploymentId));
        }
    }

    @Test
    @DisplayName("New sessions receive a connected frame")
    void testConnected() throws Exception {
        Connection connection = connect("alice");

        JsonObject connected = connection.next("connected");
        assertTrue(connected.getString("sessionId").startsWith("ws-"));
        assertNotNull(connected.getLong("timestamp"));
    }

    @Test
    @DisplayName("Ping is answered with a pong echoing the id")
    void testPingPong() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");

        connection.send(new JsonObject().put("type", "ping").put("id", "p-1"));

        assertEquals("p-1", connection.next("pong").getString("id"));
    }

    @Test
    @DisplayName("Subscribed sessions receive job status updates")
    void testSubscribeReceivesUpdates() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");

        connection.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        JsonObject started = connection.next("listener_started");
        assertEquals("7", started.getString("serverId"));
        assertNotNull(started.getJsonObject("listenerInfo").getString("startedAt"));

        client.emit(SERVER_7, 42, JobStatus.SUCCEEDED);

        JsonObject update = connection.next("job_status_update");
        assertEquals("7", update.getString("serverId"));
        assertEquals(42L, update.getLong("jobId"));
        assertEquals("succeeded", update.getString("status"));
        assertEquals("s", update.getString("statusCode"));
    }

    @Test
    @DisplayName("Unsubscribe stops the listener of the last subscriber")
    void testUnsubscribe() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");
        connection.send(new JsonObject().put("type", "subscribe").put("serverId", "7"));
        connection.next("listener_started");

        connection.send(new JsonObject().put("type", "unsubscribe").put("serverId", "7"));

        assertEquals("7", connection.next("listener_stopped").getString("serverId"));
        assertFalse(server.relay().listenerManager().isRunning(SERVER_7));
        assertEquals(1, client.closeCount());
    }

    @Test
    @DisplayName("Subscribing to an unknown server reports SERVER_NOT_FOUND")
    void testUnknownServer() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");

        connection.send(new JsonObject().put("type", "subscribe").put("serverId", 99));

        JsonObject error = connection.next("listener_error");
        assertEquals(JobRelayErrorCodes.SERVER_NOT_FOUND, error.getString("code"));
        assertEquals("99", error.getString("serverId"));
        assertFalse(error.getBoolean("terminal"));
        assertEquals(0, client.openCount());
    }

    @Test
    @DisplayName("Malformed and unknown frames are answered with error frames")
    void testInvalidFrames() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");

        connection.sendRaw("{not json");
        assertEquals(JobRelayErrorCodes.INVALID_REQUEST, connection.next("error").getString("code"));

        connection.send(new JsonObject().put("serverId", 7));
        assertEquals(JobRelayErrorCodes.INVALID_REQUEST, connection.next("error").getString("code"));

        connection.send(new JsonObject().put("type", "dance"));
        JsonObject unknown = connection.next("error");
        assertEquals(JobRelayErrorCodes.UNKNOWN_MESSAGE_TYPE, unknown.getString("code"));
        assertTrue(unknown.getString("message").contains("dance"));
    }

    @Test
    @DisplayName("Closing the socket drops its subscriptions and stops the listener")
    void testCloseStopsListener() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");
        connection.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        connection.next("listener_started");
        assertTrue(server.relay().listenerManager().isRunning(SERVER_7));

        result(connection.socket.close());

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertFalse(server.relay().listenerManager().isRunning(SERVER_7));
            assertEquals(0, server.relay().registry().subscriptionCount());
            assertEquals(1, client.closeCount());
        });
    }

    @Test
    @DisplayName("Two sessions share one listener")
    void testSharedListener() throws Exception {
        Connection first = connect("alice");
        Connection second = connect("bob");
        first.next("connected");
        second.next("connected");

        first.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        first.next("listener_started");
        second.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        second.next("listener_started");
        assertEquals(1, client.openCount());

        client.emit(SERVER_7, 5, JobStatus.RUNNING);

        assertEquals(5L, first.next("job_status_update").getLong("jobId"));
        assertEquals(5L, second.next("job_status_update").getLong("jobId"));
    }

    @Test
    @DisplayName("Stopping the server tells subscribed sessions their listener stopped")
    void testShutdownBroadcastsListenerStopped() throws Exception {
        Connection subscribed = connect("alice");
        Connection idle = connect("bob");
        subscribed.next("connected");
        idle.next("connected");
        subscribed.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        subscribed.next("listener_started");

        result(vertx.undeploy(deploymentId));
        deploymentId = null;

        assertEquals("7", subscribed.next("listener_stopped").getString("serverId"));
        assertTrue(idle.frames.stream().noneMatch(frame -> "listener_stopped".equals(frame.getString("type"))));
        assertTrue(client.openHandles(SERVER_7).isEmpty());
    }

    @Test
    @DisplayName("GET /health reports listeners, sessions and subscriptions")
    void testHealth() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");
        connection.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        connection.next("listener_started");

        HttpResponse<?> response = result(webClient.get(server.actualPort(), "localhost", "/health").send());

        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals("UP", body.getString("status"));
        assertEquals(1, body.getInteger("listeners"));
        assertEquals(1, body.getInteger("sessions"));
        assertEquals(1, body.getInteger("subscriptions"));
    }

    @Test
    @DisplayName("Listener endpoints report running listeners and 404 otherwise")
    void testListenerEndpoints() throws Exception {
        Connection connection = connect("alice");
        connection.next("connected");
        connection.send(new JsonObject().put("type", "subscribe").put("serverId", 7));
        connection.next("listener_started");

        HttpResponse<?> list = result(webClient.get(server.actualPort(), "localhost", "/api/v1/listeners").send());
        assertEquals(200, list.statusCode());
        assertEquals(1, list.bodyAsJsonObject().getInteger("count"));
        assertEquals("7", list.bodyAsJsonObject().getJsonArray("listeners").getJsonObject(0).getString("serverId"));

        HttpResponse<?> one = result(webClient.get(server.actualPort(), "localhost", "/api/v1/listeners/7").send());
        assertEquals(200, one.statusCode());
        assertEquals(1, one.bodyAsJsonObject().getInteger("subscriberCount"));

        HttpResponse<?> missing = result(webClient.get(server.actualPort(), "localhost", "/api/v1/listeners/99").send());
        assertEquals(404, missing.statusCode());
        assertEquals(JobRelayErrorCodes.SERVER_NOT_FOUND, missing.bodyAsJsonObject().getString("code"));
    }

    private Connection connect(String principal) throws Exception {
        WebSocketConnectOptions options = new WebSocketConnectOptions()
            .setPort(server.actualPort())
            .setHost("localhost")
            .setURI(JobStatusWebSocketHandler.PATH + "?principal=" + principal);
        BlockingQueue<JsonObject> frames = new LinkedBlockingQueue<>();
        WebSocket socket = result(wsClient.connect(options)
            .onSuccess(ws -> ws.textMessageHandler(message -> frames.add(new JsonObject(message)))));
        return new Connection(socket, frames);
    }

    private static <T> T result(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static final class Connection {
        private final WebSocket socket;
        private final BlockingQueue<JsonObject> frames;

        Connection(WebSocket socket, BlockingQueue<JsonObject> frames) {
            this.socket = socket;
            this.frames = frames;
        }

        void send(JsonObject frame) throws Exception {
            sendRaw(frame.encode());
        }

        void sendRaw(String text) throws Exception {
            result(socket.writeTextMessage(text));
        }

        /** Next frame of the given type, skipping frames of other types. */
        JsonObject next(String type) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                JsonObject frame = frames.poll(100, TimeUnit.MILLISECONDS);
                if (frame != null && type.equals(frame.getString("type"))) {
                    return frame;
                }
            }
            return fail("No '" + type + "' frame received");
        }
    }
}
