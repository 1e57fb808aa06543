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

import dev.mars.jobrelay.api.JobStatus;
import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.channel.ChannelException;
import dev.mars.jobrelay.api.channel.ChannelFailureKind;
import dev.mars.jobrelay.api.channel.ChannelHandle;
import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.core.config.DatabaseCredentials;
import dev.mars.jobrelay.core.config.ServerDefinition;
import dev.mars.jobrelay.core.config.ServerDirectory;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import dev.mars.jobrelay.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Tuple;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for PgNotificationChannelClient against a real PostgreSQL server.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(VertxExtension.class)
class PgNotificationChannelClientTest {

    @Container
    @SuppressWarnings("resource")
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15.13-alpine3.20")
            .withDatabaseName("jobrelay_test")
            .withUsername("jobrelay_user")
            .withPassword("jobrelay_pass");

    private static final ServerId SERVER_7 = ServerId.of(7);
    private static final ServerId MISSING_DB = ServerId.of(8);
    private static final SubscriberIdentity ALICE = SubscriberIdentity.of("alice");
    private static final SubscriberIdentity MALLORY = SubscriberIdentity.of("mallory");

    private Vertx vertx;
    private SimpleMeterRegistry meterRegistry;
    private PgNotificationChannelClient client;
    private final List<ChannelHandle> opened = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        DatabaseCredentials valid = new DatabaseCredentials(postgres.getUsername(), postgres.getPassword());
        ServerDirectory directory = new ServerDirectory(List.of(
            new ServerDefinition(SERVER_7, postgres.getHost(), postgres.getFirstMappedPort(), postgres.getDatabaseName(),
                null, Map.of("alice", valid, "mallory", new DatabaseCredentials(postgres.getUsername(), "wrong")), null),
            new ServerDefinition(MISSING_DB, postgres.getHost(), postgres.getFirstMappedPort(), "no_such_database",
                null, Map.of(), valid)));

        meterRegistry = new SimpleMeterRegistry();
        RelayMetrics metrics = new RelayMetrics("test", new SubscriptionRegistry());
        metrics.bindTo(meterRegistry);
        client = new PgNotificationChannelClient(vertx, directory, new JobStatusPayloadParser(), metrics, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        for (ChannelHandle handle : opened) {
            result(client.close(handle));
        }
    }

    private static <T> T result(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private ChannelException failure(Future<?> future) throws Exception {
        ExecutionException error = assertThrows(ExecutionException.class, () -> result(future));
        return assertInstanceOf(ChannelException.class, error.getCause());
    }

    private ChannelHandle open(SubscriberIdentity identity) throws Exception {
        ChannelHandle handle = result(client.open(SERVER_7, identity));
        opened.add(handle);
        return handle;
    }

    private PgConnectOptions adminOptions() {
        return new PgConnectOptions()
            .setHost(postgres.getHost())
            .setPort(postgres.getFirstMappedPort())
            .setDatabase(postgres.getDatabaseName())
            .setUser(postgres.getUsername())
            .setPassword(postgres.getPassword());
    }

    private void runAsAdmin(String sql, Tuple params) throws Exception {
        result(PgConnection.connect(vertx, adminOptions())
            .compose(conn -> conn.preparedQuery(sql).execute(params)
                .eventually(() -> conn.close())));
    }

    private void notify(String payload) throws Exception {
        runAsAdmin("SELECT pg_notify($1, $2)", Tuple.of(NotificationChannelClient.CHANNEL, payload));
    }

    private List<JobStatusEvent> pollUntil(ChannelHandle handle, int expected) {
        List<JobStatusEvent> received = new CopyOnWriteArrayList<>();
        await().atMost(10, TimeUnit.SECONDS).pollInterval(Duration.ofMillis(50)).until(() -> {
            received.addAll(result(client.pollOnce(handle)));
            return received.size() >= expected;
        });
        return received;
    }

    @Test
    @DisplayName("opened handles are listening and receive notifications in order")
    void open_receivesNotifications() throws Exception {
        ChannelHandle handle = open(ALICE);

        assertEquals(SERVER_7, handle.serverId());
        assertNotNull(handle.openedAt());
        assertTrue(result(client.isListening(handle)));
        assertTrue(result(client.isAlive(handle)));

        notify("{\"job_id\":42,\"status\":\"r\"}");
        notify("{\"job_id\":42,\"status\":\"s\",\"end_time\":\"2025-10-14 09:31:05+00\"}");

        List<JobStatusEvent> events = pollUntil(handle, 2);
        assertEquals(JobStatus.RUNNING, events.get(0).status());
        assertEquals(JobStatus.SUCCEEDED, events.get(1).status());
        assertNotNull(events.get(1).endTime());
        assertEquals(2.0, meterRegistry.get("jobrelay.notifications.received").counter().count());
    }

    @Test
    @DisplayName("malformed payloads are skipped and counted")
    void pollOnce_skipsMalformed() throws Exception {
        ChannelHandle handle = open(ALICE);

        notify("not json");
        notify("{\"job_id\":7,\"status\":\"f\"}");

        List<JobStatusEvent> events = pollUntil(handle, 1);
        assertEquals(7L, events.get(0).jobId());
        assertEquals(1.0, meterRegistry.get("jobrelay.notifications.malformed").counter().count());
    }

    @Test
    @DisplayName("wrong passwords and unknown databases are authentication failures")
    void open_authFailures() throws Exception {
        assertEquals(ChannelFailureKind.AUTH, failure(client.open(SERVER_7, MALLORY)).getKind());
        assertEquals(ChannelFailureKind.AUTH, failure(client.open(MISSING_DB, ALICE)).getKind());
        assertEquals(ChannelFailureKind.AUTH, failure(client.open(SERVER_7, SubscriberIdentity.of("nobody"))).getKind());
    }

    @Test
    @DisplayName("relisten keeps the subscription active")
    void relisten_confirms() throws Exception {
        ChannelHandle handle = open(ALICE);

        result(client.relisten(handle));

        assertTrue(result(client.isListening(handle)));
    }

    @Test
    @DisplayName("a terminated backend surfaces as a transient failure")
    void terminatedBackend_isTransient() throws Exception {
        ChannelHandle handle = open(ALICE);

        runAsAdmin("SELECT pg_terminate_backend(pid) FROM pg_stat_activity "
            + "WHERE pid <> pg_backend_pid() AND datname = $1 AND backend_type = 'client backend'",
            Tuple.of(postgres.getDatabaseName()));

        await().atMost(10, TimeUnit.SECONDS).until(handle::isClosed);
        assertFalse(result(client.isAlive(handle)));
        assertEquals(ChannelFailureKind.TRANSIENT_IO, failure(client.pollOnce(handle)).getKind());
    }

    @Test
    @DisplayName("close is idempotent and later polls fail")
    void close_idempotent() throws Exception {
        ChannelHandle handle = open(ALICE);

        result(client.close(handle));
        result(client.close(handle));

        assertTrue(handle.isClosed());
        assertTrue(failure(client.pollOnce(handle)).isRetryable());
    }
}
