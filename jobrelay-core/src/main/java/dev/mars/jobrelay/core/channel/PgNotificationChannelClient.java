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

import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.channel.ChannelException;
import dev.mars.jobrelay.api.channel.ChannelHandle;
import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.api.credentials.ConnectOptionsResolver;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link NotificationChannelClient} backed by the Vert.x reactive PostgreSQL client.
 *
 * Each handle owns a dedicated, non-pooled {@link PgConnection}: LISTEN state is
 * bound to the backend session and is lost if the connection is returned to a
 * pool. Every database round trip is bounded by the configured I/O timeout.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class PgNotificationChannelClient implements NotificationChannelClient {
    private static final Logger logger = LoggerFactory.getLogger(PgNotificationChannelClient.class);

    static final String LISTEN_SQL = "LISTEN \"" + CHANNEL + "\"";
    static final String UNLISTEN_SQL = "UNLISTEN \"" + CHANNEL + "\"";
    static final String LISTENING_CHANNELS_SQL = "SELECT pg_listening_channels() AS channel";
    static final String LIVENESS_SQL = "SELECT 1";

    private final Vertx vertx;
    private final ConnectOptionsResolver resolver;
    private final JobStatusPayloadParser parser;
    private final RelayMetrics metrics;
    private final long ioTimeoutMs;

    public PgNotificationChannelClient(Vertx vertx, ConnectOptionsResolver resolver, JobStatusPayloadParser parser,
                                       RelayMetrics metrics, Duration ioTimeout) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.ioTimeoutMs = Objects.requireNonNull(ioTimeout, "ioTimeout must not be null").toMillis();
        if (ioTimeoutMs <= 0) {
            throw new IllegalArgumentException("ioTimeout must be positive");
        }
    }

    @Override
    public Future<ChannelHandle> open(ServerId serverId, SubscriberIdentity identity) {
        PgConnectOptions options;
        try {
            // Fresh options per attempt, resolved for the explicit identity
            options = resolver.resolve(serverId, identity);
        } catch (RuntimeException e) {
            return Future.failedFuture(ChannelErrorClassifier.toChannelException("Resolve credentials for server " + serverId, e));
        }

        logger.debug("Opening listener connection to server {} ({}:{}/{}) as '{}'",
            serverId, options.getHost(), options.getPort(), options.getDatabase(), identity.principal());

        return withTimeout("Connect to server " + serverId, () -> PgConnection.connect(vertx, options), PgConnection::close)
            .compose(conn -> {
                PgChannelHandle handle = new PgChannelHandle(serverId, conn, Instant.now());
                registerHandlers(handle);
                return listenAndConfirm(handle, true)
                    .<ChannelHandle>map(handle)
                    .recover(err -> {
                        handle.markClosedLocally();
                        conn.close();
                        return Future.failedFuture(err);
                    });
            })
            .onSuccess(handle -> logger.info("Listening on channel '{}' for server {}", CHANNEL, serverId))
            .onFailure(err -> logger.warn("Failed to open listener connection to server {}: {}", serverId, err.getMessage()));
    }

    private void registerHandlers(PgChannelHandle handle) {
        PgConnection conn = handle.connection();
        conn.notificationHandler(notification -> {
            if (CHANNEL.equals(notification.getChannel())) {
                logger.debug("Received notification on channel '{}' from server {}: {}",
                    CHANNEL, handle.serverId(), notification.getPayload());
                handle.enqueue(notification.getPayload());
            }
        });
        conn.closeHandler(v -> {
            handle.markClosed();
            if (!handle.isClosedLocally()) {
                logger.warn("Listener connection to server {} closed unexpectedly", handle.serverId());
                handle.recordFailure(ChannelException.transientIo("Listener connection to server " + handle.serverId() + " closed", null));
            }
        });
        conn.exceptionHandler(err -> {
            if (handle.isClosedLocally()) {
                logger.debug("Listener connection error during close for server {}: {}", handle.serverId(), err.getMessage());
            } else {
                logger.warn("Listener connection error for server {}: {}", handle.serverId(), err.getMessage());
                handle.recordFailure(ChannelErrorClassifier.toChannelException("Listener connection", err));
            }
        });
    }

    /**
     * Issues LISTEN and verifies it server-side. One immediate re-issue is
     * attempted if the channel does not show up; after that the handle is
     * considered broken.
     */
    private Future<Void> listenAndConfirm(PgChannelHandle handle, boolean retry) {
        return query(handle, "LISTEN", LISTEN_SQL)
            .compose(rows -> listening(handle))
            .compose(listening -> {
                if (listening) {
                    return Future.succeededFuture();
                }
                if (retry) {
                    logger.warn("LISTEN on server {} not confirmed by pg_listening_channels, retrying", handle.serverId());
                    return listenAndConfirm(handle, false);
                }
                return Future.failedFuture(ChannelException.protocol(
                    "LISTEN on channel '" + CHANNEL + "' not confirmed for server " + handle.serverId(), null));
            });
    }

    @Override
    public Future<List<JobStatusEvent>> pollOnce(ChannelHandle channelHandle) {
        PgChannelHandle handle = cast(channelHandle);
        List<String> payloads = handle.drain();

        if (payloads.isEmpty()) {
            Throwable failure = handle.failure();
            if (failure != null) {
                return Future.failedFuture(ChannelErrorClassifier.toChannelException("Poll", failure));
            }
            if (handle.isClosed()) {
                return Future.failedFuture(ChannelException.transientIo("Listener connection to server " + handle.serverId() + " is closed", null));
            }
            return Future.succeededFuture(List.of());
        }

        List<JobStatusEvent> events = new ArrayList<>(payloads.size());
        for (String payload : payloads) {
            metrics.recordNotificationReceived();
            parser.parse(handle.serverId(), payload).ifPresentOrElse(events::add, metrics::recordMalformedNotification);
        }
        return Future.succeededFuture(events);
    }

    @Override
    public Future<Boolean> isAlive(ChannelHandle channelHandle) {
        PgChannelHandle handle = cast(channelHandle);
        if (handle.isClosed() || handle.failure() != null) {
            return Future.succeededFuture(false);
        }
        return query(handle, "Liveness check", LIVENESS_SQL)
            .map(rows -> true)
            .otherwise(err -> {
                logger.debug("Liveness check failed for server {}: {}", handle.serverId(), err.getMessage());
                return false;
            });
    }

    @Override
    public Future<Boolean> isListening(ChannelHandle channelHandle) {
        PgChannelHandle handle = cast(channelHandle);
        if (handle.isClosed()) {
            return Future.failedFuture(ChannelException.transientIo("Listener connection to server " + handle.serverId() + " is closed", null));
        }
        return listening(handle);
    }

    private Future<Boolean> listening(PgChannelHandle handle) {
        return query(handle, "Subscription check", LISTENING_CHANNELS_SQL)
            .map(rows -> {
                for (Row row : rows) {
                    if (CHANNEL.equals(row.getString("channel"))) {
                        return true;
                    }
                }
                return false;
            });
    }

    @Override
    public Future<Void> relisten(ChannelHandle channelHandle) {
        PgChannelHandle handle = cast(channelHandle);
        logger.info("Re-issuing LISTEN on channel '{}' for server {}", CHANNEL, handle.serverId());
        return listenAndConfirm(handle, false);
    }

    @Override
    public Future<Void> close(ChannelHandle channelHandle) {
        PgChannelHandle handle = cast(channelHandle);
        if (!handle.markClosedLocally()) {
            return Future.succeededFuture();
        }

        PgConnection conn = handle.connection();
        conn.closeHandler(null);
        Promise<Void> promise = Promise.promise();
        withTimeout("UNLISTEN", () -> conn.query(UNLISTEN_SQL).execute(), rows -> { })
            .onComplete(ar -> {
                if (ar.failed()) {
                    logger.debug("Error during UNLISTEN for server {}: {}", handle.serverId(), ar.cause().getMessage());
                }
                conn.close().onComplete(closed -> {
                    logger.debug("Closed listener connection to server {}", handle.serverId());
                    promise.complete();
                });
            });
        return promise.future();
    }

    private Future<RowSet<Row>> query(PgChannelHandle handle, String operation, String sql) {
        return withTimeout(operation + " on server " + handle.serverId(), () -> handle.connection().query(sql).execute(), rows -> { });
    }

    /**
     * Runs an operation bounded by the I/O timeout. Failures are converted into
     * {@link ChannelException}s; a result that arrives after the timeout is passed
     * to {@code lateResult} so it can be released.
     */
    private <T> Future<T> withTimeout(String operation, Supplier<Future<T>> action, Consumer<T> lateResult) {
        Promise<T> promise = Promise.promise();
        long timerId = vertx.setTimer(ioTimeoutMs, id -> promise.tryFail(
            ChannelException.transientIo(operation + " timed out after " + ioTimeoutMs + " ms", null)));

        Future<T> started;
        try {
            started = action.get();
        } catch (RuntimeException e) {
            started = Future.failedFuture(e);
        }

        started.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                if (!promise.tryComplete(ar.result())) {
                    lateResult.accept(ar.result());
                }
            } else {
                promise.tryFail(ChannelErrorClassifier.toChannelException(operation, ar.cause()));
            }
        });
        return promise.future();
    }

    private static PgChannelHandle cast(ChannelHandle handle) {
        if (handle instanceof PgChannelHandle pgHandle) {
            return pgHandle;
        }
        throw new IllegalArgumentException("Handle was not opened by this client: " + handle);
    }
}
