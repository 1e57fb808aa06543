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
package dev.mars.jobrelay.core.listener;

import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.channel.ChannelException;
import dev.mars.jobrelay.api.channel.ChannelFailureKind;
import dev.mars.jobrelay.api.channel.ChannelHandle;
import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.core.channel.ChannelErrorClassifier;
import dev.mars.jobrelay.core.config.ListenerConfig;
import dev.mars.jobrelay.core.dispatch.EventDispatcher;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Keeps one server's job status listener alive and feeds its events to the dispatcher.
 *
 * Each supervisor is deployed as its own verticle, so every server gets an
 * independent event loop context and all work on the channel handle runs
 * sequentially on that context. A single periodic tick drives the poll loop
 * and, when due, exactly one maintenance task: forced rotation, subscription
 * health check or keepalive round trip. A {@code busy} flag keeps a slow
 * round trip from overlapping the next tick.
 *
 * Failure handling:
 * - authentication failures give up immediately;
 * - any other failure closes the handle and reopens it after an exponential
 *   backoff, unless more than {@code maxConsecutiveFailures} failures have
 *   happened in a row, in which case the supervisor gives up.
 * Giving up is reported once through the {@link ListenerTerminationHandler}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ListenerSupervisor extends AbstractVerticle {
    private static final Logger logger = LoggerFactory.getLogger(ListenerSupervisor.class);

    private final ServerId serverId;
    private final SubscriberIdentity initialIdentity;
    private final NotificationChannelClient client;
    private final EventDispatcher dispatcher;
    private final SubscriptionRegistry registry;
    private final ListenerConfig config;
    private final RelayMetrics metrics;
    private final ListenerTerminationHandler terminationHandler;
    private final IntervalFunction backoff;
    private final RotationOverlap rotationOverlap;

    // Only mutated on this verticle's context; volatile for status readers
    private volatile ListenerState state = ListenerState.STARTING;
    private volatile ChannelHandle handle;
    private ChannelHandle retiringHandle;
    private volatile int consecutiveFailures = 0;
    private volatile Instant lastSuccessfulPoll;
    private volatile Instant lastRotation;
    private Instant lastRoundTrip;
    private Instant lastHealthCheck;
    private Instant lastRotationAttempt;

    private boolean busy = false;
    private boolean stopping = false;
    private long tickTimerId = -1;
    private long reconnectTimerId = -1;
    private Future<ChannelHandle> pendingOpen;

    public ListenerSupervisor(ServerId serverId,
                              SubscriberIdentity initialIdentity,
                              NotificationChannelClient client,
                              EventDispatcher dispatcher,
                              SubscriptionRegistry registry,
                              ListenerConfig config,
                              RelayMetrics metrics,
                              ListenerTerminationHandler terminationHandler) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
        this.initialIdentity = Objects.requireNonNull(initialIdentity, "initialIdentity must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.terminationHandler = Objects.requireNonNull(terminationHandler, "terminationHandler must not be null");
        this.backoff = config.backoff();
        this.rotationOverlap = new RotationOverlap(config.getDedupWindowSize());
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting job status listener for server {}", serverId);
        tickTimerId = vertx.setPeriodic(config.getPollInterval().toMillis(), id -> tick());
        // A failed first open goes through the normal retry path, so deployment always succeeds
        openHandle();
        startPromise.complete();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        stopping = true;
        cancelTimers();
        ListenerState previous = state;
        state = ListenerState.STOPPED;

        ChannelHandle current = handle;
        handle = null;
        Future<Void> closeCurrent = current != null ? client.close(current) : Future.<Void>succeededFuture();
        ChannelHandle retiring = retiringHandle;
        retiringHandle = null;
        Future<Void> closeRetiring = retiring != null ? client.close(retiring) : Future.<Void>succeededFuture();
        Future<ChannelHandle> opening = pendingOpen;
        pendingOpen = null;
        Future<Void> closePending = opening != null
            ? opening.<Void>transform(ar -> ar.succeeded() && ar.result() != current
                ? client.close(ar.result())
                : Future.<Void>succeededFuture())
            : Future.<Void>succeededFuture();

        Future.all(closeCurrent, closeRetiring, closePending).onComplete(ar -> {
            logger.info("Stopped job status listener for server {} (was {})", serverId, previous);
            stopPromise.complete();
        });
    }

    private void openHandle() {
        SubscriberIdentity identity = currentIdentity();
        logger.debug("Opening listener handle for server {} as '{}'", serverId, identity.principal());

        Future<ChannelHandle> opening = client.open(serverId, identity);
        pendingOpen = opening;
        onContext(opening).onComplete(ar -> {
            if (pendingOpen == opening) {
                pendingOpen = null;
            }
            if (stopping) {
                // stop() closes whatever this attempt produced
                return;
            }
            if (!state.isRunning()) {
                if (ar.succeeded()) {
                    client.close(ar.result());
                }
                return;
            }
            if (ar.succeeded()) {
                ChannelHandle opened = ar.result();
                boolean recovered = state == ListenerState.RECOVERING;
                Instant now = Instant.now();
                handle = opened;
                lastRoundTrip = now;
                lastHealthCheck = now;
                lastRotationAttempt = now;
                state = ListenerState.LISTENING;
                if (recovered) {
                    logger.info("Job status listener for server {} recovered after {} failure(s)", serverId, consecutiveFailures);
                } else {
                    logger.info("Job status listener for server {} is listening", serverId);
                }
            } else {
                handleFailure(ar.cause(), null);
            }
        });
    }

    /**
     * Identity of the longest-standing subscriber, falling back to the one that started the listener.
     */
    private SubscriberIdentity currentIdentity() {
        return registry.identityFor(serverId).orElse(initialIdentity);
    }

    private void tick() {
        if (stopping || busy || state != ListenerState.LISTENING) {
            return;
        }
        ChannelHandle polled = handle;
        if (polled == null) {
            return;
        }
        busy = true;
        onContext(client.pollOnce(polled)).onComplete(ar -> {
            if (stopping || polled != handle) {
                busy = false;
                return;
            }
            if (ar.failed()) {
                busy = false;
                handleFailure(ar.cause(), polled);
                return;
            }

            List<JobStatusEvent> events = ar.result();
            Instant now = Instant.now();
            lastSuccessfulPoll = now;
            consecutiveFailures = 0;
            if (!events.isEmpty()) {
                lastRoundTrip = now;
                deliver(events);
            }
            runMaintenance(polled).onComplete(done -> busy = false);
        });
    }

    private void deliver(List<JobStatusEvent> events) {
        Instant now = Instant.now();
        for (JobStatusEvent event : events) {
            if (rotationOverlap.consume(event.rawPayload(), now)) {
                metrics.recordDuplicateSuppressed();
                logger.debug("Suppressed notification for job {} on server {} already drained from the rotated connection",
                    event.jobId(), serverId);
            } else {
                dispatcher.dispatch(serverId, event);
            }
        }
    }

    private Future<Void> runMaintenance(ChannelHandle current) {
        Instant now = Instant.now();
        if (isDue(current.openedAt(), config.getMaxConnectionAge(), now)
                && isDue(lastRotationAttempt, config.getHealthCheckInterval(), now)) {
            return rotate(current);
        }
        if (isDue(lastHealthCheck, config.getHealthCheckInterval(), now)) {
            return healthCheck(current);
        }
        if (isDue(lastRoundTrip, config.getKeepaliveInterval(), now)) {
            return keepalive(current);
        }
        return Future.succeededFuture();
    }

    private static boolean isDue(Instant last, Duration interval, Instant now) {
        return last == null || Duration.between(last, now).compareTo(interval) >= 0;
    }

    private Future<Void> keepalive(ChannelHandle current) {
        logger.debug("Keepalive round trip for server {}", serverId);
        return onContext(client.isAlive(current)).compose(alive -> {
            if (stopping || current != handle) {
                return Future.succeededFuture();
            }
            if (alive) {
                lastRoundTrip = Instant.now();
            } else {
                handleFailure(ChannelException.transientIo("Keepalive round trip to server " + serverId + " failed", null), current);
            }
            return Future.succeededFuture();
        }, err -> {
            handleFailure(err, current);
            return Future.succeededFuture();
        });
    }

    private Future<Void> healthCheck(ChannelHandle current) {
        lastHealthCheck = Instant.now();
        logger.debug("Checking LISTEN registration for server {}", serverId);
        return onContext(client.isListening(current)).compose(listening -> {
            if (stopping || current != handle) {
                return Future.succeededFuture();
            }
            if (listening) {
                lastRoundTrip = Instant.now();
                return Future.succeededFuture();
            }
            logger.warn("Channel subscription for server {} was dropped server-side, re-issuing LISTEN", serverId);
            return onContext(client.relisten(current)).<Void>transform(ar -> {
                if (ar.succeeded()) {
                    lastRoundTrip = Instant.now();
                    logger.info("Re-established channel subscription for server {}", serverId);
                } else {
                    handleFailure(ar.cause(), current);
                }
                return Future.succeededFuture();
            });
        }, err -> {
            handleFailure(err, current);
            return Future.succeededFuture();
        });
    }

    /**
     * Replaces the connection with a fresh one. The replacement is opened and
     * confirmed before the old handle is drained and closed; if it cannot be
     * opened the old handle stays in use.
     */
    private Future<Void> rotate(ChannelHandle current) {
        lastRotationAttempt = Instant.now();
        logger.info("Rotating listener connection for server {} (age {} ms)",
            serverId, Duration.between(current.openedAt(), Instant.now()).toMillis());

        Future<ChannelHandle> opening = client.open(serverId, currentIdentity());
        pendingOpen = opening;
        return onContext(opening).<Void>transform(ar -> {
            if (pendingOpen == opening) {
                pendingOpen = null;
            }
            if (stopping || current != handle) {
                return Future.succeededFuture();
            }
            if (ar.failed()) {
                ChannelException error = ChannelErrorClassifier.toChannelException("Rotation", ar.cause());
                if (error.getKind() == ChannelFailureKind.AUTH) {
                    handleFailure(error, current);
                } else {
                    logger.warn("Could not open replacement connection for server {}, keeping current one: {}",
                        serverId, error.getMessage());
                }
                return Future.succeededFuture();
            }

            ChannelHandle replacement = ar.result();
            Instant now = Instant.now();
            handle = replacement;
            retiringHandle = current;
            lastRoundTrip = now;
            lastHealthCheck = now;
            lastRotation = now;
            metrics.recordRotation();

            return onContext(client.pollOnce(current))
                .<Void>transform(drained -> {
                    if (drained.succeeded()) {
                        List<JobStatusEvent> events = drained.result();
                        events.forEach(event -> dispatcher.dispatch(serverId, event));
                        // the replacement may have received the same notifications
                        rotationOverlap.begin(events, Instant.now().plus(overlapWindow()));
                    } else {
                        logger.debug("Could not drain rotated connection for server {}: {}", serverId, drained.cause().getMessage());
                    }
                    if (retiringHandle == current) {
                        retiringHandle = null;
                    }
                    return client.close(current);
                })
                .onComplete(closed -> logger.info("Listener connection for server {} rotated", serverId));
        });
    }

    private Duration overlapWindow() {
        return config.getIoTimeout().plus(config.getPollInterval().multipliedBy(2));
    }

    private void handleFailure(Throwable cause, ChannelHandle failedHandle) {
        if (stopping || !state.isRunning() || failedHandle != handle) {
            return;
        }
        ChannelException error = ChannelErrorClassifier.toChannelException("Listener for server " + serverId, cause);

        if (error.getKind() == ChannelFailureKind.AUTH) {
            logger.error("Authentication failed for job status listener on server {}: {}", serverId, error.getMessage());
            giveUp(JobRelayError.authenticationFailed(serverId, error.getMessage()));
            return;
        }

        consecutiveFailures++;
        if (consecutiveFailures > config.getMaxConsecutiveFailures()) {
            logger.error("Job status listener for server {} exceeded {} consecutive failures, giving up: {}",
                serverId, config.getMaxConsecutiveFailures(), error.getMessage());
            giveUp(JobRelayError.listenerExhausted(serverId, consecutiveFailures, error.getMessage()));
            return;
        }

        state = ListenerState.RECOVERING;
        rotationOverlap.clear();
        ChannelHandle broken = handle;
        handle = null;
        if (broken != null) {
            client.close(broken);
        }

        long delay = backoff.apply(consecutiveFailures);
        logger.warn("Job status listener for server {} failed ({}, attempt {}/{}), reconnecting in {} ms: {}",
            serverId, error.getKind(), consecutiveFailures, config.getMaxConsecutiveFailures(), delay, error.getMessage());
        metrics.recordReconnect();
        reconnectTimerId = vertx.setTimer(delay, id -> {
            reconnectTimerId = -1;
            if (!stopping && state == ListenerState.RECOVERING) {
                openHandle();
            }
        });
    }

    private void giveUp(JobRelayError reason) {
        state = ListenerState.FAILED;
        cancelTimers();
        ChannelHandle broken = handle;
        handle = null;
        if (broken != null) {
            client.close(broken);
        }
        metrics.recordTerminalFailure();
        terminationHandler.onTerminated(this, reason);
    }

    private void cancelTimers() {
        if (tickTimerId != -1) {
            vertx.cancelTimer(tickTimerId);
            tickTimerId = -1;
        }
        if (reconnectTimerId != -1) {
            vertx.cancelTimer(reconnectTimerId);
            reconnectTimerId = -1;
        }
    }

    /**
     * Completes the returned future on this verticle's context, whatever thread completed the source.
     */
    private <T> Future<T> onContext(Future<T> source) {
        Promise<T> promise = Promise.promise();
        source.onComplete(ar -> {
            if (Vertx.currentContext() == context) {
                promise.handle(ar);
            } else {
                context.runOnContext(v -> promise.handle(ar));
            }
        });
        return promise.future();
    }

    public ServerId getServerId() {
        return serverId;
    }

    public ListenerState getState() {
        return state;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public ListenerStats stats() {
        ChannelHandle current = handle;
        long ageMs = current == null ? 0 : Duration.between(current.openedAt(), Instant.now()).toMillis();
        return new ListenerStats(serverId, state, consecutiveFailures, ageMs, lastSuccessfulPoll, lastRotation, 0);
    }

    @Override
    public String toString() {
        return "ListenerSupervisor{server=" + serverId + ", state=" + state + ", failures=" + consecutiveFailures + "}";
    }
}
