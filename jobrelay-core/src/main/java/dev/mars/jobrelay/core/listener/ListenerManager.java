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

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.api.error.JobRelayError;
import dev.mars.jobrelay.core.config.ListenerConfig;
import dev.mars.jobrelay.core.dispatch.EventDispatcher;
import dev.mars.jobrelay.core.dispatch.OutboundEvents;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the set of running listener supervisors, at most one per server.
 *
 * Starting and stopping for one server are serialised on the server's key.
 * {@link #stop} re-checks the registry under that lock, so a subscribe that
 * lands between "last subscriber left" and the stop keeps the listener alive
 * instead of racing it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ListenerManager {
    private static final Logger logger = LoggerFactory.getLogger(ListenerManager.class);

    private record RunningListener(ListenerSupervisor supervisor, Future<String> deployment) {
    }

    private final Vertx vertx;
    private final SubscriptionRegistry registry;
    private final NotificationChannelClient client;
    private final EventDispatcher dispatcher;
    private final ListenerConfig config;
    private final RelayMetrics metrics;
    private final Map<ServerId, RunningListener> listeners = new ConcurrentHashMap<>();

    public ListenerManager(Vertx vertx,
                           SubscriptionRegistry registry,
                           NotificationChannelClient client,
                           EventDispatcher dispatcher,
                           ListenerConfig config,
                           RelayMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Starts a supervisor for the server unless one is already running.
     *
     * @return future completing once the supervisor is deployed
     */
    public Future<Void> start(ServerId serverId, SubscriberIdentity identity) {
        Promise<String> deployed = Promise.promise();
        ListenerSupervisor[] created = new ListenerSupervisor[1];

        RunningListener running = listeners.compute(serverId, (id, existing) -> {
            if (existing != null) {
                return existing;
            }
            created[0] = new ListenerSupervisor(id, identity, client, dispatcher, registry, config, metrics, this::onTerminated);
            return new RunningListener(created[0], deployed.future());
        });

        if (created[0] == null) {
            logger.debug("Listener for server {} already running", serverId);
            return running.deployment().mapEmpty();
        }

        metrics.listenerStarted();
        vertx.deployVerticle(created[0]).onComplete(deployed);
        return deployed.future()
            .onSuccess(deploymentId -> logger.debug("Deployed listener for server {} as {}", serverId, deploymentId))
            .onFailure(err -> {
                logger.error("Failed to deploy listener for server {}: {}", serverId, err.getMessage(), err);
                if (listeners.remove(serverId, running)) {
                    metrics.listenerStopped();
                }
            })
            .mapEmpty();
    }

    /**
     * Stops the server's supervisor if the server has no subscribers left.
     * Completes once the supervisor has closed its connection.
     */
    public Future<Void> stop(ServerId serverId) {
        RunningListener[] removed = new RunningListener[1];
        listeners.computeIfPresent(serverId, (id, existing) -> {
            if (registry.hasSubscribers(id)) {
                logger.debug("Server {} gained a subscriber before its listener was stopped, keeping it", id);
                return existing;
            }
            removed[0] = existing;
            return null;
        });

        if (removed[0] == null) {
            return Future.succeededFuture();
        }
        metrics.listenerStopped();
        return undeploy(serverId, removed[0]);
    }

    /**
     * Stops every supervisor regardless of subscribers, used at shutdown.
     * Sessions in each server's room are told the listener stopped.
     */
    public Future<Void> stopAll() {
        List<Future<Void>> stopped = new ArrayList<>();
        for (ServerId serverId : Set.copyOf(listeners.keySet())) {
            RunningListener removed = listeners.remove(serverId);
            if (removed != null) {
                metrics.listenerStopped();
                dispatcher.broadcast(serverId, OutboundEvents.listenerStopped(serverId));
                stopped.add(undeploy(serverId, removed));
            }
        }
        return Future.join(stopped).mapEmpty();
    }

    private Future<Void> undeploy(ServerId serverId, RunningListener listener) {
        return listener.deployment()
            .compose(vertx::undeploy)
            .onSuccess(v -> logger.info("Listener for server {} stopped", serverId))
            .onFailure(err -> logger.warn("Failed to undeploy listener for server {}: {}", serverId, err.getMessage()));
    }

    /**
     * Terminal path: drops the server's subscriptions, tells every dropped
     * session why, then tears the supervisor down.
     */
    void onTerminated(ListenerSupervisor supervisor, JobRelayError reason) {
        ServerId serverId = supervisor.getServerId();
        RunningListener[] removed = new RunningListener[1];
        AtomicReference<Set<ClientSessionId>> drained = new AtomicReference<>(Set.of());

        listeners.computeIfPresent(serverId, (id, existing) -> {
            if (existing.supervisor() != supervisor) {
                return existing;
            }
            removed[0] = existing;
            drained.set(registry.drainServer(id));
            return null;
        });

        if (removed[0] == null) {
            logger.debug("Terminated listener for server {} was already replaced", serverId);
            return;
        }
        metrics.listenerStopped();
        dispatcher.dispatchTerminal(serverId, drained.get(), reason);
        drained.get().forEach(sessionId -> dispatcher.leaveServerRoom(serverId, sessionId));
        undeploy(serverId, removed[0]);
    }

    public boolean isRunning(ServerId serverId) {
        return listeners.containsKey(serverId);
    }

    public Optional<ListenerSupervisor> supervisorFor(ServerId serverId) {
        return Optional.ofNullable(listeners.get(serverId)).map(RunningListener::supervisor);
    }

    public int activeCount() {
        return listeners.size();
    }

    public List<ListenerStats> stats() {
        List<ListenerStats> stats = new ArrayList<>();
        for (RunningListener listener : listeners.values()) {
            ListenerSupervisor supervisor = listener.supervisor();
            stats.add(supervisor.stats().withSubscriberCount(registry.sessionsFor(supervisor.getServerId()).size()));
        }
        return stats;
    }
}
