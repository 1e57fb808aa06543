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
package dev.mars.jobrelay.core;

import dev.mars.jobrelay.api.channel.NotificationChannelClient;
import dev.mars.jobrelay.api.credentials.ConnectOptionsResolver;
import dev.mars.jobrelay.core.channel.JobStatusPayloadParser;
import dev.mars.jobrelay.core.channel.PgNotificationChannelClient;
import dev.mars.jobrelay.core.config.ListenerConfig;
import dev.mars.jobrelay.core.dispatch.EventDispatcher;
import dev.mars.jobrelay.core.dispatch.SessionTransport;
import dev.mars.jobrelay.core.hooks.SessionLifecycleHooks;
import dev.mars.jobrelay.core.listener.ListenerManager;
import dev.mars.jobrelay.core.metrics.RelayMetrics;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Wires the relay components together. One instance per process.
 *
 * Usage:
 * <pre>{@code
 * JobRelayContext relay = JobRelayContext.create(vertx, listenerConfig, serverDirectory, transport, meterRegistry);
 * relay.hooks().onSubscribe("7", sessionId, identity);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public final class JobRelayContext {
    private static final Logger logger = LoggerFactory.getLogger(JobRelayContext.class);

    private final SubscriptionRegistry registry;
    private final RelayMetrics metrics;
    private final EventDispatcher dispatcher;
    private final ListenerManager listenerManager;
    private final SessionLifecycleHooks hooks;

    private JobRelayContext(SubscriptionRegistry registry, RelayMetrics metrics, EventDispatcher dispatcher,
                            ListenerManager listenerManager, SessionLifecycleHooks hooks) {
        this.registry = registry;
        this.metrics = metrics;
        this.dispatcher = dispatcher;
        this.listenerManager = listenerManager;
        this.hooks = hooks;
    }

    /**
     * Creates a relay backed by the PostgreSQL channel client.
     */
    public static JobRelayContext create(Vertx vertx, ListenerConfig config, ConnectOptionsResolver resolver,
                                         SessionTransport transport, MeterRegistry meterRegistry) {
        return create(vertx, config, resolver, transport, meterRegistry,
            metrics -> new PgNotificationChannelClient(vertx, resolver, new JobStatusPayloadParser(), metrics, config.getIoTimeout()));
    }

    /**
     * Creates a relay with a caller-supplied channel client.
     */
    public static JobRelayContext create(Vertx vertx, ListenerConfig config, ConnectOptionsResolver resolver,
                                         SessionTransport transport, MeterRegistry meterRegistry,
                                         Function<RelayMetrics, NotificationChannelClient> clientFactory) {
        SubscriptionRegistry registry = new SubscriptionRegistry();
        RelayMetrics metrics = new RelayMetrics("jobrelay", registry);
        if (meterRegistry != null) {
            metrics.bindTo(meterRegistry);
        }
        NotificationChannelClient client = clientFactory.apply(metrics);
        EventDispatcher dispatcher = new EventDispatcher(registry, transport, metrics);
        ListenerManager listenerManager = new ListenerManager(vertx, registry, client, dispatcher, config, metrics);
        SessionLifecycleHooks hooks = new SessionLifecycleHooks(registry, listenerManager, resolver, dispatcher, metrics);

        logger.info("Job relay created with {}", config);
        return new JobRelayContext(registry, metrics, dispatcher, listenerManager, hooks);
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    public RelayMetrics metrics() {
        return metrics;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    public ListenerManager listenerManager() {
        return listenerManager;
    }

    public SessionLifecycleHooks hooks() {
        return hooks;
    }

    /**
     * Stops every listener and closes their connections.
     */
    public Future<Void> close() {
        logger.info("Shutting down job relay ({} active listener(s))", listenerManager.activeCount());
        return listenerManager.stopAll();
    }
}
