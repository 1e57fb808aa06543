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
package dev.mars.jobrelay.core.metrics;

import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the job status relay.
 *
 * Recording methods are safe to call before {@link #bindTo} has run; they are
 * no-ops until the binder is attached to a registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class RelayMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(RelayMetrics.class);

    private final String instanceId;
    private final SubscriptionRegistry subscriptionRegistry;

    // Counters
    private volatile Counter notificationsReceived;
    private volatile Counter notificationsMalformed;
    private volatile Counter eventsDelivered;
    private volatile Counter eventsDeliveryFailed;
    private volatile Counter duplicatesSuppressed;
    private volatile Counter listenerReconnects;
    private volatile Counter listenerRotations;
    private volatile Counter listenerTerminalFailures;
    private volatile Counter registryInvariantViolations;

    // Gauges
    private final AtomicLong activeListeners = new AtomicLong(0);

    public RelayMetrics(String instanceId, SubscriptionRegistry subscriptionRegistry) {
        this.instanceId = instanceId;
        this.subscriptionRegistry = subscriptionRegistry;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        notificationsReceived = counter(registry, "jobrelay.notifications.received",
            "Total number of job status notifications received from database servers");
        notificationsMalformed = counter(registry, "jobrelay.notifications.malformed",
            "Total number of notifications skipped because the payload could not be decoded");
        eventsDelivered = counter(registry, "jobrelay.events.delivered",
            "Total number of events delivered to client sessions");
        eventsDeliveryFailed = counter(registry, "jobrelay.events.delivery_failed",
            "Total number of per-session delivery failures");
        duplicatesSuppressed = counter(registry, "jobrelay.events.duplicates_suppressed",
            "Total number of redelivered notifications that were not dispatched again");
        listenerReconnects = counter(registry, "jobrelay.listener.reconnects",
            "Total number of listener reconnect attempts after a failure");
        listenerRotations = counter(registry, "jobrelay.listener.rotations",
            "Total number of forced listener connection rotations");
        listenerTerminalFailures = counter(registry, "jobrelay.listener.terminal_failures",
            "Total number of listeners given up after authentication failure or exhausted retries");
        registryInvariantViolations = counter(registry, "jobrelay.registry.invariant_violations",
            "Total number of subscriptions found without a running listener");

        Gauge.builder("jobrelay.listeners.active", activeListeners, AtomicLong::get)
            .description("Number of running listener supervisors")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("jobrelay.subscriptions.active", subscriptionRegistry, SubscriptionRegistry::subscriptionCount)
            .description("Number of active session subscriptions")
            .tag("instance", instanceId)
            .register(registry);

        logger.debug("Relay metrics bound for instance {}", instanceId);
    }

    private Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
            .description(description)
            .tag("instance", instanceId)
            .register(registry);
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordNotificationReceived() {
        increment(notificationsReceived);
    }

    public void recordMalformedNotification() {
        increment(notificationsMalformed);
    }

    public void recordEventDelivered() {
        increment(eventsDelivered);
    }

    public void recordDeliveryFailed() {
        increment(eventsDeliveryFailed);
    }

    public void recordDuplicateSuppressed() {
        increment(duplicatesSuppressed);
    }

    public void recordReconnect() {
        increment(listenerReconnects);
    }

    public void recordRotation() {
        increment(listenerRotations);
    }

    public void recordTerminalFailure() {
        increment(listenerTerminalFailures);
    }

    public void recordInvariantViolation() {
        increment(registryInvariantViolations);
    }

    public void listenerStarted() {
        activeListeners.incrementAndGet();
    }

    public void listenerStopped() {
        activeListeners.updateAndGet(current -> Math.max(0, current - 1));
    }

    public long getActiveListeners() {
        return activeListeners.get();
    }
}
