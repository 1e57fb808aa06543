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

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import dev.mars.jobrelay.core.registry.SubscriptionRegistry;
import dev.mars.jobrelay.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RelayMetrics.
 */
@Tag(TestCategories.CORE)
class RelayMetricsTest {

    @Test
    @DisplayName("recording before binding is a no-op")
    void unbound() {
        RelayMetrics metrics = new RelayMetrics("test", new SubscriptionRegistry());

        assertDoesNotThrow(() -> {
            metrics.recordNotificationReceived();
            metrics.recordReconnect();
            metrics.recordTerminalFailure();
        });
    }

    @Test
    @DisplayName("counters and gauges are registered with the instance tag")
    void bound() {
        SubscriptionRegistry registry = new SubscriptionRegistry();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        RelayMetrics metrics = new RelayMetrics("relay-1", registry);
        metrics.bindTo(meterRegistry);

        metrics.recordNotificationReceived();
        metrics.recordNotificationReceived();
        metrics.recordMalformedNotification();
        metrics.recordRotation();
        metrics.listenerStarted();
        metrics.listenerStarted();
        metrics.listenerStopped();
        registry.subscribe(ServerId.of(7), ClientSessionId.of("A"), SubscriberIdentity.of("alice"));

        assertEquals(2.0, meterRegistry.get("jobrelay.notifications.received").tag("instance", "relay-1").counter().count());
        assertEquals(1.0, meterRegistry.get("jobrelay.notifications.malformed").counter().count());
        assertEquals(1.0, meterRegistry.get("jobrelay.listener.rotations").counter().count());
        assertEquals(1.0, meterRegistry.get("jobrelay.listeners.active").gauge().value());
        assertEquals(1.0, meterRegistry.get("jobrelay.subscriptions.active").gauge().value());
    }

    @Test
    @DisplayName("active listener gauge never goes negative")
    void activeListeners_floor() {
        RelayMetrics metrics = new RelayMetrics("test", new SubscriptionRegistry());

        metrics.listenerStopped();

        assertEquals(0, metrics.getActiveListeners());
    }
}
