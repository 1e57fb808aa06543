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
package dev.mars.jobrelay.core.registry;

import dev.mars.jobrelay.api.ClientSessionId;
import dev.mars.jobrelay.api.ServerId;
import dev.mars.jobrelay.api.SubscriberIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map of which client sessions are subscribed to which server.
 *
 * Each server maps to an immutable snapshot of its subscriptions that is
 * replaced on every mutation, so {@link #sessionsFor} never observes a
 * half-applied change and fan-out can iterate without holding a lock.
 * All mutations for one server are serialised through
 * {@link ConcurrentHashMap#compute}; a server key exists if and only if it has
 * at least one subscription.
 *
 * The registry only records interest. Starting and stopping listeners is the
 * caller's responsibility, driven by the {@code first}/{@code last} flags
 * returned from the mutators.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class SubscriptionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<ServerId, Map<ClientSessionId, Subscription>> subscriptionsByServer = new ConcurrentHashMap<>();
    private final Map<ClientSessionId, Set<ServerId>> serversBySession = new ConcurrentHashMap<>();
    private final Clock clock;

    public SubscriptionRegistry() {
        this(Clock.systemUTC());
    }

    public SubscriptionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records that {@code sessionId} wants updates for {@code serverId}.
     * Subscribing twice is idempotent: the identity is refreshed, the original
     * creation time is kept and no second subscription is created.
     *
     * @return whether this was the server's first subscriber and whether an existing entry was replaced
     */
    public SubscriptionResult subscribe(ServerId serverId, ClientSessionId sessionId, SubscriberIdentity identity) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(identity, "identity must not be null");

        boolean[] outcome = new boolean[2];
        subscriptionsByServer.compute(serverId, (id, current) -> {
            Map<ClientSessionId, Subscription> next = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
            Subscription existing = next.get(sessionId);
            Instant createdAt = existing != null ? existing.createdAt() : clock.instant();
            next.put(sessionId, new Subscription(id, sessionId, identity, createdAt));
            outcome[0] = current == null;
            outcome[1] = existing != null;
            serversBySession.computeIfAbsent(sessionId, s -> ConcurrentHashMap.newKeySet()).add(id);
            return Collections.unmodifiableMap(next);
        });

        logger.debug("Session {} subscribed to server {} (first={}, replaced={})", sessionId, serverId, outcome[0], outcome[1]);
        return new SubscriptionResult(outcome[0], outcome[1]);
    }

    /**
     * Removes one subscription. Removing a subscription that does not exist is a no-op.
     *
     * @return true if the server has no subscribers left as a result of this call
     */
    public boolean unsubscribe(ServerId serverId, ClientSessionId sessionId) {
        boolean[] last = new boolean[1];
        subscriptionsByServer.computeIfPresent(serverId, (id, current) -> {
            if (!current.containsKey(sessionId)) {
                return current;
            }
            Map<ClientSessionId, Subscription> next = new LinkedHashMap<>(current);
            next.remove(sessionId);
            forgetServerForSession(sessionId, id);
            if (next.isEmpty()) {
                last[0] = true;
                return null;
            }
            return Collections.unmodifiableMap(next);
        });

        logger.debug("Session {} unsubscribed from server {} (last={})", sessionId, serverId, last[0]);
        return last[0];
    }

    /**
     * Removes every subscription of a session, typically on disconnect.
     *
     * The removal is atomic per server, not across servers: until this returns,
     * a concurrent {@link #sessionsFor} may still list the session for a server
     * not yet processed. Callers close the session's transport first, so such
     * a late delivery is only reported as undeliverable.
     *
     * @return one entry per server the session was removed from
     */
    public List<SessionRemoval> removeSession(ClientSessionId sessionId) {
        Set<ServerId> servers = serversBySession.remove(sessionId);
        if (servers == null || servers.isEmpty()) {
            return List.of();
        }

        List<SessionRemoval> removals = new ArrayList<>();
        for (ServerId serverId : new HashSet<>(servers)) {
            boolean[] removed = new boolean[2];
            subscriptionsByServer.computeIfPresent(serverId, (id, current) -> {
                if (!current.containsKey(sessionId)) {
                    return current;
                }
                removed[0] = true;
                Map<ClientSessionId, Subscription> next = new LinkedHashMap<>(current);
                next.remove(sessionId);
                if (next.isEmpty()) {
                    removed[1] = true;
                    return null;
                }
                return Collections.unmodifiableMap(next);
            });
            if (removed[0]) {
                removals.add(new SessionRemoval(serverId, removed[1]));
            }
        }

        logger.debug("Removed session {} from {} server(s)", sessionId, removals.size());
        return removals;
    }

    /**
     * Removes every subscription for a server and returns the sessions that were subscribed.
     * Used when the server's listener has permanently failed.
     */
    public Set<ClientSessionId> drainServer(ServerId serverId) {
        Map<ClientSessionId, Subscription> removed = subscriptionsByServer.remove(serverId);
        if (removed == null) {
            return Set.of();
        }
        for (ClientSessionId sessionId : removed.keySet()) {
            forgetServerForSession(sessionId, serverId);
        }
        logger.debug("Drained {} subscription(s) for server {}", removed.size(), serverId);
        return Collections.unmodifiableSet(new HashSet<>(removed.keySet()));
    }

    /**
     * @return an immutable point-in-time copy of the sessions subscribed to the server
     */
    public Set<ClientSessionId> sessionsFor(ServerId serverId) {
        Map<ClientSessionId, Subscription> current = subscriptionsByServer.get(serverId);
        return current == null ? Set.of() : Collections.unmodifiableSet(new HashSet<>(current.keySet()));
    }

    /**
     * @return the subscriptions of a server in subscription order, empty if none
     */
    public List<Subscription> subscriptionsFor(ServerId serverId) {
        Map<ClientSessionId, Subscription> current = subscriptionsByServer.get(serverId);
        return current == null ? List.of() : List.copyOf(current.values());
    }

    /**
     * Identity of the longest-standing subscriber, used when a listener has to
     * reconnect after the session that started it has gone.
     */
    public Optional<SubscriberIdentity> identityFor(ServerId serverId) {
        Map<ClientSessionId, Subscription> current = subscriptionsByServer.get(serverId);
        if (current == null || current.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(current.values().iterator().next().identity());
    }

    public boolean hasSubscribers(ServerId serverId) {
        return subscriptionsByServer.containsKey(serverId);
    }

    public boolean isSubscribed(ServerId serverId, ClientSessionId sessionId) {
        Map<ClientSessionId, Subscription> current = subscriptionsByServer.get(serverId);
        return current != null && current.containsKey(sessionId);
    }

    public Set<ServerId> serversFor(ClientSessionId sessionId) {
        Set<ServerId> servers = serversBySession.get(sessionId);
        return servers == null ? Set.of() : Set.copyOf(servers);
    }

    public int subscriptionCount() {
        int total = 0;
        for (Map<ClientSessionId, Subscription> subscriptions : subscriptionsByServer.values()) {
            total += subscriptions.size();
        }
        return total;
    }

    private void forgetServerForSession(ClientSessionId sessionId, ServerId serverId) {
        serversBySession.computeIfPresent(sessionId, (s, servers) -> {
            servers.remove(serverId);
            return servers.isEmpty() ? null : servers;
        });
    }
}
