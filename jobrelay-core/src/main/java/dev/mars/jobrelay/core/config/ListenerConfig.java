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
package dev.mars.jobrelay.core.config;

import io.github.resilience4j.core.IntervalFunction;
import io.vertx.core.json.JsonObject;

import java.time.Duration;

/**
 * Timing and retry configuration shared by all listener supervisors.
 * Follows the established configuration pattern with builder support.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ListenerConfig {

    private final Duration pollInterval;
    private final Duration keepaliveInterval;
    private final Duration healthCheckInterval;
    private final Duration maxConnectionAge;
    private final Duration ioTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double backoffMultiplier;
    private final int maxConsecutiveFailures;
    private final int dedupWindowSize;

    // Private constructor for builder pattern
    private ListenerConfig(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.keepaliveInterval = builder.keepaliveInterval;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.maxConnectionAge = builder.maxConnectionAge;
        this.ioTimeout = builder.ioTimeout;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.dedupWindowSize = builder.dedupWindowSize;
    }

    // Getters
    public Duration getPollInterval() { return pollInterval; }
    public Duration getKeepaliveInterval() { return keepaliveInterval; }
    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public Duration getMaxConnectionAge() { return maxConnectionAge; }
    public Duration getIoTimeout() { return ioTimeout; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
    public int getDedupWindowSize() { return dedupWindowSize; }

    /**
     * Exponential backoff between reconnect attempts, capped at {@link #getMaxBackoff()}.
     * Attempt numbers start at 1.
     */
    public IntervalFunction backoff() {
        return IntervalFunction.ofExponentialBackoff(initialBackoff.toMillis(), backoffMultiplier, maxBackoff.toMillis());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ListenerConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Reads the {@code listener} configuration block. Missing keys keep their defaults.
     *
     * @param json The block, may be null
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ListenerConfig fromJson(JsonObject json) {
        Builder builder = builder();
        if (json == null) {
            return builder.build();
        }
        Long value;
        if ((value = json.getLong("pollIntervalMs")) != null) builder.pollInterval(Duration.ofMillis(value));
        if ((value = json.getLong("keepaliveIntervalMs")) != null) builder.keepaliveInterval(Duration.ofMillis(value));
        if ((value = json.getLong("healthCheckIntervalMs")) != null) builder.healthCheckInterval(Duration.ofMillis(value));
        if ((value = json.getLong("maxConnectionAgeMs")) != null) builder.maxConnectionAge(Duration.ofMillis(value));
        if ((value = json.getLong("ioTimeoutMs")) != null) builder.ioTimeout(Duration.ofMillis(value));
        if ((value = json.getLong("initialBackoffMs")) != null) builder.initialBackoff(Duration.ofMillis(value));
        if ((value = json.getLong("maxBackoffMs")) != null) builder.maxBackoff(Duration.ofMillis(value));
        Double multiplier = json.getDouble("backoffMultiplier");
        if (multiplier != null) builder.backoffMultiplier(multiplier);
        Integer count;
        if ((count = json.getInteger("maxConsecutiveFailures")) != null) builder.maxConsecutiveFailures(count);
        if ((count = json.getInteger("dedupWindowSize")) != null) builder.dedupWindowSize(count);
        return builder.build();
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("pollIntervalMs", pollInterval.toMillis())
            .put("keepaliveIntervalMs", keepaliveInterval.toMillis())
            .put("healthCheckIntervalMs", healthCheckInterval.toMillis())
            .put("maxConnectionAgeMs", maxConnectionAge.toMillis())
            .put("ioTimeoutMs", ioTimeout.toMillis())
            .put("initialBackoffMs", initialBackoff.toMillis())
            .put("maxBackoffMs", maxBackoff.toMillis())
            .put("backoffMultiplier", backoffMultiplier)
            .put("maxConsecutiveFailures", maxConsecutiveFailures)
            .put("dedupWindowSize", dedupWindowSize);
    }

    public static class Builder {
        private Duration pollInterval = Duration.ofMillis(250);
        private Duration keepaliveInterval = Duration.ofSeconds(15);
        private Duration healthCheckInterval = Duration.ofSeconds(60);
        private Duration maxConnectionAge = Duration.ofMinutes(30);
        private Duration ioTimeout = Duration.ofSeconds(5);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private int maxConsecutiveFailures = 5;
        private int dedupWindowSize = 512;

        public Builder pollInterval(Duration interval) {
            this.pollInterval = interval;
            return this;
        }

        public Builder keepaliveInterval(Duration interval) {
            this.keepaliveInterval = interval;
            return this;
        }

        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder maxConnectionAge(Duration age) {
            this.maxConnectionAge = age;
            return this;
        }

        public Builder ioTimeout(Duration timeout) {
            this.ioTimeout = timeout;
            return this;
        }

        public Builder initialBackoff(Duration backoff) {
            this.initialBackoff = backoff;
            return this;
        }

        public Builder maxBackoff(Duration backoff) {
            this.maxBackoff = backoff;
            return this;
        }

        public Builder backoffMultiplier(double multiplier) {
            this.backoffMultiplier = multiplier;
            return this;
        }

        /**
         * @param failures Consecutive failures tolerated before the listener gives up
         */
        public Builder maxConsecutiveFailures(int failures) {
            this.maxConsecutiveFailures = failures;
            return this;
        }

        /**
         * @param size Most payloads drained from a rotated-out connection that are
         *             checked against the replacement's first notifications; 0 disables the check
         */
        public Builder dedupWindowSize(int size) {
            this.dedupWindowSize = size;
            return this;
        }

        public ListenerConfig build() {
            requirePositive("Poll interval", pollInterval);
            requirePositive("Keepalive interval", keepaliveInterval);
            requirePositive("Health check interval", healthCheckInterval);
            requirePositive("Max connection age", maxConnectionAge);
            requirePositive("I/O timeout", ioTimeout);
            requirePositive("Initial backoff", initialBackoff);
            requirePositive("Max backoff", maxBackoff);

            if (maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("Max backoff must not be shorter than initial backoff, got: "
                    + maxBackoff + " < " + initialBackoff);
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("Backoff multiplier must be at least 1.0, got: " + backoffMultiplier);
            }
            if (maxConsecutiveFailures <= 0) {
                throw new IllegalArgumentException("Max consecutive failures must be positive, got: " + maxConsecutiveFailures);
            }
            if (dedupWindowSize < 0) {
                throw new IllegalArgumentException("Dedup window size must not be negative, got: " + dedupWindowSize);
            }
            return new ListenerConfig(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null) {
                throw new NullPointerException(name + " cannot be null");
            }
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "ListenerConfig{" +
                "pollInterval=" + pollInterval +
                ", keepaliveInterval=" + keepaliveInterval +
                ", healthCheckInterval=" + healthCheckInterval +
                ", maxConnectionAge=" + maxConnectionAge +
                ", ioTimeout=" + ioTimeout +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                ", backoffMultiplier=" + backoffMultiplier +
                ", maxConsecutiveFailures=" + maxConsecutiveFailures +
                ", dedupWindowSize=" + dedupWindowSize +
                '}';
    }
}
