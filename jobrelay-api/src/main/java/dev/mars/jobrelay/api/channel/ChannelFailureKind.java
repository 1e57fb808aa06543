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
package dev.mars.jobrelay.api.channel;

/**
 * Classification of a notification channel failure.
 */
public enum ChannelFailureKind {

    /** Credentials rejected or unavailable. Never retried. */
    AUTH(false),

    /** Socket reset, timeout, closed connection. Retried with backoff. */
    TRANSIENT_IO(true),

    /** Malformed response or lost subscription. Retried with backoff. */
    PROTOCOL(true);

    private final boolean retryable;

    ChannelFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
