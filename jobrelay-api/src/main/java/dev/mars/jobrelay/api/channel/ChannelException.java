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

import java.util.Objects;

/**
 * Failure raised by a {@link NotificationChannelClient}.
 *
 * Every failure carries a {@link ChannelFailureKind}; the listener supervisor
 * decides between retry, reopen and give-up purely on that kind.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class ChannelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ChannelFailureKind kind;

    public ChannelException(ChannelFailureKind kind, String message) {
        this(kind, message, null);
    }

    public ChannelException(ChannelFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ChannelException auth(String message, Throwable cause) {
        return new ChannelException(ChannelFailureKind.AUTH, message, cause);
    }

    public static ChannelException transientIo(String message, Throwable cause) {
        return new ChannelException(ChannelFailureKind.TRANSIENT_IO, message, cause);
    }

    public static ChannelException protocol(String message, Throwable cause) {
        return new ChannelException(ChannelFailureKind.PROTOCOL, message, cause);
    }

    public ChannelFailureKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    @Override
    public String toString() {
        return "ChannelException[" + kind + "]: " + getMessage();
    }
}
