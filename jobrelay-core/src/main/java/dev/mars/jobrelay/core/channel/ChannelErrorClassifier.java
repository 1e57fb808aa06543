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

import dev.mars.jobrelay.api.channel.ChannelException;
import dev.mars.jobrelay.api.channel.ChannelFailureKind;
import dev.mars.jobrelay.api.credentials.CredentialsUnavailableException;
import dev.mars.jobrelay.api.credentials.UnknownServerException;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.ClosedConnectionException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps PostgreSQL client failures onto {@link ChannelFailureKind}.
 *
 * SQLSTATE class 28 (invalid authorization) and 3D000 (unknown database) are
 * authentication failures. Class 08 (connection exception), 57P01..57P03
 * (admin shutdown, crash shutdown, cannot connect now), closed connections,
 * timeouts and I/O errors are transient. Anything else is a protocol failure.
 */
public final class ChannelErrorClassifier {

    private ChannelErrorClassifier() {
        // Utility class - no instantiation
    }

    public static ChannelFailureKind classify(Throwable error) {
        if (error == null) {
            return ChannelFailureKind.PROTOCOL;
        }
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ChannelException channelException) {
                return channelException.getKind();
            }
            if (cause instanceof CredentialsUnavailableException || cause instanceof UnknownServerException) {
                return ChannelFailureKind.AUTH;
            }
            if (cause instanceof PgException pgException) {
                return classifySqlState(pgException.getSqlState());
            }
            if (cause instanceof ClosedConnectionException
                    || cause instanceof IOException
                    || cause instanceof TimeoutException) {
                return ChannelFailureKind.TRANSIENT_IO;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return ChannelFailureKind.PROTOCOL;
    }

    static ChannelFailureKind classifySqlState(String sqlState) {
        if (sqlState == null) {
            return ChannelFailureKind.PROTOCOL;
        }
        if (sqlState.startsWith("28") || "3D000".equals(sqlState)) {
            return ChannelFailureKind.AUTH;
        }
        if (sqlState.startsWith("08") || "57P01".equals(sqlState) || "57P02".equals(sqlState) || "57P03".equals(sqlState)) {
            return ChannelFailureKind.TRANSIENT_IO;
        }
        return ChannelFailureKind.PROTOCOL;
    }

    /**
     * Wraps any failure into a {@link ChannelException}, leaving existing ones untouched.
     */
    public static ChannelException toChannelException(String operation, Throwable error) {
        if (error instanceof ChannelException channelException) {
            return channelException;
        }
        ChannelFailureKind kind = classify(error);
        String detail = error != null && error.getMessage() != null ? error.getMessage() : String.valueOf(error);
        return new ChannelException(kind, operation + " failed: " + detail, error);
    }
}
