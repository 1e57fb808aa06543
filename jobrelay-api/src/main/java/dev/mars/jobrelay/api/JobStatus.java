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
package dev.mars.jobrelay.api;

import java.util.Locale;

/**
 * Run state of a scheduled job as reported by the scheduler.
 *
 * The scheduler writes one-letter codes into its job log; the relay also
 * accepts the wire names so that hand-written NOTIFY payloads decode.
 */
public enum JobStatus {
    RUNNING("r", "running"),
    SUCCEEDED("s", "succeeded"),
    FAILED("f", "failed"),
    INTERNAL_ERROR("i", "internal_error"),
    ABORTED("d", "aborted"),
    UNKNOWN("?", "unknown");

    private final String code;
    private final String wireName;

    JobStatus(String code, String wireName) {
        this.code = code;
        this.wireName = wireName;
    }

    public String code() {
        return code;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Decodes a status from either its one-letter code or its wire name.
     * Unrecognised values decode to {@link #UNKNOWN}.
     */
    public static JobStatus decode(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status != UNKNOWN && (status.code.equals(normalized) || status.wireName.equals(normalized))) {
                return status;
            }
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == INTERNAL_ERROR || this == ABORTED;
    }
}
