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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.jobrelay.api.JobStatus;
import dev.mars.jobrelay.api.JobStatusEvent;
import dev.mars.jobrelay.api.ServerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes job status notification payloads.
 *
 * Payloads are JSON objects produced by {@code row_to_json} on the scheduler
 * side. {@code job_id} and {@code status} are required; {@code start_time},
 * {@code end_time} and {@code timestamp} are optional; every other key is kept
 * as an opaque detail.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-14
 * @version 1.0
 */
public class JobStatusPayloadParser {
    private static final Logger logger = LoggerFactory.getLogger(JobStatusPayloadParser.class);

    private static final Set<String> KNOWN_FIELDS = Set.of("job_id", "status", "start_time", "end_time", "timestamp");
    private static final TypeReference<Object> ANY = new TypeReference<>() { };

    // Accepts timestamptz text ("2025-10-14 09:30:00.123+00"), ISO-8601 and offset-less local times (taken as UTC)
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalStart().appendOffset("+HH", "Z").optionalEnd()
        .toFormatter();

    private final ObjectMapper objectMapper;

    public JobStatusPayloadParser() {
        this(new ObjectMapper());
    }

    public JobStatusPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one notification payload.
     *
     * @param serverId Server the notification arrived from
     * @param payload  Raw payload text
     * @return the decoded event, or empty if the payload is malformed
     */
    public Optional<JobStatusEvent> parse(ServerId serverId, String payload) {
        if (payload == null || payload.isBlank()) {
            logger.warn("Received empty job status notification from server {}", serverId);
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            logger.warn("Received job status notification from server {} that is not valid JSON: {}", serverId, e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            logger.warn("Received job status notification from server {} that is not a JSON object: {}", serverId, payload);
            return Optional.empty();
        }

        Long jobId = readJobId(root.get("job_id"));
        if (jobId == null) {
            logger.warn("Received job status notification from server {} with missing or invalid job_id: {}", serverId, payload);
            return Optional.empty();
        }

        JsonNode statusNode = root.get("status");
        if (statusNode == null || statusNode.isNull() || !statusNode.isValueNode() || statusNode.asText().isBlank()) {
            logger.warn("Received job status notification from server {} with missing status: {}", serverId, payload);
            return Optional.empty();
        }
        String rawStatus = statusNode.asText();

        Map<String, Object> details = new LinkedHashMap<>();
        root.fields().forEachRemaining(field -> {
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                details.put(field.getKey(), objectMapper.convertValue(field.getValue(), ANY));
            }
        });

        return Optional.of(new JobStatusEvent(
            serverId,
            jobId,
            JobStatus.decode(rawStatus),
            rawStatus,
            readInstant(root.get("start_time")),
            readInstant(root.get("end_time")),
            readInstant(root.get("timestamp")),
            details,
            payload));
    }

    private static Long readJobId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToExactIntegral()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Instant readInstant(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        String text = node.asText().trim();
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable timestamp '{}'", text);
            return null;
        }
    }
}
