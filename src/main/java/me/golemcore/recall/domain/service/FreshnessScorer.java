package me.golemcore.recall.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Adjusts relevance scores for data age.
 *
 * <pre>
 * ageHours = max(0, now - observedAt) / 1h
 * boost    = priorityBoost if ageHours &lt;= priorityWindowHours else 1
 * decay    = exp(-decayFactor * ageHours / 24)
 * score    = base * decay * boost
 * </pre>
 *
 * Stateless; never throws. Future timestamps clamp to age zero and a missing
 * timestamp counts as observed {@code now}.
 */
@Service
public class FreshnessScorer {

    /** Payload fields consulted, in order, for a result's observation time. */
    public static final List<String> TIMESTAMP_FIELDS = List.of("created_at", "upload_timestamp", "timestamp");

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();
    private static final double HOURS_PER_DAY = 24.0;

    public double score(double base, Instant observedAt, Instant now, double decayFactor,
            double priorityWindowHours, double priorityBoost) {
        double ageHours = ageHours(observedAt, now);
        double boost = ageHours <= priorityWindowHours ? priorityBoost : 1.0;
        double decay = decayFactor == 0.0 ? 1.0 : Math.exp(-decayFactor * (ageHours / HOURS_PER_DAY));
        return base * decay * boost;
    }

    /**
     * Pure exponential decay without a recency boost, as used for session
     * listing.
     */
    public double decayOnly(double base, Instant observedAt, Instant now, double decayFactor) {
        return score(base, observedAt, now, decayFactor, Double.NEGATIVE_INFINITY, 1.0);
    }

    double ageHours(Instant observedAt, Instant now) {
        if (observedAt == null || now == null) {
            return 0.0;
        }
        long ageMillis = now.toEpochMilli() - observedAt.toEpochMilli();
        return Math.max(0.0, ageMillis / MILLIS_PER_HOUR);
    }

    /**
     * Extracts the observation time of a backend payload from the first
     * parseable field of {@link #TIMESTAMP_FIELDS}.
     */
    public Optional<Instant> observedAt(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        for (String field : TIMESTAMP_FIELDS) {
            Optional<Instant> parsed = parseTimestamp(payload.get(field));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Parses ISO-8601 instants and offset date-times, ISO local date-times
     * (read as UTC) and epoch milliseconds given as a number or numeric string.
     */
    public Optional<Instant> parseTimestamp(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(Instant.ofEpochMilli(value.asLong()));
        }
        if (value.isTextual()) {
            return parseTimestamp(value.asText());
        }
        return Optional.empty();
    }

    public Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(trimmed)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(trimmed).toInstant());
        } catch (DateTimeParseException e) {
            return parseLocalDateTime(trimmed);
        }
    }

    private Optional<Instant> parseLocalDateTime(String text) {
        try {
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
