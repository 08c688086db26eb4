package me.golemcore.recall.domain.model;

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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Deletion policy for expired sessions. Both strategies remove exactly the same
 * set of sessions; {@link #ARCHIVE_THEN_DELETE} keeps a copy in the archive
 * directory first.
 */
public enum CleanupStrategy {

    HARD_DELETE("timestamp", "deleted"),
    ARCHIVE_THEN_DELETE("smart_archive", "archived");

    private final String wireName;
    private final String action;

    CleanupStrategy(String wireName, String action) {
        this.wireName = wireName;
        this.action = action;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Verb reported for each removed session.
     */
    public String getAction() {
        return action;
    }

    public static Optional<CleanupStrategy> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(strategy -> strategy.wireName.equals(normalized)
                        || strategy.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
