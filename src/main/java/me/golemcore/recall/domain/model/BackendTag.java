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
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Identifies the search backend a result came from. Wire names are the values
 * accepted in the {@code databases} tool parameter and used as keys of
 * aggregate results.
 */
public enum BackendTag {

    VECTOR_STORE("qdrant", List.of("vector", "vector_store")),
    DOCUMENT_STORE("admin", List.of("mongodb", "document_store"));

    private final String wireName;
    private final List<String> aliases;

    BackendTag(String wireName, List<String> aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire name or alias, case-insensitively.
     */
    public static Optional<BackendTag> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tag -> tag.wireName.equals(normalized)
                        || tag.aliases.contains(normalized)
                        || tag.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
