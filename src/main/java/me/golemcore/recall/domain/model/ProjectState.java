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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Current state of a tracked project, persisted as
 * {@code projects/<projectName>/current_state.json}. Previous states are kept
 * in a bounded, newest-first {@link #history}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectState {

    public static final String CURRENT_VERSION = "2.0.0";

    private String projectName;

    @Builder.Default
    private ObjectNode state = JsonNodeFactory.instance.objectNode();

    @Builder.Default
    private ObjectNode context = JsonNodeFactory.instance.objectNode();

    private Instant created;
    private Instant lastUpdated;
    private String version;

    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    /**
     * A superseded state together with the time it stopped being current.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class HistoryEntry {
        private ObjectNode state;
        private Instant replacedAt;
    }
}
