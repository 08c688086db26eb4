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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One hit returned by a search backend, normalized to a common shape.
 *
 * <p>
 * {@code adjustedScore} stays {@code null} until the freshness scorer runs.
 * {@code observedAt} is {@code null} when the payload carries no usable
 * timestamp; such results are scored as observed "now".
 */
@Data
@Builder(toBuilder = true)
public class SearchResult {

    private String id;
    private BackendTag sourceBackend;

    /** Collection, table or index inside the backend, when it has one. */
    private String origin;

    @Builder.Default
    private JsonNode payload = JsonNodeFactory.instance.objectNode();

    private double baseScore;
    private Instant observedAt;
    private Double adjustedScore;

    /**
     * Score used for ranking: the adjusted score once assigned, the base score
     * otherwise.
     */
    public double getRankingScore() {
        return adjustedScore != null ? adjustedScore : baseScore;
    }
}
