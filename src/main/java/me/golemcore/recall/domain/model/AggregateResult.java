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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merged output of one logical search across several backends. Per-source
 * results are keyed by the originating backend in request order.
 */
@Data
@Builder
public class AggregateResult {

    private String query;

    @Builder.Default
    private Map<BackendTag, BackendResult> sources = new LinkedHashMap<>();

    private Summary summary;

    /**
     * Counts over all requested sources.
     */
    @Data
    @Builder
    public static class Summary {
        private int totalSources;
        private int successfulSources;
        private int totalResults;
    }

    public static Summary summarize(Map<BackendTag, BackendResult> sources) {
        int successful = 0;
        int totalResults = 0;
        for (BackendResult result : sources.values()) {
            if (result.isSuccess()) {
                successful++;
            }
            totalResults += result.getCount();
        }
        return Summary.builder()
                .totalSources(sources.size())
                .successfulSources(successful)
                .totalResults(totalResults)
                .build();
    }
}
