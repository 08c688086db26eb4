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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Freshness-ranked search results from all requested backends.
 */
@Data
@Builder
public class RankedResult {

    private String query;

    @Builder.Default
    private List<SearchResult> results = new ArrayList<>();

    /** Results across all sources before truncation to the limit. */
    private int totalResults;

    private boolean freshnessApplied;
    private double decayFactor;

    /** Per-source success flags, in request order. */
    @Builder.Default
    private Map<BackendTag, Boolean> sourceStatus = new LinkedHashMap<>();

    /** Per-source error messages for failed sources. */
    @Builder.Default
    private Map<BackendTag, String> sourceErrors = new LinkedHashMap<>();
}
