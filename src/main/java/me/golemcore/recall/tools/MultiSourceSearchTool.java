package me.golemcore.recall.tools;

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

import me.golemcore.recall.domain.model.AggregateResult;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.SearchAggregatorService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Concurrent search over the configured backends.
 *
 * <p>
 * {@code search_all} returns the raw per-backend results; {@code
 * search_with_freshness} merges them and re-ranks by freshness. Backends are
 * chosen with {@code databases} (qdrant, mongodb, admin) and default to all
 * enabled ones.
 */
@Component
public class MultiSourceSearchTool extends AbstractOperationTool<MultiSourceSearchTool.Operation> {

    private final SearchAggregatorService searchAggregatorService;
    private final RecallProperties properties;

    public MultiSourceSearchTool(ToolParameters params, SearchAggregatorService searchAggregatorService,
            RecallProperties properties) {
        super(Operation.class, params);
        this.searchAggregatorService = searchAggregatorService;
        this.properties = properties;
    }

    public enum Operation implements ToolOperation {
        SEARCH_ALL("search_all"),
        SEARCH_WITH_FRESHNESS("search_with_freshness");

        private final String wireName;

        Operation(String wireName) {
            this.wireName = wireName;
        }

        @Override
        public String getWireName() {
            return wireName;
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("multi_source_search")
                .description("""
                        Search the vector store and document store concurrently.
                        search_all returns results per backend; search_with_freshness merges and ranks them,
                        favouring recently updated records.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                OPERATION, Map.of(
                                        "type", "string",
                                        "enum", operationNames(),
                                        "description", "Operation to perform"),
                                "query", Map.of(
                                        "type", "string",
                                        "description", "Search query"),
                                "databases", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Backends to search: qdrant, mongodb, admin"),
                                "limit", Map.of(
                                        "type", "integer",
                                        "description", "Maximum results (default: 10)"),
                                "decayFactor", Map.of(
                                        "type", "number",
                                        "description", "Freshness decay per day of age (default: 0.1)"),
                                "priorityWindowHours", Map.of(
                                        "type", "number",
                                        "description", "Age in hours that still earns the boost (default: 48)"),
                                "priorityBoost", Map.of(
                                        "type", "number",
                                        "description", "Multiplier for recent results (default: 1.5)"),
                                "freshnessEnabled", Map.of(
                                        "type", "boolean",
                                        "description", "Apply freshness scoring (default: true)")),
                        "required", List.of(OPERATION, "query")))
                .build();
    }

    @Override
    protected RetrievalErrorKind unexpectedErrorKind() {
        return RetrievalErrorKind.BACKEND_ERROR;
    }

    @Override
    protected ToolResult dispatch(Operation operation, Map<String, Object> parameters) {
        String query = params.requireString(parameters, "query");
        QueryConfig config = queryConfig(parameters);
        return switch (operation) {
        case SEARCH_ALL -> searchAll(query, config);
        case SEARCH_WITH_FRESHNESS -> searchWithFreshness(query, config);
        };
    }

    private ToolResult searchAll(String query, QueryConfig config) {
        AggregateResult result = searchAggregatorService.searchAll(query, config.getTargetBackends(),
                config.getLimit());
        AggregateResult.Summary summary = result.getSummary();
        return ToolResult.success(summary.getTotalResults() + " results from " + summary.getSuccessfulSources()
                + "/" + summary.getTotalSources() + " sources", params.toData(result));
    }

    private ToolResult searchWithFreshness(String query, QueryConfig config) {
        RankedResult result = searchAggregatorService.searchWithFreshness(query, config);
        return ToolResult.success("Top " + result.getResults().size() + " of " + result.getTotalResults()
                + " results", params.toData(result));
    }

    private QueryConfig queryConfig(Map<String, Object> parameters) {
        RecallProperties.SearchProperties search = properties.getSearch();
        Set<BackendTag> enabled = searchAggregatorService.enabledBackends();
        return params.queryConfig(parameters, search.getDefaultLimit(), search.getDecayFactor(),
                search.getPriorityWindowHours(), search.getPriorityBoost(),
                enabled.isEmpty() ? Set.of(BackendTag.values()) : enabled);
    }
}
