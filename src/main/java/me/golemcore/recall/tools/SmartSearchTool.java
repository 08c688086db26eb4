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

import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RelevantContext;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.ContextRetrievalService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Project-scoped retrieval in one call: the project's freshest sessions, its
 * current state and freshness-ranked hits from every enabled backend.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SmartSearchTool implements ToolComponent {

    private final ToolParameters params;
    private final ContextRetrievalService contextRetrievalService;
    private final RecallProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("smart_search")
                .description("""
                        Retrieve context for a project: recent sessions, current project state and
                        search results ranked so that recently updated information comes first.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "projectName", Map.of(
                                        "type", "string",
                                        "description", "Project to retrieve context for"),
                                "query", Map.of(
                                        "type", "string",
                                        "description", "Search query"),
                                "maxResults", Map.of(
                                        "type", "integer",
                                        "description", "Maximum search results (default: 10)"),
                                "decayFactor", Map.of(
                                        "type", "number",
                                        "description", "Freshness decay per day of age (default: 0.1)"),
                                "databases", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Backends to search (default: all enabled)")),
                        "required", List.of("projectName", "query")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> search(parameters != null ? parameters : Map.of()));
    }

    private ToolResult search(Map<String, Object> parameters) {
        String projectName = null;
        String query = null;
        try {
            projectName = params.requireString(parameters, "projectName");
            query = params.requireString(parameters, "query");

            Map<String, Object> configParameters = new LinkedHashMap<>(parameters);
            Object maxResults = parameters.get("maxResults");
            if (maxResults != null) {
                configParameters.put("limit", maxResults);
            }
            RecallProperties.SearchProperties search = properties.getSearch();
            QueryConfig config = params.queryConfig(configParameters, search.getDefaultLimit(),
                    search.getDecayFactor(), search.getPriorityWindowHours(), search.getPriorityBoost(),
                    EnumSet.allOf(BackendTag.class));

            RelevantContext context = contextRetrievalService.getRelevantContext(projectName, query, config);
            return ToolResult.success(context.getRelevantSessions().size() + " sessions and "
                    + context.getSearchResults().getResults().size() + " search results for " + projectName,
                    params.toData(context));
        } catch (RetrievalException e) {
            log.warn("[Tools] smart_search failed ({}): {}", e.getKind(), e.getMessage());
            return ToolResult.failure(e.getKind(), e.getMessage(), echo(projectName, query));
        } catch (Exception e) { // NOSONAR - nothing escapes the tool envelope
            log.error("[Tools] smart_search ERROR: {}", e.getMessage(), e);
            return ToolResult.failure(RetrievalErrorKind.BACKEND_ERROR, "Unexpected error: " + e.getMessage(),
                    echo(projectName, query));
        }
    }

    private static Map<String, Object> echo(String projectName, String query) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("projectName", projectName);
        data.put("query", query);
        return data;
    }
}
