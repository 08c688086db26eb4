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

import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of the available {@link ToolComponent}s, keyed by tool name.
 */
@Service
@Slf4j
public class ToolCatalogService {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolCatalogService(List<ToolComponent> toolComponents) {
        toolComponents.stream()
                .sorted(Comparator.comparing(ToolComponent::getToolName))
                .forEach(tool -> {
                    ToolComponent previous = tools.put(tool.getToolName(), tool);
                    if (previous != null) {
                        throw new IllegalStateException("Duplicate tool name: " + tool.getToolName());
                    }
                });
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public List<ToolDefinition> listDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public Optional<ToolComponent> findTool(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    /**
     * Executes a tool by name. An unknown tool, or a tool whose future fails,
     * still completes with a failed {@link ToolResult}.
     */
    public CompletableFuture<ToolResult> execute(String name, Map<String, Object> parameters) {
        Optional<ToolComponent> tool = findTool(name);
        if (tool.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure(RetrievalErrorKind.VALIDATION_ERROR,
                    "Unknown tool: " + name + ". Available tools: " + String.join(", ", tools.keySet())));
        }

        log.debug("[Tools] Executing {}", name);
        return tool.get().execute(parameters != null ? parameters : Map.of())
                .exceptionally(e -> {
                    log.error("[Tools] {} failed outside its envelope: {}", name, e.getMessage(), e);
                    return ToolResult.failure(RetrievalErrorKind.STORAGE_ERROR, "Tool failed: " + e.getMessage());
                });
    }
}
