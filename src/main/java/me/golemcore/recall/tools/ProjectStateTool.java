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

import me.golemcore.recall.domain.model.Checkpoint;
import me.golemcore.recall.domain.model.CheckpointListing;
import me.golemcore.recall.domain.model.ProjectState;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.ProjectStateService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Project state tracking: a current state document with bounded history and
 * point-in-time checkpoints.
 */
@Component
public class ProjectStateTool extends AbstractOperationTool<ProjectStateTool.Operation> {

    private final ProjectStateService projectStateService;

    public ProjectStateTool(ToolParameters params, ProjectStateService projectStateService) {
        super(Operation.class, params);
        this.projectStateService = projectStateService;
    }

    public enum Operation implements ToolOperation {
        CREATE_PROJECT_STATE("create_project_state"),
        UPDATE_STATE("update_state"),
        GET_CURRENT_STATE("get_current_state"),
        CREATE_CHECKPOINT("create_checkpoint"),
        LIST_CHECKPOINTS("list_checkpoints");

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
                .name("project_state_tracker")
                .description("""
                        Track project state across sessions.
                        Operations: create_project_state, update_state, get_current_state, create_checkpoint,
                        list_checkpoints.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                OPERATION, Map.of(
                                        "type", "string",
                                        "enum", operationNames(),
                                        "description", "Operation to perform"),
                                "projectName", Map.of(
                                        "type", "string",
                                        "description", "Project name"),
                                "state", Map.of(
                                        "type", "object",
                                        "description", "Initial state, or fields to merge for update_state"),
                                "context", Map.of(
                                        "type", "object",
                                        "description", "Context to store with the state or checkpoint")),
                        "required", List.of(OPERATION, "projectName")))
                .build();
    }

    @Override
    protected ToolResult dispatch(Operation operation, Map<String, Object> parameters) {
        String projectName = params.requireString(parameters, "projectName");
        return switch (operation) {
        case CREATE_PROJECT_STATE -> stateResult("Created state for " + projectName,
                projectStateService.createProjectState(projectName, params.object(parameters, "state"),
                        params.object(parameters, "context")));
        case UPDATE_STATE -> stateResult("Updated state for " + projectName,
                projectStateService.updateState(projectName, requireObject(parameters, "state")));
        case GET_CURRENT_STATE -> stateResult("Current state of " + projectName,
                projectStateService.getCurrentState(projectName));
        case CREATE_CHECKPOINT -> createCheckpoint(projectName, params.object(parameters, "context"));
        case LIST_CHECKPOINTS -> listCheckpoints(projectName);
        };
    }

    private ToolResult stateResult(String output, ProjectState state) {
        return ToolResult.success(output, Map.of("state", params.toData(state)));
    }

    private ToolResult createCheckpoint(String projectName, ObjectNode context) {
        Checkpoint checkpoint = projectStateService.createCheckpoint(projectName, context);
        return ToolResult.success("Created checkpoint " + checkpoint.getCheckpointId(), params.toData(checkpoint));
    }

    private ToolResult listCheckpoints(String projectName) {
        CheckpointListing listing = projectStateService.listCheckpoints(projectName);
        return ToolResult.success(listing.getTotal() + " checkpoints for " + projectName, params.toData(listing));
    }

    private ObjectNode requireObject(Map<String, Object> parameters, String key) {
        ObjectNode value = params.object(parameters, key);
        if (value == null) {
            throw RetrievalException.validation("Missing required parameter: " + key);
        }
        return value;
    }
}
