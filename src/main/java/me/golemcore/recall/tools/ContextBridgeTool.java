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

import me.golemcore.recall.domain.model.CaptureAck;
import me.golemcore.recall.domain.model.CleanupResult;
import me.golemcore.recall.domain.model.CleanupStrategy;
import me.golemcore.recall.domain.model.PipelineResult;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.SessionListing;
import me.golemcore.recall.domain.model.SessionRecord;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.pipeline.ContextPipelineService;
import me.golemcore.recall.domain.service.ContextRetrievalService;
import me.golemcore.recall.domain.service.SessionStoreService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session cache and live-context operations.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>{@code capture_session} - store a session snapshot (sessionId, projectName, context, metadata);
 * with {@code autoCleanup} expired sessions are archived afterwards
 * <li>{@code restore_session} - load a session, optionally checking projectName
 * <li>{@code list_active_sessions} - freshness-ranked sessions (projectName, maxResults)
 * <li>{@code cleanup_expired} - remove timed-out sessions (strategy: timestamp | smart_archive)
 * <li>{@code inject_realtime_data} - add live signals to a context
 * <li>{@code process_query_realtime} - run the full context pipeline for a query
 * </ul>
 */
@Component
public class ContextBridgeTool extends AbstractOperationTool<ContextBridgeTool.Operation> {

    private final SessionStoreService sessionStoreService;
    private final ContextPipelineService contextPipelineService;
    private final ContextRetrievalService contextRetrievalService;

    public ContextBridgeTool(ToolParameters params, SessionStoreService sessionStoreService,
            ContextPipelineService contextPipelineService, ContextRetrievalService contextRetrievalService) {
        super(Operation.class, params);
        this.sessionStoreService = sessionStoreService;
        this.contextPipelineService = contextPipelineService;
        this.contextRetrievalService = contextRetrievalService;
    }

    public enum Operation implements ToolOperation {
        CAPTURE_SESSION("capture_session"),
        RESTORE_SESSION("restore_session"),
        LIST_ACTIVE_SESSIONS("list_active_sessions"),
        CLEANUP_EXPIRED("cleanup_expired"),
        INJECT_REALTIME_DATA("inject_realtime_data"),
        PROCESS_QUERY_REALTIME("process_query_realtime");

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
                .name("context_bridge")
                .description("""
                        Session cache with freshness-ranked listing and live context enrichment.
                        Operations: capture_session, restore_session, list_active_sessions, cleanup_expired,
                        inject_realtime_data, process_query_realtime.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                OPERATION, Map.of(
                                        "type", "string",
                                        "enum", operationNames(),
                                        "description", "Operation to perform"),
                                "sessionId", Map.of(
                                        "type", "string",
                                        "description", "Session identifier"),
                                "projectName", Map.of(
                                        "type", "string",
                                        "description", "Project the session belongs to"),
                                "context", Map.of(
                                        "type", "object",
                                        "description", "Context to capture or enrich"),
                                "metadata", Map.of(
                                        "type", "object",
                                        "description", "Additional session metadata"),
                                "autoCleanup", Map.of(
                                        "type", "boolean",
                                        "description", "Archive expired sessions after capture (default: false)"),
                                "maxResults", Map.of(
                                        "type", "integer",
                                        "description", "Maximum sessions to list"),
                                "strategy", Map.of(
                                        "type", "string",
                                        "enum", List.of("timestamp", "smart_archive"),
                                        "description", "Cleanup strategy (default: timestamp)"),
                                "query", Map.of(
                                        "type", "string",
                                        "description", "Query for process_query_realtime")),
                        "required", List.of(OPERATION)))
                .build();
    }

    @Override
    protected ToolResult dispatch(Operation operation, Map<String, Object> parameters) {
        return switch (operation) {
        case CAPTURE_SESSION -> captureSession(parameters);
        case RESTORE_SESSION -> restoreSession(parameters);
        case LIST_ACTIVE_SESSIONS -> listActiveSessions(parameters);
        case CLEANUP_EXPIRED -> cleanupExpired(parameters);
        case INJECT_REALTIME_DATA -> pipelineResult(operation,
                contextPipelineService.injectRealtimeData(params.object(parameters, "context")));
        case PROCESS_QUERY_REALTIME -> pipelineResult(operation,
                contextPipelineService.processQuery(params.requireString(parameters, "query"),
                        params.object(parameters, "context")));
        };
    }

    private ToolResult captureSession(Map<String, Object> parameters) {
        String sessionId = params.requireString(parameters, "sessionId");
        String projectName = params.requireString(parameters, "projectName");
        ObjectNode context = params.object(parameters, "context");
        Map<String, Object> metadata = params.map(parameters, "metadata");

        if (Boolean.TRUE.equals(params.bool(parameters, "autoCleanup"))) {
            ContextRetrievalService.SmartCapture smart = contextRetrievalService.captureSessionSmart(sessionId,
                    projectName, context, metadata);
            Map<String, Object> data = params.toData(smart.capture());
            data.put("cleanup", params.toData(smart.cleanup()));
            return ToolResult.success("Captured session " + sessionId + ", archived "
                    + smart.cleanup().getCleaned() + " expired sessions", data);
        }

        CaptureAck ack = sessionStoreService.capture(sessionId, projectName, context, metadata);
        return ToolResult.success("Captured session " + ack.getSessionId(), params.toData(ack));
    }

    private ToolResult restoreSession(Map<String, Object> parameters) {
        SessionRecord record = sessionStoreService.restore(
                params.requireString(parameters, "sessionId"),
                params.string(parameters, "projectName"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session", params.toData(record));
        return ToolResult.success("Restored session " + record.getSessionId(), data);
    }

    private ToolResult listActiveSessions(Map<String, Object> parameters) {
        Integer maxResults = params.integer(parameters, "maxResults");
        SessionListing listing = sessionStoreService.listActive(
                params.string(parameters, "projectName"),
                maxResults != null ? maxResults : 0);

        Map<String, Object> data = params.toData(listing);
        data.put("returned", listing.getSessions().size());
        return ToolResult.success("Found " + listing.getTotal() + " sessions, returning "
                + listing.getSessions().size(), data);
    }

    private ToolResult cleanupExpired(Map<String, Object> parameters) {
        String strategyName = params.string(parameters, "strategy");
        CleanupStrategy strategy = null;
        if (strategyName != null && !strategyName.isBlank()) {
            strategy = CleanupStrategy.fromWireName(strategyName)
                    .orElseThrow(() -> RetrievalException.validation("Unknown cleanup strategy: " + strategyName
                            + ". Valid strategies: timestamp, smart_archive"));
        }
        CleanupResult result = sessionStoreService.cleanupExpired(strategy);

        return ToolResult.success("Cleaned " + result.getCleaned() + " expired sessions", params.toData(result));
    }

    private ToolResult pipelineResult(Operation operation, PipelineResult result) {
        Map<String, Object> data = params.toData(result);
        data.put(OPERATION, operation.getWireName());
        if (!result.isSuccess()) {
            return ToolResult.builder()
                    .success(false)
                    .error("Stage " + result.getFailedStage() + " failed: " + result.getError())
                    .data(data)
                    .build();
        }
        return ToolResult.success("Context processed", data);
    }
}
