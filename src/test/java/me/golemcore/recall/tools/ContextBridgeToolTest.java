package me.golemcore.recall.tools;

import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.domain.model.PipelineContext;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.pipeline.BoundingStage;
import me.golemcore.recall.domain.pipeline.CompressionStage;
import me.golemcore.recall.domain.pipeline.ContextPipelineService;
import me.golemcore.recall.domain.pipeline.LiveSignalInjectionStage;
import me.golemcore.recall.domain.pipeline.PipelineStage;
import me.golemcore.recall.domain.pipeline.RelevanceFilterStage;
import me.golemcore.recall.domain.service.ContextRetrievalService;
import me.golemcore.recall.domain.service.FreshnessScorer;
import me.golemcore.recall.domain.service.ProjectStateService;
import me.golemcore.recall.domain.service.SearchAggregatorService;
import me.golemcore.recall.domain.service.SessionStoreService;
import me.golemcore.recall.domain.signal.ContextMetricsSignal;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ContextBridgeToolTest {

    private static final String OPERATION = "operation";
    private static final String PROJECT = "p1";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MutableClock clock;
    private RecallProperties properties;
    private SessionStoreService sessionStoreService;
    private ContextRetrievalService contextRetrievalService;
    private ToolParameters params;
    private ContextBridgeTool tool;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        FreshnessScorer freshnessScorer = new FreshnessScorer();
        sessionStoreService = new SessionStoreService(storage, properties, freshnessScorer, objectMapper, clock);
        ProjectStateService projectStateService = new ProjectStateService(storage, properties, objectMapper, clock);
        SearchAggregatorService aggregator = new SearchAggregatorService(List.of(), freshnessScorer, properties,
                clock);
        contextRetrievalService = new ContextRetrievalService(sessionStoreService, projectStateService, aggregator);
        params = new ToolParameters(objectMapper);

        tool = newTool(new ArrayList<>());
    }

    @Test
    void shouldRejectUnknownOperation() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "explode"));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("capture_session"));
        assertEquals("explode", result.getData().get(OPERATION));
    }

    @Test
    void shouldRejectMissingOperation() throws Exception {
        ToolResult result = execute(Map.of());

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCaptureAndRestoreSession() throws Exception {
        ToolResult captured = execute(Map.of(OPERATION, "capture_session", "sessionId", "s1",
                "projectName", PROJECT, "context", Map.of("topic", "rag"), "metadata", Map.of("user", "u1")));

        assertTrue(captured.isSuccess());
        assertEquals("s1", captured.getData().get("sessionId"));
        assertNotNull(captured.getData().get("filePath"));

        ToolResult restored = execute(Map.of(OPERATION, "restore_session", "sessionId", "s1",
                "projectName", PROJECT));

        assertTrue(restored.isSuccess());
        Map<String, Object> session = (Map<String, Object>) restored.getData().get("session");
        assertEquals("rag", ((Map<String, Object>) session.get("context")).get("topic"));
        assertEquals("u1", ((Map<String, Object>) session.get("metadata")).get("user"));
    }

    @Test
    void shouldAcceptContextAsJsonString() throws Exception {
        ToolResult captured = execute(Map.of(OPERATION, "capture_session", "sessionId", "s1",
                "projectName", PROJECT, "context", "{\"topic\":\"json\"}"));

        assertTrue(captured.isSuccess());
        assertEquals("json", sessionStoreService.restore("s1", null).getContext().get("topic").asText());
    }

    @Test
    void shouldReportMissingSessionId() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "capture_session", "projectName", PROJECT));

        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertEquals("capture_session", result.getData().get(OPERATION));
    }

    @Test
    void shouldClassifyRestoreFailures() throws Exception {
        sessionStoreService.capture("s1", PROJECT, objectMapper.createObjectNode(), null);

        ToolResult mismatch = execute(Map.of(OPERATION, "restore_session", "sessionId", "s1",
                "projectName", "p2"));
        assertEquals(RetrievalErrorKind.PROJECT_MISMATCH, mismatch.getErrorKind());

        ToolResult missing = execute(Map.of(OPERATION, "restore_session", "sessionId", "nope"));
        assertEquals(RetrievalErrorKind.NOT_FOUND, missing.getErrorKind());
        assertEquals("restore_session", missing.getData().get(OPERATION));
    }

    @Test
    void shouldListActiveSessionsWithCap() throws Exception {
        for (String id : List.of("a", "b", "c")) {
            sessionStoreService.capture(id, PROJECT, objectMapper.createObjectNode(), null);
            clock.advance(Duration.ofMinutes(1));
        }

        ToolResult result = execute(Map.of(OPERATION, "list_active_sessions", "projectName", PROJECT,
                "maxResults", "2"));

        assertTrue(result.isSuccess());
        assertEquals(2, result.getData().get("returned"));
        assertEquals(3, result.getData().get("total"));
        assertEquals(2, ((List<?>) result.getData().get("sessions")).size());
    }

    @Test
    void shouldRejectUnknownCleanupStrategy() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "cleanup_expired", "strategy", "shred"));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("smart_archive"));
    }

    @Test
    void shouldCleanupWithSmartArchive() throws Exception {
        sessionStoreService.capture("old", PROJECT, objectMapper.createObjectNode(), null);
        clock.advance(Duration.ofHours(1));

        ToolResult result = execute(Map.of(OPERATION, "cleanup_expired", "strategy", "smart_archive"));

        assertTrue(result.isSuccess());
        assertEquals(1, result.getData().get("cleaned"));
        try (Stream<Path> archived = Files.list(tempDir.resolve("archive"))) {
            assertEquals(1, archived.count());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldArchiveExpiredSessionsOnAutoCleanupCapture() throws Exception {
        sessionStoreService.capture("old", PROJECT, objectMapper.createObjectNode(), null);
        clock.advance(Duration.ofHours(1));

        ToolResult result = execute(Map.of(OPERATION, "capture_session", "sessionId", "new",
                "projectName", PROJECT, "autoCleanup", true));

        assertTrue(result.isSuccess());
        assertEquals("new", result.getData().get("sessionId"));
        Map<String, Object> cleanup = (Map<String, Object>) result.getData().get("cleanup");
        assertEquals(1, cleanup.get("cleaned"));
        assertEquals("smart", sessionStoreService.restore("new", null).getMetadata().get("captureMode"));
        assertEquals(1, sessionStoreService.countActive());
    }

    @Test
    void shouldRequireQueryForRealtimeProcessing() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "process_query_realtime"));

        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldProcessQueryThroughPipeline() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "process_query_realtime", "query", "cache",
                "context", Map.of("topic", "cache")));

        assertTrue(result.isSuccess());
        assertEquals("process_query_realtime", result.getData().get(OPERATION));
        Map<String, Object> context = (Map<String, Object>) result.getData().get("context");
        assertEquals(1.0, ((Number) context.get(PipelineContext.RELEVANCE_KEY)).doubleValue(), 1e-9);
        assertNotNull(result.getData().get("tokenStats"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldInjectRealtimeData() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "inject_realtime_data"));

        assertTrue(result.isSuccess());
        Map<String, Object> context = (Map<String, Object>) result.getData().get("context");
        Map<String, Object> realTimeData = (Map<String, Object>) context.get(PipelineContext.REALTIME_KEY);
        assertTrue(((Map<String, Object>) realTimeData.get("sources")).containsKey("contextMetrics"));
    }

    @Test
    void shouldReportFailedStageWithoutErrorKind() throws Exception {
        List<PipelineStage> extra = new ArrayList<>();
        extra.add(new PipelineStage() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public int getOrder() {
                return 15;
            }

            @Override
            public PipelineContext process(PipelineContext context) {
                throw new IllegalStateException("no luck");
            }
        });
        tool = newTool(extra);

        ToolResult result = execute(Map.of(OPERATION, "process_query_realtime", "query", "cache"));

        assertFalse(result.isSuccess());
        assertNull(result.getErrorKind());
        assertEquals("Stage broken failed: no luck", result.getError());
        assertEquals(Boolean.FALSE, result.getData().get("success"));
        assertNotNull(result.getData().get("context"));
    }

    private ContextBridgeTool newTool(List<PipelineStage> extraStages) {
        List<PipelineStage> stages = new ArrayList<>(List.of(
                new LiveSignalInjectionStage(List.of(new ContextMetricsSignal(new FreshnessScorer(), clock)), clock),
                new RelevanceFilterStage(),
                new CompressionStage(properties),
                new BoundingStage()));
        stages.addAll(extraStages);
        ContextPipelineService pipeline = new ContextPipelineService(stages, clock);
        return new ContextBridgeTool(params, sessionStoreService, pipeline, contextRetrievalService);
    }

    private ToolResult execute(Map<String, Object> parameters) throws Exception {
        return tool.execute(new HashMap<>(parameters)).get(5, TimeUnit.SECONDS);
    }
}
