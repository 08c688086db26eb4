package me.golemcore.recall.tools;

import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RelevantContext;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.ContextRetrievalService;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SmartSearchToolTest {

    private static final String PROJECT = "alpha";
    private static final String QUERY = "release checklist";

    private ContextRetrievalService retrievalService;
    private SmartSearchTool tool;

    @BeforeEach
    void setUp() {
        retrievalService = mock(ContextRetrievalService.class);
        tool = new SmartSearchTool(new ToolParameters(AutoConfiguration.objectMapper()), retrievalService,
                new RecallProperties());
    }

    @Test
    void shouldMapMaxResultsToLimit() throws Exception {
        when(retrievalService.getRelevantContext(anyString(), anyString(), any())).thenReturn(context());

        ToolResult result = execute(Map.of("projectName", PROJECT, "query", QUERY, "maxResults", 3,
                "decayFactor", 0.2));

        assertTrue(result.isSuccess());
        assertEquals(PROJECT, result.getData().get("projectName"));
        ArgumentCaptor<QueryConfig> captor = ArgumentCaptor.forClass(QueryConfig.class);
        verify(retrievalService).getRelevantContext(eq(PROJECT), eq(QUERY), captor.capture());
        assertEquals(3, captor.getValue().getLimit());
        assertEquals(0.2, captor.getValue().getDecayFactor(), 1e-9);
        assertEquals(EnumSet.allOf(BackendTag.class), captor.getValue().getTargetBackends());
    }

    @Test
    void shouldUseConfiguredDefaults() throws Exception {
        when(retrievalService.getRelevantContext(anyString(), anyString(), any())).thenReturn(context());

        execute(Map.of("projectName", PROJECT, "query", QUERY));

        ArgumentCaptor<QueryConfig> captor = ArgumentCaptor.forClass(QueryConfig.class);
        verify(retrievalService).getRelevantContext(eq(PROJECT), eq(QUERY), captor.capture());
        assertEquals(10, captor.getValue().getLimit());
        assertEquals(1.5, captor.getValue().getPriorityBoost(), 1e-9);
        assertTrue(captor.getValue().isFreshnessEnabled());
    }

    @Test
    void shouldRequireProjectAndQuery() throws Exception {
        ToolResult missingProject = execute(Map.of("query", QUERY));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, missingProject.getErrorKind());
        assertNull(missingProject.getData().get("query"));

        ToolResult missingQuery = execute(Map.of("projectName", PROJECT));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, missingQuery.getErrorKind());
        assertEquals(PROJECT, missingQuery.getData().get("projectName"));
        verifyNoInteractions(retrievalService);
    }

    @Test
    void shouldPropagateRetrievalErrorKind() throws Exception {
        when(retrievalService.getRelevantContext(anyString(), anyString(), any()))
                .thenThrow(RetrievalException.storage("disk full", null));

        ToolResult result = execute(Map.of("projectName", PROJECT, "query", QUERY));

        assertEquals(RetrievalErrorKind.STORAGE_ERROR, result.getErrorKind());
        assertEquals("disk full", result.getError());
        assertEquals(QUERY, result.getData().get("query"));
    }

    @Test
    void shouldReportUnexpectedErrorAsBackendError() throws Exception {
        when(retrievalService.getRelevantContext(anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("socket closed"));

        ToolResult result = execute(Map.of("projectName", PROJECT, "query", QUERY));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.BACKEND_ERROR, result.getErrorKind());
    }

    private RelevantContext context() {
        return RelevantContext.builder()
                .projectName(PROJECT)
                .query(QUERY)
                .searchResults(RankedResult.builder().query(QUERY).build())
                .build();
    }

    private ToolResult execute(Map<String, Object> parameters) throws Exception {
        return tool.execute(parameters).get(5, TimeUnit.SECONDS);
    }
}
