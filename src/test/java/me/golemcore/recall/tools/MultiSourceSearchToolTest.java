package me.golemcore.recall.tools;

import me.golemcore.recall.domain.model.AggregateResult;
import me.golemcore.recall.domain.model.BackendResult;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.SearchResult;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.SearchAggregatorService;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MultiSourceSearchToolTest {

    private static final String OPERATION = "operation";
    private static final String QUERY = "deploy notes";

    private SearchAggregatorService aggregator;
    private MultiSourceSearchTool tool;

    @BeforeEach
    void setUp() {
        aggregator = mock(SearchAggregatorService.class);
        when(aggregator.enabledBackends()).thenReturn(Set.of(BackendTag.VECTOR_STORE));
        tool = new MultiSourceSearchTool(new ToolParameters(AutoConfiguration.objectMapper()), aggregator,
                new RecallProperties());
    }

    @Test
    void shouldDescribeOperations() {
        assertEquals("multi_source_search", tool.getToolName());
        assertTrue(tool.getDefinition().getInputSchema().toString().contains("search_with_freshness"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSearchRequestedBackendsInOrder() throws Exception {
        when(aggregator.searchAll(anyString(), any(), anyInt())).thenReturn(aggregate());

        ToolResult result = execute(Map.of(OPERATION, "search_all", "query", QUERY,
                "databases", List.of("mongodb", "qdrant"), "limit", 4));

        assertTrue(result.isSuccess());
        assertEquals("1 results from 1/2 sources", result.getOutput());
        ArgumentCaptor<Collection<BackendTag>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(aggregator).searchAll(eq(QUERY), captor.capture(), eq(4));
        assertEquals(List.of(BackendTag.DOCUMENT_STORE, BackendTag.VECTOR_STORE), List.copyOf(captor.getValue()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDefaultToEnabledBackends() throws Exception {
        when(aggregator.searchAll(anyString(), any(), anyInt())).thenReturn(aggregate());

        execute(Map.of(OPERATION, "search_all", "query", QUERY));

        ArgumentCaptor<Collection<BackendTag>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(aggregator).searchAll(eq(QUERY), captor.capture(), eq(10));
        assertEquals(Set.of(BackendTag.VECTOR_STORE), Set.copyOf(captor.getValue()));
    }

    @Test
    void shouldFallBackToAllBackendsWhenNoneEnabled() throws Exception {
        when(aggregator.enabledBackends()).thenReturn(Set.of());
        when(aggregator.searchWithFreshness(anyString(), any())).thenReturn(RankedResult.builder().build());

        execute(Map.of(OPERATION, "search_with_freshness", "query", QUERY));

        ArgumentCaptor<QueryConfig> captor = ArgumentCaptor.forClass(QueryConfig.class);
        verify(aggregator).searchWithFreshness(eq(QUERY), captor.capture());
        assertEquals(EnumSet.allOf(BackendTag.class), captor.getValue().getTargetBackends());
    }

    @Test
    void shouldPassFreshnessParameters() throws Exception {
        when(aggregator.searchWithFreshness(anyString(), any())).thenReturn(RankedResult.builder()
                .query(QUERY)
                .totalResults(0)
                .build());

        ToolResult result = execute(Map.of(OPERATION, "search_with_freshness", "query", QUERY,
                "limit", "3", "decayFactor", 0.25, "priorityWindowHours", 12, "priorityBoost", "2",
                "freshnessEnabled", "false", "databases", "admin"));

        assertTrue(result.isSuccess());
        ArgumentCaptor<QueryConfig> captor = ArgumentCaptor.forClass(QueryConfig.class);
        verify(aggregator).searchWithFreshness(eq(QUERY), captor.capture());
        QueryConfig config = captor.getValue();
        assertEquals(3, config.getLimit());
        assertEquals(0.25, config.getDecayFactor(), 1e-9);
        assertEquals(12.0, config.getPriorityWindowHours(), 1e-9);
        assertEquals(2.0, config.getPriorityBoost(), 1e-9);
        assertFalse(config.isFreshnessEnabled());
        assertEquals(Set.of(BackendTag.DOCUMENT_STORE), config.getTargetBackends());
    }

    @Test
    void shouldRejectUnknownBackend() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "search_all", "query", QUERY, "databases", "postgres"));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("postgres"));
        verify(aggregator, never()).searchAll(anyString(), any(), anyInt());
    }

    @Test
    void shouldRejectInvalidLimitAndMissingQuery() throws Exception {
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR,
                execute(Map.of(OPERATION, "search_all", "query", QUERY, "limit", 0)).getErrorKind());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR,
                execute(Map.of(OPERATION, "search_all")).getErrorKind());
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR,
                execute(Map.of(OPERATION, "search_all", "query", QUERY, "limit", "many")).getErrorKind());
    }

    @Test
    void shouldReportUnexpectedFailureAsBackendError() throws Exception {
        when(aggregator.searchAll(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("pool gone"));

        ToolResult result = execute(Map.of(OPERATION, "search_all", "query", QUERY));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.BACKEND_ERROR, result.getErrorKind());
        assertEquals("search_all", result.getData().get(OPERATION));
    }

    private AggregateResult aggregate() {
        Map<BackendTag, BackendResult> sources = new LinkedHashMap<>();
        sources.put(BackendTag.DOCUMENT_STORE, BackendResult.failure(BackendTag.DOCUMENT_STORE, "HTTP 500", 2));
        sources.put(BackendTag.VECTOR_STORE, BackendResult.success(BackendTag.VECTOR_STORE,
                List.of(SearchResult.builder()
                        .id("1")
                        .sourceBackend(BackendTag.VECTOR_STORE)
                        .baseScore(2.0)
                        .build()),
                3));
        return AggregateResult.builder()
                .query(QUERY)
                .sources(sources)
                .summary(AggregateResult.summarize(sources))
                .build();
    }

    private ToolResult execute(Map<String, Object> parameters) throws Exception {
        return tool.execute(parameters).get(5, TimeUnit.SECONDS);
    }
}
