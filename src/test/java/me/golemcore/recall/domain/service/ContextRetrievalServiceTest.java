package me.golemcore.recall.domain.service;

import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RelevantContext;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContextRetrievalServiceTest {

    private static final String PROJECT = "alpha";
    private static final String QUERY = "release checklist";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MutableClock clock;
    private SessionStoreService sessionStoreService;
    private ProjectStateService projectStateService;
    private SearchAggregatorService aggregator;
    private ContextRetrievalService service;

    @BeforeEach
    void setUp() {
        RecallProperties properties = new RecallProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        sessionStoreService = new SessionStoreService(storage, properties, new FreshnessScorer(), objectMapper,
                clock);
        projectStateService = new ProjectStateService(storage, properties, objectMapper, clock);
        aggregator = mock(SearchAggregatorService.class);
        when(aggregator.enabledBackends()).thenReturn(Set.of(BackendTag.VECTOR_STORE));
        when(aggregator.searchWithFreshness(anyString(), any())).thenReturn(RankedResult.builder()
                .query(QUERY)
                .totalResults(0)
                .build());
        service = new ContextRetrievalService(sessionStoreService, projectStateService, aggregator);
    }

    @Test
    void shouldCombineSessionsStateAndSearch() {
        sessionStoreService.capture("s1", PROJECT, objectMapper.createObjectNode(), null);
        sessionStoreService.capture("other", "beta", objectMapper.createObjectNode(), null);
        projectStateService.createProjectState(PROJECT, objectMapper.createObjectNode().put("phase", "qa"), null);

        RelevantContext context = service.getRelevantContext(PROJECT, QUERY, QueryConfig.builder().build());

        assertEquals(PROJECT, context.getProjectName());
        assertEquals(1, context.getTotalSessions());
        assertEquals("s1", context.getRelevantSessions().get(0).getSession().getSessionId());
        assertNotNull(context.getCurrentState());
        assertEquals("qa", context.getCurrentState().getState().get("phase").asText());
        assertEquals(QUERY, context.getSearchResults().getQuery());
    }

    @Test
    void shouldSearchOnlyEnabledTargets() {
        service.getRelevantContext(PROJECT, QUERY, QueryConfig.builder().build());

        ArgumentCaptor<QueryConfig> captor = ArgumentCaptor.forClass(QueryConfig.class);
        verify(aggregator).searchWithFreshness(eq(QUERY), captor.capture());
        assertEquals(Set.of(BackendTag.VECTOR_STORE), captor.getValue().getTargetBackends());
    }

    @Test
    void shouldSkipSearchWhenNoTargetIsEnabled() {
        when(aggregator.enabledBackends()).thenReturn(Set.of());

        RelevantContext context = service.getRelevantContext(PROJECT, QUERY,
                QueryConfig.builder().decayFactor(0.3).build());

        assertTrue(context.getSearchResults().getResults().isEmpty());
        assertEquals(0.3, context.getSearchResults().getDecayFactor(), 1e-9);
        verify(aggregator, never()).searchWithFreshness(anyString(), any());
    }

    @Test
    void shouldTolerateMissingProjectState() {
        RelevantContext context = service.getRelevantContext(PROJECT, QUERY, null);

        assertNull(context.getCurrentState());
        assertTrue(context.getRelevantSessions().isEmpty());
    }

    @Test
    void shouldReturnSessionsForProjectNameWithoutTrackableState() {
        sessionStoreService.capture("s1", "My Project", objectMapper.createObjectNode(), null);

        RelevantContext context = service.getRelevantContext("My Project", QUERY, null);

        assertNull(context.getCurrentState());
        assertEquals(1, context.getTotalSessions());
        assertEquals("s1", context.getRelevantSessions().get(0).getSession().getSessionId());
    }

    @Test
    void shouldValidateArguments() {
        RetrievalException noProject = assertThrows(RetrievalException.class,
                () -> service.getRelevantContext(" ", QUERY, null));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, noProject.getKind());

        RetrievalException badConfig = assertThrows(RetrievalException.class,
                () -> service.getRelevantContext(PROJECT, QUERY, QueryConfig.builder()
                        .targetBackends(EnumSet.noneOf(BackendTag.class)).build()));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, badConfig.getKind());
    }

    @Test
    void shouldTagSmartCaptureAndArchiveExpiredSessions() throws IOException {
        sessionStoreService.capture("old", PROJECT, objectMapper.createObjectNode(), null);
        clock.advance(Duration.ofMinutes(45));

        ContextRetrievalService.SmartCapture smart = service.captureSessionSmart("new", PROJECT,
                objectMapper.createObjectNode(), Map.of("user", "u1"));

        assertEquals("new", smart.capture().getSessionId());
        assertEquals(1, smart.cleanup().getCleaned());
        assertEquals("old", smart.cleanup().getSessions().get(0).getSessionId());
        assertEquals("archived", smart.cleanup().getSessions().get(0).getAction());

        Map<String, Object> metadata = sessionStoreService.restore("new", PROJECT).getMetadata();
        assertEquals("smart", metadata.get("captureMode"));
        assertEquals("u1", metadata.get("user"));
        try (Stream<Path> archived = Files.list(tempDir.resolve("archive"))) {
            assertEquals(1, archived.count());
        }
    }
}
