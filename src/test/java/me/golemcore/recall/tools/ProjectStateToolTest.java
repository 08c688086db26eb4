package me.golemcore.recall.tools;

import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.service.ProjectStateService;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProjectStateToolTest {

    private static final String OPERATION = "operation";
    private static final String PROJECT = "alpha";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ProjectStateTool tool;

    @BeforeEach
    void setUp() {
        RecallProperties properties = new RecallProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        ProjectStateService service = new ProjectStateService(storage, properties, objectMapper, clock);
        tool = new ProjectStateTool(new ToolParameters(objectMapper), service);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCreateUpdateAndReadState() throws Exception {
        ToolResult created = execute(Map.of(OPERATION, "create_project_state", "projectName", PROJECT,
                "state", Map.of("phase", "design", "owner", "team")));
        assertTrue(created.isSuccess());

        clock.advance(Duration.ofMinutes(1));
        ToolResult updated = execute(Map.of(OPERATION, "update_state", "projectName", PROJECT,
                "state", "{\"phase\":\"build\"}"));
        assertTrue(updated.isSuccess());

        ToolResult current = execute(Map.of(OPERATION, "get_current_state", "projectName", PROJECT));
        Map<String, Object> state = (Map<String, Object>) current.getData().get("state");
        Map<String, Object> fields = (Map<String, Object>) state.get("state");
        assertEquals("build", fields.get("phase"));
        assertEquals("team", fields.get("owner"));
        assertEquals(1, ((List<?>) state.get("history")).size());
        assertEquals("2.0.0", state.get("version"));
    }

    @Test
    void shouldRequireStateForUpdate() throws Exception {
        execute(Map.of(OPERATION, "create_project_state", "projectName", PROJECT));

        ToolResult result = execute(Map.of(OPERATION, "update_state", "projectName", PROJECT));

        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertEquals("update_state", result.getData().get(OPERATION));
    }

    @Test
    void shouldReportMissingProjectAsNotFound() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "get_current_state", "projectName", "ghost"));

        assertFalse(result.isSuccess());
        assertEquals(RetrievalErrorKind.NOT_FOUND, result.getErrorKind());
    }

    @Test
    void shouldRequireProjectName() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "list_checkpoints"));

        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
    }

    @Test
    void shouldCreateAndListCheckpoints() throws Exception {
        execute(Map.of(OPERATION, "create_project_state", "projectName", PROJECT,
                "state", Map.of("phase", "design")));

        ToolResult checkpoint = execute(Map.of(OPERATION, "create_checkpoint", "projectName", PROJECT,
                "context", Map.of("note", "before refactor")));
        assertTrue(checkpoint.isSuccess());
        String checkpointId = (String) checkpoint.getData().get("checkpointId");
        assertTrue(checkpointId.startsWith("checkpoint_"));

        ToolResult listing = execute(Map.of(OPERATION, "list_checkpoints", "projectName", PROJECT));
        assertTrue(listing.isSuccess());
        assertEquals(1, listing.getData().get("total"));
        List<?> checkpoints = (List<?>) listing.getData().get("checkpoints");
        assertEquals(checkpointId, ((Map<?, ?>) checkpoints.get(0)).get("checkpointId"));
    }

    @Test
    void shouldRejectNonObjectState() throws Exception {
        ToolResult result = execute(Map.of(OPERATION, "create_project_state", "projectName", PROJECT,
                "state", "[1,2]"));

        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, result.getErrorKind());
    }

    private ToolResult execute(Map<String, Object> parameters) throws Exception {
        return tool.execute(parameters).get(5, TimeUnit.SECONDS);
    }
}
