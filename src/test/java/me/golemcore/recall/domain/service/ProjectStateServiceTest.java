package me.golemcore.recall.domain.service;

import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.domain.model.Checkpoint;
import me.golemcore.recall.domain.model.CheckpointListing;
import me.golemcore.recall.domain.model.ProjectState;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.infrastructure.config.AutoConfiguration;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ProjectStateServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final String PROJECT = "alpha";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private MutableClock clock;
    private RecallProperties properties;
    private ProjectStateService service;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        clock = new MutableClock(T0);
        service = new ProjectStateService(storage, properties, objectMapper, clock);
    }

    @Test
    void shouldCreateAndReadCurrentState() {
        service.createProjectState(PROJECT, state("phase", "design"), state("owner", "team"));

        ProjectState current = service.getCurrentState(PROJECT);

        assertEquals(PROJECT, current.getProjectName());
        assertEquals("design", current.getState().get("phase").asText());
        assertEquals("team", current.getContext().get("owner").asText());
        assertEquals(T0, current.getCreated());
        assertEquals(T0, current.getLastUpdated());
        assertEquals("2.0.0", current.getVersion());
        assertTrue(current.getHistory().isEmpty());
        assertTrue(Files.exists(tempDir.resolve("projects").resolve(PROJECT).resolve("current_state.json")));
    }

    @Test
    void shouldFailWithNotFoundWhenProjectHasNoState() {
        RetrievalException ex = assertThrows(RetrievalException.class, () -> service.getCurrentState("ghost"));
        assertEquals(RetrievalErrorKind.NOT_FOUND, ex.getKind());

        RetrievalException update = assertThrows(RetrievalException.class,
                () -> service.updateState("ghost", state("a", "b")));
        assertEquals(RetrievalErrorKind.NOT_FOUND, update.getKind());
    }

    @Test
    void shouldRejectTraversalInProjectName() {
        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> service.createProjectState("../outside", null, null));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, ex.getKind());
    }

    @Test
    void shouldReportTrackableProjectNames() {
        assertTrue(service.isTrackableName("alpha-1.2_x"));
        assertFalse(service.isTrackableName("My Project"));
        assertFalse(service.isTrackableName("../outside"));
        assertFalse(service.isTrackableName(""));
        assertFalse(service.isTrackableName(null));
    }

    @Test
    void shouldMergeUpdateAndRecordHistory() {
        ObjectNode initial = state("phase", "design");
        initial.put("owner", "team");
        service.createProjectState(PROJECT, initial, null);
        clock.advance(Duration.ofMinutes(5));

        ProjectState updated = service.updateState(PROJECT, state("phase", "build"));

        assertEquals("build", updated.getState().get("phase").asText());
        assertEquals("team", updated.getState().get("owner").asText());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.getLastUpdated());
        assertEquals(T0, updated.getCreated());
        assertEquals(1, updated.getHistory().size());
        assertEquals("design", updated.getHistory().get(0).getState().get("phase").asText());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.getHistory().get(0).getReplacedAt());

        assertEquals(updated.getState(), service.getCurrentState(PROJECT).getState());
    }

    @Test
    void shouldBoundHistoryNewestFirst() {
        properties.getProjects().setMaxStateHistory(3);
        service.createProjectState(PROJECT, state("step", "0"), null);

        for (int i = 1; i <= 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            service.updateState(PROJECT, state("step", String.valueOf(i)));
        }

        ProjectState current = service.getCurrentState(PROJECT);
        assertEquals("5", current.getState().get("step").asText());
        assertEquals(3, current.getHistory().size());
        assertEquals("4", current.getHistory().get(0).getState().get("step").asText());
        assertEquals("2", current.getHistory().get(2).getState().get("step").asText());
    }

    @Test
    void shouldRequireStateForUpdate() {
        service.createProjectState(PROJECT, null, null);

        RetrievalException ex = assertThrows(RetrievalException.class, () -> service.updateState(PROJECT, null));
        assertEquals(RetrievalErrorKind.VALIDATION_ERROR, ex.getKind());
    }

    @Test
    void shouldSnapshotStateIntoCheckpoint() {
        service.createProjectState(PROJECT, state("phase", "design"), state("owner", "team"));

        Checkpoint checkpoint = service.createCheckpoint(PROJECT, null);

        assertTrue(checkpoint.getCheckpointId().matches("checkpoint_" + T0.toEpochMilli() + "_[0-9a-z]{9}"));
        assertEquals("design", checkpoint.getState().get("phase").asText());
        assertEquals("team", checkpoint.getContext().get("owner").asText());
        assertEquals("2.0.0", checkpoint.getStateVersion());
        assertTrue(Files.exists(tempDir.resolve("projects").resolve(PROJECT)
                .resolve(checkpoint.getCheckpointId() + ".json")));

        Checkpoint withContext = service.createCheckpoint(PROJECT, state("note", "explicit"));
        assertEquals("explicit", withContext.getContext().get("note").asText());
    }

    @Test
    void shouldNotCheckpointMissingProject() {
        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> service.createCheckpoint("ghost", null));
        assertEquals(RetrievalErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void shouldListCheckpointsNewestFirstAndSkipBrokenFiles() throws IOException {
        service.createProjectState(PROJECT, state("phase", "design"), null);
        Checkpoint first = service.createCheckpoint(PROJECT, null);
        clock.advance(Duration.ofMinutes(1));
        Checkpoint second = service.createCheckpoint(PROJECT, null);
        Files.writeString(tempDir.resolve("projects").resolve(PROJECT).resolve("checkpoint_0_broken.json"),
                "{oops");

        CheckpointListing listing = service.listCheckpoints(PROJECT);

        assertEquals(PROJECT, listing.getProjectName());
        assertEquals(2, listing.getTotal());
        assertEquals(second.getCheckpointId(), listing.getCheckpoints().get(0).getCheckpointId());
        assertEquals(first.getCheckpointId(), listing.getCheckpoints().get(1).getCheckpointId());
        assertTrue(listing.getCheckpoints().get(0).getSize() > 0);
        assertEquals(PROJECT + "/" + second.getCheckpointId() + ".json", listing.getCheckpoints().get(0).getFile());
    }

    @Test
    void shouldCapCheckpointListing() {
        properties.getProjects().setMaxStateHistory(2);
        service.createProjectState(PROJECT, null, null);
        for (int i = 0; i < 4; i++) {
            service.createCheckpoint(PROJECT, null);
            clock.advance(Duration.ofSeconds(1));
        }

        CheckpointListing listing = service.listCheckpoints(PROJECT);

        assertEquals(2, listing.getCheckpoints().size());
        assertEquals(4, listing.getTotal());
        assertEquals(T0.plus(Duration.ofSeconds(3)), listing.getCheckpoints().get(0).getCreatedAt());
    }

    @Test
    void shouldReturnEmptyListingForUnknownProject() {
        CheckpointListing listing = service.listCheckpoints("nobody");

        assertTrue(listing.getCheckpoints().isEmpty());
        assertEquals(0, listing.getTotal());
    }

    private ObjectNode state(String key, String value) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(key, value);
        return node;
    }
}
