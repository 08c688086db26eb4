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

import me.golemcore.recall.domain.model.Checkpoint;
import me.golemcore.recall.domain.model.CheckpointListing;
import me.golemcore.recall.domain.model.CheckpointSummary;
import me.golemcore.recall.domain.model.ProjectState;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.StoredObjectInfo;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Per-project state document with bounded history and timestamped checkpoints.
 *
 * <p>
 * Layout under the projects directory:
 * <ul>
 * <li>{@code <project>/current_state.json} - the current {@link ProjectState}</li>
 * <li>{@code <project>/checkpoint_<epochMs>_<rand>.json} - {@link Checkpoint}
 * snapshots</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectStateService {

    static final String CURRENT_STATE_FILE = "current_state.json";
    static final String CHECKPOINT_PREFIX = "checkpoint_";
    private static final String JSON_EXTENSION = ".json";
    private static final String RANDOM_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_SUFFIX_LENGTH = 9;
    private static final Pattern SAFE_PROJECT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final StoragePort storagePort;
    private final RecallProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ReentrantLock> projectLocks = new ConcurrentHashMap<>();

    public ProjectState createProjectState(String projectName, ObjectNode state, ObjectNode context) {
        validateProjectName(projectName);
        Instant now = clock.instant();
        ProjectState projectState = ProjectState.builder()
                .projectName(projectName)
                .state(state != null ? state.deepCopy() : JsonNodeFactory.instance.objectNode())
                .context(context != null ? context.deepCopy() : JsonNodeFactory.instance.objectNode())
                .created(now)
                .lastUpdated(now)
                .version(ProjectState.CURRENT_VERSION)
                .build();

        withProjectLock(projectName, () -> {
            write(currentStatePath(projectName), projectState);
            return null;
        });
        log.info("[ProjectState] Created state for project {}", projectName);
        return projectState;
    }

    public ProjectState getCurrentState(String projectName) {
        validateProjectName(projectName);
        return readCurrentState(projectName)
                .orElseThrow(() -> RetrievalException.notFound("No state for project: " + projectName));
    }

    /**
     * Shallow-merges {@code stateDelta} into the current state. The replaced
     * state is pushed to the front of the history, which is bounded by
     * {@code recall.projects.max-state-history}.
     */
    public ProjectState updateState(String projectName, ObjectNode stateDelta) {
        validateProjectName(projectName);
        if (stateDelta == null) {
            throw RetrievalException.validation("state is required");
        }

        ProjectState updated = withProjectLock(projectName, () -> {
            ProjectState current = readCurrentState(projectName)
                    .orElseThrow(() -> RetrievalException.notFound("No state for project: " + projectName));
            Instant now = clock.instant();

            List<ProjectState.HistoryEntry> history = new ArrayList<>();
            history.add(ProjectState.HistoryEntry.builder()
                    .state(current.getState().deepCopy())
                    .replacedAt(now)
                    .build());
            if (current.getHistory() != null) {
                history.addAll(current.getHistory());
            }
            int maxHistory = Math.max(0, properties.getProjects().getMaxStateHistory());
            if (history.size() > maxHistory) {
                history = new ArrayList<>(history.subList(0, maxHistory));
            }

            ObjectNode merged = current.getState().deepCopy();
            merged.setAll(stateDelta.deepCopy());
            current.setState(merged);
            current.setHistory(history);
            current.setLastUpdated(now);
            write(currentStatePath(projectName), current);
            return current;
        });
        log.debug("[ProjectState] Updated state for project {} ({} history entries)", projectName,
                updated.getHistory().size());
        return updated;
    }

    public Checkpoint createCheckpoint(String projectName, ObjectNode context) {
        ProjectState current = getCurrentState(projectName);
        Instant now = clock.instant();
        String checkpointId = CHECKPOINT_PREFIX + now.toEpochMilli() + "_" + randomSuffix();

        Checkpoint checkpoint = Checkpoint.builder()
                .checkpointId(checkpointId)
                .projectName(projectName)
                .state(current.getState().deepCopy())
                .context(context != null ? context.deepCopy() : current.getContext().deepCopy())
                .stateVersion(current.getVersion())
                .createdAt(now)
                .build();
        write(projectName + "/" + checkpointId + JSON_EXTENSION, checkpoint);
        log.info("[ProjectState] Created checkpoint {} for project {}", checkpointId, projectName);
        return checkpoint;
    }

    /**
     * Lists checkpoints newest first, capped at
     * {@code recall.projects.max-state-history}. Unreadable checkpoint files are
     * skipped.
     */
    public CheckpointListing listCheckpoints(String projectName) {
        validateProjectName(projectName);
        List<String> files;
        try {
            files = storagePort.listObjects(projectsDirectory(), projectName).join();
        } catch (CompletionException e) {
            throw RetrievalException.storage("Failed to list checkpoints of " + projectName + ": "
                    + SessionStoreService.rootMessage(e), e);
        }

        List<CheckpointSummary> summaries = new ArrayList<>();
        for (String file : files) {
            String name = file.substring(file.lastIndexOf('/') + 1);
            if (!name.startsWith(CHECKPOINT_PREFIX) || !name.endsWith(JSON_EXTENSION)) {
                continue;
            }
            readCheckpointSummary(file).ifPresent(summaries::add);
        }
        summaries.sort(Comparator.comparing(CheckpointSummary::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));

        int limit = Math.min(summaries.size(), properties.getProjects().getMaxStateHistory());
        return CheckpointListing.builder()
                .projectName(projectName)
                .checkpoints(new ArrayList<>(summaries.subList(0, limit)))
                .total(summaries.size())
                .build();
    }

    private Optional<CheckpointSummary> readCheckpointSummary(String file) {
        try {
            String json = storagePort.getText(projectsDirectory(), file).join();
            StoredObjectInfo info = storagePort.stat(projectsDirectory(), file).join();
            if (json == null || json.isBlank() || info == null) {
                log.warn("[ProjectState] Skipping empty checkpoint file: {}", file);
                return Optional.empty();
            }
            Checkpoint checkpoint = objectMapper.readValue(json, Checkpoint.class);
            return Optional.of(CheckpointSummary.builder()
                    .checkpointId(checkpoint.getCheckpointId())
                    .createdAt(checkpoint.getCreatedAt())
                    .size(info.size())
                    .file(file)
                    .build());
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[ProjectState] Skipping unreadable checkpoint file: {} - {}", file,
                    SessionStoreService.rootMessage(e));
            return Optional.empty();
        }
    }

    private Optional<ProjectState> readCurrentState(String projectName) {
        String json;
        try {
            json = storagePort.getText(projectsDirectory(), currentStatePath(projectName)).join();
        } catch (CompletionException e) {
            throw RetrievalException.storage("Failed to read state of " + projectName + ": "
                    + SessionStoreService.rootMessage(e), e);
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ProjectState.class));
        } catch (JsonProcessingException e) {
            throw RetrievalException.storage("Project state file is corrupt: " + projectName, e);
        }
    }

    private void write(String path, Object value) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            storagePort.putTextAtomic(projectsDirectory(), path, json).join();
        } catch (JsonProcessingException e) {
            throw RetrievalException.validation("Project payload is not serializable: " + e.getOriginalMessage());
        } catch (CompletionException e) {
            throw RetrievalException.storage("Failed to write " + path + ": " + SessionStoreService.rootMessage(e),
                    e);
        }
    }

    private <T> T withProjectLock(String projectName, Supplier<T> action) {
        ReentrantLock lock = projectLocks.computeIfAbsent(projectName, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a project name can have tracked state. Sessions accept any
     * non-blank project name; state files need a safe directory name.
     */
    public boolean isTrackableName(String projectName) {
        return projectName != null && SAFE_PROJECT_NAME.matcher(projectName).matches();
    }

    private void validateProjectName(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            throw RetrievalException.validation("projectName is required");
        }
        if (!isTrackableName(projectName)) {
            throw RetrievalException.validation("projectName contains unsupported characters: " + projectName);
        }
    }

    private String currentStatePath(String projectName) {
        return projectName + "/" + CURRENT_STATE_FILE;
    }

    private String projectsDirectory() {
        return properties.getStorage().getDirectories().getProjects();
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(RANDOM_SUFFIX_LENGTH);
        for (int i = 0; i < RANDOM_SUFFIX_LENGTH; i++) {
            suffix.append(RANDOM_ALPHABET.charAt(random.nextInt(RANDOM_ALPHABET.length())));
        }
        return suffix.toString();
    }
}
