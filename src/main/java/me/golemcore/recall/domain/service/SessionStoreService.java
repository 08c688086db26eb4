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

import me.golemcore.recall.domain.model.CaptureAck;
import me.golemcore.recall.domain.model.CleanupResult;
import me.golemcore.recall.domain.model.CleanupStrategy;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.ScoredSession;
import me.golemcore.recall.domain.model.SessionListing;
import me.golemcore.recall.domain.model.SessionRecord;
import me.golemcore.recall.domain.model.StoredObjectInfo;
import me.golemcore.recall.domain.model.StoredSession;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Session cache with time-to-live eviction and freshness-ranked listing.
 *
 * <p>
 * Each session lives in {@code context_cache/<sessionId>.json}. The file's
 * modification time is the session's {@code lastAccessed}: it is set on capture
 * and refreshed on restore, and {@link #cleanupExpired} removes every session
 * whose age exceeds {@code recall.sessions.timeout}.
 *
 * <p>
 * Capture, restore and removal of the same session id are serialized through a
 * striped lock; together with atomic file replacement this guarantees that a
 * reader sees either the previous record, the new record or "not found".
 */
@Service
@Slf4j
public class SessionStoreService {

    private static final String JSON_EXTENSION = ".json";
    private static final int LOCK_STRIPES = 64;
    private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:@-]{0,199}");

    private final StoragePort storagePort;
    private final RecallProperties properties;
    private final FreshnessScorer freshnessScorer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public SessionStoreService(StoragePort storagePort, RecallProperties properties,
            FreshnessScorer freshnessScorer, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.freshnessScorer = freshnessScorer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Writes a session, replacing any record with the same id (last writer
     * wins).
     */
    public CaptureAck capture(String sessionId, String projectName, JsonNode context, Map<String, Object> metadata) {
        validateSessionId(sessionId);
        if (projectName == null || projectName.isBlank()) {
            throw RetrievalException.validation("projectName is required");
        }

        Instant now = clock.instant();
        StoredSession stored = StoredSession.builder()
                .sessionId(sessionId)
                .projectName(projectName)
                .context(context != null ? context.deepCopy() : JsonNodeFactory.instance.objectNode())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .captureTime(now.toString())
                .timestamp(now.toEpochMilli())
                .version(StoredSession.CURRENT_VERSION)
                .build();

        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw RetrievalException.validation("Session payload is not serializable: " + e.getOriginalMessage());
        }

        String file = fileName(sessionId);
        withLock(sessionId, () -> {
            try {
                storagePort.putTextAtomic(sessionsDirectory(), file, json).join();
                storagePort.setLastModified(sessionsDirectory(), file, now).join();
            } catch (CompletionException | IllegalArgumentException e) {
                throw RetrievalException.storage("Failed to write session " + sessionId + ": " + rootMessage(e), e);
            }
            return null;
        });

        log.info("[SessionStore] Captured session {} (project={}, {} bytes)", sessionId, projectName, json.length());
        return CaptureAck.builder()
                .sessionId(sessionId)
                .projectName(projectName)
                .filePath(storagePort.resolveLocation(sessionsDirectory(), file))
                .size(json.getBytes(StandardCharsets.UTF_8).length)
                .capturedAt(now)
                .build();
    }

    /**
     * Loads a session and refreshes its last-access time.
     *
     * @param projectName
     *            when non-blank, must equal the stored project exactly
     */
    public SessionRecord restore(String sessionId, String projectName) {
        validateSessionId(sessionId);
        String file = fileName(sessionId);

        return withLock(sessionId, () -> {
            String json = readSessionFile(file);
            if (json == null || json.isBlank()) {
                throw RetrievalException.notFound("Session not found: " + sessionId);
            }

            StoredSession stored = parse(json)
                    .orElseThrow(() -> new RetrievalException(RetrievalErrorKind.STORAGE_ERROR,
                            "Session file is corrupt: " + sessionId));

            if (projectName != null && !projectName.isBlank() && !projectName.equals(stored.getProjectName())) {
                throw new RetrievalException(RetrievalErrorKind.PROJECT_MISMATCH,
                        "Session project mismatch: expected " + projectName + ", got " + stored.getProjectName());
            }

            Instant now = clock.instant();
            try {
                storagePort.setLastModified(sessionsDirectory(), file, now).join();
            } catch (CompletionException e) {
                log.warn("[SessionStore] Failed to refresh access time of {}: {}", sessionId, rootMessage(e));
            }
            log.debug("[SessionStore] Restored session {}", sessionId);
            return toRecord(stored, sessionId, now);
        });
    }

    /**
     * Lists sessions ranked by freshness of their last access. Empty and corrupt
     * files are skipped with a warning instead of failing the listing.
     *
     * @param projectName
     *            exact project filter; {@code null} or blank lists all projects
     * @param maxResults
     *            cap on returned sessions; non-positive falls back to
     *            {@code recall.sessions.max-active-sessions}
     */
    public SessionListing listActive(String projectName, int maxResults) {
        int cap = maxResults > 0 ? maxResults : properties.getSessions().getMaxActiveSessions();
        double decayFactor = properties.getSessions().getDecayFactor();
        Instant now = clock.instant();

        List<ScoredSession> scored = new ArrayList<>();
        int skipped = 0;
        for (String file : listSessionFiles()) {
            String sessionId = sessionIdFromFile(file);
            Optional<StoredObjectInfo> info = statQuietly(file);
            if (info.isEmpty()) {
                continue;
            }
            if (info.get().size() == 0) {
                log.warn("[SessionStore] Skipping empty session file: {}", file);
                skipped++;
                continue;
            }

            String json;
            try {
                json = readSessionFile(file);
            } catch (RetrievalException e) {
                log.warn("[SessionStore] Skipping unreadable session file: {} - {}", file, e.getMessage());
                skipped++;
                continue;
            }
            if (json == null) {
                continue;
            }

            Optional<StoredSession> stored = parse(json);
            if (stored.isEmpty()) {
                log.warn("[SessionStore] Skipping corrupted session file: {}", file);
                skipped++;
                continue;
            }

            SessionRecord record = toRecord(stored.get(), sessionId, info.get().lastModified());
            if (projectName != null && !projectName.isBlank() && !projectName.equals(record.getProjectName())) {
                continue;
            }

            double score = freshnessScorer.decayOnly(1.0, record.getLastAccessed(), now, decayFactor);
            scored.add(ScoredSession.builder()
                    .session(record)
                    .relevanceScore(score)
                    .sizeBytes(info.get().size())
                    .build());
        }

        scored.sort(Comparator.comparingDouble(ScoredSession::getRelevanceScore).reversed()
                .thenComparing(s -> s.getSession().getSessionId()));

        int total = scored.size();
        return SessionListing.builder()
                .sessions(new ArrayList<>(scored.subList(0, Math.min(cap, total))))
                .total(total)
                .skipped(skipped)
                .build();
    }

    /**
     * Removes every session whose last access is older than the configured
     * timeout. Sessions within the timeout are not touched.
     */
    public CleanupResult cleanupExpired(CleanupStrategy strategy) {
        CleanupStrategy effective = strategy != null ? strategy : defaultStrategy();
        Duration timeout = properties.getSessions().getTimeout();
        Instant now = clock.instant();

        List<CleanupResult.RemovedSession> removed = new ArrayList<>();
        for (String file : listSessionFiles()) {
            String sessionId = sessionIdFromFile(file);
            withLock(sessionId, () -> {
                removeIfExpired(file, sessionId, effective, timeout, now).ifPresent(removed::add);
                return null;
            });
        }

        if (!removed.isEmpty()) {
            log.info("[SessionStore] Cleanup ({}) removed {} expired sessions", effective.getWireName(),
                    removed.size());
        }
        return CleanupResult.builder()
                .strategy(effective)
                .sessions(removed)
                .build();
    }

    /**
     * Number of stored sessions, regardless of age.
     */
    public int countActive() {
        return listSessionFiles().size();
    }

    private Optional<CleanupResult.RemovedSession> removeIfExpired(String file, String sessionId,
            CleanupStrategy strategy, Duration timeout, Instant now) {
        Optional<StoredObjectInfo> info = statQuietly(file);
        if (info.isEmpty()) {
            return Optional.empty();
        }

        long ageMillis = now.toEpochMilli() - info.get().lastModified().toEpochMilli();
        if (ageMillis <= timeout.toMillis()) {
            return Optional.empty();
        }

        try {
            if (strategy == CleanupStrategy.ARCHIVE_THEN_DELETE) {
                String archived = sessionId + "_" + now.toEpochMilli() + JSON_EXTENSION;
                storagePort.copyObject(sessionsDirectory(), file, archiveDirectory(), archived).join();
            }
            storagePort.deleteObject(sessionsDirectory(), file).join();
        } catch (CompletionException e) {
            log.warn("[SessionStore] Failed to remove expired session {}: {}", sessionId, rootMessage(e));
            return Optional.empty();
        }

        return Optional.of(CleanupResult.RemovedSession.builder()
                .sessionId(sessionId)
                .action(strategy.getAction())
                .ageMinutes(Math.round(ageMillis / 60000.0))
                .build());
    }

    private CleanupStrategy defaultStrategy() {
        String configured = properties.getSessions().getDefaultCleanupStrategy();
        return CleanupStrategy.fromWireName(configured).orElse(CleanupStrategy.HARD_DELETE);
    }

    private List<String> listSessionFiles() {
        try {
            return storagePort.listObjects(sessionsDirectory(), "").join().stream()
                    .filter(file -> file.endsWith(JSON_EXTENSION) && !file.contains("/"))
                    .toList();
        } catch (CompletionException e) {
            throw RetrievalException.storage("Failed to list sessions: " + rootMessage(e), e);
        }
    }

    private String readSessionFile(String file) {
        try {
            return storagePort.getText(sessionsDirectory(), file).join();
        } catch (CompletionException e) {
            throw RetrievalException.storage("Failed to read " + file + ": " + rootMessage(e), e);
        }
    }

    private Optional<StoredObjectInfo> statQuietly(String file) {
        try {
            return Optional.ofNullable(storagePort.stat(sessionsDirectory(), file).join());
        } catch (CompletionException e) {
            log.warn("[SessionStore] Failed to stat {}: {}", file, rootMessage(e));
            return Optional.empty();
        }
    }

    private Optional<StoredSession> parse(String json) {
        try {
            StoredSession stored = objectMapper.readValue(json, StoredSession.class);
            return Optional.ofNullable(stored);
        } catch (JsonProcessingException e) {
            log.debug("[SessionStore] Failed to parse session JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private SessionRecord toRecord(StoredSession stored, String fallbackId, Instant lastAccessed) {
        Instant capturedAt = freshnessScorer.parseTimestamp(stored.getCaptureTime())
                .or(() -> Optional.ofNullable(stored.getTimestamp()).map(Instant::ofEpochMilli))
                .orElse(null);
        return SessionRecord.builder()
                .sessionId(stored.getSessionId() != null ? stored.getSessionId() : fallbackId)
                .projectName(stored.getProjectName())
                .context(stored.getContext() != null ? stored.getContext() : JsonNodeFactory.instance.objectNode())
                .metadata(stored.getMetadata() != null ? stored.getMetadata() : new LinkedHashMap<>())
                .capturedAt(capturedAt)
                .lastAccessed(lastAccessed)
                .version(stored.getVersion())
                .build();
    }

    private <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw RetrievalException.validation("sessionId is required");
        }
        if (!SAFE_SESSION_ID.matcher(sessionId).matches()) {
            throw RetrievalException.validation("sessionId contains unsupported characters: " + sessionId);
        }
    }

    private String fileName(String sessionId) {
        return sessionId + JSON_EXTENSION;
    }

    private String sessionIdFromFile(String file) {
        return file.substring(0, file.length() - JSON_EXTENSION.length());
    }

    private String sessionsDirectory() {
        return properties.getStorage().getDirectories().getSessions();
    }

    private String archiveDirectory() {
        return properties.getStorage().getDirectories().getArchive();
    }

    static String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
