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

import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.CaptureAck;
import me.golemcore.recall.domain.model.CleanupResult;
import me.golemcore.recall.domain.model.CleanupStrategy;
import me.golemcore.recall.domain.model.ProjectState;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RelevantContext;
import me.golemcore.recall.domain.model.RetrievalErrorKind;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.SessionListing;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Answers a project-scoped query from every store at once: the project's
 * freshest sessions, its current state and freshness-ranked backend hits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextRetrievalService {

    private final SessionStoreService sessionStoreService;
    private final ProjectStateService projectStateService;
    private final SearchAggregatorService searchAggregatorService;

    public RelevantContext getRelevantContext(String projectName, String query, QueryConfig config) {
        if (projectName == null || projectName.isBlank()) {
            throw RetrievalException.validation("projectName is required");
        }
        if (query == null || query.isBlank()) {
            throw RetrievalException.validation("query is required");
        }
        QueryConfig effective = (config != null ? config : QueryConfig.builder().build()).validate();

        SessionListing sessions = sessionStoreService.listActive(projectName, 0);
        ProjectState currentState = findCurrentState(projectName);
        RankedResult searchResults = search(query, effective);

        log.info("[Retrieval] '{}' in {}: {} sessions, state={}, {} hits", query, projectName,
                sessions.getSessions().size(), currentState != null, searchResults.getResults().size());
        return RelevantContext.builder()
                .projectName(projectName)
                .query(query)
                .relevantSessions(sessions.getSessions())
                .totalSessions(sessions.getTotal())
                .currentState(currentState)
                .searchResults(searchResults)
                .build();
    }

    /**
     * Captures a session tagged with {@code captureMode=smart}, then archives
     * every expired one.
     */
    public SmartCapture captureSessionSmart(String sessionId, String projectName, JsonNode context,
            Map<String, Object> metadata) {
        Map<String, Object> tagged = new LinkedHashMap<>();
        if (metadata != null) {
            tagged.putAll(metadata);
        }
        tagged.put("captureMode", "smart");
        CaptureAck ack = sessionStoreService.capture(sessionId, projectName, context, tagged);
        CleanupResult cleanup = sessionStoreService.cleanupExpired(CleanupStrategy.ARCHIVE_THEN_DELETE);
        return new SmartCapture(ack, cleanup);
    }

    private ProjectState findCurrentState(String projectName) {
        if (!projectStateService.isTrackableName(projectName)) {
            log.debug("[Retrieval] Project {} cannot have tracked state", projectName);
            return null;
        }
        try {
            return projectStateService.getCurrentState(projectName);
        } catch (RetrievalException e) {
            if (e.getKind() != RetrievalErrorKind.NOT_FOUND) {
                throw e;
            }
            log.debug("[Retrieval] No tracked state for project {}", projectName);
            return null;
        }
    }

    /**
     * Searches the requested backends that are enabled; with none enabled the
     * search is skipped rather than reported as failed sources.
     */
    private RankedResult search(String query, QueryConfig config) {
        Set<BackendTag> targets = new LinkedHashSet<>(config.getTargetBackends());
        targets.retainAll(searchAggregatorService.enabledBackends());
        if (targets.isEmpty()) {
            log.debug("[Retrieval] No enabled backend among {}, skipping search", config.getTargetBackends());
            return RankedResult.builder()
                    .query(query)
                    .freshnessApplied(config.isFreshnessEnabled())
                    .decayFactor(config.getDecayFactor())
                    .build();
        }
        return searchAggregatorService.searchWithFreshness(query, config.toBuilder().targetBackends(targets).build());
    }

    public record SmartCapture(CaptureAck capture, CleanupResult cleanup) {
    }
}
