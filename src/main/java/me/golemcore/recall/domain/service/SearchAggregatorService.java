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

import me.golemcore.recall.domain.model.AggregateResult;
import me.golemcore.recall.domain.model.BackendResult;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RankedResult;
import me.golemcore.recall.domain.model.RetrievalException;
import me.golemcore.recall.domain.model.SearchResult;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.SearchBackendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a query out to search backends concurrently and merges the answers.
 *
 * <p>
 * Every requested backend settles into a {@link BackendResult}: a backend that
 * fails, throws, times out or is not registered becomes a failed source and
 * never fails the aggregate. Calls are not retried.
 */
@Service
@Slf4j
public class SearchAggregatorService {

    private final Map<BackendTag, SearchBackendPort> backends = new EnumMap<>(BackendTag.class);
    private final FreshnessScorer freshnessScorer;
    private final RecallProperties properties;
    private final Clock clock;

    public SearchAggregatorService(List<SearchBackendPort> backendPorts, FreshnessScorer freshnessScorer,
            RecallProperties properties, Clock clock) {
        for (SearchBackendPort backend : backendPorts) {
            backends.put(backend.getTag(), backend);
        }
        this.freshnessScorer = freshnessScorer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Backends that are registered and enabled, in tag order.
     */
    public Set<BackendTag> enabledBackends() {
        Set<BackendTag> enabled = new LinkedHashSet<>();
        for (SearchBackendPort backend : backends.values()) {
            if (backend.isEnabled()) {
                enabled.add(backend.getTag());
            }
        }
        return enabled;
    }

    /**
     * Queries each requested backend once, concurrently, and waits for all of
     * them to settle.
     *
     * @param backendTags
     *            backends to query; iteration order becomes the order of
     *            {@link AggregateResult#getSources()}
     */
    public AggregateResult searchAll(String query, Collection<BackendTag> backendTags, int limit) {
        requireQuery(query);
        if (limit <= 0) {
            throw RetrievalException.validation("limit must be positive, got " + limit);
        }
        if (backendTags == null || backendTags.isEmpty()) {
            throw RetrievalException.validation("at least one backend is required");
        }

        Map<BackendTag, CompletableFuture<BackendResult>> calls = new LinkedHashMap<>();
        for (BackendTag tag : new LinkedHashSet<>(backendTags)) {
            calls.put(tag, queryBackend(tag, query, limit));
        }
        CompletableFuture.allOf(calls.values().toArray(new CompletableFuture[0])).join();

        Map<BackendTag, BackendResult> sources = new LinkedHashMap<>();
        calls.forEach((tag, call) -> sources.put(tag, call.join()));

        AggregateResult.Summary summary = AggregateResult.summarize(sources);
        log.info("[Search] '{}': {}/{} sources succeeded, {} results", query, summary.getSuccessfulSources(),
                summary.getTotalSources(), summary.getTotalResults());
        return AggregateResult.builder()
                .query(query)
                .sources(sources)
                .summary(summary)
                .build();
    }

    /**
     * Searches all target backends and re-ranks the combined hits by freshness.
     * The sort is stable: ties keep backend request order, then each backend's
     * own order.
     */
    public RankedResult searchWithFreshness(String query, QueryConfig config) {
        requireQuery(query);
        QueryConfig effective = (config != null ? config : QueryConfig.builder().build()).validate();
        AggregateResult aggregate = searchAll(query, effective.getTargetBackends(), effective.getLimit());
        Instant now = clock.instant();

        List<SearchResult> combined = new ArrayList<>();
        Map<BackendTag, Boolean> sourceStatus = new LinkedHashMap<>();
        Map<BackendTag, String> sourceErrors = new LinkedHashMap<>();
        for (BackendResult source : aggregate.getSources().values()) {
            sourceStatus.put(source.getBackend(), source.isSuccess());
            if (!source.isSuccess()) {
                sourceErrors.put(source.getBackend(), source.getError());
            }
            for (SearchResult result : source.getResults()) {
                double adjusted = effective.isFreshnessEnabled()
                        ? freshnessScorer.score(result.getBaseScore(), result.getObservedAt(), now,
                                effective.getDecayFactor(), effective.getPriorityWindowHours(),
                                effective.getPriorityBoost())
                        : result.getBaseScore();
                combined.add(result.toBuilder().adjustedScore(adjusted).build());
            }
        }

        combined.sort(Comparator.comparingDouble(SearchResult::getRankingScore).reversed());
        int total = combined.size();
        List<SearchResult> limited = new ArrayList<>(combined.subList(0, Math.min(effective.getLimit(), total)));

        return RankedResult.builder()
                .query(query)
                .results(limited)
                .totalResults(total)
                .freshnessApplied(effective.isFreshnessEnabled())
                .decayFactor(effective.getDecayFactor())
                .sourceStatus(sourceStatus)
                .sourceErrors(sourceErrors)
                .build();
    }

    private CompletableFuture<BackendResult> queryBackend(BackendTag tag, String query, int limit) {
        SearchBackendPort backend = backends.get(tag);
        if (backend == null) {
            return CompletableFuture.completedFuture(
                    BackendResult.failure(tag, "Backend not registered: " + tag.getWireName(), 0));
        }

        long started = System.currentTimeMillis();
        Duration timeout = properties.getSearch().getBackendTimeout();
        CompletableFuture<BackendResult> call;
        try {
            call = backend.query(query, limit);
        } catch (RuntimeException e) { // NOSONAR - a misbehaving adapter becomes a failed source
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.completedFuture(null);
        }

        return call.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    long elapsed = System.currentTimeMillis() - started;
                    if (error != null) {
                        String message = describe(error, timeout);
                        log.warn("[Search] Backend {} failed: {}", tag.getWireName(), message);
                        return BackendResult.failure(tag, message, elapsed);
                    }
                    if (result == null) {
                        return BackendResult.failure(tag, "Backend returned no result", elapsed);
                    }
                    return result;
                });
    }

    private static String describe(Throwable error, Duration timeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Timed out after " + timeout.toMillis() + "ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw RetrievalException.validation("query is required");
        }
    }
}
