package me.golemcore.recall.adapter.outbound.search;

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

import me.golemcore.recall.domain.model.BackendResult;
import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.SearchResult;
import me.golemcore.recall.domain.service.FreshnessScorer;
import me.golemcore.recall.domain.service.TermOverlapScorer;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.SearchBackendPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Text-match backend over a vector store's scroll API.
 *
 * <p>
 * The store is used as a filtered document scan, not for similarity search:
 * every configured collection is scrolled with a full-text match on the
 * {@code content} payload field, and hits are scored locally by
 * {@link TermOverlapScorer}.
 *
 * <p>
 * Endpoint: {@code POST {url}/collections/{collection}/points/scroll}
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code recall.search.vector-store.enabled} - Enable/disable the backend
 * <li>{@code recall.search.vector-store.url} - Base URL
 * <li>{@code recall.search.vector-store.api-key} - Optional API key
 * <li>{@code recall.search.vector-store.collections} - Collections to scroll
 * <li>{@code recall.search.vector-store.timeout-seconds} - HTTP call timeout
 * </ul>
 */
@Component
@Slf4j
public class VectorStoreScrollAdapter implements SearchBackendPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final RecallProperties.VectorStoreProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TermOverlapScorer termOverlapScorer;
    private final FreshnessScorer freshnessScorer;

    public VectorStoreScrollAdapter(RecallProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, TermOverlapScorer termOverlapScorer, FreshnessScorer freshnessScorer) {
        this.config = properties.getSearch().getVectorStore();
        this.objectMapper = objectMapper;
        this.termOverlapScorer = termOverlapScorer;
        this.freshnessScorer = freshnessScorer;

        int timeoutSeconds = config.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public BackendTag getTag() {
        return BackendTag.VECTOR_STORE;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<BackendResult> query(String query, int limit) {
        long started = System.currentTimeMillis();
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(
                    BackendResult.failure(getTag(), "Vector store backend is disabled", 0));
        }

        return CompletableFuture.supplyAsync(() -> {
            List<SearchResult> merged = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (String collection : config.getCollections()) {
                try {
                    merged.addAll(scrollCollection(query, collection, limit));
                } catch (Exception e) { // NOSONAR - one collection must not fail the others
                    log.warn("[Search] Vector store collection {} failed: {}", collection, e.getMessage());
                    errors.add(collection + ": " + e.getMessage());
                }
            }

            long elapsed = System.currentTimeMillis() - started;
            if (!config.getCollections().isEmpty() && errors.size() == config.getCollections().size()) {
                return BackendResult.failure(getTag(), String.join("; ", errors), elapsed);
            }

            // List.sort is stable, so equal scores keep collection order
            merged.sort(Comparator.comparingDouble(SearchResult::getBaseScore).reversed());
            List<SearchResult> limited = merged.size() > limit ? merged.subList(0, limit) : merged;
            log.debug("[Search] Vector store returned {} of {} hits in {}ms", limited.size(), merged.size(),
                    elapsed);
            return BackendResult.success(getTag(), limited, elapsed);
        });
    }

    private List<SearchResult> scrollCollection(String query, String collection, int limit) throws IOException {
        String url = config.getUrl() + "/collections/" + collection + "/points/scroll";
        String body = objectMapper.writeValueAsString(buildScrollRequest(query, limit));

        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON));
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("HTTP " + response.code());
            }
            return parsePoints(query, collection, objectMapper.readTree(responseBody.string()));
        }
    }

    ObjectNode buildScrollRequest(String query, int limit) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("limit", Math.min(limit, config.getMaxScrollLimit()));
        request.put("with_payload", true);
        request.put("with_vector", false);
        ArrayNode must = request.putObject("filter").putArray("must");
        ObjectNode condition = must.addObject();
        condition.put("key", "content");
        condition.putObject("match").put("text", query);
        return request;
    }

    private List<SearchResult> parsePoints(String query, String collection, JsonNode root) {
        JsonNode points = root.path("result").path("points");
        List<SearchResult> results = new ArrayList<>();
        if (!points.isArray()) {
            return results;
        }
        for (JsonNode point : points) {
            JsonNode payload = point.path("payload");
            if (!payload.isObject()) {
                payload = objectMapper.createObjectNode();
            }
            results.add(SearchResult.builder()
                    .id(point.path("id").asText())
                    .sourceBackend(getTag())
                    .origin(collection)
                    .payload(payload)
                    .baseScore(termOverlapScorer.score(query, payload.path("content").asText("")))
                    .observedAt(freshnessScorer.observedAt(payload).orElse(null))
                    .build());
        }
        return results;
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
    }
}
