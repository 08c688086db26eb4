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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Regex/field backend over a document store's HTTP data API.
 *
 * <p>
 * Issues a {@code find} with a case-insensitive regex {@code $or} over the
 * configured fields (body, from, to by default). Every hit gets the same base
 * score; ranking between hits is left to freshness scoring.
 *
 * <p>
 * The query text is quoted so that it matches literally. With
 * {@code recall.search.document-store.raw-pattern=true} it is sent unchanged
 * and interpreted by the store as a regular expression.
 *
 * <p>
 * Endpoint: {@code POST {url}/action/find}
 */
@Component
@Slf4j
public class DocumentStoreAdapter implements SearchBackendPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Pattern REGEX_METACHARACTERS = Pattern.compile("[\\\\^$.|?*+()\\[\\]{}]");

    private final RecallProperties.DocumentStoreProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FreshnessScorer freshnessScorer;

    public DocumentStoreAdapter(RecallProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, FreshnessScorer freshnessScorer) {
        this.config = properties.getSearch().getDocumentStore();
        this.objectMapper = objectMapper;
        this.freshnessScorer = freshnessScorer;

        int timeoutSeconds = config.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public BackendTag getTag() {
        return BackendTag.DOCUMENT_STORE;
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
                    BackendResult.failure(getTag(), "Document store backend is disabled", 0));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                String body = objectMapper.writeValueAsString(buildFindRequest(query, limit));
                Request.Builder requestBuilder = new Request.Builder()
                        .url(config.getUrl() + "/action/find")
                        .post(RequestBody.create(body, JSON));
                addApiKeyHeader(requestBuilder);

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody responseBody = response.body();
                    long elapsed = System.currentTimeMillis() - started;
                    if (!response.isSuccessful() || responseBody == null) {
                        log.warn("[Search] Document store query failed: HTTP {}", response.code());
                        return BackendResult.failure(getTag(), "HTTP " + response.code(), elapsed);
                    }
                    List<SearchResult> results = parseDocuments(objectMapper.readTree(responseBody.string()));
                    log.debug("[Search] Document store returned {} hits in {}ms", results.size(), elapsed);
                    return BackendResult.success(getTag(), results, elapsed);
                }
            } catch (IOException e) {
                log.warn("[Search] Document store error: {}", e.getMessage());
                return BackendResult.failure(getTag(), e.getMessage(), System.currentTimeMillis() - started);
            }
        });
    }

    ObjectNode buildFindRequest(String query, int limit) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("dataSource", config.getDataSource());
        request.put("database", config.getDatabase());
        request.put("collection", config.getCollection());
        ArrayNode or = request.putObject("filter").putArray("$or");
        String pattern = config.isRawPattern() ? query : escapeRegex(query);
        for (String field : config.getFields()) {
            ObjectNode regex = or.addObject().putObject(field);
            regex.put("$regex", pattern);
            regex.put("$options", "i");
        }
        request.put("limit", limit);
        return request;
    }

    static String escapeRegex(String text) {
        return REGEX_METACHARACTERS.matcher(text).replaceAll("\\\\$0");
    }

    private List<SearchResult> parseDocuments(JsonNode root) {
        JsonNode documents = root.path("documents");
        List<SearchResult> results = new ArrayList<>();
        if (!documents.isArray()) {
            return results;
        }
        for (JsonNode document : documents) {
            ObjectNode payload = objectMapper.createObjectNode();
            copyField(document, "body", payload, "content");
            copyField(document, "from", payload, "from");
            copyField(document, "to", payload, "to");
            copyField(document, "timestamp", payload, "timestamp");
            copyField(document, "messageId", payload, "messageId");
            results.add(SearchResult.builder()
                    .id(documentId(document.path("_id")))
                    .sourceBackend(getTag())
                    .origin(config.getCollection())
                    .payload(payload)
                    .baseScore(config.getUniformScore())
                    .observedAt(freshnessScorer.observedAt(payload).orElse(null))
                    .build());
        }
        return results;
    }

    private void copyField(JsonNode document, String sourceField, ObjectNode payload, String targetField) {
        JsonNode value = document.get(sourceField);
        if (value == null) {
            payload.putNull(targetField);
        } else if (value.has("$date")) {
            payload.set(targetField, value.get("$date"));
        } else {
            payload.set(targetField, value);
        }
    }

    private String documentId(JsonNode id) {
        // Extended JSON wraps object ids as {"$oid": "..."}
        if (id.has("$oid")) {
            return id.get("$oid").asText();
        }
        return id.isMissingNode() || id.isNull() ? null : id.asText();
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
    }
}
