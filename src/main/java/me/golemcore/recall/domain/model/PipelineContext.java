package me.golemcore.recall.domain.model;

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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * State flowing through the context pipeline for one query. Each stage
 * receives the previous stage's output and returns its own.
 */
@Data
@Builder(toBuilder = true)
public class PipelineContext {

    /** Reserved key holding injected live signals. */
    public static final String REALTIME_KEY = "realTimeData";
    public static final String SOURCES_KEY = "sources";
    public static final String RELEVANCE_KEY = "relevanceScore";

    private String query;

    @Builder.Default
    private ObjectNode context = JsonNodeFactory.instance.objectNode();

    private Instant startedAt;

    private InjectionStats injectionStats;
    private CompressionStats compressionStats;
    private TokenStats tokenStats;

    /**
     * Copy with a detached context tree; stats objects are immutable in
     * practice and shared.
     */
    public PipelineContext copy() {
        return toBuilder()
                .context(context != null ? context.deepCopy() : JsonNodeFactory.instance.objectNode())
                .build();
    }

    @Data
    @Builder
    public static class InjectionStats {
        private int sourcesInjected;
        private int failedSources;
        private long injectionTimeMillis;
        private long dataSize;
    }

    @Data
    @Builder
    public static class CompressionStats {
        private long originalSize;
        private long compressedSize;
        private double targetReduction;
        private double actualReduction;
    }

    @Data
    @Builder
    public static class TokenStats {
        private int originalTokens;
        private int optimizedTokens;
        private double tokenReduction;
    }
}
