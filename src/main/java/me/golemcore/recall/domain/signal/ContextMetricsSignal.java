package me.golemcore.recall.domain.signal;

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

import me.golemcore.recall.domain.model.PipelineContext;
import me.golemcore.recall.domain.service.FreshnessScorer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Quality metrics of the caller's context: session length, data freshness
 * class and the relevance score of a previous pipeline pass.
 */
@Component
@RequiredArgsConstructor
public class ContextMetricsSignal implements LiveSignalSource {

    static final String VERY_FRESH = "very-fresh";
    static final String FRESH = "fresh";
    static final String ACCEPTABLE = "acceptable";
    static final String STALE = "stale";
    static final String UNKNOWN = "unknown";

    private final FreshnessScorer freshnessScorer;
    private final Clock clock;

    @Override
    public String getName() {
        return "contextMetrics";
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public ObjectNode collect(JsonNode context) {
        JsonNode sessionLength = context != null ? context.get("sessionLength") : null;
        JsonNode relevance = context != null ? context.get(PipelineContext.RELEVANCE_KEY) : null;

        ObjectNode metrics = JsonNodeFactory.instance.objectNode();
        if (sessionLength != null && sessionLength.isNumber()) {
            metrics.set("avgSessionLength", sessionLength);
        } else {
            metrics.put("avgSessionLength", 0);
        }
        metrics.put("dataFreshness", classifyFreshness(context));
        metrics.put("relevancyScore", relevance != null && relevance.isNumber() ? relevance.asDouble() : 0.0);
        return metrics;
    }

    String classifyFreshness(JsonNode context) {
        Optional<Instant> timestamp = context != null
                ? freshnessScorer.parseTimestamp(context.get("timestamp"))
                : Optional.empty();
        if (timestamp.isEmpty()) {
            return UNKNOWN;
        }
        Duration age = Duration.between(timestamp.get(), clock.instant());
        if (age.compareTo(Duration.ofHours(1)) < 0) {
            return VERY_FRESH;
        }
        if (age.compareTo(Duration.ofHours(24)) < 0) {
            return FRESH;
        }
        if (age.compareTo(Duration.ofHours(48)) < 0) {
            return ACCEPTABLE;
        }
        return STALE;
    }
}
