package me.golemcore.recall.domain.pipeline;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Stage 4 (order=40): removes {@code realTimeData.timestamp}, which
 * {@code injectionTime} supersedes, and reports token counts as space-delimited
 * pieces of the serialized context.
 */
@Component
public class BoundingStage implements PipelineStage {

    public static final String NAME = "optimize_tokens";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 40;
    }

    @Override
    public PipelineContext process(PipelineContext pipelineContext) {
        ObjectNode context = pipelineContext.getContext();
        int originalTokens = countTokens(context);

        JsonNode realTimeData = context.get(PipelineContext.REALTIME_KEY);
        if (realTimeData instanceof ObjectNode realTimeObject) {
            realTimeObject.remove("timestamp");
        }

        int optimizedTokens = countTokens(context);
        pipelineContext.setTokenStats(PipelineContext.TokenStats.builder()
                .originalTokens(originalTokens)
                .optimizedTokens(optimizedTokens)
                .tokenReduction((double) (originalTokens - optimizedTokens) / originalTokens)
                .build());
        return pipelineContext;
    }

    static int countTokens(JsonNode node) {
        return node.toString().split(" ", -1).length;
    }
}
