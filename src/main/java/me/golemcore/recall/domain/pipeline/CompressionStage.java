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
import me.golemcore.recall.infrastructure.config.RecallProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Stage 3 (order=30): drops live signal sources that only carry an error.
 * Sizes are UTF-8 bytes of the serialized context.
 */
@Component
@RequiredArgsConstructor
public class CompressionStage implements PipelineStage {

    public static final String NAME = "compress_context";

    private final RecallProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 30;
    }

    @Override
    public PipelineContext process(PipelineContext pipelineContext) {
        ObjectNode context = pipelineContext.getContext();
        long originalSize = sizeOf(context);

        JsonNode sources = context.path(PipelineContext.REALTIME_KEY).path(PipelineContext.SOURCES_KEY);
        if (sources.isObject()) {
            List<String> failed = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = sources.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().has("error")) {
                    failed.add(field.getKey());
                }
            }
            ((ObjectNode) sources).remove(failed);
        }

        long compressedSize = sizeOf(context);
        pipelineContext.setCompressionStats(PipelineContext.CompressionStats.builder()
                .originalSize(originalSize)
                .compressedSize(compressedSize)
                .targetReduction(properties.getPipeline().getCompressionTarget())
                .actualReduction(originalSize == 0 ? 0.0 : (double) (originalSize - compressedSize) / originalSize)
                .build());
        return pipelineContext;
    }

    private static long sizeOf(JsonNode node) {
        return node.toString().getBytes(StandardCharsets.UTF_8).length;
    }
}
