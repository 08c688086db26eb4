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
import me.golemcore.recall.domain.model.PipelineResult;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the ordered {@link PipelineStage}s over a caller-supplied context.
 *
 * <p>
 * The caller's context is never mutated. When a stage fails the run stops and
 * the result carries the failed stage, the error and the context produced by
 * the last stage that succeeded, together with the statistics gathered so far.
 */
@Service
@Slf4j
public class ContextPipelineService {

    private final List<PipelineStage> stages;
    private final Clock clock;

    public ContextPipelineService(List<PipelineStage> stages, Clock clock) {
        this.stages = stages.stream()
                .sorted(Comparator.comparingInt(PipelineStage::getOrder))
                .toList();
        this.clock = clock;
    }

    /**
     * Runs live-signal injection alone.
     */
    public PipelineResult injectRealtimeData(ObjectNode context) {
        List<PipelineStage> injection = stages.stream()
                .filter(stage -> LiveSignalInjectionStage.NAME.equals(stage.getName()))
                .toList();
        return run(null, context, injection);
    }

    /**
     * Runs every stage: injection, relevance, compression, bounding.
     */
    public PipelineResult processQuery(String query, ObjectNode context) {
        return run(query, context, stages);
    }

    List<PipelineStage> getStages() {
        return stages;
    }

    private PipelineResult run(String query, ObjectNode input, List<PipelineStage> toRun) {
        long startMillis = clock.millis();
        PipelineContext current = PipelineContext.builder()
                .query(query)
                .context(input != null ? input.deepCopy() : JsonNodeFactory.instance.objectNode())
                .startedAt(clock.instant())
                .build();

        for (PipelineStage stage : toRun) {
            long stageStart = clock.millis();
            try {
                PipelineContext next = stage.process(current.copy());
                if (next == null || next.getContext() == null) {
                    throw new IllegalStateException("Stage produced no context");
                }
                current = next;
                log.debug("[Pipeline] Stage '{}' completed in {}ms", stage.getName(), clock.millis() - stageStart);
            } catch (Exception e) { // NOSONAR - a failed stage ends the run with partial output
                log.warn("[Pipeline] Stage '{}' FAILED: {}", stage.getName(), e.getMessage());
                return toResult(current, startMillis)
                        .success(false)
                        .failedStage(stage.getName())
                        .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }

        return toResult(current, startMillis)
                .success(true)
                .build();
    }

    private PipelineResult.PipelineResultBuilder toResult(PipelineContext context, long startMillis) {
        return PipelineResult.builder()
                .query(context.getQuery())
                .context(context.getContext())
                .injectionStats(context.getInjectionStats())
                .compressionStats(context.getCompressionStats())
                .tokenStats(context.getTokenStats())
                .totalProcessingMillis(clock.millis() - startMillis)
                .timestamp(clock.instant());
    }
}
