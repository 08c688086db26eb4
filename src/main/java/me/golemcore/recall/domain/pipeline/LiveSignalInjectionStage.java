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
import me.golemcore.recall.domain.signal.LiveSignalSource;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Stage 1 (order=10): injects live signals under {@code realTimeData}.
 *
 * <pre>
 * realTimeData: { timestamp, injectionTime, sources: { serviceStatus, sessionActivity, contextMetrics } }
 * lastInjection, enhancementVersion
 * </pre>
 */
@Component
@Slf4j
public class LiveSignalInjectionStage implements PipelineStage {

    public static final String NAME = "inject_live_data";
    static final String ENHANCEMENT_VERSION = "1.0";

    private final List<LiveSignalSource> sources;
    private final Clock clock;

    public LiveSignalInjectionStage(List<LiveSignalSource> sources, Clock clock) {
        this.sources = sources.stream()
                .sorted(Comparator.comparingInt(LiveSignalSource::getOrder))
                .toList();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public PipelineContext process(PipelineContext pipelineContext) {
        long startMillis = clock.millis();
        ObjectNode context = pipelineContext.getContext();
        ObjectNode original = context.deepCopy();

        ObjectNode realTimeData = JsonNodeFactory.instance.objectNode();
        realTimeData.put("timestamp", startMillis);
        realTimeData.put("injectionTime", clock.instant().toString());
        ObjectNode collected = realTimeData.putObject(PipelineContext.SOURCES_KEY);

        int failed = 0;
        for (LiveSignalSource source : sources) {
            try {
                collected.set(source.getName(), source.collect(original));
            } catch (Exception e) { // NOSONAR - a failing source is reported in place
                log.warn("[Pipeline] Live signal '{}' failed: {}", source.getName(), e.getMessage());
                collected.putObject(source.getName()).put("error", String.valueOf(e.getMessage()));
                failed++;
            }
        }

        context.set(PipelineContext.REALTIME_KEY, realTimeData);
        context.put("lastInjection", clock.millis());
        context.put("enhancementVersion", ENHANCEMENT_VERSION);

        pipelineContext.setInjectionStats(PipelineContext.InjectionStats.builder()
                .sourcesInjected(collected.size())
                .failedSources(failed)
                .injectionTimeMillis(clock.millis() - startMillis)
                .dataSize(realTimeData.toString().getBytes(StandardCharsets.UTF_8).length)
                .build());
        return pipelineContext;
    }
}
