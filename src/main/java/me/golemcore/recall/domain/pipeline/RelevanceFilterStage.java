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
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Stage 2 (order=20): annotates the context with {@code relevanceScore}, the
 * fraction of space-separated query words found in the serialized context.
 */
@Component
public class RelevanceFilterStage implements PipelineStage {

    public static final String NAME = "filter_by_relevance";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getOrder() {
        return 20;
    }

    @Override
    public PipelineContext process(PipelineContext pipelineContext) {
        String query = pipelineContext.getQuery();
        if (query == null || query.isEmpty()) {
            return pipelineContext;
        }

        String[] words = query.toLowerCase(Locale.ROOT).split(" ", -1);
        String serialized = pipelineContext.getContext().toString().toLowerCase(Locale.ROOT);
        int matched = 0;
        for (String word : words) {
            if (serialized.contains(word)) {
                matched++;
            }
        }

        pipelineContext.getContext().put(PipelineContext.RELEVANCE_KEY, (double) matched / words.length);
        return pipelineContext;
    }
}
