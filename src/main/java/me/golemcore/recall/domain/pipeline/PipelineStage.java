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

/**
 * One step of the context pipeline. Stages run in ascending {@link #getOrder()}
 * and each receives a detached copy of the previous stage's output, so a stage
 * may mutate its input freely.
 */
public interface PipelineStage {

    String getName();

    /**
     * Get the processing order (lower = earlier).
     */
    int getOrder();

    PipelineContext process(PipelineContext context);
}
