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

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of a pipeline run. On failure {@code context} holds the output of the
 * last stage that succeeded, so callers can degrade instead of losing the turn.
 */
@Data
@Builder
public class PipelineResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;

    private String query;
    private ObjectNode context;

    private PipelineContext.InjectionStats injectionStats;
    private PipelineContext.CompressionStats compressionStats;
    private PipelineContext.TokenStats tokenStats;

    private String failedStage;
    private String error;

    private long totalProcessingMillis;
    private Instant timestamp;
}
