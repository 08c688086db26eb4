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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Envelope returned by every tool operation: {@code success} plus either a
 * payload in {@code data} or an {@code error}. Classified retrieval failures
 * also carry their {@code errorKind}. Operations never throw past this
 * envelope.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Map<String, Object> data;
    private String error;
    private RetrievalErrorKind errorKind;

    /**
     * Creates a successful result with a short summary and structured payload.
     */
    public static ToolResult success(String output, Map<String, Object> data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed result classified by {@code kind}.
     */
    public static ToolResult failure(RetrievalErrorKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .errorKind(kind)
                .error(error)
                .build();
    }

    /**
     * Creates a failed result that echoes request context (operation, ids) back
     * to the caller.
     */
    public static ToolResult failure(RetrievalErrorKind kind, String error, Map<String, Object> data) {
        return ToolResult.builder()
                .success(false)
                .errorKind(kind)
                .error(error)
                .data(data)
                .build();
    }
}
