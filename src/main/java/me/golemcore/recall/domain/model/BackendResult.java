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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-backend response envelope: {@code {success, results, error}}. A failed
 * backend is represented by an instance with {@code success=false}, never by
 * an exception.
 */
@Data
@Builder
public class BackendResult {

    private BackendTag backend;

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;

    @Builder.Default
    private List<SearchResult> results = new ArrayList<>();

    private String error;
    private long elapsedMillis;

    public int getCount() {
        return results != null ? results.size() : 0;
    }

    public static BackendResult success(BackendTag backend, List<SearchResult> results, long elapsedMillis) {
        return BackendResult.builder()
                .backend(backend)
                .success(true)
                .results(new ArrayList<>(results))
                .elapsedMillis(elapsedMillis)
                .build();
    }

    public static BackendResult failure(BackendTag backend, String error, long elapsedMillis) {
        return BackendResult.builder()
                .backend(backend)
                .success(false)
                .error(error)
                .elapsedMillis(elapsedMillis)
                .build();
    }
}
