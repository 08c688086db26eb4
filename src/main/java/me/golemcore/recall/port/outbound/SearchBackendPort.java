package me.golemcore.recall.port.outbound;

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

import me.golemcore.recall.domain.model.BackendResult;
import me.golemcore.recall.domain.model.BackendTag;

import java.util.concurrent.CompletableFuture;

/**
 * Port for an external search backend. Each adapter turns a text query into its
 * backend's request shape and normalizes the response into
 * {@link me.golemcore.recall.domain.model.SearchResult}s.
 *
 * <p>
 * Implementations own their failure domain: transport errors, bad responses and
 * timeouts complete the future with a failed {@link BackendResult} instead of
 * completing it exceptionally. Retries, if any, are the adapter's concern.
 */
public interface SearchBackendPort {

    /**
     * Tag identifying this backend in aggregate results.
     */
    BackendTag getTag();

    /**
     * Query the backend.
     *
     * @param query
     *            free-text query
     * @param limit
     *            maximum number of results to return
     * @return normalized results, or a failed envelope
     */
    CompletableFuture<BackendResult> query(String query, int limit);

    /**
     * Whether the backend is configured and enabled.
     */
    boolean isEnabled();
}
