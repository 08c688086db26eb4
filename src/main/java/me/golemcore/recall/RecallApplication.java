package me.golemcore.recall;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Recall.
 *
 * <p>
 * Recall is a freshness-aware context retrieval engine: it caches session
 * snapshots, tracks project state and searches external backends, ranking
 * everything so that recently updated information comes first.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Session Cache</b> - atomic file-backed sessions with time-to-live
 * cleanup and freshness-ranked listing</li>
 * <li><b>Freshness Scoring</b> - exponential age decay with a recency boost
 * window</li>
 * <li><b>Multi-Source Search</b> - concurrent fan-out to a vector store and a
 * document store with per-backend failure isolation</li>
 * <li><b>Context Pipeline</b> - live signal injection, relevance annotation,
 * compression and token bounding</li>
 * <li><b>Project State</b> - current state with history and checkpoints</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → ToolsController, tool components
 * Domain Layer       → SessionStore, SearchAggregator, ContextPipeline, Services
 * Infrastructure     → Local storage, vector/document store HTTP adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code recall.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }

}
