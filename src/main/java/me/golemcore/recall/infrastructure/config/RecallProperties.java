package me.golemcore.recall.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the retrieval engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code recall.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location and directory names</li>
 * <li>{@link SessionsProperties} - session cache timeout, listing and decay</li>
 * <li>{@link SearchProperties} - freshness defaults and search backends</li>
 * <li>{@link PipelineProperties} - context pipeline tuning</li>
 * <li>{@link ProjectsProperties} - project state history</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "recall")
@Data
public class RecallProperties {

    private StorageProperties storage = new StorageProperties();
    private SessionsProperties sessions = new SessionsProperties();
    private SearchProperties search = new SearchProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private ProjectsProperties projects = new ProjectsProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/rag-state";
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class DirectoriesProperties {
        private String sessions = "context_cache";
        private String projects = "projects";
        private String archive = "archive";
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionsProperties {
        /** Sessions untouched for longer than this are removed by cleanup. */
        private Duration timeout = Duration.ofMinutes(30);

        /** Default cap for list_active_sessions. */
        private int maxActiveSessions = 5;

        private double decayFactor = 0.1;

        /** Strategy used when a cleanup request names none: timestamp or smart_archive. */
        private String defaultCleanupStrategy = "timestamp";
    }

    // ==================== SEARCH ====================

    @Data
    public static class SearchProperties {
        private int defaultLimit = 10;
        private double decayFactor = 0.1;
        private double priorityWindowHours = 48;
        private double priorityBoost = 1.5;

        /** Upper bound for a single backend call as seen by the aggregator. */
        private Duration backendTimeout = Duration.ofSeconds(10);

        private VectorStoreProperties vectorStore = new VectorStoreProperties();
        private DocumentStoreProperties documentStore = new DocumentStoreProperties();
    }

    @Data
    public static class VectorStoreProperties {
        private boolean enabled = true;
        private String url = "http://localhost:6333";
        private String apiKey;
        private List<String> collections = new ArrayList<>(
                List.of("boss-lessons-learned", "boss-development-docs"));
        private int maxScrollLimit = 50;
        private int timeoutSeconds = 5;
    }

    @Data
    public static class DocumentStoreProperties {
        private boolean enabled = false;
        private String url = "http://localhost:8081";
        private String apiKey;
        private String dataSource = "local";
        private String database = "admin";
        private String collection = "messages";
        private List<String> fields = new ArrayList<>(List.of("body", "from", "to"));
        private double uniformScore = 1.0;

        /** Send the query as a regex pattern instead of a quoted literal. */
        private boolean rawPattern = false;
        private int timeoutSeconds = 5;
    }

    // ==================== PIPELINE ====================

    @Data
    public static class PipelineProperties {
        /** Reported target reduction of the compression stage. */
        private double compressionTarget = 0.6;

        /** Active session count above which the load indicator reports "high". */
        private int highLoadSessionThreshold = 3;

        /** Zone for the business-hours indicator; blank means the system zone. */
        private String timeZone = "";

        private int businessHoursStart = 9;
        private int businessHoursEnd = 17;
    }

    // ==================== PROJECTS ====================

    @Data
    public static class ProjectsProperties {
        private int maxStateHistory = 10;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
