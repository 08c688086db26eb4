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
 * Outcome of an expired-session sweep.
 */
@Data
@Builder
public class CleanupResult {

    private CleanupStrategy strategy;

    @Builder.Default
    private List<RemovedSession> sessions = new ArrayList<>();

    public int getCleaned() {
        return sessions.size();
    }

    /**
     * One session removed by the sweep.
     */
    @Data
    @Builder
    public static class RemovedSession {
        private String sessionId;
        private String action;
        private long ageMinutes;
    }
}
