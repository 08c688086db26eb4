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
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable per-request search configuration.
 *
 * <p>
 * Defaults: {@code limit=10}, {@code decayFactor=0.1},
 * {@code priorityWindowHours=48}, {@code priorityBoost=1.5}, freshness enabled,
 * every backend targeted.
 */
@Value
@Builder(toBuilder = true)
public class QueryConfig {

    public static final int DEFAULT_LIMIT = 10;
    public static final double DEFAULT_DECAY_FACTOR = 0.1;
    public static final double DEFAULT_PRIORITY_WINDOW_HOURS = 48;
    public static final double DEFAULT_PRIORITY_BOOST = 1.5;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    @Builder.Default
    double decayFactor = DEFAULT_DECAY_FACTOR;

    @Builder.Default
    double priorityWindowHours = DEFAULT_PRIORITY_WINDOW_HOURS;

    @Builder.Default
    double priorityBoost = DEFAULT_PRIORITY_BOOST;

    @Builder.Default
    boolean freshnessEnabled = true;

    @Builder.Default
    Set<BackendTag> targetBackends = EnumSet.allOf(BackendTag.class);

    /**
     * Validates the configuration, throwing a
     * {@link RetrievalErrorKind#VALIDATION_ERROR} on the first bad field.
     *
     * @return this instance, for chaining
     */
    public QueryConfig validate() {
        if (limit <= 0) {
            throw RetrievalException.validation("limit must be positive, got " + limit);
        }
        if (!Double.isFinite(decayFactor) || decayFactor < 0) {
            throw RetrievalException.validation("decayFactor must be >= 0, got " + decayFactor);
        }
        if (!Double.isFinite(priorityWindowHours)) {
            throw RetrievalException.validation("priorityWindowHours must be a finite number, got "
                    + priorityWindowHours);
        }
        if (!Double.isFinite(priorityBoost) || priorityBoost < 1.0) {
            throw RetrievalException.validation("priorityBoost must be >= 1, got " + priorityBoost);
        }
        if (targetBackends == null || targetBackends.isEmpty()) {
            throw RetrievalException.validation("at least one target backend is required");
        }
        return this;
    }
}
