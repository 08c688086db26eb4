package me.golemcore.recall.domain.signal;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Source of live data injected into a context under
 * {@code realTimeData.sources.<name>}. Sources run in ascending order; a source
 * that throws is reported as {@code {"error": message}} without affecting the
 * others.
 */
public interface LiveSignalSource {

    /**
     * Key of this source inside {@code realTimeData.sources}.
     */
    String getName();

    int getOrder();

    /**
     * Collects the signal.
     *
     * @param context
     *            the caller's context before injection, read-only
     */
    ObjectNode collect(JsonNode context);
}
