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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of conversational or project context captured under a session id.
 * The context payload is kept as a JSON tree and is not interpreted beyond size
 * and field heuristics. Instances handed to callers are copies; the session
 * store owns the persisted record.
 */
@Data
@Builder(toBuilder = true)
public class SessionRecord {

    private String sessionId;
    private String projectName;

    @Builder.Default
    private JsonNode context = JsonNodeFactory.instance.objectNode();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant capturedAt;

    /**
     * Storage-layer modification time of the session file.
     */
    private Instant lastAccessed;

    private String version;

    /**
     * Returns a detached copy so callers cannot mutate cached state.
     */
    public SessionRecord copy() {
        return toBuilder()
                .context(context != null ? context.deepCopy() : JsonNodeFactory.instance.objectNode())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }
}
