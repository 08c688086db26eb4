package me.golemcore.recall.tools;

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

import me.golemcore.recall.domain.model.BackendTag;
import me.golemcore.recall.domain.model.QueryConfig;
import me.golemcore.recall.domain.model.RetrievalException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed access to the flat parameter maps tools receive, plus conversion of
 * domain results into tool payloads. Missing or malformed values raise a
 * validation {@link RetrievalException}.
 */
@Component
@RequiredArgsConstructor
public class ToolParameters {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String string(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String stringValue) {
            return stringValue;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw RetrievalException.validation(key + " must be a string");
    }

    public String requireString(Map<String, Object> parameters, String key) {
        String value = string(parameters, key);
        if (value == null || value.isBlank()) {
            throw RetrievalException.validation("Missing required parameter: " + key);
        }
        return value;
    }

    public Integer integer(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw RetrievalException.validation(key + " must be an integer, got " + value);
        }
    }

    public Double decimal(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw RetrievalException.validation(key + " must be a number, got " + value);
        }
    }

    public Boolean bool(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean booleanValue) {
            return booleanValue;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw RetrievalException.validation(key + " must be a boolean, got " + value);
    }

    /**
     * Reads a JSON object given either as a nested map or as a JSON string.
     */
    public ObjectNode object(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        JsonNode node;
        if (value instanceof String json) {
            try {
                node = objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw RetrievalException.validation(key + " is not valid JSON: " + e.getOriginalMessage());
            }
        } else {
            node = objectMapper.valueToTree(value);
        }
        if (node instanceof ObjectNode objectNode) {
            return objectNode;
        }
        throw RetrievalException.validation(key + " must be a JSON object");
    }

    public Map<String, Object> map(Map<String, Object> parameters, String key) {
        ObjectNode node = object(parameters, key);
        return node != null ? objectMapper.convertValue(node, MAP_TYPE) : null;
    }

    /**
     * Reads a list of strings given as an array or a comma-separated string.
     */
    public List<String> stringList(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
            return result;
        }
        for (String part : value.toString().split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    /**
     * Parses backend wire names ({@code qdrant}, {@code mongodb}, {@code admin}
     * and their aliases), keeping request order.
     *
     * @return {@code defaults} when the parameter is absent
     */
    public Set<BackendTag> backends(Map<String, Object> parameters, String key, Set<BackendTag> defaults) {
        List<String> names = stringList(parameters, key);
        if (names == null) {
            return defaults;
        }
        Set<BackendTag> tags = new LinkedHashSet<>();
        for (String name : names) {
            tags.add(BackendTag.fromWireName(name)
                    .orElseThrow(() -> RetrievalException.validation("Unknown backend: " + name
                            + ". Known backends: qdrant, mongodb, admin")));
        }
        return tags;
    }

    /**
     * Builds a query configuration from {@code limit}, {@code decayFactor},
     * {@code priorityWindowHours}, {@code priorityBoost},
     * {@code freshnessEnabled} and {@code databases}.
     */
    public QueryConfig queryConfig(Map<String, Object> parameters, int defaultLimit, double defaultDecay,
            double defaultWindowHours, double defaultBoost, Set<BackendTag> defaultBackends) {
        Integer limit = integer(parameters, "limit");
        Double decayFactor = decimal(parameters, "decayFactor");
        Double windowHours = decimal(parameters, "priorityWindowHours");
        Double boost = decimal(parameters, "priorityBoost");
        Boolean freshness = bool(parameters, "freshnessEnabled");

        return QueryConfig.builder()
                .limit(limit != null ? limit : defaultLimit)
                .decayFactor(decayFactor != null ? decayFactor : defaultDecay)
                .priorityWindowHours(windowHours != null ? windowHours : defaultWindowHours)
                .priorityBoost(boost != null ? boost : defaultBoost)
                .freshnessEnabled(freshness == null || freshness)
                .targetBackends(backends(parameters, "databases", defaultBackends))
                .build()
                .validate();
    }

    /**
     * Converts a domain result into the plain map carried by
     * {@code ToolResult.data}.
     */
    public Map<String, Object> toData(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }
}
