package me.golemcore.orchestrator.security;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Strips credential-like fields from outgoing response bodies.
 *
 * <p>
 * A key is sensitive when, ignoring case, it equals one of
 * {@code password, token, secret, key, authorization, jwt}, or ends with one of
 * them after a {@code _} or {@code -} separator (e.g. {@code api_key},
 * {@code access-token}). Nested maps, lists and Jackson trees are walked
 * recursively. The input is never modified.
 */
@Component
@RequiredArgsConstructor
public class ResponseSanitizer {

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
            "password", "token", "secret", "key", "authorization", "jwt");

    private final ObjectMapper objectMapper;

    public Map<String, Object> sanitize(Map<String, ?> body) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (body == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : body.entrySet()) {
            if (!isSensitive(entry.getKey())) {
                result.put(entry.getKey(), sanitizeValue(entry.getValue()));
            }
        }
        return result;
    }

    /**
     * Convert a JSON object into a sanitized map, e.g. for an agent payload.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> sanitize(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return sanitize(objectMapper.convertValue(node, Map.class));
    }

    static boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        if (SENSITIVE_FIELDS.contains(normalized)) {
            return true;
        }
        for (String field : SENSITIVE_FIELDS) {
            if (normalized.endsWith("_" + field) || normalized.endsWith("-" + field)) {
                return true;
            }
        }
        return false;
    }

    private Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!isSensitive(key)) {
                    nested.put(key, sanitizeValue(entry.getValue()));
                }
            }
            return nested;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        if (value instanceof JsonNode node) {
            return sanitizeNode(node.deepCopy());
        }
        return value;
    }

    private JsonNode sanitizeNode(JsonNode node) {
        if (node instanceof ObjectNode objectNode) {
            Iterator<Map.Entry<String, JsonNode>> fields = objectNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isSensitive(field.getKey())) {
                    fields.remove();
                } else {
                    sanitizeNode(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode arrayNode) {
            for (JsonNode item : arrayNode) {
                sanitizeNode(item);
            }
        }
        return node;
    }
}
