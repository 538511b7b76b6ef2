package me.golemcore.history.domain.service;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.history.domain.model.UsageDataPoint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves dot-separated field paths (e.g. {@code metadata.model}) against
 * points converted to their JSON document form.
 */
public class FieldPathResolver {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public FieldPathResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toDocument(UsageDataPoint point) {
        return objectMapper.convertValue(point, DOCUMENT_TYPE);
    }

    /**
     * Value at {@code path}, or null when any segment is missing or a
     * non-object is traversed.
     */
    public static Object resolve(Map<String, Object> document, String path) {
        if (document == null || path == null || path.isEmpty()) {
            return null;
        }
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Copy of the document reduced to the given paths. Nested paths are rebuilt
     * as nested maps; missing paths are omitted.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> project(Map<String, Object> document, List<String> paths) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String path : paths) {
            Object value = resolve(document, path);
            if (value == null) {
                continue;
            }
            String[] segments = path.split("\\.");
            Map<String, Object> target = projected;
            for (int i = 0; i < segments.length - 1; i++) {
                Object child = target.get(segments[i]);
                if (!(child instanceof Map)) {
                    child = new LinkedHashMap<String, Object>();
                    target.put(segments[i], child);
                }
                target = (Map<String, Object>) child;
            }
            target.put(segments[segments.length - 1], value);
        }
        return projected;
    }
}
