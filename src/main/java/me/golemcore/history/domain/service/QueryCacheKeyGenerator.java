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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the cache and statistics key of a query.
 *
 * <p>
 * Filters are sorted by field (on a copy), options normalized so that absent
 * sort/select become {@code []} and an absent time range {@code {}}. The JSON
 * rendering is folded with a 31-based 32-bit string hash and printed in base
 * 36. The key therefore ignores filter order but not sort or select order.
 */
public class QueryCacheKeyGenerator {

    private static final int RADIX = 36;

    private final ObjectMapper objectMapper;

    public QueryCacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String keyFor(List<QueryFilter> filters, QueryOptions options) {
        List<QueryFilter> sortedFilters = new ArrayList<>(filters);
        sortedFilters.sort(Comparator.comparing(f -> f.getField() != null ? f.getField() : ""));

        QueryOptions opts = options != null ? options : QueryOptions.none();
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("sort", opts.sortOrEmpty());
        normalized.put("limit", opts.getLimit());
        normalized.put("skip", opts.getSkip());
        normalized.put("select", opts.selectOrEmpty());
        normalized.put("timeRange", opts.getTimeRange() != null ? opts.getTimeRange() : Map.of());

        Map<String, Object> keyObject = new LinkedHashMap<>();
        keyObject.put("filters", sortedFilters);
        keyObject.put("options", normalized);

        try {
            return Integer.toString(hash(objectMapper.writeValueAsString(keyObject)), RADIX);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    static int hash(String text) {
        int hash = 0;
        for (int i = 0; i < text.length(); i++) {
            hash = (hash << 5) - hash + text.charAt(i);
        }
        return hash;
    }
}
