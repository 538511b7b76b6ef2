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

import me.golemcore.history.domain.model.GroupBySpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Simple group-by used by aggregate queries without a window.
 *
 * <p>
 * Documents are grouped by the {@code "|"}-joined string form of all group-by
 * fields. Each group yields one row holding the group field values (taken from
 * the group's first document) and one {@code <field>_<aggregation>} column per
 * spec. Only numeric values feed sum/avg/min/max; an empty numeric set yields
 * 0. Rows keep the order in which groups were first seen.
 */
public final class GroupByAggregator {

    private static final String KEY_SEPARATOR = "|";

    private GroupByAggregator() {
    }

    public static List<Map<String, Object>> group(List<Map<String, Object>> documents, List<GroupBySpec> groupBy) {
        if (groupBy == null || groupBy.isEmpty()) {
            return documents;
        }

        Map<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> document : documents) {
            StringJoiner key = new StringJoiner(KEY_SEPARATOR);
            for (GroupBySpec spec : groupBy) {
                key.add(String.valueOf(FieldPathResolver.resolve(document, spec.getField())));
            }
            groups.computeIfAbsent(key.toString(), k -> new ArrayList<>()).add(document);
        }

        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        for (List<Map<String, Object>> members : groups.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (GroupBySpec spec : groupBy) {
                row.put(spec.getField(), FieldPathResolver.resolve(members.get(0), spec.getField()));
            }
            for (GroupBySpec spec : groupBy) {
                row.put(spec.getField() + "_" + spec.getAggregation().getCode(), aggregate(members, spec));
            }
            rows.add(row);
        }
        return rows;
    }

    private static Object aggregate(List<Map<String, Object>> members, GroupBySpec spec) {
        if (spec.getAggregation() == GroupBySpec.Aggregation.COUNT) {
            return (long) members.size();
        }
        List<Double> values = new ArrayList<>();
        for (Map<String, Object> member : members) {
            if (FieldPathResolver.resolve(member, spec.getField()) instanceof Number number) {
                values.add(number.doubleValue());
            }
        }
        if (values.isEmpty()) {
            return 0.0;
        }
        return switch (spec.getAggregation()) {
        case SUM -> values.stream().mapToDouble(Double::doubleValue).sum();
        case AVG -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        case MIN -> values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        case MAX -> values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        case COUNT -> (double) members.size();
        };
    }
}
