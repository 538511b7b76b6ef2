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

import me.golemcore.history.domain.model.SortSpec;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Multi-key comparator over point documents. Keys are applied in order, each
 * with its own direction; ties on every key keep their input order since
 * {@link List#sort} is stable.
 *
 * <p>
 * Two numbers compare numerically and two strings lexically. Any other pair
 * compares by string form, with null rendered as {@code "null"}.
 */
public final class ResultSorter {

    private ResultSorter() {
    }

    public static void sort(List<Map<String, Object>> documents, List<SortSpec> sort) {
        if (sort == null || sort.isEmpty() || documents.size() < 2) {
            return;
        }
        documents.sort(comparator(sort));
    }

    public static Comparator<Map<String, Object>> comparator(List<SortSpec> sort) {
        return (left, right) -> {
            for (SortSpec spec : sort) {
                int result = compareValues(FieldPathResolver.resolve(left, spec.getField()),
                        FieldPathResolver.resolve(right, spec.getField()));
                if (result != 0) {
                    return spec.getDirection() == SortSpec.Direction.DESC ? -result : result;
                }
            }
            return 0;
        };
    }

    static int compareValues(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }
}
