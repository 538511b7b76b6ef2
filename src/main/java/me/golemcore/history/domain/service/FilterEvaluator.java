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

import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.QueryFilter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Evaluates {@link QueryFilter}s against point documents. A list of filters
 * matches when every filter matches.
 *
 * <p>
 * Numbers are compared by numeric value, so {@code 5} equals {@code 5.0}.
 * Ordering operators and {@code between} only match numeric fields.
 * {@code regex} only matches string fields and uses find semantics.
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
    }

    public static boolean matchesAll(Map<String, Object> document, List<QueryFilter> filters) {
        for (QueryFilter filter : filters) {
            if (!matches(document, filter)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws java.util.regex.PatternSyntaxException
     *             if a regex filter holds an invalid pattern
     */
    public static boolean matches(Map<String, Object> document, QueryFilter filter) {
        Object fieldValue = FieldPathResolver.resolve(document, filter.getField());
        Object value = filter.getValue();
        FilterOperator operator = filter.getOperator() != null ? filter.getOperator() : FilterOperator.UNKNOWN;

        return switch (operator) {
        case EQ -> valuesEqual(fieldValue, value);
        case NE -> !valuesEqual(fieldValue, value);
        case GT -> ordered(fieldValue, value, c -> c > 0);
        case GTE -> ordered(fieldValue, value, c -> c >= 0);
        case LT -> ordered(fieldValue, value, c -> c < 0);
        case LTE -> ordered(fieldValue, value, c -> c <= 0);
        case IN -> value instanceof Collection<?> values && containsValue(values, fieldValue);
        case NIN -> value instanceof Collection<?> values && !containsValue(values, fieldValue);
        case EXISTS -> fieldValue != null;
        case REGEX -> fieldValue instanceof String text && value instanceof String pattern
                && compile(pattern, filter.isCaseSensitive()).matcher(text).find();
        case BETWEEN -> between(fieldValue, value);
        case UNKNOWN -> true;
        };
    }

    /**
     * Compile every regex filter up front so an invalid pattern fails the query
     * even when no point reaches the filter.
     */
    public static void validate(List<QueryFilter> filters) {
        for (QueryFilter filter : filters) {
            if (filter.getOperator() == FilterOperator.REGEX && filter.getValue() instanceof String pattern) {
                compile(pattern, filter.isCaseSensitive());
            }
        }
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean containsValue(Collection<?> values, Object fieldValue) {
        for (Object candidate : values) {
            if (valuesEqual(fieldValue, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean ordered(Object left, Object right, IntPredicate accept) {
        if (!(left instanceof Number a) || !(right instanceof Number b)) {
            return false;
        }
        return accept.test(Double.compare(a.doubleValue(), b.doubleValue()));
    }

    private static boolean between(Object fieldValue, Object bounds) {
        if (!(fieldValue instanceof Number number) || !(bounds instanceof List<?> range) || range.size() != 2) {
            return false;
        }
        if (!(range.get(0) instanceof Number low) || !(range.get(1) instanceof Number high)) {
            return false;
        }
        double v = number.doubleValue();
        return v >= low.doubleValue() && v <= high.doubleValue();
    }

    private static Pattern compile(String pattern, boolean caseSensitive) {
        return caseSensitive ? Pattern.compile(pattern) : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    }
}
