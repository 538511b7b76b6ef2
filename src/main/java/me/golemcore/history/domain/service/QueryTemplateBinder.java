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

import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Binds {@code {{name}}} placeholders in template filter values.
 *
 * <p>
 * A value that is exactly one placeholder is replaced by the parameter value
 * as is, keeping its type. Placeholders embedded in a longer string are
 * replaced textually. List values are bound element by element.
 */
final class QueryTemplateBinder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private QueryTemplateBinder() {
    }

    static Set<String> placeholders(List<QueryFilter> filters) {
        Set<String> names = new LinkedHashSet<>();
        for (QueryFilter filter : filters) {
            collect(filter.getValue(), names);
        }
        return names;
    }

    /**
     * @throws IllegalArgumentException
     *             if a placeholder or declared parameter has no value
     */
    static List<QueryFilter> bind(QueryTemplate template, Map<String, Object> parameters) {
        List<QueryFilter> filters = template.getFilters() != null ? template.getFilters() : List.of();
        Set<String> required = new LinkedHashSet<>(placeholders(filters));
        if (template.getParameters() != null) {
            required.addAll(template.getParameters());
        }
        for (String name : required) {
            if (!parameters.containsKey(name) || parameters.get(name) == null) {
                throw new IllegalArgumentException("Missing template parameter: " + name);
            }
        }

        List<QueryFilter> bound = new ArrayList<>(filters.size());
        for (QueryFilter filter : filters) {
            bound.add(QueryFilter.builder()
                    .field(filter.getField())
                    .operator(filter.getOperator())
                    .value(substitute(filter.getValue(), parameters))
                    .caseSensitive(filter.isCaseSensitive())
                    .build());
        }
        return bound;
    }

    private static Object substitute(Object value, Map<String, Object> parameters) {
        if (value instanceof Collection<?> values) {
            List<Object> substituted = new ArrayList<>(values.size());
            for (Object element : values) {
                substituted.add(substitute(element, parameters));
            }
            return substituted;
        }
        if (!(value instanceof String text)) {
            return value;
        }
        Matcher whole = PLACEHOLDER.matcher(text.trim());
        if (whole.matches()) {
            return parameters.get(whole.group(1));
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = String.valueOf(parameters.get(matcher.group(1)));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static void collect(Object value, Set<String> names) {
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                collect(element, names);
            }
        } else if (value instanceof String text) {
            Matcher matcher = PLACEHOLDER.matcher(text);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
    }
}
