package me.golemcore.history.domain.model;

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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single {@code field operator value} condition. Multiple filters are always
 * combined with AND.
 *
 * <p>
 * {@code value} is a number or string for scalar operators, a list for
 * {@code in}/{@code nin}, and a two-element numeric list for {@code between}.
 * {@code caseSensitive} only affects {@code regex}.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({ "field", "operator", "value", "caseSensitive" })
public class QueryFilter {

    String field;
    FilterOperator operator;
    Object value;
    boolean caseSensitive;

    public static QueryFilter of(String field, FilterOperator operator, Object value) {
        return QueryFilter.builder().field(field).operator(operator).value(value).build();
    }

    public static QueryFilter regex(String field, String pattern, boolean caseSensitive) {
        return QueryFilter.builder()
                .field(field)
                .operator(FilterOperator.REGEX)
                .value(pattern)
                .caseSensitive(caseSensitive)
                .build();
    }
}
