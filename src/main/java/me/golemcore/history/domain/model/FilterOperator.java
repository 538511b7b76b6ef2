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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators understood by the query engine.
 *
 * <p>
 * Codes that match no operator (e.g. from a hand-edited saved query) resolve to
 * {@link #UNKNOWN}, which every point satisfies.
 */
public enum FilterOperator {
    EQ("eq"), NE("ne"), GT("gt"), GTE("gte"), LT("lt"), LTE("lte"), IN("in"), NIN("nin"), EXISTS("exists"), REGEX(
            "regex"), BETWEEN("between"), UNKNOWN("unknown");

    private final String code;

    FilterOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        for (FilterOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        return UNKNOWN;
    }
}
