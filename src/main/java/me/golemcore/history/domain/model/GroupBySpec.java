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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Group-by field together with the aggregation applied to that same field in
 * each group. The result column is named {@code <field>_<aggregation>}.
 */
@Value
@Builder
@Jacksonized
public class GroupBySpec {

    String field;
    Aggregation aggregation;

    public static GroupBySpec of(String field, Aggregation aggregation) {
        return new GroupBySpec(field, aggregation);
    }

    public enum Aggregation {
        COUNT("count"), SUM("sum"), AVG("avg"), MIN("min"), MAX("max");

        private final String code;

        Aggregation(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static Aggregation fromValue(String value) {
            for (Aggregation aggregation : values()) {
                if (aggregation.code.equalsIgnoreCase(value)) {
                    return aggregation;
                }
            }
            throw new IllegalArgumentException("Unsupported aggregation: " + value);
        }
    }
}
