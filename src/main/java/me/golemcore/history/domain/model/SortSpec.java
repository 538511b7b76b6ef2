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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One sort key with its own direction.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({ "field", "direction" })
public class SortSpec {

    String field;

    @Builder.Default
    Direction direction = Direction.ASC;

    public static SortSpec asc(String field) {
        return new SortSpec(field, Direction.ASC);
    }

    public static SortSpec desc(String field) {
        return new SortSpec(field, Direction.DESC);
    }

    public enum Direction {
        ASC("asc"), DESC("desc");

        private final String code;

        Direction(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static Direction fromValue(String value) {
            return "desc".equalsIgnoreCase(value) ? DESC : ASC;
        }
    }
}
