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
 * Policy that maps a timestamp to the key of the bucket holding it. Fixed per
 * storage instance.
 */
public enum BucketStrategy {
    DAILY("daily"), WEEKLY("weekly"), MONTHLY("monthly");

    private final String code;

    BucketStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolves a strategy from its configuration code.
     *
     * @throws IllegalArgumentException
     *             if the code names no supported strategy
     */
    @JsonCreator
    public static BucketStrategy fromValue(String value) {
        if (value != null) {
            for (BucketStrategy strategy : values()) {
                if (strategy.code.equalsIgnoreCase(value.trim()) || strategy.name().equalsIgnoreCase(value.trim())) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported bucket strategy: " + value);
    }
}
