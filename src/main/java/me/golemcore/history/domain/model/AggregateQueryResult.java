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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Result of an aggregate query. Exactly one of {@code windows} (windowed
 * statistics) and {@code rows} (simple group-by) is populated on success.
 */
@Data
@Builder
public class AggregateQueryResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private List<Map<String, Object>> rows;
    private List<AggregationResult> windows;
    private long totalCount;
    private QueryExecutionStats stats;
    private String error;

    public static AggregateQueryResult failure(String error, QueryExecutionStats stats) {
        return AggregateQueryResult.builder()
                .success(false)
                .rows(List.of())
                .windows(List.of())
                .stats(stats)
                .error(error)
                .build();
    }
}
