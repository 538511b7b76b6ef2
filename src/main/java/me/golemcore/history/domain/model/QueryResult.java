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
 * Result of a plain query.
 *
 * <p>
 * {@code data} is the requested page of points. When fields were selected,
 * {@code projection} holds the same page reduced to those fields (nested paths
 * rebuilt as nested maps), otherwise it is null. {@code totalCount} is the
 * number of matching points before pagination.
 */
@Data
@Builder
public class QueryResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private List<UsageDataPoint> data;
    private List<Map<String, Object>> projection;
    private long totalCount;
    private boolean hasMore;
    private QueryExecutionStats stats;
    private String error;

    public static QueryResult failure(String error, long executionTimeMs) {
        return QueryResult.builder()
                .success(false)
                .data(List.of())
                .totalCount(0)
                .stats(QueryExecutionStats.builder().executionTimeMs(executionTimeMs).indexedFields(List.of())
                        .build())
                .error(error)
                .build();
    }
}
