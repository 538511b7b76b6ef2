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

/**
 * Usage totals for one aggregation window, as produced by
 * {@code queryAggregated}.
 *
 * <p>
 * {@code uniqueSessions} is an estimate: it is the running count of points in
 * the window that carry a session id, not a count of distinct ids.
 * {@code averageUsage} is requests per data point.
 */
@Data
@Builder
public class AggregatedUsage {

    private AggregationWindow timeWindow;
    private long windowStart;
    private long windowEnd;
    private long totalRequests;
    private double totalCost;
    private double averageUsage;
    private double peakUsage;
    private long uniqueSessions;
    private List<String> featuresUsed;
    private long dataPoints;
}
