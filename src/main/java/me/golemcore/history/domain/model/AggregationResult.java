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
 * Statistical rollup of one aggregation window.
 *
 * <p>
 * Time patterns are averages of {@code totalCost} per UTC hour of day (24
 * entries) and per day of week (7 entries, Sunday first); they are null unless
 * requested.
 */
@Data
@Builder
public class AggregationResult {

    private AggregationWindow timeWindow;
    private long windowStart;
    private long windowEnd;
    private long dataPointCount;

    private StatisticalSummary cost;
    private StatisticalSummary requests;
    private StatisticalSummary usagePercentage;
    private StatisticalSummary costPerRequest;
    private double requestsPerHour;

    private Map<String, Long> featureDistribution;
    private long sessionCount;
    private ConfidenceInterval confidenceInterval;

    private List<Double> hourOfDayPattern;
    private List<Double> dayOfWeekPattern;
    private Integer peakUsageHour;
    private Integer lowUsageHour;

    /**
     * Confidence interval of the mean cost per point.
     */
    @Data
    @Builder
    public static class ConfidenceInterval {
        private double level;
        private double lower;
        private double upper;
    }
}
