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
import lombok.Value;

import java.util.List;

/**
 * Parameters for the aggregation port.
 */
@Value
@Builder
public class AggregationConfig {

    private static final List<Integer> STANDARD_PERCENTILES = List.of(25, 50, 75, 90, 95, 99);
    private static final double STANDARD_CONFIDENCE = 0.95;
    private static final double DEFAULT_OUTLIER_THRESHOLD = 2.0;

    List<AggregationWindow> windows;

    @Builder.Default
    boolean calculatePercentiles = true;

    @Builder.Default
    List<Integer> percentileLevels = STANDARD_PERCENTILES;

    @Builder.Default
    double confidenceLevel = STANDARD_CONFIDENCE;

    boolean trackFeatureDistribution;
    boolean trackTimePatterns;

    @Builder.Default
    int minDataPoints = 1;

    boolean outlierDetection;

    @Builder.Default
    double outlierThreshold = DEFAULT_OUTLIER_THRESHOLD;

    /**
     * Configuration used by aggregate queries: percentiles 25/50/75/90/95/99,
     * 95% confidence, feature and time-pattern tracking, no outlier removal.
     */
    public static AggregationConfig forWindow(AggregationWindow window) {
        return AggregationConfig.builder()
                .windows(List.of(window))
                .trackFeatureDistribution(true)
                .trackTimePatterns(true)
                .build();
    }
}
