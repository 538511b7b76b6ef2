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

import java.util.Map;

/**
 * Descriptive statistics of one numeric series. Percentiles are keyed by level
 * (e.g. 95) and use linear interpolation between closest ranks.
 */
@Data
@Builder
public class StatisticalSummary {

    private long count;
    private double sum;
    private double mean;
    private double min;
    private double max;
    private double median;
    private double standardDeviation;
    private Map<Integer, Double> percentiles;

    public static StatisticalSummary empty() {
        return StatisticalSummary.builder()
                .percentiles(Map.of())
                .build();
    }
}
