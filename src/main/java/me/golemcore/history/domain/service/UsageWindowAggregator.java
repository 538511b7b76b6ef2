package me.golemcore.history.domain.service;

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

import me.golemcore.history.domain.model.AggregatedUsage;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.UsageDataPoint;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rolls raw points up into per-window usage totals.
 *
 * <p>
 * Windows without points are omitted. Results are ordered by window start.
 * Feature names keep their first-seen order.
 */
public final class UsageWindowAggregator {

    private UsageWindowAggregator() {
    }

    public static List<AggregatedUsage> aggregate(List<UsageDataPoint> points, AggregationWindow window) {
        Map<Long, Accumulator> byWindow = new TreeMap<>();
        for (UsageDataPoint point : points) {
            long start = window.windowStart(point.getTimestamp());
            byWindow.computeIfAbsent(start, Accumulator::new).add(point);
        }

        List<AggregatedUsage> result = new ArrayList<>(byWindow.size());
        for (Accumulator acc : byWindow.values()) {
            result.add(acc.toUsage(window));
        }
        return result;
    }

    private static final class Accumulator {
        private final long windowStart;
        private long totalRequests;
        private double totalCost;
        private double peakUsage;
        private long uniqueSessions;
        private long dataPoints;
        private final Set<String> features = new LinkedHashSet<>();

        Accumulator(long windowStart) {
            this.windowStart = windowStart;
        }

        void add(UsageDataPoint point) {
            totalRequests += point.getRequestCount();
            totalCost += point.getTotalCost();
            peakUsage = Math.max(peakUsage, point.getUsagePercentage());
            dataPoints++;
            // Estimate only: counts points carrying a session, not distinct ids
            if (point.getSessionId() != null && !point.getSessionId().isEmpty()) {
                uniqueSessions = Math.max(uniqueSessions, dataPoints);
            }
            if (point.getFeatures() != null) {
                features.addAll(point.getFeatures());
            }
        }

        AggregatedUsage toUsage(AggregationWindow window) {
            return AggregatedUsage.builder()
                    .timeWindow(window)
                    .windowStart(windowStart)
                    .windowEnd(window.windowEnd(windowStart))
                    .totalRequests(totalRequests)
                    .totalCost(totalCost)
                    .averageUsage(dataPoints > 0 ? (double) totalRequests / dataPoints : 0.0)
                    .peakUsage(peakUsage)
                    .uniqueSessions(uniqueSessions)
                    .featuresUsed(new ArrayList<>(features))
                    .dataPoints(dataPoints)
                    .build();
        }
    }
}
