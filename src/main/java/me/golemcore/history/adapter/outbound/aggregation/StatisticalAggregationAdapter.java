package me.golemcore.history.adapter.outbound.aggregation;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.domain.model.AggregationConfig;
import me.golemcore.history.domain.model.AggregationResult;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.StatisticalSummary;
import me.golemcore.history.domain.model.UsageDataPoint;
import me.golemcore.history.port.outbound.AggregationPort;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * In-process implementation of {@link AggregationPort} computing descriptive
 * statistics per aggregation window.
 *
 * <p>
 * Points with a non-positive timestamp are discarded first. With outlier
 * detection enabled, points whose cost lies more than
 * {@code outlierThreshold} standard deviations from the mean are dropped
 * before grouping. Windows holding fewer than {@code minDataPoints} points are
 * skipped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class StatisticalAggregationAdapter implements AggregationPort {

    private static final String LOG_PREFIX = "[Aggregation]";
    private static final int HOURS_PER_DAY = 24;
    private static final int DAYS_PER_WEEK = 7;
    private static final double HOUR_MILLIS = Duration.ofHours(1).toMillis();
    private static final int MEDIAN_LEVEL = 50;

    private static final Map<Double, Double> Z_SCORES = Map.of(
            0.80, 1.282,
            0.90, 1.645,
            0.95, 1.96,
            0.99, 2.576);
    private static final double DEFAULT_Z_SCORE = 1.96;

    @Override
    public CompletableFuture<List<AggregationResult>> aggregate(List<UsageDataPoint> points,
            AggregationConfig config) {
        return CompletableFuture.supplyAsync(() -> aggregateNow(points, config));
    }

    List<AggregationResult> aggregateNow(List<UsageDataPoint> points, AggregationConfig config) {
        long started = System.nanoTime();
        List<UsageDataPoint> clean = clean(points, config);

        List<AggregationResult> results = new ArrayList<>();
        List<AggregationWindow> windows = config.getWindows() != null ? config.getWindows() : List.of();
        for (AggregationWindow window : windows) {
            Map<Long, List<UsageDataPoint>> groups = new TreeMap<>();
            for (UsageDataPoint point : clean) {
                groups.computeIfAbsent(window.windowStart(point.getTimestamp()), k -> new ArrayList<>()).add(point);
            }
            for (Map.Entry<Long, List<UsageDataPoint>> group : groups.entrySet()) {
                if (group.getValue().size() < config.getMinDataPoints()) {
                    continue;
                }
                results.add(aggregateWindow(window, group.getKey(), group.getValue(), config));
            }
        }

        log.debug("{} Aggregated {} points into {} windows in {}ms", LOG_PREFIX, clean.size(), results.size(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        return results;
    }

    private List<UsageDataPoint> clean(List<UsageDataPoint> points, AggregationConfig config) {
        List<UsageDataPoint> valid = new ArrayList<>();
        if (points != null) {
            for (UsageDataPoint point : points) {
                if (point != null && point.getTimestamp() > 0 && Double.isFinite(point.getTotalCost())) {
                    valid.add(point);
                }
            }
        }
        if (!config.isOutlierDetection() || valid.size() < 2) {
            return valid;
        }

        double[] costs = valid.stream().mapToDouble(UsageDataPoint::getTotalCost).toArray();
        double mean = Arrays.stream(costs).average().orElse(0.0);
        double sd = standardDeviation(costs, mean);
        if (sd == 0.0) {
            return valid;
        }
        List<UsageDataPoint> kept = new ArrayList<>(valid.size());
        for (UsageDataPoint point : valid) {
            if (Math.abs(point.getTotalCost() - mean) / sd <= config.getOutlierThreshold()) {
                kept.add(point);
            }
        }
        if (kept.size() < valid.size()) {
            log.debug("{} Removed {} cost outliers", LOG_PREFIX, valid.size() - kept.size());
        }
        return kept;
    }

    private AggregationResult aggregateWindow(AggregationWindow window, long windowStart,
            List<UsageDataPoint> points, AggregationConfig config) {
        long windowEnd = window.windowEnd(windowStart);
        StatisticalSummary cost = summarize(points, UsageDataPoint::getTotalCost, config);
        long totalRequests = points.stream().mapToLong(UsageDataPoint::getRequestCount).sum();
        double windowHours = (windowEnd - windowStart) / HOUR_MILLIS;

        List<UsageDataPoint> withRequests = points.stream().filter(p -> p.getRequestCount() > 0).toList();

        AggregationResult.AggregationResultBuilder builder = AggregationResult.builder()
                .timeWindow(window)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .dataPointCount(points.size())
                .cost(cost)
                .requests(summarize(points, p -> p.getRequestCount(), config))
                .usagePercentage(summarize(points, UsageDataPoint::getUsagePercentage, config))
                .costPerRequest(summarize(withRequests, p -> p.getTotalCost() / p.getRequestCount(), config))
                .requestsPerHour(windowHours > 0 ? totalRequests / windowHours : 0.0)
                .featureDistribution(featureDistribution(points, config))
                .sessionCount(sessionCount(points))
                .confidenceInterval(confidenceInterval(cost, config.getConfidenceLevel()));

        if (config.isTrackTimePatterns()) {
            List<Double> hourly = averageCostBy(points, HOURS_PER_DAY, p -> utc(p).getHour());
            builder.hourOfDayPattern(hourly)
                    .dayOfWeekPattern(averageCostBy(points, DAYS_PER_WEEK, p -> sundayFirst(utc(p).getDayOfWeek())))
                    .peakUsageHour(peakHour(hourly))
                    .lowUsageHour(lowHour(hourly));
        }
        return builder.build();
    }

    StatisticalSummary summarize(List<UsageDataPoint> points, ToDoubleFunction<UsageDataPoint> metric,
            AggregationConfig config) {
        if (points.isEmpty()) {
            return StatisticalSummary.empty();
        }
        double[] sorted = points.stream().mapToDouble(metric).sorted().toArray();
        double sum = Arrays.stream(sorted).sum();
        double mean = sum / sorted.length;

        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        if (config.isCalculatePercentiles() && config.getPercentileLevels() != null) {
            for (Integer level : config.getPercentileLevels()) {
                percentiles.put(level, percentile(sorted, level));
            }
        }

        return StatisticalSummary.builder()
                .count(sorted.length)
                .sum(sum)
                .mean(mean)
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .median(percentile(sorted, MEDIAN_LEVEL))
                .standardDeviation(standardDeviation(sorted, mean))
                .percentiles(percentiles)
                .build();
    }

    /**
     * Linear interpolation between closest ranks of an ascending array.
     */
    static double percentile(double[] sorted, double level) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = level / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    private static double standardDeviation(double[] values, double mean) {
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    private static AggregationResult.ConfidenceInterval confidenceInterval(StatisticalSummary cost, double level) {
        double margin = cost.getCount() > 0
                ? Z_SCORES.getOrDefault(level, DEFAULT_Z_SCORE) * cost.getStandardDeviation()
                        / Math.sqrt(cost.getCount())
                : 0.0;
        return AggregationResult.ConfidenceInterval.builder()
                .level(level)
                .lower(cost.getMean() - margin)
                .upper(cost.getMean() + margin)
                .build();
    }

    private static Map<String, Long> featureDistribution(List<UsageDataPoint> points, AggregationConfig config) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        if (!config.isTrackFeatureDistribution()) {
            return distribution;
        }
        for (UsageDataPoint point : points) {
            if (point.getFeatures() != null) {
                for (String feature : point.getFeatures()) {
                    distribution.merge(feature, 1L, Long::sum);
                }
            }
        }
        return distribution;
    }

    private static long sessionCount(List<UsageDataPoint> points) {
        Set<String> sessions = new HashSet<>();
        for (UsageDataPoint point : points) {
            if (point.getSessionId() != null && !point.getSessionId().isEmpty()) {
                sessions.add(point.getSessionId());
            }
        }
        return sessions.size();
    }

    private static List<Double> averageCostBy(List<UsageDataPoint> points, int slots,
            ToIntFunction<UsageDataPoint> slotOf) {
        double[] totals = new double[slots];
        int[] counts = new int[slots];
        for (UsageDataPoint point : points) {
            int slot = slotOf.applyAsInt(point);
            totals[slot] += point.getTotalCost();
            counts[slot]++;
        }
        List<Double> averages = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            averages.add(counts[i] > 0 ? totals[i] / counts[i] : 0.0);
        }
        return averages;
    }

    private static int peakHour(List<Double> hourly) {
        int peak = 0;
        for (int hour = 1; hour < hourly.size(); hour++) {
            if (hourly.get(hour) > hourly.get(peak)) {
                peak = hour;
            }
        }
        return peak;
    }

    // Hour with the smallest non-zero average; hours without usage are ignored
    private static int lowHour(List<Double> hourly) {
        int low = -1;
        for (int hour = 0; hour < hourly.size(); hour++) {
            double value = hourly.get(hour);
            if (value > 0 && (low < 0 || value < hourly.get(low))) {
                low = hour;
            }
        }
        return Math.max(low, 0);
    }

    private static ZonedDateTime utc(UsageDataPoint point) {
        return Instant.ofEpochMilli(point.getTimestamp()).atZone(ZoneOffset.UTC);
    }

    private static int sundayFirst(DayOfWeek day) {
        return day.getValue() % DAYS_PER_WEEK;
    }
}
