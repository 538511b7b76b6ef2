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

import me.golemcore.history.domain.model.BucketStrategy;
import me.golemcore.history.domain.model.TimeRange;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Encodes timestamps to bucket keys and decodes keys back to their time range,
 * per bucket strategy. All calendar math is UTC.
 *
 * <ul>
 * <li>{@code daily} - {@code YYYY-MM-DD}</li>
 * <li>{@code weekly} - {@code YYYY-MM-DD-week}, the date being the Sunday that
 * starts the week</li>
 * <li>{@code monthly} - {@code YYYY-MM}</li>
 * </ul>
 *
 * <p>
 * Decoding accepts only keys of the codec's own strategy, so a weekly key is
 * never mistaken for a daily one.
 */
public class BucketKeyCodec {

    private static final String WEEK_SUFFIX = "-week";
    private static final int DAYS_PER_WEEK = 7;

    private final BucketStrategy strategy;

    public BucketKeyCodec(BucketStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Bucket strategy is required");
        }
        this.strategy = strategy;
    }

    public BucketStrategy getStrategy() {
        return strategy;
    }

    public String keyFor(long timestamp) {
        LocalDate date = LocalDate.ofInstant(Instant.ofEpochMilli(timestamp), ZoneOffset.UTC);
        return switch (strategy) {
        case DAILY -> date.toString();
        case WEEKLY -> weekStart(date) + WEEK_SUFFIX;
        case MONTHLY -> YearMonth.from(date).toString();
        };
    }

    /**
     * Half-open range {@code [start, end)} covered by the bucket key.
     *
     * @throws IllegalArgumentException
     *             if the key was not produced by this strategy
     */
    public TimeRange rangeOf(String key) {
        LocalDate start = startDate(key);
        LocalDate end = switch (strategy) {
        case DAILY -> start.plusDays(1);
        case WEEKLY -> start.plusDays(DAYS_PER_WEEK);
        case MONTHLY -> start.plusMonths(1);
        };
        return TimeRange.of(toEpochMillis(start), toEpochMillis(end));
    }

    public long startOf(String key) {
        return toEpochMillis(startDate(key));
    }

    private LocalDate startDate(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Bucket key is required");
        }
        try {
            return switch (strategy) {
            case DAILY -> LocalDate.parse(key);
            case WEEKLY -> parseWeekKey(key);
            case MONTHLY -> YearMonth.parse(key).atDay(1);
            };
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid " + strategy.getCode() + " bucket key '" + key + "': " + e.getMessage(), e);
        }
    }

    private LocalDate parseWeekKey(String key) {
        if (!key.endsWith(WEEK_SUFFIX)) {
            throw new IllegalArgumentException("Invalid weekly bucket key '" + key + "': missing " + WEEK_SUFFIX);
        }
        LocalDate date = LocalDate.parse(key.substring(0, key.length() - WEEK_SUFFIX.length()));
        if (date.getDayOfWeek() != DayOfWeek.SUNDAY) {
            throw new IllegalArgumentException("Invalid weekly bucket key '" + key + "': not a Sunday");
        }
        return date;
    }

    private static LocalDate weekStart(LocalDate date) {
        return date.minusDays(date.getDayOfWeek().getValue() % DAYS_PER_WEEK);
    }

    private static long toEpochMillis(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
}
