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

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Time-bucketed grouping used for rollup statistics. All window boundaries are
 * computed in UTC; weeks start on Sunday.
 */
public enum AggregationWindow {
    HOUR("hour"), DAY("day"), WEEK("week"), MONTH("month");

    private static final long HOUR_MILLIS = Duration.ofHours(1).toMillis();
    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();
    private static final int DAYS_PER_WEEK = 7;

    private final String code;

    AggregationWindow(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AggregationWindow fromValue(String value) {
        for (AggregationWindow window : values()) {
            if (window.code.equalsIgnoreCase(value)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unsupported aggregation window: " + value);
    }

    /**
     * Start (inclusive, epoch millis) of the window containing the timestamp.
     */
    public long windowStart(long timestamp) {
        Instant instant = Instant.ofEpochMilli(timestamp);
        return switch (this) {
        case HOUR -> instant.truncatedTo(ChronoUnit.HOURS).toEpochMilli();
        case DAY -> instant.truncatedTo(ChronoUnit.DAYS).toEpochMilli();
        case WEEK -> {
            LocalDate date = LocalDate.ofInstant(instant, ZoneOffset.UTC);
            LocalDate sunday = date.minusDays(date.getDayOfWeek().getValue() % DAYS_PER_WEEK);
            yield sunday.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        }
        case MONTH -> LocalDate.ofInstant(instant, ZoneOffset.UTC).withDayOfMonth(1)
                .atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        };
    }

    /**
     * End (exclusive, epoch millis) of the window starting at
     * {@code windowStart}.
     */
    public long windowEnd(long windowStart) {
        return switch (this) {
        case HOUR -> windowStart + HOUR_MILLIS;
        case DAY -> windowStart + DAY_MILLIS;
        case WEEK -> windowStart + DAYS_PER_WEEK * DAY_MILLIS;
        case MONTH -> LocalDate.ofInstant(Instant.ofEpochMilli(windowStart), ZoneOffset.UTC).plusMonths(1)
                .atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        };
    }
}
