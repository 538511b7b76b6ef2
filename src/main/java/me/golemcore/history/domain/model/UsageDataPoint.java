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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * One historical usage/cost sample.
 *
 * <p>
 * Points are immutable once written. Storing a point with the same timestamp as
 * an existing one does not replace it: both are kept, in insertion order.
 *
 * <p>
 * Field names double as query field paths, e.g. {@code totalCost} or
 * {@code metadata.model}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "timestamp", "date", "requestCount", "totalCost", "dailyLimit", "usagePercentage",
        "resetTime", "sessionId", "features", "metadata" })
public class UsageDataPoint {

    /** Epoch milliseconds. */
    long timestamp;

    /** Calendar date, {@code YYYY-MM-DD}. */
    String date;

    long requestCount;
    double totalCost;
    double dailyLimit;
    double usagePercentage;
    String resetTime;

    String sessionId;
    List<String> features;
    Map<String, Object> metadata;
}
