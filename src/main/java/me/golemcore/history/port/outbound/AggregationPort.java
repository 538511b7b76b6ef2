package me.golemcore.history.port.outbound;

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

import me.golemcore.history.domain.model.AggregationConfig;
import me.golemcore.history.domain.model.AggregationResult;
import me.golemcore.history.domain.model.UsageDataPoint;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the statistical aggregation engine consumed by aggregate queries.
 */
public interface AggregationPort {

    /**
     * Aggregate points into one result per populated window of every window
     * type in {@code config}.
     */
    CompletableFuture<List<AggregationResult>> aggregate(List<UsageDataPoint> points, AggregationConfig config);
}
