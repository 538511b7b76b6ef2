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

import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed-weight cost model: base cost 1000, minus 200 per filter on an indexed
 * field, plus 100 per sort key, capped at ten times the limit, never below 10.
 * Assumes a single bucket scan.
 */
@Component
public class HeuristicQueryCostEstimator implements QueryCostEstimator {

    private static final long BASE_COST = 1000;
    private static final long INDEXED_FILTER_DISCOUNT = 200;
    private static final long SORT_KEY_COST = 100;
    private static final long COST_PER_LIMITED_ROW = 10;
    private static final long MIN_COST = 10;

    @Override
    public QueryPlan estimate(List<QueryFilter> filters, QueryOptions options, Map<String, IndexSpec> indexes) {
        QueryOptions opts = options != null ? options : QueryOptions.none();
        long cost = BASE_COST;

        List<String> indexesUsed = new ArrayList<>();
        List<String> filterOrder = new ArrayList<>(filters.size());
        for (QueryFilter filter : filters) {
            filterOrder.add(filter.getField());
            if (filter.getField() != null && indexes.containsKey(filter.getField())) {
                indexesUsed.add(filter.getField());
                cost -= INDEXED_FILTER_DISCOUNT;
            }
        }

        cost += SORT_KEY_COST * opts.sortOrEmpty().size();
        if (opts.hasLimit()) {
            cost = Math.min(cost, opts.getLimit() * COST_PER_LIMITED_ROW);
        }

        return QueryPlan.builder()
                .estimatedCost(Math.max(MIN_COST, cost))
                .indexesUsed(indexesUsed)
                .bucketsScan(1)
                .filterOrder(filterOrder)
                .sortRequired(!opts.sortOrEmpty().isEmpty())
                .aggregationRequired(false)
                .build();
    }
}
