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

import me.golemcore.history.domain.model.AggregateQueryOptions;
import me.golemcore.history.domain.model.AggregateQueryResult;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.GroupBySpec;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;
import me.golemcore.history.domain.model.QueryResult;
import me.golemcore.history.domain.model.SortSpec;
import me.golemcore.history.domain.model.TimeRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fluent accumulator for one query, bound to the engine that created it.
 * Every terminal call snapshots the accumulated state, so a builder can be
 * executed more than once.
 *
 * <pre>
 * engine.createQuery()
 *         .timeRange(from, to)
 *         .where("totalCost", FilterOperator.GT, 1.5)
 *         .orderBy("timestamp", SortSpec.Direction.DESC)
 *         .limit(20)
 *         .execute();
 * </pre>
 *
 * <p>
 * Filters are always combined with AND; there is no OR.
 */
public class UsageQueryBuilder {

    private final UsageQueryEngine engine;
    private final List<QueryFilter> filters = new ArrayList<>();
    private final List<SortSpec> sorts = new ArrayList<>();
    private final List<GroupBySpec> groups = new ArrayList<>();
    private List<String> selectedFields;
    private TimeRange range;
    private Integer limitCount;
    private Integer skipCount;

    UsageQueryBuilder(UsageQueryEngine engine) {
        this.engine = engine;
    }

    public UsageQueryBuilder timeRange(long start, long end) {
        this.range = TimeRange.of(start, end);
        return this;
    }

    public UsageQueryBuilder where(String field, FilterOperator operator, Object value) {
        filters.add(QueryFilter.of(field, operator, value));
        return this;
    }

    public UsageQueryBuilder where(QueryFilter filter) {
        filters.add(filter);
        return this;
    }

    public UsageQueryBuilder whereAnd(String field, FilterOperator operator, Object value) {
        return where(field, operator, value);
    }

    public UsageQueryBuilder orderBy(String field, SortSpec.Direction direction) {
        sorts.add(SortSpec.builder().field(field).direction(direction).build());
        return this;
    }

    public UsageQueryBuilder groupBy(String field, GroupBySpec.Aggregation aggregation) {
        groups.add(GroupBySpec.of(field, aggregation));
        return this;
    }

    public UsageQueryBuilder limit(int count) {
        this.limitCount = count;
        return this;
    }

    public UsageQueryBuilder skip(int count) {
        this.skipCount = count;
        return this;
    }

    public UsageQueryBuilder select(String... fields) {
        this.selectedFields = Arrays.asList(fields);
        return this;
    }

    public CompletableFuture<QueryResult> execute() {
        return engine.query(List.copyOf(filters), options());
    }

    /**
     * Number of matching points, ignoring limit, skip and select.
     */
    public CompletableFuture<Long> count() {
        QueryOptions countOptions = QueryOptions.builder().timeRange(range).build();
        return engine.query(List.copyOf(filters), countOptions).thenApply(QueryResult::getTotalCount);
    }

    /**
     * Run the group-by, or windowed statistics when {@code window} is not
     * null.
     */
    public CompletableFuture<AggregateQueryResult> aggregate(AggregationWindow window) {
        AggregateQueryOptions options = AggregateQueryOptions.builder()
                .timeRange(range)
                .window(window)
                .build();
        return engine.aggregateQuery(List.copyOf(filters), List.copyOf(groups), options);
    }

    public QueryPlan explain() {
        return engine.explainQuery(List.copyOf(filters), options());
    }

    QueryOptions options() {
        return QueryOptions.builder()
                .sort(sorts.isEmpty() ? null : List.copyOf(sorts))
                .limit(limitCount)
                .skip(skipCount)
                .select(selectedFields)
                .timeRange(range)
                .build();
    }
}
