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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.domain.model.AggregateQueryOptions;
import me.golemcore.history.domain.model.AggregateQueryResult;
import me.golemcore.history.domain.model.AggregationConfig;
import me.golemcore.history.domain.model.AggregationResult;
import me.golemcore.history.domain.model.CacheConfig;
import me.golemcore.history.domain.model.GroupBySpec;
import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.OperationResult;
import me.golemcore.history.domain.model.OptimizationReport;
import me.golemcore.history.domain.model.QueryEngineStats;
import me.golemcore.history.domain.model.QueryExecutionStats;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;
import me.golemcore.history.domain.model.QueryRange;
import me.golemcore.history.domain.model.QueryResult;
import me.golemcore.history.domain.model.QueryTemplate;
import me.golemcore.history.domain.model.SavedQuery;
import me.golemcore.history.domain.model.StorageException;
import me.golemcore.history.domain.model.TimeRange;
import me.golemcore.history.domain.model.UsageDataPoint;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.AggregationPort;
import me.golemcore.history.port.outbound.QueryCatalogPort;
import me.golemcore.history.port.outbound.TimeSeriesStoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Query engine over the usage history store.
 *
 * <p>
 * A query reads the requested time range from storage (everything up to now
 * when no range is given), applies the AND-combined filters, sorts, counts,
 * paginates and finally projects. Results are cached by query signature and
 * every execution is recorded for {@link #getStats()} and {@link #optimize()}.
 *
 * <p>
 * All state lives on one query thread, so callers may issue operations
 * concurrently. Failures never escape as exceptions: they come back as
 * {@code success=false} results.
 *
 * <p>
 * Declared indexes, saved queries and templates are persisted through
 * {@link QueryCatalogPort}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class UsageQueryEngine {

    private static final String LOG_PREFIX = "[Query]";
    private static final long SLOW_QUERY_MILLIS = 1000;
    private static final double OPTIMIZE_SLOW_AVERAGE_MILLIS = 500;
    private static final int HISTORY_PER_QUERY = 100;
    private static final int INDEX_SUGGESTION_QUERY_COUNT = 100;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final TimeSeriesStoragePort storage;
    private final AggregationPort aggregationPort;
    private final QueryCatalogPort catalogPort;
    private final QueryCostEstimator costEstimator;
    private final Clock clock;
    private final FieldPathResolver fieldPathResolver;
    private final QueryCacheKeyGenerator keyGenerator;

    private final Map<String, IndexSpec> indexes = new ConcurrentHashMap<>();

    // Only touched from the query thread
    private final QueryResultCache<QueryResult> cache;
    private final Map<String, Deque<QueryExecutionStats>> queryStats = new LinkedHashMap<>();
    private final Map<String, SavedQuery> savedQueries = new LinkedHashMap<>();
    private final Map<String, QueryTemplate> templates = new LinkedHashMap<>();

    private volatile CacheConfig cacheConfig;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "history-query");
        t.setDaemon(true);
        return t;
    });

    public UsageQueryEngine(TimeSeriesStoragePort storage, AggregationPort aggregationPort,
            QueryCatalogPort catalogPort, QueryCostEstimator costEstimator, HistoryProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.aggregationPort = aggregationPort;
        this.catalogPort = catalogPort;
        this.costEstimator = costEstimator;
        this.clock = clock;
        this.fieldPathResolver = new FieldPathResolver(objectMapper);
        this.keyGenerator = new QueryCacheKeyGenerator(objectMapper);
        this.cacheConfig = CacheConfig.defaults().mergedWith(properties.getQuery().getCache().toCacheConfig());
        this.cache = new QueryResultCache<>(clock, cacheConfig.getMaxSize(), cacheConfig.getTtl());
    }

    @PostConstruct
    public void init() {
        try {
            indexes.putAll(catalogPort.loadIndexes());
        } catch (StorageException e) {
            log.warn("{} Failed to load indexes, starting without: {}", LOG_PREFIX, e.getMessage());
        }
        try {
            savedQueries.putAll(catalogPort.loadSavedQueries());
        } catch (StorageException e) {
            log.warn("{} Failed to load saved queries, starting without: {}", LOG_PREFIX, e.getMessage());
        }
        try {
            templates.putAll(catalogPort.loadTemplates());
        } catch (StorageException e) {
            log.warn("{} Failed to load query templates, starting without: {}", LOG_PREFIX, e.getMessage());
        }
        storage.addWriteListener(this::onBucketsChanged);
        log.info("{} Query engine ready: {} indexes, {} saved queries, {} templates", LOG_PREFIX, indexes.size(),
                savedQueries.size(), templates.size());
    }

    @PreDestroy
    public void destroy() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public UsageQueryBuilder createQuery() {
        return new UsageQueryBuilder(this);
    }

    // ==================== Queries ====================

    public CompletableFuture<QueryResult> query(List<QueryFilter> filters, QueryOptions options) {
        return CompletableFuture.supplyAsync(() -> executeQuery(filters, options), executor);
    }

    public CompletableFuture<AggregateQueryResult> aggregateQuery(List<QueryFilter> filters,
            List<GroupBySpec> groupBy, AggregateQueryOptions options) {
        return CompletableFuture.supplyAsync(() -> executeAggregate(filters, groupBy, options), executor);
    }

    /**
     * Estimated plan for the query. Runs on the calling thread and never reads
     * storage.
     */
    public QueryPlan explainQuery(List<QueryFilter> filters, QueryOptions options) {
        return costEstimator.estimate(filters != null ? filters : List.of(), options, Map.copyOf(indexes));
    }

    private QueryResult executeQuery(List<QueryFilter> filters, QueryOptions options) {
        long startNanos = System.nanoTime();
        List<QueryFilter> safeFilters = filters != null ? filters : List.of();
        QueryOptions opts = options != null ? options : QueryOptions.none();
        try {
            String key = keyGenerator.keyFor(safeFilters, opts);
            CacheConfig config = cacheConfig;
            if (config.isEnabled()) {
                Optional<QueryResult> cached = cache.get(key);
                if (cached.isPresent()) {
                    recordExecution(key, QueryExecutionStats.builder()
                            .executionTimeMs(elapsedMillis(startNanos))
                            .cacheHits(1)
                            .indexedFields(List.of())
                            .build());
                    log.debug("{} Cache hit for query {}", LOG_PREFIX, key);
                    return cached.get();
                }
            }

            FilterEvaluator.validate(safeFilters);
            TimeRange range = opts.getTimeRange() != null ? opts.getTimeRange() : TimeRange.of(0, clock.millis());
            List<UsageDataPoint> points = storage.query(QueryRange.of(range)).join();

            List<Row> rows = new ArrayList<>();
            for (UsageDataPoint point : points) {
                Map<String, Object> document = fieldPathResolver.toDocument(point);
                if (FilterEvaluator.matchesAll(document, safeFilters)) {
                    rows.add(new Row(point, document));
                }
            }
            if (!opts.sortOrEmpty().isEmpty()) {
                rows.sort(Comparator.comparing(Row::document, ResultSorter.comparator(opts.sortOrEmpty())));
            }

            int totalCount = rows.size();
            int from = opts.hasSkip() ? Math.min(opts.getSkip(), totalCount) : 0;
            int to = opts.hasLimit() ? (int) Math.min(totalCount, (long) from + opts.getLimit()) : totalCount;
            List<Row> page = rows.subList(from, to);

            List<UsageDataPoint> data = new ArrayList<>(page.size());
            List<Map<String, Object>> projection = opts.selectOrEmpty().isEmpty() ? null : new ArrayList<>();
            for (Row row : page) {
                data.add(row.point());
                if (projection != null) {
                    projection.add(FieldPathResolver.project(row.document(), opts.selectOrEmpty()));
                }
            }

            List<String> indexedFields = indexedFields(safeFilters);
            QueryExecutionStats stats = QueryExecutionStats.builder()
                    .executionTimeMs(elapsedMillis(startNanos))
                    .rowsScanned(totalCount)
                    .rowsReturned(data.size())
                    .bucketAccess(1)
                    .cacheHits(0)
                    .cacheMisses(config.isEnabled() ? 1 : 0)
                    .indexSeeks(indexedFields.size())
                    .fullScans(indexedFields.isEmpty() ? 1 : 0)
                    .indexedFields(indexedFields)
                    .build();

            QueryResult result = QueryResult.builder()
                    .success(true)
                    .data(data)
                    .projection(projection)
                    .totalCount(totalCount)
                    .hasMore(from + data.size() < totalCount)
                    .stats(stats)
                    .build();

            if (config.isEnabled()) {
                cache.put(key, result);
            }
            recordExecution(key, stats);
            log.debug("{} Query {} matched {} of {} points, returned {} in {}ms", LOG_PREFIX, key, totalCount,
                    points.size(), data.size(), stats.getExecutionTimeMs());
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} Query failed: {}", LOG_PREFIX, cause.getMessage());
            return QueryResult.failure(cause.getMessage(), elapsedMillis(startNanos));
        } catch (StorageException | IllegalArgumentException e) {
            log.warn("{} Query failed: {}", LOG_PREFIX, e.getMessage());
            return QueryResult.failure(e.getMessage(), elapsedMillis(startNanos));
        } catch (RuntimeException e) {
            log.error("{} Query failed unexpectedly", LOG_PREFIX, e);
            return QueryResult.failure(e.getMessage(), elapsedMillis(startNanos));
        }
    }

    private AggregateQueryResult executeAggregate(List<QueryFilter> filters, List<GroupBySpec> groupBy,
            AggregateQueryOptions options) {
        long startNanos = System.nanoTime();
        AggregateQueryOptions opts = options != null ? options : AggregateQueryOptions.none();
        QueryResult raw = executeQuery(filters, QueryOptions.builder().timeRange(opts.getTimeRange()).build());
        if (!raw.isSuccess()) {
            return AggregateQueryResult.failure(raw.getError(), raw.getStats());
        }
        QueryExecutionStats stats = raw.getStats().toBuilder().executionTimeMs(elapsedMillis(startNanos)).build();
        if (raw.getData().isEmpty()) {
            return AggregateQueryResult.builder()
                    .success(true)
                    .rows(List.of())
                    .windows(List.of())
                    .totalCount(0)
                    .stats(stats)
                    .build();
        }

        try {
            if (opts.getWindow() != null) {
                List<AggregationResult> windows = aggregationPort
                        .aggregate(raw.getData(), AggregationConfig.forWindow(opts.getWindow()))
                        .join();
                return AggregateQueryResult.builder()
                        .success(true)
                        .windows(windows)
                        .totalCount(windows.size())
                        .stats(stats.toBuilder().executionTimeMs(elapsedMillis(startNanos)).build())
                        .build();
            }

            List<Map<String, Object>> documents = new ArrayList<>(raw.getData().size());
            for (UsageDataPoint point : raw.getData()) {
                documents.add(fieldPathResolver.toDocument(point));
            }
            List<Map<String, Object>> rows = GroupByAggregator.group(documents,
                    groupBy != null ? groupBy : List.of());
            return AggregateQueryResult.builder()
                    .success(true)
                    .rows(rows)
                    .totalCount(rows.size())
                    .stats(stats.toBuilder().executionTimeMs(elapsedMillis(startNanos)).build())
                    .build();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} Aggregate query failed: {}", LOG_PREFIX, cause.getMessage());
            return AggregateQueryResult.failure(cause.getMessage(), stats);
        } catch (RuntimeException e) {
            log.error("{} Aggregate query failed unexpectedly", LOG_PREFIX, e);
            return AggregateQueryResult.failure(e.getMessage(), stats);
        }
    }

    private List<String> indexedFields(List<QueryFilter> filters) {
        List<String> fields = new ArrayList<>();
        for (QueryFilter filter : filters) {
            if (filter.getField() != null && indexes.containsKey(filter.getField())) {
                fields.add(filter.getField());
            }
        }
        return fields;
    }

    private void recordExecution(String key, QueryExecutionStats stats) {
        Deque<QueryExecutionStats> history = queryStats.computeIfAbsent(key, k -> new ArrayDeque<>());
        history.addLast(stats);
        while (history.size() > HISTORY_PER_QUERY) {
            history.removeFirst();
        }
    }

    // ==================== Indexes ====================

    public CompletableFuture<OperationResult<IndexSpec>> createIndex(IndexSpec spec) {
        return supplyOperation("createIndex", () -> {
            if (spec == null || spec.getField() == null || spec.getField().isBlank()) {
                throw new IllegalArgumentException("Index field is required");
            }
            IndexSpec stored = spec.toBuilder()
                    .type(spec.getType() != null ? spec.getType() : IndexSpec.IndexType.BTREE)
                    .build();
            indexes.put(stored.getField(), stored);
            persistIndexes();
            log.info("{} Created {} index on {}", LOG_PREFIX, stored.getType().getCode(), stored.getField());
            return stored.toBuilder().build();
        });
    }

    public CompletableFuture<Void> dropIndex(String field) {
        return CompletableFuture.runAsync(() -> {
            if (indexes.remove(field) != null) {
                persistIndexes();
                log.info("{} Dropped index on {}", LOG_PREFIX, field);
            }
        }, executor);
    }

    public List<IndexSpec> listIndexes() {
        List<IndexSpec> specs = new ArrayList<>(indexes.values());
        specs.sort(Comparator.comparing(IndexSpec::getField));
        return specs;
    }

    private void persistIndexes() {
        Map<String, IndexSpec> snapshot = new LinkedHashMap<>();
        for (IndexSpec spec : listIndexes()) {
            snapshot.put(spec.getField(), spec);
        }
        try {
            catalogPort.saveIndexes(snapshot);
        } catch (StorageException e) {
            log.error("{} Failed to save indexes", LOG_PREFIX, e);
        }
    }

    // ==================== Statistics ====================

    public CompletableFuture<QueryEngineStats> getStats() {
        return CompletableFuture.supplyAsync(this::computeStats, executor);
    }

    private QueryEngineStats computeStats() {
        long total = 0;
        long totalTime = 0;
        long cacheHits = 0;
        long cacheRequests = 0;
        long slow = 0;
        Map<String, Long> utilization = new LinkedHashMap<>();
        for (IndexSpec spec : listIndexes()) {
            utilization.put(spec.getField(), 0L);
        }

        for (Deque<QueryExecutionStats> history : queryStats.values()) {
            for (QueryExecutionStats stats : history) {
                total++;
                totalTime += stats.getExecutionTimeMs();
                cacheHits += stats.getCacheHits();
                cacheRequests += stats.getCacheHits() + stats.getCacheMisses();
                if (stats.getExecutionTimeMs() > SLOW_QUERY_MILLIS) {
                    slow++;
                }
                if (stats.getIndexedFields() != null) {
                    for (String field : stats.getIndexedFields()) {
                        utilization.merge(field, 1L, Long::sum);
                    }
                }
            }
        }

        return QueryEngineStats.builder()
                .totalQueries(total)
                .averageExecutionTimeMs(total > 0 ? (double) totalTime / total : 0.0)
                .cacheHitRatio(cacheRequests > 0 ? (double) cacheHits / cacheRequests : 0.0)
                .slowQueries(slow)
                .indexUtilization(utilization)
                .build();
    }

    public CompletableFuture<OptimizationReport> optimize() {
        return CompletableFuture.supplyAsync(() -> {
            List<String> slowQueries = new ArrayList<>();
            List<String> recommendations = new ArrayList<>();
            for (Map.Entry<String, Deque<QueryExecutionStats>> entry : queryStats.entrySet()) {
                double average = entry.getValue().stream()
                        .mapToLong(QueryExecutionStats::getExecutionTimeMs)
                        .average()
                        .orElse(0.0);
                if (average > OPTIMIZE_SLOW_AVERAGE_MILLIS) {
                    slowQueries.add(entry.getKey());
                    recommendations.add(String.format(Locale.ROOT,
                            "Query %s averages %.2fms - consider adding indexes", entry.getKey(), average));
                }
            }

            List<IndexSpec> suggested = new ArrayList<>();
            if (computeStats().getTotalQueries() > INDEX_SUGGESTION_QUERY_COUNT) {
                suggested.add(IndexSpec.builder().field("timestamp").type(IndexSpec.IndexType.BTREE)
                        .background(true).build());
                suggested.add(IndexSpec.builder().field("sessionId").type(IndexSpec.IndexType.HASH)
                        .sparse(true).background(true).build());
            }

            return OptimizationReport.builder()
                    .suggestedIndexes(suggested)
                    .slowQueries(slowQueries)
                    .optimizationRecommendations(recommendations)
                    .build();
        }, executor);
    }

    // ==================== Cache ====================

    public CompletableFuture<Void> clearCache() {
        return CompletableFuture.runAsync(() -> {
            cache.clear();
            log.debug("{} Cache cleared", LOG_PREFIX);
        }, executor);
    }

    /**
     * Merge the non-null fields of {@code update} into the cache settings.
     * Disabling the cache drops every entry.
     */
    public CompletableFuture<OperationResult<CacheConfig>> configureCache(CacheConfig update) {
        return supplyOperation("configureCache", () -> {
            CacheConfig merged = cacheConfig.mergedWith(update);
            cache.reconfigure(merged.getMaxSize(), merged.getTtl());
            if (!merged.isEnabled()) {
                cache.clear();
            }
            cacheConfig = merged;
            log.info("{} Cache configured: enabled={}, maxSize={}, ttl={}", LOG_PREFIX, merged.isEnabled(),
                    merged.getMaxSize(), merged.getTtl());
            return merged;
        });
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    private void onBucketsChanged(Set<String> bucketKeys) {
        if (!cacheConfig.isInvalidateOnWrite()) {
            return;
        }
        try {
            executor.execute(() -> {
                if (cache.size() > 0) {
                    log.debug("{} Invalidating {} cached results after write to {}", LOG_PREFIX, cache.size(),
                            bucketKeys);
                    cache.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("{} Query engine stopped, skipping cache invalidation", LOG_PREFIX);
        }
    }

    // ==================== Saved queries ====================

    public CompletableFuture<OperationResult<SavedQuery>> saveQuery(SavedQuery query) {
        return supplyOperation("saveQuery", () -> {
            if (query == null) {
                throw new IllegalArgumentException("Saved query is required");
            }
            SavedQuery stored = SavedQuery.builder()
                    .id(query.getId() != null && !query.getId().isBlank() ? query.getId()
                            : UUID.randomUUID().toString())
                    .name(query.getName())
                    .description(query.getDescription())
                    .filters(query.getFilters() != null ? new ArrayList<>(query.getFilters()) : new ArrayList<>())
                    .options(query.getOptions())
                    .createdAt(query.getCreatedAt() != null ? query.getCreatedAt() : clock.instant())
                    .build();
            savedQueries.put(stored.getId(), stored);
            persistSavedQueries();
            log.info("{} Saved query '{}' ({})", LOG_PREFIX, stored.getName(), stored.getId());
            return stored;
        });
    }

    public CompletableFuture<Optional<SavedQuery>> getSavedQuery(String id) {
        return CompletableFuture.supplyAsync(() -> Optional.ofNullable(savedQueries.get(id)), executor);
    }

    public CompletableFuture<List<SavedQuery>> listSavedQueries() {
        return CompletableFuture.supplyAsync(() -> List.copyOf(savedQueries.values()), executor);
    }

    public CompletableFuture<Boolean> deleteSavedQuery(String id) {
        return CompletableFuture.supplyAsync(() -> {
            if (savedQueries.remove(id) == null) {
                return false;
            }
            persistSavedQueries();
            log.info("{} Deleted saved query {}", LOG_PREFIX, id);
            return true;
        }, executor);
    }

    public CompletableFuture<QueryResult> runSavedQuery(String id) {
        return CompletableFuture.supplyAsync(() -> {
            SavedQuery saved = savedQueries.get(id);
            if (saved == null) {
                return QueryResult.failure("Saved query not found: " + id, 0);
            }
            return executeQuery(saved.getFilters(), saved.getOptions());
        }, executor);
    }

    private void persistSavedQueries() {
        try {
            catalogPort.saveSavedQueries(new LinkedHashMap<>(savedQueries));
        } catch (StorageException e) {
            log.error("{} Failed to save saved queries", LOG_PREFIX, e);
        }
    }

    // ==================== Templates ====================

    public CompletableFuture<OperationResult<QueryTemplate>> saveTemplate(QueryTemplate template) {
        return supplyOperation("saveTemplate", () -> {
            if (template == null) {
                throw new IllegalArgumentException("Query template is required");
            }
            List<QueryFilter> filters = template.getFilters() != null ? new ArrayList<>(template.getFilters())
                    : new ArrayList<>();
            List<String> parameters = template.getParameters() != null && !template.getParameters().isEmpty()
                    ? new ArrayList<>(template.getParameters())
                    : new ArrayList<>(QueryTemplateBinder.placeholders(filters));
            QueryTemplate stored = QueryTemplate.builder()
                    .id(template.getId() != null && !template.getId().isBlank() ? template.getId()
                            : UUID.randomUUID().toString())
                    .name(template.getName())
                    .description(template.getDescription())
                    .filters(filters)
                    .options(template.getOptions())
                    .parameters(parameters)
                    .createdAt(template.getCreatedAt() != null ? template.getCreatedAt() : clock.instant())
                    .build();
            templates.put(stored.getId(), stored);
            persistTemplates();
            log.info("{} Saved template '{}' ({}) with parameters {}", LOG_PREFIX, stored.getName(),
                    stored.getId(), parameters);
            return stored;
        });
    }

    public CompletableFuture<List<QueryTemplate>> listTemplates() {
        return CompletableFuture.supplyAsync(() -> List.copyOf(templates.values()), executor);
    }

    public CompletableFuture<QueryResult> runTemplate(String id, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            QueryTemplate template = templates.get(id);
            if (template == null) {
                return QueryResult.failure("Query template not found: " + id, 0);
            }
            List<QueryFilter> bound;
            try {
                bound = QueryTemplateBinder.bind(template, parameters != null ? parameters : Map.of());
            } catch (IllegalArgumentException e) {
                log.warn("{} Template {} not runnable: {}", LOG_PREFIX, id, e.getMessage());
                return QueryResult.failure(e.getMessage(), 0);
            }
            return executeQuery(bound, template.getOptions());
        }, executor);
    }

    private void persistTemplates() {
        try {
            catalogPort.saveTemplates(new LinkedHashMap<>(templates));
        } catch (StorageException e) {
            log.error("{} Failed to save query templates", LOG_PREFIX, e);
        }
    }

    private <T> CompletableFuture<OperationResult<T>> supplyOperation(String operation, Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return OperationResult.success(action.get());
            } catch (IllegalArgumentException e) {
                log.warn("{} {} rejected: {}", LOG_PREFIX, operation, e.getMessage());
                return OperationResult.<T>failure(e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} {} failed unexpectedly", LOG_PREFIX, operation, e);
                return OperationResult.<T>failure(e.getMessage());
            }
        }, executor);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Row(UsageDataPoint point, Map<String, Object> document) {
    }
}
