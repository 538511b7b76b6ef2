package me.golemcore.history.domain.service;

import me.golemcore.history.domain.model.AggregateQueryOptions;
import me.golemcore.history.domain.model.AggregateQueryResult;
import me.golemcore.history.domain.model.AggregationConfig;
import me.golemcore.history.domain.model.AggregationResult;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.CacheConfig;
import me.golemcore.history.domain.model.CorruptionException;
import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.GroupBySpec;
import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.OperationResult;
import me.golemcore.history.domain.model.OptimizationReport;
import me.golemcore.history.domain.model.QueryEngineStats;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;
import me.golemcore.history.domain.model.QueryRange;
import me.golemcore.history.domain.model.QueryResult;
import me.golemcore.history.domain.model.QueryTemplate;
import me.golemcore.history.domain.model.SavedQuery;
import me.golemcore.history.domain.model.SortSpec;
import me.golemcore.history.domain.model.StorageErrorKind;
import me.golemcore.history.domain.model.StorageException;
import me.golemcore.history.domain.model.TimeRange;
import me.golemcore.history.domain.model.UsageDataPoint;
import me.golemcore.history.infrastructure.config.HistoryConfiguration;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.AggregationPort;
import me.golemcore.history.port.outbound.QueryCatalogPort;
import me.golemcore.history.port.outbound.TimeSeriesStoragePort;
import me.golemcore.history.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.any;
import static org.mockito.Mockito.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsageQueryEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-02T00:00:00Z");
    private static final List<UsageDataPoint> POINTS = List.of(
            point("2024-01-01T01:00:00Z", 1.0, "s1", "gpt-4o"),
            point("2024-01-01T02:00:00Z", 2.0, "s1", "claude"),
            point("2024-01-01T03:00:00Z", 3.0, "s2", "gpt-4o"),
            point("2024-01-01T04:00:00Z", 4.0, "s2", "gpt-4o-mini"),
            point("2024-01-01T05:00:00Z", 0.5, "s3", "claude"));

    private TimeSeriesStoragePort storage;
    private AggregationPort aggregationPort;
    private QueryCatalogPort catalogPort;
    private MutableClock clock;
    private final List<UsageQueryEngine> engines = new ArrayList<>();
    private UsageQueryEngine engine;

    @BeforeEach
    void setUp() {
        storage = mock(TimeSeriesStoragePort.class);
        aggregationPort = mock(AggregationPort.class);
        catalogPort = mock(QueryCatalogPort.class);
        clock = new MutableClock(NOW);

        when(storage.query(any())).thenReturn(CompletableFuture.completedFuture(POINTS));

        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        for (UsageQueryEngine e : engines) {
            e.destroy();
        }
    }

    private UsageQueryEngine newEngine() {
        UsageQueryEngine created = new UsageQueryEngine(storage, aggregationPort, catalogPort,
                new HeuristicQueryCostEstimator(), new HistoryProperties(), HistoryConfiguration.objectMapper(),
                clock);
        created.init();
        engines.add(created);
        return created;
    }

    private static UsageDataPoint point(String instant, double cost, String session, String model) {
        return UsageDataPoint.builder()
                .timestamp(Instant.parse(instant).toEpochMilli())
                .requestCount(2)
                .totalCost(cost)
                .dailyLimit(10)
                .usagePercentage(cost * 10)
                .sessionId(session)
                .features(List.of("chat"))
                .metadata(Map.of("model", model))
                .build();
    }

    private static List<Double> costs(QueryResult result) {
        List<Double> costs = new ArrayList<>();
        for (UsageDataPoint p : result.getData()) {
            costs.add(p.getTotalCost());
        }
        return costs;
    }

    private QueryResult run(List<QueryFilter> filters, QueryOptions options) {
        return engine.query(filters, options).join();
    }

    // ==================== Queries ====================

    @Test
    void shouldFilterSortAndPaginate() {
        QueryOptions options = QueryOptions.builder()
                .sort(List.of(SortSpec.desc("totalCost")))
                .skip(1)
                .limit(1)
                .build();

        QueryResult result = run(List.of(QueryFilter.of("totalCost", FilterOperator.GT, 1)), options);

        assertTrue(result.isSuccess());
        assertEquals(List.of(3.0), costs(result));
        assertEquals(3, result.getTotalCount());
        assertTrue(result.isHasMore());
        assertNull(result.getProjection());
        assertEquals(3, result.getStats().getRowsScanned());
        assertEquals(1, result.getStats().getRowsReturned());
        assertEquals(1, result.getStats().getFullScans());
    }

    @Test
    void shouldReportNoMoreRowsOnLastPage() {
        QueryResult result = run(List.of(), QueryOptions.builder().skip(3).limit(5).build());

        assertEquals(List.of(4.0, 0.5), costs(result));
        assertEquals(5, result.getTotalCount());
        assertFalse(result.isHasMore());
    }

    @Test
    void shouldPageToTheEndWithMaximumLimit() {
        QueryResult result = run(List.of(), QueryOptions.builder().skip(1).limit(Integer.MAX_VALUE).build());

        assertTrue(result.isSuccess());
        assertEquals(List.of(2.0, 3.0, 4.0, 0.5), costs(result));
        assertFalse(result.isHasMore());
    }

    @Test
    void shouldReadEverythingUntilNowWithoutTimeRange() {
        run(List.of(), QueryOptions.none());

        verify(storage).query(QueryRange.of(0, NOW.toEpochMilli()));
    }

    @Test
    void shouldMatchNestedMetadataFields() {
        QueryResult result = run(List.of(QueryFilter.regex("metadata.model", "^GPT", false)), QueryOptions.none());

        assertEquals(List.of(1.0, 3.0, 4.0), costs(result));
    }

    @Test
    void shouldProjectSelectedFields() {
        QueryOptions options = QueryOptions.builder()
                .select(List.of("totalCost", "metadata.model"))
                .limit(1)
                .build();

        QueryResult result = run(List.of(), options);

        assertEquals(List.of(Map.of("totalCost", 1.0, "metadata", Map.of("model", "gpt-4o"))),
                result.getProjection());
        assertEquals(1, result.getData().size());
    }

    @Test
    void shouldFailQueryWithInvalidRegexBeforeReadingStorage() {
        QueryResult result = run(List.of(QueryFilter.regex("sessionId", "[unclosed", false)), QueryOptions.none());

        assertFalse(result.isSuccess());
        assertNotNull(result.getError());
        assertTrue(result.getData().isEmpty());
        verify(storage, never()).query(any());
    }

    @Test
    void shouldReturnFailureWhenStorageFails() {
        when(storage.query(any())).thenReturn(
                CompletableFuture.failedFuture(new StorageException(StorageErrorKind.IO_FAILURE, "disk gone")));

        QueryResult result = run(List.of(), QueryOptions.none());

        assertFalse(result.isSuccess());
        assertEquals("disk gone", result.getError());
    }

    // ==================== Cache ====================

    @Test
    void shouldServeRepeatedQueryFromCache() {
        List<QueryFilter> filters = List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s1"),
                QueryFilter.of("totalCost", FilterOperator.GTE, 1));
        List<QueryFilter> reordered = List.of(filters.get(1), filters.get(0));

        QueryResult first = run(filters, QueryOptions.none());
        QueryResult second = run(reordered, QueryOptions.none());

        assertSame(first, second);
        assertEquals(1, first.getStats().getCacheMisses());
        verify(storage, times(1)).query(any());
    }

    @Test
    void shouldExpireCachedResultsAfterTtl() {
        run(List.of(), QueryOptions.none());
        clock.advance(Duration.ofMinutes(4));
        run(List.of(), QueryOptions.none());
        verify(storage, times(1)).query(any());

        clock.advance(Duration.ofMinutes(1));
        run(List.of(), QueryOptions.none());

        verify(storage, times(2)).query(any());
    }

    @Test
    void shouldEvictOldestResultWhenCacheIsFull() {
        engine.configureCache(CacheConfig.builder().maxSize(1).build()).join();

        run(List.of(), QueryOptions.builder().limit(1).build());
        run(List.of(), QueryOptions.builder().limit(2).build());
        run(List.of(), QueryOptions.builder().limit(2).build());
        run(List.of(), QueryOptions.builder().limit(1).build());

        verify(storage, times(3)).query(any());
    }

    @Test
    void shouldBypassCacheWhenDisabled() {
        CacheConfig config = engine.configureCache(CacheConfig.builder().enabled(false).build()).join().getValue();

        QueryResult result = run(List.of(), QueryOptions.none());
        run(List.of(), QueryOptions.none());

        assertFalse(config.isEnabled());
        assertEquals(1000, config.getMaxSize());
        assertEquals(0, result.getStats().getCacheMisses());
        verify(storage, times(2)).query(any());
    }

    @Test
    void shouldRejectNegativeCacheSizeAndKeepSettings() {
        OperationResult<CacheConfig> result = engine.configureCache(CacheConfig.builder().maxSize(-1).build()).join();

        assertFalse(result.isSuccess());
        assertEquals("Cache max size must not be negative: -1", result.getError());
        assertEquals(1000, engine.getCacheConfig().getMaxSize());
    }

    @Test
    void shouldInvalidateCacheWhenStorageChanges() {
        ArgumentCaptor<TimeSeriesStoragePort.WriteListener> listener = ArgumentCaptor
                .forClass(TimeSeriesStoragePort.WriteListener.class);
        verify(storage).addWriteListener(listener.capture());

        run(List.of(), QueryOptions.none());
        listener.getValue().onBucketsChanged(Set.of("2024-01-01"));
        run(List.of(), QueryOptions.none());

        verify(storage, times(2)).query(any());
    }

    @Test
    void shouldKeepCacheOnWriteWhenInvalidationDisabled() {
        ArgumentCaptor<TimeSeriesStoragePort.WriteListener> listener = ArgumentCaptor
                .forClass(TimeSeriesStoragePort.WriteListener.class);
        verify(storage).addWriteListener(listener.capture());
        engine.configureCache(CacheConfig.builder().invalidateOnWrite(false).build()).join();

        run(List.of(), QueryOptions.none());
        listener.getValue().onBucketsChanged(Set.of("2024-01-01"));
        run(List.of(), QueryOptions.none());

        verify(storage, times(1)).query(any());
    }

    @Test
    void shouldClearCacheOnRequest() {
        run(List.of(), QueryOptions.none());

        engine.clearCache().join();
        run(List.of(), QueryOptions.none());

        verify(storage, times(2)).query(any());
    }

    // ==================== Aggregation ====================

    @Test
    void shouldDelegateWindowedAggregationToPort() {
        AggregationResult window = AggregationResult.builder()
                .timeWindow(AggregationWindow.DAY)
                .dataPointCount(2)
                .build();
        when(aggregationPort.aggregate(anyList(), any(AggregationConfig.class)))
                .thenReturn(CompletableFuture.completedFuture(List.of(window)));

        AggregateQueryResult result = engine.aggregateQuery(
                List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s2")), List.of(),
                AggregateQueryOptions.builder().window(AggregationWindow.DAY).build()).join();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<UsageDataPoint>> points = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<AggregationConfig> config = ArgumentCaptor.forClass(AggregationConfig.class);
        verify(aggregationPort).aggregate(points.capture(), config.capture());
        assertTrue(result.isSuccess());
        assertEquals(List.of(window), result.getWindows());
        assertEquals(1, result.getTotalCount());
        assertEquals(2, points.getValue().size());
        assertEquals(List.of(AggregationWindow.DAY), config.getValue().getWindows());
        assertTrue(config.getValue().isTrackFeatureDistribution());
        assertTrue(config.getValue().isTrackTimePatterns());
    }

    @Test
    void shouldGroupRowsWithoutWindow() {
        AggregateQueryResult result = engine.aggregateQuery(List.of(),
                List.of(GroupBySpec.of("sessionId", GroupBySpec.Aggregation.COUNT)),
                AggregateQueryOptions.none()).join();

        assertTrue(result.isSuccess());
        assertEquals(3, result.getTotalCount());
        assertEquals("s1", result.getRows().get(0).get("sessionId"));
        assertEquals(2L, result.getRows().get(0).get("sessionId_count"));
        assertEquals(1L, result.getRows().get(2).get("sessionId_count"));
        verify(aggregationPort, never()).aggregate(anyList(), any());
    }

    @Test
    void shouldReturnEmptyAggregateWhenNothingMatches() {
        AggregateQueryResult result = engine.aggregateQuery(
                List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "nobody")), List.of(),
                AggregateQueryOptions.builder().window(AggregationWindow.HOUR).build()).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getRows().isEmpty());
        assertTrue(result.getWindows().isEmpty());
        verify(aggregationPort, never()).aggregate(anyList(), any());
    }

    @Test
    void shouldPropagateQueryFailureToAggregate() {
        AggregateQueryResult result = engine.aggregateQuery(
                List.of(QueryFilter.regex("sessionId", "(", true)), List.of(), null).join();

        assertFalse(result.isSuccess());
        assertNotNull(result.getError());
    }

    // ==================== Indexes and plans ====================

    @Test
    void shouldCreateIndexesAndUseThemInPlans() {
        engine.createIndex(IndexSpec.builder().field("timestamp").type(null).build()).join();
        engine.createIndex(IndexSpec.builder().field("sessionId").type(IndexSpec.IndexType.HASH).build()).join();

        List<IndexSpec> indexes = engine.listIndexes();
        QueryPlan plan = engine.explainQuery(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s1")),
                QueryOptions.builder().sort(List.of(SortSpec.asc("timestamp"))).build());
        QueryResult result = run(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s1")), QueryOptions.none());

        assertEquals(List.of("sessionId", "timestamp"), indexes.stream().map(IndexSpec::getField).toList());
        assertEquals(IndexSpec.IndexType.BTREE, indexes.get(1).getType());
        assertEquals(900, plan.getEstimatedCost());
        assertEquals(List.of("sessionId"), plan.getIndexesUsed());
        assertEquals(1, result.getStats().getIndexSeeks());
        assertEquals(0, result.getStats().getFullScans());
        verify(catalogPort, times(2)).saveIndexes(any());
    }

    @Test
    void shouldDropIndex() {
        engine.createIndex(IndexSpec.builder().field("sessionId").build()).join();

        engine.dropIndex("sessionId").join();
        engine.dropIndex("unknown").join();

        assertTrue(engine.listIndexes().isEmpty());
        verify(catalogPort, times(2)).saveIndexes(any());
    }

    @Test
    void shouldRejectIndexWithoutField() {
        OperationResult<IndexSpec> result = engine.createIndex(IndexSpec.builder().field(" ").build()).join();

        assertFalse(result.isSuccess());
        assertEquals("Index field is required", result.getError());
        assertNull(result.getValue());
        assertTrue(engine.listIndexes().isEmpty());
        verify(catalogPort, never()).saveIndexes(any());
    }

    @Test
    void shouldStoreCopyOfIndexSpec() {
        IndexSpec requested = IndexSpec.builder().field("sessionId").type(null).build();

        OperationResult<IndexSpec> result = engine.createIndex(requested).join();
        requested.setField("renamed");

        assertTrue(result.isSuccess());
        assertNull(requested.getType());
        assertEquals(IndexSpec.IndexType.BTREE, result.getValue().getType());
        assertEquals(List.of("sessionId"), engine.listIndexes().stream().map(IndexSpec::getField).toList());
    }

    @Test
    void shouldStartWithoutCatalogsThatFailToLoad() {
        when(catalogPort.loadIndexes()).thenThrow(new CorruptionException("bad indexes", null));

        UsageQueryEngine recovered = newEngine();

        assertTrue(recovered.listIndexes().isEmpty());
        assertTrue(recovered.query(List.of(), QueryOptions.none()).join().isSuccess());
    }

    // ==================== Statistics ====================

    @Test
    void shouldAggregateExecutionStatistics() {
        engine.createIndex(IndexSpec.builder().field("sessionId").build()).join();
        engine.createIndex(IndexSpec.builder().field("timestamp").build()).join();

        run(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s1")), QueryOptions.none());
        run(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s1")), QueryOptions.none());
        run(List.of(QueryFilter.of("totalCost", FilterOperator.GT, 1)), QueryOptions.none());

        QueryEngineStats stats = engine.getStats().join();

        assertEquals(3, stats.getTotalQueries());
        assertEquals(1.0 / 3, stats.getCacheHitRatio(), 1e-9);
        assertEquals(0, stats.getSlowQueries());
        assertEquals(Map.of("sessionId", 1L, "timestamp", 0L), stats.getIndexUtilization());
    }

    @Test
    void shouldReportEmptyStatisticsBeforeAnyQuery() {
        QueryEngineStats stats = engine.getStats().join();

        assertEquals(0, stats.getTotalQueries());
        assertEquals(0.0, stats.getAverageExecutionTimeMs());
        assertEquals(0.0, stats.getCacheHitRatio());
    }

    @Test
    void shouldSuggestIndexesAfterManyQueries() {
        for (int i = 0; i < 101; i++) {
            run(List.of(), QueryOptions.none());
        }

        OptimizationReport report = engine.optimize().join();

        assertEquals(2, report.getSuggestedIndexes().size());
        IndexSpec timestamp = report.getSuggestedIndexes().get(0);
        IndexSpec session = report.getSuggestedIndexes().get(1);
        assertEquals("timestamp", timestamp.getField());
        assertEquals(IndexSpec.IndexType.BTREE, timestamp.getType());
        assertTrue(timestamp.isBackground());
        assertEquals("sessionId", session.getField());
        assertEquals(IndexSpec.IndexType.HASH, session.getType());
        assertTrue(session.isSparse());
        assertTrue(report.getSlowQueries().isEmpty());
    }

    @Test
    void shouldFlagSlowQueriesInOptimizationReport() {
        when(storage.query(any())).thenAnswer(invocation -> {
            Thread.sleep(520);
            return CompletableFuture.completedFuture(POINTS);
        });
        engine.configureCache(CacheConfig.builder().enabled(false).build()).join();

        run(List.of(QueryFilter.of("totalCost", FilterOperator.GT, 1)), QueryOptions.none());
        OptimizationReport report = engine.optimize().join();

        assertEquals(1, report.getSlowQueries().size());
        String recommendation = report.getOptimizationRecommendations().get(0);
        assertTrue(recommendation.startsWith("Query " + report.getSlowQueries().get(0) + " averages "));
        assertTrue(recommendation.endsWith("ms - consider adding indexes"));
        assertTrue(report.getSuggestedIndexes().isEmpty());
    }

    // ==================== Saved queries ====================

    @Test
    void shouldSaveAndRunQuery() {
        SavedQuery saved = engine.saveQuery(SavedQuery.builder()
                .name("expensive")
                .filters(List.of(QueryFilter.of("totalCost", FilterOperator.GTE, 3)))
                .build()).join().getValue();

        QueryResult result = engine.runSavedQuery(saved.getId()).join();

        assertNotNull(saved.getId());
        assertEquals(NOW, saved.getCreatedAt());
        assertEquals(List.of(3.0, 4.0), costs(result));
        assertEquals(Optional.of(saved), engine.getSavedQuery(saved.getId()).join());
        assertEquals(List.of(saved), engine.listSavedQueries().join());
        verify(catalogPort).saveSavedQueries(Map.of(saved.getId(), saved));
    }

    @Test
    void shouldRejectMissingSavedQuery() {
        OperationResult<SavedQuery> result = engine.saveQuery(null).join();

        assertFalse(result.isSuccess());
        assertEquals("Saved query is required", result.getError());
        assertTrue(engine.listSavedQueries().join().isEmpty());
    }

    @Test
    void shouldDeleteSavedQuery() {
        SavedQuery saved = engine.saveQuery(SavedQuery.builder().id("q-1").name("all").build()).join().getValue();

        assertTrue(engine.deleteSavedQuery(saved.getId()).join());
        assertFalse(engine.deleteSavedQuery(saved.getId()).join());
        assertEquals(Optional.empty(), engine.getSavedQuery("q-1").join());
    }

    @Test
    void shouldFailToRunUnknownSavedQuery() {
        QueryResult result = engine.runSavedQuery("missing").join();

        assertFalse(result.isSuccess());
        assertEquals("Saved query not found: missing", result.getError());
    }

    @Test
    void shouldRunSavedQueriesLoadedFromCatalog() {
        SavedQuery stored = SavedQuery.builder()
                .id("q-7")
                .name("session two")
                .filters(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "s2")))
                .options(QueryOptions.builder().sort(List.of(SortSpec.desc("totalCost"))).build())
                .build();
        when(catalogPort.loadSavedQueries()).thenReturn(new LinkedHashMap<>(Map.of("q-7", stored)));

        UsageQueryEngine restarted = newEngine();

        assertEquals(List.of(4.0, 3.0), costs(restarted.runSavedQuery("q-7").join()));
    }

    @Test
    void shouldKeepSavedQueryWhenCatalogWriteFails() {
        doThrow(new StorageException(StorageErrorKind.IO_FAILURE, "read-only")).when(catalogPort)
                .saveSavedQueries(any());

        SavedQuery saved = engine.saveQuery(SavedQuery.builder().id("q-1").name("all").build()).join().getValue();

        assertEquals(Optional.of(saved), engine.getSavedQuery("q-1").join());
    }

    // ==================== Templates ====================

    @Test
    void shouldDeriveTemplateParametersAndRunWithBindings() {
        QueryTemplate template = engine.saveTemplate(QueryTemplate.builder()
                .name("session spend")
                .filters(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "{{session}}"),
                        QueryFilter.of("totalCost", FilterOperator.GTE, "{{minCost}}")))
                .build()).join().getValue();

        QueryResult result = engine.runTemplate(template.getId(), Map.of("session", "s2", "minCost", 3.5)).join();

        assertEquals(List.of("session", "minCost"), template.getParameters());
        assertEquals(List.of(4.0), costs(result));
        assertEquals(List.of(template), engine.listTemplates().join());
        verify(catalogPort).saveTemplates(any());
    }

    @Test
    void shouldFailTemplateRunWithMissingParameter() {
        QueryTemplate template = engine.saveTemplate(QueryTemplate.builder()
                .id("t-1")
                .filters(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "{{session}}")))
                .build()).join().getValue();

        QueryResult result = engine.runTemplate(template.getId(), Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Missing template parameter: session", result.getError());
        verify(storage, never()).query(any());
    }

    @Test
    void shouldRejectMissingTemplate() {
        OperationResult<QueryTemplate> result = engine.saveTemplate(null).join();

        assertFalse(result.isSuccess());
        assertEquals("Query template is required", result.getError());
        verify(catalogPort, never()).saveTemplates(any());
    }

    @Test
    void shouldFailToRunUnknownTemplate() {
        QueryResult result = engine.runTemplate("nope", Map.of()).join();

        assertEquals("Query template not found: nope", result.getError());
    }

    // ==================== Builder ====================

    @Test
    void shouldExecuteBuiltQuery() {
        long start = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();
        long end = Instant.parse("2024-01-01T23:59:59Z").toEpochMilli();

        QueryResult result = engine.createQuery()
                .timeRange(start, end)
                .where("sessionId", FilterOperator.EQ, "s2")
                .orderBy("totalCost", SortSpec.Direction.DESC)
                .select("totalCost")
                .execute()
                .join();
        long count = engine.createQuery()
                .timeRange(start, end)
                .whereAnd("metadata.model", FilterOperator.IN, List.of("claude"))
                .limit(1)
                .count()
                .join();

        assertEquals(List.of(Map.of("totalCost", 4.0), Map.of("totalCost", 3.0)), result.getProjection());
        assertEquals(2L, count);
        verify(storage, times(2)).query(QueryRange.of(start, end));
    }

    @Test
    void shouldCarryBuilderStateIntoOptions() {
        UsageQueryBuilder builder = engine.createQuery()
                .timeRange(10, 20)
                .where(QueryFilter.of("totalCost", FilterOperator.GT, 1))
                .orderBy("timestamp", SortSpec.Direction.ASC)
                .skip(5)
                .limit(10);

        QueryOptions options = builder.options();
        QueryPlan plan = builder.explain();

        assertEquals(TimeRange.of(10, 20), options.getTimeRange());
        assertEquals(5, options.getSkip());
        assertEquals(10, options.getLimit());
        assertEquals(List.of(SortSpec.asc("timestamp")), options.getSort());
        assertTrue(plan.isSortRequired());
        assertEquals(100, plan.getEstimatedCost());
    }

    @Test
    void shouldAggregateBuiltQueryByWindow() {
        when(aggregationPort.aggregate(anyList(), any(AggregationConfig.class)))
                .thenReturn(CompletableFuture.completedFuture(List.of()));

        AggregateQueryResult result = engine.createQuery()
                .where("sessionId", FilterOperator.NE, "s3")
                .aggregate(AggregationWindow.HOUR)
                .join();

        assertTrue(result.isSuccess());
        verify(aggregationPort).aggregate(anyList(), any(AggregationConfig.class));
    }
}
