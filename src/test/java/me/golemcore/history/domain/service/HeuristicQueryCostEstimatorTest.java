package me.golemcore.history.domain.service;

import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;
import me.golemcore.history.domain.model.SortSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicQueryCostEstimatorTest {

    private final HeuristicQueryCostEstimator estimator = new HeuristicQueryCostEstimator();

    private static final Map<String, IndexSpec> INDEXES = Map.of(
            "timestamp", IndexSpec.builder().field("timestamp").build(),
            "sessionId", IndexSpec.builder().field("sessionId").type(IndexSpec.IndexType.HASH).build());

    @Test
    void shouldStartFromBaseCostForFullScan() {
        QueryPlan plan = estimator.estimate(List.of(QueryFilter.of("totalCost", FilterOperator.GT, 1)),
                QueryOptions.none(), INDEXES);

        assertEquals(1000, plan.getEstimatedCost());
        assertEquals(List.of(), plan.getIndexesUsed());
        assertEquals(List.of("totalCost"), plan.getFilterOrder());
        assertEquals(1, plan.getBucketsScan());
        assertFalse(plan.isSortRequired());
        assertFalse(plan.isAggregationRequired());
    }

    @Test
    void shouldDiscountIndexedFiltersAndChargeSortKeys() {
        QueryOptions options = QueryOptions.builder()
                .sort(List.of(SortSpec.desc("timestamp"), SortSpec.asc("totalCost")))
                .build();

        QueryPlan plan = estimator.estimate(List.of(
                QueryFilter.of("sessionId", FilterOperator.EQ, "s1"),
                QueryFilter.of("timestamp", FilterOperator.GTE, 0),
                QueryFilter.of("totalCost", FilterOperator.GT, 1)), options, INDEXES);

        assertEquals(1000 - 400 + 200, plan.getEstimatedCost());
        assertEquals(List.of("sessionId", "timestamp"), plan.getIndexesUsed());
        assertTrue(plan.isSortRequired());
    }

    @Test
    void shouldCapCostByLimit() {
        QueryPlan plan = estimator.estimate(List.of(), QueryOptions.builder().limit(5).build(), Map.of());

        assertEquals(50, plan.getEstimatedCost());
    }

    @Test
    void shouldNeverEstimateBelowFloor() {
        QueryPlan limited = estimator.estimate(List.of(), QueryOptions.builder().limit(0).build(), Map.of());
        QueryPlan tiny = estimator.estimate(List.of(), QueryOptions.builder().limit(1).build(), Map.of());
        List<QueryFilter> many = List.of(
                QueryFilter.of("timestamp", FilterOperator.GT, 0), QueryFilter.of("timestamp", FilterOperator.LT, 9),
                QueryFilter.of("sessionId", FilterOperator.EQ, "a"), QueryFilter.of("sessionId", FilterOperator.NE, "b"),
                QueryFilter.of("timestamp", FilterOperator.EXISTS, true),
                QueryFilter.of("sessionId", FilterOperator.EXISTS, true));
        QueryPlan indexed = estimator.estimate(many, QueryOptions.none(), INDEXES);

        assertEquals(1000, limited.getEstimatedCost());
        assertEquals(10, tiny.getEstimatedCost());
        assertEquals(10, indexed.getEstimatedCost());
    }
}
