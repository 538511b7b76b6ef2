package me.golemcore.history.domain.service;

import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.QueryFilter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterEvaluatorTest {

    private static final Map<String, Object> DOCUMENT = Map.of(
            "timestamp", 1_704_067_200_000L,
            "totalCost", 2.5,
            "requestCount", 5,
            "sessionId", "session-Alpha",
            "features", List.of("chat", "tools"),
            "metadata", Map.of("model", "gpt-4o", "tier", 2));

    private static boolean matches(String field, FilterOperator operator, Object value) {
        return FilterEvaluator.matches(DOCUMENT, QueryFilter.of(field, operator, value));
    }

    @Test
    void shouldCompareNumbersByValueForEquality() {
        assertTrue(matches("requestCount", FilterOperator.EQ, 5.0));
        assertTrue(matches("totalCost", FilterOperator.EQ, 2.5));
        assertFalse(matches("requestCount", FilterOperator.NE, 5L));
        assertTrue(matches("sessionId", FilterOperator.NE, "other"));
    }

    @Test
    void shouldApplyOrderingOperatorsOnNumbersOnly() {
        assertTrue(matches("totalCost", FilterOperator.GT, 2));
        assertFalse(matches("totalCost", FilterOperator.GT, 2.5));
        assertTrue(matches("totalCost", FilterOperator.GTE, 2.5));
        assertTrue(matches("requestCount", FilterOperator.LT, 6));
        assertTrue(matches("requestCount", FilterOperator.LTE, 5));
        assertFalse(matches("sessionId", FilterOperator.GT, "a"));
        assertFalse(matches("missing", FilterOperator.LT, 10));
    }

    @Test
    void shouldMatchMembershipOperators() {
        assertTrue(matches("sessionId", FilterOperator.IN, List.of("x", "session-Alpha")));
        assertFalse(matches("sessionId", FilterOperator.NIN, List.of("x", "session-Alpha")));
        assertTrue(matches("requestCount", FilterOperator.IN, List.of(4.0, 5.0)));
        assertTrue(matches("sessionId", FilterOperator.NIN, List.of("x")));
    }

    @Test
    void shouldTreatEmptyMembershipListsAsNoMatchAndAllMatch() {
        assertFalse(matches("sessionId", FilterOperator.IN, List.of()));
        assertTrue(matches("sessionId", FilterOperator.NIN, List.of()));
        assertFalse(matches("missing", FilterOperator.IN, List.of()));
    }

    @Test
    void shouldPassUnrecognizedOperators() {
        FilterOperator operator = FilterOperator.fromValue("like");

        assertEquals(FilterOperator.UNKNOWN, operator);
        assertTrue(matches("sessionId", operator, "nothing alike"));
        assertTrue(FilterEvaluator.matches(DOCUMENT, QueryFilter.of("sessionId", null, "x")));
    }

    @Test
    void shouldNotMatchMembershipWhenValueIsNotCollection() {
        assertFalse(matches("sessionId", FilterOperator.IN, "session-Alpha"));
        assertFalse(matches("sessionId", FilterOperator.NIN, "x"));
    }

    @Test
    void shouldTestExistenceOfNestedFields() {
        assertTrue(matches("metadata.model", FilterOperator.EXISTS, true));
        assertFalse(matches("metadata.region", FilterOperator.EXISTS, true));
        assertFalse(matches("sessionId.inner", FilterOperator.EXISTS, true));
    }

    @Test
    void shouldResolveDotPathsForComparison() {
        assertTrue(matches("metadata.model", FilterOperator.EQ, "gpt-4o"));
        assertTrue(matches("metadata.tier", FilterOperator.GTE, 2));
    }

    @Test
    void shouldMatchRegexCaseInsensitiveByDefault() {
        assertTrue(matches("sessionId", FilterOperator.REGEX, "alpha"));
        assertTrue(matches("sessionId", FilterOperator.REGEX, "^session-"));
        assertFalse(FilterEvaluator.matches(DOCUMENT, QueryFilter.regex("sessionId", "alpha", true)));
        assertTrue(FilterEvaluator.matches(DOCUMENT, QueryFilter.regex("sessionId", "Alpha", true)));
    }

    @Test
    void shouldNotMatchRegexOnNonStringField() {
        assertFalse(matches("totalCost", FilterOperator.REGEX, "2"));
    }

    @Test
    void shouldMatchBetweenInclusively() {
        assertTrue(matches("totalCost", FilterOperator.BETWEEN, List.of(2.5, 3)));
        assertTrue(matches("totalCost", FilterOperator.BETWEEN, List.of(1, 2.5)));
        assertFalse(matches("totalCost", FilterOperator.BETWEEN, List.of(3, 4)));
        assertFalse(matches("totalCost", FilterOperator.BETWEEN, List.of(1)));
        assertFalse(matches("totalCost", FilterOperator.BETWEEN, List.of("a", "b")));
    }

    @Test
    void shouldPassUnknownOperator() {
        assertTrue(matches("totalCost", FilterOperator.fromValue("near"), 1));
        assertTrue(FilterEvaluator.matches(DOCUMENT, QueryFilter.builder().field("totalCost").value(1).build()));
    }

    @Test
    void shouldRequireEveryFilterToMatch() {
        List<QueryFilter> filters = List.of(
                QueryFilter.of("totalCost", FilterOperator.GT, 1),
                QueryFilter.of("metadata.model", FilterOperator.EQ, "gpt-4o"));
        assertTrue(FilterEvaluator.matchesAll(DOCUMENT, filters));

        List<QueryFilter> failing = List.of(
                QueryFilter.of("totalCost", FilterOperator.GT, 1),
                QueryFilter.of("metadata.model", FilterOperator.EQ, "claude"));
        assertFalse(FilterEvaluator.matchesAll(DOCUMENT, failing));
        assertTrue(FilterEvaluator.matchesAll(DOCUMENT, List.of()));
    }

    @Test
    void shouldRejectInvalidRegexOnValidation() {
        List<QueryFilter> filters = List.of(QueryFilter.of("sessionId", FilterOperator.REGEX, "[unclosed"));

        assertThrows(PatternSyntaxException.class, () -> FilterEvaluator.validate(filters));
        assertDoesNotThrow(() -> FilterEvaluator.validate(
                List.of(QueryFilter.of("sessionId", FilterOperator.REGEX, "session-\\w+"))));
    }
}
