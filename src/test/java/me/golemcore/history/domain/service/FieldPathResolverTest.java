package me.golemcore.history.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.history.domain.model.UsageDataPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class FieldPathResolverTest {

    private final FieldPathResolver resolver = new FieldPathResolver(new ObjectMapper());

    @Test
    void shouldConvertPointToDocumentWithoutNullFields() {
        UsageDataPoint point = UsageDataPoint.builder()
                .timestamp(1_704_067_200_000L)
                .requestCount(3)
                .totalCost(1.25)
                .metadata(Map.of("model", "gpt-4o"))
                .build();

        Map<String, Object> document = resolver.toDocument(point);

        assertEquals(1_704_067_200_000L, ((Number) document.get("timestamp")).longValue());
        assertEquals(1.25, document.get("totalCost"));
        assertEquals("gpt-4o", FieldPathResolver.resolve(document, "metadata.model"));
        assertFalse(document.containsKey("sessionId"));
    }

    @Test
    void shouldReturnNullForMissingOrNonObjectSegments() {
        Map<String, Object> document = Map.of("metadata", Map.of("model", "a"), "sessionId", "s1");

        assertNull(FieldPathResolver.resolve(document, "metadata.region"));
        assertNull(FieldPathResolver.resolve(document, "sessionId.length"));
        assertNull(FieldPathResolver.resolve(document, ""));
        assertNull(FieldPathResolver.resolve(null, "sessionId"));
    }

    @Test
    void shouldProjectNestedPaths() {
        Map<String, Object> document = Map.of(
                "totalCost", 2.0,
                "metadata", Map.of("model", "a", "tier", 1),
                "features", List.of("chat"));

        Map<String, Object> projected = FieldPathResolver.project(document,
                List.of("totalCost", "metadata.model", "missing.path"));

        assertEquals(Map.of("totalCost", 2.0, "metadata", Map.of("model", "a")), projected);
    }
}
