package me.golemcore.history.adapter.outbound.storage;

import me.golemcore.history.domain.model.CorruptionException;
import me.golemcore.history.domain.model.FilterOperator;
import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryTemplate;
import me.golemcore.history.domain.model.SavedQuery;
import me.golemcore.history.domain.model.SortSpec;
import me.golemcore.history.domain.model.TimeRange;
import me.golemcore.history.infrastructure.config.HistoryConfiguration;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalQueryCatalogAdapterTest {

    @TempDir
    Path tempDir;

    private LocalQueryCatalogAdapter adapter;

    @BeforeEach
    void setUp() {
        HistoryProperties properties = new HistoryProperties();
        properties.getQuery().setBasePath(tempDir.toString());
        adapter = new LocalQueryCatalogAdapter(properties, HistoryConfiguration.objectMapper());
        adapter.init();
    }

    @Test
    void shouldCreateCatalogDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("indexes")));
        assertTrue(Files.isDirectory(tempDir.resolve("saved-queries")));
        assertTrue(Files.isDirectory(tempDir.resolve("query-cache")));
    }

    @Test
    void shouldLoadEmptyCatalogsWhenFilesAreMissing() {
        assertTrue(adapter.loadIndexes().isEmpty());
        assertTrue(adapter.loadSavedQueries().isEmpty());
        assertTrue(adapter.loadTemplates().isEmpty());
    }

    @Test
    void shouldPersistIndexesKeyedByField() {
        Map<String, IndexSpec> indexes = new LinkedHashMap<>();
        indexes.put("sessionId", IndexSpec.builder().field("sessionId").type(IndexSpec.IndexType.HASH)
                .sparse(true).build());
        indexes.put("timestamp", IndexSpec.builder().field("timestamp").build());

        adapter.saveIndexes(indexes);

        assertEquals(indexes, adapter.loadIndexes());
        assertTrue(Files.exists(tempDir.resolve("indexes").resolve("indexes.json")));
    }

    @Test
    void shouldPersistSavedQueriesWithFiltersAndOptions() {
        SavedQuery query = SavedQuery.builder()
                .id("q-1")
                .name("expensive")
                .description("Costly requests")
                .filters(List.of(QueryFilter.of("totalCost", FilterOperator.GT, 2.5),
                        QueryFilter.of("sessionId", FilterOperator.IN, List.of("a", "b"))))
                .options(QueryOptions.builder()
                        .sort(List.of(SortSpec.desc("totalCost")))
                        .limit(10)
                        .timeRange(TimeRange.of(0, 1000))
                        .build())
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        adapter.saveSavedQueries(Map.of("q-1", query));
        SavedQuery loaded = adapter.loadSavedQueries().get("q-1");

        assertEquals(query, loaded);
        assertEquals(FilterOperator.GT, loaded.getFilters().get(0).getOperator());
        assertEquals(SortSpec.Direction.DESC, loaded.getOptions().getSort().get(0).getDirection());
    }

    @Test
    void shouldPersistTemplatesSeparately() {
        QueryTemplate template = QueryTemplate.builder()
                .id("t-1")
                .name("by session")
                .filters(List.of(QueryFilter.of("sessionId", FilterOperator.EQ, "{{session}}")))
                .parameters(List.of("session"))
                .build();

        adapter.saveTemplates(Map.of("t-1", template));

        assertEquals(template, adapter.loadTemplates().get("t-1"));
        assertTrue(adapter.loadSavedQueries().isEmpty());
        assertTrue(Files.exists(tempDir.resolve("saved-queries").resolve("templates.json")));
    }

    @Test
    void shouldTreatBlankCatalogFileAsEmpty() throws Exception {
        Files.writeString(tempDir.resolve("indexes").resolve("indexes.json"), "  \n");

        assertTrue(adapter.loadIndexes().isEmpty());
    }

    @Test
    void shouldReportCorruptionForMalformedCatalog() throws Exception {
        Files.writeString(tempDir.resolve("saved-queries").resolve("saved-queries.json"), "{\"q\": [");

        assertThrows(CorruptionException.class, () -> adapter.loadSavedQueries());
    }
}
