package me.golemcore.history.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.domain.model.CorruptionException;
import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryTemplate;
import me.golemcore.history.domain.model.SavedQuery;
import me.golemcore.history.domain.model.StorageErrorKind;
import me.golemcore.history.domain.model.StorageException;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.QueryCatalogPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local filesystem implementation of {@link QueryCatalogPort}.
 *
 * <p>
 * Files under the query base directory
 * ({@code history.query.base-path}):
 * <ul>
 * <li>{@code indexes/indexes.json} - declared indexes by field</li>
 * <li>{@code saved-queries/saved-queries.json} - saved queries by id</li>
 * <li>{@code saved-queries/templates.json} - query templates by id</li>
 * <li>{@code query-cache/} - reserved, created on startup</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalQueryCatalogAdapter implements QueryCatalogPort {

    private static final String LOG_PREFIX = "[Query]";
    private static final String INDEXES_DIR = "indexes";
    private static final String SAVED_QUERIES_DIR = "saved-queries";
    private static final String CACHE_DIR = "query-cache";
    private static final String INDEXES_FILE = "indexes.json";
    private static final String SAVED_QUERIES_FILE = "saved-queries.json";
    private static final String TEMPLATES_FILE = "templates.json";

    private static final TypeReference<LinkedHashMap<String, IndexSpec>> INDEX_MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, SavedQuery>> SAVED_QUERY_MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, QueryTemplate>> TEMPLATE_MAP_TYPE = new TypeReference<>() {
    };

    private final HistoryProperties properties;
    private final ObjectMapper objectMapper;

    private Path basePath;

    @PostConstruct
    public void init() {
        this.basePath = HistoryProperties.resolvePath(properties.getQuery().getBasePath());
        try {
            for (String dir : List.of(INDEXES_DIR, SAVED_QUERIES_DIR, CACHE_DIR)) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("{} Query catalogs initialized at: {}", LOG_PREFIX, basePath);
        } catch (IOException e) {
            log.error("{} Failed to create query engine directories", LOG_PREFIX, e);
        }
    }

    @Override
    public Map<String, IndexSpec> loadIndexes() {
        return load(indexesPath(), INDEX_MAP_TYPE);
    }

    @Override
    public void saveIndexes(Map<String, IndexSpec> indexes) {
        save(indexesPath(), indexes);
    }

    @Override
    public Map<String, SavedQuery> loadSavedQueries() {
        return load(savedQueriesPath(), SAVED_QUERY_MAP_TYPE);
    }

    @Override
    public void saveSavedQueries(Map<String, SavedQuery> queries) {
        save(savedQueriesPath(), queries);
    }

    @Override
    public Map<String, QueryTemplate> loadTemplates() {
        return load(templatesPath(), TEMPLATE_MAP_TYPE);
    }

    @Override
    public void saveTemplates(Map<String, QueryTemplate> templates) {
        save(templatesPath(), templates);
    }

    private Path indexesPath() {
        return requireBasePath().resolve(INDEXES_DIR).resolve(INDEXES_FILE);
    }

    private Path savedQueriesPath() {
        return requireBasePath().resolve(SAVED_QUERIES_DIR).resolve(SAVED_QUERIES_FILE);
    }

    private Path templatesPath() {
        return requireBasePath().resolve(SAVED_QUERIES_DIR).resolve(TEMPLATES_FILE);
    }

    private Path requireBasePath() {
        if (basePath == null) {
            init();
        }
        return basePath;
    }

    private <T> Map<String, T> load(Path path, TypeReference<LinkedHashMap<String, T>> type) {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        try {
            String json = Files.readString(path);
            if (json.isBlank()) {
                return new LinkedHashMap<>();
            }
            Map<String, T> loaded = objectMapper.readValue(json, type);
            log.debug("{} Loaded {} entries from {}", LOG_PREFIX, loaded.size(), path.getFileName());
            return loaded;
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Malformed catalog file: " + path, e);
        } catch (IOException e) {
            throw new StorageException(StorageErrorKind.IO_FAILURE, "Failed to read catalog file: " + path, e);
        }
    }

    private void save(Path path, Map<String, ?> entries) {
        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entries);
            BucketFileCodec.writeAtomic(path, json);
            log.debug("{} Saved {} entries to {}", LOG_PREFIX, entries.size(), path.getFileName());
        } catch (IOException e) {
            throw new StorageException(StorageErrorKind.IO_FAILURE, "Failed to write catalog file: " + path, e);
        }
    }
}
