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

import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryTemplate;
import me.golemcore.history.domain.model.SavedQuery;

import java.util.Map;

/**
 * Persistence of the query engine's own catalogs: declared indexes, saved
 * queries and query templates. Each catalog is stored as one JSON object keyed
 * by field name or id.
 *
 * <p>
 * Loads return an empty map when nothing was saved yet and throw
 * {@link me.golemcore.history.domain.model.CorruptionException} when the file
 * cannot be parsed. Saves throw
 * {@link me.golemcore.history.domain.model.StorageException} on I/O failure.
 */
public interface QueryCatalogPort {

    Map<String, IndexSpec> loadIndexes();

    void saveIndexes(Map<String, IndexSpec> indexes);

    Map<String, SavedQuery> loadSavedQueries();

    void saveSavedQueries(Map<String, SavedQuery> queries);

    Map<String, QueryTemplate> loadTemplates();

    void saveTemplates(Map<String, QueryTemplate> templates);
}
