package me.golemcore.history.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Telemetry of one query execution. Cache hits are recorded too, with
 * {@code cacheHits = 1} and nothing scanned.
 */
@Data
@Builder(toBuilder = true)
public class QueryExecutionStats {

    private long executionTimeMs;
    private long rowsScanned;
    private long rowsReturned;
    private int bucketAccess;
    private int cacheHits;
    private int cacheMisses;
    private int indexSeeks;
    private int fullScans;

    // Filter fields that had a declared index, one entry per matching filter
    private List<String> indexedFields;
}
