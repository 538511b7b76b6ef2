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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.history.domain.model.StorageBucket;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of {@code index.json}: bucket entries as {@code [key, bucket]}
 * pairs in insertion order, plus bookkeeping timestamps (epoch millis).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "buckets", "lastUpdated", "version", "lastCompaction", "lastBackup" })
class BucketIndexDocument {

    static final String CURRENT_VERSION = "1.0";

    @Builder.Default
    private List<Entry> buckets = new ArrayList<>();

    private long lastUpdated;

    @Builder.Default
    private String version = CURRENT_VERSION;

    private long lastCompaction;
    private long lastBackup;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({ "key", "bucket" })
    static class Entry {
        private String key;
        private StorageBucket bucket;
    }
}
