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
 * Snapshot of the storage engine's on-disk footprint.
 *
 * <p>
 * {@code compressionRatio} is on-disk bytes divided by decoded JSON bytes, so
 * 1.0 means no saving. Timestamps are epoch millis, 0 when unknown.
 */
@Data
@Builder
public class StorageStats {

    private long totalDataPoints;
    private long totalFileSize;
    private double compressionRatio;
    private long oldestRecord;
    private long newestRecord;
    private double averageDataPointsPerDay;
    private int bucketCount;
    private int compressedBuckets;
    private List<StorageBucket> storageBuckets;
    private long lastCompaction;
    private long lastBackup;
}
