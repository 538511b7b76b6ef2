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

import me.golemcore.history.domain.model.AggregatedUsage;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.QueryRange;
import me.golemcore.history.domain.model.StorageOperationResult;
import me.golemcore.history.domain.model.StorageStats;
import me.golemcore.history.domain.model.UsageDataPoint;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the historical usage time-series store.
 *
 * <p>
 * Mutating operations never complete exceptionally: failures are reported
 * through {@link StorageOperationResult}. Data-returning operations
 * ({@link #query}, {@link #queryAggregated}, {@link #getStats}) complete
 * exceptionally with a
 * {@link me.golemcore.history.domain.model.StorageException} when the data
 * cannot be read.
 *
 * <p>
 * A storage directory must be owned by a single instance; concurrent writers
 * from other processes lose updates (last whole-file rewrite wins).
 */
public interface TimeSeriesStoragePort {

    /**
     * Insert one point into its bucket, keeping the bucket ordered by timestamp.
     */
    CompletableFuture<StorageOperationResult> store(UsageDataPoint point);

    /**
     * Insert points grouped by bucket, writing each touched bucket once.
     */
    CompletableFuture<StorageOperationResult> storeBatch(List<UsageDataPoint> points);

    /**
     * Points with {@code start <= timestamp <= end}, ascending, then offset and
     * limit.
     */
    CompletableFuture<List<UsageDataPoint>> query(QueryRange range);

    /**
     * Roll the points of {@link #query(QueryRange)} up into windows, ordered by
     * window start.
     */
    CompletableFuture<List<AggregatedUsage>> queryAggregated(QueryRange range, AggregationWindow window);

    CompletableFuture<StorageStats> getStats();

    /**
     * Gzip every uncompressed bucket older than seven days.
     */
    CompletableFuture<StorageOperationResult> compact();

    /**
     * Delete buckets whose end lies before {@code olderThan} (epoch millis).
     */
    CompletableFuture<StorageOperationResult> purgeOldData(long olderThan);

    /**
     * Delete buckets that ended before the configured retention period.
     */
    CompletableFuture<StorageOperationResult> purgeExpired();

    /**
     * Copy the index and bucket files into {@code target}. Relative paths are
     * resolved against the storage's {@code backups/} directory.
     */
    CompletableFuture<StorageOperationResult> backup(Path target);

    /**
     * Replace all local buckets and the index with the backup in
     * {@code source}.
     */
    CompletableFuture<StorageOperationResult> restore(Path source);

    /**
     * Drop the in-memory index. The next operation reloads it from disk.
     */
    CompletableFuture<Void> close();

    void addWriteListener(WriteListener listener);

    /**
     * Notified on the storage thread after buckets were written, compacted,
     * purged or restored. Implementations must not block.
     */
    @FunctionalInterface
    interface WriteListener {
        void onBucketsChanged(Set<String> bucketKeys);
    }
}
