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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.domain.model.AggregatedUsage;
import me.golemcore.history.domain.model.AggregationWindow;
import me.golemcore.history.domain.model.CorruptionException;
import me.golemcore.history.domain.model.Granularity;
import me.golemcore.history.domain.model.QueryRange;
import me.golemcore.history.domain.model.StorageBucket;
import me.golemcore.history.domain.model.StorageErrorKind;
import me.golemcore.history.domain.model.StorageException;
import me.golemcore.history.domain.model.StorageOperationResult;
import me.golemcore.history.domain.model.StorageStats;
import me.golemcore.history.domain.model.TimeRange;
import me.golemcore.history.domain.model.UsageDataPoint;
import me.golemcore.history.domain.service.BucketKeyCodec;
import me.golemcore.history.domain.service.UsageWindowAggregator;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.TimeSeriesStoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * File-backed implementation of {@link TimeSeriesStoragePort}.
 *
 * <p>
 * Layout under the base directory
 * ({@code history.storage.base-path}):
 * <ul>
 * <li>{@code index.json} - bucket descriptors and bookkeeping timestamps</li>
 * <li>{@code buckets/<key>.json} or {@code buckets/<key>.json.gz} - one JSON
 * array of points per bucket, sorted by timestamp</li>
 * <li>{@code backups/} - default parent of relative backup targets</li>
 * </ul>
 *
 * <p>
 * Every operation runs on one storage thread, so bucket read-modify-write
 * cycles never interleave. The index is loaded lazily on first use and again
 * after {@link #close()}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class FileTimeSeriesStorage implements TimeSeriesStoragePort {

    private static final String LOG_PREFIX = "[Storage]";
    private static final String INDEX_FILE = "index.json";
    private static final String BUCKETS_DIR = "buckets";
    private static final String BACKUPS_DIR = "backups";
    private static final String JSON_EXTENSION = ".json";

    private static final long COMPRESSION_AGE_MILLIS = Duration.ofDays(7).toMillis();
    private static final long MINUTE_GRANULARITY_AGE_MILLIS = Duration.ofDays(7).toMillis();
    private static final long HOUR_GRANULARITY_AGE_MILLIS = Duration.ofDays(30).toMillis();
    private static final double DAY_MILLIS = Duration.ofDays(1).toMillis();
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final HistoryProperties.StorageProperties config;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final BucketKeyCodec keyCodec;
    private final BucketFileCodec fileCodec;
    private final Path baseDir;
    private final Path indexPath;
    private final Path bucketsDir;

    // Only touched from the storage thread
    private final Map<String, StorageBucket> bucketIndex = new LinkedHashMap<>();
    private boolean initialized;
    private long lastCompaction;
    private long lastBackup;

    private final List<WriteListener> writeListeners = new CopyOnWriteArrayList<>();

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "history-storage");
        t.setDaemon(true);
        return t;
    });

    public FileTimeSeriesStorage(HistoryProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getStorage();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyCodec = new BucketKeyCodec(config.getBucketStrategy());
        this.fileCodec = new BucketFileCodec(objectMapper);
        this.baseDir = HistoryProperties.resolvePath(config.getBasePath());
        this.indexPath = baseDir.resolve(INDEX_FILE);
        this.bucketsDir = baseDir.resolve(BUCKETS_DIR);
    }

    @PreDestroy
    void destroy() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    Path getBaseDir() {
        return baseDir;
    }

    @Override
    public void addWriteListener(WriteListener listener) {
        writeListeners.add(listener);
    }

    // ==================== Writes ====================

    @Override
    public CompletableFuture<StorageOperationResult> store(UsageDataPoint point) {
        return runOperation("store", () -> {
            if (point == null) {
                throw new IllegalArgumentException("Data point is required");
            }
            String key = keyCodec.keyFor(point.getTimestamp());
            StorageBucket bucket = getOrCreateBucket(key, point.getTimestamp());

            List<UsageDataPoint> points = new ArrayList<>(fileCodec.read(bucket));
            points.add(upperBound(points, point.getTimestamp()), point);
            fileCodec.write(bucket, points);

            log.debug("{} Stored point at {} in bucket {}", LOG_PREFIX, point.getTimestamp(), key);
            notifyListeners(Set.of(key));
            return 1;
        });
    }

    @Override
    public CompletableFuture<StorageOperationResult> storeBatch(List<UsageDataPoint> points) {
        return runOperation("storeBatch", () -> {
            if (points == null || points.isEmpty()) {
                return 0;
            }
            Map<String, List<UsageDataPoint>> byBucket = new LinkedHashMap<>();
            for (UsageDataPoint point : points) {
                if (point == null) {
                    throw new IllegalArgumentException("Batch contains a null data point");
                }
                byBucket.computeIfAbsent(keyCodec.keyFor(point.getTimestamp()), k -> new ArrayList<>()).add(point);
            }

            for (Map.Entry<String, List<UsageDataPoint>> entry : byBucket.entrySet()) {
                List<UsageDataPoint> incoming = entry.getValue();
                StorageBucket bucket = getOrCreateBucket(entry.getKey(), incoming.get(0).getTimestamp());
                List<UsageDataPoint> merged = new ArrayList<>(fileCodec.read(bucket));
                merged.addAll(incoming);
                // List.sort is stable: equal timestamps keep existing-then-incoming order
                merged.sort(Comparator.comparingLong(UsageDataPoint::getTimestamp));
                fileCodec.write(bucket, merged);
            }

            log.debug("{} Stored batch of {} points across {} buckets", LOG_PREFIX, points.size(), byBucket.size());
            notifyListeners(byBucket.keySet());
            return points.size();
        });
    }

    // ==================== Reads ====================

    @Override
    public CompletableFuture<List<UsageDataPoint>> query(QueryRange range) {
        return supplyData(() -> queryRange(range));
    }

    @Override
    public CompletableFuture<List<AggregatedUsage>> queryAggregated(QueryRange range, AggregationWindow window) {
        return supplyData(() -> {
            if (window == null) {
                throw new StorageException(StorageErrorKind.INVALID_ARGUMENT, "Aggregation window is required");
            }
            return UsageWindowAggregator.aggregate(queryRange(range), window);
        });
    }

    private List<UsageDataPoint> queryRange(QueryRange range) throws IOException {
        if (range == null) {
            throw new StorageException(StorageErrorKind.INVALID_ARGUMENT, "Query range is required");
        }
        List<UsageDataPoint> result = new ArrayList<>();
        int bucketsRead = 0;
        for (StorageBucket bucket : bucketIndex.values()) {
            TimeRange bucketRange = bucket.getTimeRange();
            if (bucketRange.getStart() > range.getEnd() || bucketRange.getEnd() < range.getStart()) {
                continue;
            }
            bucketsRead++;
            for (UsageDataPoint point : fileCodec.read(bucket)) {
                if (point.getTimestamp() >= range.getStart() && point.getTimestamp() <= range.getEnd()) {
                    result.add(point);
                }
            }
        }
        result.sort(Comparator.comparingLong(UsageDataPoint::getTimestamp));

        int from = range.getOffset() != null && range.getOffset() > 0
                ? Math.min(range.getOffset(), result.size())
                : 0;
        int to = range.getLimit() != null && range.getLimit() > 0
                ? (int) Math.min(result.size(), (long) from + range.getLimit())
                : result.size();

        log.debug("{} Query [{}, {}] read {} buckets, {} points matched", LOG_PREFIX, range.getStart(),
                range.getEnd(), bucketsRead, result.size());
        return new ArrayList<>(result.subList(from, to));
    }

    @Override
    public CompletableFuture<StorageStats> getStats() {
        return supplyData(() -> {
            long totalDataPoints = 0;
            long totalFileSize = 0;
            long decodedSize = 0;
            long oldest = Long.MAX_VALUE;
            long newest = 0;
            int compressedBuckets = 0;

            for (StorageBucket bucket : bucketIndex.values()) {
                if (bucket.isCompressed()) {
                    compressedBuckets++;
                }
                byte[] json = fileCodec.readDecoded(bucket);
                if (json == null) {
                    continue;
                }
                Path dataPath = BucketFileCodec.dataPath(bucket);
                List<UsageDataPoint> points = fileCodec.parse(json, dataPath);
                totalFileSize += fileCodec.fileSize(bucket);
                decodedSize += json.length;
                totalDataPoints += points.size();
                if (!points.isEmpty()) {
                    oldest = Math.min(oldest, points.get(0).getTimestamp());
                    newest = Math.max(newest, points.get(points.size() - 1).getTimestamp());
                }
            }

            double totalDays = totalDataPoints > 0 ? (newest - oldest) / DAY_MILLIS : 0;
            return StorageStats.builder()
                    .totalDataPoints(totalDataPoints)
                    .totalFileSize(totalFileSize)
                    .compressionRatio(decodedSize > 0 ? (double) totalFileSize / decodedSize : 1.0)
                    .oldestRecord(totalDataPoints > 0 ? oldest : 0)
                    .newestRecord(totalDataPoints > 0 ? newest : 0)
                    .averageDataPointsPerDay(totalDays > 0 ? totalDataPoints / totalDays : 0)
                    .bucketCount(bucketIndex.size())
                    .compressedBuckets(compressedBuckets)
                    .storageBuckets(copyBuckets())
                    .lastCompaction(lastCompaction)
                    .lastBackup(lastBackup)
                    .build();
        });
    }

    // ==================== Maintenance ====================

    @Override
    public CompletableFuture<StorageOperationResult> compact() {
        return runOperation("compact", () -> {
            int recordsAffected = 0;
            Set<String> changed = new LinkedHashSet<>();
            Map<String, StorageException> skipped = new LinkedHashMap<>();
            long now = clock.millis();
            for (Map.Entry<String, StorageBucket> entry : bucketIndex.entrySet()) {
                StorageBucket bucket = entry.getValue();
                if (bucket.isCompressed() || !shouldCompress(bucket.getTimeRange().getStart(), now)) {
                    continue;
                }
                try {
                    recordsAffected += compactBucket(entry);
                    changed.add(entry.getKey());
                } catch (StorageException e) {
                    log.warn("{} Skipping bucket {} during compaction: {}", LOG_PREFIX, entry.getKey(),
                            e.getMessage());
                    skipped.put(entry.getKey(), e);
                } catch (IOException e) {
                    log.warn("{} Skipping bucket {} during compaction: {}", LOG_PREFIX, entry.getKey(),
                            e.getMessage());
                    skipped.put(entry.getKey(),
                            new StorageException(StorageErrorKind.IO_FAILURE, e.getMessage(), e));
                }
            }
            lastCompaction = now;
            saveIndex();

            log.info("{} Compacted {} buckets ({} points)", LOG_PREFIX, changed.size(), recordsAffected);
            notifyListeners(changed);
            if (!skipped.isEmpty()) {
                StorageException first = skipped.values().iterator().next();
                throw new StorageException(first.getKind(), "Compaction skipped buckets " + skipped.keySet()
                        + " after compacting " + changed.size() + ": " + first.getMessage(), first);
            }
            return recordsAffected;
        });
    }

    /**
     * Rewrite one bucket gzipped. The saved index points at the gzip variant
     * before the plain file is removed.
     */
    private int compactBucket(Map.Entry<String, StorageBucket> entry) throws IOException {
        StorageBucket bucket = entry.getValue();
        List<UsageDataPoint> points = fileCodec.read(bucket);
        StorageBucket compressed = bucket.toBuilder()
                .compressionLevel(config.getCompressionLevel())
                .build();
        fileCodec.writeCurrentVariant(compressed, points);
        entry.setValue(compressed);
        try {
            saveIndex();
        } catch (IOException e) {
            entry.setValue(bucket);
            throw e;
        }
        fileCodec.deleteOtherVariant(compressed);
        return points.size();
    }

    @Override
    public CompletableFuture<StorageOperationResult> purgeOldData(long olderThan) {
        return runOperation("purgeOldData", () -> purgeBefore(olderThan));
    }

    @Override
    public CompletableFuture<StorageOperationResult> purgeExpired() {
        return runOperation("purgeExpired", () -> {
            long cutoff = clock.millis() - Duration.ofDays(config.getMaxRetentionDays()).toMillis();
            return purgeBefore(cutoff);
        });
    }

    private int purgeBefore(long olderThan) throws IOException {
        int recordsAffected = 0;
        Set<String> removed = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        IOException firstFailure = null;
        Iterator<Map.Entry<String, StorageBucket>> it = bucketIndex.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, StorageBucket> entry = it.next();
            StorageBucket bucket = entry.getValue();
            if (bucket.getTimeRange().getEnd() >= olderThan) {
                continue;
            }
            try {
                int count = countPoints(entry.getKey(), bucket);
                fileCodec.delete(bucket);
                it.remove();
                removed.add(entry.getKey());
                recordsAffected += count;
            } catch (IOException e) {
                log.warn("{} Failed to delete bucket {}: {}", LOG_PREFIX, entry.getKey(), e.getMessage());
                failed.add(entry.getKey());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        saveIndex();

        log.info("{} Purged {} buckets ({} points) older than {}", LOG_PREFIX, removed.size(), recordsAffected,
                olderThan);
        notifyListeners(removed);
        if (firstFailure != null) {
            throw new StorageException(StorageErrorKind.IO_FAILURE, "Failed to purge buckets " + failed
                    + " after purging " + removed.size() + ": " + firstFailure.getMessage(), firstFailure);
        }
        return recordsAffected;
    }

    /**
     * Points in a bucket about to be purged. Unreadable buckets count as empty
     * and are purged anyway.
     */
    private int countPoints(String key, StorageBucket bucket) throws IOException {
        try {
            return fileCodec.read(bucket).size();
        } catch (CorruptionException e) {
            log.warn("{} Purging unreadable bucket {}: {}", LOG_PREFIX, key, e.getMessage());
            return 0;
        }
    }

    @Override
    public CompletableFuture<StorageOperationResult> backup(Path target) {
        return runOperation("backup", () -> {
            Path backupDir = resolveBackupPath(target);
            lastBackup = clock.millis();
            saveIndex();

            Files.createDirectories(backupDir);
            Files.copy(indexPath, backupDir.resolve(INDEX_FILE), StandardCopyOption.REPLACE_EXISTING);
            int copied = copyTree(bucketsDir, backupDir.resolve(BUCKETS_DIR));

            log.info("{} Backed up {} bucket files to {}", LOG_PREFIX, copied, backupDir);
            return copied;
        });
    }

    @Override
    public CompletableFuture<StorageOperationResult> restore(Path source) {
        return runOperation("restore", () -> {
            Path backupDir = resolveBackupPath(source);
            Path backupIndex = backupDir.resolve(INDEX_FILE);
            if (!Files.isRegularFile(backupIndex)) {
                throw new StorageException(StorageErrorKind.NOT_FOUND, "No backup index found at " + backupIndex);
            }
            if (backupDir.equals(baseDir)) {
                throw new IllegalArgumentException("Cannot restore the storage directory onto itself");
            }
            BucketIndexDocument document = readIndexDocument(backupIndex);
            Map<String, StorageBucket> restored = toBucketMap(document);

            Set<String> changed = new LinkedHashSet<>(bucketIndex.keySet());
            deleteTree(bucketsDir);
            int copied = copyTree(backupDir.resolve(BUCKETS_DIR), bucketsDir);

            bucketIndex.clear();
            // Backups may come from another base directory
            restored.forEach((key, bucket) -> bucketIndex.put(key, bucket.toBuilder()
                    .filePath(bucketFilePath(key))
                    .build()));
            lastCompaction = document.getLastCompaction();
            lastBackup = document.getLastBackup();
            saveIndex();
            changed.addAll(bucketIndex.keySet());

            log.info("{} Restored {} buckets ({} files) from {}", LOG_PREFIX, bucketIndex.size(), copied,
                    backupDir);
            notifyListeners(changed);
            return copied;
        });
    }

    @Override
    public CompletableFuture<Void> close() {
        return CompletableFuture.runAsync(() -> {
            bucketIndex.clear();
            initialized = false;
            log.debug("{} Closed", LOG_PREFIX);
        }, executor);
    }

    // ==================== Index ====================

    private void ensureInitialized() throws IOException {
        if (initialized) {
            return;
        }
        Files.createDirectories(bucketsDir);
        Files.createDirectories(baseDir.resolve(BACKUPS_DIR));

        bucketIndex.clear();
        lastCompaction = 0;
        lastBackup = 0;
        if (Files.exists(indexPath)) {
            BucketIndexDocument document = readIndexDocument(indexPath);
            bucketIndex.putAll(toBucketMap(document));
            lastCompaction = document.getLastCompaction();
            lastBackup = document.getLastBackup();
        }
        initialized = true;
        log.info("{} Initialized at {} with {} buckets ({} strategy)", LOG_PREFIX, baseDir, bucketIndex.size(),
                keyCodec.getStrategy().getCode());
    }

    private BucketIndexDocument readIndexDocument(Path path) throws IOException {
        try {
            BucketIndexDocument document = objectMapper.readValue(path.toFile(), BucketIndexDocument.class);
            if (document == null) {
                throw new CorruptionException("Empty index file: " + path, null);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Malformed index file: " + path, e);
        }
    }

    private static Map<String, StorageBucket> toBucketMap(BucketIndexDocument document) {
        Map<String, StorageBucket> buckets = new LinkedHashMap<>();
        if (document.getBuckets() == null) {
            return buckets;
        }
        for (BucketIndexDocument.Entry entry : document.getBuckets()) {
            if (entry == null || entry.getKey() == null || entry.getBucket() == null
                    || entry.getBucket().getTimeRange() == null) {
                throw new CorruptionException("Malformed index entry: " + entry, null);
            }
            buckets.put(entry.getKey(), entry.getBucket());
        }
        return buckets;
    }

    private void saveIndex() throws IOException {
        List<BucketIndexDocument.Entry> entries = new ArrayList<>(bucketIndex.size());
        for (Map.Entry<String, StorageBucket> entry : bucketIndex.entrySet()) {
            entries.add(new BucketIndexDocument.Entry(entry.getKey(), entry.getValue()));
        }
        BucketIndexDocument document = BucketIndexDocument.builder()
                .buckets(entries)
                .lastUpdated(clock.millis())
                .lastCompaction(lastCompaction)
                .lastBackup(lastBackup)
                .build();
        BucketFileCodec.writeAtomic(indexPath,
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
    }

    private StorageBucket getOrCreateBucket(String key, long timestamp) throws IOException {
        StorageBucket existing = bucketIndex.get(key);
        if (existing != null) {
            return existing;
        }
        long now = clock.millis();
        StorageBucket bucket = StorageBucket.builder()
                .timeRange(keyCodec.rangeOf(key))
                .granularity(granularityFor(timestamp, now))
                .filePath(bucketFilePath(key))
                .compressionLevel(shouldCompress(timestamp, now) ? config.getCompressionLevel() : 0)
                .encrypted(config.isEncryptionEnabled())
                .build();
        bucketIndex.put(key, bucket);
        saveIndex();
        log.debug("{} Created bucket {} ({}, compression {})", LOG_PREFIX, key, bucket.getGranularity().getCode(),
                bucket.getCompressionLevel());
        return bucket;
    }

    private String bucketFilePath(String key) {
        return bucketsDir.resolve(key + JSON_EXTENSION).toString();
    }

    private boolean shouldCompress(long timestamp, long now) {
        return config.isCompressionEnabled() && now - timestamp > COMPRESSION_AGE_MILLIS;
    }

    private static Granularity granularityFor(long timestamp, long now) {
        long age = now - timestamp;
        if (age < MINUTE_GRANULARITY_AGE_MILLIS) {
            return Granularity.MINUTE;
        }
        if (age < HOUR_GRANULARITY_AGE_MILLIS) {
            return Granularity.HOUR;
        }
        return Granularity.DAY;
    }

    private List<StorageBucket> copyBuckets() {
        List<StorageBucket> copies = new ArrayList<>(bucketIndex.size());
        for (StorageBucket bucket : bucketIndex.values()) {
            copies.add(bucket.toBuilder().timeRange(TimeRange.of(bucket.getTimeRange().getStart(),
                    bucket.getTimeRange().getEnd())).build());
        }
        return copies;
    }

    /**
     * Index of the first point with a timestamp greater than {@code timestamp}.
     */
    private static int upperBound(List<UsageDataPoint> points, long timestamp) {
        int low = 0;
        int high = points.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (points.get(mid).getTimestamp() <= timestamp) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // ==================== Files ====================

    private Path resolveBackupPath(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Backup path is required");
        }
        return path.isAbsolute() ? path.normalize() : baseDir.resolve(BACKUPS_DIR).resolve(path).normalize();
    }

    private static int copyTree(Path source, Path target) throws IOException {
        Files.createDirectories(target);
        if (!Files.isDirectory(source)) {
            return 0;
        }
        int copied = 0;
        List<Path> files;
        try (Stream<Path> paths = Files.walk(source)) {
            files = paths.filter(Files::isRegularFile).toList();
        }
        for (Path file : files) {
            Path destination = target.resolve(source.relativize(file).toString());
            Path parent = destination.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(file, destination, StandardCopyOption.REPLACE_EXISTING);
            copied++;
        }
        return copied;
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    // ==================== Execution ====================

    private void notifyListeners(Set<String> bucketKeys) {
        if (bucketKeys.isEmpty()) {
            return;
        }
        Set<String> keys = Set.copyOf(bucketKeys);
        for (WriteListener listener : writeListeners) {
            try {
                listener.onBucketsChanged(keys);
            } catch (RuntimeException e) {
                log.warn("{} Write listener failed: {}", LOG_PREFIX, e.getMessage());
            }
        }
    }

    private CompletableFuture<StorageOperationResult> runOperation(String operation, StorageAction action) {
        return CompletableFuture.supplyAsync(() -> {
            long startNanos = System.nanoTime();
            try {
                ensureInitialized();
                int affected = action.run();
                return StorageOperationResult.success(affected, elapsedMillis(startNanos));
            } catch (CorruptionException e) {
                log.error("{} {} failed, data is corrupted: {}", LOG_PREFIX, operation, e.getMessage());
                return StorageOperationResult.failure(StorageErrorKind.CORRUPTION, e.getMessage(),
                        elapsedMillis(startNanos));
            } catch (StorageException e) {
                log.warn("{} {} failed: {}", LOG_PREFIX, operation, e.getMessage());
                return StorageOperationResult.failure(e.getKind(), e.getMessage(), elapsedMillis(startNanos));
            } catch (IOException e) {
                log.warn("{} {} failed: {}", LOG_PREFIX, operation, e.getMessage(), e);
                return StorageOperationResult.failure(StorageErrorKind.IO_FAILURE, e.getMessage(),
                        elapsedMillis(startNanos));
            } catch (IllegalArgumentException e) {
                log.warn("{} {} rejected: {}", LOG_PREFIX, operation, e.getMessage());
                return StorageOperationResult.failure(StorageErrorKind.INVALID_ARGUMENT, e.getMessage(),
                        elapsedMillis(startNanos));
            } catch (RuntimeException e) {
                log.error("{} {} failed unexpectedly", LOG_PREFIX, operation, e);
                return StorageOperationResult.failure(StorageErrorKind.IO_FAILURE, e.getMessage(),
                        elapsedMillis(startNanos));
            }
        }, executor);
    }

    private <T> CompletableFuture<T> supplyData(DataSupplier<T> supplier) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                ensureInitialized();
                return supplier.get();
            } catch (IOException e) {
                throw new StorageException(StorageErrorKind.IO_FAILURE, e.getMessage(), e);
            }
        }, executor);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @FunctionalInterface
    private interface StorageAction {
        int run() throws IOException;
    }

    @FunctionalInterface
    private interface DataSupplier<T> {
        T get() throws IOException;
    }
}
