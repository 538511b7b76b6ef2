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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.domain.model.CorruptionException;
import me.golemcore.history.domain.model.StorageBucket;
import me.golemcore.history.domain.model.UsageDataPoint;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

/**
 * Reads and writes bucket files.
 *
 * <p>
 * A bucket's points are a pretty-printed JSON array. Compressed buckets store
 * the same bytes gzipped in {@code <filePath>.gz}. Exactly one variant exists
 * on disk after a successful write.
 */
@Slf4j
class BucketFileCodec {

    static final String GZIP_SUFFIX = ".gz";

    private static final TypeReference<List<UsageDataPoint>> POINT_LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    BucketFileCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static Path dataPath(StorageBucket bucket) {
        Path jsonPath = Paths.get(bucket.getFilePath());
        return bucket.isCompressed() ? gzipPath(jsonPath) : jsonPath;
    }

    static Path gzipPath(Path jsonPath) {
        return jsonPath.resolveSibling(jsonPath.getFileName() + GZIP_SUFFIX);
    }

    /**
     * Points of the bucket, or an empty list when its file does not exist.
     *
     * @throws CorruptionException
     *             if the file is not valid (gzipped) JSON
     */
    List<UsageDataPoint> read(StorageBucket bucket) throws IOException {
        byte[] json = readDecoded(bucket);
        if (json == null) {
            return List.of();
        }
        return parse(json, dataPath(bucket));
    }

    /**
     * Decoded JSON bytes of the bucket file, or null when the file does not
     * exist.
     */
    byte[] readDecoded(StorageBucket bucket) throws IOException {
        Path path = dataPath(bucket);
        if (!Files.exists(path)) {
            return null;
        }
        byte[] raw = Files.readAllBytes(path);
        if (!bucket.isCompressed()) {
            return raw;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return in.readAllBytes();
        } catch (ZipException | EOFException e) {
            throw new CorruptionException("Corrupted gzip bucket file: " + path, e);
        }
    }

    List<UsageDataPoint> parse(byte[] json, Path source) {
        try {
            return objectMapper.readValue(json, POINT_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Malformed bucket file: " + source, e);
        } catch (IOException e) {
            throw new CorruptionException("Unreadable bucket file: " + source, e);
        }
    }

    /**
     * Write the points in the bucket's current format and remove the other
     * variant.
     */
    void write(StorageBucket bucket, List<UsageDataPoint> points) throws IOException {
        writeCurrentVariant(bucket, points);
        deleteOtherVariant(bucket);
    }

    /**
     * Write the points in the bucket's current format, leaving the other
     * variant in place.
     */
    void writeCurrentVariant(StorageBucket bucket, List<UsageDataPoint> points) throws IOException {
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(points);
        if (bucket.isCompressed()) {
            writeAtomic(dataPath(bucket), gzip(json, bucket.getCompressionLevel()));
        } else {
            writeAtomic(dataPath(bucket), json);
        }
    }

    void deleteOtherVariant(StorageBucket bucket) throws IOException {
        Path jsonPath = Paths.get(bucket.getFilePath());
        Files.deleteIfExists(bucket.isCompressed() ? jsonPath : gzipPath(jsonPath));
    }

    long fileSize(StorageBucket bucket) throws IOException {
        Path path = dataPath(bucket);
        return Files.exists(path) ? Files.size(path) : 0L;
    }

    void delete(StorageBucket bucket) throws IOException {
        Path jsonPath = Paths.get(bucket.getFilePath());
        Files.deleteIfExists(jsonPath);
        Files.deleteIfExists(gzipPath(jsonPath));
    }

    static byte[] gzip(byte[] data, int level) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (LeveledGzipOutputStream gzip = new LeveledGzipOutputStream(bytes, level)) {
            gzip.write(data);
        }
        return bytes.toByteArray();
    }

    /**
     * Write through a fsynced temp file and an atomic rename.
     */
    static void writeAtomic(Path targetPath, byte[] bytes) throws IOException {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
