package me.golemcore.history.infrastructure.config;

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

import lombok.Data;
import me.golemcore.history.domain.model.BucketStrategy;
import me.golemcore.history.domain.model.CacheConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for usage history storage and querying, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code history.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - bucket layout, compression and retention</li>
 * <li>{@link QueryProperties} - query engine catalogs and result cache</li>
 * </ul>
 *
 * <p>
 * Base paths may contain {@code ${user.home}}, expanded by
 * {@link #resolvePath(String)}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "history")
@Data
public class HistoryProperties {

    private StorageProperties storage = new StorageProperties();
    private QueryProperties query = new QueryProperties();

    public static Path resolvePath(String path) {
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/historical-data";
        private BucketStrategy bucketStrategy = BucketStrategy.DAILY;
        private boolean compressionEnabled = true;
        private int compressionLevel = 6;
        // Capability flag; bucket files are never encrypted
        private boolean encryptionEnabled = false;
        private int maxRetentionDays = 365;
    }

    @Data
    public static class QueryProperties {
        private String basePath = "${user.home}/.golemcore/query-engine";
        private CacheProperties cache = new CacheProperties();
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private int maxSize = 1000;
        private Duration ttl = Duration.ofMinutes(5);
        private List<String> keyFields = new ArrayList<>(List.of("timestamp", "sessionId"));
        private boolean invalidateOnWrite = true;

        public CacheConfig toCacheConfig() {
            return CacheConfig.builder()
                    .enabled(enabled)
                    .maxSize(maxSize)
                    .ttl(ttl)
                    .keyFields(List.copyOf(keyFields))
                    .invalidateOnWrite(invalidateOnWrite)
                    .build();
        }
    }
}
