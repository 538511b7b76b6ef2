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
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Query result cache settings.
 *
 * <p>
 * When passed to {@code configureCache}, null fields keep their current value.
 * {@code keyFields} is informational; the cache key always covers the full
 * query signature.
 */
@Value
@Builder(toBuilder = true)
public class CacheConfig {

    private static final int DEFAULT_MAX_SIZE = 1000;
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    Boolean enabled;
    Integer maxSize;
    Duration ttl;
    List<String> keyFields;
    Boolean invalidateOnWrite;

    public static CacheConfig defaults() {
        return CacheConfig.builder()
                .enabled(true)
                .maxSize(DEFAULT_MAX_SIZE)
                .ttl(DEFAULT_TTL)
                .keyFields(List.of("timestamp", "sessionId"))
                .invalidateOnWrite(true)
                .build();
    }

    public CacheConfig mergedWith(CacheConfig update) {
        if (update == null) {
            return this;
        }
        return CacheConfig.builder()
                .enabled(update.enabled != null ? update.enabled : enabled)
                .maxSize(update.maxSize != null ? update.maxSize : maxSize)
                .ttl(update.ttl != null ? update.ttl : ttl)
                .keyFields(update.keyFields != null ? List.copyOf(update.keyFields) : keyFields)
                .invalidateOnWrite(update.invalidateOnWrite != null ? update.invalidateOnWrite : invalidateOnWrite)
                .build();
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isInvalidateOnWrite() {
        return Boolean.TRUE.equals(invalidateOnWrite);
    }
}
