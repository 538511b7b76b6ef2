package me.golemcore.history.domain.service;

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

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded result cache with insertion-order (FIFO) eviction and a time to
 * live.
 *
 * <p>
 * An entry older than the TTL is stale: it is never returned and is replaced
 * by the next {@link #put}. Reads do not refresh an entry's position, so the
 * oldest insertion is always evicted first. Not thread-safe; callers confine
 * it to one thread.
 *
 * @param <V>
 *            cached value type
 */
public class QueryResultCache<V> {

    private final Clock clock;
    private final Map<String, Entry<V>> entries = new LinkedHashMap<>();
    private int maxSize;
    private Duration ttl;

    public QueryResultCache(Clock clock, int maxSize, Duration ttl) {
        this.clock = clock;
        reconfigure(maxSize, ttl);
    }

    /**
     * Apply new limits, evicting the oldest entries above {@code maxSize}.
     */
    public void reconfigure(int maxSize, Duration ttl) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("Cache max size must not be negative: " + maxSize);
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be a non-negative duration: " + ttl);
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        evictOverflow();
    }

    public Optional<V> get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null || isStale(entry)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, V value) {
        // Re-inserting moves the key to the young end of the eviction order
        entries.remove(key);
        entries.put(key, new Entry<>(value, clock.millis()));
        evictOverflow();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    private boolean isStale(Entry<V> entry) {
        return clock.millis() - entry.storedAt() >= ttl.toMillis();
    }

    private void evictOverflow() {
        Iterator<String> eldest = entries.keySet().iterator();
        while (entries.size() > maxSize && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    private record Entry<V>(V value, long storedAt) {
    }
}
