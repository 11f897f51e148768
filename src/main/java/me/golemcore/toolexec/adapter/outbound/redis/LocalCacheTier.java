package me.golemcore.toolexec.adapter.outbound.redis;

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

import me.golemcore.toolexec.domain.model.CacheEntry;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process cache tier. Bounded; the least recently used entry is evicted
 * first. Expired entries are not served as hits but are kept until evicted so
 * they can still be returned when the remote tier is unavailable.
 */
class LocalCacheTier {

    private final int maxEntries;
    private final LinkedHashMap<String, CacheEntry> entries;

    LocalCacheTier(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > LocalCacheTier.this.maxEntries;
            }
        };
    }

    synchronized Optional<CacheEntry> getFresh(String key, Instant now) {
        CacheEntry entry = entries.get(key);
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    synchronized Optional<CacheEntry> getAny(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    synchronized void put(String key, CacheEntry entry) {
        entries.put(key, entry);
    }

    synchronized void remove(String key) {
        entries.remove(key);
    }

    synchronized int removeByPrefix(String prefix) {
        int removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized int size() {
        return entries.size();
    }

    int maxEntries() {
        return maxEntries;
    }
}
