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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.CacheEntry;
import me.golemcore.toolexec.domain.model.CacheStats;
import me.golemcore.toolexec.port.outbound.CacheStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache: a bounded in-process tier in front of Redis.
 *
 * <p>
 * Redis holds the authoritative copy as a JSON {@link CacheEntry} so a value
 * read back into the local tier keeps its real expiry. The local tier keeps a
 * value for at most {@code localMaxTtl}, which bounds how stale another
 * process's write can look from here. When Redis cannot be reached the last
 * local value is served even if it has expired, and callers see a miss only
 * when nothing was ever cached locally. No operation throws on Redis failure.
 *
 * <p>
 * Built without a template ({@link #localOnly}) the local tier is the only
 * tier and holds values for their full TTL.
 */
@Slf4j
public class TieredCacheStore implements CacheStorePort {

    private static final String NAMESPACE_SEPARATOR = ":";

    private final StringRedisTemplate redisTemplate;
    private final LocalCacheTier localTier;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration defaultTtl;
    private final Duration localMaxTtl;
    private final Counters counters;

    public TieredCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock,
            String keyPrefix, Duration defaultTtl, boolean localTierEnabled, int localMaxEntries,
            Duration localMaxTtl) {
        this(redisTemplate, localTierEnabled ? new LocalCacheTier(localMaxEntries) : null, objectMapper, clock,
                keyPrefix, defaultTtl, localMaxTtl, new Counters());
    }

    private TieredCacheStore(StringRedisTemplate redisTemplate, LocalCacheTier localTier,
            ObjectMapper objectMapper, Clock clock, String keyPrefix, Duration defaultTtl, Duration localMaxTtl,
            Counters counters) {
        this.redisTemplate = redisTemplate;
        this.localTier = localTier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
        this.localMaxTtl = localMaxTtl;
        this.counters = counters;
    }

    /**
     * Cache without a remote tier, used when the durable backend is not
     * reachable at startup.
     */
    public static TieredCacheStore localOnly(ObjectMapper objectMapper, Clock clock, String keyPrefix,
            Duration defaultTtl, int localMaxEntries) {
        return new TieredCacheStore(null, new LocalCacheTier(localMaxEntries), objectMapper, clock, keyPrefix,
                defaultTtl, Duration.ZERO, new Counters());
    }

    @Override
    public Optional<String> get(String key) {
        return getEntry(key).map(CacheEntry::getValue);
    }

    @Override
    public Optional<CacheEntry> getEntry(String key) {
        String cacheKey = keyPrefix + key;
        Instant now = clock.instant();
        Optional<CacheEntry> local = readLocal(cacheKey, now);
        if (local.isPresent() || redisTemplate == null) {
            return local;
        }

        String payload;
        try {
            payload = redisTemplate.opsForValue().get(cacheKey);
        } catch (DataAccessException e) {
            return staleLocal(cacheKey, e);
        }
        return acceptRemote(cacheKey, payload, now);
    }

    @Override
    public Map<String, Optional<String>> getMany(Collection<String> keys) {
        Map<String, Optional<String>> results = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        Instant now = clock.instant();
        for (String key : keys) {
            Optional<CacheEntry> local = readLocal(keyPrefix + key, now);
            results.put(key, local.map(CacheEntry::getValue));
            if (local.isEmpty()) {
                misses.add(key);
            }
        }
        if (misses.isEmpty() || redisTemplate == null) {
            return results;
        }

        List<String> cacheKeys = misses.stream().map(key -> keyPrefix + key).toList();
        List<String> payloads;
        try {
            payloads = redisTemplate.opsForValue().multiGet(cacheKeys);
        } catch (DataAccessException e) {
            for (String key : misses) {
                results.put(key, staleLocal(keyPrefix + key, e).map(CacheEntry::getValue));
            }
            return results;
        }
        for (int i = 0; i < misses.size(); i++) {
            String payload = payloads != null && i < payloads.size() ? payloads.get(i) : null;
            results.put(misses.get(i), acceptRemote(cacheKeys.get(i), payload, now).map(CacheEntry::getValue));
        }
        return results;
    }

    @Override
    public void set(String key, String value) {
        set(key, value, defaultTtl);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative: " + ttl);
        }
        String cacheKey = keyPrefix + key;
        Instant now = clock.instant();
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        CacheEntry entry = CacheEntry.builder()
                .key(cacheKey)
                .value(value)
                .expiresAt(effectiveTtl.isZero() ? null : now.plus(effectiveTtl))
                .build();
        counters.sets.incrementAndGet();

        if (redisTemplate != null) {
            writeRemote(cacheKey, entry, effectiveTtl);
        }
        writeLocal(cacheKey, entry, now);
    }

    @Override
    public void setMany(Map<String, String> values, Duration ttl) {
        values.forEach((key, value) -> set(key, value, ttl));
    }

    @Override
    public void delete(String key) {
        String cacheKey = keyPrefix + key;
        if (localTier != null) {
            localTier.remove(cacheKey);
        }
        if (redisTemplate == null) {
            return;
        }
        try {
            redisTemplate.delete(cacheKey);
        } catch (DataAccessException e) {
            log.warn("[Cache] remote delete failed for {}: {}", cacheKey, e.getMessage());
        }
    }

    @Override
    public CacheStorePort namespace(String namespace) {
        return new TieredCacheStore(redisTemplate, localTier, objectMapper, clock,
                keyPrefix + namespace + NAMESPACE_SEPARATOR, defaultTtl, localMaxTtl, counters);
    }

    @Override
    public void invalidateNamespace(String namespace) {
        String prefix = keyPrefix + namespace + NAMESPACE_SEPARATOR;
        int localRemoved = localTier != null ? localTier.removeByPrefix(prefix) : 0;
        long remoteRemoved = 0;
        if (redisTemplate != null) {
            try {
                Set<String> keys = redisTemplate.keys(prefix + "*");
                if (keys != null && !keys.isEmpty()) {
                    Long deleted = redisTemplate.delete(keys);
                    remoteRemoved = deleted != null ? deleted : 0;
                }
            } catch (DataAccessException e) {
                log.warn("[Cache] remote invalidation failed for namespace {}: {}", namespace, e.getMessage());
            }
        }
        log.debug("[Cache] invalidated namespace {} (local={}, remote={})", namespace, localRemoved,
                remoteRemoved);
    }

    @Override
    public CacheStats stats() {
        return CacheStats.builder()
                .localTierEnabled(localTier != null)
                .remoteTierEnabled(redisTemplate != null)
                .localSize(localTier != null ? localTier.size() : 0)
                .localMaxSize(localTier != null ? localTier.maxEntries() : 0)
                .localHits(counters.localHits.get())
                .localMisses(counters.localMisses.get())
                .remoteHits(counters.remoteHits.get())
                .remoteFailures(counters.remoteFailures.get())
                .staleHits(counters.staleHits.get())
                .sets(counters.sets.get())
                .build();
    }

    private Optional<CacheEntry> readLocal(String cacheKey, Instant now) {
        if (localTier == null) {
            return Optional.empty();
        }
        Optional<CacheEntry> local = localTier.getFresh(cacheKey, now);
        if (local.isPresent()) {
            counters.localHits.incrementAndGet();
            return local.map(entry -> entry.toBuilder().tier(CacheEntry.Tier.LOCAL).build());
        }
        counters.localMisses.incrementAndGet();
        return Optional.empty();
    }

    private Optional<CacheEntry> acceptRemote(String cacheKey, String payload, Instant now) {
        if (payload == null) {
            return Optional.empty();
        }
        Optional<CacheEntry> remote = decode(cacheKey, payload).filter(entry -> !entry.isExpired(now));
        remote.ifPresent(entry -> {
            counters.remoteHits.incrementAndGet();
            writeLocal(cacheKey, entry, now);
        });
        return remote.map(entry -> entry.toBuilder().tier(CacheEntry.Tier.REMOTE).build());
    }

    private Optional<CacheEntry> staleLocal(String cacheKey, DataAccessException cause) {
        counters.remoteFailures.incrementAndGet();
        Optional<CacheEntry> stale = localTier != null ? localTier.getAny(cacheKey) : Optional.empty();
        if (stale.isPresent()) {
            counters.staleHits.incrementAndGet();
            log.warn("[Cache] remote get failed for {}, serving local copy: {}", cacheKey, cause.getMessage());
            return stale.map(entry -> entry.toBuilder().tier(CacheEntry.Tier.LOCAL).build());
        }
        log.warn("[Cache] remote get failed for {}: {}", cacheKey, cause.getMessage());
        return Optional.empty();
    }

    private void writeRemote(String cacheKey, CacheEntry entry, Duration ttl) {
        try {
            String payload = objectMapper.writeValueAsString(entry);
            if (ttl.isZero()) {
                redisTemplate.opsForValue().set(cacheKey, payload);
            } else {
                redisTemplate.opsForValue().set(cacheKey, payload, ttl);
            }
        } catch (JsonProcessingException e) {
            log.warn("[Cache] could not encode {}: {}", cacheKey, e.getMessage());
        } catch (DataAccessException e) {
            counters.remoteFailures.incrementAndGet();
            log.warn("[Cache] remote set failed for {}: {}", cacheKey, e.getMessage());
        }
    }

    private void writeLocal(String cacheKey, CacheEntry entry, Instant now) {
        if (localTier == null) {
            return;
        }
        Instant expiresAt = entry.getExpiresAt();
        if (!localMaxTtl.isZero()) {
            Instant localLimit = now.plus(localMaxTtl);
            if (expiresAt == null || localLimit.isBefore(expiresAt)) {
                expiresAt = localLimit;
            }
        }
        localTier.put(cacheKey, entry.toBuilder().key(cacheKey).expiresAt(expiresAt).tier(null).build());
    }

    private Optional<CacheEntry> decode(String cacheKey, String payload) {
        try {
            return Optional.of(objectMapper.readValue(payload, CacheEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("[Cache] unreadable entry at {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private static final class Counters {
        private final AtomicLong localHits = new AtomicLong();
        private final AtomicLong localMisses = new AtomicLong();
        private final AtomicLong remoteHits = new AtomicLong();
        private final AtomicLong remoteFailures = new AtomicLong();
        private final AtomicLong staleHits = new AtomicLong();
        private final AtomicLong sets = new AtomicLong();
    }
}
