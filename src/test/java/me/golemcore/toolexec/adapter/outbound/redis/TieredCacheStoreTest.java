package me.golemcore.toolexec.adapter.outbound.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.toolexec.domain.model.CacheEntry;
import me.golemcore.toolexec.domain.model.CacheStats;
import me.golemcore.toolexec.port.outbound.CacheStorePort;
import me.golemcore.toolexec.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TieredCacheStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final String PREFIX = "mcp:cache:";
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    private static final Duration LOCAL_MAX_TTL = Duration.ofSeconds(60);

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private TieredCacheStore cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        clock = new MutableClock(START);
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new TieredCacheStore(redisTemplate, objectMapper, clock, PREFIX, DEFAULT_TTL, true, 100,
                LOCAL_MAX_TTL);
    }

    // ==================== Set ====================

    @Test
    void shouldWriteRemoteWithTtlAndExpiry() throws Exception {
        cache.set("k", "v", Duration.ofMinutes(10));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(PREFIX + "k"), payload.capture(), eq(Duration.ofMinutes(10)));
        CacheEntry stored = objectMapper.readValue(payload.getValue(), CacheEntry.class);
        assertEquals("v", stored.getValue());
        assertEquals(START.plus(Duration.ofMinutes(10)), stored.getExpiresAt());
        assertNull(stored.getTier());
    }

    @Test
    void shouldUseDefaultTtl() {
        cache.set("k", "v");

        verify(valueOps).set(eq(PREFIX + "k"), anyString(), eq(DEFAULT_TTL));
    }

    @Test
    void shouldWriteWithoutExpiryForZeroTtl() {
        cache.set("k", "v", Duration.ZERO);

        verify(valueOps).set(eq(PREFIX + "k"), anyString());
    }

    @Test
    void shouldRejectNegativeTtl() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", Duration.ofSeconds(-1)));

        verify(valueOps, never()).set(anyString(), anyString(), any(Duration.class));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.stats().getSets());
    }

    @Test
    void shouldKeepLocalValueWhenRemoteWriteFails() {
        doThrow(new RedisConnectionFailureException("down")).when(valueOps)
                .set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> cache.set("k", "v"));

        assertEquals(Optional.of("v"), cache.get("k"));
        assertEquals(1, cache.stats().getRemoteFailures());
    }

    // ==================== Get ====================

    @Test
    void shouldServeLocalHitWithoutRemoteRoundTrip() {
        cache.set("k", "v");

        Optional<CacheEntry> entry = cache.getEntry("k");

        assertEquals("v", entry.orElseThrow().getValue());
        assertEquals(CacheEntry.Tier.LOCAL, entry.get().getTier());
        verify(valueOps, never()).get(any());
        assertEquals(1, cache.stats().getLocalHits());
    }

    @Test
    void shouldBackfillLocalTierFromRemote() throws Exception {
        when(valueOps.get(PREFIX + "k")).thenReturn(remotePayload("k", "v", START.plus(DEFAULT_TTL)));

        Optional<CacheEntry> first = cache.getEntry("k");
        Optional<CacheEntry> second = cache.getEntry("k");

        assertEquals(CacheEntry.Tier.REMOTE, first.orElseThrow().getTier());
        assertEquals(CacheEntry.Tier.LOCAL, second.orElseThrow().getTier());
        verify(valueOps, times(1)).get(PREFIX + "k");
        CacheStats stats = cache.stats();
        assertEquals(1, stats.getRemoteHits());
        assertEquals(0.5, stats.getLocalHitRate());
    }

    @Test
    void shouldRereadRemoteAfterLocalMaxTtl() throws Exception {
        when(valueOps.get(PREFIX + "k")).thenReturn(remotePayload("k", "v1", START.plus(DEFAULT_TTL)));
        cache.get("k");
        when(valueOps.get(PREFIX + "k")).thenReturn(remotePayload("k", "v2", START.plus(DEFAULT_TTL)));

        clock.advance(LOCAL_MAX_TTL);

        assertEquals(Optional.of("v2"), cache.get("k"));
    }

    @Test
    void shouldServeStaleLocalValueWhenRemoteIsDown() {
        cache.set("k", "v");
        clock.advance(LOCAL_MAX_TTL.plusSeconds(1));
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        Optional<CacheEntry> entry = cache.getEntry("k");

        assertEquals("v", entry.orElseThrow().getValue());
        assertEquals(CacheEntry.Tier.LOCAL, entry.get().getTier());
        assertEquals(1, cache.stats().getStaleHits());
    }

    @Test
    void shouldReturnEmptyWhenRemoteIsDownAndNothingLocal() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(cache.get("k").isEmpty());
        assertEquals(1, cache.stats().getRemoteFailures());
    }

    @Test
    void shouldIgnoreUnreadableRemoteEntry() {
        when(valueOps.get(PREFIX + "k")).thenReturn("not-json");

        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void shouldAlwaysAskRemoteWhenLocalTierDisabled() throws Exception {
        TieredCacheStore remoteOnly = new TieredCacheStore(redisTemplate, objectMapper, clock, PREFIX, DEFAULT_TTL,
                false, 100, LOCAL_MAX_TTL);
        when(valueOps.get(PREFIX + "k")).thenReturn(remotePayload("k", "v", null));

        remoteOnly.get("k");
        remoteOnly.get("k");

        verify(valueOps, times(2)).get(PREFIX + "k");
        assertFalse(remoteOnly.stats().isLocalTierEnabled());
    }

    @Test
    void shouldFetchLocalMissesInOneRoundTrip() throws Exception {
        cache.set("a", "1");
        when(valueOps.multiGet(List.of(PREFIX + "b", PREFIX + "c")))
                .thenReturn(Arrays.asList(remotePayload("b", "2", null), null));

        Map<String, Optional<String>> values = cache.getMany(List.of("a", "b", "c"));

        assertEquals(Optional.of("1"), values.get("a"));
        assertEquals(Optional.of("2"), values.get("b"));
        assertEquals(Optional.empty(), values.get("c"));
    }

    @Test
    void shouldSetManyEntries() {
        cache.setMany(Map.of("a", "1", "b", "2"), Duration.ofMinutes(1));

        verify(valueOps).set(eq(PREFIX + "a"), anyString(), eq(Duration.ofMinutes(1)));
        verify(valueOps).set(eq(PREFIX + "b"), anyString(), eq(Duration.ofMinutes(1)));
        assertEquals(2, cache.stats().getSets());
    }

    // ==================== Delete and namespaces ====================

    @Test
    void shouldDeleteFromBothTiers() {
        cache.set("k", "v");

        cache.delete("k");

        verify(redisTemplate).delete(PREFIX + "k");
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void shouldDeleteLocallyEvenWhenRemoteDeleteFails() {
        cache.set("k", "v");
        when(redisTemplate.delete(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertDoesNotThrow(() -> cache.delete("k"));

        assertEquals(0, cache.stats().getLocalSize());
    }

    @Test
    void shouldScopeNamespaceKeys() {
        CacheStorePort analysis = cache.namespace("analysis");

        analysis.set("file.ts", "result");

        verify(valueOps).set(eq(PREFIX + "analysis:file.ts"), anyString(), eq(DEFAULT_TTL));
        assertTrue(cache.get("file.ts").isEmpty());
        assertEquals(Optional.of("result"), analysis.get("file.ts"));
    }

    @Test
    void shouldInvalidateNamespaceInBothTiers() {
        cache.namespace("analysis").set("a", "1");
        cache.namespace("other").set("b", "2");
        Set<String> remoteKeys = Set.of(PREFIX + "analysis:a");
        when(redisTemplate.keys(PREFIX + "analysis:*")).thenReturn(remoteKeys);
        when(redisTemplate.delete(remoteKeys)).thenReturn(1L);

        cache.invalidateNamespace("analysis");

        verify(redisTemplate).delete(remoteKeys);
        assertEquals(1, cache.stats().getLocalSize());
    }

    // ==================== Local only ====================

    @Test
    void shouldCacheInProcessWithoutRemoteTier() {
        TieredCacheStore localOnly = TieredCacheStore.localOnly(objectMapper, clock, PREFIX, DEFAULT_TTL, 10);

        localOnly.set("k", "v");
        clock.advance(Duration.ofMinutes(4));

        assertEquals(Optional.of("v"), localOnly.get("k"));
        clock.advance(Duration.ofMinutes(1));
        assertTrue(localOnly.get("k").isEmpty());
        assertFalse(localOnly.stats().isRemoteTierEnabled());
    }

    private String remotePayload(String key, String value, Instant expiresAt) throws Exception {
        return objectMapper.writeValueAsString(CacheEntry.builder()
                .key(PREFIX + key)
                .value(value)
                .expiresAt(expiresAt)
                .build());
    }
}
