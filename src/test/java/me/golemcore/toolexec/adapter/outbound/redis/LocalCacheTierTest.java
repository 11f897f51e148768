package me.golemcore.toolexec.adapter.outbound.redis;

import me.golemcore.toolexec.domain.model.CacheEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalCacheTierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        LocalCacheTier tier = new LocalCacheTier(2);
        tier.put("a", entry("a", null));
        tier.put("b", entry("b", null));
        tier.getFresh("a", NOW);

        tier.put("c", entry("c", null));

        assertEquals(2, tier.size());
        assertTrue(tier.getAny("a").isPresent());
        assertTrue(tier.getAny("b").isEmpty());
        assertTrue(tier.getAny("c").isPresent());
    }

    @Test
    void shouldKeepExpiredEntryForStaleReads() {
        LocalCacheTier tier = new LocalCacheTier(10);
        tier.put("a", entry("a", NOW.minusSeconds(1)));

        assertTrue(tier.getFresh("a", NOW).isEmpty());
        assertTrue(tier.getAny("a").isPresent());
    }

    @Test
    void shouldRemoveByPrefix() {
        LocalCacheTier tier = new LocalCacheTier(10);
        tier.put("ns:a", entry("ns:a", null));
        tier.put("ns:b", entry("ns:b", null));
        tier.put("other:c", entry("other:c", null));

        assertEquals(2, tier.removeByPrefix("ns:"));
        assertEquals(1, tier.size());
    }

    private static CacheEntry entry(String key, Instant expiresAt) {
        return CacheEntry.builder().key(key).value("v-" + key).expiresAt(expiresAt).build();
    }
}
