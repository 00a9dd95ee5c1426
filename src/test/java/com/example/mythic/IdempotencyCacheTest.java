package com.example.mythic;

import com.example.mythic.util.IdempotencyCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdempotencyCache Tests")
class IdempotencyCacheTest {

    /** Clock the test moves by hand */
    private static final class ManualClock extends Clock {
        private Instant now = CombatFixtures.NOW;

        void advanceMs(long ms) {
            now = now.plusMillis(ms);
        }

        @Override
        public ZoneId getZone() { return ZoneOffset.UTC; }

        @Override
        public Clock withZone(ZoneId zone) { return this; }

        @Override
        public Instant instant() { return now; }
    }

    @Test
    @DisplayName("Cached value is returned until the TTL passes")
    void expiresAfterTtl() {
        ManualClock clock = new ManualClock();
        IdempotencyCache<String> cache = new IdempotencyCache<>(15_000, clock);
        cache.put("user-1:k1", "first");

        clock.advanceMs(14_999);
        assertEquals("first", cache.get("user-1:k1"));

        clock.advanceMs(1);
        assertNull(cache.get("user-1:k1"));
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Keys are independent")
    void independentKeys() {
        IdempotencyCache<String> cache = new IdempotencyCache<>(1_000, new ManualClock());
        cache.put("a", "1");
        cache.put("b", "2");
        assertEquals("1", cache.get("a"));
        assertEquals("2", cache.get("b"));
        assertNull(cache.get("c"));
        assertNull(cache.get(null));
    }

    @Test
    @DisplayName("Zero TTL disables caching")
    void zeroTtl() {
        IdempotencyCache<String> cache = new IdempotencyCache<>(0, new ManualClock());
        cache.put("a", "1");
        assertNull(cache.get("a"));
    }

    @Test
    @DisplayName("Expired entries are purged on put")
    void purgeOnPut() {
        ManualClock clock = new ManualClock();
        IdempotencyCache<String> cache = new IdempotencyCache<>(100, clock);
        cache.put("old", "x");
        clock.advanceMs(200);
        cache.put("new", "y");
        assertEquals(1, cache.size());
    }
}
