package com.example.mythic.util;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived response cache keyed by caller-supplied idempotency keys.
 * Entries expire after a fixed TTL; expired entries are purged lazily on access.
 */
public class IdempotencyCache<V> {

    private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final Clock clock;

    public IdempotencyCache(long ttlMs, Clock clock) {
        this.ttlMs = ttlMs;
        this.clock = clock;
    }

    /**
     * Get a cached value, or null if absent or expired.
     */
    public V get(String key) {
        if (key == null) return null;
        Entry<V> e = entries.get(key);
        if (e == null) return null;
        if (e.expiresAtMs <= clock.millis()) {
            entries.remove(key, e);
            return null;
        }
        return e.value;
    }

    public void put(String key, V value) {
        if (key == null || value == null || ttlMs <= 0) return;
        purgeExpired();
        entries.put(key, new Entry<>(value, clock.millis() + ttlMs));
    }

    public int size() {
        purgeExpired();
        return entries.size();
    }

    private void purgeExpired() {
        long now = clock.millis();
        entries.entrySet().removeIf(e -> e.getValue().expiresAtMs <= now);
    }

    private static final class Entry<V> {
        final V value;
        final long expiresAtMs;

        Entry(V value, long expiresAtMs) {
            this.value = value;
            this.expiresAtMs = expiresAtMs;
        }
    }
}
