package com.faceblog.gateway.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-process read-through cache with a fixed time-to-live per entry.
 *
 * <p>Expired entries are dropped lazily on read and in bulk by {@link #evictExpired()}.
 * Every removal is a conditional single-entry remove, so sweeping never blocks readers
 * or writers of other keys.
 */
public class LocalTtlCache<K, V> {

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public LocalTtlCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * @return the cached value, or null when absent or expired
     */
    public V get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry.value();
    }

    public void put(K key, V value) {
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    /**
     * Drop every entry whose value matches.
     *
     * @return number of entries removed
     */
    public int invalidateIf(Predicate<V> predicate) {
        int removed = 0;
        for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
            if (predicate.test(e.getValue().value()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * @return number of expired entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
