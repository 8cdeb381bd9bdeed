package io.sessionvault.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read cache with a fixed capacity and time-to-live. When full, the entry with the fewest
 * hits is evicted (the oldest such entry on ties).
 */
public final class PrefetchCache<V> {
    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private long lookups;
    private long hits;

    public PrefetchCache(int capacity, Duration ttl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = clock;
    }

    public synchronized Optional<V> get(String key) {
        lookups++;
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            return Optional.empty();
        }
        entry.hits++;
        hits++;
        return Optional.of(entry.data);
    }

    public synchronized Optional<String> put(String key, V value) {
        CacheEntry<V> existing = entries.get(key);
        if (existing != null) {
            existing.data = value;
            existing.timestamp = clock.instant();
            return Optional.empty();
        }
        Optional<String> evicted = Optional.empty();
        if (entries.size() >= capacity) {
            evicted = evictLeastHit();
        }
        entries.put(key, new CacheEntry<>(value, clock.instant()));
        return evicted;
    }

    private Optional<String> evictLeastHit() {
        String victim = null;
        long fewest = Long.MAX_VALUE;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().hits < fewest) {
                fewest = e.getValue().hits;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
        }
        return Optional.ofNullable(victim);
    }

    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next(), now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized void invalidate(String key) {
        entries.remove(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public synchronized OptionalLong hitsOf(String key) {
        CacheEntry<V> entry = entries.get(key);
        return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.hits);
    }

    public synchronized long totalHits() {
        return hits;
    }

    public synchronized long totalLookups() {
        return lookups;
    }

    public int capacity() {
        return capacity;
    }

    private boolean isExpired(CacheEntry<V> entry, Instant now) {
        return entry.timestamp.plus(ttl).isBefore(now);
    }

    private static final class CacheEntry<V> {
        private V data;
        private Instant timestamp;
        private long hits;

        private CacheEntry(V data, Instant timestamp) {
            this.data = data;
            this.timestamp = timestamp;
        }
    }
}
