package com.fintech.signals.quote;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Time-boxed memoization in front of the upstream feed.
 *
 * <p>Entries live for {@code ttl} counted from the lookup that loaded them. Beyond
 * {@code maxEntries} the oldest insertion is evicted.
 * The loader runs outside the lock, so two concurrent misses on one key may both load.
 * A loader that throws leaves the cache untouched.
 */
public class QuoteCache<V> {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final LinkedHashMap<String, Entry<V>> entries = new LinkedHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public QuoteCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public V getOrLoad(String key, Supplier<V> loader) {
        long now = clock.millis();
        synchronized (entries) {
            Entry<V> cached = entries.get(key);
            if (cached != null && now - cached.storedAt < ttl.toMillis()) {
                hits.incrementAndGet();
                return cached.value;
            }
        }

        misses.incrementAndGet();
        V value = loader.get();

        synchronized (entries) {
            // re-insert so the refreshed entry counts as newest
            entries.remove(key);
            entries.put(key, new Entry<>(value, now));
            Iterator<Map.Entry<String, Entry<V>>> oldest = entries.entrySet().iterator();
            while (entries.size() > maxEntries && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
                evictions.incrementAndGet();
            }
        }
        return value;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }

    private record Entry<V>(V value, long storedAt) {
    }
}
