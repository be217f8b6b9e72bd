package com.fintech.signals.aggregation;

import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Interval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, bucket-ordered candle sequence for one (instrument, interval).
 *
 * <p>Guarded by a read-write lock: one writer folds observations in, readers get
 * immutable copies. Candles are immutable records, so a copy is a consistent snapshot.
 */
public class CandleSeries {

    /** Outcome of folding one observation into the series. */
    public enum IngestResult {
        CREATED,
        UPDATED,
        /** Past bucket with no candle; candles are never created retroactively. */
        DROPPED_LATE
    }

    private final SeriesKey key;
    private final int capacity;
    private final ArrayList<Candle> candles;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long evicted;

    public CandleSeries(SeriesKey key, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Series capacity must be at least 1, got " + capacity);
        }
        this.key = key;
        this.capacity = capacity;
        this.candles = new ArrayList<>(Math.min(capacity, 256));
    }

    public IngestResult ingest(double price, long timestamp) {
        Interval interval = key.interval();
        long bucketStart = interval.alignTimestamp(timestamp);

        lock.writeLock().lock();
        try {
            int size = candles.size();
            if (size == 0 || candles.get(size - 1).bucketStart() < bucketStart) {
                candles.add(Candle.of(bucketStart, price));
                if (candles.size() > capacity) {
                    candles.remove(0);
                    evicted++;
                }
                return IngestResult.CREATED;
            }

            int index = indexOf(bucketStart);
            if (index >= 0) {
                candles.set(index, candles.get(index).withPrice(price));
                return IngestResult.UPDATED;
            }

            return IngestResult.DROPPED_LATE;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Newest {@code count} candles, oldest first. Fewer when history is short. */
    public List<Candle> latest(int count) {
        lock.readLock().lock();
        try {
            int size = candles.size();
            int from = Math.max(0, size - Math.max(0, count));
            return Collections.unmodifiableList(new ArrayList<>(candles.subList(from, size)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return candles.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long evictedCount() {
        lock.readLock().lock();
        try {
            return evicted;
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the lock
    private int indexOf(long bucketStart) {
        int low = 0;
        int high = candles.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            long midStart = candles.get(mid).bucketStart();
            if (midStart < bucketStart) {
                low = mid + 1;
            } else if (midStart > bucketStart) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }
}
