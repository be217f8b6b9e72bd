package com.fintech.signals.aggregation;

import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Interval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CandleSeries Tests")
class CandleSeriesTest {

    private static final long BASE = 1_700_000_040_000L; // minute-aligned

    private CandleSeries series;

    @BeforeEach
    void setUp() {
        series = new CandleSeries(new SeriesKey("mint-a", Interval.M1), 3);
    }

    @Test
    @DisplayName("Observations in one bucket should fold into one candle")
    void testSameBucketFolding() {
        assertThat(series.ingest(100.0, BASE)).isEqualTo(CandleSeries.IngestResult.CREATED);
        assertThat(series.ingest(104.0, BASE + 10_000)).isEqualTo(CandleSeries.IngestResult.UPDATED);
        assertThat(series.ingest(97.0, BASE + 20_000)).isEqualTo(CandleSeries.IngestResult.UPDATED);
        assertThat(series.ingest(101.0, BASE + 59_999)).isEqualTo(CandleSeries.IngestResult.UPDATED);

        List<Candle> candles = series.latest(3);
        assertThat(candles).hasSize(1);
        Candle candle = candles.get(0);
        assertThat(candle.bucketStart()).isEqualTo(BASE);
        assertThat(candle.open()).isEqualTo(100.0);
        assertThat(candle.high()).isEqualTo(104.0);
        assertThat(candle.low()).isEqualTo(97.0);
        assertThat(candle.close()).isEqualTo(101.0);
        assertThat(candle.volume()).isEqualTo(4);
    }

    @Test
    @DisplayName("Exceeding the cap should evict exactly the oldest candle")
    void testEvictsOldest() {
        for (int i = 0; i < 3; i++) {
            series.ingest(100.0 + i, BASE + i * 60_000L);
        }
        assertThat(series.size()).isEqualTo(3);

        series.ingest(200.0, BASE + 3 * 60_000L);

        List<Candle> candles = series.latest(3);
        assertThat(candles).hasSize(3);
        assertThat(candles.get(0).bucketStart()).isEqualTo(BASE + 60_000L);
        assertThat(candles.get(2).close()).isEqualTo(200.0);
        assertThat(series.evictedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Late observation for an existing bucket should update it")
    void testLateObservationUpdatesExistingBucket() {
        series.ingest(100.0, BASE);
        series.ingest(110.0, BASE + 60_000L);

        assertThat(series.ingest(90.0, BASE + 30_000L)).isEqualTo(CandleSeries.IngestResult.UPDATED);

        Candle first = series.latest(3).get(0);
        assertThat(first.low()).isEqualTo(90.0);
        assertThat(first.close()).isEqualTo(90.0);
        assertThat(first.open()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Late observation for a missing past bucket should be dropped")
    void testLateObservationForGapIsDropped() {
        series.ingest(100.0, BASE);
        series.ingest(110.0, BASE + 120_000L);

        assertThat(series.ingest(105.0, BASE + 60_000L)).isEqualTo(CandleSeries.IngestResult.DROPPED_LATE);
        assertThat(series.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("latest() should return newest candles oldest first")
    void testLatest() {
        for (int i = 0; i < 3; i++) {
            series.ingest(100.0 + i, BASE + i * 60_000L);
        }

        List<Candle> latest = series.latest(2);

        assertThat(latest).extracting(Candle::close).containsExactly(101.0, 102.0);
        assertThat(series.latest(10)).hasSize(3);
    }

    @Test
    @DisplayName("Returned lists should be detached copies")
    void testSnapshotIsImmutable() {
        series.ingest(100.0, BASE);
        List<Candle> snapshot = series.latest(3);

        series.ingest(120.0, BASE + 60_000L);

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(Candle.of(0L, 1.0)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void testRejectsZeroCapacity() {
        assertThatThrownBy(() -> new CandleSeries(new SeriesKey("mint-a", Interval.M1), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Readers running alongside the writer should only see ordered, bounded, valid candles")
    void testConcurrentReadersDuringWrites() throws Exception {
        // Given
        int capacity = 50;
        int observations = 20_000;
        int observationsPerBucket = 10;
        int readerCount = 4;
        CandleSeries shared = new CandleSeries(new SeriesKey("mint-a", Interval.M1), capacity);

        ExecutorService pool = Executors.newFixedThreadPool(readerCount + 1);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicLong snapshotsChecked = new AtomicLong();
        Queue<String> violations = new ConcurrentLinkedQueue<>();

        // When
        Future<?> writer = pool.submit(() -> {
            startLatch.await();
            try {
                for (int i = 0; i < observations; i++) {
                    double price = 100.0 + (i % 7) - (i % 3);
                    long timestamp = BASE + (long) (i / observationsPerBucket) * 60_000L
                        + (i % observationsPerBucket) * 1_000L;
                    shared.ingest(price, timestamp);
                }
            } finally {
                writing.set(false);
            }
            return null;
        });

        List<Future<?>> readers = new ArrayList<>();
        for (int r = 0; r < readerCount; r++) {
            int window = r % 2 == 0 ? capacity : 10;
            readers.add(pool.submit(() -> {
                startLatch.await();
                do {
                    List<Candle> candles = shared.latest(window);
                    if (candles.size() > window) {
                        violations.add("snapshot of " + candles.size() + " exceeds window " + window);
                    }
                    for (int i = 0; i < candles.size(); i++) {
                        Candle candle = candles.get(i);
                        if (candle.low() > Math.min(candle.open(), candle.close())
                                || candle.high() < Math.max(candle.open(), candle.close())) {
                            violations.add("inconsistent OHLC: " + candle);
                        }
                        if (i > 0 && candles.get(i - 1).bucketStart() >= candle.bucketStart()) {
                            violations.add("out of order at " + candle.bucketStart());
                        }
                    }
                    snapshotsChecked.incrementAndGet();
                } while (writing.get());
                return null;
            }));
        }

        startLatch.countDown();
        writer.get(10, TimeUnit.SECONDS);
        for (Future<?> reader : readers) {
            reader.get(10, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        // Then
        assertThat(violations).isEmpty();
        assertThat(snapshotsChecked.get()).isGreaterThanOrEqualTo(readerCount);
        assertThat(shared.size()).isEqualTo(capacity);

        List<Candle> settled = shared.latest(capacity);
        long lastBucket = BASE + (long) (observations / observationsPerBucket - 1) * 60_000L;
        assertThat(settled.get(capacity - 1).bucketStart()).isEqualTo(lastBucket);
        assertThat(settled).allSatisfy(candle -> assertThat(candle.volume()).isEqualTo(observationsPerBucket));
        assertThat(shared.evictedCount()).isEqualTo(observations / observationsPerBucket - capacity);
    }
}
