package com.fintech.signals.aggregation;

import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.domain.PriceObservation;
import com.fintech.signals.error.InsufficientDataException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multi-interval OHLC aggregator. Every observation is folded into each
 * {@link Interval} series of its instrument.
 *
 * <p>Single writer (the ingestion handler thread), many readers. Each series carries
 * its own read-write lock; readers always receive copies.
 */
public class CandleAggregator {

    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final int maxCandlesPerSeries;
    private final MeterRegistry meterRegistry;

    private final Map<SeriesKey, CandleSeries> series = new ConcurrentHashMap<>();

    private final AtomicLong observationsIngested = new AtomicLong(0);
    private final AtomicLong observationsRejected = new AtomicLong(0);
    private final AtomicLong candlesCreated = new AtomicLong(0);
    private final AtomicLong lateObservationsDropped = new AtomicLong(0);

    public CandleAggregator(int maxCandlesPerSeries, MeterRegistry meterRegistry) {
        if (maxCandlesPerSeries < 1) {
            throw new IllegalArgumentException("Max candles per series must be at least 1");
        }
        this.maxCandlesPerSeries = maxCandlesPerSeries;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("candle.aggregator.observations.ingested", observationsIngested);
        meterRegistry.gauge("candle.aggregator.observations.rejected", observationsRejected);
        meterRegistry.gauge("candle.aggregator.candles.created", candlesCreated);
        meterRegistry.gauge("candle.aggregator.late.observations.dropped", lateObservationsDropped);
        meterRegistry.gauge("candle.aggregator.series.count", series, Map::size);
    }

    public void ingest(PriceObservation observation) {
        if (!observation.isValid()) {
            observationsRejected.incrementAndGet();
            log.warn("Invalid observation received, skipping: {}", observation);
            return;
        }
        ingest(observation.instrumentId(), observation.price(), observation.observedAt());
    }

    /**
     * Folds one price into every interval series of the instrument.
     */
    public void ingest(String instrumentId, double price, long timestamp) {
        if (instrumentId == null || instrumentId.isBlank() || !Double.isFinite(price) || price <= 0) {
            observationsRejected.incrementAndGet();
            log.warn("Rejected observation: instrument={}, price={}, timestamp={}", instrumentId, price, timestamp);
            return;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            for (Interval interval : Interval.values()) {
                CandleSeries target = series.computeIfAbsent(
                    new SeriesKey(instrumentId, interval),
                    key -> new CandleSeries(key, maxCandlesPerSeries));

                switch (target.ingest(price, timestamp)) {
                    case CREATED -> {
                        candlesCreated.incrementAndGet();
                        if (log.isTraceEnabled()) {
                            log.trace("Started candle: instrument={}, interval={}, bucket={}",
                                    instrumentId, interval.code(), interval.alignTimestamp(timestamp));
                        }
                    }
                    case DROPPED_LATE -> {
                        lateObservationsDropped.incrementAndGet();
                        log.debug("Dropped late observation: instrument={}, interval={}, timestamp={}",
                                instrumentId, interval.code(), timestamp);
                    }
                    case UPDATED -> {
                        // high/low/close folded in
                    }
                }
            }
            observationsIngested.incrementAndGet();
        } finally {
            sample.stop(meterRegistry.timer("candle.aggregator.ingest.time"));
        }
    }

    /**
     * Newest {@code count} candles for the series, oldest first. Short history is returned as-is.
     *
     * @throws InsufficientDataException when the series holds no candles
     */
    public List<Candle> getCandles(String instrumentId, Interval interval, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Candle count must be positive, got " + count);
        }
        CandleSeries target = series.get(new SeriesKey(instrumentId, interval));
        List<Candle> candles = target == null ? List.of() : target.latest(count);
        if (candles.isEmpty()) {
            throw new InsufficientDataException(
                "No " + interval.code() + " candles collected yet for " + instrumentId);
        }
        return candles;
    }

    /** Like {@link #getCandles} but returns an empty list instead of throwing. */
    public List<Candle> findCandles(String instrumentId, Interval interval, int count) {
        CandleSeries target = series.get(new SeriesKey(instrumentId, interval));
        return target == null ? List.of() : target.latest(count);
    }

    /**
     * Candle counts per instrument id, then per interval code.
     */
    public Map<String, Map<String, Integer>> stats() {
        Map<String, Map<Interval, Integer>> grouped = new TreeMap<>();
        series.forEach((key, value) -> grouped
            .computeIfAbsent(key.instrumentId(), id -> new EnumMap<>(Interval.class))
            .put(key.interval(), value.size()));

        Map<String, Map<String, Integer>> result = new TreeMap<>();
        grouped.forEach((instrumentId, counts) -> {
            Map<String, Integer> byCode = new LinkedHashMap<>();
            counts.forEach((interval, size) -> byCode.put(interval.code(), size));
            result.put(instrumentId, Collections.unmodifiableMap(byCode));
        });
        return Collections.unmodifiableMap(result);
    }

    public int getMaxCandlesPerSeries() {
        return maxCandlesPerSeries;
    }

    public long getObservationsIngested() {
        return observationsIngested.get();
    }

    public long getObservationsRejected() {
        return observationsRejected.get();
    }

    public long getCandlesCreated() {
        return candlesCreated.get();
    }

    public long getCandlesEvicted() {
        return series.values().stream().mapToLong(CandleSeries::evictedCount).sum();
    }

    public long getLateObservationsDropped() {
        return lateObservationsDropped.get();
    }

    public int getSeriesCount() {
        return series.size();
    }
}
