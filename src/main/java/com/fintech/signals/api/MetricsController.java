package com.fintech.signals.api;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.ingestion.DisruptorEventPublisher;
import com.fintech.signals.ingestion.PricePoller;
import com.fintech.signals.quote.QuoteService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Human-readable engine metrics. Prometheus scrapes the same meters from /actuator/prometheus.
 * Not metered by the payment gate.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Monitoring")
public class MetricsController {

    private final MeterRegistry meterRegistry;
    private final CandleAggregator aggregator;
    private final DisruptorEventPublisher publisher;
    private final QuoteService quoteService;
    private final ObjectProvider<PricePoller> poller;

    public MetricsController(
            MeterRegistry meterRegistry,
            CandleAggregator aggregator,
            DisruptorEventPublisher publisher,
            QuoteService quoteService,
            ObjectProvider<PricePoller> poller) {
        this.meterRegistry = meterRegistry;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.quoteService = quoteService;
        this.poller = poller;
    }

    /**
     * Ingestion, aggregation and price-feed counters.
     */
    @Operation(summary = "Engine state summary")
    @GetMapping("/engine")
    public Map<String, Object> getEngineMetrics() {
        Map<String, Object> response = new LinkedHashMap<>();

        Map<String, Object> aggregation = new LinkedHashMap<>();
        aggregation.put("observations_ingested", aggregator.getObservationsIngested());
        aggregation.put("observations_rejected", aggregator.getObservationsRejected());
        aggregation.put("candles_created", aggregator.getCandlesCreated());
        aggregation.put("candles_evicted", aggregator.getCandlesEvicted());
        aggregation.put("late_observations_dropped", aggregator.getLateObservationsDropped());
        aggregation.put("series_count", aggregator.getSeriesCount());
        response.put("aggregation", aggregation);

        Map<String, Object> ingestion = new LinkedHashMap<>();
        ingestion.put("published", publisher.getObservationsPublished());
        ingestion.put("ring_buffer_remaining", publisher.getRemainingCapacity());
        ingestion.put("ring_buffer_size", publisher.getBufferSize());
        response.put("ingestion", ingestion);

        Map<String, Object> feed = new LinkedHashMap<>();
        feed.put("circuit_state", quoteService.circuitState().name());
        PricePoller activePoller = poller.getIfAvailable();
        feed.put("polling", activePoller != null && activePoller.isRunning());
        if (activePoller != null) {
            feed.put("poll_cycles_completed", activePoller.getCyclesCompleted());
            feed.put("poll_fetch_failures", activePoller.getFetchFailures());
        }
        response.put("price_feed", feed);

        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("entries", (long) gaugeValue("quote.cache.size"));
        cache.put("hits", (long) gaugeValue("quote.cache.hits"));
        cache.put("misses", (long) gaugeValue("quote.cache.misses"));
        cache.put("evictions", (long) gaugeValue("quote.cache.evictions"));
        response.put("quote_cache", cache);

        response.put("timestamp", System.currentTimeMillis());
        return response;
    }

    /**
     * Latency percentiles for ingestion, upstream fetches and analysis.
     */
    @Operation(summary = "Latency percentiles")
    @GetMapping("/latency")
    public Map<String, Object> getLatencyMetrics() {
        Map<String, Object> response = new LinkedHashMap<>();
        addTimerMetrics(response, "candle_ingest", "candle.aggregator.ingest.time");
        addTimerMetrics(response, "price_fetch", "quote.upstream.latency");
        addTimerMetrics(response, "asset_analysis", "analysis.asset.time");
        addTimerMetrics(response, "operations", "signals.operation.time");
        return response;
    }

    private double gaugeValue(String name) {
        Gauge gauge = meterRegistry.find(name).gauge();
        return gauge == null ? 0 : gauge.value();
    }

    private void addTimerMetrics(Map<String, Object> response, String key, String timerName) {
        Timer timer = meterRegistry.find(timerName).timer();
        if (timer == null) {
            return;
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("count", timer.count());
        metrics.put("mean_ms", timer.mean(TimeUnit.MILLISECONDS));
        metrics.put("max_ms", timer.max(TimeUnit.MILLISECONDS));

        HistogramSnapshot snapshot = timer.takeSnapshot();
        for (ValueAtPercentile percentile : snapshot.percentileValues()) {
            metrics.put(formatPercentileKey(percentile.percentile()) + "_ms", percentile.value(TimeUnit.MILLISECONDS));
        }

        response.put(key, metrics);
    }

    /**
     * 0.5 -> "p50", 0.999 -> "p999"
     */
    private String formatPercentileKey(double percentile) {
        if (percentile == 0.999) return "p999";
        return "p" + Math.round(percentile * 100);
    }
}
