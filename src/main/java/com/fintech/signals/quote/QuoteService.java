package com.fintech.signals.quote;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.concurrent.BatchExecutor;
import com.fintech.signals.concurrent.BatchOutcome;
import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.domain.PriceQuote;
import com.fintech.signals.error.UpstreamFetchException;
import com.fintech.signals.ingestion.DisruptorEventPublisher;
import com.fintech.signals.registry.InstrumentRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Current prices for tracked instruments.
 *
 * Responsibilities:
 * - Time-boxed caching in front of the rate-limited feed
 * - Circuit breaker around upstream calls
 * - Publishing every fresh quote to the ingestion pipeline
 *
 * No fallback price exists: every upstream failure reaches the caller.
 */
public class QuoteService {

    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);

    static final String CIRCUIT_BREAKER_NAME = "price-feed";
    private static final String PRICE_OPERATION = "price";
    private static final int HOURS_PER_DAY = 24;

    private final InstrumentRegistry registry;
    private final PriceFeedClient client;
    private final QuoteCache<PriceQuote> cache;
    private final DisruptorEventPublisher publisher;
    private final CandleAggregator aggregator;
    private final BatchExecutor batchExecutor;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    private final AtomicLong upstreamFailures = new AtomicLong(0);

    public QuoteService(
            InstrumentRegistry registry,
            PriceFeedClient client,
            QuoteCache<PriceQuote> cache,
            DisruptorEventPublisher publisher,
            CandleAggregator aggregator,
            BatchExecutor batchExecutor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.client = client;
        this.cache = cache;
        this.publisher = publisher;
        this.aggregator = aggregator;
        this.batchExecutor = batchExecutor;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("quote.upstream.failures", upstreamFailures);
        meterRegistry.gauge("quote.cache.hits", cache, QuoteCache::hits);
        meterRegistry.gauge("quote.cache.misses", cache, QuoteCache::misses);
        meterRegistry.gauge("quote.cache.size", cache, QuoteCache::size);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Price feed circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Current price for an instrument id or symbol.
     *
     * @throws com.fintech.signals.error.InstrumentNotFoundException for unknown instruments
     * @throws UpstreamFetchException when the feed fails or the breaker is open
     */
    public PriceQuote getPrice(String instrumentId) {
        return getPrice(registry.resolve(instrumentId));
    }

    public PriceQuote getPrice(Instrument instrument) {
        return cache.getOrLoad(PRICE_OPERATION + ":" + instrument.id(), () -> fetchFresh(instrument));
    }

    /**
     * Prices for every instrument, optionally one category. Failed instruments are
     * logged and left out.
     *
     * @throws UpstreamFetchException when every instrument failed
     */
    public List<InstrumentPrice> getCurrentPrices(AssetCategory category) {
        List<Instrument> instruments = category == null ? registry.all() : registry.byCategory(category);
        if (instruments.isEmpty()) {
            return List.of();
        }

        List<BatchOutcome<Instrument, PriceQuote>> outcomes =
            batchExecutor.settleAll("current-prices", instruments, this::getPrice);
        outcomes.stream()
            .filter(outcome -> !outcome.isSuccess())
            .forEach(outcome -> log.warn("Failed to fetch price for {}: {}",
                outcome.key().symbol(), outcome.error().getMessage()));
        List<InstrumentPrice> prices = outcomes.stream()
            .filter(BatchOutcome::isSuccess)
            .map(outcome -> toInstrumentPrice(outcome.value()))
            .toList();

        if (prices.isEmpty()) {
            throw new UpstreamFetchException("Price feed failed for all " + instruments.size() + " instruments");
        }
        return prices;
    }

    /**
     * Percent change against the open of the candle 24 hourly buckets back, or null with less history.
     * Used when the feed itself reports no 24h change.
     */
    public Double priceChange24h(String instrumentId, double currentPrice) {
        List<Candle> hourly = aggregator.findCandles(instrumentId, Interval.H1, HOURS_PER_DAY);
        if (hourly.size() < HOURS_PER_DAY) {
            return null;
        }
        double reference = hourly.get(0).open();
        return (currentPrice - reference) / reference * 100.0;
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private PriceQuote fetchFresh(Instrument instrument) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            PriceQuote quote = circuitBreaker.executeSupplier(() -> client.fetchPrice(instrument));
            publisher.publish(quote.toObservation());
            return quote;
        } catch (CallNotPermittedException e) {
            upstreamFailures.incrementAndGet();
            log.warn("Price feed circuit breaker OPEN - rejecting fetch for {}", instrument.symbol());
            throw new UpstreamFetchException("Price feed temporarily unavailable (circuit open)", e);
        } catch (UpstreamFetchException e) {
            upstreamFailures.incrementAndGet();
            log.warn("Price fetch failed: symbol={}, error={}", instrument.symbol(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            upstreamFailures.incrementAndGet();
            log.error("Unexpected price fetch error: symbol={}", instrument.symbol(), e);
            throw new UpstreamFetchException("Unable to fetch price for " + instrument.symbol(), e);
        } finally {
            sample.stop(meterRegistry.timer("quote.upstream.latency", "source", client.sourceName()));
        }
    }

    private InstrumentPrice toInstrumentPrice(PriceQuote quote) {
        Instrument instrument = quote.instrument();
        return new InstrumentPrice(
            instrument.id(),
            instrument.symbol(),
            instrument.displayName(),
            instrument.category(),
            quote.price(),
            quote.priceChange24h() != null
                ? quote.priceChange24h()
                : priceChange24h(instrument.id(), quote.price()),
            quote.timestamp(),
            quote.source()
        );
    }
}
