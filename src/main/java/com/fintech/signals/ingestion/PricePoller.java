package com.fintech.signals.ingestion;

import com.fintech.signals.domain.Instrument;
import com.fintech.signals.error.SignalEngineException;
import com.fintech.signals.quote.QuoteService;
import com.fintech.signals.registry.InstrumentRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically pulls a price for every instrument. Each fresh quote reaches the
 * candle aggregator through the ingestion ring buffer.
 *
 * <p>One instrument's failure never stops the cycle; the next tick retries it.
 */
public class PricePoller {

    private static final Logger log = LoggerFactory.getLogger(PricePoller.class);

    private final InstrumentRegistry registry;
    private final QuoteService quoteService;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final Duration initialDelay;

    private final AtomicLong cyclesCompleted = new AtomicLong(0);
    private final AtomicLong fetchFailures = new AtomicLong(0);

    private ScheduledFuture<?> task;

    public PricePoller(
            InstrumentRegistry registry,
            QuoteService quoteService,
            TaskScheduler scheduler,
            Duration interval,
            Duration initialDelay,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.quoteService = quoteService;
        this.scheduler = scheduler;
        this.interval = interval;
        this.initialDelay = initialDelay;

        meterRegistry.gauge("poller.cycles.completed", cyclesCompleted);
        meterRegistry.gauge("poller.fetch.failures", fetchFailures);
    }

    @PostConstruct
    public synchronized void start() {
        if (task != null && !task.isDone()) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::pollOnce, Instant.now().plus(initialDelay), interval);
        log.info("Price poller started: instruments={}, interval={}ms", registry.size(), interval.toMillis());
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Price poller stopped after {} cycles", cyclesCompleted.get());
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * One polling cycle over the whole universe.
     */
    public void pollOnce() {
        int failures = 0;
        for (Instrument instrument : registry.all()) {
            try {
                quoteService.getPrice(instrument);
            } catch (SignalEngineException e) {
                failures++;
                log.warn("Poll failed: symbol={}, kind={}, error={}", instrument.symbol(), e.kind(), e.getMessage());
            } catch (RuntimeException e) {
                failures++;
                log.error("Unexpected poll error: symbol={}", instrument.symbol(), e);
            }
        }
        fetchFailures.addAndGet(failures);
        cyclesCompleted.incrementAndGet();
        log.debug("Poll cycle complete: instruments={}, failures={}", registry.size(), failures);
    }

    public long getCyclesCompleted() {
        return cyclesCompleted.get();
    }

    public long getFetchFailures() {
        return fetchFailures.get();
    }
}
