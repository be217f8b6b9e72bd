package com.fintech.signals.ingestion;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.PriceObservation;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands price observations to the candle aggregator through an LMAX Disruptor ring buffer.
 *
 * <p>Exactly one consumer thread drains the buffer, which makes it the sole writer of
 * candle state. Producers (poller, quote fetches) never touch candle series directly.
 */
public class DisruptorEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DisruptorEventPublisher.class);

    private final CandleAggregator aggregator;
    private final SignalProperties properties;

    private final AtomicLong observationsPublished = new AtomicLong(0);

    private Disruptor<ObservationHolder> disruptor;
    private RingBuffer<ObservationHolder> ringBuffer;

    public DisruptorEventPublisher(CandleAggregator aggregator, SignalProperties properties, MeterRegistry meterRegistry) {
        this.aggregator = aggregator;
        this.properties = properties;

        meterRegistry.gauge("disruptor.observations.published", observationsPublished);
    }

    @PostConstruct
    public void start() {
        int bufferSize = properties.getAggregation().getDisruptor().getBufferSize();

        EventFactory<ObservationHolder> eventFactory = ObservationHolder::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("candle-writer-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<ObservationHolder>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, ObservationHolder holder) {
                log.error("Exception applying observation at sequence {}: {}", sequence, holder.observation, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Disruptor started: bufferSize={}, waitStrategy={}",
                bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Publishes an observation, blocking while the buffer is full (back-pressure).
     */
    public void publish(PriceObservation observation) {
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).observation = observation;
        } finally {
            ringBuffer.publish(sequence);
        }
        observationsPublished.incrementAndGet();
    }

    private void handleEvent(ObservationHolder holder, long sequence, boolean endOfBatch) {
        PriceObservation observation = holder.observation;
        holder.observation = null;
        if (observation != null) {
            aggregator.ingest(observation);
            if (endOfBatch && log.isTraceEnabled()) {
                log.trace("Applied observation at sequence {}, end of batch", sequence);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down Disruptor...");
            disruptor.shutdown();
            log.info("Disruptor shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = properties.getAggregation().getDisruptor().getWaitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Pre-allocated ring buffer slot.
     */
    private static class ObservationHolder {
        PriceObservation observation;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public long getObservationsPublished() {
        return observationsPublished.get();
    }
}
