package com.fintech.signals.ingestion;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.PriceObservation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for DisruptorEventPublisher.
 *
 * <p><b>Test Coverage:</b>
 * <ul>
 *   <li>Blocking and non-blocking publishing</li>
 *   <li>Single-consumer ordering</li>
 *   <li>Wait strategy selection</li>
 *   <li>Consumer exceptions</li>
 *   <li>Concurrent producers</li>
 * </ul>
 */
@DisplayName("DisruptorEventPublisher Tests")
class DisruptorEventPublisherTest {

    private static final String MINT = "3NZ9JMVBmGAqocybic2c7LQCJScmgsAZ6vQqTDzcqmJh";

    private CandleAggregator mockAggregator;
    private DisruptorEventPublisher publisher;

    @BeforeEach
    void setUp() {
        mockAggregator = mock(CandleAggregator.class);
        publisher = new DisruptorEventPublisher(mockAggregator, createProperties(1024, "BLOCKING"), new SimpleMeterRegistry());
        publisher.start();
    }

    @AfterEach
    void tearDown() {
        if (publisher != null) {
            publisher.shutdown();
        }
    }

    private static SignalProperties createProperties(int bufferSize, String waitStrategy) {
        SignalProperties props = new SignalProperties();
        props.getAggregation().getDisruptor().setBufferSize(bufferSize);
        props.getAggregation().getDisruptor().setWaitStrategy(waitStrategy);
        return props;
    }

    private static PriceObservation observation(double price, long timestamp) {
        return new PriceObservation(MINT, price, timestamp, "jupiter");
    }

    @Test
    @DisplayName("Should hand a published observation to the aggregator")
    void testPublishObservation() {
        // Given
        PriceObservation observation = observation(97_000.0, 1_700_000_000_000L);

        // When
        publisher.publish(observation);

        // Then
        verify(mockAggregator, timeout(1000)).ingest(observation);
        assertThat(publisher.getObservationsPublished()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should apply observations in publish order")
    void testOrdering() {
        // Given
        for (int i = 0; i < 10; i++) {
            publisher.publish(observation(100.0 + i, 1_700_000_000_000L + i));
        }

        // Then
        ArgumentCaptor<PriceObservation> captor = ArgumentCaptor.forClass(PriceObservation.class);
        verify(mockAggregator, timeout(2000).times(10)).ingest(captor.capture());
        List<PriceObservation> applied = captor.getAllValues();
        for (int i = 0; i < 10; i++) {
            assertThat(applied.get(i).price()).isEqualTo(100.0 + i);
        }
    }

    @Test
    @DisplayName("A consumer exception should not stop later observations")
    void testConsumerExceptionIsolated() {
        PriceObservation bad = observation(1.0, 1_700_000_000_000L);
        PriceObservation good = observation(2.0, 1_700_000_000_001L);
        doThrow(new IllegalStateException("aggregator failure")).when(mockAggregator).ingest(bad);

        publisher.publish(bad);
        publisher.publish(good);

        verify(mockAggregator, timeout(1000)).ingest(good);
    }

    @Test
    @DisplayName("Concurrent producers should all be applied")
    void testConcurrentProducers() throws InterruptedException {
        int producers = 4;
        int perProducer = 250;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch done = new CountDownLatch(producers);
        for (int p = 0; p < producers; p++) {
            pool.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    publisher.publish(observation(100.0, 1_700_000_000_000L + i));
                }
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        verify(mockAggregator, timeout(5000).times(producers * perProducer)).ingest(any(PriceObservation.class));
        pool.shutdown();
    }

    @ParameterizedTest
    @ValueSource(strings = {"BLOCKING", "SLEEPING", "YIELDING", "unknown"})
    @DisplayName("Should start with every configured wait strategy")
    void testWaitStrategies(String strategy) {
        DisruptorEventPublisher other = new DisruptorEventPublisher(
            mockAggregator, createProperties(64, strategy), new SimpleMeterRegistry());
        other.start();
        try {
            assertThat(other.getBufferSize()).isEqualTo(64);
            other.publish(observation(1.5, 1_700_000_000_000L));
            verify(mockAggregator, timeout(1000).times(1)).ingest(any(PriceObservation.class));
        } finally {
            other.shutdown();
        }
    }
}
