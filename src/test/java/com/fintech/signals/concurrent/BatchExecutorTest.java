package com.fintech.signals.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchExecutor Tests")
class BatchExecutorTest {

    private ExecutorService executor;
    private BatchExecutor batchExecutor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        batchExecutor = new BatchExecutor(executor, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should return one outcome per key in input order")
    void testInputOrder() {
        List<BatchOutcome<Integer, Integer>> outcomes = batchExecutor.settleAll("square", List.of(5, 1, 4, 2, 3), key -> {
            sleepQuietly(key * 10L);
            return key * key;
        });

        assertThat(outcomes).extracting(BatchOutcome::key).containsExactly(5, 1, 4, 2, 3);
        assertThat(outcomes).extracting(BatchOutcome::value).containsExactly(25, 1, 16, 4, 9);
    }

    @Test
    @DisplayName("A failing member should not fail or cancel its siblings")
    void testFailureIsolated() {
        List<BatchOutcome<String, String>> outcomes = batchExecutor.settleAll("upper", List.of("a", "boom", "c"), key -> {
            if (key.equals("boom")) {
                throw new IllegalStateException("member failed");
            }
            return key.toUpperCase();
        });

        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).error()).isInstanceOf(IllegalStateException.class).hasMessage("member failed");
        assertThat(outcomes.get(1).value()).isNull();
        assertThat(outcomes).filteredOn(BatchOutcome::isSuccess)
            .extracting(BatchOutcome::value)
            .containsExactly("A", "C");
    }

    @Test
    @DisplayName("A member past the deadline should settle as a timeout")
    void testTimeout() throws InterruptedException {
        BatchExecutor shortDeadline = new BatchExecutor(executor, Duration.ofMillis(100));
        CountDownLatch never = new CountDownLatch(1);

        List<BatchOutcome<String, String>> outcomes = shortDeadline.settleAll("slow", List.of("fast", "stuck"), key -> {
            if (key.equals("stuck")) {
                try {
                    never.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return key;
        });

        assertThat(outcomes.get(0).value()).isEqualTo("fast");
        assertThat(outcomes.get(1).error()).isInstanceOf(TimeoutException.class).hasMessageContaining("stuck");
    }

    @Test
    @DisplayName("An empty batch should settle immediately")
    void testEmptyBatch() {
        assertThat(batchExecutor.settleAll("empty", List.<String>of(), key -> key)).isEmpty();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
