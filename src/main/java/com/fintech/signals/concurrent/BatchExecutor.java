package com.fintech.signals.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Settle-all fan-out: runs one task per key on a bounded pool and returns one
 * {@link BatchOutcome} per key, in input order. A failing or timed-out member
 * never fails the batch and never cancels its siblings. Callers log failures.
 */
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private final ExecutorService executor;
    private final Duration timeout;

    public BatchExecutor(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <K, V> List<BatchOutcome<K, V>> settleAll(String batchName, List<K> keys, Function<K, V> task) {
        List<Future<V>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            futures.add(executor.submit(() -> task.apply(key)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        List<BatchOutcome<K, V>> outcomes = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            K key = keys.get(i);
            Future<V> future = futures.get(i);
            BatchOutcome<K, V> outcome;
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                outcome = BatchOutcome.success(key, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                outcome = BatchOutcome.failure(key, e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                future.cancel(true);
                outcome = BatchOutcome.failure(key, new TimeoutException(
                    batchName + " member " + key + " exceeded " + timeout.toMillis() + "ms"));
            } catch (CancellationException e) {
                outcome = BatchOutcome.failure(key, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                outcome = BatchOutcome.failure(key, e);
            }
            if (!outcome.isSuccess() && log.isDebugEnabled()) {
                log.debug("Batch member failed: batch={}, key={}, error={}",
                        batchName, key, describe(outcome.error()));
            }
            outcomes.add(outcome);
        }

        if (log.isDebugEnabled()) {
            long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
            log.debug("Batch settled: batch={}, members={}, failed={}", batchName, outcomes.size(), failed);
        }
        return outcomes;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
