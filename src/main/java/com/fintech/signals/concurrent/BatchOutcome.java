package com.fintech.signals.concurrent;

/**
 * Settled result of one batch member: either a value or the error that replaced it.
 *
 * @param key Input the task ran for
 * @param value Result, null on failure
 * @param error Failure cause, null on success
 */
public record BatchOutcome<K, V>(K key, V value, Throwable error) {

    public static <K, V> BatchOutcome<K, V> success(K key, V value) {
        return new BatchOutcome<>(key, value, null);
    }

    public static <K, V> BatchOutcome<K, V> failure(K key, Throwable error) {
        return new BatchOutcome<>(key, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
