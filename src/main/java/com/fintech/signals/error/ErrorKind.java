package com.fintech.signals.error;

/**
 * Machine-readable error kinds carried in every error response.
 */
public enum ErrorKind {
    INSUFFICIENT_DATA,
    INSTRUMENT_NOT_FOUND,
    UPSTREAM_FETCH_ERROR,
    PAYMENT_REQUIRED
}
