package com.fintech.signals.error;

/**
 * The price feed was unreachable or returned no usable price. There is no fallback value.
 */
public class UpstreamFetchException extends SignalEngineException {

    public UpstreamFetchException(String message) {
        super(ErrorKind.UPSTREAM_FETCH_ERROR, message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_FETCH_ERROR, message, cause);
    }
}
