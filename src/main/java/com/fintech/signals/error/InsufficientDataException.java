package com.fintech.signals.error;

/**
 * Not enough accumulated history for the requested computation.
 * Recoverable: more polling cycles will fill the series.
 */
public class InsufficientDataException extends SignalEngineException {

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }
}
