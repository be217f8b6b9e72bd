package com.fintech.signals.error;

/**
 * Unknown instrument id or symbol.
 */
public class InstrumentNotFoundException extends SignalEngineException {

    private final String requested;

    public InstrumentNotFoundException(String requested, String message) {
        super(ErrorKind.INSTRUMENT_NOT_FOUND, message);
        this.requested = requested;
    }

    public String requested() {
        return requested;
    }
}
