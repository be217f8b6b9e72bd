package com.fintech.signals.error;

/**
 * Base type for the engine's domain failures. Each subtype maps to one {@link ErrorKind}.
 */
public abstract class SignalEngineException extends RuntimeException {

    private final ErrorKind kind;

    protected SignalEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SignalEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
