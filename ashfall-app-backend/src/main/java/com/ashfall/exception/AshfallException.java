package com.ashfall.exception;

/**
 * Base class for failures that make an ashfall run impossible to complete.
 * These are fatal for the run and are never retried.
 */
public abstract class AshfallException extends RuntimeException {

    protected AshfallException(String message) {
        super(message);
    }

    protected AshfallException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine readable code, used in API error bodies.
     */
    public abstract String getErrorCode();
}
