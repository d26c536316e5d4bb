package com.ashfall.exception;

/**
 * Thrown when the observation set cannot support a surface fit.
 */
public class InsufficientDataException extends AshfallException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "InsufficientData";
    }
}
