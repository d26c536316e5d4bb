package com.ashfall.exception;

/**
 * Thrown when no valid region geometry can be built from a mask.
 */
public class InvalidGeometryException extends AshfallException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "InvalidGeometry";
    }
}
