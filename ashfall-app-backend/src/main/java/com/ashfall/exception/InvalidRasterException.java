package com.ashfall.exception;

/**
 * Thrown when a land-use raster is not usable as given, e.g. it carries no
 * coordinate reference or one that differs from the working reference.
 */
public class InvalidRasterException extends AshfallException {

    public InvalidRasterException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "InvalidRaster";
    }
}
