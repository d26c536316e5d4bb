package com.ashfall.exception;

public class DegenerateTaperException extends AshfallException {

    public DegenerateTaperException(double innerRadius, double outerRadius) {
        super(String.format("Taper inner radius %.4f must be smaller than outer radius %.4f",
                innerRadius, outerRadius));
    }

    @Override
    public String getErrorCode() {
        return "DegenerateTaper";
    }
}
