package com.ashfall.service.model.impl.kernels;

import com.ashfall.service.model.ValueTransform;

/**
 * Fits {@code log10(thickness + offset)}. Thickness spans several orders of
 * magnitude, so fitting in log space keeps the largest deposits from
 * dominating the surface.
 */
public class Log10Transform implements ValueTransform {

    private final double offset;

    public Log10Transform(double offset) {
        if (!(offset > 0) || !Double.isFinite(offset)) {
            throw new IllegalArgumentException("Log offset must be a positive finite value, got " + offset);
        }
        this.offset = offset;
    }

    @Override
    public double forward(double thicknessCm) {
        return Math.log10(thicknessCm + offset);
    }

    @Override
    public double inverse(double value) {
        return Math.pow(10.0, value) - offset;
    }
}
