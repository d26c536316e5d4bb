package com.ashfall.service.model.impl.kernels;

import com.ashfall.service.model.ValueTransform;

/**
 * Fits thickness values as they are.
 */
public class IdentityTransform implements ValueTransform {

    @Override
    public double forward(double thicknessCm) {
        return thicknessCm;
    }

    @Override
    public double inverse(double value) {
        return value;
    }
}
