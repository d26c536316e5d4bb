package com.ashfall.model;

/**
 * Scalar field whose values all lie within [0, 1].
 */
public class WeightField extends ScalarField {

    public WeightField(Grid grid, double[] weights) {
        super(grid, weights);
        for (double w : weights) {
            if (!(w >= 0.0 && w <= 1.0)) {
                throw new IllegalArgumentException("Weight outside [0, 1]: " + w);
            }
        }
    }
}
