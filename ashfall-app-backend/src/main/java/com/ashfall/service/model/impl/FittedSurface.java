package com.ashfall.service.model.impl;

import com.ashfall.service.model.RadialBasisFunction;
import com.ashfall.service.model.ValueTransform;

/**
 * A radial-basis-function surface fitted to scattered points in a
 * transformed value domain.
 */
public final class FittedSurface {

    private final double[] xs;
    private final double[] ys;
    private final double[] weights;
    private final RadialBasisFunction kernel;
    private final double epsilon;
    private final ValueTransform transform;

    FittedSurface(double[] xs, double[] ys, double[] weights, RadialBasisFunction kernel,
                  double epsilon, ValueTransform transform) {
        this.xs = xs;
        this.ys = ys;
        this.weights = weights;
        this.kernel = kernel;
        this.epsilon = epsilon;
        this.transform = transform;
    }

    /** Surface value in the fitting domain. */
    public double transformedValueAt(double lon, double lat) {
        double sum = 0.0;
        for (int j = 0; j < weights.length; j++) {
            double dx = lon - xs[j];
            double dy = lat - ys[j];
            sum += weights[j] * kernel.evaluate(Math.sqrt(dx * dx + dy * dy), epsilon);
        }
        return sum;
    }

    /** Back-transformed thickness, without any clamping. */
    public double estimate(double lon, double lat) {
        return transform.inverse(transformedValueAt(lon, lat));
    }

    /** Euclidean distance in degrees to the nearest fitted point. */
    public double distanceToNearest(double lon, double lat) {
        double best = Double.POSITIVE_INFINITY;
        for (int j = 0; j < xs.length; j++) {
            double dx = lon - xs[j];
            double dy = lat - ys[j];
            best = Math.min(best, dx * dx + dy * dy);
        }
        return Math.sqrt(best);
    }

    public int getPointCount() {
        return xs.length;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
