package com.ashfall.service.model.impl;

import com.ashfall.exception.DegenerateTaperException;
import com.ashfall.model.Grid;
import com.ashfall.model.ScalarField;
import com.ashfall.model.WeightField;

/**
 * Anisotropic distance decay around the eruption source. Longitude offsets
 * are scaled by {@code cos(sourceLatitude)}, southward latitude offsets by
 * {@code southBoost}. The weight is 1 up to the inner radius, falls linearly
 * to 0 at the outer radius and stays 0 beyond it.
 */
public final class DirectionalTaper {

    private final double sourceLongitude;
    private final double sourceLatitude;
    private final double southBoost;
    private final double innerRadius;
    private final double outerRadius;
    private final double lonScale;

    public DirectionalTaper(double sourceLongitude, double sourceLatitude, double southBoost,
                            double innerRadius, double outerRadius) {
        if (!Double.isFinite(sourceLongitude) || !Double.isFinite(sourceLatitude) || !Double.isFinite(southBoost)
                || !Double.isFinite(innerRadius) || !Double.isFinite(outerRadius)) {
            throw new IllegalArgumentException("Taper parameters must be finite");
        }
        if (innerRadius >= outerRadius) {
            throw new DegenerateTaperException(innerRadius, outerRadius);
        }
        if (innerRadius <= 0) {
            throw new IllegalArgumentException("Taper inner radius must be positive, got " + innerRadius);
        }
        if (southBoost < 1.0) {
            throw new IllegalArgumentException("South boost must be >= 1, got " + southBoost);
        }
        this.sourceLongitude = sourceLongitude;
        this.sourceLatitude = sourceLatitude;
        this.southBoost = southBoost;
        this.innerRadius = innerRadius;
        this.outerRadius = outerRadius;
        this.lonScale = Math.cos(Math.toRadians(sourceLatitude));
    }

    /** Effective distance of a point from the source, in degrees. */
    public double effectiveRadius(double lon, double lat) {
        double dx = (lon - sourceLongitude) * lonScale;
        double dy = lat - sourceLatitude;
        double dyEff = dy < 0 ? dy * southBoost : dy;
        return Math.sqrt(dx * dx + dyEff * dyEff);
    }

    public double weightForRadius(double r) {
        if (r <= innerRadius) {
            return 1.0;
        }
        if (r >= outerRadius) {
            return 0.0;
        }
        return 1.0 - (r - innerRadius) / (outerRadius - innerRadius);
    }

    public double weightAt(double lon, double lat) {
        return weightForRadius(effectiveRadius(lon, lat));
    }

    public WeightField weights(Grid grid) {
        double[] w = new double[grid.size()];
        for (int row = 0; row < grid.getNy(); row++) {
            double lat = grid.latitudeAt(row);
            for (int col = 0; col < grid.getNx(); col++) {
                w[grid.index(col, row)] = weightAt(grid.longitudeAt(col), lat);
            }
        }
        return new WeightField(grid, w);
    }

    /**
     * Multiplies the weights into the field. Where the weight is 0 the result
     * is exactly 0, also for undefined input nodes.
     */
    public ScalarField apply(ScalarField field) {
        WeightField w = weights(field.getGrid());
        double[] out = new double[field.size()];
        for (int i = 0; i < out.length; i++) {
            double weight = w.get(i);
            out[i] = weight == 0.0 ? 0.0 : field.get(i) * weight;
        }
        return new ScalarField(field.getGrid(), out);
    }
}
