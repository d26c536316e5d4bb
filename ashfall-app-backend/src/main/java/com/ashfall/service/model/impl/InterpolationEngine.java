package com.ashfall.service.model.impl;

import com.ashfall.exception.InsufficientDataException;
import com.ashfall.model.Grid;
import com.ashfall.model.Observation;
import com.ashfall.model.ScalarField;
import com.ashfall.service.model.RadialBasisFunction;
import com.ashfall.service.model.ValueTransform;
import com.ashfall.service.model.impl.kernels.Log10Transform;
import com.ashfall.service.model.impl.kernels.StandardKernel;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a radial-basis-function surface to the positive observations and
 * evaluates it on a grid.
 * <p>
 * Numeric policy of the evaluated field: values that are non-finite or not
 * positive after the inverse transform are undefined (NaN); finite values are
 * clipped to {@code clipFactor} times the largest observation when
 * {@code clipFactor > 0}; nodes farther than {@code maxObservationDistance}
 * degrees from every observation are undefined when that distance is positive.
 */
public final class InterpolationEngine {

    public static final int MIN_OBSERVATIONS = 5;

    private static final Logger logger = LoggerFactory.getLogger(InterpolationEngine.class);

    private final RadialBasisFunction kernel;
    private final ValueTransform transform;
    private final double smoothing;
    private final double epsilon;
    private final double clipFactor;
    private final double maxObservationDistance;

    private InterpolationEngine(Builder builder) {
        this.kernel = builder.kernel;
        this.transform = builder.transform;
        this.smoothing = builder.smoothing;
        this.epsilon = builder.epsilon;
        this.clipFactor = builder.clipFactor;
        this.maxObservationDistance = builder.maxObservationDistance;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fits the surface to the observations with positive thickness. Dry sites
     * are skipped.
     *
     * @throws InsufficientDataException with fewer than {@value #MIN_OBSERVATIONS}
     *                                   positive observations or a singular system
     */
    public FittedSurface fit(List<Observation> observations) {
        List<Observation> positive = positiveOnly(observations);
        if (positive.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(String.format(
                    "At least %d observations with positive thickness are required, got %d",
                    MIN_OBSERVATIONS, positive.size()));
        }

        int n = positive.size();
        double[] xs = new double[n];
        double[] ys = new double[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            Observation o = positive.get(i);
            xs[i] = o.getLongitude();
            ys[i] = o.getLatitude();
            values[i] = transform.forward(o.getThicknessCm());
        }

        double eps = epsilon > 0 ? epsilon : averageSpacing(xs, ys);

        RealMatrix system = new Array2DRowRealMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double dx = xs[i] - xs[j];
                double dy = ys[i] - ys[j];
                double phi = kernel.evaluate(Math.sqrt(dx * dx + dy * dy), eps);
                system.setEntry(i, j, i == j ? phi - smoothing : phi);
            }
        }

        DecompositionSolver solver = new LUDecomposition(system).getSolver();
        RealVector weights;
        try {
            weights = solver.solve(new ArrayRealVector(values, false));
        } catch (SingularMatrixException e) {
            throw new InsufficientDataException(
                    "RBF system is singular; observation coordinates must be deduplicated", e);
        }

        logger.debug("Fitted RBF surface on {} observations (kernel={}, epsilon={}, smoothing={})",
                n, kernel, eps, smoothing);
        return new FittedSurface(xs, ys, weights.toArray(), kernel, eps, transform);
    }

    /**
     * Estimates the thickness at every node of the grid.
     */
    public ScalarField interpolate(List<Observation> observations, Grid grid) {
        FittedSurface surface = fit(observations);

        double maxObserved = 0.0;
        for (Observation o : observations) {
            maxObserved = Math.max(maxObserved, o.getThicknessCm());
        }
        double ceiling = clipFactor > 0 ? clipFactor * maxObserved : Double.POSITIVE_INFINITY;

        double[] values = new double[grid.size()];
        int undefined = 0;
        for (int row = 0; row < grid.getNy(); row++) {
            double lat = grid.latitudeAt(row);
            for (int col = 0; col < grid.getNx(); col++) {
                double lon = grid.longitudeAt(col);
                double v = surface.estimate(lon, lat);
                if (!Double.isFinite(v) || v <= 0.0) {
                    v = Double.NaN;
                } else if (maxObservationDistance > 0
                        && surface.distanceToNearest(lon, lat) > maxObservationDistance) {
                    v = Double.NaN;
                } else {
                    v = Math.min(v, ceiling);
                }
                if (Double.isNaN(v)) {
                    undefined++;
                }
                values[grid.index(col, row)] = v;
            }
        }

        logger.debug("Interpolated {} nodes, {} undefined", values.length, undefined);
        return new ScalarField(grid, values);
    }

    private static List<Observation> positiveOnly(List<Observation> observations) {
        List<Observation> positive = new ArrayList<>();
        if (observations == null) {
            return positive;
        }
        for (Observation o : observations) {
            if (!o.isDry()) {
                positive.add(o);
            }
        }
        return positive;
    }

    // (product of non-zero bounding box edges / N) ^ (1 / edge count)
    static double averageSpacing(double[] xs, double[] ys) {
        double[] edges = {span(xs), span(ys)};
        double product = 1.0;
        int dims = 0;
        for (double edge : edges) {
            if (edge > 0) {
                product *= edge;
                dims++;
            }
        }
        if (dims == 0) {
            return 1.0;
        }
        return Math.pow(product / xs.length, 1.0 / dims);
    }

    private static double span(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return max - min;
    }

    public static final class Builder {

        private RadialBasisFunction kernel = StandardKernel.MULTIQUADRIC;
        private ValueTransform transform = new Log10Transform(1e-3);
        private double smoothing = 0.0;
        private double epsilon = 0.0;
        private double clipFactor = 1.2;
        private double maxObservationDistance = 0.0;

        private Builder() {
        }

        public Builder kernel(RadialBasisFunction kernel) {
            this.kernel = kernel;
            return this;
        }

        public Builder transform(ValueTransform transform) {
            this.transform = transform;
            return this;
        }

        public Builder smoothing(double smoothing) {
            this.smoothing = smoothing;
            return this;
        }

        /** Kernel shape parameter; 0 selects the average point spacing. */
        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        /** Upper clip as a multiple of the largest observation; 0 disables clipping. */
        public Builder clipFactor(double clipFactor) {
            this.clipFactor = clipFactor;
            return this;
        }

        /** Distance cutoff in degrees; 0 disables it. */
        public Builder maxObservationDistance(double maxObservationDistance) {
            this.maxObservationDistance = maxObservationDistance;
            return this;
        }

        public InterpolationEngine build() {
            if (kernel == null || transform == null) {
                throw new IllegalArgumentException("Kernel and value transform are required");
            }
            if (!Double.isFinite(smoothing) || !Double.isFinite(epsilon) || epsilon < 0
                    || !Double.isFinite(clipFactor) || !Double.isFinite(maxObservationDistance)) {
                throw new IllegalArgumentException("Interpolation parameters must be finite and epsilon >= 0");
            }
            return new InterpolationEngine(this);
        }
    }
}
