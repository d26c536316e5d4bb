package com.ashfall.config;

import com.ashfall.service.model.impl.EqualAreaProjector;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline parameters bound from {@code ashfall.*}. Defaults reproduce the
 * Tambora 1815 analysis.
 */
@ConfigurationProperties(prefix = "ashfall")
public class AshfallProperties {

    private GridProperties grid = new GridProperties();
    private InterpolationProperties interpolation = new InterpolationProperties();
    private TaperProperties taper = new TaperProperties();
    private MaskProperties mask = new MaskProperties();
    private ProjectionProperties projection = new ProjectionProperties();

    /**
     * Deep copy, so request overrides never leak into the shared configuration.
     */
    public AshfallProperties copy() {
        AshfallProperties c = new AshfallProperties();
        c.grid.nx = grid.nx;
        c.grid.ny = grid.ny;
        c.grid.padFraction = grid.padFraction;
        c.interpolation.kernel = interpolation.kernel;
        c.interpolation.transform = interpolation.transform;
        c.interpolation.smoothing = interpolation.smoothing;
        c.interpolation.epsilon = interpolation.epsilon;
        c.interpolation.logOffset = interpolation.logOffset;
        c.interpolation.clipFactor = interpolation.clipFactor;
        c.interpolation.maxObservationDistance = interpolation.maxObservationDistance;
        c.taper.sourceLongitude = taper.sourceLongitude;
        c.taper.sourceLatitude = taper.sourceLatitude;
        c.taper.southBoost = taper.southBoost;
        c.taper.innerRadius = taper.innerRadius;
        c.taper.outerRadius = taper.outerRadius;
        c.mask.thresholds = new ArrayList<>(mask.thresholds);
        c.mask.closingIterations = mask.closingIterations;
        c.mask.openingIterations = mask.openingIterations;
        c.mask.minComponentPixels = mask.minComponentPixels;
        c.mask.maxCleanupPasses = mask.maxCleanupPasses;
        c.projection.workingCrs = projection.workingCrs;
        c.projection.equalAreaCrs = projection.equalAreaCrs;
        c.projection.equalAreaDefinition = projection.equalAreaDefinition;
        return c;
    }

    public GridProperties getGrid() {
        return grid;
    }

    public void setGrid(GridProperties grid) {
        this.grid = grid;
    }

    public InterpolationProperties getInterpolation() {
        return interpolation;
    }

    public void setInterpolation(InterpolationProperties interpolation) {
        this.interpolation = interpolation;
    }

    public TaperProperties getTaper() {
        return taper;
    }

    public void setTaper(TaperProperties taper) {
        this.taper = taper;
    }

    public MaskProperties getMask() {
        return mask;
    }

    public void setMask(MaskProperties mask) {
        this.mask = mask;
    }

    public ProjectionProperties getProjection() {
        return projection;
    }

    public void setProjection(ProjectionProperties projection) {
        this.projection = projection;
    }

    public static class GridProperties {
        private int nx = 600;
        private int ny = 600;
        // padding on each side, as a fraction of the observation extent
        private double padFraction = 0.9;

        public int getNx() {
            return nx;
        }

        public void setNx(int nx) {
            this.nx = nx;
        }

        public int getNy() {
            return ny;
        }

        public void setNy(int ny) {
            this.ny = ny;
        }

        public double getPadFraction() {
            return padFraction;
        }

        public void setPadFraction(double padFraction) {
            this.padFraction = padFraction;
        }
    }

    public static class InterpolationProperties {
        private String kernel = "MULTIQUADRIC";
        // LOG10 or IDENTITY
        private String transform = "LOG10";
        private double smoothing = 0.005;
        // 0 = average spacing of the observations
        private double epsilon = 0.0;
        private double logOffset = 1e-3;
        private double clipFactor = 1.2;
        private double maxObservationDistance = 0.0;

        public String getKernel() {
            return kernel;
        }

        public void setKernel(String kernel) {
            this.kernel = kernel;
        }

        public String getTransform() {
            return transform;
        }

        public void setTransform(String transform) {
            this.transform = transform;
        }

        public double getSmoothing() {
            return smoothing;
        }

        public void setSmoothing(double smoothing) {
            this.smoothing = smoothing;
        }

        public double getEpsilon() {
            return epsilon;
        }

        public void setEpsilon(double epsilon) {
            this.epsilon = epsilon;
        }

        public double getLogOffset() {
            return logOffset;
        }

        public void setLogOffset(double logOffset) {
            this.logOffset = logOffset;
        }

        public double getClipFactor() {
            return clipFactor;
        }

        public void setClipFactor(double clipFactor) {
            this.clipFactor = clipFactor;
        }

        public double getMaxObservationDistance() {
            return maxObservationDistance;
        }

        public void setMaxObservationDistance(double maxObservationDistance) {
            this.maxObservationDistance = maxObservationDistance;
        }
    }

    public static class TaperProperties {
        private double sourceLongitude = 118.0;
        private double sourceLatitude = -8.25;
        private double southBoost = 2.0;
        private double innerRadius = 3.5;
        private double outerRadius = 20.0;

        public double getSourceLongitude() {
            return sourceLongitude;
        }

        public void setSourceLongitude(double sourceLongitude) {
            this.sourceLongitude = sourceLongitude;
        }

        public double getSourceLatitude() {
            return sourceLatitude;
        }

        public void setSourceLatitude(double sourceLatitude) {
            this.sourceLatitude = sourceLatitude;
        }

        public double getSouthBoost() {
            return southBoost;
        }

        public void setSouthBoost(double southBoost) {
            this.southBoost = southBoost;
        }

        public double getInnerRadius() {
            return innerRadius;
        }

        public void setInnerRadius(double innerRadius) {
            this.innerRadius = innerRadius;
        }

        public double getOuterRadius() {
            return outerRadius;
        }

        public void setOuterRadius(double outerRadius) {
            this.outerRadius = outerRadius;
        }
    }

    public static class MaskProperties {
        private List<Double> thresholds = new ArrayList<>(List.of(0.1, 1.0, 10.0, 100.0));
        private int closingIterations = 2;
        private int openingIterations = 1;
        private int minComponentPixels = 500;
        private int maxCleanupPasses = 8;

        public List<Double> getThresholds() {
            return thresholds;
        }

        public void setThresholds(List<Double> thresholds) {
            this.thresholds = thresholds;
        }

        public int getClosingIterations() {
            return closingIterations;
        }

        public void setClosingIterations(int closingIterations) {
            this.closingIterations = closingIterations;
        }

        public int getOpeningIterations() {
            return openingIterations;
        }

        public void setOpeningIterations(int openingIterations) {
            this.openingIterations = openingIterations;
        }

        public int getMinComponentPixels() {
            return minComponentPixels;
        }

        public void setMinComponentPixels(int minComponentPixels) {
            this.minComponentPixels = minComponentPixels;
        }

        public int getMaxCleanupPasses() {
            return maxCleanupPasses;
        }

        public void setMaxCleanupPasses(int maxCleanupPasses) {
            this.maxCleanupPasses = maxCleanupPasses;
        }
    }

    public static class ProjectionProperties {
        private String workingCrs = "EPSG:4326";
        private String equalAreaCrs = EqualAreaProjector.EASE_GRID_2_NAME;
        private String equalAreaDefinition = EqualAreaProjector.EASE_GRID_2_DEFINITION;

        public String getWorkingCrs() {
            return workingCrs;
        }

        public void setWorkingCrs(String workingCrs) {
            this.workingCrs = workingCrs;
        }

        public String getEqualAreaCrs() {
            return equalAreaCrs;
        }

        public void setEqualAreaCrs(String equalAreaCrs) {
            this.equalAreaCrs = equalAreaCrs;
        }

        public String getEqualAreaDefinition() {
            return equalAreaDefinition;
        }

        public void setEqualAreaDefinition(String equalAreaDefinition) {
            this.equalAreaDefinition = equalAreaDefinition;
        }
    }
}
