package com.ashfall.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON body of an analysis request. Everything except the observations is
 * optional; missing values fall back to the configured defaults.
 */
public class AshfallRequest {

    private List<PointInput> observations;
    private BoundsInput bounds;
    private Integer nx;
    private Integer ny;
    private List<Double> thresholds;

    // interpolation overrides
    private String kernel;
    private Double smoothing;

    // taper overrides
    private Double sourceLongitude;
    private Double sourceLatitude;
    private Double southBoost;
    private Double innerRadius;
    private Double outerRadius;

    private Integer minComponentPixels;

    private LandUseInput landUse;
    private List<BoundaryInput> boundaries;

    public AshfallRequest() {
        // Default constructor
    }

    public List<PointInput> getObservations() {
        return observations;
    }

    public void setObservations(List<PointInput> observations) {
        this.observations = observations;
    }

    public BoundsInput getBounds() {
        return bounds;
    }

    public void setBounds(BoundsInput bounds) {
        this.bounds = bounds;
    }

    public Integer getNx() {
        return nx;
    }

    public void setNx(Integer nx) {
        this.nx = nx;
    }

    public Integer getNy() {
        return ny;
    }

    public void setNy(Integer ny) {
        this.ny = ny;
    }

    public List<Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(List<Double> thresholds) {
        this.thresholds = thresholds;
    }

    public String getKernel() {
        return kernel;
    }

    public void setKernel(String kernel) {
        this.kernel = kernel;
    }

    public Double getSmoothing() {
        return smoothing;
    }

    public void setSmoothing(Double smoothing) {
        this.smoothing = smoothing;
    }

    public Double getSourceLongitude() {
        return sourceLongitude;
    }

    public void setSourceLongitude(Double sourceLongitude) {
        this.sourceLongitude = sourceLongitude;
    }

    public Double getSourceLatitude() {
        return sourceLatitude;
    }

    public void setSourceLatitude(Double sourceLatitude) {
        this.sourceLatitude = sourceLatitude;
    }

    public Double getSouthBoost() {
        return southBoost;
    }

    public void setSouthBoost(Double southBoost) {
        this.southBoost = southBoost;
    }

    public Double getInnerRadius() {
        return innerRadius;
    }

    public void setInnerRadius(Double innerRadius) {
        this.innerRadius = innerRadius;
    }

    public Double getOuterRadius() {
        return outerRadius;
    }

    public void setOuterRadius(Double outerRadius) {
        this.outerRadius = outerRadius;
    }

    public Integer getMinComponentPixels() {
        return minComponentPixels;
    }

    public void setMinComponentPixels(Integer minComponentPixels) {
        this.minComponentPixels = minComponentPixels;
    }

    public LandUseInput getLandUse() {
        return landUse;
    }

    public void setLandUse(LandUseInput landUse) {
        this.landUse = landUse;
    }

    public List<BoundaryInput> getBoundaries() {
        return boundaries;
    }

    public void setBoundaries(List<BoundaryInput> boundaries) {
        this.boundaries = boundaries;
    }

    public static class PointInput {
        private Double longitude;
        private Double latitude;
        private Double thicknessCm;

        public PointInput() {
        }

        public Double getLongitude() {
            return longitude;
        }

        public void setLongitude(Double longitude) {
            this.longitude = longitude;
        }

        public Double getLatitude() {
            return latitude;
        }

        public void setLatitude(Double latitude) {
            this.latitude = latitude;
        }

        public Double getThicknessCm() {
            return thicknessCm;
        }

        public void setThicknessCm(Double thicknessCm) {
            this.thicknessCm = thicknessCm;
        }
    }

    public static class BoundsInput {
        private double west;
        private double south;
        private double east;
        private double north;

        public double getWest() {
            return west;
        }

        public void setWest(double west) {
            this.west = west;
        }

        public double getSouth() {
            return south;
        }

        public void setSouth(double south) {
            this.south = south;
        }

        public double getEast() {
            return east;
        }

        public void setEast(double east) {
            this.east = east;
        }

        public double getNorth() {
            return north;
        }

        public void setNorth(double north) {
            this.north = north;
        }
    }

    public static class LandUseInput {
        private int width;
        private int height;
        private String crs;
        private TransformInput transform;
        private int[] codes;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public String getCrs() {
            return crs;
        }

        public void setCrs(String crs) {
            this.crs = crs;
        }

        public TransformInput getTransform() {
            return transform;
        }

        public void setTransform(TransformInput transform) {
            this.transform = transform;
        }

        public int[] getCodes() {
            return codes;
        }

        public void setCodes(int[] codes) {
            this.codes = codes;
        }
    }

    public static class TransformInput {
        private double originX;
        private double pixelWidth;
        private double originY;
        private double pixelHeight;

        public double getOriginX() {
            return originX;
        }

        public void setOriginX(double originX) {
            this.originX = originX;
        }

        public double getPixelWidth() {
            return pixelWidth;
        }

        public void setPixelWidth(double pixelWidth) {
            this.pixelWidth = pixelWidth;
        }

        public double getOriginY() {
            return originY;
        }

        public void setOriginY(double originY) {
            this.originY = originY;
        }

        public double getPixelHeight() {
            return pixelHeight;
        }

        public void setPixelHeight(double pixelHeight) {
            this.pixelHeight = pixelHeight;
        }
    }

    public static class BoundaryInput {
        private String name;
        // GeoJSON geometry object
        private JsonNode geometry;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public JsonNode getGeometry() {
            return geometry;
        }

        public void setGeometry(JsonNode geometry) {
            this.geometry = geometry;
        }
    }
}
