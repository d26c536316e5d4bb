package com.ashfall.model;

import java.util.List;

/**
 * Represents the result of an ashfall analysis, including one region
 * geometry and its statistics tables per thickness threshold.
 */
public class AshfallResult {

    private double west;
    private double south;
    private double east;
    private double north;
    private int nx;
    private int ny;

    private int observationsUsed;
    private int drySites;

    /**
     * Maximum of the tapered thickness field, in cm.
     */
    private double fieldMaximumCm;

    private List<ThresholdResult> thresholds;

    public AshfallResult() {
        // Default constructor
    }

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

    public int getObservationsUsed() {
        return observationsUsed;
    }

    public void setObservationsUsed(int observationsUsed) {
        this.observationsUsed = observationsUsed;
    }

    public int getDrySites() {
        return drySites;
    }

    public void setDrySites(int drySites) {
        this.drySites = drySites;
    }

    public double getFieldMaximumCm() {
        return fieldMaximumCm;
    }

    public void setFieldMaximumCm(double fieldMaximumCm) {
        this.fieldMaximumCm = fieldMaximumCm;
    }

    public List<ThresholdResult> getThresholds() {
        return thresholds;
    }

    public void setThresholds(List<ThresholdResult> thresholds) {
        this.thresholds = thresholds;
    }

    public static class ThresholdResult {

        private double thresholdCm;
        private boolean regionFound;

        /**
         * GeoJSON string of the dissolved region, null when no region was found.
         */
        private String geoJsonRegion;

        private double areaKm2;
        private int componentCount;
        private List<ZonalRecord> landUse;
        private List<CountryRecord> countries;

        public double getThresholdCm() {
            return thresholdCm;
        }

        public void setThresholdCm(double thresholdCm) {
            this.thresholdCm = thresholdCm;
        }

        public boolean isRegionFound() {
            return regionFound;
        }

        public void setRegionFound(boolean regionFound) {
            this.regionFound = regionFound;
        }

        public String getGeoJsonRegion() {
            return geoJsonRegion;
        }

        public void setGeoJsonRegion(String geoJsonRegion) {
            this.geoJsonRegion = geoJsonRegion;
        }

        public double getAreaKm2() {
            return areaKm2;
        }

        public void setAreaKm2(double areaKm2) {
            this.areaKm2 = areaKm2;
        }

        public int getComponentCount() {
            return componentCount;
        }

        public void setComponentCount(int componentCount) {
            this.componentCount = componentCount;
        }

        public List<ZonalRecord> getLandUse() {
            return landUse;
        }

        public void setLandUse(List<ZonalRecord> landUse) {
            this.landUse = landUse;
        }

        public List<CountryRecord> getCountries() {
            return countries;
        }

        public void setCountries(List<CountryRecord> countries) {
            this.countries = countries;
        }
    }

    @Override
    public String toString() {
        return "AshfallResult{" +
                "nx=" + nx +
                ", ny=" + ny +
                ", observationsUsed=" + observationsUsed +
                ", drySites=" + drySites +
                ", fieldMaximumCm=" + fieldMaximumCm +
                ", thresholds=" + (thresholds == null ? 0 : thresholds.size()) +
                '}';
    }
}
