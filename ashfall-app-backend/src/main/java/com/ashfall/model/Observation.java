package com.ashfall.model;

/**
 * A single ash thickness measurement. A thickness of zero marks a dry site.
 */
public final class Observation {

    private final double longitude;
    private final double latitude;
    private final double thicknessCm;

    public Observation(double longitude, double latitude, double thicknessCm) {
        if (!Double.isFinite(longitude) || !Double.isFinite(latitude)) {
            throw new IllegalArgumentException("Observation coordinates must be finite");
        }
        if (!Double.isFinite(thicknessCm) || thicknessCm < 0) {
            throw new IllegalArgumentException("Ash thickness must be a finite value >= 0, got " + thicknessCm);
        }
        this.longitude = longitude;
        this.latitude = latitude;
        this.thicknessCm = thicknessCm;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getThicknessCm() {
        return thicknessCm;
    }

    public boolean isDry() {
        return thicknessCm == 0.0;
    }

    @Override
    public String toString() {
        return "Observation{" +
                "longitude=" + longitude +
                ", latitude=" + latitude +
                ", thicknessCm=" + thicknessCm +
                '}';
    }
}
