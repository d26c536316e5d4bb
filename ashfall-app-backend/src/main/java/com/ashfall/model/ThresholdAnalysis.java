package com.ashfall.model;

import java.util.List;

/**
 * Region and statistics for one thickness threshold. The region is null when
 * nothing of the field exceeds the threshold.
 */
public final class ThresholdAnalysis {

    private final double thresholdCm;
    private final int maskPixelCount;
    private final RegionGeometry region;
    private final List<ZonalRecord> zonalRecords;
    private final List<CountryRecord> countryRecords;

    public ThresholdAnalysis(double thresholdCm, int maskPixelCount, RegionGeometry region,
                             List<ZonalRecord> zonalRecords, List<CountryRecord> countryRecords) {
        this.thresholdCm = thresholdCm;
        this.maskPixelCount = maskPixelCount;
        this.region = region;
        this.zonalRecords = List.copyOf(zonalRecords);
        this.countryRecords = List.copyOf(countryRecords);
    }

    public static ThresholdAnalysis empty(double thresholdCm) {
        return new ThresholdAnalysis(thresholdCm, 0, null, List.of(), List.of());
    }

    public double getThresholdCm() {
        return thresholdCm;
    }

    public int getMaskPixelCount() {
        return maskPixelCount;
    }

    public boolean isRegionFound() {
        return region != null;
    }

    public RegionGeometry getRegion() {
        return region;
    }

    public List<ZonalRecord> getZonalRecords() {
        return zonalRecords;
    }

    public List<CountryRecord> getCountryRecords() {
        return countryRecords;
    }
}
