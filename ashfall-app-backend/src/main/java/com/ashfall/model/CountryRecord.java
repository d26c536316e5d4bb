package com.ashfall.model;

public final class CountryRecord {

    private final String countryName;
    private final double intersectionAreaKm2;
    private final Double percentOfCountry;

    public CountryRecord(String countryName, double intersectionAreaKm2, Double percentOfCountry) {
        this.countryName = countryName;
        this.intersectionAreaKm2 = intersectionAreaKm2;
        this.percentOfCountry = percentOfCountry;
    }

    public String getCountryName() {
        return countryName;
    }

    public double getIntersectionAreaKm2() {
        return intersectionAreaKm2;
    }

    /**
     * Affected share of the country's own area in percent, null when the
     * country area is unknown.
     */
    public Double getPercentOfCountry() {
        return percentOfCountry;
    }

    @Override
    public String toString() {
        return "CountryRecord{" +
                "countryName='" + countryName + '\'' +
                ", intersectionAreaKm2=" + intersectionAreaKm2 +
                ", percentOfCountry=" + percentOfCountry +
                '}';
    }
}
