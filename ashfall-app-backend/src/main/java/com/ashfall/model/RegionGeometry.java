package com.ashfall.model;

import org.locationtech.jts.geom.Geometry;

/**
 * The dissolved affected region: one valid (multi)polygon in geographic
 * coordinates. The area is always measured in the equal-area reference.
 * The geometry is copied on the way in and out, so the stored area always
 * matches it.
 */
public final class RegionGeometry {

    private final Geometry geometry;
    private final String crs;
    private final int componentCount;
    private final double areaKm2;

    public RegionGeometry(Geometry geometry, String crs, int componentCount, double areaKm2) {
        if (geometry == null) {
            throw new IllegalArgumentException("Region geometry is required");
        }
        this.geometry = geometry.copy();
        this.crs = crs;
        this.componentCount = componentCount;
        this.areaKm2 = areaKm2;
    }

    public Geometry getGeometry() {
        return geometry.copy();
    }

    public String getCrs() {
        return crs;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public double getAreaKm2() {
        return areaKm2;
    }
}
