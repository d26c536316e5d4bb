package com.ashfall.model;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;

public final class AdminBoundary {

    private final String name;
    private final Geometry geometry;

    public AdminBoundary(String name, Geometry geometry) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Boundary name is required");
        }
        if (!(geometry instanceof Polygonal)) {
            throw new IllegalArgumentException("Boundary '" + name + "' must be a polygon or multipolygon");
        }
        this.name = name;
        this.geometry = geometry;
    }

    public String getName() {
        return name;
    }

    public Geometry getGeometry() {
        return geometry;
    }
}
