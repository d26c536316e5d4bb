package com.ashfall.service.model.impl;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Projects WGS84 longitude/latitude geometries into an equal-area reference
 * so that planar area is true surface area. Areas are never computed in
 * degrees.
 * <p>
 * Not thread-safe: proj4j transforms keep scratch state. Use one instance per
 * pipeline run.
 */
public final class EqualAreaProjector {

    public static final String WGS84_DEFINITION = "+proj=longlat +datum=WGS84 +no_defs";
    public static final String EASE_GRID_2_NAME = "EPSG:6933";
    public static final String EASE_GRID_2_DEFINITION =
            "+proj=cea +lat_ts=30 +lon_0=0 +x_0=0 +y_0=0 +datum=WGS84 +units=m +no_defs";

    private final String name;
    private final CoordinateTransform toEqualArea;
    private final ProjCoordinate in = new ProjCoordinate();
    private final ProjCoordinate out = new ProjCoordinate();

    public EqualAreaProjector(String name, String definition) {
        CRSFactory crsFactory = new CRSFactory();
        CoordinateReferenceSystem wgs84 = crsFactory.createFromParameters("EPSG:4326", WGS84_DEFINITION);
        CoordinateReferenceSystem target;
        try {
            target = crsFactory.createFromParameters(name, definition);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid equal-area projection '" + definition + "'", e);
        }
        this.name = name;
        this.toEqualArea = new CoordinateTransformFactory().createTransform(wgs84, target);
    }

    /** EASE-Grid 2.0 global cylindrical equal-area. */
    public static EqualAreaProjector easeGrid2() {
        return new EqualAreaProjector(EASE_GRID_2_NAME, EASE_GRID_2_DEFINITION);
    }

    /** A projected copy of the geometry; the input is untouched. */
    public Geometry project(Geometry geometry) {
        Geometry copy = geometry.copy();
        copy.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter(CoordinateSequence seq, int i) {
                in.x = seq.getX(i);
                in.y = seq.getY(i);
                toEqualArea.transform(in, out);
                seq.setOrdinate(i, 0, out.x);
                seq.setOrdinate(i, 1, out.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        copy.geometryChanged();
        return copy;
    }

    public double areaKm2(Geometry geometry) {
        if (geometry.isEmpty()) {
            return 0.0;
        }
        return project(geometry).getArea() / 1e6;
    }

    /** Area of a longitude/latitude box, in km². */
    public double areaKm2(Envelope envelope, GeometryFactory factory) {
        return areaKm2(factory.toGeometry(envelope));
    }

    public String getName() {
        return name;
    }
}
