package com.ashfall.model;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import static org.junit.jupiter.api.Assertions.*;

public class RegionGeometryTest {

    private final GeometryFactory factory = new GeometryFactory();

    @Test
    void storedGeometryCannotBeChangedFromOutside() {
        Geometry box = factory.toGeometry(new Envelope(0, 2, 0, 1));
        RegionGeometry region = new RegionGeometry(box, "EPSG:4326", 1, 24000.0);

        box.getCoordinates()[2].x = 50;
        box.geometryChanged();
        Geometry handedOut = region.getGeometry();
        handedOut.getCoordinates()[2].x = 70;
        handedOut.geometryChanged();

        assertEquals(new Envelope(0, 2, 0, 1), region.getGeometry().getEnvelopeInternal());
        assertEquals(2.0, region.getGeometry().getArea(), 1e-12);
    }

    @Test
    void geometryIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new RegionGeometry(null, "EPSG:4326", 0, 0));
    }
}
