package com.ashfall.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.springframework.stereotype.Component;

/**
 * GeoJSON reading and writing of WGS84 geometries.
 */
@Component
public class GeoJsonConverter {

    private final GeometryFactory geometryFactory =
            new GeometryFactory(new PrecisionModel(), AshfallPipeline.WGS84_SRID);

    public String write(Geometry geometry) {
        GeoJsonWriter writer = new GeoJsonWriter();
        return writer.write(geometry);
    }

    public Geometry read(JsonNode geometry) {
        if (geometry == null || geometry.isNull()) {
            throw new IllegalArgumentException("GeoJSON geometry is missing");
        }
        return read(geometry.toString());
    }

    public Geometry read(String geoJson) {
        try {
            return new GeoJsonReader(geometryFactory).read(geoJson);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid GeoJSON geometry: " + e.getMessage(), e);
        }
    }
}
