package com.ashfall.service.model.impl;

import com.ashfall.exception.InvalidRasterException;
import com.ashfall.model.AdminBoundary;
import com.ashfall.model.AffineTransform;
import com.ashfall.model.BinaryMask;
import com.ashfall.model.CountryRecord;
import com.ashfall.model.LandUseRaster;
import com.ashfall.model.RegionGeometry;
import com.ashfall.model.ZonalRecord;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Overlays a region with a land-use raster and administrative boundaries.
 */
public final class ZonalStatistics {

    public static final String UNKNOWN_CLASS = "Unknown";

    private static final Logger logger = LoggerFactory.getLogger(ZonalStatistics.class);

    private final GeometryFactory geometryFactory;
    private final EqualAreaProjector projector;
    private final String workingCrs;

    public ZonalStatistics(GeometryFactory geometryFactory, EqualAreaProjector projector, String workingCrs) {
        this.geometryFactory = geometryFactory;
        this.projector = projector;
        this.workingCrs = workingCrs;
    }

    /**
     * Region mask at the raster's own resolution: a pixel is inside when its
     * centre lies inside the region or on its boundary.
     */
    public BinaryMask rasterize(RegionGeometry region, LandUseRaster raster) {
        validate(raster);
        int width = raster.getWidth();
        int height = raster.getHeight();
        AffineTransform t = raster.getTransform();
        boolean[] inside = new boolean[width * height];

        Geometry regionGeometry = region.getGeometry();
        Envelope env = regionGeometry.getEnvelopeInternal();
        double c0 = t.columnOf(env.getMinX());
        double c1 = t.columnOf(env.getMaxX());
        double r0 = t.rowOf(env.getMinY());
        double r1 = t.rowOf(env.getMaxY());
        int colMin = Math.max(0, (int) Math.floor(Math.min(c0, c1)));
        int colMax = Math.min(width - 1, (int) Math.ceil(Math.max(c0, c1)));
        int rowMin = Math.max(0, (int) Math.floor(Math.min(r0, r1)));
        int rowMax = Math.min(height - 1, (int) Math.ceil(Math.max(r0, r1)));

        IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(regionGeometry);
        Coordinate p = new Coordinate();
        for (int row = rowMin; row <= rowMax; row++) {
            p.y = t.centerY(row);
            for (int col = colMin; col <= colMax; col++) {
                p.x = t.centerX(col);
                if (locator.locate(p) != Location.EXTERIOR) {
                    inside[row * width + col] = true;
                }
            }
        }
        return new BinaryMask(width, height, inside);
    }

    /**
     * One record per land-use class with pixels inside the region, ordered by
     * class code. Shares are percentages of the region's classified pixels and
     * of the class's pixels in the whole raster.
     */
    public List<ZonalRecord> landUseBreakdown(RegionGeometry region, LandUseRaster raster,
                                              Map<Integer, String> classNames) {
        BinaryMask inside = rasterize(region, raster);
        int width = raster.getWidth();
        int height = raster.getHeight();
        // codes are sparse
        Map<Integer, ClassTally> tallies = new TreeMap<>();
        long totalInside = 0;

        for (int row = 0; row < height; row++) {
            double cellArea = Double.NaN;
            for (int col = 0; col < width; col++) {
                int code = raster.codeAt(col, row);
                if (code == 0) {
                    continue;
                }
                ClassTally tally = tallies.computeIfAbsent(code, k -> new ClassTally());
                tally.total++;
                if (inside.get(col, row)) {
                    if (Double.isNaN(cellArea)) {
                        cellArea = cellAreaKm2(raster.getTransform(), row);
                    }
                    tally.inside++;
                    tally.areaKm2 += cellArea;
                    totalInside++;
                }
            }
        }

        List<ZonalRecord> records = new ArrayList<>();
        for (Map.Entry<Integer, ClassTally> e : tallies.entrySet()) {
            int code = e.getKey();
            ClassTally tally = e.getValue();
            if (tally.inside == 0) {
                continue;
            }
            String name = classNames == null ? UNKNOWN_CLASS : classNames.getOrDefault(code, UNKNOWN_CLASS);
            records.add(new ZonalRecord(code, name, tally.inside, tally.total,
                    tally.inside * 100.0 / totalInside,
                    tally.inside * 100.0 / tally.total,
                    tally.areaKm2));
        }
        logger.debug("Land-use overlay: {} classified pixels inside region, {} classes", totalInside, records.size());
        return records;
    }

    /**
     * Intersection area per country, largest first. Boundaries sharing a name
     * are summed; the country share uses the summed area of those boundaries.
     */
    public List<CountryRecord> countryOverlap(RegionGeometry region, List<AdminBoundary> boundaries) {
        Map<String, double[]> byCountry = new LinkedHashMap<>();
        Geometry regionGeometry = region.getGeometry();
        Envelope regionEnvelope = regionGeometry.getEnvelopeInternal();
        if (boundaries == null) {
            return List.of();
        }
        for (AdminBoundary boundary : boundaries) {
            Geometry shape = boundary.getGeometry();
            if (!shape.isValid()) {
                shape = GeometryFixer.fix(shape);
            }
            double[] acc = byCountry.computeIfAbsent(boundary.getName(), k -> new double[2]);
            acc[1] += projector.areaKm2(shape);
            if (!regionEnvelope.intersects(shape.getEnvelopeInternal())) {
                continue;
            }
            Geometry intersection = regionGeometry.intersection(shape);
            if (!intersection.isEmpty()) {
                acc[0] += projector.areaKm2(intersection);
            }
        }

        List<CountryRecord> records = new ArrayList<>();
        for (Map.Entry<String, double[]> e : byCountry.entrySet()) {
            double area = e.getValue()[0];
            double total = e.getValue()[1];
            if (area <= 0) {
                continue;
            }
            Double percent = total > 0 ? area / total * 100.0 : null;
            records.add(new CountryRecord(e.getKey(), area, percent));
        }
        records.sort(Comparator.comparingDouble(CountryRecord::getIntersectionAreaKm2).reversed());
        return records;
    }

    private void validate(LandUseRaster raster) {
        String crs = raster.getCrs();
        if (crs == null || crs.isBlank()) {
            throw new InvalidRasterException("Land-use raster has no coordinate reference");
        }
        if (!crs.trim().equalsIgnoreCase(workingCrs)) {
            throw new InvalidRasterException("Land-use raster is in " + crs + ", expected " + workingCrs
                    + "; reproject it before the analysis");
        }
    }

    // equal-area cell area depends only on the row for a lon/lat raster
    private double cellAreaKm2(AffineTransform t, int row) {
        Envelope cell = new Envelope(t.x(0), t.x(1), t.y(row), t.y(row + 1));
        return projector.areaKm2(cell, geometryFactory);
    }

    private static final class ClassTally {
        long total;
        long inside;
        double areaKm2;
    }
}
