package com.ashfall.service.model.impl;

import com.ashfall.exception.InvalidGeometryException;
import com.ashfall.model.AffineTransform;
import com.ashfall.model.BinaryMask;
import com.ashfall.model.RegionGeometry;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Traces the foreground of a mask into polygons and dissolves them into one
 * region geometry. Each 4-connected component is built from its row runs of
 * pixel cells, so polygon edges follow pixel boundaries exactly.
 */
public final class Polygonizer {

    private static final Logger logger = LoggerFactory.getLogger(Polygonizer.class);

    private final GeometryFactory geometryFactory;
    private final EqualAreaProjector projector;
    private final String crs;

    public Polygonizer(GeometryFactory geometryFactory, EqualAreaProjector projector, String crs) {
        this.geometryFactory = geometryFactory;
        this.projector = projector;
        this.crs = crs;
    }

    public RegionGeometry polygonize(BinaryMask mask, AffineTransform transform) {
        if (mask.isEmpty()) {
            throw new InvalidGeometryException("Mask has no foreground pixels, no region to polygonize");
        }
        int width = mask.getWidth();
        int height = mask.getHeight();
        boolean[] bits = mask.toArray();
        int[] labels = new int[bits.length];
        int components = BinaryMorphology.label(bits, width, height, labels);

        List<List<Geometry>> runsByComponent = new ArrayList<>(components);
        for (int c = 0; c < components; c++) {
            runsByComponent.add(new ArrayList<>());
        }
        for (int row = 0; row < height; row++) {
            int col = 0;
            while (col < width) {
                int label = labels[row * width + col];
                if (label == 0) {
                    col++;
                    continue;
                }
                int start = col;
                while (col < width && labels[row * width + col] == label) {
                    col++;
                }
                runsByComponent.get(label - 1).add(cellRun(transform, row, start, col));
            }
        }

        List<Geometry> parts = new ArrayList<>(components);
        for (List<Geometry> runs : runsByComponent) {
            parts.add(UnaryUnionOp.union(runs));
        }
        Geometry dissolved = UnaryUnionOp.union(parts);

        if (dissolved == null || dissolved.isEmpty()) {
            throw new InvalidGeometryException("Dissolved region is empty");
        }
        if (!(dissolved instanceof Polygonal) || !dissolved.isValid()) {
            throw new InvalidGeometryException("Dissolved region is not a valid polygonal geometry: "
                    + dissolved.getGeometryType());
        }

        double areaKm2 = projector.areaKm2(dissolved);
        logger.debug("Polygonized {} pixels in {} component(s), {} km2", mask.count(), components, areaKm2);
        return new RegionGeometry(dissolved, crs, components, areaKm2);
    }

    // cells [startCol, endCol) of one row
    private Geometry cellRun(AffineTransform transform, int row, int startCol, int endCol) {
        Envelope env = new Envelope(
                transform.x(startCol), transform.x(endCol),
                transform.y(row), transform.y(row + 1));
        return geometryFactory.toGeometry(env);
    }
}
