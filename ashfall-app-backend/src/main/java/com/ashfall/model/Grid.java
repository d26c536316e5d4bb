package com.ashfall.model;

import java.util.List;

/**
 * Regular lattice over a geographic bounding box. Nodes sit on an inclusive
 * linspace of each axis: column 0 is the west edge, row 0 the south edge.
 * Values aligned to a grid are stored row-major, {@code index = row * nx + col}.
 */
public final class Grid {

    private final double west;
    private final double south;
    private final double east;
    private final double north;
    private final int nx;
    private final int ny;

    public Grid(double west, double south, double east, double north, int nx, int ny) {
        if (nx < 2 || ny < 2) {
            throw new IllegalArgumentException("Grid needs at least 2 nodes per axis, got " + nx + "x" + ny);
        }
        if (!(east > west) || !(north > south)) {
            throw new IllegalArgumentException("Grid bounds are degenerate: " + west + "," + south + "," + east + "," + north);
        }
        this.west = west;
        this.south = south;
        this.east = east;
        this.north = north;
        this.nx = nx;
        this.ny = ny;
    }

    /**
     * Grid over the extent of the observations, padded on every side by
     * {@code padFraction} times the extent along that axis. An axis without
     * extent is padded by one degree.
     */
    public static Grid around(List<Observation> observations, double padFraction, int nx, int ny) {
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a grid from an empty observation set");
        }
        double lonMin = Double.POSITIVE_INFINITY;
        double lonMax = Double.NEGATIVE_INFINITY;
        double latMin = Double.POSITIVE_INFINITY;
        double latMax = Double.NEGATIVE_INFINITY;
        for (Observation o : observations) {
            lonMin = Math.min(lonMin, o.getLongitude());
            lonMax = Math.max(lonMax, o.getLongitude());
            latMin = Math.min(latMin, o.getLatitude());
            latMax = Math.max(latMax, o.getLatitude());
        }
        double lonPad = lonMax > lonMin ? padFraction * (lonMax - lonMin) : 1.0;
        double latPad = latMax > latMin ? padFraction * (latMax - latMin) : 1.0;
        return new Grid(lonMin - lonPad, latMin - latPad, lonMax + lonPad, latMax + latPad, nx, ny);
    }

    public double longitudeAt(int col) {
        return west + col * getCellWidth();
    }

    public double latitudeAt(int row) {
        return south + row * getCellHeight();
    }

    public double getCellWidth() {
        return (east - west) / (nx - 1);
    }

    public double getCellHeight() {
        return (north - south) / (ny - 1);
    }

    public int index(int col, int row) {
        return row * nx + col;
    }

    public int size() {
        return nx * ny;
    }

    /**
     * Transform of the pixel cells of this grid, each node being the centre of its cell.
     */
    public AffineTransform getTransform() {
        double cw = getCellWidth();
        double ch = getCellHeight();
        return new AffineTransform(west - cw / 2, cw, south - ch / 2, ch);
    }

    public double getWest() {
        return west;
    }

    public double getSouth() {
        return south;
    }

    public double getEast() {
        return east;
    }

    public double getNorth() {
        return north;
    }

    public int getNx() {
        return nx;
    }

    public int getNy() {
        return ny;
    }

    @Override
    public String toString() {
        return "Grid{" +
                "west=" + west +
                ", south=" + south +
                ", east=" + east +
                ", north=" + north +
                ", nx=" + nx +
                ", ny=" + ny +
                '}';
    }
}
