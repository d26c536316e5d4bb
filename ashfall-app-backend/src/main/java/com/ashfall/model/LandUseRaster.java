package com.ashfall.model;

/**
 * Single band land-use class grid. Code 0 is nodata. Codes are stored
 * row-major in the row order of the raster's transform.
 */
public final class LandUseRaster {

    private final int width;
    private final int height;
    private final int[] codes;
    private final AffineTransform transform;
    private final String crs;

    public LandUseRaster(int width, int height, int[] codes, AffineTransform transform, String crs) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive");
        }
        if (codes == null || codes.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " raster codes");
        }
        if (transform == null) {
            throw new IllegalArgumentException("Raster transform is required");
        }
        for (int code : codes) {
            if (code < 0) {
                throw new IllegalArgumentException("Land-use codes must be >= 0, got " + code);
            }
        }
        this.width = width;
        this.height = height;
        this.codes = codes.clone();
        this.transform = transform;
        this.crs = crs;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int codeAt(int col, int row) {
        return codes[row * width + col];
    }

    public AffineTransform getTransform() {
        return transform;
    }

    /** Coordinate reference identifier, may be null when the source had none. */
    public String getCrs() {
        return crs;
    }
}
