package com.ashfall.model;

/**
 * Maps pixel corner indices (col, row) to coordinates:
 * {@code x = originX + col * pixelWidth}, {@code y = originY + row * pixelHeight}.
 * North-up rasters have a negative pixel height.
 */
public final class AffineTransform {

    private final double originX;
    private final double pixelWidth;
    private final double originY;
    private final double pixelHeight;

    public AffineTransform(double originX, double pixelWidth, double originY, double pixelHeight) {
        if (pixelWidth == 0 || pixelHeight == 0 || !Double.isFinite(pixelWidth) || !Double.isFinite(pixelHeight)) {
            throw new IllegalArgumentException("Pixel size must be finite and non-zero");
        }
        this.originX = originX;
        this.pixelWidth = pixelWidth;
        this.originY = originY;
        this.pixelHeight = pixelHeight;
    }

    /**
     * North-up transform for a raster of {@code width x height} pixels covering the given bounds.
     */
    public static AffineTransform fromBounds(double west, double south, double east, double north,
                                             int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive");
        }
        return new AffineTransform(west, (east - west) / width, north, -(north - south) / height);
    }

    public double x(double col) {
        return originX + col * pixelWidth;
    }

    public double y(double row) {
        return originY + row * pixelHeight;
    }

    public double centerX(int col) {
        return x(col + 0.5);
    }

    public double centerY(int row) {
        return y(row + 0.5);
    }

    /** Fractional column of a coordinate. */
    public double columnOf(double x) {
        return (x - originX) / pixelWidth;
    }

    /** Fractional row of a coordinate. */
    public double rowOf(double y) {
        return (y - originY) / pixelHeight;
    }

    public double getOriginX() {
        return originX;
    }

    public double getPixelWidth() {
        return pixelWidth;
    }

    public double getOriginY() {
        return originY;
    }

    public double getPixelHeight() {
        return pixelHeight;
    }

    @Override
    public String toString() {
        return "AffineTransform{" +
                "originX=" + originX +
                ", pixelWidth=" + pixelWidth +
                ", originY=" + originY +
                ", pixelHeight=" + pixelHeight +
                '}';
    }
}
