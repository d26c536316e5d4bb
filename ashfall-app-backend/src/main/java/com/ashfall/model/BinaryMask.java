package com.ashfall.model;

import java.util.Arrays;

/**
 * Immutable boolean lattice, stored row-major like {@link ScalarField}.
 */
public final class BinaryMask {

    private final int width;
    private final int height;
    private final boolean[] bits;

    public BinaryMask(int width, int height, boolean[] bits) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Mask dimensions must be positive");
        }
        if (bits == null || bits.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " mask cells");
        }
        this.width = width;
        this.height = height;
        this.bits = bits.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean get(int col, int row) {
        return bits[row * width + col];
    }

    public boolean[] toArray() {
        return bits.clone();
    }

    public int count() {
        int n = 0;
        for (boolean b : bits) {
            if (b) {
                n++;
            }
        }
        return n;
    }

    public boolean isEmpty() {
        for (boolean b : bits) {
            if (b) {
                return false;
            }
        }
        return true;
    }

    /** True when every set cell of this mask is also set in {@code other}. */
    public boolean isSubsetOf(BinaryMask other) {
        if (other.width != width || other.height != height) {
            throw new IllegalArgumentException("Masks have different shapes");
        }
        for (int i = 0; i < bits.length; i++) {
            if (bits[i] && !other.bits[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinaryMask that = (BinaryMask) o;
        return width == that.width && height == that.height && Arrays.equals(bits, that.bits);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "BinaryMask{" + width + "x" + height + ", set=" + count() + '}';
    }
}
