package com.ashfall.model;

import java.util.Arrays;

/**
 * Immutable values aligned to a {@link Grid}. NaN marks an undefined node.
 */
public class ScalarField {

    private final Grid grid;
    private final double[] values;

    public ScalarField(Grid grid, double[] values) {
        if (grid == null || values == null) {
            throw new IllegalArgumentException("Grid and values are required");
        }
        if (values.length != grid.size()) {
            throw new IllegalArgumentException("Expected " + grid.size() + " values, got " + values.length);
        }
        this.grid = grid;
        this.values = values.clone();
    }

    public Grid getGrid() {
        return grid;
    }

    public double get(int col, int row) {
        return values[grid.index(col, row)];
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    /** Largest finite value, NaN when there is none. */
    public double max() {
        double max = Double.NaN;
        for (double v : values) {
            if (Double.isFinite(v) && (Double.isNaN(max) || v > max)) {
                max = v;
            }
        }
        return max;
    }

    public int countFinite() {
        int n = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                n++;
            }
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScalarField that = (ScalarField) o;
        return grid == that.grid && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
