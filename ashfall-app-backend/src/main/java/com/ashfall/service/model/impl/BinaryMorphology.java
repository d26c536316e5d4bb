package com.ashfall.service.model.impl;

/**
 * Binary raster operators on row-major {@code boolean[]} lattices. All use
 * 4-connectivity and the cross structuring element; everything outside the
 * lattice counts as background. None of them modifies its input.
 */
final class BinaryMorphology {

    private BinaryMorphology() {
    }

    /** Background cells that cannot reach the lattice border become foreground. */
    static boolean[] fillHoles(boolean[] bits, int width, int height) {
        boolean[] outside = new boolean[bits.length];
        int[] queue = new int[bits.length];
        int head = 0;
        int tail = 0;
        for (int col = 0; col < width; col++) {
            tail = seed(bits, outside, queue, tail, col);
            tail = seed(bits, outside, queue, tail, (height - 1) * width + col);
        }
        for (int row = 0; row < height; row++) {
            tail = seed(bits, outside, queue, tail, row * width);
            tail = seed(bits, outside, queue, tail, row * width + width - 1);
        }
        while (head < tail) {
            int i = queue[head++];
            int col = i % width;
            int row = i / width;
            if (col > 0) tail = seed(bits, outside, queue, tail, i - 1);
            if (col < width - 1) tail = seed(bits, outside, queue, tail, i + 1);
            if (row > 0) tail = seed(bits, outside, queue, tail, i - width);
            if (row < height - 1) tail = seed(bits, outside, queue, tail, i + width);
        }
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            out[i] = bits[i] || !outside[i];
        }
        return out;
    }

    private static int seed(boolean[] bits, boolean[] outside, int[] queue, int tail, int i) {
        if (!bits[i] && !outside[i]) {
            outside[i] = true;
            queue[tail++] = i;
        }
        return tail;
    }

    static boolean[] dilate(boolean[] bits, int width, int height) {
        boolean[] out = new boolean[bits.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int i = row * width + col;
                out[i] = bits[i]
                        || (col > 0 && bits[i - 1])
                        || (col < width - 1 && bits[i + 1])
                        || (row > 0 && bits[i - width])
                        || (row < height - 1 && bits[i + width]);
            }
        }
        return out;
    }

    static boolean[] erode(boolean[] bits, int width, int height) {
        boolean[] out = new boolean[bits.length];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int i = row * width + col;
                out[i] = bits[i]
                        && col > 0 && bits[i - 1]
                        && col < width - 1 && bits[i + 1]
                        && row > 0 && bits[i - width]
                        && row < height - 1 && bits[i + width];
            }
        }
        return out;
    }

    /**
     * Closing as on an unbounded plane: the lattice is padded by
     * {@code iterations} background cells so foreground touching the border
     * is not eroded away.
     */
    static boolean[] close(boolean[] bits, int width, int height, int iterations) {
        if (iterations <= 0) {
            return bits.clone();
        }
        int pw = width + 2 * iterations;
        int ph = height + 2 * iterations;
        boolean[] padded = new boolean[pw * ph];
        for (int row = 0; row < height; row++) {
            System.arraycopy(bits, row * width, padded, (row + iterations) * pw + iterations, width);
        }
        for (int k = 0; k < iterations; k++) {
            padded = dilate(padded, pw, ph);
        }
        for (int k = 0; k < iterations; k++) {
            padded = erode(padded, pw, ph);
        }
        boolean[] out = new boolean[bits.length];
        for (int row = 0; row < height; row++) {
            System.arraycopy(padded, (row + iterations) * pw + iterations, out, row * width, width);
        }
        return out;
    }

    // the opened set is contained in the input, so no padding is needed
    static boolean[] open(boolean[] bits, int width, int height, int iterations) {
        boolean[] out = bits.clone();
        for (int k = 0; k < iterations; k++) {
            out = erode(out, width, height);
        }
        for (int k = 0; k < iterations; k++) {
            out = dilate(out, width, height);
        }
        return out;
    }

    /**
     * Labels 4-connected foreground components 1..n in row-major order of
     * their first cell; background is 0.
     *
     * @return n, the number of components; labels are written to {@code labels}
     */
    static int label(boolean[] bits, int width, int height, int[] labels) {
        int[] queue = new int[bits.length];
        int next = 0;
        for (int start = 0; start < bits.length; start++) {
            if (!bits[start] || labels[start] != 0) {
                continue;
            }
            next++;
            int head = 0;
            int tail = 0;
            labels[start] = next;
            queue[tail++] = start;
            while (head < tail) {
                int i = queue[head++];
                int col = i % width;
                int row = i / width;
                if (col > 0) tail = visit(bits, labels, queue, tail, i - 1, next);
                if (col < width - 1) tail = visit(bits, labels, queue, tail, i + 1, next);
                if (row > 0) tail = visit(bits, labels, queue, tail, i - width, next);
                if (row < height - 1) tail = visit(bits, labels, queue, tail, i + width, next);
            }
        }
        return next;
    }

    private static int visit(boolean[] bits, int[] labels, int[] queue, int tail, int i, int label) {
        if (bits[i] && labels[i] == 0) {
            labels[i] = label;
            queue[tail++] = i;
        }
        return tail;
    }

    /** Drops foreground components with fewer than {@code minPixels} cells. */
    static boolean[] sieve(boolean[] bits, int width, int height, int minPixels) {
        if (minPixels <= 1) {
            return bits.clone();
        }
        int[] labels = new int[bits.length];
        int n = label(bits, width, height, labels);
        int[] sizes = new int[n + 1];
        for (int l : labels) {
            sizes[l]++;
        }
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) {
            out[i] = labels[i] != 0 && sizes[labels[i]] >= minPixels;
        }
        return out;
    }
}
