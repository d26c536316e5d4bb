package com.ashfall.service.model.impl;

import com.ashfall.model.BinaryMask;
import com.ashfall.model.Grid;
import com.ashfall.model.ScalarField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Thresholds a field into a binary mask and cleans it. The cleanup sequence
 * is fill holes, closing, fill holes, opening, sieve, fill holes; it is
 * repeated until the mask stops changing, so cleaning a cleaned mask is a
 * no-op.
 */
public final class MaskExtractor {

    private static final Logger logger = LoggerFactory.getLogger(MaskExtractor.class);

    private final int closingIterations;
    private final int openingIterations;
    private final int minComponentPixels;
    private final int maxCleanupPasses;

    public MaskExtractor(int closingIterations, int openingIterations, int minComponentPixels, int maxCleanupPasses) {
        if (closingIterations < 0 || openingIterations < 0 || minComponentPixels < 0) {
            throw new IllegalArgumentException("Morphology parameters must be >= 0");
        }
        if (maxCleanupPasses < 1) {
            throw new IllegalArgumentException("At least one cleanup pass is required");
        }
        this.closingIterations = closingIterations;
        this.openingIterations = openingIterations;
        this.minComponentPixels = minComponentPixels;
        this.maxCleanupPasses = maxCleanupPasses;
    }

    public BinaryMask extract(ScalarField field, double threshold) {
        return clean(threshold(field, threshold));
    }

    /** Finite values strictly above the threshold. */
    public BinaryMask threshold(ScalarField field, double threshold) {
        Grid grid = field.getGrid();
        boolean[] bits = new boolean[field.size()];
        for (int i = 0; i < bits.length; i++) {
            double v = field.get(i);
            bits[i] = Double.isFinite(v) && v > threshold;
        }
        return new BinaryMask(grid.getNx(), grid.getNy(), bits);
    }

    public BinaryMask clean(BinaryMask mask) {
        int width = mask.getWidth();
        int height = mask.getHeight();
        boolean[] current = mask.toArray();
        for (int pass = 1; pass <= maxCleanupPasses; pass++) {
            boolean[] next = cleanupPass(current, width, height);
            if (Arrays.equals(next, current)) {
                logger.debug("Mask cleanup stable after {} pass(es)", pass);
                return new BinaryMask(width, height, next);
            }
            current = next;
        }
        logger.warn("Mask cleanup still changing after {} passes, using last result", maxCleanupPasses);
        return new BinaryMask(width, height, current);
    }

    private boolean[] cleanupPass(boolean[] bits, int width, int height) {
        boolean[] m = BinaryMorphology.fillHoles(bits, width, height);
        m = BinaryMorphology.close(m, width, height, closingIterations);
        m = BinaryMorphology.fillHoles(m, width, height);
        m = BinaryMorphology.open(m, width, height, openingIterations);
        m = BinaryMorphology.sieve(m, width, height, minComponentPixels);
        return BinaryMorphology.fillHoles(m, width, height);
    }
}
