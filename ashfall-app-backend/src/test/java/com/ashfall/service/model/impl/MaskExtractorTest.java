package com.ashfall.service.model.impl;

import com.ashfall.model.BinaryMask;
import com.ashfall.model.Grid;
import com.ashfall.model.ScalarField;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MaskExtractorTest {

    private static final int W = 30;
    private static final int H = 30;
    private static final Grid GRID = new Grid(0, 0, W - 1, H - 1, W, H);

    private static ScalarField fieldOf(boolean[] bits) {
        double[] values = new double[bits.length];
        for (int i = 0; i < bits.length; i++) {
            values[i] = bits[i] ? 1.0 : 0.0;
        }
        return new ScalarField(GRID, values);
    }

    private static void fillBlock(boolean[] bits, int col0, int row0, int col1, int row1) {
        for (int row = row0; row <= row1; row++) {
            for (int col = col0; col <= col1; col++) {
                bits[row * W + col] = true;
            }
        }
    }

    // a few overlapping bumps with ragged edges
    private static ScalarField bumps() {
        double[] values = new double[GRID.size()];
        for (int row = 0; row < H; row++) {
            for (int col = 0; col < W; col++) {
                double a = 10 * Math.exp(-((col - 10) * (col - 10) + (row - 12) * (row - 12)) / 30.0);
                double b = 6 * Math.exp(-((col - 22) * (col - 22) + (row - 20) * (row - 20)) / 12.0);
                double ripple = 0.8 * Math.sin(col * 1.7) * Math.cos(row * 1.3);
                values[GRID.index(col, row)] = a + b + ripple;
            }
        }
        values[GRID.index(0, 0)] = Double.NaN;
        return new ScalarField(GRID, values);
    }

    @Test
    void thresholdIsStrictAndIgnoresUndefinedValues() {
        double[] values = new double[GRID.size()];
        values[0] = 1.0;
        values[1] = 1.0000001;
        values[2] = Double.NaN;
        values[3] = Double.POSITIVE_INFINITY;
        BinaryMask mask = new MaskExtractor(0, 0, 0, 1).threshold(new ScalarField(GRID, values), 1.0);

        assertFalse(mask.get(0, 0));
        assertTrue(mask.get(1, 0));
        assertFalse(mask.get(2, 0));
        assertFalse(mask.get(3, 0));
    }

    @Test
    void holesAreFilled() {
        boolean[] bits = new boolean[W * H];
        fillBlock(bits, 5, 5, 11, 11);
        for (int row = 7; row <= 9; row++) {
            for (int col = 7; col <= 9; col++) {
                bits[row * W + col] = false;
            }
        }

        BinaryMask mask = new MaskExtractor(0, 0, 0, 4).extract(fieldOf(bits), 0.5);

        assertTrue(mask.get(8, 8));
        assertEquals(49, mask.count());
    }

    @Test
    void smallComponentsAreSieved() {
        boolean[] bits = new boolean[W * H];
        fillBlock(bits, 2, 2, 7, 7);
        fillBlock(bits, 20, 20, 21, 21);

        BinaryMask mask = new MaskExtractor(0, 0, 10, 4).extract(fieldOf(bits), 0.5);

        assertEquals(36, mask.count());
        assertFalse(mask.get(20, 20));
    }

    @Test
    void closingBridgesNarrowGaps() {
        boolean[] bits = new boolean[W * H];
        fillBlock(bits, 5, 5, 9, 9);
        fillBlock(bits, 11, 5, 15, 9);

        BinaryMask unbridged = new MaskExtractor(0, 0, 0, 4).extract(fieldOf(bits), 0.5);
        BinaryMask bridged = new MaskExtractor(1, 0, 0, 4).extract(fieldOf(bits), 0.5);

        assertFalse(unbridged.get(10, 7));
        assertTrue(bridged.get(10, 7));
    }

    @Test
    void blobsTouchingTheBorderSurviveCleanup() {
        boolean[] bits = new boolean[W * H];
        fillBlock(bits, 0, 0, 5, 5);

        BinaryMask mask = new MaskExtractor(2, 1, 0, 8).extract(fieldOf(bits), 0.5);

        assertTrue(mask.get(0, 3));
        assertTrue(mask.get(3, 0));
        assertTrue(mask.count() > 30);
    }

    @Test
    void extractionIsIdempotent() {
        MaskExtractor extractor = new MaskExtractor(2, 1, 8, 8);
        BinaryMask once = extractor.extract(bumps(), 2.0);
        BinaryMask twice = extractor.extract(fieldOf(once.toArray()), 0.5);

        assertFalse(once.isEmpty());
        assertEquals(once, twice);
        assertEquals(once, extractor.clean(once));
    }

    @Test
    void higherThresholdsGiveSmallerMasks() {
        MaskExtractor extractor = new MaskExtractor(2, 1, 8, 8);
        ScalarField field = bumps();
        double[] thresholds = {0.5, 1.0, 2.0, 4.0, 7.0};

        BinaryMask previous = extractor.extract(field, thresholds[0]);
        for (int k = 1; k < thresholds.length; k++) {
            BinaryMask next = extractor.extract(field, thresholds[k]);
            assertTrue(next.isSubsetOf(previous), "mask at " + thresholds[k] + " is not nested");
            previous = next;
        }
    }

    @Test
    void rejectsNegativeParameters() {
        assertThrows(IllegalArgumentException.class, () -> new MaskExtractor(-1, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new MaskExtractor(0, 0, 0, 0));
    }
}
