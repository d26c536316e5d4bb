package com.ashfall.service.model.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BinaryMorphologyTest {

    private static boolean[] parse(String... rows) {
        int width = rows[0].length();
        boolean[] bits = new boolean[rows.length * width];
        for (int row = 0; row < rows.length; row++) {
            for (int col = 0; col < width; col++) {
                bits[row * width + col] = rows[row].charAt(col) == '#';
            }
        }
        return bits;
    }

    @Test
    void labelsUseFourConnectivity() {
        boolean[] bits = parse(
                "#....",
                ".#...",
                ".##..",
                "....#");
        int[] labels = new int[bits.length];

        assertEquals(3, BinaryMorphology.label(bits, 5, 4, labels));
        assertEquals(1, labels[0]);
        assertEquals(2, labels[6]);
        assertEquals(2, labels[12]);
        assertEquals(3, labels[19]);
        assertEquals(0, labels[1]);
    }

    @Test
    void fillHolesLeavesBorderConnectedBackground() {
        boolean[] bits = parse(
                "#####",
                "#...#",
                "#####",
                "#..##",
                "#####");
        boolean[] filled = BinaryMorphology.fillHoles(bits, 5, 5);
        for (boolean b : filled) {
            assertTrue(b);
        }

        boolean[] open = parse(
                "#####",
                "#....",
                "#####");
        assertFalse(BinaryMorphology.fillHoles(open, 5, 3)[6]);
    }

    @Test
    void erosionTreatsOutsideAsBackground() {
        boolean[] all = parse("###", "###", "###");
        boolean[] eroded = BinaryMorphology.erode(all, 3, 3);
        assertTrue(eroded[4]);
        assertFalse(eroded[0]);
        assertFalse(eroded[3]);
    }

    @Test
    void paddedClosingKeepsBorderPixels() {
        boolean[] all = parse("###", "###", "###");
        assertArrayEquals(all, BinaryMorphology.close(all, 3, 3, 2));
    }

    @Test
    void inputsAreNotModified() {
        boolean[] bits = parse("#.#", "...", "#.#");
        boolean[] copy = bits.clone();
        BinaryMorphology.close(bits, 3, 3, 1);
        BinaryMorphology.open(bits, 3, 3, 1);
        BinaryMorphology.sieve(bits, 3, 3, 2);
        BinaryMorphology.fillHoles(bits, 3, 3);
        assertArrayEquals(copy, bits);
        assertEquals(0, countSet(BinaryMorphology.sieve(bits, 3, 3, 2)));
    }

    private static int countSet(boolean[] bits) {
        int n = 0;
        for (boolean b : bits) {
            if (b) n++;
        }
        return n;
    }
}
