package com.ashfall.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GridTest {

    @Test
    void nodesSpanTheBoundsInclusively() {
        Grid grid = new Grid(112.0, -14.25, 124.0, -2.25, 121, 121);
        assertEquals(112.0, grid.longitudeAt(0), 0.0);
        assertEquals(124.0, grid.longitudeAt(120), 1e-9);
        assertEquals(-14.25, grid.latitudeAt(0), 0.0);
        assertEquals(-2.25, grid.latitudeAt(120), 1e-9);
        assertEquals(0.1, grid.getCellWidth(), 1e-12);
        assertEquals(121 * 121, grid.size());
        assertEquals(121 + 3, grid.index(3, 1));
    }

    @Test
    void transformCentresCellsOnNodes() {
        Grid grid = new Grid(0, 0, 9, 4, 10, 5);
        AffineTransform t = grid.getTransform();
        for (int col = 0; col < 10; col++) {
            assertEquals(grid.longitudeAt(col), t.centerX(col), 1e-12);
        }
        for (int row = 0; row < 5; row++) {
            assertEquals(grid.latitudeAt(row), t.centerY(row), 1e-12);
        }
    }

    @Test
    void aroundPadsEachAxis() {
        List<Observation> obs = List.of(new Observation(10, 5, 1), new Observation(12, 5, 2));
        Grid grid = Grid.around(obs, 0.5, 20, 20);
        assertEquals(9.0, grid.getWest(), 1e-12);
        assertEquals(13.0, grid.getEast(), 1e-12);
        // no latitude extent: one degree
        assertEquals(4.0, grid.getSouth(), 1e-12);
        assertEquals(6.0, grid.getNorth(), 1e-12);
    }

    @Test
    void rejectsDegenerateGrids() {
        assertThrows(IllegalArgumentException.class, () -> new Grid(0, 0, 1, 1, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> new Grid(1, 0, 1, 1, 5, 5));
        assertThrows(IllegalArgumentException.class, () -> Grid.around(List.of(), 0.9, 5, 5));
    }

    @Test
    void northUpRasterTransform() {
        AffineTransform t = AffineTransform.fromBounds(0, 0, 10, 10, 10, 10);
        assertEquals(9.5, t.centerY(0), 1e-12);
        assertEquals(0.5, t.centerY(9), 1e-12);
        assertEquals(3.0, t.columnOf(3.0), 1e-12);
        assertEquals(7.0, t.rowOf(3.0), 1e-12);
    }

    @Test
    void observationsValidateThickness() {
        assertThrows(IllegalArgumentException.class, () -> new Observation(0, 0, -1));
        assertThrows(IllegalArgumentException.class, () -> new Observation(Double.NaN, 0, 1));
        assertTrue(new Observation(0, 0, 0).isDry());
    }
}
