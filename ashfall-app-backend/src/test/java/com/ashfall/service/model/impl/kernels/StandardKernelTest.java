package com.ashfall.service.model.impl.kernels;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StandardKernelTest {

    @Test
    void resolvesNamesCaseInsensitively() {
        assertEquals(StandardKernel.MULTIQUADRIC, StandardKernel.fromName("multiquadric"));
        assertEquals(StandardKernel.THIN_PLATE, StandardKernel.fromName("thin-plate"));
        assertEquals(StandardKernel.INVERSE_MULTIQUADRIC, StandardKernel.fromName(" Inverse_Multiquadric "));
    }

    @Test
    void rejectsUnknownKernel() {
        assertThrows(IllegalArgumentException.class, () -> StandardKernel.fromName("bessel"));
        assertThrows(IllegalArgumentException.class, () -> StandardKernel.fromName(" "));
    }

    @Test
    void kernelValues() {
        assertEquals(1.0, StandardKernel.MULTIQUADRIC.evaluate(0.0, 2.0), 1e-12);
        assertEquals(Math.sqrt(2.0), StandardKernel.MULTIQUADRIC.evaluate(2.0, 2.0), 1e-12);
        assertEquals(1.0 / Math.sqrt(2.0), StandardKernel.INVERSE_MULTIQUADRIC.evaluate(2.0, 2.0), 1e-12);
        assertEquals(Math.exp(-1.0), StandardKernel.GAUSSIAN.evaluate(2.0, 2.0), 1e-12);
        assertEquals(3.0, StandardKernel.LINEAR.evaluate(3.0, 99.0), 0.0);
        assertEquals(8.0, StandardKernel.CUBIC.evaluate(2.0, 1.0), 1e-12);
        assertEquals(32.0, StandardKernel.QUINTIC.evaluate(2.0, 1.0), 1e-12);
        assertEquals(0.0, StandardKernel.THIN_PLATE.evaluate(0.0, 1.0), 0.0);
        assertEquals(4.0 * Math.log(2.0), StandardKernel.THIN_PLATE.evaluate(2.0, 1.0), 1e-12);
    }

    @Test
    void logTransformRoundTripsAndKeepsZeroFinite() {
        Log10Transform t = new Log10Transform(1e-3);
        assertEquals(-3.0, t.forward(0.0), 1e-12);
        assertEquals(42.0, t.inverse(t.forward(42.0)), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> new Log10Transform(0.0));
    }
}
