package com.ashfall.service.model.impl;

import com.ashfall.exception.InsufficientDataException;
import com.ashfall.model.Grid;
import com.ashfall.model.Observation;
import com.ashfall.model.ScalarField;
import com.ashfall.service.model.impl.kernels.IdentityTransform;
import com.ashfall.service.model.impl.kernels.Log10Transform;
import com.ashfall.service.model.impl.kernels.StandardKernel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InterpolationEngineTest {

    private static List<Observation> cross() {
        List<Observation> obs = new ArrayList<>();
        obs.add(new Observation(118.0, -8.25, 100));
        obs.add(new Observation(118.0, -6.25, 50));
        obs.add(new Observation(118.0, -10.25, 50));
        obs.add(new Observation(120.0, -8.25, 50));
        obs.add(new Observation(116.0, -8.25, 10));
        return obs;
    }

    private static final Grid GRID = new Grid(112.0, -14.25, 124.0, -2.25, 25, 25);

    @Test
    void zeroSmoothingReproducesObservations() {
        InterpolationEngine engine = InterpolationEngine.builder()
                .kernel(StandardKernel.MULTIQUADRIC)
                .transform(new Log10Transform(1e-3))
                .smoothing(0.0)
                .build();
        FittedSurface surface = engine.fit(cross());
        for (Observation o : cross()) {
            assertEquals(o.getThicknessCm(), surface.estimate(o.getLongitude(), o.getLatitude()),
                    1e-6 * o.getThicknessCm());
        }
    }

    @Test
    void zeroSmoothingReproducesObservationsInLinearDomain() {
        InterpolationEngine engine = InterpolationEngine.builder()
                .kernel(StandardKernel.LINEAR)
                .transform(new IdentityTransform())
                .build();
        FittedSurface surface = engine.fit(cross());
        for (Observation o : cross()) {
            assertEquals(o.getThicknessCm(), surface.estimate(o.getLongitude(), o.getLatitude()), 1e-8);
        }
    }

    @Test
    void fourPositiveObservationsAreNotEnough() {
        List<Observation> obs = cross().subList(0, 4);
        List<Observation> withDry = new ArrayList<>(obs);
        withDry.add(new Observation(110.0, -5.0, 0.0));
        withDry.add(new Observation(125.0, -12.0, 0.0));

        InterpolationEngine engine = InterpolationEngine.builder().build();
        assertThrows(InsufficientDataException.class, () -> engine.interpolate(obs, GRID));
        assertThrows(InsufficientDataException.class, () -> engine.interpolate(withDry, GRID));
    }

    @Test
    void fivePositiveObservationsSucceed() {
        ScalarField field = InterpolationEngine.builder().smoothing(0.005).build().interpolate(cross(), GRID);
        assertEquals(GRID.size(), field.size());
        assertTrue(field.countFinite() > 0);
    }

    @Test
    void drySitesDoNotTakePartInTheFit() {
        List<Observation> withDry = new ArrayList<>(cross());
        withDry.add(new Observation(114.0, -12.0, 0.0));
        InterpolationEngine engine = InterpolationEngine.builder().smoothing(0.0).build();

        assertEquals(5, engine.fit(withDry).getPointCount());
        assertArrayEquals(engine.interpolate(cross(), GRID).toArray(), engine.interpolate(withDry, GRID).toArray());
    }

    @Test
    void outputIsDeterministic() {
        InterpolationEngine engine = InterpolationEngine.builder().smoothing(0.005).build();
        assertArrayEquals(engine.interpolate(cross(), GRID).toArray(), engine.interpolate(cross(), GRID).toArray());
    }

    @Test
    void valuesAreUndefinedOrPositiveAndClipped() {
        ScalarField field = InterpolationEngine.builder()
                .kernel(StandardKernel.LINEAR)
                .transform(new IdentityTransform())
                .clipFactor(1.2)
                .build()
                .interpolate(cross(), GRID);
        for (double v : field.toArray()) {
            assertTrue(Double.isNaN(v) || (v > 0 && v <= 120.0), "unexpected value " + v);
        }
    }

    @Test
    void nodesFarFromObservationsCanBeCutOff() {
        ScalarField field = InterpolationEngine.builder()
                .maxObservationDistance(1.0)
                .build()
                .interpolate(cross(), GRID);
        // south-west corner is far from every observation
        assertTrue(Double.isNaN(field.get(0, 0)));
        // node (12, 12) sits on the source
        assertEquals(118.0, GRID.longitudeAt(12), 1e-9);
        assertTrue(Double.isFinite(field.get(12, 12)));
    }

    @Test
    void automaticEpsilonIsAverageSpacing() {
        double[] xs = {0, 4, 0, 4};
        double[] ys = {0, 0, 1, 1};
        assertEquals(1.0, InterpolationEngine.averageSpacing(xs, ys), 1e-12);
        assertEquals(1.0, InterpolationEngine.averageSpacing(new double[]{2, 2}, new double[]{3, 3}), 0.0);
    }
}
