package com.ashfall.service;

import com.ashfall.config.AshfallProperties;
import com.ashfall.model.AshfallRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AshfallAnalysisServiceTest {

    @Test
    void requestOverridesDoNotLeakIntoSharedSettings() {
        AshfallProperties shared = new AshfallProperties();
        AshfallAnalysisService service = new AshfallAnalysisService(shared, null, new GeoJsonConverter());

        AshfallRequest request = new AshfallRequest();
        request.setNx(80);
        request.setThresholds(List.of(5.0));
        request.setKernel("gaussian");
        request.setSouthBoost(3.0);
        request.setMinComponentPixels(2);

        AshfallProperties effective = service.effectiveSettings(request);

        assertEquals(80, effective.getGrid().getNx());
        assertEquals(List.of(5.0), effective.getMask().getThresholds());
        assertEquals("gaussian", effective.getInterpolation().getKernel());
        assertEquals(3.0, effective.getTaper().getSouthBoost(), 0.0);
        assertEquals(2, effective.getMask().getMinComponentPixels());

        assertEquals(600, shared.getGrid().getNx());
        assertEquals(List.of(0.1, 1.0, 10.0, 100.0), shared.getMask().getThresholds());
        assertEquals("MULTIQUADRIC", shared.getInterpolation().getKernel());
        assertEquals(2.0, shared.getTaper().getSouthBoost(), 0.0);
    }

    @Test
    void missingOverridesKeepConfiguredValues() {
        AshfallProperties shared = new AshfallProperties();
        shared.getTaper().setOuterRadius(12.0);
        AshfallAnalysisService service = new AshfallAnalysisService(shared, null, new GeoJsonConverter());

        AshfallProperties effective = service.effectiveSettings(new AshfallRequest());

        assertEquals(12.0, effective.getTaper().getOuterRadius(), 0.0);
        assertEquals(shared.getMask().getThresholds(), effective.getMask().getThresholds());
    }

    @Test
    void emptyObservationListIsRejected() {
        AshfallAnalysisService service = new AshfallAnalysisService(new AshfallProperties(), null, new GeoJsonConverter());
        assertThrows(IllegalArgumentException.class, () -> service.analyze(new AshfallRequest()));
    }

    @Test
    void observationWithoutThicknessIsRejected() {
        AshfallAnalysisService service = new AshfallAnalysisService(new AshfallProperties(), null, new GeoJsonConverter());
        AshfallRequest.PointInput p = new AshfallRequest.PointInput();
        p.setLongitude(118.0);
        p.setLatitude(-8.25);
        AshfallRequest request = new AshfallRequest();
        request.setObservations(List.of(p));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> service.analyze(request));
        assertTrue(e.getMessage().contains("thicknessCm"));
    }
}
