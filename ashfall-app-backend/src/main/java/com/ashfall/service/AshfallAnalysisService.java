package com.ashfall.service;

import com.ashfall.config.AshfallProperties;
import com.ashfall.model.AdminBoundary;
import com.ashfall.model.AffineTransform;
import com.ashfall.model.AshfallReport;
import com.ashfall.model.AshfallRequest;
import com.ashfall.model.AshfallResult;
import com.ashfall.model.Grid;
import com.ashfall.model.LandUseRaster;
import com.ashfall.model.Observation;
import com.ashfall.model.ThresholdAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AshfallAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AshfallAnalysisService.class);

    private final AshfallProperties properties;
    private final LandUseClassService landUseClassService;
    private final GeoJsonConverter geoJsonConverter;

    public AshfallAnalysisService(AshfallProperties properties,
                                  LandUseClassService landUseClassService,
                                  GeoJsonConverter geoJsonConverter) {
        this.properties = properties;
        this.landUseClassService = landUseClassService;
        this.geoJsonConverter = geoJsonConverter;
    }

    public AshfallResult analyze(AshfallRequest request) {
        if (request.getObservations() == null || request.getObservations().isEmpty()) {
            throw new IllegalArgumentException("Observations are required");
        }
        List<Observation> observations = new ArrayList<>();
        for (AshfallRequest.PointInput p : request.getObservations()) {
            if (p == null || p.getLongitude() == null || p.getLatitude() == null || p.getThicknessCm() == null) {
                throw new IllegalArgumentException("Observation " + (observations.size() + 1)
                        + " needs longitude, latitude and thicknessCm");
            }
            observations.add(new Observation(p.getLongitude(), p.getLatitude(), p.getThicknessCm()));
        }

        AshfallProperties settings = effectiveSettings(request);
        AshfallPipeline pipeline = new AshfallPipeline(settings);
        Grid grid = request.getBounds() == null
                ? pipeline.defaultGrid(observations)
                : new Grid(request.getBounds().getWest(), request.getBounds().getSouth(),
                request.getBounds().getEast(), request.getBounds().getNorth(),
                settings.getGrid().getNx(), settings.getGrid().getNy());

        logger.info("Ashfall analysis started: {} observations, {}", observations.size(), grid);
        AshfallReport report = pipeline.run(observations, grid, toRaster(request.getLandUse()),
                toBoundaries(request.getBoundaries()), landUseClassService.classNames());
        logger.info("Ashfall analysis finished: {} threshold(s)", report.getAnalyses().size());
        return toResult(report);
    }

    AshfallProperties effectiveSettings(AshfallRequest request) {
        AshfallProperties settings = properties.copy();
        if (request.getNx() != null) {
            settings.getGrid().setNx(request.getNx());
        }
        if (request.getNy() != null) {
            settings.getGrid().setNy(request.getNy());
        }
        if (request.getThresholds() != null && !request.getThresholds().isEmpty()) {
            settings.getMask().setThresholds(new ArrayList<>(request.getThresholds()));
        }
        if (request.getMinComponentPixels() != null) {
            settings.getMask().setMinComponentPixels(request.getMinComponentPixels());
        }
        if (request.getKernel() != null && !request.getKernel().isBlank()) {
            settings.getInterpolation().setKernel(request.getKernel());
        }
        if (request.getSmoothing() != null) {
            settings.getInterpolation().setSmoothing(request.getSmoothing());
        }
        AshfallProperties.TaperProperties taper = settings.getTaper();
        if (request.getSourceLongitude() != null) {
            taper.setSourceLongitude(request.getSourceLongitude());
        }
        if (request.getSourceLatitude() != null) {
            taper.setSourceLatitude(request.getSourceLatitude());
        }
        if (request.getSouthBoost() != null) {
            taper.setSouthBoost(request.getSouthBoost());
        }
        if (request.getInnerRadius() != null) {
            taper.setInnerRadius(request.getInnerRadius());
        }
        if (request.getOuterRadius() != null) {
            taper.setOuterRadius(request.getOuterRadius());
        }
        return settings;
    }

    private LandUseRaster toRaster(AshfallRequest.LandUseInput input) {
        if (input == null) {
            return null;
        }
        AshfallRequest.TransformInput t = input.getTransform();
        if (t == null) {
            throw new IllegalArgumentException("Land-use raster transform is required");
        }
        return new LandUseRaster(input.getWidth(), input.getHeight(), input.getCodes(),
                new AffineTransform(t.getOriginX(), t.getPixelWidth(), t.getOriginY(), t.getPixelHeight()),
                input.getCrs());
    }

    private List<AdminBoundary> toBoundaries(List<AshfallRequest.BoundaryInput> inputs) {
        List<AdminBoundary> boundaries = new ArrayList<>();
        if (inputs == null) {
            return boundaries;
        }
        for (AshfallRequest.BoundaryInput b : inputs) {
            boundaries.add(new AdminBoundary(b.getName(), geoJsonConverter.read(b.getGeometry())));
        }
        return boundaries;
    }

    private AshfallResult toResult(AshfallReport report) {
        AshfallResult result = new AshfallResult();
        Grid grid = report.getGrid();
        result.setWest(grid.getWest());
        result.setSouth(grid.getSouth());
        result.setEast(grid.getEast());
        result.setNorth(grid.getNorth());
        result.setNx(grid.getNx());
        result.setNy(grid.getNy());
        result.setObservationsUsed(report.getObservationsUsed());
        result.setDrySites(report.getDrySites());
        result.setFieldMaximumCm(report.getFieldMaximum());

        List<AshfallResult.ThresholdResult> thresholds = new ArrayList<>();
        for (ThresholdAnalysis analysis : report.getAnalyses()) {
            AshfallResult.ThresholdResult tr = new AshfallResult.ThresholdResult();
            tr.setThresholdCm(analysis.getThresholdCm());
            tr.setRegionFound(analysis.isRegionFound());
            if (analysis.isRegionFound()) {
                tr.setGeoJsonRegion(geoJsonConverter.write(analysis.getRegion().getGeometry()));
                tr.setAreaKm2(analysis.getRegion().getAreaKm2());
                tr.setComponentCount(analysis.getRegion().getComponentCount());
            }
            tr.setLandUse(analysis.getZonalRecords());
            tr.setCountries(analysis.getCountryRecords());
            thresholds.add(tr);
        }
        result.setThresholds(thresholds);
        return result;
    }
}
