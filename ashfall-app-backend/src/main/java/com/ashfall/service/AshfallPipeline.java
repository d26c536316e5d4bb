package com.ashfall.service;

import com.ashfall.config.AshfallProperties;
import com.ashfall.model.AdminBoundary;
import com.ashfall.model.AshfallReport;
import com.ashfall.model.BinaryMask;
import com.ashfall.model.CountryRecord;
import com.ashfall.model.Grid;
import com.ashfall.model.LandUseRaster;
import com.ashfall.model.Observation;
import com.ashfall.model.RegionGeometry;
import com.ashfall.model.ScalarField;
import com.ashfall.model.ThresholdAnalysis;
import com.ashfall.model.ZonalRecord;
import com.ashfall.service.model.ValueTransform;
import com.ashfall.service.model.impl.DirectionalTaper;
import com.ashfall.service.model.impl.EqualAreaProjector;
import com.ashfall.service.model.impl.InterpolationEngine;
import com.ashfall.service.model.impl.MaskExtractor;
import com.ashfall.service.model.impl.Polygonizer;
import com.ashfall.service.model.impl.ZonalStatistics;
import com.ashfall.service.model.impl.kernels.IdentityTransform;
import com.ashfall.service.model.impl.kernels.Log10Transform;
import com.ashfall.service.model.impl.kernels.StandardKernel;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One configured run of the stages: interpolation, taper, and per threshold
 * mask extraction, polygonization and zonal statistics. Built per run from
 * the effective settings; not shared between threads.
 */
public class AshfallPipeline {

    public static final int WGS84_SRID = 4326;

    private static final Logger logger = LoggerFactory.getLogger(AshfallPipeline.class);

    private final AshfallProperties settings;
    private final InterpolationEngine engine;
    private final DirectionalTaper taper;
    private final MaskExtractor extractor;
    private final Polygonizer polygonizer;
    private final ZonalStatistics zonalStatistics;

    public AshfallPipeline(AshfallProperties settings) {
        this.settings = settings;
        AshfallProperties.InterpolationProperties ip = settings.getInterpolation();
        this.engine = InterpolationEngine.builder()
                .kernel(StandardKernel.fromName(ip.getKernel()))
                .transform(valueTransform(ip))
                .smoothing(ip.getSmoothing())
                .epsilon(ip.getEpsilon())
                .clipFactor(ip.getClipFactor())
                .maxObservationDistance(ip.getMaxObservationDistance())
                .build();

        AshfallProperties.TaperProperties tp = settings.getTaper();
        this.taper = new DirectionalTaper(tp.getSourceLongitude(), tp.getSourceLatitude(),
                tp.getSouthBoost(), tp.getInnerRadius(), tp.getOuterRadius());

        AshfallProperties.MaskProperties mp = settings.getMask();
        this.extractor = new MaskExtractor(mp.getClosingIterations(), mp.getOpeningIterations(),
                mp.getMinComponentPixels(), mp.getMaxCleanupPasses());

        AshfallProperties.ProjectionProperties pp = settings.getProjection();
        GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), WGS84_SRID);
        EqualAreaProjector projector = new EqualAreaProjector(pp.getEqualAreaCrs(), pp.getEqualAreaDefinition());
        this.polygonizer = new Polygonizer(geometryFactory, projector, pp.getWorkingCrs());
        this.zonalStatistics = new ZonalStatistics(geometryFactory, projector, pp.getWorkingCrs());
    }

    /** Grid around the observations with the configured padding and resolution. */
    public Grid defaultGrid(List<Observation> observations) {
        AshfallProperties.GridProperties gp = settings.getGrid();
        return Grid.around(observations, gp.getPadFraction(), gp.getNx(), gp.getNy());
    }

    /**
     * Runs the whole pipeline.
     *
     * @param raster     land-use raster, or null to skip the land-use breakdown
     * @param boundaries administrative boundaries, may be empty
     * @param classNames land-use class names by code
     */
    public AshfallReport run(List<Observation> observations, Grid grid, LandUseRaster raster,
                             List<AdminBoundary> boundaries, Map<Integer, String> classNames) {
        List<Double> thresholds = settings.getMask().getThresholds();
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("At least one thickness threshold is required");
        }
        for (Double t : thresholds) {
            if (t == null || !Double.isFinite(t)) {
                throw new IllegalArgumentException("Thresholds must be finite numbers");
            }
        }

        int drySites = 0;
        for (Observation o : observations) {
            if (o.isDry()) {
                drySites++;
            }
        }
        if (drySites > 0) {
            logger.warn("{} dry site(s) excluded from the surface fit", drySites);
        }

        ScalarField raw = engine.interpolate(observations, grid);
        ScalarField weighted = taper.apply(raw);
        double fieldMaximum = weighted.max();
        logger.info("Thickness field on {}x{} grid, maximum {} cm", grid.getNx(), grid.getNy(), fieldMaximum);

        List<ThresholdAnalysis> analyses = new ArrayList<>();
        for (double threshold : thresholds) {
            analyses.add(analyzeThreshold(weighted, threshold, thresholds.size() > 1, raster, boundaries, classNames));
        }
        return new AshfallReport(grid, observations.size() - drySites, drySites, fieldMaximum, analyses);
    }

    private ThresholdAnalysis analyzeThreshold(ScalarField weighted, double threshold, boolean sweep,
                                               LandUseRaster raster, List<AdminBoundary> boundaries,
                                               Map<Integer, String> classNames) {
        BinaryMask mask = extractor.extract(weighted, threshold);
        if (mask.isEmpty() && sweep) {
            logger.info("Threshold {} cm: no region", threshold);
            return ThresholdAnalysis.empty(threshold);
        }
        RegionGeometry region = polygonizer.polygonize(mask, weighted.getGrid().getTransform());

        List<ZonalRecord> zonal = raster == null
                ? List.of()
                : zonalStatistics.landUseBreakdown(region, raster, classNames);
        List<CountryRecord> countries = boundaries == null || boundaries.isEmpty()
                ? List.of()
                : zonalStatistics.countryOverlap(region, boundaries);

        logger.info("Threshold {} cm: {} km2 in {} component(s), {} land-use classes, {} countries",
                threshold, String.format(Locale.ROOT, "%.1f", region.getAreaKm2()),
                region.getComponentCount(), zonal.size(), countries.size());
        return new ThresholdAnalysis(threshold, mask.count(), region, zonal, countries);
    }

    private static ValueTransform valueTransform(AshfallProperties.InterpolationProperties ip) {
        String name = ip.getTransform() == null ? "LOG10" : ip.getTransform().trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "LOG10" -> new Log10Transform(ip.getLogOffset());
            case "IDENTITY" -> new IdentityTransform();
            default -> throw new IllegalArgumentException("Unsupported value transform: " + ip.getTransform());
        };
    }
}
