package com.ashfall.model;

import java.util.List;

/**
 * Outcome of one pipeline run over all requested thresholds.
 */
public final class AshfallReport {

    private final Grid grid;
    private final int observationsUsed;
    private final int drySites;
    private final double fieldMaximum;
    private final List<ThresholdAnalysis> analyses;

    public AshfallReport(Grid grid, int observationsUsed, int drySites, double fieldMaximum,
                         List<ThresholdAnalysis> analyses) {
        this.grid = grid;
        this.observationsUsed = observationsUsed;
        this.drySites = drySites;
        this.fieldMaximum = fieldMaximum;
        this.analyses = List.copyOf(analyses);
    }

    public Grid getGrid() {
        return grid;
    }

    public int getObservationsUsed() {
        return observationsUsed;
    }

    public int getDrySites() {
        return drySites;
    }

    public double getFieldMaximum() {
        return fieldMaximum;
    }

    public List<ThresholdAnalysis> getAnalyses() {
        return analyses;
    }
}
