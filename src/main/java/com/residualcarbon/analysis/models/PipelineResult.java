package com.residualcarbon.analysis.models;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.grids.CoverageReport;
import com.residualcarbon.hex.HexAggregate;
import com.residualcarbon.scoring.ScoringResult;

import java.util.List;
import java.util.SortedMap;

/**
 * Everything one pipeline run produced. A run can succeed up to aggregation and still fail to score, in which case
 * scoring is null and scoringError says why.
 */
public class PipelineResult {

    public final AreaOfInterest aoi;
    public final int resolution;

    /** Aggregated hexes sorted by cell id, with boundaries. */
    public final List<HexAggregate> hexes;

    public final ScoringResult scoring;
    public final PipelineException scoringError;

    public final SortedMap<Layer, CoverageReport> coverage;

    /** True when any layer's raster did not cover the whole area of interest. */
    public final boolean partialCoverage;

    public final Diagnostics diagnostics;

    public PipelineResult (AreaOfInterest aoi, int resolution, List<HexAggregate> hexes, ScoringResult scoring,
                           PipelineException scoringError, SortedMap<Layer, CoverageReport> coverage,
                           boolean partialCoverage, Diagnostics diagnostics) {
        this.aoi = aoi;
        this.resolution = resolution;
        this.hexes = hexes;
        this.scoring = scoring;
        this.scoringError = scoringError;
        this.coverage = coverage;
        this.partialCoverage = partialCoverage;
        this.diagnostics = diagnostics;
    }

    /** Counters gathered over a run, for logs and front ends. */
    public static class Diagnostics {
        public long pointsIndexed;
        public long filteredCoordinates;
        public long filteredValues;
        public long boundaryPolygons;
        /** Read from the shared cache counters, so these include other runs that overlapped this one. */
        public long cacheHits;
        public long cacheMisses;
        public long elapsedMillis;

        @Override
        public String toString () {
            return String.format("%d points indexed (%d bad coordinates, %d NaN values filtered), %d boundaries, " +
                    "cache %d hits / %d misses, %d ms", pointsIndexed, filteredCoordinates, filteredValues,
                    boundaryPolygons, cacheHits, cacheMisses, elapsedMillis);
        }
    }
}
