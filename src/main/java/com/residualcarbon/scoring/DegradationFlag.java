package com.residualcarbon.scoring;

/** Marks a score that was computed but rests on incomplete data. */
public enum DegradationFlag {
    /** Some input raster did not cover the whole area of interest. */
    PARTIAL_COVERAGE,
    /** Fewer points fell in the hex than the configured threshold. */
    LOW_POINT_COUNT,
    MOISTURE_DEFAULTED,
    TEMPERATURE_DEFAULTED
}
