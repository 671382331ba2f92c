package com.residualcarbon.grids;

/**
 * A raster restricted to an area of interest, with pixels outside the area set to nodata. For the full extent this
 * simply wraps the source raster.
 */
public class ClippedRaster {

    public final Raster raster;

    public final CoverageReport coverage;

    public ClippedRaster (Raster raster, CoverageReport coverage) {
        this.raster = raster;
        this.coverage = coverage;
    }
}
