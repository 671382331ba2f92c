package com.residualcarbon.grids;

/**
 * How much of an area of interest a raster actually covers. Partial coverage is reported here as data rather than
 * raised as an error.
 */
public class CoverageReport {

    /** Pixels whose centers fall inside the area, whether or not the raster extends that far. */
    public final long totalPixels;

    /** Of those, the pixels inside the raster holding real data. */
    public final long validPixels;

    public final double fractionValidPixels;

    /** True when part of the area lies beyond the raster's extent. */
    public final boolean touchesBoundary;

    public CoverageReport (long totalPixels, long validPixels, double fractionValidPixels, boolean touchesBoundary) {
        this.totalPixels = totalPixels;
        this.validPixels = validPixels;
        this.fractionValidPixels = fractionValidPixels;
        this.touchesBoundary = touchesBoundary;
    }

    public static CoverageReport of (long totalPixels, long validPixels, boolean touchesBoundary) {
        double fraction = totalPixels == 0 ? 0 : validPixels / (double) totalPixels;
        return new CoverageReport(totalPixels, validPixels, fraction, touchesBoundary);
    }

    /** The whole raster is the area of interest, so coverage is complete by definition. */
    public static CoverageReport fullExtent (Raster raster) {
        return new CoverageReport(raster.pixelCount(), raster.countValid(0), 1.0, false);
    }

    @Override
    public String toString () {
        return String.format("%d of %d pixels valid (%.1f%%)%s", validPixels, totalPixels, fractionValidPixels * 100,
                touchesBoundary ? ", touches data boundary" : "");
    }
}
