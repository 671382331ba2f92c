package com.residualcarbon.hex;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;

/**
 * The points of one layer with the hex cell each falls in, as parallel arrays. Only points with a finite value and a
 * valid coordinate make it in; the rest are counted.
 */
public class IndexedPoints {

    public final Layer layer;
    public final int resolution;
    public final double[] lon;
    public final double[] lat;
    public final double[] value;
    public final long[] cells;

    /** Rows dropped because the coordinate was NaN or off the globe. */
    public final long filteredCoordinates;

    /** Rows dropped because the value was NaN (nodata kept by the NAN policy). */
    public final long filteredValues;

    public final CoverageReport coverage;

    public IndexedPoints (Layer layer, int resolution, double[] lon, double[] lat, double[] value, long[] cells,
                          long filteredCoordinates, long filteredValues, CoverageReport coverage) {
        this.layer = layer;
        this.resolution = resolution;
        this.lon = lon;
        this.lat = lat;
        this.value = value;
        this.cells = cells;
        this.filteredCoordinates = filteredCoordinates;
        this.filteredValues = filteredValues;
        this.coverage = coverage;
    }

    public int size () {
        return cells.length;
    }
}
