package com.residualcarbon.tables;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;

/**
 * The points of one layer. Iterating a table more than once yields the same records in the same order.
 */
public abstract class PointTable implements Iterable<PointRecord> {

    public final Layer layer;

    /** How much of the area of interest the source raster covered. */
    public final CoverageReport coverage;

    protected PointTable (Layer layer, CoverageReport coverage) {
        this.layer = layer;
        this.coverage = coverage;
    }

    public String unit () {
        return layer.property.unit;
    }

    /** Read every record into primitive column arrays. */
    public abstract ColumnarPointTable materialize ();
}
