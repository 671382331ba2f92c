package com.residualcarbon.tables;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.ClippedRaster;
import com.residualcarbon.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens clipped rasters into point tables, converting every value into its property's normalized unit
 * (percent, pH or degrees Celsius) so later steps never see source encodings.
 */
public class RasterTableConverter {

    private static final Logger LOG = LoggerFactory.getLogger(RasterTableConverter.class);

    private final NodataPolicy policy;

    public RasterTableConverter (NodataPolicy policy) {
        this.policy = policy;
    }

    /** A lazy, restartable view of one band. */
    public PointTable toTable (ClippedRaster clip, Layer layer, int band) {
        return new RasterPointTable(clip, layer, band, policy);
    }

    /** Read one band fully into memory, logging what was dropped or blanked. */
    public ColumnarPointTable convert (ClippedRaster clip, Layer layer, int band) {
        long start = System.currentTimeMillis();
        ColumnarPointTable table = toTable(clip, layer, band).materialize();
        if (table.nodataCount > 0) {
            LOG.warn("{}: {} nodata pixels {}", layer, table.nodataCount,
                    policy == NodataPolicy.SKIP ? "skipped" : "kept as NaN");
        }
        if (table.anomalyCount > 0) {
            LOG.warn("{}: {} values outside the plausible range {} to {} {} after conversion from {}, {}", layer,
                    table.anomalyCount, layer.property.plausibleMin, layer.property.plausibleMax,
                    layer.property.unit, layer.property.sourceUnit,
                    policy == NodataPolicy.SKIP ? "skipped" : "kept as NaN");
        }
        LOG.info("Converted {} to {} points ({}) in {}", layer, table.size(),
                Util.human(table.size() * 24.0, "B"), Util.elapsed(start));
        return table;
    }
}
