package com.residualcarbon.hex;

import com.residualcarbon.tables.ColumnarPointTable;
import com.residualcarbon.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Assigns every point of a table to the hex cell containing it. Works column-wise over primitive arrays in two tight
 * loops (filter, then index) so that hundreds of thousands of points are indexed without per-row objects.
 */
public class HexIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(HexIndexer.class);

    public IndexedPoints index (ColumnarPointTable table, int resolution) {
        checkArgument(HexGrid.isValidResolution(resolution), "Hex resolution must be between %s and %s, got %s",
                HexGrid.MIN_RESOLUTION, HexGrid.MAX_RESOLUTION, resolution);
        long start = System.currentTimeMillis();
        int n = table.size();

        // Pass 1: mark the rows that can be indexed.
        boolean[] keep = new boolean[n];
        int kept = 0;
        long badCoordinates = 0;
        long badValues = 0;
        for (int i = 0; i < n; i++) {
            double lon = table.lon[i];
            double lat = table.lat[i];
            if (!(lat >= -90 && lat <= 90 && lon >= -180 && lon <= 180)) {
                badCoordinates++;
            } else if (Double.isNaN(table.value[i])) {
                badValues++;
            } else {
                keep[i] = true;
                kept++;
            }
        }

        // Pass 2: copy the kept rows and index them.
        double[] lons = new double[kept];
        double[] lats = new double[kept];
        double[] values = new double[kept];
        long[] cells = new long[kept];
        for (int i = 0, j = 0; i < n; i++) {
            if (!keep[i]) continue;
            lons[j] = table.lon[i];
            lats[j] = table.lat[i];
            values[j] = table.value[i];
            cells[j] = HexGrid.cellOf(lats[j], lons[j], resolution);
            j++;
        }

        if (badCoordinates > 0) {
            LOG.warn("{}: filtered {} rows with invalid coordinates before indexing", table.layer, badCoordinates);
        }
        if (badValues > 0) {
            LOG.info("{}: filtered {} rows with NaN values before indexing", table.layer, badValues);
        }
        LOG.info("Indexed {} points of {} at resolution {} in {}", kept, table.layer, resolution, Util.elapsed(start));
        return new IndexedPoints(table.layer, resolution, lons, lats, values, cells, badCoordinates, badValues,
                table.coverage);
    }
}
