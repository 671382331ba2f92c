package com.residualcarbon.tables;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A point table held in parallel primitive arrays, the form used for indexing and for the table cache.
 */
public class ColumnarPointTable extends PointTable {

    public final double[] lon;
    public final double[] lat;
    public final double[] value;

    /** Pixels that held nodata, whether they were skipped or kept as NaN. */
    public final long nodataCount;

    /** Pixels whose converted value fell outside the property's plausible range. */
    public final long anomalyCount;

    public ColumnarPointTable (Layer layer, CoverageReport coverage, double[] lon, double[] lat, double[] value,
                               long nodataCount, long anomalyCount) {
        super(layer, coverage);
        if (lon.length != lat.length || lon.length != value.length) {
            throw new IllegalArgumentException("Column lengths differ");
        }
        this.lon = lon;
        this.lat = lat;
        this.value = value;
        this.nodataCount = nodataCount;
        this.anomalyCount = anomalyCount;
    }

    public int size () {
        return value.length;
    }

    @Override
    public ColumnarPointTable materialize () {
        return this;
    }

    @Override
    public Iterator<PointRecord> iterator () {
        String unit = unit();
        return new Iterator<PointRecord>() {
            int i = 0;

            @Override
            public boolean hasNext () {
                return i < value.length;
            }

            @Override
            public PointRecord next () {
                if (i >= value.length) throw new NoSuchElementException();
                PointRecord record = new PointRecord(lon[i], lat[i], value[i], unit);
                i++;
                return record;
            }
        };
    }
}
