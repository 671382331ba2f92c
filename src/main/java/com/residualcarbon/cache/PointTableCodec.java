package com.residualcarbon.cache;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;
import com.residualcarbon.tables.ColumnarPointTable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/** Point tables column by column: all longitudes, then all latitudes, then all values. */
public class PointTableCodec implements ArtifactCodec<ColumnarPointTable> {

    @Override
    public void write (ColumnarPointTable table, DataOutput out) throws IOException {
        CodecSupport.writeLayer(table.layer, out);
        CodecSupport.writeCoverage(table.coverage, out);
        out.writeLong(table.nodataCount);
        out.writeLong(table.anomalyCount);
        out.writeInt(table.size());
        CodecSupport.writeDoubles(table.lon, out);
        CodecSupport.writeDoubles(table.lat, out);
        CodecSupport.writeDoubles(table.value, out);
    }

    @Override
    public ColumnarPointTable read (DataInput in) throws IOException {
        Layer layer = CodecSupport.readLayer(in);
        CoverageReport coverage = CodecSupport.readCoverage(in);
        long nodataCount = in.readLong();
        long anomalyCount = in.readLong();
        int n = CodecSupport.readLength(in);
        double[] lon = CodecSupport.readDoubles(n, in);
        double[] lat = CodecSupport.readDoubles(n, in);
        double[] value = CodecSupport.readDoubles(n, in);
        return new ColumnarPointTable(layer, coverage, lon, lat, value, nodataCount, anomalyCount);
    }
}
