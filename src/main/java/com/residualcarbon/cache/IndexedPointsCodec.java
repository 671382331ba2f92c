package com.residualcarbon.cache;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;
import com.residualcarbon.hex.IndexedPoints;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/** Indexed points column by column, with the cell id column last. */
public class IndexedPointsCodec implements ArtifactCodec<IndexedPoints> {

    @Override
    public void write (IndexedPoints points, DataOutput out) throws IOException {
        CodecSupport.writeLayer(points.layer, out);
        out.writeInt(points.resolution);
        CodecSupport.writeCoverage(points.coverage, out);
        out.writeLong(points.filteredCoordinates);
        out.writeLong(points.filteredValues);
        out.writeInt(points.size());
        CodecSupport.writeDoubles(points.lon, out);
        CodecSupport.writeDoubles(points.lat, out);
        CodecSupport.writeDoubles(points.value, out);
        for (long cell : points.cells) out.writeLong(cell);
    }

    @Override
    public IndexedPoints read (DataInput in) throws IOException {
        Layer layer = CodecSupport.readLayer(in);
        int resolution = in.readInt();
        CoverageReport coverage = CodecSupport.readCoverage(in);
        long filteredCoordinates = in.readLong();
        long filteredValues = in.readLong();
        int n = CodecSupport.readLength(in);
        double[] lon = CodecSupport.readDoubles(n, in);
        double[] lat = CodecSupport.readDoubles(n, in);
        double[] value = CodecSupport.readDoubles(n, in);
        long[] cells = new long[n];
        for (int i = 0; i < n; i++) cells[i] = in.readLong();
        return new IndexedPoints(layer, resolution, lon, lat, value, cells, filteredCoordinates, filteredValues,
                coverage);
    }
}
