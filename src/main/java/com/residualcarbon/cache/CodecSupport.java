package com.residualcarbon.cache;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.CoverageReport;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/** Pieces shared by the artifact codecs. */
abstract class CodecSupport {

    static void writeLayer (Layer layer, DataOutput out) throws IOException {
        out.writeUTF(layer.name());
    }

    static Layer readLayer (DataInput in) throws IOException {
        try {
            return Layer.parse(in.readUTF());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown layer in cached artifact", e);
        }
    }

    static void writeCoverage (CoverageReport coverage, DataOutput out) throws IOException {
        out.writeLong(coverage.totalPixels);
        out.writeLong(coverage.validPixels);
        out.writeDouble(coverage.fractionValidPixels);
        out.writeBoolean(coverage.touchesBoundary);
    }

    static CoverageReport readCoverage (DataInput in) throws IOException {
        return new CoverageReport(in.readLong(), in.readLong(), in.readDouble(), in.readBoolean());
    }

    static void writeDoubles (double[] values, DataOutput out) throws IOException {
        for (double value : values) out.writeDouble(value);
    }

    static double[] readDoubles (int n, DataInput in) throws IOException {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = in.readDouble();
        return values;
    }

    /** Guard against allocating absurd arrays from a damaged length field. */
    static int readLength (DataInput in) throws IOException {
        int n = in.readInt();
        if (n < 0 || n > 200_000_000) throw new IOException("Implausible array length " + n);
        return n;
    }
}
