package com.residualcarbon.cache;

import com.residualcarbon.grids.ClippedRaster;
import com.residualcarbon.grids.CoverageReport;
import com.residualcarbon.grids.Raster;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Clipped rasters as a header (size, georeferencing, CRS, nodata), the coverage report, then each band's samples in
 * row-major order.
 */
public class ClippedRasterCodec implements ArtifactCodec<ClippedRaster> {

    @Override
    public void write (ClippedRaster clip, DataOutput out) throws IOException {
        Raster raster = clip.raster;
        out.writeInt(raster.width);
        out.writeInt(raster.height);
        out.writeInt(raster.bandCount());
        out.writeDouble(raster.west);
        out.writeDouble(raster.north);
        out.writeDouble(raster.pixelWidth);
        out.writeDouble(raster.pixelHeight);
        out.writeUTF(raster.crs);
        out.writeDouble(raster.nodata);
        CodecSupport.writeCoverage(clip.coverage, out);
        for (int b = 0; b < raster.bandCount(); b++) {
            for (int i = 0; i < raster.pixelCount(); i++) out.writeFloat(raster.get(b, i));
        }
    }

    @Override
    public ClippedRaster read (DataInput in) throws IOException {
        int width = CodecSupport.readLength(in);
        int height = CodecSupport.readLength(in);
        int bandCount = CodecSupport.readLength(in);
        double west = in.readDouble();
        double north = in.readDouble();
        double pixelWidth = in.readDouble();
        double pixelHeight = in.readDouble();
        String crs = in.readUTF();
        double nodata = in.readDouble();
        CoverageReport coverage = CodecSupport.readCoverage(in);
        float[][] bands = new float[bandCount][width * height];
        for (float[] band : bands) {
            for (int i = 0; i < band.length; i++) band[i] = in.readFloat();
        }
        return new ClippedRaster(new Raster(width, height, west, north, pixelWidth, pixelHeight, crs, nodata, bands),
                coverage);
    }
}
