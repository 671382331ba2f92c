package com.residualcarbon.grids;

import com.residualcarbon.analysis.models.Layer;

import java.io.File;

/**
 * One discovered input raster file. The modification time is the one seen at discovery; the cache re-reads the file's
 * current time itself before trusting any artifact derived from it.
 */
public class RasterSource {

    /** File name without extension, e.g. "SOC_res_250_b0". */
    public final String datasetName;

    public final Layer layer;

    public final File file;

    public final long lastModified;

    /** Nominal resolution in meters parsed from the file name, or null when the name carries none. */
    public final Integer resolution;

    public RasterSource (String datasetName, Layer layer, File file, long lastModified, Integer resolution) {
        this.datasetName = datasetName;
        this.layer = layer;
        this.file = file;
        this.lastModified = lastModified;
        this.resolution = resolution;
    }

    public static RasterSource of (File file, Layer layer, Integer resolution) {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return new RasterSource(dot > 0 ? name.substring(0, dot) : name, layer, file, file.lastModified(), resolution);
    }

    public Raster read () throws java.io.IOException {
        return RasterReader.forFile(file).read(file);
    }

    @Override
    public String toString () {
        return String.format("[%s %s from %s]", layer, resolution == null ? "" : resolution + "m", file.getName());
    }
}
