package com.residualcarbon.grids;

import com.residualcarbon.analysis.PipelineException;

import java.io.File;
import java.io.IOException;

/**
 * Reads a raster file into memory. Implementations are stateless and may be shared between threads.
 */
public abstract class RasterReader {

    private static final RasterReader GEOTIFF = new GeoTiffRasterReader();
    private static final RasterReader ASCII_GRID = new AsciiGridRasterReader();

    public abstract Raster read (File file) throws IOException;

    public static boolean isSupported (File file) {
        String name = file.getName().toLowerCase();
        return name.endsWith(".tif") || name.endsWith(".tiff") || name.endsWith(".asc");
    }

    public static RasterReader forFile (File file) {
        String name = file.getName().toLowerCase();
        if (name.endsWith(".tif") || name.endsWith(".tiff")) return GEOTIFF;
        if (name.endsWith(".asc")) return ASCII_GRID;
        throw PipelineException.rasterFormat("Unsupported raster file type: " + file.getName());
    }
}
