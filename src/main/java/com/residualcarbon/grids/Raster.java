package com.residualcarbon.grids;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An in-memory north-up raster: one or more bands of float samples on a regular grid in some coordinate reference
 * system. Pixel (0, 0) is the north-west corner. Values are never modified once the raster has been built.
 */
public class Raster {

    public final int width;
    public final int height;

    /** X coordinate of the western edge of the first column, in raster CRS units. */
    public final double west;

    /** Y coordinate of the northern edge of the first row, in raster CRS units. */
    public final double north;

    public final double pixelWidth;
    public final double pixelHeight;

    /** CRS as "EPSG:nnnn" or a PROJ.4 parameter string. */
    public final String crs;

    /** The sentinel for missing data, or NaN when the raster declares none. NaN samples always count as nodata. */
    public final double nodata;

    /** Samples per band in row-major order, index = row * width + col. */
    final float[][] bands;

    public Raster (int width, int height, double west, double north, double pixelWidth, double pixelHeight,
                   String crs, double nodata, float[][] bands) {
        checkArgument(width > 0 && height > 0, "Raster must have at least one pixel, got %sx%s", width, height);
        checkArgument(pixelWidth > 0 && pixelHeight > 0, "Pixel size must be positive");
        checkArgument(bands.length > 0, "Raster must have at least one band");
        for (float[] band : bands) {
            checkArgument(band.length == width * height, "Band length %s does not match %sx%s", band.length, width, height);
        }
        this.width = width;
        this.height = height;
        this.west = west;
        this.north = north;
        this.pixelWidth = pixelWidth;
        this.pixelHeight = pixelHeight;
        this.crs = crs;
        this.nodata = nodata;
        this.bands = bands;
    }

    /** Make a raster of the same georeferencing with every pixel set to nodata, for clipping into. */
    public static float[][] emptyBands (int nBands, int width, int height, double nodata) {
        float[][] bands = new float[nBands][width * height];
        for (float[] band : bands) Arrays.fill(band, (float) nodata);
        return bands;
    }

    public int bandCount () {
        return bands.length;
    }

    public int pixelCount () {
        return width * height;
    }

    public float get (int band, int col, int row) {
        return bands[band][row * width + col];
    }

    public float get (int band, int index) {
        return bands[band][index];
    }

    public boolean isNodata (float value) {
        return Float.isNaN(value) || (!Double.isNaN(nodata) && value == (float) nodata);
    }

    public double pixelCenterX (int col) {
        return west + (col + 0.5) * pixelWidth;
    }

    public double pixelCenterY (int row) {
        return north - (row + 0.5) * pixelHeight;
    }

    public double east () {
        return west + width * pixelWidth;
    }

    /** Count pixels in a band holding real data. */
    public int countValid (int band) {
        int valid = 0;
        for (float v : bands[band]) {
            if (!isNodata(v)) valid++;
        }
        return valid;
    }

    @Override
    public String toString () {
        return String.format("[Raster %dx%d, %d band(s), origin (%f, %f), pixel %fx%f, %s]",
                width, height, bands.length, west, north, pixelWidth, pixelHeight, crs);
    }
}
