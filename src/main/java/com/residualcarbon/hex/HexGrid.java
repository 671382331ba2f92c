package com.residualcarbon.hex;

import com.uber.h3core.H3Core;
import com.uber.h3core.util.LatLng;

import java.io.IOException;

/**
 * Access to the H3 hierarchical hexagonal grid. H3Core is thread-safe, so one instance serves the whole JVM.
 */
public abstract class HexGrid {

    public static final int MIN_RESOLUTION = 0;
    public static final int MAX_RESOLUTION = 15;

    static final H3Core H3;

    static {
        try {
            H3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    public static boolean isValidResolution (int resolution) {
        return resolution >= MIN_RESOLUTION && resolution <= MAX_RESOLUTION;
    }

    public static long cellOf (double lat, double lon, int resolution) {
        return H3.latLngToCell(lat, lon, resolution);
    }

    /** The hexadecimal address of a cell, as used by H3 tooling and map layers. */
    public static String address (long cell) {
        return H3.h3ToString(cell);
    }

    public static LatLng center (long cell) {
        return H3.cellToLatLng(cell);
    }

    public static int resolutionOf (long cell) {
        return H3.getResolution(cell);
    }
}
