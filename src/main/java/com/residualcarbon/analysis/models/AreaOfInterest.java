package com.residualcarbon.analysis.models;

import com.residualcarbon.util.Util;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Either the full data extent or a geodesic circle around a center point. Created once per pipeline run and never
 * modified afterward. The descriptor string identifies the area in cache keys and in the protected-area list, so two
 * circles that agree to six decimal places in the center and two in the radius are the same area. Circles are
 * rounded to that precision when created, so the geometry that is clipped is always the one the descriptor names.
 */
public class AreaOfInterest {

    public static final String FULL_EXTENT_DESCRIPTOR = "full-extent";

    private static final AreaOfInterest FULL_EXTENT = new AreaOfInterest(false, Double.NaN, Double.NaN, Double.NaN);

    public final boolean circle;
    public final double centerLat;
    public final double centerLon;
    public final double radiusKm;

    private AreaOfInterest (boolean circle, double centerLat, double centerLon, double radiusKm) {
        this.circle = circle;
        this.centerLat = centerLat;
        this.centerLon = centerLon;
        this.radiusKm = radiusKm;
    }

    public static AreaOfInterest fullExtent () {
        return FULL_EXTENT;
    }

    /** Only checks the radius; range and region checks belong to the AoiResolver. */
    public static AreaOfInterest circle (double centerLat, double centerLon, double radiusKm) {
        double radius = roundRadius(radiusKm);
        checkArgument(radius > 0, "Radius must be at least 0.01 km, got %s km", radiusKm);
        return new AreaOfInterest(true, Util.round(centerLat, 6), Util.round(centerLon, 6), radius);
    }

    /** The radius as it will be stored, to the hundredth of a kilometer. */
    public static double roundRadius (double radiusKm) {
        return Util.round(radiusKm, 2);
    }

    /**
     * Parse the form used in configuration files: either "full-extent" or "lat,lon,radiusKm".
     */
    public static AreaOfInterest parse (String text) {
        String trimmed = text.trim();
        if (FULL_EXTENT_DESCRIPTOR.equalsIgnoreCase(trimmed)) return FULL_EXTENT;
        String[] parts = trimmed.split(",");
        checkArgument(parts.length == 3, "Area of interest must be 'full-extent' or 'lat,lon,radiusKm': %s", text);
        return circle(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()),
                Double.parseDouble(parts[2].trim()));
    }

    public boolean isFullExtent () {
        return !circle;
    }

    public String descriptor () {
        if (!circle) return FULL_EXTENT_DESCRIPTOR;
        return String.format(Locale.ROOT, "circle:%.6f,%.6f,%.2f", centerLat, centerLon, radiusKm);
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof AreaOfInterest)) return false;
        return descriptor().equals(((AreaOfInterest) other).descriptor());
    }

    @Override
    public int hashCode () {
        return descriptor().hashCode();
    }

    @Override
    public String toString () {
        return descriptor();
    }
}
