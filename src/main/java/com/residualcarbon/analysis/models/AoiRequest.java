package com.residualcarbon.analysis.models;

/**
 * An area-of-interest request as sent by a command line or web front end. Every field is optional: no coordinates
 * means the full extent, no radius means the configured default, no resolution means the default for the area type.
 */
public class AoiRequest {
    public Double lat;
    public Double lon;
    public Double radiusKm;
    public Integer hexResolution;

    public static AoiRequest fullExtent () {
        return new AoiRequest();
    }

    public static AoiRequest circle (double lat, double lon, double radiusKm) {
        AoiRequest request = new AoiRequest();
        request.lat = lat;
        request.lon = lon;
        request.radiusKm = radiusKm;
        return request;
    }

    public AoiRequest withHexResolution (int hexResolution) {
        this.hexResolution = hexResolution;
        return this;
    }
}
