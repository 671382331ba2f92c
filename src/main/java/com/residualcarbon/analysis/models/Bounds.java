package com.residualcarbon.analysis.models;

/**
 * A latitude/longitude bounding box in WGS84 degrees, used for the supported region.
 */
public class Bounds {
    public double north, east, south, west;

    /** Needed by Jackson. */
    public Bounds () { }

    public Bounds (double north, double east, double south, double west) {
        this.north = north;
        this.east = east;
        this.south = south;
        this.west = west;
    }

    /** Inclusive on all four edges. */
    public boolean contains (double lat, double lon) {
        return lat >= south && lat <= north && lon >= west && lon <= east;
    }

    public String describe () {
        return String.format("latitude %s to %s, longitude %s to %s", south, north, west, east);
    }

    @Override
    public boolean equals (Object other) {
        return equals(other, 0D);
    }

    public boolean equals (Object other, double tolerance) {
        if (!Bounds.class.isInstance(other)) return false;
        Bounds o = (Bounds) other;
        return Math.abs(north - o.north) <= tolerance && Math.abs(east - o.east) <= tolerance &&
                Math.abs(south - o.south) <= tolerance && Math.abs(west - o.west) <= tolerance;
    }

    @Override
    public int hashCode () {
        return java.util.Objects.hash(north, east, south, west);
    }

    @Override
    public String toString () {
        return "[Bounds " + describe() + "]";
    }
}
