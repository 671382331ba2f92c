package com.residualcarbon.tables;

import java.util.Objects;

/** The value of one property at one pixel center, in WGS84 degrees and normalized units. */
public class PointRecord {
    public final double lon;
    public final double lat;
    public final double value;
    public final String unit;

    public PointRecord (double lon, double lat, double value, String unit) {
        this.lon = lon;
        this.lat = lat;
        this.value = value;
        this.unit = unit;
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof PointRecord)) return false;
        PointRecord o = (PointRecord) other;
        return Double.compare(lon, o.lon) == 0 && Double.compare(lat, o.lat) == 0 &&
                Double.compare(value, o.value) == 0 && Objects.equals(unit, o.unit);
    }

    @Override
    public int hashCode () {
        return Objects.hash(lon, lat, value, unit);
    }

    @Override
    public String toString () {
        return String.format("(%f, %f) %f %s", lon, lat, value, unit);
    }
}
