package com.residualcarbon.hex;

import com.google.common.collect.ImmutableSortedMap;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.SoilProperty;
import org.locationtech.jts.geom.Polygon;

import java.util.Map;
import java.util.SortedMap;

/**
 * One surviving hex cell: how many points fell in it and the mean of each layer over those points. The boundary is
 * left null by aggregation and filled in afterward by {@link HexBoundaries}.
 */
public class HexAggregate {

    public final long cellId;
    public final String address;
    public final double centerLat;
    public final double centerLon;

    /** Distinct point locations in the cell, across all layers. Always at least one. */
    public final int pointCount;

    /** Only layers with at least one point in this cell appear here. */
    public final SortedMap<Layer, Double> means;

    public final Polygon boundary;

    public HexAggregate (long cellId, String address, double centerLat, double centerLon, int pointCount,
                         Map<Layer, Double> means, Polygon boundary) {
        this.cellId = cellId;
        this.address = address;
        this.centerLat = centerLat;
        this.centerLon = centerLon;
        this.pointCount = pointCount;
        this.means = ImmutableSortedMap.copyOf(means);
        this.boundary = boundary;
    }

    public HexAggregate withBoundary (Polygon boundary) {
        return new HexAggregate(cellId, address, centerLat, centerLon, pointCount, means, boundary);
    }

    public boolean hasProperty (SoilProperty property) {
        for (Layer layer : means.keySet()) {
            if (layer.property == property) return true;
        }
        return false;
    }

    @Override
    public String toString () {
        return String.format("[Hex %s, %d points, %s]", address, pointCount, means);
    }
}
