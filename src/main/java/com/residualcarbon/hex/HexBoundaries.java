package com.residualcarbon.hex;

import com.uber.h3core.util.LatLng;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds hex boundary polygons on demand. Meant to be applied to an aggregated cell list, never to points, so the
 * number of polygons built equals the number of cells.
 */
public class HexBoundaries {

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    private final AtomicLong polygonsBuilt = new AtomicLong();

    /** The cell outline as a closed lon/lat ring. */
    public Polygon boundaryOf (long cell) {
        List<LatLng> vertices = HexGrid.H3.cellToBoundary(cell);
        Coordinate[] ring = new Coordinate[vertices.size() + 1];
        for (int i = 0; i < vertices.size(); i++) {
            ring[i] = new Coordinate(vertices.get(i).lng, vertices.get(i).lat);
        }
        ring[vertices.size()] = new Coordinate(ring[0]);
        polygonsBuilt.incrementAndGet();
        return geometryFactory.createPolygon(ring);
    }

    public List<HexAggregate> attach (List<HexAggregate> aggregates) {
        List<HexAggregate> result = new ArrayList<>(aggregates.size());
        for (HexAggregate aggregate : aggregates) {
            result.add(aggregate.boundary != null ? aggregate : aggregate.withBoundary(boundaryOf(aggregate.cellId)));
        }
        return result;
    }

    public long polygonsBuilt () {
        return polygonsBuilt.get();
    }
}
