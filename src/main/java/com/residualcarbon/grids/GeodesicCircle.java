package com.residualcarbon.grids;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Builds the polygon of all points within a given distance of a center on the WGS84 ellipsoid. The circle is drawn
 * in an azimuthal equidistant projection centered on the point, where it is exactly round, and its vertices are then
 * projected into the target CRS.
 */
public abstract class GeodesicCircle {

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    /** Segments per quarter circle; 32 keeps the chord error under 0.05% of the radius. */
    public static final int QUADRANT_SEGMENTS = 32;

    public static Polygon inCrs (double centerLat, double centerLon, double radiusKm, String targetCrs) {
        String aeqd = Projections.azimuthalEquidistant(centerLat, centerLon);
        Geometry planar = geometryFactory.createPoint(new Coordinate(0, 0)).buffer(radiusKm * 1000, QUADRANT_SEGMENTS);
        CoordinateTransform transform = Projections.transform(aeqd, targetCrs);
        Coordinate[] ring = planar.getCoordinates();
        Coordinate[] projected = new Coordinate[ring.length];
        ProjCoordinate src = new ProjCoordinate();
        ProjCoordinate dst = new ProjCoordinate();
        for (int i = 0; i < ring.length; i++) {
            src.x = ring[i].x;
            src.y = ring[i].y;
            transform.transform(src, dst);
            projected[i] = new Coordinate(dst.x, dst.y);
        }
        // Close exactly, floating point noise in the transform could otherwise open the ring.
        projected[projected.length - 1] = new Coordinate(projected[0]);
        return geometryFactory.createPolygon(projected);
    }
}
