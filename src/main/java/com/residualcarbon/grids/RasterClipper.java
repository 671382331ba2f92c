package com.residualcarbon.grids;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.AreaOfInterest;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restricts a raster to an area of interest. A pixel belongs to the circle when its center lies inside or on the
 * circle polygon, evaluated in the raster's own CRS.
 *
 * The circle may run off the edge of the raster. That is expected for areas near the border of the data region, so it
 * is only reported in the coverage; the clip fails only when not a single valid pixel remains.
 */
public class RasterClipper {

    private static final Logger LOG = LoggerFactory.getLogger(RasterClipper.class);

    public ClippedRaster clip (Raster raster, AreaOfInterest aoi) {
        if (aoi.isFullExtent()) {
            return new ClippedRaster(raster, CoverageReport.fullExtent(raster));
        }

        Polygon circle = GeodesicCircle.inCrs(aoi.centerLat, aoi.centerLon, aoi.radiusKm, raster.crs);
        Envelope env = circle.getEnvelopeInternal();
        IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(circle);

        // Pixel window covering the circle on the raster's grid, extended indefinitely beyond the raster itself.
        long colMin = (long) Math.floor((env.getMinX() - raster.west) / raster.pixelWidth);
        long colMax = (long) Math.floor((env.getMaxX() - raster.west) / raster.pixelWidth);
        long rowMin = (long) Math.floor((raster.north - env.getMaxY()) / raster.pixelHeight);
        long rowMax = (long) Math.floor((raster.north - env.getMinY()) / raster.pixelHeight);

        // Part of the window that lies on the raster.
        int c0 = (int) Math.max(colMin, 0);
        int c1 = (int) Math.min(colMax, raster.width - 1);
        int r0 = (int) Math.max(rowMin, 0);
        int r1 = (int) Math.min(rowMax, raster.height - 1);

        long total = 0;
        long valid = 0;
        Raster clipped = null;
        if (c0 <= c1 && r0 <= r1) {
            int width = c1 - c0 + 1;
            int height = r1 - r0 + 1;
            float[][] bands = Raster.emptyBands(raster.bandCount(), width, height, raster.nodata);
            Coordinate center = new Coordinate();
            for (int row = r0; row <= r1; row++) {
                center.y = raster.pixelCenterY(row);
                for (int col = c0; col <= c1; col++) {
                    center.x = raster.pixelCenterX(col);
                    if (locator.locate(center) == Location.EXTERIOR) continue;
                    total++;
                    int target = (row - r0) * width + (col - c0);
                    for (int b = 0; b < bands.length; b++) {
                        bands[b][target] = raster.get(b, col, row);
                    }
                    if (!raster.isNodata(raster.get(0, col, row))) valid++;
                }
            }
            clipped = new Raster(width, height, raster.west + c0 * raster.pixelWidth,
                    raster.north - r0 * raster.pixelHeight, raster.pixelWidth, raster.pixelHeight,
                    raster.crs, raster.nodata, bands);
        }

        // Circle pixels falling outside the raster grid.
        long outside = 0;
        Coordinate center = new Coordinate();
        for (long row = rowMin; row <= rowMax; row++) {
            boolean rowOnRaster = row >= 0 && row < raster.height;
            center.y = raster.north - (row + 0.5) * raster.pixelHeight;
            for (long col = colMin; col <= colMax; col++) {
                if (rowOnRaster && col >= 0 && col < raster.width) continue;
                center.x = raster.west + (col + 0.5) * raster.pixelWidth;
                if (locator.locate(center) != Location.EXTERIOR) outside++;
            }
        }
        total += outside;

        CoverageReport coverage = CoverageReport.of(total, valid, outside > 0);
        if (valid == 0) {
            throw PipelineException.emptyClip(String.format("Area %s has no valid data in %s (%s).",
                    aoi.descriptor(), raster, coverage));
        }
        if (coverage.touchesBoundary) {
            LOG.warn("Area {} extends beyond the raster: {}", aoi.descriptor(), coverage);
        } else {
            LOG.info("Clipped {} to {}x{} window, {}", aoi.descriptor(), clipped.width, clipped.height, coverage);
        }
        return new ClippedRaster(clipped, coverage);
    }
}
