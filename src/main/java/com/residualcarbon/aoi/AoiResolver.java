package com.residualcarbon.aoi;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.AoiRequest;
import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Bounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an optional (lat, lon, radius) request into an AreaOfInterest. Invalid input is always rejected with an
 * explanation; nothing is clamped into range.
 */
public class AoiResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AoiResolver.class);

    public interface Config {
        /** The bounding box that circle centers must fall in. */
        Bounds region ();
        double defaultRadiusKm ();
        double maxRadiusKm ();
    }

    private final Config config;

    public AoiResolver (Config config) {
        this.config = config;
    }

    public AreaOfInterest resolve (AoiRequest request) {
        return resolve(request.lat, request.lon, request.radiusKm);
    }

    public AreaOfInterest resolve (Double lat, Double lon, Double radiusKm) {
        if (lat == null && lon == null) {
            if (radiusKm != null) {
                LOG.warn("Radius {} km supplied without a center, using the full extent.", radiusKm);
            }
            return AreaOfInterest.fullExtent();
        }
        if (lat == null || lon == null) {
            throw PipelineException.invalidCoordinate("Latitude and longitude must be supplied together.");
        }
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw PipelineException.invalidCoordinate(String.format("Latitude %s is outside [-90, 90].", lat));
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw PipelineException.invalidCoordinate(String.format("Longitude %s is outside [-180, 180].", lon));
        }
        Bounds region = config.region();
        if (!region.contains(lat, lon)) {
            throw PipelineException.outOfRegion(String.format("Point (%s, %s) is outside the supported region %s.",
                    lat, lon, region.describe()));
        }
        double radius = radiusKm == null ? config.defaultRadiusKm() : radiusKm;
        if (Double.isNaN(radius) || AreaOfInterest.roundRadius(radius) <= 0) {
            throw PipelineException.invalidCoordinate(String.format(
                    "Radius %s km must be at least 0.01 km.", radius));
        }
        if (radius > config.maxRadiusKm()) {
            throw PipelineException.invalidCoordinate(String.format("Radius %s km exceeds the maximum of %s km.",
                    radius, config.maxRadiusKm()));
        }
        AreaOfInterest aoi = AreaOfInterest.circle(lat, lon, radius);
        LOG.info("Resolved area of interest {}", aoi.descriptor());
        return aoi;
    }
}
