package com.residualcarbon.grids;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.proj.LongLatProjection;

import java.util.Locale;

/**
 * Coordinate reference system lookup and transforms. CRS definitions are immutable and shared, but Proj4J transforms
 * hold scratch state, so a new transform must be made for each thread of work.
 */
public abstract class Projections {

    public static final String WGS84 = "EPSG:4326";

    private static final String WGS84_PARAMETERS = "+proj=longlat +datum=WGS84 +no_defs";

    private static final CRSFactory crsFactory = new CRSFactory();

    private static final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    /** Parsing EPSG definitions reads a resource file, so keep the handful used in a run. */
    private static final LoadingCache<String, CoordinateReferenceSystem> crsCache = CacheBuilder.newBuilder()
            .maximumSize(32)
            .build(new CacheLoader<String, CoordinateReferenceSystem>() {
                @Override
                public CoordinateReferenceSystem load (String name) {
                    if (WGS84.equalsIgnoreCase(name)) {
                        return crsFactory.createFromParameters(WGS84, WGS84_PARAMETERS);
                    }
                    if (name.startsWith("+")) {
                        return crsFactory.createFromParameters("custom", name);
                    }
                    return crsFactory.createFromName(name);
                }
            });

    public static CoordinateReferenceSystem crs (String name) {
        try {
            return crsCache.getUnchecked(name);
        } catch (UncheckedExecutionException e) {
            throw new IllegalArgumentException("Unsupported coordinate reference system " + name, e.getCause());
        }
    }

    public static CoordinateTransform transform (String from, String to) {
        return transformFactory.createTransform(crs(from), crs(to));
    }

    public static boolean isGeographic (String name) {
        return crs(name).getProjection() instanceof LongLatProjection;
    }

    /**
     * An azimuthal equidistant projection centered on the given point. Distances from the center are preserved, so a
     * planar circle in this projection is a geodesic circle on the ellipsoid.
     */
    public static String azimuthalEquidistant (double lat, double lon) {
        return String.format(Locale.ROOT, "+proj=aeqd +lat_0=%.8f +lon_0=%.8f +x_0=0 +y_0=0 +datum=WGS84 +units=m +no_defs",
                lat, lon);
    }
}
