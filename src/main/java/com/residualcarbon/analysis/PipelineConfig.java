package com.residualcarbon.analysis;

import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Bounds;
import com.residualcarbon.aoi.AoiResolver;
import com.residualcarbon.cache.ContentAddressableCache;
import com.residualcarbon.scoring.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration for one pipeline deployment, read from a properties file. Every component declares the settings it
 * needs as a Config interface, and this class implements all of them, so components never see each other's settings.
 */
public class PipelineConfig implements
        SoilPipeline.Config,
        AoiResolver.Config,
        ContentAddressableCache.Config
{
    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PROPERTIES_FILE_NAME = "soil-pipeline.properties";

    protected Properties config = new Properties();
    protected Set<String> missingKeys = new LinkedHashSet<>();

    private final File rasterDirectory;
    private final String cacheDirectory;
    private final File outputDirectory;
    private final Bounds region;
    private final double defaultRadiusKm;
    private final double maxRadiusKm;
    private final int fullExtentHexResolution;
    private final int circleHexResolution;
    private final int workerThreads;
    private final int lowPointCountThreshold;
    private final Set<String> protectedAois;
    private final String thresholdsFile;

    public PipelineConfig () {
        this(PROPERTIES_FILE_NAME);
    }

    public PipelineConfig (String filename) {
        this(load(filename));
    }

    public PipelineConfig (Properties properties) {
        config.putAll(properties);
        // No defaults here; they belong in the example properties file.
        String rasterDirectory = getProperty("raster-directory", true);
        cacheDirectory = getProperty("cache-directory", true);
        String outputDirectory = getProperty("output-directory", true);
        String minLat = getProperty("region-min-lat", true);
        String maxLat = getProperty("region-max-lat", true);
        String minLon = getProperty("region-min-lon", true);
        String maxLon = getProperty("region-max-lon", true);
        String defaultRadius = getProperty("default-radius-km", true);
        String maxRadius = getProperty("max-radius-km", true);
        String fullExtentResolution = getProperty("full-extent-hex-resolution", true);
        String circleResolution = getProperty("circle-hex-resolution", true);
        String threads = getProperty("worker-threads", true);
        String lowPointCount = getProperty("low-point-count-threshold", true);
        String protectedList = getProperty("protected-aois", true);
        thresholdsFile = getProperty("thresholds-file", false);
        if (!missingKeys.isEmpty()) {
            LOG.error("You must provide these configuration properties: {}", String.join(", ", missingKeys));
            throw PipelineException.configuration("Missing configuration properties: " + String.join(", ", missingKeys));
        }

        try {
            this.rasterDirectory = new File(rasterDirectory);
            this.outputDirectory = new File(outputDirectory);
            region = new Bounds(Double.parseDouble(maxLat), Double.parseDouble(maxLon), Double.parseDouble(minLat),
                    Double.parseDouble(minLon));
            defaultRadiusKm = Double.parseDouble(defaultRadius);
            maxRadiusKm = Double.parseDouble(maxRadius);
            fullExtentHexResolution = Integer.parseInt(fullExtentResolution.trim());
            circleHexResolution = Integer.parseInt(circleResolution.trim());
            workerThreads = Integer.parseInt(threads.trim());
            lowPointCountThreshold = Integer.parseInt(lowPointCount.trim());
            Set<String> aois = new TreeSet<>();
            for (String aoi : protectedList.split(";")) {
                if (!aoi.trim().isEmpty()) aois.add(AreaOfInterest.parse(aoi).descriptor());
            }
            protectedAois = Collections.unmodifiableSet(aois);
        } catch (IllegalArgumentException e) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.CONFIGURE,
                    "Invalid configuration value: " + e.getMessage(), e);
        }
        if (region.south > region.north || region.west > region.east) {
            throw PipelineException.configuration("Region bounds are inverted: " + region.describe());
        }
        if (workerThreads < 1) throw PipelineException.configuration("worker-threads must be at least 1");
    }

    private static Properties load (String filename) {
        Properties properties = new Properties();
        try (InputStream is = new FileInputStream(filename)) {
            properties.load(is);
        } catch (Exception e) {
            String message = "Could not read config file " + filename;
            LOG.error(message);
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.CONFIGURE,
                    message, e);
        }
        return properties;
    }

    private String getProperty (String key, boolean require) {
        String value = config.getProperty(key);
        if (require && value == null) {
            LOG.error("Missing configuration option {}", key);
            missingKeys.add(key);
        }
        return value;
    }

    public File outputDirectory () {
        return outputDirectory;
    }

    // Implementations of the component Config interfaces.

    @Override public File rasterDirectory () { return rasterDirectory; }
    @Override public String cacheDirectory () { return cacheDirectory; }
    @Override public Bounds region () { return region; }
    @Override public double defaultRadiusKm () { return defaultRadiusKm; }
    @Override public double maxRadiusKm () { return maxRadiusKm; }
    @Override public int fullExtentHexResolution () { return fullExtentHexResolution; }
    @Override public int circleHexResolution () { return circleHexResolution; }
    @Override public int workerThreads () { return workerThreads; }
    @Override public int lowPointCountThreshold () { return lowPointCountThreshold; }
    @Override public Set<String> protectedAois () { return protectedAois; }

    @Override
    public ScoringConfig scoringConfig () {
        return thresholdsFile == null ? ScoringConfig.loadDefault() : ScoringConfig.load(new File(thresholdsFile));
    }

}
