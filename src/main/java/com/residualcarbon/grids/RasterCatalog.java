package com.residualcarbon.grids;

import com.google.common.collect.ImmutableList;
import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.SoilProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the soil property rasters in a directory and works out which layer each one holds from its file name.
 */
public class RasterCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(RasterCatalog.class);

    private static final Pattern DEPTH = Pattern.compile("(?:^|[^a-z0-9])(b\\d+)(?=$|[^a-z0-9])");
    private static final Pattern RESOLUTION = Pattern.compile("(?:^|[^a-z0-9])res[_-]?(\\d+)(?=$|[^a-z0-9])");

    /**
     * List the usable rasters in a directory, one per layer. When the same layer is present at several resolutions
     * only the finest is kept.
     * @return sources ordered by layer.
     */
    public static List<RasterSource> discover (File directory) {
        File[] files = directory.listFiles();
        if (files == null) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.DISCOVER,
                    "Raster directory " + directory + " does not exist or is not readable.");
        }
        Arrays.sort(files);
        Map<Layer, RasterSource> bestByLayer = new TreeMap<>();
        int ignored = 0;
        for (File file : files) {
            if (!file.isFile() || !RasterReader.isSupported(file)) continue;
            RasterSource source = classify(file);
            if (source == null) {
                LOG.info("Ignoring {}, its name matches no soil property.", file.getName());
                ignored++;
                continue;
            }
            RasterSource existing = bestByLayer.get(source.layer);
            if (existing == null || FINEST_FIRST.compare(source, existing) < 0) {
                if (existing != null) LOG.info("Using {} rather than coarser {}", source, existing);
                bestByLayer.put(source.layer, source);
            }
        }
        if (bestByLayer.isEmpty()) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.DISCOVER,
                    String.format("No soil property rasters found in %s (%d unrecognized files).", directory, ignored));
        }
        LOG.info("Discovered {} raster layers in {}: {}", bestByLayer.size(), directory, bestByLayer.keySet());
        return ImmutableList.copyOf(bestByLayer.values());
    }

    /** @return the source described by this file name, or null if it names no soil property. */
    public static RasterSource classify (File file) {
        SoilProperty property = SoilProperty.classify(file.getName());
        if (property == null) return null;
        String lower = file.getName().toLowerCase();
        int dot = lower.lastIndexOf('.');
        String stem = dot > 0 ? lower.substring(0, dot) : lower;
        Matcher depth = DEPTH.matcher(stem);
        Matcher resolution = RESOLUTION.matcher(stem);
        return RasterSource.of(file, new Layer(property, depth.find() ? depth.group(1) : null),
                resolution.find() ? Integer.valueOf(resolution.group(1)) : null);
    }

    /** Smaller resolution numbers first, files without a resolution tag last, then by name for a stable choice. */
    private static final Comparator<RasterSource> FINEST_FIRST = Comparator
            .comparing((RasterSource s) -> s.resolution, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(s -> s.file.getName());
}
