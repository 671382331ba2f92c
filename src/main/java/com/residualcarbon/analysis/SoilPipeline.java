package com.residualcarbon.analysis;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.residualcarbon.analysis.models.AoiRequest;
import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.PipelineResult;
import com.residualcarbon.aoi.AoiResolver;
import com.residualcarbon.cache.CacheFamily;
import com.residualcarbon.cache.CacheKey;
import com.residualcarbon.cache.ClippedRasterCodec;
import com.residualcarbon.cache.ContentAddressableCache;
import com.residualcarbon.cache.IndexedPointsCodec;
import com.residualcarbon.cache.PointTableCodec;
import com.residualcarbon.grids.ClippedRaster;
import com.residualcarbon.grids.CoverageReport;
import com.residualcarbon.grids.Raster;
import com.residualcarbon.grids.RasterCatalog;
import com.residualcarbon.grids.RasterClipper;
import com.residualcarbon.grids.RasterSource;
import com.residualcarbon.hex.HexAggregate;
import com.residualcarbon.hex.HexAggregator;
import com.residualcarbon.hex.HexBoundaries;
import com.residualcarbon.hex.HexGrid;
import com.residualcarbon.hex.HexIndexer;
import com.residualcarbon.hex.IndexedPoints;
import com.residualcarbon.scoring.ScoringConfig;
import com.residualcarbon.scoring.ScoringResult;
import com.residualcarbon.scoring.SuitabilityScorer;
import com.residualcarbon.tables.ColumnarPointTable;
import com.residualcarbon.tables.NodataPolicy;
import com.residualcarbon.tables.RasterTableConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs clip, convert and index for every discovered layer in parallel, waits for all of them, then aggregates,
 * attaches boundaries and scores. The three per-layer steps are each wrapped in the cache, nested so that a valid
 * hex index is returned without touching the raster at all.
 *
 * All run state lives in locals and in the result, so one pipeline can evaluate several areas concurrently.
 */
public class SoilPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SoilPipeline.class);

    public interface Config extends AoiResolver.Config {
        File rasterDirectory ();
        int workerThreads ();
        int fullExtentHexResolution ();
        int circleHexResolution ();
        /** Descriptors of areas whose cache entries the sweep keeps. */
        Set<String> protectedAois ();
        int lowPointCountThreshold ();
        ScoringConfig scoringConfig ();
    }

    /** Every layer is read from its first band. */
    static final int BAND = 0;

    private static final ClippedRasterCodec CLIP_CODEC = new ClippedRasterCodec();
    private static final PointTableCodec TABLE_CODEC = new PointTableCodec();
    private static final IndexedPointsCodec INDEX_CODEC = new IndexedPointsCodec();

    private final Config config;
    private final ContentAddressableCache cache;
    private final AoiResolver resolver;
    private final RasterClipper clipper = new RasterClipper();
    private final RasterTableConverter converter = new RasterTableConverter(NodataPolicy.SKIP);
    private final HexIndexer indexer = new HexIndexer();
    private final HexAggregator aggregator = new HexAggregator();
    private final SuitabilityScorer scorer;

    public SoilPipeline (Config config, ContentAddressableCache cache) {
        this.config = config;
        this.cache = cache;
        this.resolver = new AoiResolver(config);
        this.scorer = new SuitabilityScorer(config.scoringConfig(), config.lowPointCountThreshold());
    }

    public PipelineResult run (AoiRequest request) {
        long start = System.currentTimeMillis();
        long hitsBefore = cache.hits();
        long missesBefore = cache.misses();

        AreaOfInterest aoi = resolver.resolve(request);
        int resolution = request.hexResolution != null ? request.hexResolution
                : aoi.isFullExtent() ? config.fullExtentHexResolution() : config.circleHexResolution();
        if (!HexGrid.isValidResolution(resolution)) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.RESOLVE_AOI,
                    String.format("Hex resolution must be between %d and %d, got %d",
                            HexGrid.MIN_RESOLUTION, HexGrid.MAX_RESOLUTION, resolution));
        }
        LOG.info("Running soil pipeline for {} at hex resolution {}", aoi.descriptor(), resolution);

        Set<String> protectedAois = new TreeSet<>(config.protectedAois());
        protectedAois.add(AreaOfInterest.FULL_EXTENT_DESCRIPTOR);
        protectedAois.add(aoi.descriptor());
        cache.sweep(protectedAois);

        List<RasterSource> sources = RasterCatalog.discover(config.rasterDirectory());
        List<IndexedPoints> indexed = processLayers(sources, aoi, resolution);

        PipelineResult.Diagnostics diagnostics = new PipelineResult.Diagnostics();
        SortedMap<Layer, CoverageReport> coverage = new TreeMap<>();
        boolean partialCoverage = false;
        for (IndexedPoints points : indexed) {
            coverage.put(points.layer, points.coverage);
            partialCoverage |= points.coverage.touchesBoundary;
            diagnostics.pointsIndexed += points.size();
            diagnostics.filteredCoordinates += points.filteredCoordinates;
            diagnostics.filteredValues += points.filteredValues;
        }

        List<HexAggregate> aggregates;
        try {
            aggregates = aggregator.aggregate(indexed);
        } catch (RuntimeException e) {
            throw PipelineException.unknown(PipelineException.Stage.AGGREGATE,
                    e.getMessage(), e);
        }
        HexBoundaries boundaries = new HexBoundaries();
        List<HexAggregate> hexes = boundaries.attach(aggregates);
        diagnostics.boundaryPolygons = boundaries.polygonsBuilt();

        ScoringResult scoring = null;
        PipelineException scoringError = null;
        try {
            scoring = scorer.score(hexes, partialCoverage);
        } catch (PipelineException e) {
            if (e.type != PipelineException.TYPE.MISSING_REQUIRED_PROPERTY) throw e;
            // The hex table is still valid without scores.
            scoringError = e;
            e.log();
        }

        diagnostics.cacheHits = cache.hits() - hitsBefore;
        diagnostics.cacheMisses = cache.misses() - missesBefore;
        diagnostics.elapsedMillis = System.currentTimeMillis() - start;
        LOG.info("Pipeline finished for {}: {} hexes, {}", aoi.descriptor(), hexes.size(), diagnostics);
        return new PipelineResult(aoi, resolution, hexes, scoring, scoringError, coverage, partialCoverage, diagnostics);
    }

    /** Fan the layers out to a worker pool and wait for every one of them. */
    private List<IndexedPoints> processLayers (List<RasterSource> sources, AreaOfInterest aoi, int resolution) {
        int threads = Math.max(1, Math.min(config.workerThreads(), sources.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("soil-layer-%d").setDaemon(true).build());
        try {
            List<Future<IndexedPoints>> futures = new ArrayList<>();
            for (RasterSource source : sources) {
                futures.add(pool.submit(() -> processLayer(source, aoi, resolution)));
            }
            List<IndexedPoints> indexed = new ArrayList<>();
            for (Future<IndexedPoints> future : futures) {
                indexed.add(future.get());
            }
            return indexed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PipelineException.unknown(PipelineException.Stage.INDEX,
                    "Interrupted while waiting for layers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException) throw (PipelineException) cause;
            if (cause instanceof IOException) {
                throw PipelineException.unknown(PipelineException.Stage.CACHE,
                        cause.getMessage(), cause);
            }
            throw PipelineException.unknown(PipelineException.Stage.INDEX,
                    String.valueOf(cause), cause);
        } finally {
            // Stops the remaining layers if one failed; their partial results never reach the cache.
            pool.shutdownNow();
        }
    }

    IndexedPoints processLayer (RasterSource source, AreaOfInterest aoi, int resolution) throws IOException {
        Layer layer = source.layer;
        CacheKey hexKey = keyFor(CacheFamily.HEX_INDEX, "hex_index", source, aoi)
                .param("band", BAND)
                .param("nodata_policy", NodataPolicy.SKIP)
                .param("resolution", resolution)
                .build();
        CacheKey tableKey = keyFor(CacheFamily.TABLE, "to_table", source, aoi)
                .param("band", BAND)
                .param("nodata_policy", NodataPolicy.SKIP)
                .build();
        return cache.cached(hexKey, INDEX_CODEC, () -> {
            ColumnarPointTable table = cache.cached(tableKey, TABLE_CODEC,
                    () -> converter.convert(clip(source, aoi), layer, BAND));
            return indexer.index(table, resolution);
        });
    }

    /** The full extent is a pass-through of the source raster, so only circle clips are worth caching. */
    private ClippedRaster clip (RasterSource source, AreaOfInterest aoi) throws IOException {
        if (aoi.isFullExtent()) return clipper.clip(read(source), aoi);
        CacheKey clipKey = keyFor(CacheFamily.CLIP, "clip", source, aoi).build();
        return cache.cached(clipKey, CLIP_CODEC, () -> clipper.clip(read(source), aoi));
    }

    private static Raster read (RasterSource source) {
        try {
            return source.read();
        } catch (IOException e) {
            throw new PipelineException(PipelineException.TYPE.RASTER_FORMAT, PipelineException.Stage.CLIP,
                    "Cannot read raster " + source.file, e);
        }
    }

    private static CacheKey.Builder keyFor (CacheFamily family, String operation, RasterSource source,
                                            AreaOfInterest aoi) {
        return CacheKey.builder(family, operation)
                .source(source.file)
                .param(CacheKey.AOI_PARAM, aoi.descriptor())
                .param("layer", source.layer.name());
    }
}
