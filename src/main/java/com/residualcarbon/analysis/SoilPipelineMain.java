package com.residualcarbon.analysis;

import com.residualcarbon.analysis.models.AoiRequest;
import com.residualcarbon.analysis.models.PipelineResult;
import com.residualcarbon.cache.ContentAddressableCache;
import com.residualcarbon.results.HexTableWriter;
import com.residualcarbon.results.ScoreTableWriter;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Command line entry point: runs the pipeline once and writes the hex and score tables to the output directory. When
 * scoring fails only the hex tables are written, and any score table left by an earlier run is removed.
 *
 * Usage: SoilPipelineMain [--config file] [--lat deg --lon deg] [--radius km] [--resolution n]
 */
public class SoilPipelineMain {

    private static final Logger LOG = LoggerFactory.getLogger(SoilPipelineMain.class);

    public static final String HEX_CSV = "hexes.csv";
    public static final String HEX_GEOJSON = "hexes.geojson";
    public static final String SCORES_CSV = "suitability_scores.csv";

    public static void main (String[] args) {
        try {
            System.exit(run(args));
        } catch (PipelineException e) {
            e.log();
            System.exit(1);
        }
    }

    /** @return the process exit code. */
    public static int run (String[] args) {
        String configFile = PipelineConfig.PROPERTIES_FILE_NAME;
        AoiRequest request = new AoiRequest();
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) throw PipelineException.configuration("Missing value after " + flag);
            String value = args[++i];
            try {
                switch (flag) {
                    case "--config": configFile = value; break;
                    case "--lat": request.lat = Double.parseDouble(value); break;
                    case "--lon": request.lon = Double.parseDouble(value); break;
                    case "--radius": request.radiusKm = Double.parseDouble(value); break;
                    case "--resolution": request.hexResolution = Integer.parseInt(value); break;
                    default: throw PipelineException.configuration("Unknown argument " + flag);
                }
            } catch (NumberFormatException e) {
                throw PipelineException.invalidCoordinate(String.format("Value '%s' for %s is not a number", value, flag));
            }
        }

        PipelineConfig config = new PipelineConfig(configFile);
        SoilPipeline pipeline = new SoilPipeline(config, new ContentAddressableCache(config));
        PipelineResult result = pipeline.run(request);
        try {
            writeOutputs(result, config.outputDirectory());
        } catch (IOException e) {
            throw PipelineException.unknown(PipelineException.Stage.OUTPUT,
                    "Cannot write outputs to " + config.outputDirectory(), e);
        }
        if (result.scoringError != null) {
            LOG.error("Hex table written, but scoring failed: {}", result.scoringError.describe());
            return 2;
        }
        if (result.partialCoverage) {
            LOG.warn("Area {} is only partly covered by the input rasters; scores are flagged.", result.aoi);
        }
        return 0;
    }

    public static void writeOutputs (PipelineResult result, File outputDirectory) throws IOException {
        FileUtils.forceMkdir(outputDirectory);
        HexTableWriter hexWriter = new HexTableWriter();
        hexWriter.writeCsv(result.hexes, new File(outputDirectory, HEX_CSV));
        hexWriter.writeGeoJson(result.hexes, new File(outputDirectory, HEX_GEOJSON));
        File scores = new File(outputDirectory, SCORES_CSV);
        if (result.scoring != null) {
            new ScoreTableWriter().writeCsv(result.scoring.scores, scores);
        } else if (scores.exists()) {
            // A score table from an earlier run must not sit next to hexes it was not computed from.
            LOG.info("Removing stale score table {}", scores);
            FileUtils.forceDelete(scores);
        }
    }
}
