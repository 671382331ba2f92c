package com.residualcarbon.grids;

import com.residualcarbon.analysis.PipelineException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads single-band ESRI ASCII grids. The format has no CRS of its own, so coordinates are taken to be WGS84 degrees.
 *
 * <pre>
 * ncols        4
 * nrows        3
 * xllcorner    -56.0
 * yllcorner    -13.0
 * cellsize     0.01
 * NODATA_value -9999
 * 1 2 3 4
 * ...
 * </pre>
 */
public class AsciiGridRasterReader extends RasterReader {

    @Override
    public Raster read (File file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.US_ASCII)) {
            Map<String, String> header = new HashMap<>();
            String line;
            String firstDataLine = null;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) continue;
                if (!Character.isLetter(trimmed.charAt(0))) {
                    firstDataLine = trimmed;
                    break;
                }
                String[] parts = trimmed.split("\\s+");
                if (parts.length != 2) throw PipelineException.rasterFormat("Malformed header line in " + file + ": " + line);
                header.put(parts[0].toLowerCase(), parts[1]);
            }

            int width = Integer.parseInt(required(header, "ncols", file));
            int height = Integer.parseInt(required(header, "nrows", file));
            double cellSize = Double.parseDouble(required(header, "cellsize", file));
            double west;
            double south;
            if (header.containsKey("xllcenter")) {
                west = Double.parseDouble(header.get("xllcenter")) - cellSize / 2;
                south = Double.parseDouble(required(header, "yllcenter", file)) - cellSize / 2;
            } else {
                west = Double.parseDouble(required(header, "xllcorner", file));
                south = Double.parseDouble(required(header, "yllcorner", file));
            }
            double nodata = header.containsKey("nodata_value") ? Double.parseDouble(header.get("nodata_value")) : Double.NaN;

            float[] values = new float[width * height];
            int i = 0;
            line = firstDataLine;
            while (line != null) {
                for (String token : line.trim().split("\\s+")) {
                    if (token.isEmpty()) continue;
                    if (i >= values.length) throw PipelineException.rasterFormat("Too many values in " + file);
                    values[i++] = Float.parseFloat(token);
                }
                line = reader.readLine();
            }
            if (i != values.length) {
                throw PipelineException.rasterFormat(String.format("Expected %d values in %s, found %d", values.length, file, i));
            }
            return new Raster(width, height, west, south + height * cellSize, cellSize, cellSize,
                    Projections.WGS84, nodata, new float[][] { values });
        } catch (NumberFormatException e) {
            throw new PipelineException(PipelineException.TYPE.RASTER_FORMAT, PipelineException.Stage.CLIP,
                    "Unreadable number in " + file, e);
        }
    }

    private static String required (Map<String, String> header, String key, File file) {
        String value = header.get(key);
        if (value == null) throw PipelineException.rasterFormat("ASCII grid " + file + " has no " + key + " header");
        return value;
    }
}
