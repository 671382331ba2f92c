package com.residualcarbon.results;

import com.csvreader.CsvWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.hex.HexAggregate;
import com.residualcarbon.util.JsonUtil;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Writes the aggregated hex table for the mapping layer, as CSV with WKT boundaries and as a GeoJSON feature
 * collection. Rows follow the order of the list, which the aggregator sorts by cell id, so output is reproducible.
 */
public class HexTableWriter {

    private static final Logger LOG = LoggerFactory.getLogger(HexTableWriter.class);

    public void writeCsv (List<HexAggregate> hexes, File file) throws IOException {
        List<Layer> layers = layersIn(hexes);
        List<String> header = new ArrayList<>();
        header.add("cell_id");
        header.add("lon");
        header.add("lat");
        header.add("point_count");
        for (Layer layer : layers) header.add(layer.name());
        header.add("boundary");

        WKTWriter wkt = new WKTWriter();
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
            CsvWriter csv = new CsvWriter(writer, ',');
            csv.writeRecord(header.toArray(new String[0]));
            for (HexAggregate hex : hexes) {
                List<String> row = new ArrayList<>(header.size());
                row.add(hex.address);
                row.add(String.valueOf(hex.centerLon));
                row.add(String.valueOf(hex.centerLat));
                row.add(String.valueOf(hex.pointCount));
                for (Layer layer : layers) {
                    Double mean = hex.means.get(layer);
                    row.add(mean == null ? "" : String.valueOf(mean));
                }
                row.add(hex.boundary == null ? "" : wkt.write(hex.boundary));
                csv.writeRecord(row.toArray(new String[0]));
            }
            csv.flush();
        }
        LOG.info("Wrote {} hexes to {}", hexes.size(), file);
    }

    public void writeGeoJson (List<HexAggregate> hexes, File file) throws IOException {
        ObjectNode collection = JsonUtil.objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");
        for (HexAggregate hex : hexes) {
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");
            if (hex.boundary == null) {
                feature.putNull("geometry");
            } else {
                ObjectNode geometry = feature.putObject("geometry");
                geometry.put("type", "Polygon");
                ArrayNode ring = geometry.putArray("coordinates").addArray();
                for (Coordinate c : hex.boundary.getExteriorRing().getCoordinates()) {
                    ring.addArray().add(c.x).add(c.y);
                }
            }
            ObjectNode properties = feature.putObject("properties");
            properties.put("cell_id", hex.address);
            properties.put("lon", hex.centerLon);
            properties.put("lat", hex.centerLat);
            properties.put("point_count", hex.pointCount);
            hex.means.forEach((layer, mean) -> properties.put(layer.name(), mean));
        }
        try (OutputStream os = new FileOutputStream(file)) {
            JsonUtil.objectMapper.writeValue(os, collection);
        }
        LOG.info("Wrote {} hex features to {}", hexes.size(), file);
    }

    private static List<Layer> layersIn (List<HexAggregate> hexes) {
        SortedSet<Layer> layers = new TreeSet<>();
        for (HexAggregate hex : hexes) layers.addAll(hex.means.keySet());
        return new ArrayList<>(layers);
    }
}
