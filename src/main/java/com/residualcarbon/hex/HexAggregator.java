package com.residualcarbon.hex;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.util.Util;
import com.uber.h3core.util.LatLng;
import gnu.trove.map.hash.TLongIntHashMap;
import gnu.trove.set.hash.TLongHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the indexed points of several layers on hex cell id and reduces each cell to per-layer means. No geometry is
 * built here: cells are plain long ids until the final list is handed to {@link HexBoundaries}.
 */
public class HexAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(HexAggregator.class);

    public List<HexAggregate> aggregate (List<IndexedPoints> inputs) {
        if (inputs.isEmpty()) return new ArrayList<>();
        long start = System.currentTimeMillis();
        int resolution = inputs.get(0).resolution;
        for (IndexedPoints points : inputs) {
            if (points.resolution != resolution) {
                throw new IllegalArgumentException(String.format("Cannot merge %s at resolution %d with %s at %d",
                        points.layer, points.resolution, inputs.get(0).layer, resolution));
            }
        }

        // Dense index for every cell that received at least one point, in ascending id order.
        TLongHashSet cellSet = new TLongHashSet();
        for (IndexedPoints points : inputs) cellSet.addAll(points.cells);
        long[] cells = cellSet.toArray();
        Arrays.sort(cells);
        TLongIntHashMap cellIndex = new TLongIntHashMap(cells.length * 2, 0.5f, -1L, -1);
        for (int i = 0; i < cells.length; i++) cellIndex.put(cells[i], i);

        // Layers sharing a pixel grid put several values at the same location; that location is one point.
        int[] pointCounts = new int[cells.length];
        TLongHashSet seenLocations = new TLongHashSet();
        List<Layer> layers = new ArrayList<>();
        Map<Layer, double[]> sums = new HashMap<>();
        Map<Layer, int[]> counts = new HashMap<>();
        for (IndexedPoints points : inputs) {
            double[] sum = sums.computeIfAbsent(points.layer, l -> new double[cells.length]);
            int[] count = counts.computeIfAbsent(points.layer, l -> new int[cells.length]);
            if (!layers.contains(points.layer)) layers.add(points.layer);
            for (int i = 0; i < points.size(); i++) {
                int c = cellIndex.get(points.cells[i]);
                sum[c] += points.value[i];
                count[c]++;
                if (seenLocations.add(locationKey(points.lon[i], points.lat[i]))) pointCounts[c]++;
            }
        }
        layers.sort(Comparator.naturalOrder());

        List<HexAggregate> aggregates = new ArrayList<>(cells.length);
        for (int c = 0; c < cells.length; c++) {
            Map<Layer, Double> means = new HashMap<>();
            for (Layer layer : layers) {
                int n = counts.get(layer)[c];
                if (n > 0) means.put(layer, sums.get(layer)[c] / n);
            }
            LatLng center = HexGrid.center(cells[c]);
            aggregates.add(new HexAggregate(cells[c], HexGrid.address(cells[c]), center.lat, center.lng,
                    pointCounts[c], means, null));
        }
        LOG.info("Aggregated {} distinct points from {} layer(s) into {} hex cells at resolution {} in {}",
                seenLocations.size(), layers.size(), aggregates.size(), resolution, Util.elapsed(start));
        return aggregates;
    }

    /** Pack a location rounded to 1e-6 degrees into one long. */
    static long locationKey (double lon, double lat) {
        long x = Math.round(lon * 1e6) + 180_000_000L;
        long y = Math.round(lat * 1e6) + 90_000_000L;
        return (x << 32) | y;
    }
}
