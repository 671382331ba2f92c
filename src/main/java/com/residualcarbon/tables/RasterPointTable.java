package com.residualcarbon.tables;

import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.grids.ClippedRaster;
import com.residualcarbon.grids.Projections;
import com.residualcarbon.grids.Raster;
import gnu.trove.list.array.TDoubleArrayList;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A point table read lazily from a raster band, one pixel at a time. Nothing but the raster itself is held in memory,
 * and every call to iterator() starts a fresh pass over the pixels.
 */
public class RasterPointTable extends PointTable {

    private final Raster raster;
    private final int band;
    private final NodataPolicy policy;
    private final boolean geographic;

    public RasterPointTable (ClippedRaster clip, Layer layer, int band, NodataPolicy policy) {
        super(layer, clip.coverage);
        if (band < 0 || band >= clip.raster.bandCount()) {
            throw new IllegalArgumentException(String.format("Band %d requested from a raster with %d band(s)",
                    band, clip.raster.bandCount()));
        }
        this.raster = clip.raster;
        this.band = band;
        this.policy = policy;
        this.geographic = Projections.isGeographic(raster.crs);
    }

    @Override
    public Iterator<PointRecord> iterator () {
        return new Cursor();
    }

    @Override
    public ColumnarPointTable materialize () {
        TDoubleArrayList lons = new TDoubleArrayList();
        TDoubleArrayList lats = new TDoubleArrayList();
        TDoubleArrayList values = new TDoubleArrayList();
        Cursor cursor = new Cursor();
        while (cursor.hasNext()) {
            PointRecord record = cursor.next();
            lons.add(record.lon);
            lats.add(record.lat);
            values.add(record.value);
        }
        return new ColumnarPointTable(layer, coverage, lons.toArray(), lats.toArray(), values.toArray(),
                cursor.nodata, cursor.anomalies);
    }

    /** One pass over the pixels. Counts what it skipped or blanked along the way. */
    class Cursor implements Iterator<PointRecord> {
        final String unit = unit();
        // Proj4J transforms keep scratch state, so each pass gets its own.
        final CoordinateTransform toWgs84 = geographic ? null : Projections.transform(raster.crs, Projections.WGS84);
        final ProjCoordinate src = new ProjCoordinate();
        final ProjCoordinate dst = new ProjCoordinate();
        int pixel = 0;
        long nodata = 0;
        long anomalies = 0;
        PointRecord pending;

        @Override
        public boolean hasNext () {
            while (pending == null && pixel < raster.pixelCount()) {
                pending = convert(pixel++);
            }
            return pending != null;
        }

        @Override
        public PointRecord next () {
            if (!hasNext()) throw new NoSuchElementException();
            PointRecord record = pending;
            pending = null;
            return record;
        }

        /** @return the record for this pixel, or null if the policy drops it. */
        private PointRecord convert (int index) {
            float raw = raster.get(band, index);
            double value;
            if (raster.isNodata(raw)) {
                nodata++;
                if (policy == NodataPolicy.SKIP) return null;
                value = Double.NaN;
            } else {
                value = layer.property.normalizeSample(raw);
                if (!layer.property.isPlausible(value)) {
                    anomalies++;
                    if (policy == NodataPolicy.SKIP) return null;
                    value = Double.NaN;
                }
            }
            double x = raster.pixelCenterX(index % raster.width);
            double y = raster.pixelCenterY(index / raster.width);
            if (toWgs84 != null) {
                src.x = x;
                src.y = y;
                toWgs84.transform(src, dst);
                x = dst.x;
                y = dst.y;
            }
            return new PointRecord(x, y, value, unit);
        }
    }
}
