package com.residualcarbon.grids;

import com.residualcarbon.analysis.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

/**
 * Reads north-up GeoTIFFs through the TIFF plugin bundled with the JDK. Georeferencing comes from the
 * ModelPixelScale and ModelTiepoint tags, the CRS from the GeoKey directory and the nodata value from the GDAL_NODATA
 * tag. Rotated or sheared rasters (ModelTransformation) are not supported.
 */
public class GeoTiffRasterReader extends RasterReader {

    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffRasterReader.class);

    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_GEO_KEY_DIRECTORY = 34735;
    static final int TAG_GDAL_NODATA = 42113;

    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_CS_TYPE = 3072;
    static final int RASTER_PIXEL_IS_POINT = 2;
    static final int USER_DEFINED = 32767;

    @Override
    public Raster read (File file) throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
        if (!readers.hasNext()) throw new IOException("No TIFF image reader available in this JVM");
        ImageReader reader = readers.next();
        try (ImageInputStream input = ImageIO.createImageInputStream(file)) {
            if (input == null) throw new IOException("Cannot open " + file);
            reader.setInput(input);
            TIFFImageReadParam param = new TIFFImageReadParam();
            // GDAL_NODATA is a private tag the reader drops unless asked to keep unknown tags.
            param.setReadUnknownTags(true);
            java.awt.image.Raster pixels = reader.read(0, param).getRaster();
            IIOMetadata metadata = reader.getImageMetadata(0);
            TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);

            TIFFField scale = directory.getTIFFField(TAG_MODEL_PIXEL_SCALE);
            TIFFField tiepoint = directory.getTIFFField(TAG_MODEL_TIEPOINT);
            if (scale == null || tiepoint == null) {
                throw PipelineException.rasterFormat(file + " is not georeferenced (no pixel scale or tiepoint tag)");
            }
            double pixelWidth = scale.getAsDouble(0);
            double pixelHeight = scale.getAsDouble(1);
            double west = tiepoint.getAsDouble(3) - tiepoint.getAsDouble(0) * pixelWidth;
            double north = tiepoint.getAsDouble(4) + tiepoint.getAsDouble(1) * pixelHeight;

            String crs = Projections.WGS84;
            TIFFField geoKeys = directory.getTIFFField(TAG_GEO_KEY_DIRECTORY);
            if (geoKeys != null) {
                int epsg = geoKey(geoKeys, KEY_PROJECTED_CS_TYPE);
                if (epsg <= 0 || epsg == USER_DEFINED) epsg = geoKey(geoKeys, KEY_GEOGRAPHIC_TYPE);
                if (epsg > 0 && epsg != USER_DEFINED) {
                    crs = "EPSG:" + epsg;
                } else {
                    LOG.warn("{} has no EPSG code in its GeoKeys, assuming {}", file.getName(), Projections.WGS84);
                }
                if (geoKey(geoKeys, KEY_RASTER_TYPE) == RASTER_PIXEL_IS_POINT) {
                    // Tiepoint refers to the center of the corner pixel.
                    west -= pixelWidth / 2;
                    north += pixelHeight / 2;
                }
            }

            double nodata = Double.NaN;
            TIFFField nodataField = directory.getTIFFField(TAG_GDAL_NODATA);
            if (nodataField != null) {
                String text = nodataField.getAsString(0).trim();
                try {
                    nodata = Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    LOG.warn("Ignoring unparseable GDAL_NODATA value '{}' in {}", text, file.getName());
                }
            }

            int width = pixels.getWidth();
            int height = pixels.getHeight();
            float[][] bands = new float[pixels.getNumBands()][];
            for (int b = 0; b < bands.length; b++) {
                bands[b] = pixels.getSamples(0, 0, width, height, b, (float[]) null);
            }
            LOG.debug("Read {}x{} GeoTIFF {} with {} band(s) in {}", width, height, file.getName(), bands.length, crs);
            return new Raster(width, height, west, north, pixelWidth, pixelHeight, crs, nodata, bands);
        } finally {
            reader.dispose();
        }
    }

    /** Look up a short-valued GeoKey, returning -1 if absent or stored in another tag. */
    static int geoKey (TIFFField directory, int keyId) {
        int nKeys = directory.getAsInt(3);
        for (int k = 0; k < nKeys; k++) {
            int offset = 4 + k * 4;
            if (directory.getAsInt(offset) == keyId) {
                if (directory.getAsInt(offset + 1) != 0) return -1;
                return directory.getAsInt(offset + 3);
            }
        }
        return -1;
    }
}
