package com.residualcarbon.grids;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.plugins.tiff.TIFFTagSet;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;

public class GeoTiffRasterReaderTest {

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    @Test
    public void readsGeoreferencingAndNodataFromTags () throws IOException {
        File file = temp.newFile("soil_ph_res_250_b0.tif");
        writeGeoTiff(file);

        Raster raster = RasterReader.forFile(file).read(file);
        assertThat(raster.width, equalTo(3));
        assertThat(raster.height, equalTo(2));
        assertThat(raster.bandCount(), equalTo(1));
        assertThat(raster.west, closeTo(-56.03, 1e-9));
        assertThat(raster.north, closeTo(-13.0, 1e-9));
        assertThat(raster.pixelWidth, closeTo(0.01, 1e-12));
        assertThat(raster.crs, equalTo("EPSG:4326"));
        assertThat(raster.nodata, equalTo(0.0));
        assertThat(raster.get(0, 0, 0), equalTo(50f));
        assertThat(raster.get(0, 2, 1), equalTo(65f));
        assertThat(raster.isNodata(raster.get(0, 1, 1)), equalTo(true));
        assertThat(raster.countValid(0), equalTo(5));
    }

    /** A 3x2 pH raster (values stored times ten) with one nodata pixel. */
    private static void writeGeoTiff (File file) throws IOException {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_USHORT_GRAY);
        WritableRaster pixels = image.getRaster();
        int[] values = { 50, 55, 60, 62, 0, 65 };
        for (int i = 0; i < values.length; i++) pixels.setSample(i % 3, i / 3, 0, values[i]);

        GeoTIFFTagSet geo = GeoTIFFTagSet.getInstance();
        TIFFDirectory directory = new TIFFDirectory(
                new TIFFTagSet[] { BaselineTIFFTagSet.getInstance(), geo }, null);
        directory.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE),
                TIFFTag.TIFF_DOUBLE, 3, new double[] { 0.01, 0.01, 0 }));
        directory.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_MODEL_TIE_POINT),
                TIFFTag.TIFF_DOUBLE, 6, new double[] { 0, 0, 0, -56.03, -13.0, 0 }));
        directory.addTIFFField(new TIFFField(geo.getTag(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY),
                TIFFTag.TIFF_SHORT, 12, new char[] { 1, 1, 0, 2, 1024, 0, 1, 2, 2048, 0, 1, 4326 }));
        TIFFTag gdalNodata = new TIFFTag("GDAL_NODATA", GeoTiffRasterReader.TAG_GDAL_NODATA, 1 << TIFFTag.TIFF_ASCII);
        directory.addTIFFField(new TIFFField(gdalNodata, TIFFTag.TIFF_ASCII, 1, new String[] { "0" }));

        ImageWriter writer = ImageIO.getImageWritersByFormatName("tiff").next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file)) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, directory.getAsMetadata()), null);
        } finally {
            writer.dispose();
        }
    }
}
