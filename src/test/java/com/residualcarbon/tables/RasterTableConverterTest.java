package com.residualcarbon.tables;

import com.residualcarbon.TestUtils;
import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.SoilProperty;
import com.residualcarbon.grids.ClippedRaster;
import com.residualcarbon.grids.Raster;
import com.residualcarbon.grids.RasterClipper;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;

public class RasterTableConverterTest {

    private static final float NODATA = (float) TestUtils.NODATA;

    /** 3x2 raster with one nodata pixel. */
    private static ClippedRaster clip (float... values) {
        Raster raster = new Raster(3, 2, -56.03, -13.0, 0.01, 0.01, "EPSG:4326", TestUtils.NODATA,
                new float[][] { values });
        return new RasterClipper().clip(raster, AreaOfInterest.fullExtent());
    }

    @Test
    public void normalizesUnits () {
        assertThat(SoilProperty.MOISTURE.normalize(0.55), closeTo(55.0, 1e-9));
        assertThat(SoilProperty.TEMPERATURE.normalize(293.15), closeTo(20.0, 1e-9));
        assertThat(SoilProperty.ORGANIC_CARBON.normalize(25), closeTo(2.5, 1e-9));
        assertThat(SoilProperty.PH.normalize(65), closeTo(6.5, 1e-9));

        RasterTableConverter converter = new RasterTableConverter(NodataPolicy.SKIP);
        ColumnarPointTable moisture = converter.convert(clip(0.55f, 0.55f, 0.55f, 0.55f, 0.55f, 0.55f),
                Layer.of(SoilProperty.MOISTURE), 0);
        assertThat(moisture.value[0], equalTo(55.0));
        assertThat(moisture.unit(), equalTo("%"));
        ColumnarPointTable temperature = converter.convert(clip(293.15f, 293.15f, 293.15f, 293.15f, 293.15f, 293.15f),
                Layer.of(SoilProperty.TEMPERATURE), 0);
        assertThat(temperature.value[5], equalTo(20.0));
    }

    @Test
    public void singlePrecisionSamplesConvertToTheirDecimalValue () {
        // 0.6f widens to 0.6000000238 and 70 * 0.1 is 7.000000000000001 in binary; both must land on the band edge.
        assertThat(SoilProperty.MOISTURE.normalizeSample(0.6f), equalTo(60.0));
        assertThat(SoilProperty.PH.normalizeSample(70f), equalTo(7.0));
        assertThat(SoilProperty.TEMPERATURE.normalizeSample(298.15f), equalTo(25.0));
        assertThat(SoilProperty.ORGANIC_CARBON.normalizeSample(40f), equalTo(4.0));
        assertThat(SoilProperty.MOISTURE.normalizeSample(0.123456789f), equalTo(12.345679));

        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.SKIP)
                .convert(clip(0.6f, 0.3f, 0.2f, 0.7f, 0.8f, 0.05f), Layer.of(SoilProperty.MOISTURE), 0);
        assertThat(table.value[0], equalTo(60.0));
        assertThat(table.value[1], equalTo(30.0));
        assertThat(table.value[2], equalTo(20.0));
        assertThat(table.value[3], equalTo(70.0));
        assertThat(table.value[4], equalTo(80.0));
        assertThat(table.value[5], equalTo(5.0));
    }

    @Test
    public void skipPolicyDropsNodata () {
        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.SKIP)
                .convert(clip(50, 55, 60, NODATA, 65, 70), new Layer(SoilProperty.PH, "b0"), 0);
        assertThat(table.size(), equalTo(5));
        assertThat(table.nodataCount, equalTo(1L));
        // Row-major from the north-west corner; pixel centers.
        assertThat(table.lon[0], closeTo(-56.025, 1e-9));
        assertThat(table.lat[0], closeTo(-13.005, 1e-9));
        assertThat(table.lon[3], closeTo(-56.015, 1e-9));
        assertThat(table.lat[3], closeTo(-13.015, 1e-9));
        assertThat(table.value[3], closeTo(6.5, 1e-6));
    }

    @Test
    public void nanPolicyKeepsEveryPixel () {
        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.NAN)
                .convert(clip(50, 55, 60, NODATA, Float.NaN, 70), Layer.of(SoilProperty.PH), 0);
        assertThat(table.size(), equalTo(6));
        assertThat(table.nodataCount, equalTo(2L));
        assertThat(Double.isNaN(table.value[3]), equalTo(true));
        assertThat(Double.isNaN(table.value[4]), equalTo(true));
        assertThat(table.value[5], closeTo(7.0, 1e-6));
    }

    @Test
    public void implausibleValuesAreCountedAsAnomalies () {
        // 1.2 m3/m3 is 120% moisture.
        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.SKIP)
                .convert(clip(0.2f, 1.2f, 0.3f, 0.4f, 0.5f, 0.6f), Layer.of(SoilProperty.MOISTURE), 0);
        assertThat(table.size(), equalTo(5));
        assertThat(table.anomalyCount, equalTo(1L));
        assertThat(table.nodataCount, equalTo(0L));
    }

    @Test
    public void lazyTableIsRestartable () {
        PointTable table = new RasterTableConverter(NodataPolicy.SKIP)
                .toTable(clip(10, 20, NODATA, 40, 50, 60), Layer.of(SoilProperty.ORGANIC_CARBON), 0);
        List<PointRecord> first = new ArrayList<>();
        for (PointRecord record : table) first.add(record);
        List<PointRecord> second = new ArrayList<>();
        for (PointRecord record : table) second.add(record);
        assertThat(first.size(), equalTo(5));
        assertThat(second, equalTo(first));
        assertThat(first.get(0).unit, equalTo("%"));
        assertThat(first.get(0).value, closeTo(1.0, 1e-9));
    }

    @Test
    public void projectedRastersAreReturnedInLonLat () {
        // UTM zone 21S, central meridian 57 W.
        Raster utm = new Raster(2, 2, 500000, 8560000, 100, 100, "EPSG:32721", TestUtils.NODATA,
                new float[][] { { 60, 61, 62, 63 } });
        ClippedRaster clip = new RasterClipper().clip(utm, AreaOfInterest.fullExtent());
        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.SKIP).convert(clip, Layer.of(SoilProperty.PH), 0);
        assertThat(table.lon[0], closeTo(-57.0, 0.01));
        assertThat(table.lat[0], closeTo(-13.0, 0.1));
    }
}
