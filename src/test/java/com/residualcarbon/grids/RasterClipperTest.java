package com.residualcarbon.grids;

import com.residualcarbon.TestUtils;
import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.AreaOfInterest;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

public class RasterClipperTest {

    private final RasterClipper clipper = new RasterClipper();

    /** One degree square, 0.01 degree pixels, lon -57 to -56 and lat -12.5 to -11.5. */
    private final Raster raster = TestUtils.uniformRaster(-57, -11.5, 100, 100, 0.01, 1f);

    @Test
    public void fullExtentPassesRasterThrough () {
        ClippedRaster clip = clipper.clip(raster, AreaOfInterest.fullExtent());
        assertThat(clip.raster, sameInstance(raster));
        assertThat(clip.coverage.fractionValidPixels, equalTo(1.0));
        assertThat(clip.coverage.touchesBoundary, equalTo(false));
    }

    @Test
    public void circleInsideRasterIsFullyCovered () {
        ClippedRaster clip = clipper.clip(raster, AreaOfInterest.circle(-12.0, -56.5, 20));
        assertThat(clip.coverage.touchesBoundary, equalTo(false));
        assertThat(clip.coverage.fractionValidPixels, equalTo(1.0));
        // A 20 km circle is about 0.18 degrees of longitude across here, so ~37 pixels wide.
        assertThat(clip.raster.width, greaterThan(30));
        assertThat(clip.raster.width, lessThan(45));
        // Area check: pi * r^2 over the pixel area at this latitude.
        double pixelArea = (0.01 * 111.32 * Math.cos(Math.toRadians(12))) * (0.01 * 110.6);
        assertThat((double) clip.coverage.validPixels, closeTo(Math.PI * 400 / pixelArea, 40));
        // Window corners lie outside the circle and must have been blanked.
        assertThat(clip.raster.isNodata(clip.raster.get(0, 0, 0)), equalTo(true));
        int middle = clip.raster.width / 2;
        assertThat(clip.raster.get(0, middle, clip.raster.height / 2), equalTo(1f));
        assertThat((long) clip.raster.countValid(0), equalTo(clip.coverage.validPixels));
    }

    @Test
    public void circleMostlyOffTheRasterStillClips () {
        // 50 km is 0.459 degrees of longitude at 12 S. A center 0.687 radii east of the raster's east edge leaves
        // the circle segment west of that edge, about 10% of the area, over the raster.
        double radiusDegrees = 50 / (111.32 * Math.cos(Math.toRadians(12)));
        double centerLon = -56 + 0.687 * radiusDegrees;
        ClippedRaster clip = clipper.clip(raster, AreaOfInterest.circle(-12.0, centerLon, 50));
        assertThat(clip.coverage.touchesBoundary, equalTo(true));
        assertThat(clip.coverage.fractionValidPixels, closeTo(0.1, 0.02));
        assertThat(clip.raster.east(), closeTo(-56, 1e-9));
    }

    @Test
    public void nodataInsideCircleLowersCoverageWithoutTouchingBoundary () {
        float[] band = new float[100 * 100];
        for (int i = 0; i < band.length; i++) band[i] = (i % 100) < 50 ? (float) TestUtils.NODATA : 2f;
        Raster halfEmpty = new Raster(100, 100, -57, -11.5, 0.01, 0.01, Projections.WGS84, TestUtils.NODATA,
                new float[][] { band });
        ClippedRaster clip = clipper.clip(halfEmpty, AreaOfInterest.circle(-12.0, -56.5, 20));
        assertThat(clip.coverage.touchesBoundary, equalTo(false));
        assertThat(clip.coverage.fractionValidPixels, closeTo(0.5, 0.05));
    }

    @Test
    public void circleWithNoOverlapIsAnError () {
        try {
            clipper.clip(raster, AreaOfInterest.circle(-12.0, -54.0, 50));
            fail("Expected an empty clip");
        } catch (PipelineException e) {
            assertThat(e.type, equalTo(PipelineException.TYPE.EMPTY_CLIP));
            assertThat(e.stage, equalTo(PipelineException.Stage.CLIP));
        }
    }

    @Test
    public void circleOverOnlyNodataIsAnError () {
        Raster empty = TestUtils.uniformRaster(-57, -11.5, 100, 100, 0.01, (float) TestUtils.NODATA);
        try {
            clipper.clip(empty, AreaOfInterest.circle(-12.0, -56.5, 20));
            fail("Expected an empty clip");
        } catch (PipelineException e) {
            assertThat(e.type, equalTo(PipelineException.TYPE.EMPTY_CLIP));
        }
    }
}
