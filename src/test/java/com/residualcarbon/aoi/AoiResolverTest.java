package com.residualcarbon.aoi;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.AoiRequest;
import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Bounds;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

public class AoiResolverTest {

    private final AoiResolver resolver = new AoiResolver(new AoiResolver.Config() {
        @Override public Bounds region () { return new Bounds(-7, -50, -18, -62); }
        @Override public double defaultRadiusKm () { return 100; }
        @Override public double maxRadiusKm () { return 500; }
    });

    @Test
    public void noCoordinatesMeansFullExtent () {
        assertThat(resolver.resolve(AoiRequest.fullExtent()), sameInstance(AreaOfInterest.fullExtent()));
        assertThat(resolver.resolve(null, null, 25.0).isFullExtent(), equalTo(true));
    }

    @Test
    public void resolvesCircleWithDefaultRadius () {
        AreaOfInterest aoi = resolver.resolve(-13.0, -56.0, null);
        assertThat(aoi.circle, equalTo(true));
        assertThat(aoi.radiusKm, equalTo(100.0));
        assertThat(aoi.descriptor(), equalTo("circle:-13.000000,-56.000000,100.00"));
    }

    @Test
    public void regionEdgesAreInside () {
        assertThat(resolver.resolve(-18.0, -62.0, 10.0).circle, equalTo(true));
        assertThat(resolver.resolve(-7.0, -50.0, 500.0).radiusKm, equalTo(500.0));
    }

    @Test
    public void rejectsHalfACoordinate () {
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, null, 10.0);
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, null, -56.0, 10.0);
    }

    @Test
    public void rejectsImpossibleCoordinates () {
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, -91.0, -56.0, 10.0);
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, 181.0, 10.0);
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, Double.NaN, -56.0, 10.0);
    }

    @Test
    public void rejectsPointsOutsideRegionWithBounds () {
        PipelineException e = assertFails(PipelineException.TYPE.OUT_OF_REGION, -23.5, -46.6, 10.0);
        assertThat(e.getMessage(), containsString("latitude -18.0 to -7.0, longitude -62.0 to -50.0"));
        assertThat(e.stage, equalTo(PipelineException.Stage.RESOLVE_AOI));
    }

    @Test
    public void rejectsBadRadiusWithoutClamping () {
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, -56.0, 0.0);
        assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, -56.0, -5.0);
        PipelineException e = assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, -56.0, 500.5);
        assertThat(e.getMessage(), containsString("maximum of 500.0 km"));
    }

    @Test
    public void circlesWithTheSameDescriptorAreTheSameArea () {
        AreaOfInterest first = resolver.resolve(-13.0, -56.0, 10.001);
        AreaOfInterest second = resolver.resolve(-13.0, -56.0, 10.004);
        assertThat(first.descriptor(), equalTo("circle:-13.000000,-56.000000,10.00"));
        assertThat(first, equalTo(second));
        assertThat(first.radiusKm, equalTo(10.0));
        assertThat(second.radiusKm, equalTo(10.0));

        AreaOfInterest shifted = resolver.resolve(-13.0000001, -56.0000004, 10.005);
        assertThat(shifted.centerLat, equalTo(-13.0));
        assertThat(shifted.centerLon, equalTo(-56.0));
        assertThat(shifted.radiusKm, equalTo(10.01));
        assertThat(AreaOfInterest.parse("-13.0000001,-56.0,10.001"), equalTo(first));
    }

    @Test
    public void rejectsRadiusThatRoundsToZero () {
        PipelineException e = assertFails(PipelineException.TYPE.INVALID_COORDINATE, -13.0, -56.0, 0.004);
        assertThat(e.getMessage(), containsString("at least 0.01 km"));
        assertThat(resolver.resolve(-13.0, -56.0, 0.005).radiusKm, equalTo(0.01));
    }

    private PipelineException assertFails (PipelineException.TYPE type, Double lat, Double lon, Double radius) {
        try {
            resolver.resolve(lat, lon, radius);
        } catch (PipelineException e) {
            assertThat(e.type, equalTo(type));
            return e;
        }
        fail("Expected " + type + " for " + lat + ", " + lon + ", " + radius);
        return null;
    }
}
