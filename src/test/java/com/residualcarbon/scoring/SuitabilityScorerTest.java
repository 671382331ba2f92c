package com.residualcarbon.scoring;

import com.residualcarbon.TestUtils;
import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.AreaOfInterest;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.SoilProperty;
import com.residualcarbon.hex.HexAggregate;
import com.residualcarbon.grids.RasterClipper;
import com.residualcarbon.hex.HexGrid;
import com.residualcarbon.tables.ColumnarPointTable;
import com.residualcarbon.tables.NodataPolicy;
import com.residualcarbon.tables.RasterTableConverter;
import org.junit.Test;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.residualcarbon.analysis.models.SoilProperty.MOISTURE;
import static com.residualcarbon.analysis.models.SoilProperty.ORGANIC_CARBON;
import static com.residualcarbon.analysis.models.SoilProperty.PH;
import static com.residualcarbon.analysis.models.SoilProperty.TEMPERATURE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.fail;

public class SuitabilityScorerTest {

    private final ScoringConfig config = ScoringConfig.loadDefault();
    private final SuitabilityScorer scorer = new SuitabilityScorer(config, 3);

    private int nextHex = 0;

    private static Map<SoilProperty, Double> values (double moisture, double carbon, double ph, double temperature) {
        Map<SoilProperty, Double> values = new EnumMap<>(SoilProperty.class);
        values.put(MOISTURE, moisture);
        values.put(ORGANIC_CARBON, carbon);
        values.put(PH, ph);
        values.put(TEMPERATURE, temperature);
        return values;
    }

    private SuitabilityScore scoreOf (double moisture, double carbon, double ph, double temperature) {
        return scorer.score(1L, "test", 10, values(moisture, carbon, ph, temperature),
                EnumSet.noneOf(DegradationFlag.class));
    }

    /** A hex at a distinct cell holding the given layer means. */
    private HexAggregate hex (int pointCount, Object... layerValues) {
        long cell = HexGrid.cellOf(-13.0 + nextHex * 0.1, -56.0, 7);
        nextHex++;
        Map<Layer, Double> means = new HashMap<>();
        for (int i = 0; i < layerValues.length; i += 2) {
            means.put((Layer) layerValues[i], ((Number) layerValues[i + 1]).doubleValue());
        }
        return new HexAggregate(cell, HexGrid.address(cell), -13.0, -56.0, pointCount, means, null);
    }

    private HexAggregate completeHex (int pointCount) {
        return hex(pointCount, Layer.of(MOISTURE), 15, Layer.of(ORGANIC_CARBON), 0.8, Layer.of(PH), 5.0,
                Layer.of(TEMPERATURE), 32);
    }

    @Test
    public void idealSoilIsNotSuitable () {
        SuitabilityScore score = scoreOf(55, 5.0, 6.5, 20);
        assertThat(score.compositeScore, equalTo(0.0));
        assertThat(score.qualityIndex, equalTo(100.0));
        assertThat(score.grade, equalTo(Grade.NOT_SUITABLE));
        assertThat(score.subscores.values(), contains(3, 3, 3, 3));
    }

    /** The converted value of a uniform single-precision raster of the given property. */
    private static double converted (SoilProperty property, float raw) {
        ColumnarPointTable table = new RasterTableConverter(NodataPolicy.SKIP).convert(
                new RasterClipper().clip(TestUtils.uniformRaster(-56.03, -13.0, 3, 2, 0.01, raw),
                        AreaOfInterest.fullExtent()), Layer.of(property), 0);
        return table.value[0];
    }

    @Test
    public void convertedBandEdgesScoreAsOptimal () {
        double moisture = converted(MOISTURE, 0.6f);
        double carbon = converted(ORGANIC_CARBON, 40f);
        double ph = converted(PH, 70f);
        double temperature = converted(TEMPERATURE, 298.15f);

        SuitabilityScore score = scoreOf(moisture, carbon, ph, temperature);
        assertThat(score.subscores.get(MOISTURE), equalTo(3));
        assertThat(score.subscores.get(PH), equalTo(3));
        assertThat(score.subscores.values(), contains(3, 3, 3, 3));
        assertThat(score.compositeScore, equalTo(0.0));
        assertThat(score.grade, equalTo(Grade.NOT_SUITABLE));

        SuitabilityScore ideal = scoreOf(converted(MOISTURE, 0.55f), 5.0, 6.5, converted(TEMPERATURE, 293.15f));
        assertThat(ideal.compositeScore, equalTo(0.0));
    }

    @Test
    public void poorSoilIsHighlySuitable () {
        SuitabilityScore score = scoreOf(15, 0.8, 5.0, 32);
        assertThat(score.subscores.get(MOISTURE), equalTo(0));
        assertThat(score.subscores.get(ORGANIC_CARBON), equalTo(0));
        assertThat(score.subscores.get(PH), equalTo(2));
        assertThat(score.subscores.get(TEMPERATURE), equalTo(1));
        assertThat(score.compositeScore, equalTo(77.78));
        assertThat(score.qualityIndex, equalTo(22.22));
        assertThat(score.rescaledScore, closeTo(7.778, 1e-9));
        assertThat(score.grade, equalTo(Grade.HIGH));
        assertThat(score.grade.label, equalTo("High Suitability"));
    }

    @Test
    public void scoresStayWithinBounds () {
        double[] moistures = { 0, 15, 25, 35, 55, 75, 100 };
        double[] carbons = { 0, 0.5, 1, 2, 4, 40 };
        double[] phs = { 0, 3.5, 5, 6.5, 7.5, 8.5, 14 };
        double[] temperatures = { -20, 5, 12, 20, 28, 33, 60 };
        for (double m : moistures) for (double c : carbons) for (double p : phs) for (double t : temperatures) {
            SuitabilityScore score = scoreOf(m, c, p, t);
            assertThat(score.compositeScore, greaterThanOrEqualTo(0.0));
            assertThat(score.compositeScore, lessThanOrEqualTo(100.0));
            assertThat(score.compositeScore + score.qualityIndex, closeTo(100, 0.011));
            assertThat(score.rescaledScore, closeTo(score.compositeScore / 10, 1e-9));
            assertThat(score.grade, equalTo(Grade.forScore(score.compositeScore)));
        }
    }

    @Test
    public void valuesOnSharedEdgesGetTheHigherBand () {
        PropertyThresholds ph = config.thresholds(PH);
        assertThat(ph.subscore(6.0), equalTo(3));
        assertThat(ph.subscore(7.0), equalTo(3));
        assertThat(ph.subscore(4.5), equalTo(2));
        assertThat(ph.subscore(9.0), equalTo(1));
        assertThat(ph.subscore(9.01), equalTo(0));
        assertThat(config.thresholds(MOISTURE).subscore(30), equalTo(2));
        assertThat(config.thresholds(ORGANIC_CARBON).subscore(4.0), equalTo(3));
        assertThat(config.thresholds(ORGANIC_CARBON).subscore(0.99), equalTo(0));
    }

    @Test
    public void gradeCutoffs () {
        assertThat(Grade.forScore(76), equalTo(Grade.HIGH));
        assertThat(Grade.forScore(75.99), equalTo(Grade.MODERATE));
        assertThat(Grade.forScore(51), equalTo(Grade.MODERATE));
        assertThat(Grade.forScore(26), equalTo(Grade.LOW));
        assertThat(Grade.forScore(25.99), equalTo(Grade.NOT_SUITABLE));
    }

    @Test
    public void missingMoistureAndTemperatureFallBackWithFlags () {
        HexAggregate hex = hex(10, Layer.of(ORGANIC_CARBON), 0.8, Layer.of(PH), 5.0);
        ScoringResult result = scorer.score(Collections.singletonList(hex), false);
        assertThat(result.scores.size(), equalTo(1));
        SuitabilityScore score = result.scores.get(0);
        assertThat(score.values.get(MOISTURE), equalTo(50.0));
        assertThat(score.values.get(TEMPERATURE), equalTo(20.0));
        assertThat(score.flags, equalTo(EnumSet.of(DegradationFlag.MOISTURE_DEFAULTED,
                DegradationFlag.TEMPERATURE_DEFAULTED)));
        assertThat(result.moistureDefaulted, equalTo(1));
        assertThat(result.temperatureDefaulted, equalTo(1));
    }

    @Test
    public void depthLayersAreAveraged () {
        HexAggregate hex = hex(10, Layer.of(MOISTURE), 15, new Layer(ORGANIC_CARBON, "b0"), 0.5,
                new Layer(ORGANIC_CARBON, "b10"), 1.5, Layer.of(PH), 5.0, Layer.of(TEMPERATURE), 32);
        SuitabilityScore score = scorer.score(Collections.singletonList(hex), false).scores.get(0);
        assertThat(score.values.get(ORGANIC_CARBON), closeTo(1.0, 1e-12));
        assertThat(score.subscores.get(ORGANIC_CARBON), equalTo(1));
    }

    @Test
    public void organicCarbonAbsentEverywhereFailsScoring () {
        List<HexAggregate> hexes = Arrays.asList(
                hex(10, Layer.of(MOISTURE), 15, Layer.of(PH), 5.0),
                hex(10, Layer.of(PH), 6.5));
        try {
            scorer.score(hexes, false);
            fail("Expected scoring to fail without organic carbon");
        } catch (PipelineException e) {
            assertThat(e.type, equalTo(PipelineException.TYPE.MISSING_REQUIRED_PROPERTY));
            assertThat(e.stage, equalTo(PipelineException.Stage.SCORE));
        }
    }

    @Test
    public void emptyHexListScoresNothing () {
        ScoringResult result = scorer.score(Collections.emptyList(), false);
        assertThat(result.scores, empty());
    }

    @Test
    public void hexLackingPhIsSkipped () {
        List<HexAggregate> hexes = Arrays.asList(completeHex(10), hex(10, Layer.of(ORGANIC_CARBON), 0.8));
        ScoringResult result = scorer.score(hexes, false);
        assertThat(result.scores.size(), equalTo(1));
        assertThat(result.skippedMissingRequired, equalTo(1));
    }

    @Test
    public void hexWithOutOfRangeValueIsSkipped () {
        List<HexAggregate> hexes = Arrays.asList(completeHex(10),
                hex(10, Layer.of(ORGANIC_CARBON), 0.8, Layer.of(PH), 15.5));
        ScoringResult result = scorer.score(hexes, false);
        assertThat(result.scores.size(), equalTo(1));
        assertThat(result.skippedInvalid, equalTo(1));
    }

    @Test
    public void withoutFallbacksHexesMissingMoistureAreSkipped () {
        ScoringConfig strict = ScoringConfig.load(new File(TestUtils.getResourceFileName("thresholds-strict.json")));
        SuitabilityScorer strictScorer = new SuitabilityScorer(strict, 3);
        List<HexAggregate> hexes = Arrays.asList(completeHex(10),
                hex(10, Layer.of(ORGANIC_CARBON), 0.8, Layer.of(PH), 5.0, Layer.of(TEMPERATURE), 32));
        ScoringResult result = strictScorer.score(hexes, false);
        assertThat(result.scores.size(), equalTo(1));
        assertThat(result.skippedMissingRequired, equalTo(1));
        assertThat(result.moistureDefaulted, equalTo(0));
    }

    @Test
    public void coverageAndPointCountFlags () {
        List<HexAggregate> hexes = Arrays.asList(completeHex(10), completeHex(2));
        ScoringResult result = scorer.score(hexes, true);
        assertThat(result.scores.get(0).flags, equalTo(EnumSet.of(DegradationFlag.PARTIAL_COVERAGE)));
        assertThat(result.scores.get(1).flags, equalTo(EnumSet.of(DegradationFlag.PARTIAL_COVERAGE,
                DegradationFlag.LOW_POINT_COUNT)));
        // Flags do not change the score itself.
        assertThat(result.scores.get(1).compositeScore, equalTo(77.78));
    }
}
