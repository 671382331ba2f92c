package com.residualcarbon.scoring;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.Layer;
import com.residualcarbon.analysis.models.SoilProperty;
import com.residualcarbon.hex.HexAggregate;
import com.residualcarbon.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores aggregated hexes for biochar suitability. Each property's value is mapped to a sub-score from 0 to 3, the
 * sub-scores are weighted and summed into a soil quality index, and suitability is the inverse of that quality: the
 * poorer the soil, the more biochar helps.
 *
 * Organic carbon and pH drive the result, so they are never defaulted. Moisture and temperature fall back to
 * configured values, and the score is flagged when that happens.
 */
public class SuitabilityScorer {

    private static final Logger LOG = LoggerFactory.getLogger(SuitabilityScorer.class);

    public static final Set<SoilProperty> REQUIRED = EnumSet.of(SoilProperty.ORGANIC_CARBON, SoilProperty.PH);

    private final ScoringConfig config;
    private final int lowPointCountThreshold;

    public SuitabilityScorer (ScoringConfig config, int lowPointCountThreshold) {
        this.config = config;
        this.lowPointCountThreshold = lowPointCountThreshold;
    }

    /**
     * @param partialCoverage true if some input raster did not cover the whole area, flagging every score.
     * @throws PipelineException MISSING_REQUIRED_PROPERTY when no hex at all has organic carbon or pH.
     */
    public ScoringResult score (List<HexAggregate> hexes, boolean partialCoverage) {
        long start = System.currentTimeMillis();
        if (!hexes.isEmpty()) {
            for (SoilProperty required : REQUIRED) {
                boolean present = false;
                for (HexAggregate hex : hexes) {
                    if (hex.hasProperty(required)) {
                        present = true;
                        break;
                    }
                }
                if (!present) {
                    throw PipelineException.missingRequiredProperty(String.format(
                            "No %s data in any of the %d hexes; it is required for scoring.", required.key, hexes.size()));
                }
            }
        }

        List<SuitabilityScore> scores = new ArrayList<>(hexes.size());
        int skippedMissing = 0;
        int skippedInvalid = 0;
        int moistureDefaulted = 0;
        int temperatureDefaulted = 0;
        HEXES: for (HexAggregate hex : hexes) {
            Map<SoilProperty, Double> values = averageByProperty(hex.means);
            Set<DegradationFlag> flags = EnumSet.noneOf(DegradationFlag.class);
            for (SoilProperty property : SoilProperty.values()) {
                if (values.containsKey(property)) continue;
                Double fallback = config.thresholds(property).fallback;
                if (REQUIRED.contains(property) || fallback == null) {
                    skippedMissing++;
                    continue HEXES;
                }
                values.put(property, fallback);
                if (property == SoilProperty.MOISTURE) {
                    flags.add(DegradationFlag.MOISTURE_DEFAULTED);
                    moistureDefaulted++;
                } else if (property == SoilProperty.TEMPERATURE) {
                    flags.add(DegradationFlag.TEMPERATURE_DEFAULTED);
                    temperatureDefaulted++;
                }
            }
            for (Map.Entry<SoilProperty, Double> value : values.entrySet()) {
                if (!config.thresholds(value.getKey()).isValid(value.getValue())) {
                    LOG.debug("Hex {} has invalid {} {}, not scored", hex.address, value.getKey().key, value.getValue());
                    skippedInvalid++;
                    continue HEXES;
                }
            }
            if (partialCoverage) flags.add(DegradationFlag.PARTIAL_COVERAGE);
            if (hex.pointCount < lowPointCountThreshold) flags.add(DegradationFlag.LOW_POINT_COUNT);
            scores.add(score(hex.cellId, hex.address, hex.pointCount, values, flags));
        }

        if (skippedMissing > 0) LOG.warn("{} hexes lack organic carbon or pH and were not scored", skippedMissing);
        if (skippedInvalid > 0) LOG.warn("{} hexes have out-of-range values and were not scored", skippedInvalid);
        if (moistureDefaulted > 0) {
            LOG.warn("{} hexes use the default moisture of {}", moistureDefaulted,
                    config.thresholds(SoilProperty.MOISTURE).fallback);
        }
        if (temperatureDefaulted > 0) {
            LOG.warn("{} hexes use the default temperature of {}", temperatureDefaulted,
                    config.thresholds(SoilProperty.TEMPERATURE).fallback);
        }
        LOG.info("Scored {} of {} hexes in {}", scores.size(), hexes.size(), Util.elapsed(start));
        return new ScoringResult(scores, skippedMissing, skippedInvalid, moistureDefaulted, temperatureDefaulted);
    }

    /** Score one set of property values, which must hold all four properties. */
    public SuitabilityScore score (long cellId, String address, int pointCount, Map<SoilProperty, Double> values,
                                  Set<DegradationFlag> flags) {
        Map<SoilProperty, Integer> subscores = new EnumMap<>(SoilProperty.class);
        double weightedSum = 0;
        for (SoilProperty property : SoilProperty.values()) {
            PropertyThresholds thresholds = config.thresholds(property);
            int subscore = thresholds.subscore(values.get(property));
            subscores.put(property, subscore);
            weightedSum += subscore * thresholds.weight;
        }
        double quality = 100 * weightedSum / config.maxWeightedSum();
        double qualityIndex = clamp(Util.round(quality, 2));
        double composite = clamp(Util.round(100 - quality, 2));
        return new SuitabilityScore(cellId, address, pointCount, composite, qualityIndex, subscores, values, flags);
    }

    /** Depth layers of the same property count equally toward its value. */
    static Map<SoilProperty, Double> averageByProperty (Map<Layer, Double> means) {
        Map<SoilProperty, Double> sums = new EnumMap<>(SoilProperty.class);
        Map<SoilProperty, Integer> counts = new EnumMap<>(SoilProperty.class);
        for (Map.Entry<Layer, Double> mean : means.entrySet()) {
            if (Double.isNaN(mean.getValue())) continue;
            SoilProperty property = mean.getKey().property;
            sums.merge(property, mean.getValue(), Double::sum);
            counts.merge(property, 1, Integer::sum);
        }
        Map<SoilProperty, Double> averages = new EnumMap<>(SoilProperty.class);
        for (Map.Entry<SoilProperty, Double> sum : sums.entrySet()) {
            averages.put(sum.getKey(), sum.getValue() / counts.get(sum.getKey()));
        }
        return averages;
    }

    private static double clamp (double score) {
        return Math.max(0, Math.min(100, score));
    }
}
