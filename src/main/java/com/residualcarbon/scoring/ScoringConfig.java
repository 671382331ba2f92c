package com.residualcarbon.scoring;

import com.residualcarbon.analysis.PipelineException;
import com.residualcarbon.analysis.models.SoilProperty;
import com.residualcarbon.util.JsonUtil;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.TreeMap;

/**
 * Thresholds and weights for all four properties, keyed by property key ("moisture", "organic_carbon", "ph",
 * "temperature"). Loaded from JSON; the default set ships on the classpath as thresholds.json.
 */
public class ScoringConfig {

    public static final String DEFAULT_RESOURCE = "thresholds.json";

    public Map<String, PropertyThresholds> properties = new TreeMap<>();

    public static ScoringConfig loadDefault () {
        try (InputStream is = ScoringConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) throw PipelineException.configuration("Default " + DEFAULT_RESOURCE + " is not on the classpath.");
            return JsonUtil.objectMapper.readValue(is, ScoringConfig.class).validate();
        } catch (IOException e) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.CONFIGURE,
                    "Cannot read default scoring thresholds", e);
        }
    }

    public static ScoringConfig load (File file) {
        try {
            return JsonUtil.objectMapper.readValue(file, ScoringConfig.class).validate();
        } catch (IOException e) {
            throw new PipelineException(PipelineException.TYPE.CONFIGURATION, PipelineException.Stage.CONFIGURE,
                    "Cannot read scoring thresholds from " + file, e);
        }
    }

    public PropertyThresholds thresholds (SoilProperty property) {
        return properties.get(property.key);
    }

    /** The weighted sum a hex scoring 3 on every property would reach. */
    public double maxWeightedSum () {
        double max = 0;
        for (SoilProperty property : SoilProperty.values()) max += 3 * thresholds(property).weight;
        return max;
    }

    ScoringConfig validate () {
        for (SoilProperty property : SoilProperty.values()) {
            PropertyThresholds t = thresholds(property);
            if (t == null) throw PipelineException.configuration("No scoring thresholds for " + property.key);
            if (t.weight < 0) throw PipelineException.configuration("Negative weight for " + property.key);
        }
        if (maxWeightedSum() <= 0) throw PipelineException.configuration("All scoring weights are zero.");
        return this;
    }
}
