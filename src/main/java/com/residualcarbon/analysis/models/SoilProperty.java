package com.residualcarbon.analysis.models;

import com.google.common.collect.ImmutableSet;
import com.residualcarbon.util.Util;

import java.util.Set;

/**
 * The four soil properties the pipeline understands. Each knows how to recognize its rasters by file name and how to
 * convert its source encoding into the homogeneous unit every downstream step works in.
 */
public enum SoilProperty {

    /** Volumetric water content, m³/m³ in the source rasters. */
    MOISTURE("moisture", "m3/m3", "%", 0, 100, ImmutableSet.of("moisture"), "sm_surface") {
        @Override
        public double normalize (double raw) {
            return raw * 100.0;
        }
    },

    /** Soil organic carbon, g/kg in the source rasters. */
    ORGANIC_CARBON("organic_carbon", "g/kg", "%", 0, 100, ImmutableSet.of("soc", "organic"), "organic_carbon") {
        @Override
        public double normalize (double raw) {
            return raw / 10.0;
        }
    },

    /** Soil pH, stored multiplied by ten in the source rasters. */
    PH("ph", "pH*10", "pH", 0, 14, ImmutableSet.of("ph"), null) {
        @Override
        public double normalize (double raw) {
            return raw * 0.1;
        }
    },

    /** Soil temperature, Kelvin in the source rasters. */
    TEMPERATURE("temperature", "K", "°C", -90, 70, ImmutableSet.of("temp", "temperature"), "soil_temp") {
        @Override
        public double normalize (double raw) {
            return raw - 273.15;
        }
    };

    /** Short name used in layer names and output column headers. */
    public final String key;
    public final String sourceUnit;
    public final String unit;
    /** Converted values outside this range are treated as conversion anomalies. */
    public final double plausibleMin;
    public final double plausibleMax;
    private final Set<String> tokens;
    private final String phrase;

    SoilProperty (String key, String sourceUnit, String unit, double plausibleMin, double plausibleMax,
                  Set<String> tokens, String phrase) {
        this.key = key;
        this.sourceUnit = sourceUnit;
        this.unit = unit;
        this.plausibleMin = plausibleMin;
        this.plausibleMax = plausibleMax;
        this.tokens = tokens;
        this.phrase = phrase;
    }

    /** Convert a raw raster value into this property's normalized unit. */
    public abstract double normalize (double raw);

    /**
     * Normalize a single-precision raster sample. The sample is widened through its shortest decimal form, so 0.6f
     * becomes 0.6 rather than 0.6000000238, and the result is rounded to nine places to drop the binary noise of the
     * unit conversion itself. Band edges in the scoring tables can then be compared exactly.
     */
    public double normalizeSample (float raw) {
        return Util.round(normalize(Double.parseDouble(Float.toString(raw))), 9);
    }

    public boolean isPlausible (double normalized) {
        return normalized >= plausibleMin && normalized <= plausibleMax;
    }

    /**
     * Recognize a dataset from its file name, e.g. "SOC_res_250_b0" or "soil_temp_layer1". Matching is done on whole
     * underscore/dash separated tokens so that "ph" does not match inside longer words.
     * @return the property, or null if the name matches none of them.
     */
    public static SoilProperty classify (String datasetName) {
        String lower = datasetName.toLowerCase();
        Set<String> nameTokens = ImmutableSet.copyOf(lower.split("[^a-z0-9]+"));
        for (SoilProperty property : values()) {
            if (property.phrase != null && lower.contains(property.phrase)) return property;
            for (String token : property.tokens) {
                if (nameTokens.contains(token)) return property;
            }
        }
        return null;
    }

    public static SoilProperty forKey (String key) {
        for (SoilProperty property : values()) {
            if (property.key.equals(key)) return property;
        }
        throw new IllegalArgumentException("Unknown soil property: " + key);
    }
}
