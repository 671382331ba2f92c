package com.residualcarbon.scoring;

/**
 * Score bands and weight for one soil property. The bands are nested: every optimal value is also moderate and every
 * moderate value acceptable. A value receives the highest band containing it, so a value on the edge shared by two
 * bands receives the higher score.
 */
public class PropertyThresholds {
    public Range optimal;
    public Range moderate;
    public Range acceptable;

    /** Used when a hex has no value for moisture or temperature. Organic carbon and pH are never defaulted. */
    public Double fallback;

    public double weight;

    /** Values outside this range mean the hex's input data is broken; null means anything goes. */
    public Range valid;

    public int subscore (double value) {
        if (optimal != null && optimal.contains(value)) return 3;
        if (moderate != null && moderate.contains(value)) return 2;
        if (acceptable != null && acceptable.contains(value)) return 1;
        return 0;
    }

    public boolean isValid (double value) {
        return !Double.isNaN(value) && (valid == null || valid.contains(value));
    }
}
