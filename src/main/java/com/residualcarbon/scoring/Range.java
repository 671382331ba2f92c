package com.residualcarbon.scoring;

/**
 * A closed interval. A null bound is unbounded on that side.
 */
public class Range {
    public Double min;
    public Double max;

    public Range () { }

    public Range (Double min, Double max) {
        this.min = min;
        this.max = max;
    }

    public boolean contains (double value) {
        if (Double.isNaN(value)) return false;
        return (min == null || value >= min) && (max == null || value <= max);
    }

    @Override
    public String toString () {
        return String.format("[%s, %s]", min == null ? "-inf" : min, max == null ? "inf" : max);
    }
}
