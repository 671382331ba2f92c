package com.residualcarbon.scoring;

import com.google.common.collect.ImmutableSortedMap;
import com.residualcarbon.analysis.models.SoilProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * The biochar suitability of one hex. The composite score runs from 0 (ideal soil, nothing to gain) to 100 (poorest
 * soil); the rescaled score is the same value on a 0 to 10 scale.
 */
public class SuitabilityScore {

    public final long cellId;
    public final String address;
    public final int pointCount;

    public final double compositeScore;
    public final double rescaledScore;
    public final double qualityIndex;
    public final Grade grade;

    /** 0 to 3 per property. */
    public final SortedMap<SoilProperty, Integer> subscores;

    /** The values that were scored, after depth averaging and defaults. */
    public final SortedMap<SoilProperty, Double> values;

    public final Set<DegradationFlag> flags;

    public SuitabilityScore (long cellId, String address, int pointCount, double compositeScore, double qualityIndex,
                             Map<SoilProperty, Integer> subscores, Map<SoilProperty, Double> values,
                             Set<DegradationFlag> flags) {
        this.cellId = cellId;
        this.address = address;
        this.pointCount = pointCount;
        this.compositeScore = compositeScore;
        this.rescaledScore = compositeScore / 10.0;
        this.qualityIndex = qualityIndex;
        this.grade = Grade.forScore(compositeScore);
        this.subscores = ImmutableSortedMap.copyOf(subscores);
        this.values = ImmutableSortedMap.copyOf(values);
        EnumSet<DegradationFlag> copy = EnumSet.noneOf(DegradationFlag.class);
        copy.addAll(flags);
        this.flags = Collections.unmodifiableSet(copy);
    }

    @Override
    public String toString () {
        return String.format("[%s score %.2f %s %s]", address, compositeScore, grade, flags);
    }
}
