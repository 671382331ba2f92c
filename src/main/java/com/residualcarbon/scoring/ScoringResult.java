package com.residualcarbon.scoring;

import java.util.List;

/** Scores for all scorable hexes, and counts of the hexes that were not scored or needed defaults. */
public class ScoringResult {

    public final List<SuitabilityScore> scores;

    /** Hexes lacking organic carbon or pH. */
    public final int skippedMissingRequired;

    /** Hexes with a value outside its property's valid range. */
    public final int skippedInvalid;

    public final int moistureDefaulted;
    public final int temperatureDefaulted;

    public ScoringResult (List<SuitabilityScore> scores, int skippedMissingRequired, int skippedInvalid,
                          int moistureDefaulted, int temperatureDefaulted) {
        this.scores = scores;
        this.skippedMissingRequired = skippedMissingRequired;
        this.skippedInvalid = skippedInvalid;
        this.moistureDefaulted = moistureDefaulted;
        this.temperatureDefaulted = temperatureDefaulted;
    }
}
