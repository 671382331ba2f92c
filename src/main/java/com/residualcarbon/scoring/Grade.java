package com.residualcarbon.scoring;

/**
 * Suitability grades with their lower score cutoffs. Higher means poorer soil and more to gain from biochar.
 */
public enum Grade {
    HIGH(76, "High Suitability", "#d32f2f", "Very suitable – biochar highly recommended"),
    MODERATE(51, "Moderate Suitability", "#f57c00", "Suitable – biochar recommended"),
    LOW(26, "Low Suitability", "#fbc02d", "Marginal – biochar may help"),
    NOT_SUITABLE(Double.NEGATIVE_INFINITY, "Not Suitable", "#388e3c", "Healthy soil – biochar not needed");

    /** Scores at or above this value and below the next grade's cutoff get this grade. */
    public final double minScore;
    public final String label;
    public final String color;
    public final String recommendation;

    Grade (double minScore, String label, String color, String recommendation) {
        this.minScore = minScore;
        this.label = label;
        this.color = color;
        this.recommendation = recommendation;
    }

    public static Grade forScore (double compositeScore) {
        for (Grade grade : values()) {
            if (compositeScore >= grade.minScore) return grade;
        }
        return NOT_SUITABLE;
    }
}
