package com.secondhand.condition;

import lombok.Getter;

/**
 * Overall condition grade an inspector reports.
 */
@Getter
public enum ConditionRating {

    EXCELLENT("Excellent", 0.10),
    GOOD("Good", 0.25),
    FAIR("Fair", 0.45),
    POOR("Poor", 1.0);

    private final String displayName;

    /**
     * Highest mean of damage and wear that still earns this grade.
     */
    private final double maxMeanDegradation;

    ConditionRating(String displayName, double maxMeanDegradation) {
        this.displayName = displayName;
        this.maxMeanDegradation = maxMeanDegradation;
    }

    /**
     * Grade an item from its damage and wear.
     */
    public static ConditionRating fromDegradation(double damage, double wear) {
        double mean = (damage + wear) / 2.0;
        for (ConditionRating rating : values()) {
            if (mean <= rating.maxMeanDegradation) {
                return rating;
            }
        }
        return POOR;
    }
}
