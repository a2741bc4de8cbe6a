package com.secondhand.negotiation;

import lombok.Getter;

/**
 * How a seller reacts to offers, fixed by the listing's hidden quality scalar.
 *
 * <p>Owners of good items know it: the higher the hidden quality, the less room to haggle
 * and the more likely a lowball ends the conversation for good.
 */
@Getter
public enum SellerPersonality {

    /**
     * Hidden quality [0.0, 0.2). Wants out, takes nearly anything.
     */
    DESPERATE("Desperate", 0.2, 0.15, 0.05, 0.80),

    /**
     * Hidden quality [0.2, 0.4).
     */
    MOTIVATED("Motivated", 0.4, 0.08, 0.15, 0.85),

    /**
     * Hidden quality [0.4, 0.6).
     */
    REASONABLE("Reasonable", 0.6, 0.0, 0.35, 0.90),

    /**
     * Hidden quality [0.6, 0.8).
     */
    FIRM("Firm", 0.8, -0.05, 0.60, 0.92),

    /**
     * Hidden quality [0.8, 1.0]. Accepts only near asking and never counters a rejection.
     */
    IMMOVABLE("Immovable", Double.POSITIVE_INFINITY, -0.15, 0.90, 0.98);

    /**
     * Offers at or above this fraction of asking always satisfy an immovable seller.
     */
    public static final double IMMOVABLE_FLOOR = 0.98;

    private final String displayName;

    /**
     * Exclusive upper bound of the hidden quality band.
     */
    private final double upperBound;

    /**
     * Added to the acceptable gap; negative values make the seller stricter.
     */
    private final double tolerance;

    private final double walkAwayChance;

    /**
     * Fraction of asking the seller accepts before modifiers.
     */
    private final double acceptanceThreshold;

    SellerPersonality(String displayName, double upperBound, double tolerance,
                      double walkAwayChance, double acceptanceThreshold) {
        this.displayName = displayName;
        this.upperBound = upperBound;
        this.tolerance = tolerance;
        this.walkAwayChance = walkAwayChance;
        this.acceptanceThreshold = acceptanceThreshold;
    }

    /**
     * Classify a hidden quality scalar. Values outside [0, 1] are clamped.
     */
    public static SellerPersonality fromHiddenQuality(double hiddenQuality) {
        double q = Math.max(0.0, Math.min(1.0, hiddenQuality));
        for (SellerPersonality personality : values()) {
            if (q < personality.upperBound) {
                return personality;
            }
        }
        return IMMOVABLE;
    }

    public boolean isImmovable() {
        return this == IMMOVABLE;
    }
}
