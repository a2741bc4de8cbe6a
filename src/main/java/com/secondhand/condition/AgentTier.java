package com.secondhand.condition;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Agent reach for both searching and selling: a speed, cost and success tradeoff.
 *
 * <p>Wider reach finds younger, better kept stock (generation weights skew toward
 * {@link Generation#RECENT}, damage and wear are scaled down) and pays the seller more,
 * at a higher fee. Durations are simulated hours; one market month is
 * {@link #HOURS_PER_MONTH} hours.
 */
@Slf4j
@Getter
public enum AgentTier {

    LOCAL(1, "Local",
            new double[]{0.20, 0.50, 0.30}, 1.3,
            0.04, 1, 1, 0.25, 1,
            50, 0.0, 0.60, 0.75, 12, 0.35, 72),

    REGIONAL(2, "Regional",
            new double[]{0.40, 0.40, 0.20}, 1.0,
            0.06, 1, 2, 0.55, 2,
            200, 0.01, 0.70, 0.85, 18, 0.55, 120),

    NATIONAL(3, "National",
            new double[]{0.55, 0.35, 0.10}, 0.7,
            0.10, 2, 4, 0.80, 3,
            500, 0.02, 0.80, 0.95, 24, 0.75, 168);

    public static final int HOURS_PER_MONTH = 24;

    /**
     * Tier used by the generator when handed an index it doesn't know.
     */
    public static final AgentTier FALLBACK = REGIONAL;

    private final int index;

    private final String displayName;

    /**
     * Draw weights for RECENT, MID_AGE and OLD, in that order.
     */
    private final double[] generationWeights;

    /**
     * Scale applied to drawn damage and wear.
     */
    private final double conditionMultiplier;

    // Search terms
    private final double searchFeePercent;
    private final int searchMinMonths;
    private final int searchMaxMonths;
    private final double searchSuccessChance;
    private final int findCount;

    // Sale terms
    private final long saleFlatFee;
    private final double saleFeePercent;
    private final double returnMin;
    private final double returnMax;
    private final int offerIntervalHours;
    private final double offerChance;
    private final int saleLifetimeHours;

    AgentTier(int index, String displayName,
              double[] generationWeights, double conditionMultiplier,
              double searchFeePercent, int searchMinMonths, int searchMaxMonths,
              double searchSuccessChance, int findCount,
              long saleFlatFee, double saleFeePercent, double returnMin, double returnMax,
              int offerIntervalHours, double offerChance, int saleLifetimeHours) {
        this.index = index;
        this.displayName = displayName;
        this.generationWeights = generationWeights;
        this.conditionMultiplier = conditionMultiplier;
        this.searchFeePercent = searchFeePercent;
        this.searchMinMonths = searchMinMonths;
        this.searchMaxMonths = searchMaxMonths;
        this.searchSuccessChance = searchSuccessChance;
        this.findCount = findCount;
        this.saleFlatFee = saleFlatFee;
        this.saleFeePercent = saleFeePercent;
        this.returnMin = returnMin;
        this.returnMax = returnMax;
        this.offerIntervalHours = offerIntervalHours;
        this.offerChance = offerChance;
        this.saleLifetimeHours = saleLifetimeHours;
    }

    /**
     * Generation weights, copied so callers can't alter the table.
     */
    public double[] getGenerationWeights() {
        return generationWeights.clone();
    }

    /**
     * Fee for commissioning a search.
     *
     * @param basePrice      new price of the requested category
     * @param creditModifier fractional fee adjustment from the requester's credit
     * @return fee, rounded down to whole currency units
     */
    public long searchFee(long basePrice, double creditModifier) {
        return (long) Math.floor(basePrice * searchFeePercent * (1 + creditModifier));
    }

    /**
     * Agent fee for listing an item worth {@code value}.
     */
    public long saleFee(long value) {
        return saleFlatFee + (long) Math.floor(value * saleFeePercent);
    }

    /**
     * Chance the search succeeds for the given quality, clamped to [0.05, 0.95].
     */
    public double searchSuccessChance(QualityTier quality) {
        return Math.max(0.05, Math.min(0.95, searchSuccessChance + quality.getSuccessModifier()));
    }

    public static Optional<AgentTier> fromIndex(int index) {
        for (AgentTier tier : values()) {
            if (tier.index == index) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Look up a tier by index, substituting {@link #FALLBACK} for unknown indices.
     */
    public static AgentTier fromIndexOrFallback(int index) {
        return fromIndex(index).orElseGet(() -> {
            log.warn("Unknown agent tier {}, using {}", index, FALLBACK);
            return FALLBACK;
        });
    }
}
