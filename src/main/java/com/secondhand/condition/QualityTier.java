package com.secondhand.condition;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Quality a requester asks a search agent to find.
 *
 * <p>Damage and wear of a found item are drawn from the tier's ranges, the price multiplier
 * sets how far below new the asking price lands, and the success modifier makes cheap
 * tiers easier to fill than pristine ones.
 */
@Slf4j
@Getter
public enum QualityTier {

    ANY(1, "Any Condition",
            0.30, 0.50,
            0.35, 0.60,
            0.40, 0.65,
            0.08),

    POOR(2, "Poor Condition",
            0.22, 0.38,
            0.55, 0.80,
            0.60, 0.85,
            0.15),

    FAIR(3, "Fair Condition",
            0.50, 0.68,
            0.18, 0.35,
            0.22, 0.40,
            0.0),

    GOOD(4, "Good Condition",
            0.68, 0.80,
            0.06, 0.18,
            0.08, 0.22,
            -0.08),

    EXCELLENT(5, "Excellent Condition",
            0.80, 0.94,
            0.00, 0.06,
            0.00, 0.08,
            -0.15);

    /**
     * Tier used by the generator when handed an index it doesn't know.
     */
    public static final QualityTier FALLBACK = ANY;

    /**
     * One-based index used by callers and the save file.
     */
    private final int index;

    private final String displayName;

    private final double priceMultiplierMin;
    private final double priceMultiplierMax;

    private final double damageMin;
    private final double damageMax;

    private final double wearMin;
    private final double wearMax;

    /**
     * Added to the agent tier's base search success chance.
     */
    private final double successModifier;

    QualityTier(int index, String displayName,
                double priceMultiplierMin, double priceMultiplierMax,
                double damageMin, double damageMax,
                double wearMin, double wearMax,
                double successModifier) {
        this.index = index;
        this.displayName = displayName;
        this.priceMultiplierMin = priceMultiplierMin;
        this.priceMultiplierMax = priceMultiplierMax;
        this.damageMin = damageMin;
        this.damageMax = damageMax;
        this.wearMin = wearMin;
        this.wearMax = wearMax;
        this.successModifier = successModifier;
    }

    /**
     * Look up a tier by its one-based index.
     *
     * @param index tier index, 1..5
     * @return the tier, or empty if the index is out of range
     */
    public static Optional<QualityTier> fromIndex(int index) {
        for (QualityTier tier : values()) {
            if (tier.index == index) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Look up a tier by index, substituting {@link #FALLBACK} for unknown indices.
     */
    public static QualityTier fromIndexOrFallback(int index) {
        return fromIndex(index).orElseGet(() -> {
            log.warn("Unknown quality tier {}, using {}", index, FALLBACK);
            return FALLBACK;
        });
    }
}
