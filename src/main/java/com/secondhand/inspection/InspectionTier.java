package com.secondhand.inspection;

import com.secondhand.state.ConditionField;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Depth of a pre-purchase inspection: fee, turnaround and what it reveals.
 */
@Getter
public enum InspectionTier {

    QUICK(1, "Quick Glance", 1000, 0.02, 2500, 2,
            EnumSet.of(ConditionField.OVERALL_RATING)),

    STANDARD(2, "Standard Inspection", 2000, 0.03, 5000, 6,
            EnumSet.of(ConditionField.OVERALL_RATING, ConditionField.RELIABILITY)),

    COMPREHENSIVE(3, "Comprehensive Inspection", 4000, 0.05, 10000, 12,
            EnumSet.of(ConditionField.OVERALL_RATING, ConditionField.RELIABILITY,
                    ConditionField.RELIABILITY_DETAIL, ConditionField.QUALITY_HINT));

    private final int index;
    private final String displayName;
    private final long flatFee;
    private final double pricePercent;
    private final long feeCap;
    private final int durationHours;
    private final Set<ConditionField> reveals;

    InspectionTier(int index, String displayName, long flatFee, double pricePercent, long feeCap,
                   int durationHours, EnumSet<ConditionField> reveals) {
        this.index = index;
        this.displayName = displayName;
        this.flatFee = flatFee;
        this.pricePercent = pricePercent;
        this.feeCap = feeCap;
        this.durationHours = durationHours;
        this.reveals = Collections.unmodifiableSet(reveals);
    }

    /**
     * Fee for inspecting an item at {@code price}: flat plus percentage, capped.
     */
    public long fee(long price) {
        long uncapped = flatFee + (long) Math.floor(price * pricePercent);
        return Math.min(feeCap, uncapped);
    }

    public static Optional<InspectionTier> fromIndex(int index) {
        for (InspectionTier tier : values()) {
            if (tier.index == index) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
