package com.secondhand.condition;

import lombok.Builder;
import lombok.Value;

/**
 * Output of one {@link ConditionGenerator} draw: the visible condition of a used item,
 * its price, and the hidden quality scalar the seller and inspectors key off.
 */
@Value
@Builder
public class GeneratedCondition {

    Generation generation;

    int age;

    int operatingHours;

    double damage;

    double wear;

    /**
     * Quality-tier multiplier applied to the base price before the age discount.
     */
    double priceMultiplier;

    /**
     * Generated price, never below 5% of the base price.
     */
    long price;

    double hiddenQuality;

    ReliabilityScores reliability;

    public ConditionRating rating() {
        return ConditionRating.fromDegradation(damage, wear);
    }
}
