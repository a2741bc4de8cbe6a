package com.secondhand.state;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * An owned item offered for sale.
 */
@Value
@Builder
public class SaleItem {

    @NonNull
    String itemId;

    @NonNull
    String name;

    @NonNull
    String categoryId;

    /**
     * What the host would pay outright; buyer offers are fractions of this.
     */
    long sellValue;

    /**
     * New price of the item's category.
     */
    long basePrice;

    int age;

    int operatingHours;

    double damage;

    double wear;

    /**
     * Hidden quality carried over from when the item was acquired, null if unknown.
     */
    @Nullable
    Double hiddenQuality;
}
