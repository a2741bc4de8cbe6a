package com.secondhand.authority;

import com.secondhand.state.ItemCategory;
import com.secondhand.state.SaleItem;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * A player action as received by the authority. Only the fields the {@link RequestType}
 * needs are set.
 */
@Value
@Builder
public class MarketRequest {

    @NonNull
    String participantId;

    @NonNull
    RequestType type;

    /**
     * Search, listing or sale id for targeted requests.
     */
    @Nullable
    String targetId;

    long amount;

    /**
     * Agent tier for searches and sales, inspection tier for inspections.
     */
    int tier;

    int qualityTier;

    @Nullable
    ItemCategory category;

    @Nullable
    SaleItem item;
}
