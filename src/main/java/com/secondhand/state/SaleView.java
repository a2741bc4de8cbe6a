package com.secondhand.state;

import com.secondhand.condition.AgentTier;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.List;

@Value
@Builder
public class SaleView {

    String id;
    String ownerId;
    String listingId;
    String itemId;
    String itemName;
    AgentTier agentTier;
    long feePaid;
    long createdAtHour;
    long sellValue;
    ListingStatus status;
    int ttlHours;
    List<OfferHistoryEntry> offerHistory;

    @Nullable
    PendingOffer pendingOffer;

    public boolean hasPendingOffer() {
        return pendingOffer != null;
    }
}
