package com.secondhand.state;

import lombok.Value;

@Value
public class OfferHistoryEntry {

    long amount;

    /**
     * Simulated hour the offer arrived.
     */
    long offeredAtHour;

    OfferDecision decision;

    public boolean isAccepted() {
        return decision == OfferDecision.ACCEPTED;
    }
}
