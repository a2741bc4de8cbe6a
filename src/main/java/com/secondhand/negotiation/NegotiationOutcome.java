package com.secondhand.negotiation;

import lombok.Builder;
import lombok.Value;

/**
 * Seller's answer to one offer, with the numbers that produced it.
 */
@Value
@Builder
public class NegotiationOutcome {

    String listingId;

    OfferResponse response;

    SellerPersonality personality;

    long offerAmount;

    /**
     * Asking price the offer was measured against.
     */
    long askingPrice;

    /**
     * New asking price when {@link OfferResponse#COUNTERED}, otherwise 0.
     */
    long counterAmount;

    /**
     * How far the offer fell below the effective threshold, as a fraction of asking.
     */
    double gap;

    double weatherModifier;

    /**
     * Amount the deal closes at when {@link OfferResponse#ACCEPTED}.
     */
    public long getSettledPrice() {
        return response == OfferResponse.ACCEPTED ? offerAmount : 0;
    }

    public String describe() {
        switch (response) {
            case ACCEPTED:
                return String.format("Seller accepted $%,d", offerAmount);
            case COUNTERED:
                return String.format("Seller countered at $%,d", counterAmount);
            case REJECTED:
                return String.format("Seller rejected $%,d", offerAmount);
            case WALKED_AWAY:
                return "Seller walked away";
            default:
                return response.name();
        }
    }
}
