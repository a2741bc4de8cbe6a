package com.secondhand.negotiation;

/**
 * Seller's answer to one offer.
 */
public enum OfferResponse {

    /**
     * Deal at the offered amount. Terminal: the listing is sold.
     */
    ACCEPTED,

    /**
     * Seller proposes a new asking price and waits for another offer.
     */
    COUNTERED,

    /**
     * Offer refused; asking price unchanged.
     */
    REJECTED,

    /**
     * Seller insulted. Terminal: the listing is withdrawn for good.
     */
    WALKED_AWAY;

    public boolean isTerminal() {
        return this == ACCEPTED || this == WALKED_AWAY;
    }
}
