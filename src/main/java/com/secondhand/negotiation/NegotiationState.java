package com.secondhand.negotiation;

/**
 * Where an offer exchange stands between rounds.
 */
public enum NegotiationState {
    AWAITING_OFFER,
    COUNTERED,
    ACCEPTED,
    REJECTED,
    WALKED_AWAY;

    public static NegotiationState after(OfferResponse response) {
        switch (response) {
            case ACCEPTED:
                return ACCEPTED;
            case COUNTERED:
                return COUNTERED;
            case REJECTED:
                return REJECTED;
            case WALKED_AWAY:
                return WALKED_AWAY;
            default:
                throw new IllegalArgumentException("Unknown response: " + response);
        }
    }

    /**
     * Whether the seller will take another offer.
     */
    public boolean acceptsOffers() {
        return this == AWAITING_OFFER || this == COUNTERED || this == REJECTED;
    }
}
