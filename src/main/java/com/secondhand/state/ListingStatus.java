package com.secondhand.state;

/**
 * Lifecycle of a {@link ListingRecord}.
 */
public enum ListingStatus {

    /**
     * For sale through an agent, waiting for a buyer offer.
     */
    SEARCHING,

    /**
     * Turned up by a search, waiting for the requester.
     */
    FOUND,

    /**
     * An offer exchange is under way (acquisition) or a buyer offer is pending (sale).
     */
    NEGOTIATING,

    SOLD,

    EXPIRED,

    /**
     * Permanently pulled. Never returned by a query again.
     */
    WITHDRAWN;

    public boolean isTerminal() {
        return this == SOLD || this == EXPIRED || this == WITHDRAWN;
    }
}
