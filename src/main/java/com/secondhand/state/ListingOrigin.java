package com.secondhand.state;

/**
 * Which queue created (and owns) a listing.
 */
public enum ListingOrigin {

    /**
     * Found by a search; the owner id is the requester.
     */
    ACQUISITION,

    /**
     * Listed by its owner through a sale agent.
     */
    DISPOSITION
}
