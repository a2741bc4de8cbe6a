package com.secondhand.inspection;

import com.secondhand.state.ConditionField;
import com.secondhand.state.ListingRecord;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Listings an inspector may be sent to. Implemented by the queue that owns them, which
 * stays the only writer of the listing records.
 */
public interface InspectableListings {

    Optional<ListingRecord> findListing(String listingId);

    /**
     * Live listings, for the completion check on each hour tick.
     */
    Collection<ListingRecord> liveListings();

    /**
     * Attach an inspection and put the listing on hold.
     */
    void holdForInspection(ListingRecord listing, InspectionRecord inspection);

    /**
     * Reveal what the finished inspection found and lift the hold.
     */
    void completeInspection(ListingRecord listing, Set<ConditionField> reveals);

    /**
     * Drop an unfinished inspection and lift the hold.
     */
    void abandonInspection(ListingRecord listing);
}
