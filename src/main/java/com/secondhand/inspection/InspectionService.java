package com.secondhand.inspection;

import com.secondhand.condition.ConditionRating;
import com.secondhand.error.OperationResult;
import com.secondhand.host.MarketNotifier;
import com.secondhand.host.MoneyLedger;
import com.secondhand.state.ListingRecord;
import com.secondhand.state.ListingStatus;
import com.secondhand.state.ListingView;
import com.secondhand.state.MarketClock;
import com.secondhand.state.ResolvedListings;
import com.secondhand.status.MarketStatistics;
import com.secondhand.status.StatisticType;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Optional;

/**
 * Sends inspectors to found listings and reports back when they finish.
 *
 * <p>An inspection holds the listing (its TTL stops) from request until the hour tick at or
 * after {@code completesAtHour}, then reveals the tier's fields. One inspection per listing.
 */
@Slf4j
@Singleton
public class InspectionService {

    private final InspectableListings listings;
    private final MarketClock clock;
    private final ResolvedListings resolved;
    private final MarketStatistics statistics;
    private final MarketNotifier notifier;
    private final MoneyLedger ledger;

    @Inject
    public InspectionService(InspectableListings listings, MarketClock clock, ResolvedListings resolved,
                             MarketStatistics statistics, MarketNotifier notifier, MoneyLedger ledger) {
        this.listings = listings;
        this.clock = clock;
        this.resolved = resolved;
        this.statistics = statistics;
        this.notifier = notifier;
        this.ledger = ledger;
    }

    /**
     * Book an inspection, charged to the listing's requester. The result arrives as a
     * notification once the inspection completes.
     */
    public OperationResult<Void> requestInspection(String listingId, int tierIndex) {
        Optional<InspectionTier> tier = InspectionTier.fromIndex(tierIndex);
        if (tier.isEmpty()) {
            return OperationResult.validation("Unknown inspection tier " + tierIndex);
        }
        OperationResult<ListingRecord> lookup = lookup(listingId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        String ownerId = listing.getOwnerId();

        InspectionRecord existing = listing.getInspection();
        if (existing != null && existing.isInProgress()) {
            return notifier.reject(ownerId, OperationResult.validation(
                    "An inspection of listing " + listingId + " is already in progress"));
        }
        if (existing != null) {
            return notifier.reject(ownerId, OperationResult.validation(
                    "Listing " + listingId + " has already been inspected"));
        }

        InspectionTier inspectionTier = tier.get();
        long fee = inspectionTier.fee(listing.getAskingPrice());
        if (!ledger.debit(ownerId, fee)) {
            return notifier.reject(ownerId, OperationResult.funds(
                    String.format("Insufficient funds for the $%,d inspection fee", fee)));
        }

        long hour = clock.currentHour();
        InspectionRecord inspection = new InspectionRecord(inspectionTier, hour, fee);
        listings.holdForInspection(listing, inspection);

        log.info("Listing {}: {} booked at hour {}, due {}", listingId, inspectionTier.getDisplayName(),
                hour, inspection.getCompletesAtHour());
        notifier.info(ownerId, String.format("%s of the %s booked, results in %d hours",
                inspectionTier.getDisplayName(), listing.getCategoryName(), inspectionTier.getDurationHours()));
        return OperationResult.done();
    }

    /**
     * Call off an unfinished inspection. The fee is not refunded.
     */
    public OperationResult<Void> cancelInspection(String listingId) {
        OperationResult<ListingRecord> lookup = lookup(listingId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        if (!listing.isInspectionInProgress()) {
            return notifier.reject(listing.getOwnerId(), OperationResult.validation(
                    "No inspection of listing " + listingId + " is in progress"));
        }
        listings.abandonInspection(listing);
        log.info("Listing {}: inspection cancelled", listingId);
        notifier.info(listing.getOwnerId(), "Inspection of the " + listing.getCategoryName() + " cancelled");
        return OperationResult.done();
    }

    public OperationResult<Long> getInspectionHoursRemaining(String listingId) {
        OperationResult<ListingRecord> lookup = lookup(listingId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        InspectionRecord inspection = lookup.getValue().getInspection();
        if (inspection == null) {
            return OperationResult.validation("Listing " + listingId + " has no inspection");
        }
        return OperationResult.success(inspection.hoursRemaining(clock.currentHour()));
    }

    /**
     * Complete every inspection due at the current hour.
     */
    public void onHourTick() {
        long hour = clock.currentHour();
        for (ListingRecord listing : new ArrayList<>(listings.liveListings())) {
            InspectionRecord inspection = listing.getInspection();
            if (inspection == null || !inspection.isDue(hour)) {
                continue;
            }
            inspection.markComplete();
            listings.completeInspection(listing, inspection.getTier().getReveals());
            statistics.increment(listing.getOwnerId(), StatisticType.INSPECTIONS_COMPLETED);

            log.info("Listing {}: {} complete at hour {}", listing.getId(), inspection.getTier().getDisplayName(), hour);
            notifier.ok(listing.getOwnerId(), report(listing));
        }
    }

    private static String report(ListingRecord listing) {
        ListingView view = listing.toView();
        StringBuilder message = new StringBuilder("Inspection of the ")
                .append(listing.getCategoryName())
                .append(" complete");
        ConditionRating rating = view.getRating();
        if (rating != null) {
            message.append(": condition ").append(rating.getDisplayName());
        }
        if (view.getOverallReliability() != null) {
            message.append(String.format(", reliability %.0f%%", view.getOverallReliability() * 100));
        }
        if (view.getQualityHint() != null) {
            message.append(", inspector says \"").append(view.getQualityHint().getDisplayName()).append('"');
        }
        return message.toString();
    }

    private OperationResult<ListingRecord> lookup(String listingId) {
        Optional<ListingRecord> listing = listings.findListing(listingId);
        if (listing.isEmpty()) {
            Optional<ListingStatus> finalStatus = resolved.lookup(listingId);
            if (finalStatus.isPresent()) {
                return OperationResult.race("Listing " + listingId + " was already "
                        + finalStatus.get().name().toLowerCase(Locale.ROOT));
            }
            return OperationResult.validation("No listing " + listingId + " to inspect");
        }
        return OperationResult.success(listing.get());
    }
}
