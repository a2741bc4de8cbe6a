package com.secondhand.acquisition;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.secondhand.condition.AgentTier;
import com.secondhand.condition.ConditionGenerator;
import com.secondhand.condition.GeneratedCondition;
import com.secondhand.condition.QualityHint;
import com.secondhand.condition.QualityTier;
import com.secondhand.config.MarketConfig;
import com.secondhand.error.OperationResult;
import com.secondhand.host.CreditScoreProvider;
import com.secondhand.host.ItemCustody;
import com.secondhand.host.MarketNotifier;
import com.secondhand.host.MoneyLedger;
import com.secondhand.host.WeatherService;
import com.secondhand.inspection.InspectableListings;
import com.secondhand.inspection.InspectionRecord;
import com.secondhand.negotiation.NegotiationContext;
import com.secondhand.negotiation.NegotiationEngine;
import com.secondhand.negotiation.NegotiationOutcome;
import com.secondhand.negotiation.NegotiationRecord;
import com.secondhand.negotiation.OfferResponse;
import com.secondhand.state.ConditionField;
import com.secondhand.state.IdSequence;
import com.secondhand.state.ItemCategory;
import com.secondhand.state.ListingOrigin;
import com.secondhand.state.ListingRecord;
import com.secondhand.state.ListingStatus;
import com.secondhand.state.ListingView;
import com.secondhand.state.MarketClock;
import com.secondhand.state.ResolvedListings;
import com.secondhand.state.SearchRequest;
import com.secondhand.state.SearchStatus;
import com.secondhand.state.SearchView;
import com.secondhand.status.MarketStatistics;
import com.secondhand.status.StatisticType;
import com.secondhand.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Commissioned searches and the listings they turn up.
 *
 * <p>Sole writer of {@link SearchRequest}s and of {@link ListingOrigin#ACQUISITION} listings.
 * Searches count down one hour per tick and resolve by a success roll; found listings hold
 * their offer window closed until the requester first interacts with them.
 *
 * <p>Every operation re-validates against current state, so a second request on a listing
 * that was already bought, withdrawn or expired gets a race error instead of a duplicate
 * mutation.
 */
@Slf4j
@Singleton
public class AcquisitionQueue implements InspectableListings {

    private final Randomization randomization;
    private final MarketConfig config;
    private final ConditionGenerator generator;
    private final NegotiationEngine negotiation;
    private final MarketClock clock;
    private final ResolvedListings resolved;
    private final IdSequence ids;
    private final MarketStatistics statistics;
    private final MarketNotifier notifier;
    private final MoneyLedger ledger;
    private final WeatherService weather;
    private final CreditScoreProvider creditScores;
    private final ItemCustody custody;

    private final Map<String, SearchRequest> searches = new LinkedHashMap<>();
    private final Map<String, ListingRecord> listings = new LinkedHashMap<>();

    /**
     * Searches that left the live set, kept briefly so they can be renewed.
     */
    private final Cache<String, SearchRequest> finishedSearches;

    @Inject
    public AcquisitionQueue(Randomization randomization, MarketConfig config, ConditionGenerator generator,
                            NegotiationEngine negotiation, MarketClock clock, ResolvedListings resolved,
                            IdSequence ids, MarketStatistics statistics, MarketNotifier notifier,
                            MoneyLedger ledger, WeatherService weather, CreditScoreProvider creditScores,
                            ItemCustody custody) {
        this.randomization = randomization;
        this.config = config;
        this.generator = generator;
        this.negotiation = negotiation;
        this.clock = clock;
        this.resolved = resolved;
        this.ids = ids;
        this.statistics = statistics;
        this.notifier = notifier;
        this.ledger = ledger;
        this.weather = weather;
        this.creditScores = creditScores;
        this.custody = custody;
        this.finishedSearches = CacheBuilder.newBuilder()
                .maximumSize(Math.max(1, config.resolvedIdMemory()))
                .build();
    }

    // ========================================================================
    // Searches
    // ========================================================================

    /**
     * Commission a search. Unknown tier indices fall back to the Regional agent and the
     * "Any" quality tier; a search request never fails on a malformed tier.
     *
     * @return the new search, or a validation/funds error with nothing charged
     */
    public OperationResult<SearchView> requestSearch(String requesterId, ItemCategory category,
                                                     int qualityIndex, int agentIndex) {
        if (requesterId == null || requesterId.isEmpty()) {
            return OperationResult.validation("A search needs a requester");
        }
        if (category == null) {
            return notifier.reject(requesterId, OperationResult.validation("A search needs an item category"));
        }
        if (category.getBasePrice() <= 0) {
            return notifier.reject(requesterId, OperationResult.validation(
                    "Category " + category.getName() + " has no base price"));
        }
        return startSearch(requesterId, category, QualityTier.fromIndexOrFallback(qualityIndex),
                AgentTier.fromIndexOrFallback(agentIndex));
    }

    /**
     * Run a finished search again with the same parameters, for a fresh fee.
     */
    public OperationResult<SearchView> renewSearch(String searchId) {
        SearchRequest previous = searches.get(searchId);
        if (previous == null) {
            previous = finishedSearches.getIfPresent(searchId);
        }
        if (previous == null) {
            return OperationResult.validation("No search " + searchId + " to renew");
        }
        if (previous.getStatus() == SearchStatus.ACTIVE) {
            return notifier.reject(previous.getRequesterId(),
                    OperationResult.validation("Search " + searchId + " is still running"));
        }
        if (previous.getStatus() == SearchStatus.CANCELLED) {
            return notifier.reject(previous.getRequesterId(),
                    OperationResult.validation("Search " + searchId + " was cancelled"));
        }
        return startSearch(previous.getRequesterId(), previous.getCategory(),
                previous.getQualityTier(), previous.getAgentTier());
    }

    /**
     * Stop an active search. The fee is not refunded.
     */
    public OperationResult<Void> cancelSearch(String searchId) {
        SearchRequest search = searches.get(searchId);
        if (search == null) {
            SearchRequest finished = finishedSearches.getIfPresent(searchId);
            if (finished != null) {
                return notifier.reject(finished.getRequesterId(), OperationResult.race(
                        "Search " + searchId + " was already " + describe(finished.getStatus())));
            }
            return OperationResult.validation("No search " + searchId);
        }
        if (search.getStatus() != SearchStatus.ACTIVE) {
            return notifier.reject(search.getRequesterId(), OperationResult.race(
                    "Search " + searchId + " was already " + describe(search.getStatus())));
        }

        search.setStatus(SearchStatus.CANCELLED);
        search.setCompletedAtHour(clock.currentHour());
        retire(search);
        statistics.increment(search.getRequesterId(), StatisticType.SEARCHES_CANCELLED);
        log.info("Search {} cancelled by {}", searchId, search.getRequesterId());
        notifier.info(search.getRequesterId(), "Search for " + search.getCategory().getName() + " cancelled");
        return OperationResult.done();
    }

    private OperationResult<SearchView> startSearch(String requesterId, ItemCategory category,
                                                    QualityTier quality, AgentTier agent) {
        long active = searches.values().stream()
                .filter(s -> s.getRequesterId().equals(requesterId) && s.getStatus() == SearchStatus.ACTIVE)
                .count();
        if (active >= config.maxActiveSearches()) {
            return notifier.reject(requesterId, OperationResult.validation(
                    "You already have " + active + " active searches"));
        }

        double creditModifier = CreditScoreProvider.feeModifier(creditScores.creditScore(requesterId));
        long fee = agent.searchFee(category.getBasePrice(), creditModifier);
        if (fee > 0 && !ledger.debit(requesterId, fee)) {
            return notifier.reject(requesterId, OperationResult.funds(
                    String.format("Insufficient funds for the $%,d search fee", fee)));
        }

        int months = randomization.uniformRandomInt(agent.getSearchMinMonths(), agent.getSearchMaxMonths());
        int duration = months * AgentTier.HOURS_PER_MONTH;
        SearchRequest search = SearchRequest.builder()
                .id(ids.next(IdSequence.SEARCH))
                .requesterId(requesterId)
                .category(category)
                .qualityTier(quality)
                .agentTier(agent)
                .feePaid(fee)
                .createdAtHour(clock.currentHour())
                .durationHours(duration)
                .remainingHours(duration)
                .status(SearchStatus.ACTIVE)
                .build();
        searches.put(search.getId(), search);
        statistics.increment(requesterId, StatisticType.SEARCHES_STARTED);

        log.info("Search {} started: {} {} via {} agent, fee={} duration={}h",
                search.getId(), quality.getDisplayName(), category.getName(), agent.getDisplayName(), fee, duration);
        notifier.info(requesterId, String.format("%s agent is searching for %s (%d hours)",
                agent.getDisplayName(), category.getName(), duration));
        return OperationResult.success(search.toView());
    }

    // ========================================================================
    // Listings
    // ========================================================================

    /**
     * Show a found listing to its requester. The first look opens the offer window.
     */
    public OperationResult<ListingView> viewListing(String listingId, String requesterId) {
        OperationResult<ListingRecord> lookup = ownedListing(listingId, requesterId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        touch(listing);
        return OperationResult.success(listing.toView());
    }

    /**
     * Make an offer on a found listing.
     *
     * @return the seller's answer; funds errors leave the listing untouched
     */
    public OperationResult<NegotiationOutcome> submitOffer(String listingId, String offererId, long amount) {
        OperationResult<ListingRecord> lookup = negotiableListing(listingId, offererId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        long asking = listing.getAskingPrice();
        if (amount <= 0) {
            return notifier.reject(offererId, OperationResult.validation("Offer must be positive"));
        }
        if (amount > asking) {
            return notifier.reject(offererId, OperationResult.validation(
                    String.format("Offer $%,d is above the asking price $%,d", amount, asking)));
        }
        long minimum = (long) Math.ceil(asking * config.minOfferFraction());
        if (amount < minimum) {
            return notifier.reject(offererId, OperationResult.validation(
                    String.format("Offer $%,d is below the $%,d minimum", amount, minimum)));
        }

        NegotiationRecord record = listing.getNegotiation();
        NegotiationOutcome outcome = negotiation.respond(record, contextFor(listing), amount);

        if (outcome.getResponse() == OfferResponse.ACCEPTED && !ledger.debit(offererId, amount)) {
            return notifier.reject(offererId, OperationResult.funds(
                    String.format("Insufficient funds to pay $%,d", amount)));
        }
        apply(listing, outcome);
        return OperationResult.success(outcome);
    }

    /**
     * Take the seller's standing counter.
     */
    public OperationResult<NegotiationOutcome> acceptCounter(String listingId, String buyerId) {
        OperationResult<ListingRecord> lookup = negotiableListing(listingId, buyerId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        NegotiationRecord record = listing.getNegotiation();
        if (!record.hasOpenCounter()) {
            return notifier.reject(buyerId, OperationResult.validation("The seller has no counter on the table"));
        }
        long price = record.getCounterAmount();
        if (!ledger.debit(buyerId, price)) {
            return notifier.reject(buyerId, OperationResult.funds(
                    String.format("Insufficient funds to pay $%,d", price)));
        }
        NegotiationOutcome outcome = NegotiationOutcome.builder()
                .listingId(listingId)
                .response(OfferResponse.ACCEPTED)
                .personality(record.getPersonality())
                .offerAmount(price)
                .askingPrice(listing.getAskingPrice())
                .weatherModifier(weather.currentWeather().getNegotiationModifier())
                .build();
        apply(listing, outcome);
        return OperationResult.success(outcome);
    }

    /**
     * Insist on the last offer after a counter.
     */
    public OperationResult<NegotiationOutcome> standFirm(String listingId, String buyerId) {
        OperationResult<ListingRecord> lookup = negotiableListing(listingId, buyerId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        NegotiationRecord record = listing.getNegotiation();
        if (!record.hasOpenCounter()) {
            return notifier.reject(buyerId, OperationResult.validation("The seller has no counter to hold out against"));
        }
        NegotiationOutcome outcome = negotiation.standFirm(record, contextFor(listing));
        if (outcome.getResponse() == OfferResponse.ACCEPTED && !ledger.debit(buyerId, outcome.getOfferAmount())) {
            return notifier.reject(buyerId, OperationResult.funds(
                    String.format("Insufficient funds to pay $%,d", outcome.getOfferAmount())));
        }
        apply(listing, outcome);
        return OperationResult.success(outcome);
    }

    /**
     * Buy a found listing outright at its current asking price.
     */
    public OperationResult<ListingView> purchaseListing(String listingId, String buyerId) {
        OperationResult<ListingRecord> lookup = ownedListing(listingId, buyerId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        ListingRecord listing = lookup.getValue();
        if (listing.isInspectionInProgress()) {
            return notifier.reject(buyerId, OperationResult.validation(
                    "Listing " + listingId + " is out with an inspector"));
        }
        long price = listing.getAskingPrice();
        if (!ledger.debit(buyerId, price)) {
            return notifier.reject(buyerId, OperationResult.funds(
                    String.format("Insufficient funds to pay $%,d", price)));
        }
        sell(listing, price);
        return OperationResult.success(listing.toView());
    }

    private void apply(ListingRecord listing, NegotiationOutcome outcome) {
        NegotiationRecord record = listing.getNegotiation();
        record.applyOutcome(outcome, clock.currentHour(), config.rejectCooldownHours());
        touch(listing);

        switch (outcome.getResponse()) {
            case ACCEPTED:
                sell(listing, outcome.getOfferAmount());
                break;
            case COUNTERED:
                listing.setAskingPrice(outcome.getCounterAmount());
                listing.setStatus(ListingStatus.NEGOTIATING);
                notifier.info(listing.getOwnerId(), outcome.describe());
                break;
            case REJECTED:
                listing.setStatus(ListingStatus.NEGOTIATING);
                notifier.warning(listing.getOwnerId(), outcome.describe());
                break;
            case WALKED_AWAY:
                withdraw(listing);
                break;
            default:
                throw new IllegalStateException("Unhandled response " + outcome.getResponse());
        }
    }

    /**
     * First interaction with a found listing starts its offer window.
     */
    private void touch(ListingRecord listing) {
        if (listing.getStatus() == ListingStatus.FOUND && !listing.isOfferWindowOpen()) {
            listing.openOfferWindow();
            log.debug("Listing {}: offer window open, {}h", listing.getId(), listing.getTtlHours());
        }
    }

    private NegotiationContext contextFor(ListingRecord listing) {
        return NegotiationContext.builder()
                .listingId(listing.getId())
                .askingPrice(listing.getAskingPrice())
                .basePrice(listing.getBasePrice())
                .damage(listing.getDamage())
                .operatingHours(listing.getOperatingHours())
                .daysOnMarket(listing.daysOnMarket(clock.currentHour()))
                .weather(weather.currentWeather())
                .build();
    }

    private void sell(ListingRecord listing, long price) {
        listing.setStatus(ListingStatus.SOLD);
        resolve(listing);
        custody.deliver(listing.getOwnerId(), listing.toView());
        statistics.increment(listing.getOwnerId(), StatisticType.LISTINGS_PURCHASED);
        log.info("Listing {} sold to {} for {}", listing.getId(), listing.getOwnerId(), price);
        notifier.ok(listing.getOwnerId(), String.format("You bought the %s for $%,d",
                listing.getCategoryName(), price));
    }

    private void withdraw(ListingRecord listing) {
        listing.setStatus(ListingStatus.WITHDRAWN);
        resolve(listing);
        statistics.increment(listing.getOwnerId(), StatisticType.LISTINGS_WITHDRAWN);
        log.info("Listing {} withdrawn: seller walked away", listing.getId());
        notifier.warning(listing.getOwnerId(), "The seller of the " + listing.getCategoryName()
                + " walked away and the listing is gone");
    }

    private void expire(ListingRecord listing) {
        listing.setStatus(ListingStatus.EXPIRED);
        resolve(listing);
        statistics.increment(listing.getOwnerId(), StatisticType.LISTINGS_EXPIRED);
        log.info("Listing {} expired", listing.getId());
        notifier.warning(listing.getOwnerId(), "The listing for the " + listing.getCategoryName() + " expired");
    }

    /**
     * Drop a listing from the live set, keeping only its id and final status.
     */
    private void resolve(ListingRecord listing) {
        listings.remove(listing.getId());
        resolved.record(listing.getId(), listing.getStatus());
        SearchRequest search = searches.get(listing.getSourceId());
        if (search != null) {
            search.removeListing(listing.getId());
            if (search.isExhausted()) {
                retire(search);
            }
        }
    }

    private void retire(SearchRequest search) {
        searches.remove(search.getId());
        finishedSearches.put(search.getId(), search);
    }

    private OperationResult<ListingRecord> ownedListing(String listingId, String actorId) {
        ListingRecord listing = listings.get(listingId);
        if (listing == null) {
            Optional<ListingStatus> finalStatus = resolved.lookup(listingId);
            if (finalStatus.isPresent()) {
                return notifier.reject(actorId, OperationResult.race(
                        "Listing " + listingId + " was already " + describe(finalStatus.get())));
            }
            return notifier.reject(actorId, OperationResult.validation("No listing " + listingId));
        }
        if (!listing.getOwnerId().equals(actorId)) {
            return notifier.reject(actorId, OperationResult.validation(
                    "Listing " + listingId + " belongs to another requester"));
        }
        if (listing.getStatus().isTerminal()) {
            return notifier.reject(actorId, OperationResult.race(
                    "Listing " + listingId + " was already " + describe(listing.getStatus())));
        }
        return OperationResult.success(listing);
    }

    private OperationResult<ListingRecord> negotiableListing(String listingId, String actorId) {
        OperationResult<ListingRecord> lookup = ownedListing(listingId, actorId);
        if (lookup.isFailure()) {
            return lookup;
        }
        ListingRecord listing = lookup.getValue();
        if (listing.isInspectionInProgress()) {
            return notifier.reject(actorId, OperationResult.validation(
                    "Listing " + listingId + " is out with an inspector"));
        }
        NegotiationRecord record = listing.getNegotiation();
        if (record == null || !record.getState().acceptsOffers()) {
            return notifier.reject(actorId, OperationResult.race(
                    "The seller of listing " + listingId + " is no longer negotiating"));
        }
        if (record.isCoolingDown(clock.currentHour())) {
            return notifier.reject(actorId, OperationResult.validation(
                    "The seller needs time before hearing another offer"));
        }
        return OperationResult.success(listing);
    }

    // ========================================================================
    // Ticks
    // ========================================================================

    /**
     * Advance every listing TTL and search timer by one hour. Listings found on this tick
     * start counting on the next one.
     */
    public void onHourTick() {
        for (ListingRecord listing : new ArrayList<>(listings.values())) {
            if (listing.tickTtl()) {
                expire(listing);
            }
        }
        for (SearchRequest search : new ArrayList<>(searches.values())) {
            if (search.getStatus() != SearchStatus.ACTIVE) {
                continue;
            }
            int remaining = Math.max(0, search.getRemainingHours() - 1);
            search.setRemainingHours(remaining);
            if (remaining == 0) {
                resolveSearch(search);
            }
        }
    }

    public void onPeriodTick() {
        listings.values().forEach(ListingRecord::incrementPeriodsOnMarket);
    }

    private void resolveSearch(SearchRequest search) {
        search.setCompletedAtHour(clock.currentHour());
        String requester = search.getRequesterId();
        double successChance = search.getAgentTier().searchSuccessChance(search.getQualityTier());

        if (!randomization.chance(successChance)) {
            search.setStatus(SearchStatus.FAILED);
            retire(search);
            statistics.increment(requester, StatisticType.SEARCHES_FAILED);
            log.info("Search {} failed (chance {})", search.getId(), String.format("%.2f", successChance));
            notifier.warning(requester, "Your agent found no " + search.getCategory().getName());
            return;
        }

        int found = search.getAgentTier().getFindCount();
        for (int i = 0; i < found; i++) {
            ListingRecord listing = createListing(search);
            listings.put(listing.getId(), listing);
            search.addListing(listing.getId());
            statistics.increment(requester, StatisticType.ITEMS_FOUND);
        }
        search.setStatus(SearchStatus.RESOLVED);
        statistics.increment(requester, StatisticType.SEARCHES_SUCCEEDED);
        log.info("Search {} resolved with {} listings", search.getId(), found);
        notifier.ok(requester, String.format("Your agent found %d %s listing%s",
                found, search.getCategory().getName(), found == 1 ? "" : "s"));
    }

    private ListingRecord createListing(SearchRequest search) {
        ItemCategory category = search.getCategory();
        GeneratedCondition condition = generator.generate(
                category.getBasePrice(), search.getQualityTier(), search.getAgentTier(), null);
        long commission = (long) Math.floor(condition.getPrice() * config.listingCommission());

        ListingRecord listing = ListingRecord.builder()
                .id(ids.next(IdSequence.LISTING))
                .origin(ListingOrigin.ACQUISITION)
                .categoryId(category.getId())
                .categoryName(category.getName())
                .ownerId(search.getRequesterId())
                .sourceId(search.getId())
                .status(ListingStatus.FOUND)
                .createdAtHour(clock.currentHour())
                .ttlHours(config.foundListingOfferWindowHours())
                .hiddenQuality(condition.getHiddenQuality())
                .personality(negotiation.open(condition.getHiddenQuality()).getPersonality())
                .generation(condition.getGeneration())
                .age(condition.getAge())
                .operatingHours(condition.getOperatingHours())
                .damage(condition.getDamage())
                .wear(condition.getWear())
                .reliability(condition.getReliability())
                .basePrice(category.getBasePrice())
                .askingPrice(condition.getPrice() + commission)
                .commission(commission)
                .quoteIndex(randomization.uniformRandomInt(1, QualityHint.QUOTES_PER_BAND))
                .build();
        listing.setNegotiation(negotiation.open(condition.getHiddenQuality()));
        return listing;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<SearchView> getActiveSearches(String requesterId) {
        return searches.values().stream()
                .filter(s -> s.getRequesterId().equals(requesterId))
                .map(SearchRequest::toView)
                .collect(Collectors.toList());
    }

    public List<ListingView> getActiveListings(String requesterId) {
        return listings.values().stream()
                .filter(l -> l.getOwnerId().equals(requesterId))
                .map(ListingRecord::toView)
                .collect(Collectors.toList());
    }

    /**
     * Hours left on a live listing's TTL or a live search's timer.
     */
    public Optional<Integer> hoursRemaining(String id) {
        ListingRecord listing = listings.get(id);
        if (listing != null) {
            return Optional.of(listing.getTtlHours());
        }
        SearchRequest search = searches.get(id);
        if (search != null) {
            return Optional.of(search.getRemainingHours());
        }
        return Optional.empty();
    }

    /**
     * Requester behind a live search or listing, or a finished search that can still be
     * renewed.
     */
    public Optional<String> ownerOf(String id) {
        ListingRecord listing = listings.get(id);
        if (listing != null) {
            return Optional.of(listing.getOwnerId());
        }
        SearchRequest search = searches.get(id);
        if (search == null) {
            search = finishedSearches.getIfPresent(id);
        }
        return search == null ? Optional.empty() : Optional.of(search.getRequesterId());
    }

    @Override
    public Optional<ListingRecord> findListing(String listingId) {
        return Optional.ofNullable(listings.get(listingId));
    }

    @Override
    public Collection<ListingRecord> liveListings() {
        return Collections.unmodifiableCollection(listings.values());
    }

    @Override
    public void holdForInspection(ListingRecord listing, InspectionRecord inspection) {
        listing.setInspection(inspection);
        listing.setOnHold(true);
    }

    @Override
    public void completeInspection(ListingRecord listing, Set<ConditionField> reveals) {
        listing.reveal(reveals);
        listing.setOnHold(false);
    }

    @Override
    public void abandonInspection(ListingRecord listing) {
        listing.setInspection(null);
        listing.setOnHold(false);
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public Collection<SearchRequest> liveSearches() {
        return Collections.unmodifiableCollection(searches.values());
    }

    /**
     * Replace the live set with restored records.
     */
    public void restore(Collection<SearchRequest> restoredSearches, Collection<ListingRecord> restoredListings) {
        searches.clear();
        listings.clear();
        finishedSearches.invalidateAll();
        for (SearchRequest search : restoredSearches) {
            searches.put(search.getId(), search);
            ids.observe(search.getId());
        }
        for (ListingRecord listing : restoredListings) {
            if (listing.getNegotiation() == null) {
                listing.setNegotiation(negotiation.open(listing.readHiddenQuality()));
            }
            listings.put(listing.getId(), listing);
            ids.observe(listing.getId());
        }
        // A listing the store skipped would keep its search alive forever.
        for (SearchRequest search : List.copyOf(searches.values())) {
            for (String listingId : List.copyOf(search.getListingIds())) {
                if (!listings.containsKey(listingId)) {
                    log.warn("Search {}: listing {} was not restored, dropping it", search.getId(), listingId);
                    search.removeListing(listingId);
                }
            }
            if (search.isExhausted()) {
                retire(search);
            }
        }
        log.debug("Restored {} searches and {} found listings", searches.size(), listings.size());
    }

    private static String describe(Enum<?> status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
