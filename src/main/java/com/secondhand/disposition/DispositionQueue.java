package com.secondhand.disposition;

import com.secondhand.condition.AgentTier;
import com.secondhand.condition.ConditionGenerator;
import com.secondhand.condition.Generation;
import com.secondhand.config.MarketConfig;
import com.secondhand.error.OperationResult;
import com.secondhand.host.ItemCustody;
import com.secondhand.host.MarketNotifier;
import com.secondhand.host.MoneyLedger;
import com.secondhand.host.WeatherService;
import com.secondhand.negotiation.NegotiationEngine;
import com.secondhand.negotiation.SellerPersonality;
import com.secondhand.state.IdSequence;
import com.secondhand.state.ListingOrigin;
import com.secondhand.state.ListingRecord;
import com.secondhand.state.ListingStatus;
import com.secondhand.state.MarketClock;
import com.secondhand.state.OfferDecision;
import com.secondhand.state.PendingOffer;
import com.secondhand.state.ResolvedListings;
import com.secondhand.state.SaleItem;
import com.secondhand.state.SaleRequest;
import com.secondhand.state.SaleView;
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
import java.util.stream.Collectors;

/**
 * Owner-initiated sales through an agent.
 *
 * <p>Sole writer of {@link SaleRequest}s and of {@link ListingOrigin#DISPOSITION} listings.
 * A sale listing starts {@link ListingStatus#SEARCHING}; every offer interval the agent rolls
 * for a buyer, and a buyer offer moves the listing to {@link ListingStatus#NEGOTIATING} until
 * the owner answers or the offer lapses. The agent fee is charged up front and never refunded.
 */
@Slf4j
@Singleton
public class DispositionQueue {

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
    private final ItemCustody custody;

    private final Map<String, SaleRequest> sales = new LinkedHashMap<>();
    private final Map<String, ListingRecord> listings = new LinkedHashMap<>();

    @Inject
    public DispositionQueue(Randomization randomization, MarketConfig config, ConditionGenerator generator,
                            NegotiationEngine negotiation, MarketClock clock, ResolvedListings resolved,
                            IdSequence ids, MarketStatistics statistics, MarketNotifier notifier,
                            MoneyLedger ledger, WeatherService weather, ItemCustody custody) {
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
        this.custody = custody;
    }

    // ========================================================================
    // Operations
    // ========================================================================

    /**
     * List an owned item through an agent. The item is reserved and the fee charged before
     * anything is created; a failed charge releases the reservation.
     */
    public OperationResult<SaleView> listForSale(String ownerId, SaleItem item, int agentIndex) {
        if (ownerId == null || ownerId.isEmpty()) {
            return OperationResult.validation("A sale needs an owner");
        }
        if (item == null) {
            return notifier.reject(ownerId, OperationResult.validation("Nothing to sell"));
        }
        if (item.getSellValue() <= 0) {
            return notifier.reject(ownerId, OperationResult.validation(item.getName() + " has no resale value"));
        }
        Optional<AgentTier> tier = AgentTier.fromIndex(agentIndex);
        if (tier.isEmpty()) {
            return notifier.reject(ownerId, OperationResult.validation("Unknown agent tier " + agentIndex));
        }
        AgentTier agent = tier.get();

        long listed = sales.values().stream().filter(s -> s.getOwnerId().equals(ownerId)).count();
        if (listed >= config.maxSaleListings()) {
            return notifier.reject(ownerId, OperationResult.validation(
                    "You already have " + listed + " items listed"));
        }
        boolean alreadyListed = sales.values().stream()
                .anyMatch(s -> s.getOwnerId().equals(ownerId) && s.getItem().getItemId().equals(item.getItemId()));
        if (alreadyListed) {
            return notifier.reject(ownerId, OperationResult.validation(item.getName() + " is already listed"));
        }
        if (!custody.reserve(ownerId, item.getItemId())) {
            return notifier.reject(ownerId, OperationResult.validation(
                    "You don't have " + item.getName() + " available to sell"));
        }

        long fee = agent.saleFee(item.getSellValue());
        if (!ledger.debit(ownerId, fee)) {
            custody.release(ownerId, item.getItemId());
            return notifier.reject(ownerId, OperationResult.funds(
                    String.format("Insufficient funds for the $%,d agent fee", fee)));
        }

        String saleId = ids.next(IdSequence.SALE);
        ListingRecord listing = createListing(ownerId, saleId, item, agent);
        SaleRequest sale = SaleRequest.builder()
                .id(saleId)
                .ownerId(ownerId)
                .item(item)
                .agentTier(agent)
                .feePaid(fee)
                .createdAtHour(clock.currentHour())
                .listingId(listing.getId())
                .hoursUntilOfferCheck(agent.getOfferIntervalHours())
                .build();
        sales.put(saleId, sale);
        listings.put(listing.getId(), listing);
        statistics.increment(ownerId, StatisticType.SALES_LISTED);

        log.info("Sale {} listed: {} via {} agent, fee={} lifetime={}h",
                saleId, item.getName(), agent.getDisplayName(), fee, listing.getTtlHours());
        notifier.info(ownerId, String.format("%s listed with a %s agent for $%,d",
                item.getName(), agent.getDisplayName(), fee));
        return OperationResult.success(sale.toView(listing));
    }

    /**
     * Take the pending buyer offer: the owner is paid and the item leaves their inventory.
     */
    public OperationResult<SaleView> acceptOffer(String listingId) {
        OperationResult<SaleRequest> lookup = saleWithOffer(listingId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        SaleRequest sale = lookup.getValue();
        ListingRecord listing = listings.get(listingId);
        PendingOffer offer = sale.closePendingOffer(OfferDecision.ACCEPTED);

        ledger.credit(sale.getOwnerId(), offer.getAmount());
        custody.surrender(sale.getOwnerId(), sale.getItem().getItemId());
        listing.setAskingPrice(offer.getAmount());
        finish(sale, listing, ListingStatus.SOLD);
        statistics.increment(sale.getOwnerId(), StatisticType.SALES_COMPLETED);

        log.info("Sale {} completed for {}", sale.getId(), offer.getAmount());
        notifier.ok(sale.getOwnerId(), String.format("Sold %s for $%,d",
                sale.getItem().getName(), offer.getAmount()));
        return OperationResult.success(sale.toView(listing));
    }

    /**
     * Turn down the pending buyer offer; the agent resumes looking.
     */
    public OperationResult<SaleView> declineOffer(String listingId) {
        OperationResult<SaleRequest> lookup = saleWithOffer(listingId);
        if (lookup.isFailure()) {
            return lookup.asFailure();
        }
        SaleRequest sale = lookup.getValue();
        ListingRecord listing = listings.get(listingId);
        PendingOffer offer = sale.closePendingOffer(OfferDecision.DECLINED);
        resumeSearching(sale, listing);

        log.debug("Sale {}: offer of {} declined", sale.getId(), offer.getAmount());
        notifier.info(sale.getOwnerId(), String.format("Declined $%,d for %s, your agent keeps looking",
                offer.getAmount(), sale.getItem().getName()));
        return OperationResult.success(sale.toView(listing));
    }

    /**
     * Withdraw a sale. Refused while a buyer offer is pending; the fee is not refunded.
     */
    public OperationResult<Void> cancelSale(String saleId) {
        SaleRequest sale = sales.get(saleId);
        if (sale == null) {
            Optional<ListingStatus> finalStatus = resolved.lookup(saleId);
            if (finalStatus.isPresent()) {
                return OperationResult.race("Sale " + saleId + " was already " + describe(finalStatus.get()));
            }
            return OperationResult.validation("No sale " + saleId);
        }
        if (sale.hasPendingOffer()) {
            return notifier.reject(sale.getOwnerId(), OperationResult.validation(
                    "Accept or decline the pending offer before cancelling"));
        }

        ListingRecord listing = listings.get(sale.getListingId());
        custody.release(sale.getOwnerId(), sale.getItem().getItemId());
        finish(sale, listing, ListingStatus.WITHDRAWN);
        statistics.increment(sale.getOwnerId(), StatisticType.SALES_CANCELLED);

        log.info("Sale {} cancelled, fee {} kept by agent", saleId, sale.getFeePaid());
        notifier.info(sale.getOwnerId(), sale.getItem().getName() + " taken off the market; the agent fee is not refunded");
        return OperationResult.done();
    }

    // ========================================================================
    // Ticks
    // ========================================================================

    /**
     * Advance every sale by one hour: listing lifetime, offer lapses, then buyer checks.
     */
    public void onHourTick() {
        long hour = clock.currentHour();
        for (SaleRequest sale : new ArrayList<>(sales.values())) {
            ListingRecord listing = listings.get(sale.getListingId());

            if (listing.tickTtl()) {
                expire(sale, listing);
                continue;
            }

            PendingOffer pending = sale.getPendingOffer();
            if (pending != null) {
                if (pending.isLapsed(hour)) {
                    sale.closePendingOffer(OfferDecision.LAPSED);
                    resumeSearching(sale, listing);
                    log.debug("Sale {}: offer of {} lapsed", sale.getId(), pending.getAmount());
                    notifier.warning(sale.getOwnerId(), String.format(
                            "The $%,d offer for %s lapsed, your agent keeps looking",
                            pending.getAmount(), sale.getItem().getName()));
                }
                continue;
            }

            int untilCheck = sale.getHoursUntilOfferCheck() - 1;
            if (untilCheck > 0) {
                sale.setHoursUntilOfferCheck(untilCheck);
                continue;
            }
            sale.setHoursUntilOfferCheck(sale.getAgentTier().getOfferIntervalHours());
            if (randomization.chance(sale.getAgentTier().getOfferChance())) {
                receiveOffer(sale, listing, hour);
            }
        }
    }

    public void onPeriodTick() {
        listings.values().forEach(ListingRecord::incrementPeriodsOnMarket);
    }

    private void receiveOffer(SaleRequest sale, ListingRecord listing, long hour) {
        long amount = negotiation.proposeBuyerOffer(
                sale.getAgentTier(), sale.getItem().getSellValue(), weather.currentWeather());
        sale.setPendingOffer(new PendingOffer(amount, hour, hour + config.saleOfferWindowHours()));
        listing.setStatus(ListingStatus.NEGOTIATING);
        statistics.increment(sale.getOwnerId(), StatisticType.OFFERS_RECEIVED);

        log.info("Sale {}: buyer offers {}", sale.getId(), amount);
        notifier.info(sale.getOwnerId(), String.format("A buyer offers $%,d for %s (%d hours to answer)",
                amount, sale.getItem().getName(), config.saleOfferWindowHours()));
    }

    private void resumeSearching(SaleRequest sale, ListingRecord listing) {
        listing.setStatus(ListingStatus.SEARCHING);
        sale.setHoursUntilOfferCheck(sale.getAgentTier().getOfferIntervalHours());
    }

    private void expire(SaleRequest sale, ListingRecord listing) {
        if (sale.hasPendingOffer()) {
            sale.closePendingOffer(OfferDecision.LAPSED);
        }
        custody.release(sale.getOwnerId(), sale.getItem().getItemId());
        finish(sale, listing, ListingStatus.EXPIRED);
        statistics.increment(sale.getOwnerId(), StatisticType.SALES_EXPIRED);

        log.info("Sale {} expired unsold", sale.getId());
        notifier.warning(sale.getOwnerId(), "No buyer for " + sale.getItem().getName()
                + "; it is back in your inventory");
    }

    private void finish(SaleRequest sale, ListingRecord listing, ListingStatus finalStatus) {
        listing.setStatus(finalStatus);
        sales.remove(sale.getId());
        listings.remove(listing.getId());
        resolved.record(listing.getId(), finalStatus);
        resolved.record(sale.getId(), finalStatus);
    }

    private ListingRecord createListing(String ownerId, String saleId, SaleItem item, AgentTier agent) {
        double hiddenQuality = item.getHiddenQuality() != null
                ? Randomization.clamp(item.getHiddenQuality(), 0.0, 1.0)
                : generator.drawHiddenQuality(item.getDamage());
        return ListingRecord.builder()
                .id(ids.next(IdSequence.LISTING))
                .origin(ListingOrigin.DISPOSITION)
                .categoryId(item.getCategoryId())
                .categoryName(item.getName())
                .ownerId(ownerId)
                .sourceId(saleId)
                .itemId(item.getItemId())
                .status(ListingStatus.SEARCHING)
                .createdAtHour(clock.currentHour())
                .ttlHours(agent.getSaleLifetimeHours())
                .hiddenQuality(hiddenQuality)
                .personality(SellerPersonality.fromHiddenQuality(hiddenQuality))
                .generation(Generation.forAge(item.getAge()))
                .age(item.getAge())
                .operatingHours(item.getOperatingHours())
                .damage(item.getDamage())
                .wear(item.getWear())
                .basePrice(item.getBasePrice() > 0 ? item.getBasePrice() : item.getSellValue())
                .askingPrice(item.getSellValue())
                .build();
    }

    private OperationResult<SaleRequest> saleWithOffer(String listingId) {
        ListingRecord listing = listings.get(listingId);
        if (listing == null) {
            Optional<ListingStatus> finalStatus = resolved.lookup(listingId);
            if (finalStatus.isPresent()) {
                return OperationResult.race("Listing " + listingId + " was already " + describe(finalStatus.get()));
            }
            return OperationResult.validation("No sale listing " + listingId);
        }
        SaleRequest sale = sales.get(listing.getSourceId());
        PendingOffer pending = sale.getPendingOffer();
        if (pending == null) {
            return notifier.reject(sale.getOwnerId(), OperationResult.race(
                    "There is no pending offer for " + sale.getItem().getName()));
        }
        if (pending.isLapsed(clock.currentHour())) {
            return notifier.reject(sale.getOwnerId(), OperationResult.race(
                    "The offer for " + sale.getItem().getName() + " has lapsed"));
        }
        return OperationResult.success(sale);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<SaleView> getSaleListings(String ownerId) {
        return sales.values().stream()
                .filter(s -> s.getOwnerId().equals(ownerId))
                .map(s -> s.toView(listings.get(s.getListingId())))
                .collect(Collectors.toList());
    }

    /**
     * Hours left on a live sale listing, looked up by listing or sale id.
     */
    public Optional<Integer> hoursRemaining(String id) {
        ListingRecord listing = listings.get(id);
        if (listing == null) {
            SaleRequest sale = sales.get(id);
            listing = sale == null ? null : listings.get(sale.getListingId());
        }
        return listing == null ? Optional.empty() : Optional.of(listing.getTtlHours());
    }

    /**
     * Owner behind a live sale, by listing or sale id.
     */
    public Optional<String> ownerOf(String id) {
        ListingRecord listing = listings.get(id);
        if (listing != null) {
            return Optional.of(listing.getOwnerId());
        }
        SaleRequest sale = sales.get(id);
        return sale == null ? Optional.empty() : Optional.of(sale.getOwnerId());
    }

    public Optional<ListingRecord> findListing(String listingId) {
        return Optional.ofNullable(listings.get(listingId));
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public Collection<SaleRequest> liveSales() {
        return Collections.unmodifiableCollection(sales.values());
    }

    public Collection<ListingRecord> liveListings() {
        return Collections.unmodifiableCollection(listings.values());
    }

    /**
     * Replace the live set. Sales whose listing didn't survive the load, and listings with
     * no sale, are dropped.
     */
    public void restore(Collection<SaleRequest> restoredSales, Collection<ListingRecord> restoredListings) {
        sales.clear();
        listings.clear();
        Map<String, ListingRecord> byId = new LinkedHashMap<>();
        restoredListings.forEach(l -> byId.put(l.getId(), l));

        for (SaleRequest sale : restoredSales) {
            ListingRecord listing = byId.remove(sale.getListingId());
            if (listing == null) {
                log.warn("Dropping sale {}: listing {} missing from save", sale.getId(), sale.getListingId());
                continue;
            }
            sales.put(sale.getId(), sale);
            listings.put(listing.getId(), listing);
            ids.observe(sale.getId());
            ids.observe(listing.getId());
        }
        byId.keySet().forEach(id -> log.warn("Dropping sale listing {}: no sale in save", id));
        log.debug("Restored {} sales", sales.size());
    }

    private static String describe(ListingStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
