package com.secondhand.core;

import com.google.common.base.Stopwatch;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.secondhand.acquisition.AcquisitionQueue;
import com.secondhand.config.JsonMarketConfig;
import com.secondhand.config.MarketConfig;
import com.secondhand.disposition.DispositionQueue;
import com.secondhand.error.OperationResult;
import com.secondhand.host.HostServices;
import com.secondhand.inspection.InspectionService;
import com.secondhand.negotiation.NegotiationOutcome;
import com.secondhand.persistence.MarketStateStore;
import com.secondhand.state.ItemCategory;
import com.secondhand.state.ListingStatus;
import com.secondhand.state.ListingView;
import com.secondhand.state.MarketClock;
import com.secondhand.state.ResolvedListings;
import com.secondhand.state.SaleItem;
import com.secondhand.state.SaleView;
import com.secondhand.state.SearchView;
import com.secondhand.status.MarketStatistics;
import com.secondhand.status.StatisticType;
import com.secondhand.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One host session's market: the entry point for clock events, player operations and
 * queries.
 *
 * <p>All state hangs off this object; nothing is process-wide. Calls are expected from the
 * host's single simulation thread, so nothing here locks. Each hour tick runs inspections
 * first, then searches and found listings, then sales.
 */
@Slf4j
@Singleton
public class MarketSession {

    private final MarketConfig config;
    private final MarketClock clock;
    private final AcquisitionQueue acquisition;
    private final DispositionQueue disposition;
    private final InspectionService inspections;
    private final MarketStatistics statistics;
    private final ResolvedListings resolved;
    private final MarketStateStore store;

    @Inject
    public MarketSession(MarketConfig config, MarketClock clock, AcquisitionQueue acquisition,
                         DispositionQueue disposition, InspectionService inspections,
                         MarketStatistics statistics, ResolvedListings resolved, MarketStateStore store) {
        this.config = config;
        this.clock = clock;
        this.acquisition = acquisition;
        this.disposition = disposition;
        this.inspections = inspections;
        this.statistics = statistics;
        this.resolved = resolved;
        this.store = store;
    }

    /**
     * Open a session with config from {@code /config/market.json} and unseeded randomness.
     */
    public static MarketSession open(HostServices host) {
        return open(host, JsonMarketConfig.fromClasspath(), new Randomization());
    }

    public static MarketSession open(HostServices host, MarketConfig config, Randomization randomization) {
        Injector injector = Guice.createInjector(new MarketModule(host, config, randomization));
        return injector.getInstance(MarketSession.class);
    }

    // ========================================================================
    // Clock events
    // ========================================================================

    /**
     * Host hour event. Each call advances every timer by one hour; an hour at or behind the
     * current one is ignored.
     */
    public void onHourTick(long currentHour) {
        if (!clock.advanceTo(currentHour)) {
            return;
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        inspections.onHourTick();
        acquisition.onHourTick();
        disposition.onHourTick();
        resolved.cleanUp();

        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        if (elapsed > config.slowTickWarnMillis()) {
            log.warn("Hour tick {} took {}ms", currentHour, elapsed);
        } else {
            log.trace("Hour tick {} took {}ms", currentHour, elapsed);
        }
    }

    /**
     * Host month event.
     */
    public void onPeriodTick() {
        acquisition.onPeriodTick();
        disposition.onPeriodTick();
        log.debug("Period tick at hour {}", clock.currentHour());
    }

    public long currentHour() {
        return clock.currentHour();
    }

    // ========================================================================
    // Acquisition
    // ========================================================================

    public OperationResult<SearchView> requestSearch(String requesterId, ItemCategory category,
                                                     int qualityTier, int agentTier) {
        return acquisition.requestSearch(requesterId, category, qualityTier, agentTier);
    }

    public OperationResult<SearchView> renewSearch(String searchId) {
        return acquisition.renewSearch(searchId);
    }

    public OperationResult<Void> cancelSearch(String searchId) {
        return acquisition.cancelSearch(searchId);
    }

    public OperationResult<ListingView> viewListing(String listingId, String requesterId) {
        return acquisition.viewListing(listingId, requesterId);
    }

    public OperationResult<NegotiationOutcome> submitOffer(String listingId, String offererId, long amount) {
        if (disposition.findListing(listingId).isPresent()) {
            return OperationResult.validation("Listing " + listingId + " is a sale listing; buyers are found by the agent");
        }
        return acquisition.submitOffer(listingId, offererId, amount);
    }

    public OperationResult<NegotiationOutcome> acceptCounter(String listingId, String buyerId) {
        return acquisition.acceptCounter(listingId, buyerId);
    }

    public OperationResult<NegotiationOutcome> standFirm(String listingId, String buyerId) {
        return acquisition.standFirm(listingId, buyerId);
    }

    public OperationResult<ListingView> purchaseListing(String listingId, String buyerId) {
        return acquisition.purchaseListing(listingId, buyerId);
    }

    // ========================================================================
    // Disposition
    // ========================================================================

    public OperationResult<SaleView> listForSale(String ownerId, SaleItem item, int agentTier) {
        return disposition.listForSale(ownerId, item, agentTier);
    }

    public OperationResult<Void> cancelSale(String saleId) {
        return disposition.cancelSale(saleId);
    }

    public OperationResult<SaleView> acceptOffer(String listingId) {
        return disposition.acceptOffer(listingId);
    }

    public OperationResult<SaleView> declineOffer(String listingId) {
        return disposition.declineOffer(listingId);
    }

    // ========================================================================
    // Inspection
    // ========================================================================

    public OperationResult<Void> requestInspection(String listingId, int tier) {
        if (disposition.findListing(listingId).isPresent()) {
            return OperationResult.validation("Only found listings can be inspected");
        }
        return inspections.requestInspection(listingId, tier);
    }

    public OperationResult<Void> cancelInspection(String listingId) {
        return inspections.cancelInspection(listingId);
    }

    public OperationResult<Long> getInspectionHoursRemaining(String listingId) {
        return inspections.getInspectionHoursRemaining(listingId);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<SearchView> getActiveSearches(String requesterId) {
        return acquisition.getActiveSearches(requesterId);
    }

    /**
     * Found listings and sale listings belonging to {@code requesterId}.
     */
    public List<ListingView> getActiveListings(String requesterId) {
        List<ListingView> views = new ArrayList<>(acquisition.getActiveListings(requesterId));
        disposition.getSaleListings(requesterId).forEach(sale ->
                disposition.findListing(sale.getListingId()).ifPresent(l -> views.add(l.toView())));
        return views;
    }

    public List<SaleView> getSaleListings(String ownerId) {
        return disposition.getSaleListings(ownerId);
    }

    /**
     * Hours left on a live listing, search or sale.
     */
    public OperationResult<Integer> getHoursRemaining(String id) {
        Optional<Integer> hours = acquisition.hoursRemaining(id);
        if (hours.isEmpty()) {
            hours = disposition.hoursRemaining(id);
        }
        if (hours.isPresent()) {
            return OperationResult.success(hours.get());
        }
        Optional<ListingStatus> finalStatus = resolved.lookup(id);
        if (finalStatus.isPresent()) {
            return OperationResult.race(id + " was already " + finalStatus.get().name().toLowerCase(Locale.ROOT));
        }
        return OperationResult.validation("Nothing active with id " + id);
    }

    public Map<StatisticType, Long> getStatistics(String ownerId) {
        return statistics.snapshot(ownerId);
    }

    /**
     * Owner of a live search, listing or sale.
     */
    public Optional<String> ownerOf(String id) {
        Optional<String> owner = acquisition.ownerOf(id);
        return owner.isPresent() ? owner : disposition.ownerOf(id);
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public boolean save(Path path) {
        return store.save(path);
    }

    public Optional<MarketStateStore.LoadSummary> load(Path path) {
        return store.load(path);
    }
}
