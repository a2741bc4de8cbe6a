package com.secondhand.acquisition;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.secondhand.condition.AgentTier;
import com.secondhand.condition.QualityTier;
import com.secondhand.config.MarketConfig;
import com.secondhand.core.MarketModule;
import com.secondhand.core.MarketSession;
import com.secondhand.error.ErrorKind;
import com.secondhand.error.OperationResult;
import com.secondhand.host.Severity;
import com.secondhand.negotiation.NegotiationOutcome;
import com.secondhand.negotiation.NegotiationState;
import com.secondhand.negotiation.OfferResponse;
import com.secondhand.state.ItemCategory;
import com.secondhand.state.ListingStatus;
import com.secondhand.state.ListingView;
import com.secondhand.state.SearchStatus;
import com.secondhand.state.SearchView;
import com.secondhand.status.MarketStatistics;
import com.secondhand.status.StatisticType;
import com.secondhand.support.InMemoryHost;
import com.secondhand.support.Listings;
import com.secondhand.support.ScriptedRandomization;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class AcquisitionQueueTest {

    private static final ItemCategory TRACTOR = new ItemCategory("tractor", "Tractor", 100_000);
    private static final long START_FUNDS = 1_000_000;

    private InMemoryHost host;
    private ScriptedRandomization randomization;
    private MarketSession session;
    private AcquisitionQueue acquisition;
    private MarketStatistics statistics;

    @Before
    public void setUp() {
        host = new InMemoryHost().fund("p1", START_FUNDS);
        randomization = new ScriptedRandomization(42L);
        Injector injector = Guice.createInjector(
                new MarketModule(host.services(), new MarketConfig() { }, randomization));
        session = injector.getInstance(MarketSession.class);
        acquisition = injector.getInstance(AcquisitionQueue.class);
        statistics = injector.getInstance(MarketStatistics.class);
    }

    private void tickThrough(long lastHour) {
        for (long hour = session.currentHour() + 1; hour <= lastHour; hour++) {
            session.onHourTick(hour);
        }
    }

    private void seed(double hiddenQuality, long asking) {
        acquisition.restore(List.of(), List.of(Listings.found("LST-1", "p1", hiddenQuality, asking)));
    }

    // ========================================================================
    // Searches
    // ========================================================================

    @Test
    public void testRequestSearch_LocalAgent_ChargesFeeAndResolvesAfterOneMonth() {
        randomization.setForcedChance(true);

        OperationResult<SearchView> result = session.requestSearch("p1", TRACTOR, 1, 1);

        assertTrue("Search should start", result.isSuccess());
        SearchView search = result.getValue();
        assertEquals(4_000, search.getFeePaid());
        assertEquals(START_FUNDS - 4_000, host.balance("p1"));
        assertEquals(24, search.getRemainingHours());
        assertEquals(SearchStatus.ACTIVE, search.getStatus());

        tickThrough(23);
        assertEquals("One hour left", Integer.valueOf(1), session.getHoursRemaining(search.getId()).getValue());
        assertTrue(session.getActiveListings("p1").isEmpty());

        tickThrough(24);
        List<ListingView> listings = session.getActiveListings("p1");
        assertEquals("Local agents find one listing", 1, listings.size());
        ListingView listing = listings.get(0);
        assertEquals(ListingStatus.FOUND, listing.getStatus());
        assertEquals(search.getId(), listing.getSourceId());
        assertEquals(72, listing.getTtlHours());
        assertFalse(listing.isOfferWindowOpen());
        long price = listing.getAskingPrice() - listing.getCommission();
        assertEquals("8% commission on top of the generated price",
                (long) Math.floor(price * 0.08), listing.getCommission());
        assertNull("Rating hidden until inspected", listing.getRating());

        assertEquals(SearchStatus.RESOLVED, session.getActiveSearches("p1").get(0).getStatus());
        assertEquals(1, statistics.get("p1", StatisticType.SEARCHES_SUCCEEDED));
        assertEquals(1, statistics.get("p1", StatisticType.ITEMS_FOUND));
    }

    @Test
    public void testRequestSearch_MalformedTiers_FallBack() {
        OperationResult<SearchView> result = session.requestSearch("p1", TRACTOR, 99, 42);

        assertTrue("Malformed tiers never fail a search", result.isSuccess());
        assertEquals(QualityTier.ANY, result.getValue().getQualityTier());
        assertEquals(AgentTier.REGIONAL, result.getValue().getAgentTier());
        assertEquals(AgentTier.REGIONAL.searchFee(100_000, 0.0), result.getValue().getFeePaid());
    }

    @Test
    public void testRequestSearch_OverCap_Validation() {
        for (int i = 0; i < 5; i++) {
            assertTrue(session.requestSearch("p1", TRACTOR, 1, 1).isSuccess());
        }
        long balance = host.balance("p1");

        OperationResult<SearchView> sixth = session.requestSearch("p1", TRACTOR, 1, 1);

        assertTrue(sixth.failedWith(ErrorKind.VALIDATION));
        assertEquals("Nothing charged", balance, host.balance("p1"));
        assertEquals(5, session.getActiveSearches("p1").size());
    }

    @Test
    public void testRequestSearch_InsufficientFunds_NoMutation() {
        InMemoryHost poor = new InMemoryHost().fund("p2", 1_000);
        MarketSession other = MarketSession.open(poor.services(), new MarketConfig() { }, new ScriptedRandomization(1L));

        OperationResult<SearchView> result = other.requestSearch("p2", TRACTOR, 1, 1);

        assertTrue(result.failedWith(ErrorKind.FUNDS));
        assertEquals(1_000, poor.balance("p2"));
        assertTrue(other.getActiveSearches("p2").isEmpty());
        assertEquals("Funds failures are critical notifications", 1,
                poor.notificationsFor("p2", Severity.CRITICAL).size());
    }

    @Test
    public void testSearchFails_ThenRenew_ChargesAgain() {
        randomization.setForcedChance(false);
        String searchId = session.requestSearch("p1", TRACTOR, 1, 1).getValue().getId();

        tickThrough(24);

        assertTrue("Failed searches leave the live set", session.getActiveSearches("p1").isEmpty());
        assertEquals(1, statistics.get("p1", StatisticType.SEARCHES_FAILED));

        OperationResult<SearchView> renewed = session.renewSearch(searchId);
        assertTrue(renewed.isSuccess());
        assertNotEquals(searchId, renewed.getValue().getId());
        assertEquals(START_FUNDS - 8_000, host.balance("p1"));
    }

    @Test
    public void testCancelSearch_NoRefund_SecondCancelIsRace() {
        String searchId = session.requestSearch("p1", TRACTOR, 1, 1).getValue().getId();

        assertTrue(session.cancelSearch(searchId).isSuccess());
        assertEquals("Fee kept by the agent", START_FUNDS - 4_000, host.balance("p1"));
        assertTrue(session.getActiveSearches("p1").isEmpty());

        assertTrue(session.cancelSearch(searchId).failedWith(ErrorKind.RACE));
        assertTrue("Cancelled searches can't be renewed", session.renewSearch(searchId).failedWith(ErrorKind.VALIDATION));
    }

    // ========================================================================
    // Offers
    // ========================================================================

    @Test
    public void testViewListing_OpensOfferWindow() {
        seed(0.5, 50_000);
        tickThrough(5);
        assertEquals("Window closed: TTL untouched", Integer.valueOf(72), session.getHoursRemaining("LST-1").getValue());

        assertTrue(session.viewListing("LST-1", "p1").getValue().isOfferWindowOpen());
        tickThrough(8);

        assertEquals(Integer.valueOf(69), session.getHoursRemaining("LST-1").getValue());
    }

    @Test
    public void testSubmitOffer_AtAsking_AcceptedAndDelivered() {
        seed(0.5, 100_000);

        OperationResult<NegotiationOutcome> result = session.submitOffer("LST-1", "p1", 100_000);

        assertEquals(OfferResponse.ACCEPTED, result.getValue().getResponse());
        assertEquals(START_FUNDS - 100_000, host.balance("p1"));
        assertEquals(1, host.getDeliveries().size());
        assertTrue(session.getActiveListings("p1").isEmpty());
        assertTrue("Sold listings answer with a race", session.purchaseListing("LST-1", "p1").failedWith(ErrorKind.RACE));
        assertEquals(1, statistics.get("p1", StatisticType.LISTINGS_PURCHASED));
    }

    @Test
    public void testSubmitOffer_AcceptedWithoutFunds_ListingUntouched() {
        InMemoryHost poor = new InMemoryHost().fund("p1", 10_000);
        Injector injector = Guice.createInjector(
                new MarketModule(poor.services(), new MarketConfig() { }, new ScriptedRandomization(3L)));
        MarketSession other = injector.getInstance(MarketSession.class);
        injector.getInstance(AcquisitionQueue.class)
                .restore(List.of(), List.of(Listings.found("LST-1", "p1", 0.5, 100_000)));

        OperationResult<NegotiationOutcome> result = other.submitOffer("LST-1", "p1", 100_000);

        assertTrue(result.failedWith(ErrorKind.FUNDS));
        assertEquals(10_000, poor.balance("p1"));
        ListingView listing = other.getActiveListings("p1").get(0);
        assertEquals(ListingStatus.FOUND, listing.getStatus());
        assertEquals(NegotiationState.AWAITING_OFFER, listing.getNegotiationState());
        assertEquals(0, listing.getNegotiationRounds());
        assertTrue(poor.getDeliveries().isEmpty());
    }

    @Test
    public void testSubmitOffer_OutOfRange_Validation() {
        seed(0.5, 100_000);

        assertTrue(session.submitOffer("LST-1", "p1", 0).failedWith(ErrorKind.VALIDATION));
        assertTrue(session.submitOffer("LST-1", "p1", 100_001).failedWith(ErrorKind.VALIDATION));
        assertTrue("Below half of asking", session.submitOffer("LST-1", "p1", 49_999).failedWith(ErrorKind.VALIDATION));
        assertEquals(START_FUNDS, host.balance("p1"));
    }

    @Test
    public void testSubmitOffer_ForeignRequester_Validation() {
        seed(0.5, 100_000);

        assertTrue(session.submitOffer("LST-1", "p2", 90_000).failedWith(ErrorKind.VALIDATION));
    }

    @Test
    public void testSubmitOffer_Countered_ThenAcceptCounter() {
        seed(0.5, 100_000);
        randomization.setForcedRoll(0.99);

        NegotiationOutcome counter = session.submitOffer("LST-1", "p1", 87_000).getValue();

        assertEquals(OfferResponse.COUNTERED, counter.getResponse());
        ListingView listing = session.getActiveListings("p1").get(0);
        assertEquals(ListingStatus.NEGOTIATING, listing.getStatus());
        assertEquals(counter.getCounterAmount(), listing.getAskingPrice());

        OperationResult<NegotiationOutcome> accepted = session.acceptCounter("LST-1", "p1");

        assertEquals(OfferResponse.ACCEPTED, accepted.getValue().getResponse());
        assertEquals(START_FUNDS - counter.getCounterAmount(), host.balance("p1"));
    }

    @Test
    public void testSubmitOffer_Rejected_CooldownUntilNextHour() {
        seed(0.5, 100_000);
        randomization.setForcedRoll(0.0);

        // Reasonable seller, gap 0.10: reject on a low roll
        assertEquals(OfferResponse.REJECTED, session.submitOffer("LST-1", "p1", 80_000).getValue().getResponse());
        assertTrue(session.submitOffer("LST-1", "p1", 95_000).failedWith(ErrorKind.VALIDATION));

        tickThrough(1);

        assertTrue("Cooldown over", session.submitOffer("LST-1", "p1", 95_000).isSuccess());
    }

    @Test
    public void testSubmitOffer_InsultingOffer_SellerWalksAwayForGood() {
        seed(0.7, 100_000);
        randomization.setForcedRoll(0.0);

        OperationResult<NegotiationOutcome> result = session.submitOffer("LST-1", "p1", 50_000);

        assertEquals(OfferResponse.WALKED_AWAY, result.getValue().getResponse());
        assertTrue(session.getActiveListings("p1").isEmpty());
        assertTrue(session.submitOffer("LST-1", "p1", 99_000).failedWith(ErrorKind.RACE));
        assertTrue(session.purchaseListing("LST-1", "p1").failedWith(ErrorKind.RACE));
        assertTrue(session.getHoursRemaining("LST-1").failedWith(ErrorKind.RACE));
        assertEquals(START_FUNDS, host.balance("p1"));
        assertEquals(1, statistics.get("p1", StatisticType.LISTINGS_WITHDRAWN));
    }

    @Test
    public void testStandFirm_WithoutCounter_Validation() {
        seed(0.5, 100_000);

        assertTrue(session.standFirm("LST-1", "p1").failedWith(ErrorKind.VALIDATION));
    }

    private NegotiationOutcome counterAt87k() {
        seed(0.5, 100_000);
        randomization.setForcedRoll(0.99);
        NegotiationOutcome counter = session.submitOffer("LST-1", "p1", 87_000).getValue();
        assertEquals(OfferResponse.COUNTERED, counter.getResponse());
        return counter;
    }

    @Test
    public void testStandFirm_LowRoll_SellerTakesOriginalOffer() {
        counterAt87k();
        randomization.setForcedRoll(0.1);

        OperationResult<NegotiationOutcome> result = session.standFirm("LST-1", "p1");

        assertEquals(OfferResponse.ACCEPTED, result.getValue().getResponse());
        assertEquals("Pays the offer, not the counter", START_FUNDS - 87_000, host.balance("p1"));
        assertEquals(1, host.getDeliveries().size());
        assertTrue(session.getActiveListings("p1").isEmpty());
        assertEquals(1, statistics.get("p1", StatisticType.LISTINGS_PURCHASED));
    }

    @Test
    public void testStandFirm_MiddleRoll_CounterStands() {
        NegotiationOutcome counter = counterAt87k();
        randomization.setForcedRoll(0.5);

        OperationResult<NegotiationOutcome> result = session.standFirm("LST-1", "p1");

        assertEquals(OfferResponse.COUNTERED, result.getValue().getResponse());
        assertEquals(counter.getCounterAmount(), result.getValue().getCounterAmount());
        ListingView listing = session.getActiveListings("p1").get(0);
        assertEquals(ListingStatus.NEGOTIATING, listing.getStatus());
        assertEquals(counter.getCounterAmount(), listing.getAskingPrice());
        assertEquals(2, listing.getNegotiationRounds());
        assertEquals(START_FUNDS, host.balance("p1"));
        assertTrue("Counter can still be taken", session.acceptCounter("LST-1", "p1").isSuccess());
    }

    @Test
    public void testStandFirm_HighRoll_SellerWalksAway() {
        counterAt87k();
        randomization.setForcedRoll(0.9);

        OperationResult<NegotiationOutcome> result = session.standFirm("LST-1", "p1");

        assertEquals(OfferResponse.WALKED_AWAY, result.getValue().getResponse());
        assertTrue(session.getActiveListings("p1").isEmpty());
        assertTrue(session.acceptCounter("LST-1", "p1").failedWith(ErrorKind.RACE));
        assertEquals(START_FUNDS, host.balance("p1"));
        assertEquals(1, statistics.get("p1", StatisticType.LISTINGS_WITHDRAWN));
    }

    @Test
    public void testStandFirm_AcceptedWithoutFunds_CounterKept() {
        InMemoryHost poor = new InMemoryHost().fund("p1", 10_000);
        ScriptedRandomization rolls = new ScriptedRandomization(3L);
        Injector injector = Guice.createInjector(
                new MarketModule(poor.services(), new MarketConfig() { }, rolls));
        MarketSession other = injector.getInstance(MarketSession.class);
        injector.getInstance(AcquisitionQueue.class)
                .restore(List.of(), List.of(Listings.found("LST-1", "p1", 0.5, 100_000)));
        rolls.setForcedRoll(0.99);
        NegotiationOutcome counter = other.submitOffer("LST-1", "p1", 87_000).getValue();
        rolls.setForcedRoll(0.1);

        OperationResult<NegotiationOutcome> result = other.standFirm("LST-1", "p1");

        assertTrue(result.failedWith(ErrorKind.FUNDS));
        assertEquals(10_000, poor.balance("p1"));
        ListingView listing = other.getActiveListings("p1").get(0);
        assertEquals(ListingStatus.NEGOTIATING, listing.getStatus());
        assertEquals(counter.getCounterAmount(), listing.getAskingPrice());
        assertEquals(1, listing.getNegotiationRounds());
        assertTrue(poor.getDeliveries().isEmpty());
    }

    @Test
    public void testOnPeriodTick_CountsPeriodsOnMarket() {
        seed(0.5, 100_000);

        session.onPeriodTick();
        session.onPeriodTick();

        assertEquals(2, session.getActiveListings("p1").get(0).getPeriodsOnMarket());
    }

    // ========================================================================
    // Expiry
    // ========================================================================

    @Test
    public void testFoundListing_ExpiresAfterWindow() {
        seed(0.5, 100_000);
        session.viewListing("LST-1", "p1");

        tickThrough(72);

        assertTrue(session.getActiveListings("p1").isEmpty());
        assertTrue(session.viewListing("LST-1", "p1").failedWith(ErrorKind.RACE));
        assertEquals(1, statistics.get("p1", StatisticType.LISTINGS_EXPIRED));
    }
}
