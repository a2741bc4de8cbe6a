package com.secondhand.negotiation;

import com.secondhand.condition.AgentTier;
import com.secondhand.config.MarketConfig;
import com.secondhand.host.WeatherCondition;
import com.secondhand.util.Randomization;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.Assert.*;
import static org.mockito.Mockito.when;

public class NegotiationEngineTest {

    private static final long ASKING = 100_000;

    @Mock
    private Randomization randomization;

    private NegotiationEngine engine;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        engine = new NegotiationEngine(randomization, new MarketConfig() { });
    }

    private static NegotiationContext context(WeatherCondition weather) {
        return NegotiationContext.builder()
                .listingId("LST-1")
                .askingPrice(ASKING)
                .basePrice(ASKING)
                .damage(0.10)
                .operatingHours(2000)
                .daysOnMarket(0)
                .weather(weather)
                .build();
    }

    private static NegotiationRecord record(SellerPersonality personality) {
        return new NegotiationRecord(personality);
    }

    // ========================================================================
    // Gap bands
    // ========================================================================

    @Test
    public void testRespond_GapExactlyTwentyPercent_AlwaysRejects() {
        when(randomization.roll()).thenReturn(0.0);

        NegotiationOutcome outcome = engine.respond(record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 77_000);

        assertEquals("Gap 0.20 is inside the reject band", 0.20, outcome.getGap(), 1e-9);
        assertEquals(OfferResponse.REJECTED, outcome.getResponse());
    }

    @Test
    public void testRespond_GapJustUnderTwentyPercent_CanCounter() {
        when(randomization.roll()).thenReturn(0.0);

        NegotiationOutcome outcome = engine.respond(record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 77_001);

        assertTrue(outcome.getGap() < 0.20);
        assertEquals("A near-zero roll counters just under the boundary", OfferResponse.COUNTERED, outcome.getResponse());
        assertTrue(outcome.getCounterAmount() > 77_001);
        assertTrue(outcome.getCounterAmount() <= ASKING);
    }

    @Test
    public void testRespond_FirmSellerEightyPercent_RejectBiased() {
        NegotiationEngine seeded = new NegotiationEngine(new Randomization(12345L), new MarketConfig() { });
        int rejects = 0;
        int trials = 10_000;
        for (int i = 0; i < trials; i++) {
            NegotiationOutcome outcome = seeded.respond(
                    record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 80_000);
            assertNotEquals("Walk-away needs a gap above 0.20", OfferResponse.WALKED_AWAY, outcome.getResponse());
            if (outcome.getResponse() == OfferResponse.REJECTED) {
                rejects++;
            }
        }
        double rejectRate = (double) rejects / trials;
        assertTrue("Expected at least 70% rejects, got " + rejectRate, rejectRate >= 0.70);
    }

    @Test
    public void testRespond_OfferAtThreshold_Accepts() {
        when(randomization.roll()).thenReturn(0.99);

        // Reasonable: 0.90 threshold, no tolerance
        NegotiationOutcome outcome = engine.respond(
                record(SellerPersonality.REASONABLE), context(WeatherCondition.SUN), 90_000);

        assertEquals(OfferResponse.ACCEPTED, outcome.getResponse());
        assertEquals(90_000, outcome.getSettledPrice());
    }

    @Test
    public void testRespond_CloseGap_AlwaysCounters() {
        when(randomization.roll()).thenReturn(0.99);

        NegotiationOutcome outcome = engine.respond(
                record(SellerPersonality.REASONABLE), context(WeatherCondition.SUN), 87_000);

        assertEquals(OfferResponse.COUNTERED, outcome.getResponse());
        assertEquals("Counter lands halfway between offer and asking", 93_500, outcome.getCounterAmount());
    }

    @Test
    public void testRespond_HailLowersThreshold() {
        when(randomization.roll()).thenReturn(0.99);

        NegotiationOutcome sunny = engine.respond(
                record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 86_000);
        NegotiationOutcome hail = engine.respond(
                record(SellerPersonality.FIRM), context(WeatherCondition.HAIL), 86_000);

        assertNotEquals(OfferResponse.ACCEPTED, sunny.getResponse());
        assertEquals("Hail takes 12% off a 0.97 threshold", OfferResponse.ACCEPTED, hail.getResponse());
        assertEquals(0.12, hail.getWeatherModifier(), 1e-12);
    }

    @Test
    public void testRespond_InsultingOffer_WalkAwayOnLowRoll() {
        when(randomization.roll()).thenReturn(0.10);

        NegotiationOutcome outcome = engine.respond(
                record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 50_000);

        assertEquals(OfferResponse.WALKED_AWAY, outcome.getResponse());
        assertTrue(outcome.getResponse().isTerminal());
    }

    @Test
    public void testRespond_InsultingOffer_RejectOnHighRoll() {
        when(randomization.roll()).thenReturn(0.95);

        NegotiationOutcome outcome = engine.respond(
                record(SellerPersonality.FIRM), context(WeatherCondition.SUN), 50_000);

        assertEquals(OfferResponse.REJECTED, outcome.getResponse());
    }

    // ========================================================================
    // Immovable sellers
    // ========================================================================

    @Test
    public void testRespond_Immovable_AcceptsAtNinetyEightPercent() {
        when(randomization.roll()).thenReturn(0.5);

        NegotiationOutcome outcome = engine.respond(
                record(SellerPersonality.IMMOVABLE), context(WeatherCondition.SUN), 98_000);

        assertEquals(OfferResponse.ACCEPTED, outcome.getResponse());
    }

    @Test
    public void testRespond_Immovable_NeverCounters() {
        when(randomization.roll()).thenReturn(0.0);

        for (long offer = 60_000; offer < 98_000; offer += 1_000) {
            NegotiationOutcome outcome = engine.respond(
                    record(SellerPersonality.IMMOVABLE), context(WeatherCondition.SUN), offer);
            assertNotEquals("Immovable seller countered " + offer, OfferResponse.COUNTERED, outcome.getResponse());
            assertNotEquals(OfferResponse.ACCEPTED, outcome.getResponse());
        }
    }

    // ========================================================================
    // Stand firm
    // ========================================================================

    private NegotiationRecord countered() {
        NegotiationRecord record = record(SellerPersonality.REASONABLE);
        record.applyOutcome(NegotiationOutcome.builder()
                .listingId("LST-1")
                .response(OfferResponse.COUNTERED)
                .personality(SellerPersonality.REASONABLE)
                .offerAmount(87_000)
                .askingPrice(ASKING)
                .counterAmount(90_000)
                .build(), 10, 1);
        return record;
    }

    @Test
    public void testStandFirm_Splits() {
        NegotiationRecord record = countered();

        when(randomization.roll()).thenReturn(0.10);
        NegotiationOutcome accept = engine.standFirm(record, context(WeatherCondition.SUN));
        assertEquals(OfferResponse.ACCEPTED, accept.getResponse());
        assertEquals("Seller takes the last offer", 87_000, accept.getSettledPrice());

        when(randomization.roll()).thenReturn(0.60);
        NegotiationOutcome hold = engine.standFirm(record, context(WeatherCondition.SUN));
        assertEquals(OfferResponse.COUNTERED, hold.getResponse());
        assertEquals(90_000, hold.getCounterAmount());

        when(randomization.roll()).thenReturn(0.85);
        assertEquals(OfferResponse.WALKED_AWAY,
                engine.standFirm(record, context(WeatherCondition.SUN)).getResponse());
    }

    @Test(expected = IllegalStateException.class)
    public void testStandFirm_NoCounter_Throws() {
        engine.standFirm(record(SellerPersonality.FIRM), context(WeatherCondition.SUN));
    }

    // ========================================================================
    // Situation and buyers
    // ========================================================================

    @Test
    public void testSituationModifier() {
        NegotiationContext worn = NegotiationContext.builder()
                .listingId("LST-2")
                .askingPrice(300_000)
                .basePrice(300_000)
                .damage(0.30)
                .operatingHours(6000)
                .daysOnMarket(100)
                .build();
        // 0.10 cap + 0.05 damage + 0.03 hours - 0.05 expensive
        assertEquals(0.13, NegotiationEngine.situationModifier(worn), 1e-9);
    }

    @Test
    public void testProposeBuyerOffer_WithinTierRange() {
        NegotiationEngine seeded = new NegotiationEngine(new Randomization(7L), new MarketConfig() { });
        for (int i = 0; i < 500; i++) {
            long offer = seeded.proposeBuyerOffer(AgentTier.LOCAL, 50_000, WeatherCondition.STORM);
            assertTrue("Offer " + offer + " under the 60% floor", offer >= 30_000 - 100);
            assertTrue("Offer " + offer + " over the 75% ceiling", offer <= 37_500);
            assertEquals("Offers land on hundreds", 0, offer % 100);
        }
    }

    @Test
    public void testBand_Boundaries() {
        assertEquals(OfferResponse.ACCEPTED, NegotiationEngine.band(0.0, 0.99, 0.9));
        assertEquals(OfferResponse.COUNTERED, NegotiationEngine.band(0.05, 0.0, 0.9));
        assertEquals("Reject chance is 0.30 at the top of the 5-10% band",
                OfferResponse.REJECTED, NegotiationEngine.band(0.10, 0.29, 0.9));
        assertEquals(OfferResponse.COUNTERED, NegotiationEngine.band(0.15, 0.5, 0.9));
        assertEquals(OfferResponse.REJECTED, NegotiationEngine.band(0.15, 0.49, 0.9));
        assertEquals(OfferResponse.REJECTED, NegotiationEngine.band(0.21, 0.95, 0.9));
        assertEquals(OfferResponse.WALKED_AWAY, NegotiationEngine.band(0.21, 0.5, 0.9));
    }
}
