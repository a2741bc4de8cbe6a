package com.secondhand.negotiation;

import org.junit.Test;

import static org.junit.Assert.*;

public class NegotiationRecordTest {

    private static NegotiationOutcome outcome(OfferResponse response, long offer, long counter) {
        return NegotiationOutcome.builder()
                .listingId("LST-1")
                .response(response)
                .personality(SellerPersonality.REASONABLE)
                .offerAmount(offer)
                .askingPrice(100_000)
                .counterAmount(counter)
                .build();
    }

    @Test
    public void testNewRecord_TakesPersonalityThresholds() {
        NegotiationRecord record = new NegotiationRecord(SellerPersonality.FIRM);

        assertEquals(0.92, record.getAcceptanceThreshold(), 1e-12);
        assertEquals(-0.05, record.getToleranceModifier(), 1e-12);
        assertEquals(NegotiationState.AWAITING_OFFER, record.getState());
        assertFalse(record.hasOpenCounter());
    }

    @Test
    public void testApplyOutcome_Rejected_StartsCooldown() {
        NegotiationRecord record = new NegotiationRecord(SellerPersonality.REASONABLE);

        record.applyOutcome(outcome(OfferResponse.REJECTED, 70_000, 0), 100, 2);

        assertEquals(NegotiationState.REJECTED, record.getState());
        assertTrue("Offers refused during the cooldown", record.isCoolingDown(101));
        assertFalse("Cooldown ends after two hours", record.isCoolingDown(102));
        assertTrue("Rejected listings still hear offers", record.getState().acceptsOffers());
    }

    @Test
    public void testApplyOutcome_Countered_OpensCounter() {
        NegotiationRecord record = new NegotiationRecord(SellerPersonality.REASONABLE);

        record.applyOutcome(outcome(OfferResponse.COUNTERED, 87_000, 93_500), 10, 1);

        assertTrue(record.hasOpenCounter());
        assertEquals(93_500, record.getCounterAmount());
        assertEquals(87_000, record.getLastOfferAmount());
        assertEquals(1, record.getRoundCount());
        assertFalse("Counters don't start a cooldown", record.isCoolingDown(10));
    }

    @Test
    public void testApplyOutcome_RejectAfterCounter_ClearsCounter() {
        NegotiationRecord record = new NegotiationRecord(SellerPersonality.REASONABLE);
        record.applyOutcome(outcome(OfferResponse.COUNTERED, 87_000, 93_500), 10, 1);

        record.applyOutcome(outcome(OfferResponse.REJECTED, 80_000, 0), 11, 1);

        assertFalse(record.hasOpenCounter());
        assertEquals(2, record.getRoundCount());
    }

    @Test
    public void testWalkedAway_RefusesOffers() {
        NegotiationRecord record = new NegotiationRecord(SellerPersonality.FIRM);

        record.applyOutcome(outcome(OfferResponse.WALKED_AWAY, 40_000, 0), 10, 1);

        assertFalse(record.getState().acceptsOffers());
        assertTrue(OfferResponse.WALKED_AWAY.isTerminal());
    }
}
