package com.secondhand.negotiation;

import lombok.Getter;

/**
 * Offer-exchange state attached to one listing.
 *
 * <p>The personality and its thresholds are fixed when the record is opened; only the
 * round bookkeeping changes. The owning queue is the only writer.
 */
@Getter
public class NegotiationRecord {

    private final SellerPersonality personality;

    /**
     * Fraction of asking accepted before situation and weather modifiers.
     */
    private final double acceptanceThreshold;

    private final double toleranceModifier;

    private NegotiationState state = NegotiationState.AWAITING_OFFER;

    private long lastOfferAmount;

    /**
     * Seller's most recent counter, 0 if none.
     */
    private long counterAmount;

    private int roundCount;

    /**
     * Weather modifier in effect for the latest round.
     */
    private double weatherModifier;

    /**
     * First hour at which another offer is heard after a rejection.
     */
    private long cooldownUntilHour;

    public NegotiationRecord(SellerPersonality personality) {
        this(personality, NegotiationState.AWAITING_OFFER, 0, 0, 0, 0.0, 0);
    }

    /**
     * Restore a persisted record.
     */
    public NegotiationRecord(SellerPersonality personality, NegotiationState state, long lastOfferAmount,
                             long counterAmount, int roundCount, double weatherModifier, long cooldownUntilHour) {
        this.personality = personality;
        this.acceptanceThreshold = personality.getAcceptanceThreshold();
        this.toleranceModifier = personality.getTolerance();
        this.state = state;
        this.lastOfferAmount = lastOfferAmount;
        this.counterAmount = counterAmount;
        this.roundCount = roundCount;
        this.weatherModifier = weatherModifier;
        this.cooldownUntilHour = cooldownUntilHour;
    }

    public boolean isCoolingDown(long currentHour) {
        return currentHour < cooldownUntilHour;
    }

    public boolean hasOpenCounter() {
        return state == NegotiationState.COUNTERED && counterAmount > 0;
    }

    /**
     * Record the result of one round.
     *
     * @param outcome       the seller's answer
     * @param currentHour   simulated hour of the round
     * @param cooldownHours hours to refuse offers after a plain rejection
     */
    public void applyOutcome(NegotiationOutcome outcome, long currentHour, int cooldownHours) {
        roundCount++;
        lastOfferAmount = outcome.getOfferAmount();
        weatherModifier = outcome.getWeatherModifier();
        state = NegotiationState.after(outcome.getResponse());

        if (outcome.getResponse() == OfferResponse.COUNTERED) {
            counterAmount = outcome.getCounterAmount();
        } else if (outcome.getResponse() == OfferResponse.REJECTED) {
            counterAmount = 0;
            cooldownUntilHour = currentHour + cooldownHours;
        }
    }
}
