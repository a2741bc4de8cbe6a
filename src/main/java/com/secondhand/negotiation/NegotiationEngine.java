package com.secondhand.negotiation;

import com.secondhand.condition.AgentTier;
import com.secondhand.config.MarketConfig;
import com.secondhand.host.WeatherCondition;
import com.secondhand.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Decides how sellers answer offers and what buyers offer for listed items.
 *
 * <p>Stateless between calls: every method reads the {@link NegotiationRecord} it is handed
 * and returns an outcome; the owning queue applies it with
 * {@link NegotiationRecord#applyOutcome}.
 *
 * <p>Response bands by gap below the effective threshold:
 * <pre>
 *   gap &lt;= 0      accept
 *   gap &lt;= 0.05   counter
 *   gap &lt;= 0.10   counter, reject chance (gap - 0.05) * 6
 *   gap &lt;= 0.15   50/50 counter or reject
 *   gap &lt;= 0.20   reject, counter chance (0.20 - gap) * 6
 *   gap &gt;  0.20   reject, personality walk-away chance
 * </pre>
 */
@Slf4j
@Singleton
public class NegotiationEngine {

    public static final double CLOSE_GAP = 0.05;
    public static final double MODERATE_GAP = 0.10;
    public static final double SIGNIFICANT_GAP = 0.15;
    public static final double AGGRESSIVE_GAP = 0.20;

    /**
     * Slope of the linear reject/counter chance inside the graded bands.
     */
    private static final double BAND_SLOPE = 6.0;

    // Stand-firm split after a counter
    public static final double STAND_FIRM_ACCEPT = 0.30;
    public static final double STAND_FIRM_HOLD = 0.50;

    /**
     * Counters and buyer offers land on multiples of this.
     */
    public static final long PRICE_STEP = 100;

    private final Randomization randomization;
    private final MarketConfig config;

    @Inject
    public NegotiationEngine(Randomization randomization, MarketConfig config) {
        this.randomization = randomization;
        this.config = config;
    }

    // ========================================================================
    // Seller side
    // ========================================================================

    /**
     * Start a negotiation for a listing with the given hidden quality.
     */
    public NegotiationRecord open(double hiddenQuality) {
        return new NegotiationRecord(SellerPersonality.fromHiddenQuality(hiddenQuality));
    }

    /**
     * Listing circumstances that lower the seller's threshold: time on market, visible
     * damage, heavy use. Expensive items raise it.
     */
    public static double situationModifier(NegotiationContext context) {
        double modifier = Math.min(context.getDaysOnMarket() * 0.003, 0.10);
        if (context.getDamage() > 0.20) {
            modifier += 0.05;
        }
        if (context.getOperatingHours() > 5000) {
            modifier += 0.03;
        }
        if (context.getBasePrice() > 200_000) {
            modifier -= 0.05;
        }
        return modifier;
    }

    /**
     * Threshold the offer fraction is measured against, after personality, weather and
     * situation.
     */
    public static double effectiveThreshold(NegotiationRecord record, NegotiationContext context) {
        return record.getAcceptanceThreshold()
                - record.getToleranceModifier()
                - context.getWeather().getNegotiationModifier()
                - situationModifier(context);
    }

    /**
     * Answer one offer.
     *
     * @param record  the listing's negotiation state (not modified)
     * @param context listing facts and current weather
     * @param offer   offered amount, positive
     * @return the seller's response
     */
    public NegotiationOutcome respond(NegotiationRecord record, NegotiationContext context, long offer) {
        long asking = context.getAskingPrice();
        SellerPersonality personality = record.getPersonality();
        double weatherModifier = context.getWeather().getNegotiationModifier();
        double offerFraction = (double) offer / asking;

        NegotiationOutcome.NegotiationOutcomeBuilder outcome = NegotiationOutcome.builder()
                .listingId(context.getListingId())
                .personality(personality)
                .offerAmount(offer)
                .askingPrice(asking)
                .weatherModifier(weatherModifier);

        if (personality.isImmovable() && offerFraction >= SellerPersonality.IMMOVABLE_FLOOR) {
            log.debug("Listing {}: immovable seller accepts {} of asking", context.getListingId(), offerFraction);
            return outcome.response(OfferResponse.ACCEPTED).gap(0.0).build();
        }

        double threshold = effectiveThreshold(record, context);
        double gap = roundGap(threshold - offerFraction);
        double roll = randomization.roll();

        OfferResponse response = band(gap, roll, personality.getWalkAwayChance());
        if (personality.isImmovable()) {
            if (gap <= 0) {
                // Meets the numbers but not the 98% floor: hold at asking.
                response = OfferResponse.COUNTERED;
            } else if (response == OfferResponse.COUNTERED) {
                response = OfferResponse.REJECTED;
            }
        }

        log.debug("Listing {}: {} seller, threshold={} offer={} gap={} roll={} -> {}",
                context.getListingId(), personality,
                String.format("%.3f", threshold), String.format("%.3f", offerFraction),
                String.format("%.3f", gap), String.format("%.3f", roll), response);

        outcome.response(response).gap(gap);
        if (response == OfferResponse.COUNTERED) {
            outcome.counterAmount(counterPrice(asking, offer, threshold, gap <= 0));
        }
        return outcome.build();
    }

    /**
     * Buyer insists on the previous offer after a counter: the seller takes it, holds the
     * counter, or walks away.
     *
     * @throws IllegalStateException if the record has no open counter
     */
    public NegotiationOutcome standFirm(NegotiationRecord record, NegotiationContext context) {
        if (!record.hasOpenCounter()) {
            throw new IllegalStateException("No counter to stand firm against on " + context.getListingId());
        }
        double weatherModifier = context.getWeather().getNegotiationModifier();
        long offer = record.getLastOfferAmount();
        double roll = randomization.roll();

        OfferResponse response;
        if (roll < STAND_FIRM_ACCEPT) {
            response = OfferResponse.ACCEPTED;
        } else if (roll < STAND_FIRM_ACCEPT + STAND_FIRM_HOLD) {
            response = OfferResponse.COUNTERED;
        } else {
            response = OfferResponse.WALKED_AWAY;
        }
        log.debug("Listing {}: stand firm at {} roll={} -> {}",
                context.getListingId(), offer, String.format("%.3f", roll), response);

        return NegotiationOutcome.builder()
                .listingId(context.getListingId())
                .personality(record.getPersonality())
                .response(response)
                .offerAmount(offer)
                .askingPrice(context.getAskingPrice())
                .counterAmount(response == OfferResponse.COUNTERED ? record.getCounterAmount() : 0)
                .gap(0.0)
                .weatherModifier(weatherModifier)
                .build();
    }

    static OfferResponse band(double gap, double roll, double walkAwayChance) {
        if (gap <= 0) {
            return OfferResponse.ACCEPTED;
        }
        if (gap <= CLOSE_GAP) {
            return OfferResponse.COUNTERED;
        }
        if (gap <= MODERATE_GAP) {
            double rejectChance = (gap - CLOSE_GAP) * BAND_SLOPE;
            return roll < rejectChance ? OfferResponse.REJECTED : OfferResponse.COUNTERED;
        }
        if (gap <= SIGNIFICANT_GAP) {
            return roll < 0.5 ? OfferResponse.REJECTED : OfferResponse.COUNTERED;
        }
        if (gap <= AGGRESSIVE_GAP) {
            double counterChance = (AGGRESSIVE_GAP - gap) * BAND_SLOPE;
            return roll < counterChance ? OfferResponse.COUNTERED : OfferResponse.REJECTED;
        }
        return roll < walkAwayChance ? OfferResponse.WALKED_AWAY : OfferResponse.REJECTED;
    }

    /**
     * Counter partway from the offer toward asking, never under the seller's threshold
     * and never over asking.
     */
    private long counterPrice(long asking, long offer, double threshold, boolean holdAtAsking) {
        if (holdAtAsking) {
            return asking;
        }
        double blended = offer + (asking - offer) * config.counterBlend();
        double thresholdPrice = Math.min(asking, threshold * asking);
        double target = Math.max(blended, thresholdPrice);
        long rounded = (long) Math.ceil(target / PRICE_STEP) * PRICE_STEP;
        return Math.min(asking, rounded);
    }

    private static double roundGap(double gap) {
        return Math.round(gap * 1e9) / 1e9;
    }

    // ========================================================================
    // Buyer side
    // ========================================================================

    /**
     * Offer a buyer makes for an item listed through {@code tier}.
     *
     * @param tier    agent tier handling the sale
     * @param value   reference sell value of the item
     * @param weather current weather; rough weather shaves the offer, down to the tier floor
     * @return offer amount, rounded down to {@link #PRICE_STEP} where the value allows
     */
    public long proposeBuyerOffer(AgentTier tier, long value, WeatherCondition weather) {
        double fraction = randomization.uniformRandom(tier.getReturnMin(), tier.getReturnMax());
        fraction = Math.max(tier.getReturnMin(), fraction - weather.getNegotiationModifier());
        long amount = Randomization.floorTo(value * fraction, PRICE_STEP);
        if (amount <= 0) {
            amount = Math.max(1, (long) Math.floor(value * fraction));
        }
        return amount;
    }
}
