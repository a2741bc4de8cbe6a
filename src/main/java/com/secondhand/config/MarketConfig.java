package com.secondhand.config;

/**
 * Tunables for the market engine.
 *
 * <p>Every value has a default here; {@link JsonMarketConfig} overrides any of them from
 * {@code /config/market.json}. Durations are simulated hours.
 */
public interface MarketConfig {

    // ========================================================================
    // Acquisition
    // ========================================================================

    /**
     * Hours a found listing stays open once the requester first views it.
     */
    default int foundListingOfferWindowHours() {
        return 72;
    }

    /**
     * Seller-side commission added on top of the generated price of a found listing.
     */
    default double listingCommission() {
        return 0.08;
    }

    /**
     * Maximum simultaneously active searches per requester.
     */
    default int maxActiveSearches() {
        return 5;
    }

    /**
     * Standard deviation of the hidden quality draw around {@code 1 - damage}.
     */
    default double hiddenQualityStdDev() {
        return 0.15;
    }

    // ========================================================================
    // Negotiation
    // ========================================================================

    /**
     * Lowest offer accepted for consideration, as a fraction of asking.
     */
    default double minOfferFraction() {
        return 0.50;
    }

    /**
     * Hours a listing refuses new offers after a plain rejection.
     */
    default int rejectCooldownHours() {
        return 1;
    }

    /**
     * Where between the offer (0.0) and the asking price (1.0) a counter lands.
     */
    default double counterBlend() {
        return 0.5;
    }

    // ========================================================================
    // Disposition
    // ========================================================================

    /**
     * Hours a buyer offer waits for the owner's answer before lapsing.
     */
    default int saleOfferWindowHours() {
        return 24;
    }

    /**
     * Maximum simultaneous sale listings per owner.
     */
    default int maxSaleListings() {
        return 10;
    }

    // ========================================================================
    // Engine
    // ========================================================================

    /**
     * Number of resolved listing ids remembered for "already handled" answers.
     */
    default int resolvedIdMemory() {
        return 1024;
    }

    /**
     * Hour-tick processing time above which a warning is logged.
     */
    default long slowTickWarnMillis() {
        return 5;
    }
}
