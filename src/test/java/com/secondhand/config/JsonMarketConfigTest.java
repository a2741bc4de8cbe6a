package com.secondhand.config;

import com.google.gson.JsonObject;
import org.junit.Test;

import static org.junit.Assert.*;

public class JsonMarketConfigTest {

    @Test
    public void testFromClasspath_OverridesAndIgnoresBadValues() {
        JsonMarketConfig config = JsonMarketConfig.fromClasspath("/config/test-market.json");

        assertEquals(0.10, config.listingCommission(), 1e-12);
        assertEquals(2, config.maxActiveSearches());
        assertEquals("Non-numeric override ignored", 1, config.rejectCooldownHours());
        assertEquals("Untouched keys keep defaults", 72, config.foundListingOfferWindowHours());
    }

    @Test
    public void testFromClasspath_MissingResource_Defaults() {
        JsonMarketConfig config = JsonMarketConfig.fromClasspath("/config/does-not-exist.json");

        assertEquals(0.08, config.listingCommission(), 1e-12);
        assertEquals(5, config.maxActiveSearches());
        assertEquals(24, config.saleOfferWindowHours());
    }

    @Test
    public void testBundledConfig_MatchesDefaults() {
        JsonMarketConfig config = JsonMarketConfig.fromClasspath();
        MarketConfig defaults = new MarketConfig() { };

        assertEquals(defaults.maxSaleListings(), config.maxSaleListings());
        assertEquals(defaults.minOfferFraction(), config.minOfferFraction(), 1e-12);
        assertEquals(defaults.counterBlend(), config.counterBlend(), 1e-12);
    }

    @Test
    public void testConstructor_IntegerValueForDouble() {
        JsonObject json = new JsonObject();
        json.addProperty("counterBlend", 1);

        assertEquals(1.0, new JsonMarketConfig(json).counterBlend(), 1e-12);
    }
}
