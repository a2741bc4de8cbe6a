package com.secondhand.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.secondhand.data.GsonFactory;
import com.secondhand.data.JsonResourceLoader;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * {@link MarketConfig} backed by a JSON object of overrides.
 *
 * <p>Keys match the interface method names. Unknown keys and values of the wrong type are
 * logged and ignored, so a bad override never stops the engine from starting.
 */
@Slf4j
public class JsonMarketConfig implements MarketConfig {

    /**
     * Classpath location of the bundled overrides.
     */
    public static final String DEFAULT_RESOURCE = "/config/market.json";

    private static final Set<String> KNOWN_KEYS = Set.of(
            "foundListingOfferWindowHours",
            "listingCommission",
            "maxActiveSearches",
            "hiddenQualityStdDev",
            "minOfferFraction",
            "rejectCooldownHours",
            "counterBlend",
            "saleOfferWindowHours",
            "maxSaleListings",
            "resolvedIdMemory",
            "slowTickWarnMillis"
    );

    private final Map<String, Number> overrides;

    public JsonMarketConfig(JsonObject json) {
        this.overrides = Collections.unmodifiableMap(parse(json));
    }

    /**
     * Load the bundled overrides, falling back to pure defaults if the resource is absent.
     */
    public static JsonMarketConfig fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static JsonMarketConfig fromClasspath(String resourcePath) {
        Gson gson = GsonFactory.create();
        JsonObject json = JsonResourceLoader.tryLoadOptional(gson, resourcePath);
        if (json == null) {
            log.info("No market config at {}, using defaults", resourcePath);
            return new JsonMarketConfig(new JsonObject());
        }
        JsonMarketConfig config = new JsonMarketConfig(json);
        log.info("Loaded market config from {} ({} overrides)", resourcePath, config.overrides.size());
        return config;
    }

    private static Map<String, Number> parse(JsonObject json) {
        Map<String, Number> parsed = new HashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String key = entry.getKey();
            JsonElement value = entry.getValue();
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown market config key '{}'", key);
                continue;
            }
            if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
                log.warn("Ignoring market config key '{}': expected a number, got {}", key, value);
                continue;
            }
            parsed.put(key, value.getAsNumber());
        }
        return parsed;
    }

    private int intValue(String key, int fallback) {
        Number n = overrides.get(key);
        return n != null ? n.intValue() : fallback;
    }

    private long longValue(String key, long fallback) {
        Number n = overrides.get(key);
        return n != null ? n.longValue() : fallback;
    }

    private double doubleValue(String key, double fallback) {
        Number n = overrides.get(key);
        return n != null ? n.doubleValue() : fallback;
    }

    // ========================================================================
    // MarketConfig
    // ========================================================================

    @Override
    public int foundListingOfferWindowHours() {
        return intValue("foundListingOfferWindowHours", MarketConfig.super.foundListingOfferWindowHours());
    }

    @Override
    public double listingCommission() {
        return doubleValue("listingCommission", MarketConfig.super.listingCommission());
    }

    @Override
    public int maxActiveSearches() {
        return intValue("maxActiveSearches", MarketConfig.super.maxActiveSearches());
    }

    @Override
    public double hiddenQualityStdDev() {
        return doubleValue("hiddenQualityStdDev", MarketConfig.super.hiddenQualityStdDev());
    }

    @Override
    public double minOfferFraction() {
        return doubleValue("minOfferFraction", MarketConfig.super.minOfferFraction());
    }

    @Override
    public int rejectCooldownHours() {
        return intValue("rejectCooldownHours", MarketConfig.super.rejectCooldownHours());
    }

    @Override
    public double counterBlend() {
        return doubleValue("counterBlend", MarketConfig.super.counterBlend());
    }

    @Override
    public int saleOfferWindowHours() {
        return intValue("saleOfferWindowHours", MarketConfig.super.saleOfferWindowHours());
    }

    @Override
    public int maxSaleListings() {
        return intValue("maxSaleListings", MarketConfig.super.maxSaleListings());
    }

    @Override
    public int resolvedIdMemory() {
        return intValue("resolvedIdMemory", MarketConfig.super.resolvedIdMemory());
    }

    @Override
    public long slowTickWarnMillis() {
        return longValue("slowTickWarnMillis", MarketConfig.super.slowTickWarnMillis());
    }
}
