package com.secondhand.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Centralized factory for creating Gson instances used by the save file and config loader.
 *
 * <p>Records are written as flat {@code JsonObject}s by hand, so no type adapters are
 * registered. HTML escaping is off: the save file is read by people, and item names like
 * "Bale &amp; Wrap" should stay legible.
 *
 * <p>Usage:
 * <pre>
 * Gson gson = GsonFactory.create();
 * Gson pretty = GsonFactory.createPrettyPrinting();
 * </pre>
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a compact Gson instance.
     *
     * @return configured Gson instance
     */
    public static Gson create() {
        return builder().create();
    }

    /**
     * Create a Gson instance with pretty printing enabled.
     *
     * @return configured Gson instance with pretty printing
     */
    public static Gson createPrettyPrinting() {
        return builder().setPrettyPrinting().create();
    }

    /**
     * Get a pre-configured GsonBuilder.
     * Use this when you need additional customization.
     *
     * @return pre-configured GsonBuilder
     */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .disableHtmlEscaping();
    }
}
