package com.secondhand.data;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON documents from classpath resources.
 *
 * Usage:
 * <pre>
 * JsonObject overrides = JsonResourceLoader.tryLoadOptional(gson, "/config/market.json");
 * </pre>
 */
@Slf4j
public final class JsonResourceLoader {

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a JSON resource file.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path (e.g., "/config/market.json")
     * @return the parsed JsonObject
     * @throws JsonLoadException if the resource is missing or malformed
     */
    public static JsonObject load(Gson gson, String resourcePath) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }

            JsonObject result = gson.fromJson(
                    new InputStreamReader(is, StandardCharsets.UTF_8),
                    JsonObject.class
            );

            if (result == null) {
                throw new JsonLoadException("Parsed JSON is null for: " + resourcePath);
            }

            return result;
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        } catch (JsonParseException e) {
            throw new JsonLoadException("Malformed JSON in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Try to load a JSON file from the given resource path.
     * Returns null if the resource doesn't exist or can't be read.
     *
     * @param gson         the Gson instance
     * @param resourcePath the resource path
     * @return JsonObject or null if resource doesn't exist
     */
    @Nullable
    public static JsonObject tryLoadOptional(Gson gson, String resourcePath) {
        try {
            return load(gson, resourcePath);
        } catch (JsonLoadException e) {
            log.debug("Optional JSON resource not loaded: {} ({})", resourcePath, e.getMessage());
            return null;
        }
    }

    /**
     * Exception thrown when JSON loading fails.
     */
    public static class JsonLoadException extends RuntimeException {
        public JsonLoadException(String message) {
            super(message);
        }

        public JsonLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
