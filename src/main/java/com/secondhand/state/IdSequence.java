package com.secondhand.state;

import com.google.gson.JsonObject;
import com.google.gson.JsonElement;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-prefix counters for record ids ("SRCH-17", "LST-204"). Persisted with the
 * session so ids never repeat across loads.
 */
@Slf4j
@Singleton
public class IdSequence {

    public static final String SEARCH = "SRCH";
    public static final String LISTING = "LST";
    public static final String SALE = "SALE";

    private final Map<String, Long> counters = new TreeMap<>();

    public String next(String prefix) {
        long n = counters.merge(prefix, 1L, Long::sum);
        return prefix + "-" + n;
    }

    /**
     * Make sure the counter for an id's prefix is past the id's number, so restored
     * records never collide with new ones.
     */
    public void observe(String id) {
        int dash = id.lastIndexOf('-');
        if (dash <= 0 || dash == id.length() - 1) {
            return;
        }
        try {
            long n = Long.parseLong(id.substring(dash + 1));
            counters.merge(id.substring(0, dash), n, Math::max);
        } catch (NumberFormatException e) {
            log.debug("Id {} is not from a sequence, counters unchanged", id);
        }
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        counters.forEach(json::addProperty);
        return json;
    }

    public void restore(JsonObject json) {
        counters.clear();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (entry.getValue().isJsonPrimitive() && entry.getValue().getAsJsonPrimitive().isNumber()) {
                counters.put(entry.getKey(), entry.getValue().getAsLong());
            }
        }
    }
}
