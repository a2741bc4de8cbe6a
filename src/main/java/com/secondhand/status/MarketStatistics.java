package com.secondhand.status;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Running counters per owner, persisted with the session.
 */
@Slf4j
@Singleton
public class MarketStatistics {

    private final Map<String, EnumMap<StatisticType, Long>> byOwner = new HashMap<>();

    public void increment(String ownerId, StatisticType type) {
        byOwner.computeIfAbsent(ownerId, k -> new EnumMap<>(StatisticType.class))
                .merge(type, 1L, Long::sum);
    }

    public long get(String ownerId, StatisticType type) {
        EnumMap<StatisticType, Long> counters = byOwner.get(ownerId);
        if (counters == null) {
            return 0;
        }
        return counters.getOrDefault(type, 0L);
    }

    /**
     * Copy of one owner's counters; types never incremented are absent.
     */
    public Map<StatisticType, Long> snapshot(String ownerId) {
        EnumMap<StatisticType, Long> counters = byOwner.get(ownerId);
        if (counters == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(counters));
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        byOwner.forEach((owner, counters) -> {
            JsonObject ownerJson = new JsonObject();
            counters.forEach((type, value) -> ownerJson.addProperty(type.name(), value));
            json.add(owner, ownerJson);
        });
        return json;
    }

    /**
     * Replace all counters from a save. Unknown counter names are skipped.
     */
    public void restore(JsonObject json) {
        byOwner.clear();
        for (Map.Entry<String, JsonElement> owner : json.entrySet()) {
            if (!owner.getValue().isJsonObject()) {
                log.warn("Skipping statistics for {}: not an object", owner.getKey());
                continue;
            }
            EnumMap<StatisticType, Long> counters = new EnumMap<>(StatisticType.class);
            for (Map.Entry<String, JsonElement> counter : owner.getValue().getAsJsonObject().entrySet()) {
                try {
                    StatisticType type = StatisticType.valueOf(counter.getKey().toUpperCase(Locale.ROOT));
                    counters.put(type, counter.getValue().getAsLong());
                } catch (IllegalArgumentException | UnsupportedOperationException | IllegalStateException e) {
                    log.warn("Skipping statistic {}.{}: {}", owner.getKey(), counter.getKey(), e.getMessage());
                }
            }
            byOwner.put(owner.getKey(), counters);
        }
    }
}
