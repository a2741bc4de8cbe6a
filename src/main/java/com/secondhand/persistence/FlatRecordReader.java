package com.secondhand.persistence;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Typed reads over one flat persisted record.
 *
 * <p>{@code require*} methods throw {@link CorruptRecordException} for absent or
 * mistyped values; {@code optional*} methods fall back to the given default so records
 * written before a field existed still load.
 */
public final class FlatRecordReader {

    private final JsonObject json;
    private final String recordType;

    public FlatRecordReader(JsonObject json, String recordType) {
        this.json = json;
        this.recordType = recordType;
    }

    public boolean has(String key) {
        JsonElement e = json.get(key);
        return e != null && !e.isJsonNull();
    }

    public String requireString(String key) throws CorruptRecordException {
        JsonElement e = requirePrimitive(key);
        String value = e.getAsString();
        if (value.isEmpty()) {
            throw new CorruptRecordException(recordType + " has empty '" + key + "'");
        }
        return value;
    }

    public long requireLong(String key) throws CorruptRecordException {
        JsonElement e = requirePrimitive(key);
        try {
            return e.getAsLong();
        } catch (NumberFormatException ex) {
            throw new CorruptRecordException(recordType + " has non-numeric '" + key + "': " + e, ex);
        }
    }

    public <E extends Enum<E>> E requireEnum(String key, Class<E> type) throws CorruptRecordException {
        String name = requireString(key);
        E value = parseEnum(name, type);
        if (value == null) {
            throw new CorruptRecordException(recordType + " has unknown " + type.getSimpleName() + " '" + name + "'");
        }
        return value;
    }

    @Nullable
    public String optionalString(String key, @Nullable String fallback) {
        return has(key) ? json.get(key).getAsString() : fallback;
    }

    public long optionalLong(String key, long fallback) throws CorruptRecordException {
        return has(key) ? requireLong(key) : fallback;
    }

    public int optionalInt(String key, int fallback) throws CorruptRecordException {
        return has(key) ? (int) requireLong(key) : fallback;
    }

    public double optionalDouble(String key, double fallback) throws CorruptRecordException {
        if (!has(key)) {
            return fallback;
        }
        JsonElement e = requirePrimitive(key);
        try {
            return e.getAsDouble();
        } catch (NumberFormatException ex) {
            throw new CorruptRecordException(recordType + " has non-numeric '" + key + "': " + e, ex);
        }
    }

    public boolean optionalBoolean(String key, boolean fallback) {
        return has(key) ? json.get(key).getAsBoolean() : fallback;
    }

    public <E extends Enum<E>> E optionalEnum(String key, Class<E> type, E fallback) {
        if (!has(key)) {
            return fallback;
        }
        E value = parseEnum(json.get(key).getAsString(), type);
        return value != null ? value : fallback;
    }

    /**
     * Read a comma-joined list written by {@link #joinList}. Absent keys read as empty.
     */
    public List<String> optionalList(String key) {
        if (!has(key)) {
            return new ArrayList<>();
        }
        List<String> items = new ArrayList<>();
        for (String part : json.get(key).getAsString().split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    public static String joinList(Collection<?> items) {
        StringBuilder sb = new StringBuilder();
        for (Object item : items) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(item);
        }
        return sb.toString();
    }

    private JsonElement requirePrimitive(String key) throws CorruptRecordException {
        JsonElement e = json.get(key);
        if (e == null || e.isJsonNull()) {
            throw new CorruptRecordException(recordType + " is missing '" + key + "'");
        }
        if (!e.isJsonPrimitive()) {
            throw new CorruptRecordException(recordType + " has non-scalar '" + key + "'");
        }
        return e;
    }

    @Nullable
    private static <E extends Enum<E>> E parseEnum(String name, Class<E> type) {
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
