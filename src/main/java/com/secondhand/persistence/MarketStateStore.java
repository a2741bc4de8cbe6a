package com.secondhand.persistence;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.secondhand.acquisition.AcquisitionQueue;
import com.secondhand.data.GsonFactory;
import com.secondhand.disposition.DispositionQueue;
import com.secondhand.state.IdSequence;
import com.secondhand.state.ListingOrigin;
import com.secondhand.state.ListingRecord;
import com.secondhand.state.MarketClock;
import com.secondhand.state.SaleRequest;
import com.secondhand.state.SearchRequest;
import com.secondhand.status.MarketStatistics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saves and loads a whole market session as one JSON document.
 *
 * <p>Every record is stored as its flat attribute set; timestamps are simulated hours. The
 * previous save is copied to {@code <file>.bak} before each write, and a load that can't
 * parse the main file falls back to that copy. A record that fails to deserialize is logged
 * and skipped; the rest of the save still loads.
 */
@Slf4j
@Singleton
public class MarketStateStore {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    private static final String BACKUP_SUFFIX = ".bak";

    private final Gson gson = GsonFactory.createPrettyPrinting();

    private final AcquisitionQueue acquisition;
    private final DispositionQueue disposition;
    private final MarketClock clock;
    private final IdSequence ids;
    private final MarketStatistics statistics;

    @Inject
    public MarketStateStore(AcquisitionQueue acquisition, DispositionQueue disposition, MarketClock clock,
                            IdSequence ids, MarketStatistics statistics) {
        this.acquisition = acquisition;
        this.disposition = disposition;
        this.clock = clock;
        this.ids = ids;
        this.statistics = statistics;
    }

    // ========================================================================
    // Save
    // ========================================================================

    /**
     * Write the session to {@code path}, keeping the previous file as a backup.
     *
     * @return false if the write failed; the previous file and its backup are left as they were
     */
    public boolean save(Path path) {
        JsonObject root = snapshot();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(path)) {
                Files.copy(path, backupOf(path), StandardCopyOption.REPLACE_EXISTING);
            }
            Files.writeString(path, gson.toJson(root), StandardCharsets.UTF_8);
            log.debug("Saved market state to {}", path);
            return true;
        } catch (IOException e) {
            log.error("Failed to save market state to {}: {}", path, e.getMessage());
            return false;
        }
    }

    JsonObject snapshot() {
        JsonObject root = new JsonObject();
        root.addProperty("schemaVersion", CURRENT_SCHEMA_VERSION);
        root.addProperty("currentHour", clock.currentHour());
        root.add("ids", ids.serialize());

        JsonArray searches = new JsonArray();
        acquisition.liveSearches().forEach(s -> searches.add(s.serialize()));
        root.add("searches", searches);

        JsonArray listings = new JsonArray();
        acquisition.liveListings().forEach(l -> listings.add(l.serialize()));
        disposition.liveListings().forEach(l -> listings.add(l.serialize()));
        root.add("listings", listings);

        JsonArray sales = new JsonArray();
        disposition.liveSales().forEach(s -> sales.add(s.serialize()));
        root.add("sales", sales);

        root.add("statistics", statistics.serialize());
        return root;
    }

    // ========================================================================
    // Load
    // ========================================================================

    /**
     * Replace the session state with the contents of {@code path}.
     *
     * @return what was loaded, or empty if neither the file nor its backup could be read;
     *         the session is unchanged in that case
     */
    public Optional<LoadSummary> load(Path path) {
        Optional<JsonObject> document = read(path);
        if (document.isEmpty()) {
            Path backup = backupOf(path);
            if (Files.exists(backup)) {
                log.warn("Falling back to backup {}", backup);
                document = read(backup);
            }
        }
        if (document.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(restore(document.get()));
    }

    private Optional<JsonObject> read(Path path) {
        if (!Files.exists(path)) {
            log.info("No market state at {}", path);
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            JsonObject root = gson.fromJson(content, JsonObject.class);
            if (root == null) {
                log.warn("Market state at {} is empty", path);
                return Optional.empty();
            }
            if (header(root).isEmpty()) {
                log.warn("Market state at {} has an unreadable header", path);
                return Optional.empty();
            }
            return Optional.of(root);
        } catch (IOException | JsonParseException e) {
            log.warn("Failed to read market state from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    LoadSummary restore(JsonObject root) {
        Header header = header(root).orElse(Header.EMPTY);
        if (header.getSchemaVersion() > CURRENT_SCHEMA_VERSION) {
            log.warn("Market state schema {} is newer than {}, loading what is recognised",
                    header.getSchemaVersion(), CURRENT_SCHEMA_VERSION);
        }

        int[] skipped = {0};
        List<SearchRequest> searches = new ArrayList<>();
        for (JsonObject json : records(root, "searches", skipped)) {
            try {
                searches.add(SearchRequest.deserialize(json));
            } catch (CorruptRecordException | RuntimeException e) {
                skip(SearchRequest.RECORD_TYPE, json, e, skipped);
            }
        }

        List<ListingRecord> found = new ArrayList<>();
        List<ListingRecord> forSale = new ArrayList<>();
        for (JsonObject json : records(root, "listings", skipped)) {
            try {
                ListingRecord listing = ListingRecord.deserialize(json);
                if (listing.getOrigin() == ListingOrigin.ACQUISITION) {
                    found.add(listing);
                } else {
                    forSale.add(listing);
                }
            } catch (CorruptRecordException | RuntimeException e) {
                skip(ListingRecord.RECORD_TYPE, json, e, skipped);
            }
        }

        List<SaleRequest> sales = new ArrayList<>();
        for (JsonObject json : records(root, "sales", skipped)) {
            try {
                sales.add(SaleRequest.deserialize(json));
            } catch (CorruptRecordException | RuntimeException e) {
                skip(SaleRequest.RECORD_TYPE, json, e, skipped);
            }
        }

        clock.restore(header.getCurrentHour());
        ids.restore(root.has("ids") && root.get("ids").isJsonObject()
                ? root.getAsJsonObject("ids") : new JsonObject());
        statistics.restore(root.has("statistics") && root.get("statistics").isJsonObject()
                ? root.getAsJsonObject("statistics") : new JsonObject());
        acquisition.restore(searches, found);
        disposition.restore(sales, forSale);

        LoadSummary summary = new LoadSummary(searches.size(), found.size() + forSale.size(), sales.size(), skipped[0]);
        log.info("Loaded market state at hour {}: {}", clock.currentHour(), summary);
        return summary;
    }

    private static Optional<Header> header(JsonObject root) {
        FlatRecordReader reader = new FlatRecordReader(root, "Market state header");
        try {
            return Optional.of(new Header(reader.optionalInt("schemaVersion", 0),
                    reader.optionalLong("currentHour", 0)));
        } catch (CorruptRecordException e) {
            log.warn(e.getMessage());
            return Optional.empty();
        }
    }

    private static List<JsonObject> records(JsonObject root, String key, int[] skipped) {
        List<JsonObject> records = new ArrayList<>();
        if (!root.has(key) || !root.get(key).isJsonArray()) {
            return records;
        }
        for (JsonElement element : root.getAsJsonArray(key)) {
            if (element.isJsonObject()) {
                records.add(element.getAsJsonObject());
            } else {
                log.warn("Skipping non-object entry in '{}': {}", key, element);
                skipped[0]++;
            }
        }
        return records;
    }

    private static void skip(String recordType, JsonObject json, Exception e, int[] skipped) {
        String id = json.has("id") && json.get("id").isJsonPrimitive() ? json.get("id").getAsString() : "?";
        log.warn("Skipping corrupt {} record {}: {}", recordType, id, e.getMessage());
        skipped[0]++;
    }

    private static Path backupOf(Path path) {
        return path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
    }

    @Value
    private static class Header {
        static final Header EMPTY = new Header(0, 0);

        int schemaVersion;
        long currentHour;
    }

    /**
     * Record counts from one load.
     */
    @Value
    public static class LoadSummary {
        int searches;
        int listings;
        int sales;
        int skipped;
    }
}
