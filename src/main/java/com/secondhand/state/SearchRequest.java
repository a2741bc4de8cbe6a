package com.secondhand.state;

import com.google.gson.JsonObject;
import com.secondhand.condition.AgentTier;
import com.secondhand.condition.QualityTier;
import com.secondhand.persistence.CorruptRecordException;
import com.secondhand.persistence.FlatRecordReader;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One in-flight acquisition job. Written only by the acquisition queue.
 */
@Getter
@Builder
public class SearchRequest {

    public static final String RECORD_TYPE = "search";

    private final String id;

    private final String requesterId;

    private final ItemCategory category;

    private final QualityTier qualityTier;

    private final AgentTier agentTier;

    private final long feePaid;

    private final long createdAtHour;

    private final int durationHours;

    @Setter
    private int remainingHours;

    @Setter
    private SearchStatus status;

    /**
     * Hour the search resolved or failed; 0 while active.
     */
    @Setter
    private long completedAtHour;

    @Builder.Default
    private final List<String> listingIds = new ArrayList<>();

    public long getCompletesAtHour() {
        return createdAtHour + durationHours;
    }

    public List<String> getListingIds() {
        return Collections.unmodifiableList(listingIds);
    }

    public void addListing(String listingId) {
        listingIds.add(listingId);
    }

    public void removeListing(String listingId) {
        listingIds.remove(listingId);
    }

    /**
     * Whether the search has nothing left to offer and can leave the live set.
     */
    public boolean isExhausted() {
        return status.isFinished() && listingIds.isEmpty();
    }

    public SearchView toView() {
        return SearchView.builder()
                .id(id)
                .requesterId(requesterId)
                .categoryId(category.getId())
                .categoryName(category.getName())
                .qualityTier(qualityTier)
                .agentTier(agentTier)
                .feePaid(feePaid)
                .createdAtHour(createdAtHour)
                .completesAtHour(getCompletesAtHour())
                .remainingHours(remainingHours)
                .status(status)
                .listingIds(List.copyOf(listingIds))
                .build();
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("requesterId", requesterId);
        json.addProperty("categoryId", category.getId());
        json.addProperty("categoryName", category.getName());
        json.addProperty("basePrice", category.getBasePrice());
        json.addProperty("qualityTier", qualityTier.getIndex());
        json.addProperty("agentTier", agentTier.getIndex());
        json.addProperty("feePaid", feePaid);
        json.addProperty("createdAtHour", createdAtHour);
        json.addProperty("durationHours", durationHours);
        json.addProperty("remainingHours", remainingHours);
        json.addProperty("status", status.name());
        json.addProperty("completedAtHour", completedAtHour);
        json.addProperty("listingIds", FlatRecordReader.joinList(listingIds));
        return json;
    }

    /**
     * @throws CorruptRecordException if identity, category or tiers are missing or invalid
     */
    public static SearchRequest deserialize(JsonObject json) throws CorruptRecordException {
        FlatRecordReader r = new FlatRecordReader(json, RECORD_TYPE);
        String id = r.requireString("id");

        int qualityIndex = (int) r.requireLong("qualityTier");
        QualityTier quality = QualityTier.fromIndex(qualityIndex)
                .orElseThrow(() -> new CorruptRecordException("search " + id + " has quality tier " + qualityIndex));
        int agentIndex = (int) r.requireLong("agentTier");
        AgentTier agent = AgentTier.fromIndex(agentIndex)
                .orElseThrow(() -> new CorruptRecordException("search " + id + " has agent tier " + agentIndex));

        long basePrice = r.requireLong("basePrice");
        ItemCategory category = new ItemCategory(
                r.requireString("categoryId"),
                r.optionalString("categoryName", "Unknown"),
                basePrice);

        int duration = r.optionalInt("durationHours", agent.getSearchMinMonths() * AgentTier.HOURS_PER_MONTH);
        return SearchRequest.builder()
                .id(id)
                .requesterId(r.requireString("requesterId"))
                .category(category)
                .qualityTier(quality)
                .agentTier(agent)
                .feePaid(r.optionalLong("feePaid", 0))
                .createdAtHour(r.optionalLong("createdAtHour", 0))
                .durationHours(duration)
                .remainingHours(r.optionalInt("remainingHours", duration))
                .status(r.optionalEnum("status", SearchStatus.class, SearchStatus.ACTIVE))
                .completedAtHour(r.optionalLong("completedAtHour", 0))
                .listingIds(r.optionalList("listingIds"))
                .build();
    }
}
