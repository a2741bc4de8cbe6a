package com.secondhand.state;

import com.google.gson.JsonObject;
import com.secondhand.condition.AgentTier;
import com.secondhand.persistence.CorruptRecordException;
import com.secondhand.persistence.FlatRecordReader;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One in-flight disposition job. Written only by the disposition queue.
 *
 * <p>The listing it advertises carries status and TTL; this record carries the agent
 * terms, the offer timer and the offer history.
 */
@Getter
@Builder
public class SaleRequest {

    public static final String RECORD_TYPE = "sale";

    private final String id;

    private final String ownerId;

    private final SaleItem item;

    private final AgentTier agentTier;

    private final long feePaid;

    private final long createdAtHour;

    private final String listingId;

    /**
     * Hours until the agent next tries to produce a buyer.
     */
    @Setter
    private int hoursUntilOfferCheck;

    @Setter
    @Nullable
    private PendingOffer pendingOffer;

    @Builder.Default
    private final List<OfferHistoryEntry> offerHistory = new ArrayList<>();

    public List<OfferHistoryEntry> getOfferHistory() {
        return Collections.unmodifiableList(offerHistory);
    }

    public boolean hasPendingOffer() {
        return pendingOffer != null;
    }

    /**
     * Close the pending offer with {@code decision} and move it to the history.
     *
     * @return the closed offer
     * @throws IllegalStateException if no offer is pending
     */
    public PendingOffer closePendingOffer(OfferDecision decision) {
        PendingOffer offer = pendingOffer;
        if (offer == null) {
            throw new IllegalStateException("No pending offer on sale " + id);
        }
        offerHistory.add(new OfferHistoryEntry(offer.getAmount(), offer.getOfferedAtHour(), decision));
        pendingOffer = null;
        return offer;
    }

    public SaleView toView(ListingRecord listing) {
        return SaleView.builder()
                .id(id)
                .ownerId(ownerId)
                .listingId(listingId)
                .itemId(item.getItemId())
                .itemName(item.getName())
                .agentTier(agentTier)
                .feePaid(feePaid)
                .createdAtHour(createdAtHour)
                .sellValue(item.getSellValue())
                .status(listing.getStatus())
                .ttlHours(listing.getTtlHours())
                .offerHistory(List.copyOf(offerHistory))
                .pendingOffer(pendingOffer)
                .build();
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("ownerId", ownerId);
        json.addProperty("listingId", listingId);
        json.addProperty("agentTier", agentTier.getIndex());
        json.addProperty("feePaid", feePaid);
        json.addProperty("createdAtHour", createdAtHour);
        json.addProperty("hoursUntilOfferCheck", hoursUntilOfferCheck);

        json.addProperty("item.id", item.getItemId());
        json.addProperty("item.name", item.getName());
        json.addProperty("item.categoryId", item.getCategoryId());
        json.addProperty("item.sellValue", item.getSellValue());
        json.addProperty("item.basePrice", item.getBasePrice());
        json.addProperty("item.age", item.getAge());
        json.addProperty("item.operatingHours", item.getOperatingHours());
        json.addProperty("item.damage", item.getDamage());
        json.addProperty("item.wear", item.getWear());
        if (item.getHiddenQuality() != null) {
            json.addProperty("item.hiddenQuality", item.getHiddenQuality());
        }

        if (pendingOffer != null) {
            json.addProperty("pending.amount", pendingOffer.getAmount());
            json.addProperty("pending.offeredAtHour", pendingOffer.getOfferedAtHour());
            json.addProperty("pending.expiresAtHour", pendingOffer.getExpiresAtHour());
        }

        json.addProperty("offerCount", offerHistory.size());
        for (int i = 0; i < offerHistory.size(); i++) {
            OfferHistoryEntry entry = offerHistory.get(i);
            json.addProperty("offer." + i + ".amount", entry.getAmount());
            json.addProperty("offer." + i + ".hour", entry.getOfferedAtHour());
            json.addProperty("offer." + i + ".decision", entry.getDecision().name());
        }
        return json;
    }

    /**
     * @throws CorruptRecordException if identity, item or tier are missing or invalid
     */
    public static SaleRequest deserialize(JsonObject json) throws CorruptRecordException {
        FlatRecordReader r = new FlatRecordReader(json, RECORD_TYPE);
        String id = r.requireString("id");

        int agentIndex = (int) r.requireLong("agentTier");
        AgentTier agent = AgentTier.fromIndex(agentIndex)
                .orElseThrow(() -> new CorruptRecordException("sale " + id + " has agent tier " + agentIndex));

        SaleItem item = SaleItem.builder()
                .itemId(r.requireString("item.id"))
                .name(r.optionalString("item.name", "Unknown item"))
                .categoryId(r.optionalString("item.categoryId", "unknown"))
                .sellValue(r.requireLong("item.sellValue"))
                .basePrice(r.optionalLong("item.basePrice", 0))
                .age(r.optionalInt("item.age", 0))
                .operatingHours(r.optionalInt("item.operatingHours", 0))
                .damage(r.optionalDouble("item.damage", 0.0))
                .wear(r.optionalDouble("item.wear", 0.0))
                .hiddenQuality(r.has("item.hiddenQuality") ? r.optionalDouble("item.hiddenQuality", 0.5) : null)
                .build();

        PendingOffer pending = null;
        if (r.has("pending.amount")) {
            long offeredAt = r.optionalLong("pending.offeredAtHour", 0);
            pending = new PendingOffer(
                    r.requireLong("pending.amount"),
                    offeredAt,
                    r.optionalLong("pending.expiresAtHour", offeredAt));
        }

        List<OfferHistoryEntry> history = new ArrayList<>();
        int offerCount = r.optionalInt("offerCount", 0);
        for (int i = 0; i < offerCount; i++) {
            String prefix = "offer." + i + ".";
            if (!r.has(prefix + "amount")) {
                continue;
            }
            history.add(new OfferHistoryEntry(
                    r.requireLong(prefix + "amount"),
                    r.optionalLong(prefix + "hour", 0),
                    r.optionalEnum(prefix + "decision", OfferDecision.class, OfferDecision.DECLINED)));
        }

        return SaleRequest.builder()
                .id(id)
                .ownerId(r.requireString("ownerId"))
                .listingId(r.requireString("listingId"))
                .item(item)
                .agentTier(agent)
                .feePaid(r.optionalLong("feePaid", 0))
                .createdAtHour(r.optionalLong("createdAtHour", 0))
                .hoursUntilOfferCheck(r.optionalInt("hoursUntilOfferCheck", agent.getOfferIntervalHours()))
                .pendingOffer(pending)
                .offerHistory(history)
                .build();
    }
}
