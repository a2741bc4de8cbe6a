package com.secondhand.state;

import com.google.gson.JsonObject;
import com.secondhand.condition.ConditionRating;
import com.secondhand.condition.Generation;
import com.secondhand.condition.QualityHint;
import com.secondhand.condition.ReliabilityScores;
import com.secondhand.inspection.InspectionRecord;
import com.secondhand.inspection.InspectionTier;
import com.secondhand.negotiation.NegotiationRecord;
import com.secondhand.negotiation.NegotiationState;
import com.secondhand.negotiation.SellerPersonality;
import com.secondhand.persistence.CorruptRecordException;
import com.secondhand.persistence.FlatRecordReader;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One unit of used goods on the market, owned by exactly one requester or owner.
 *
 * <p>Mutable, and written only by the queue named in {@link #getOrigin()}. Everything else
 * reads it through {@link #toView()}, which exposes only revealed condition fields. The
 * hidden quality scalar has no getter; engine code uses {@link #readHiddenQuality()}.
 */
@Getter
@Builder
public class ListingRecord {

    public static final String RECORD_TYPE = "listing";

    private final String id;

    private final ListingOrigin origin;

    private final String categoryId;

    private final String categoryName;

    private final String ownerId;

    /**
     * Search id (acquisition) or sale id (disposition) this listing belongs to.
     */
    private final String sourceId;

    /**
     * Item id in the owner's inventory for disposition listings, null otherwise.
     */
    @Nullable
    private final String itemId;

    @Setter
    private ListingStatus status;

    private final long createdAtHour;

    /**
     * Hours left before the listing expires.
     */
    @Setter
    private int ttlHours;

    /**
     * Whether the TTL runs for a found listing. Opens on the requester's first interaction.
     */
    private boolean offerWindowOpen;

    @Setter
    private boolean onHold;

    @Getter(AccessLevel.NONE)
    private final double hiddenQuality;

    private final SellerPersonality personality;

    private final Generation generation;

    private final int age;

    private final int operatingHours;

    private final double damage;

    private final double wear;

    private final ReliabilityScores reliability;

    private final long basePrice;

    @Setter
    private long askingPrice;

    private final long commission;

    /**
     * Which of the band's inspector quotes this listing shows, 1-based.
     */
    @Builder.Default
    private final int quoteIndex = 1;

    @Builder.Default
    private int periodsOnMarket = 0;

    @Builder.Default
    private final EnumSet<ConditionField> revealed = EnumSet.copyOf(ConditionField.VISIBLE_ON_LISTING);

    @Setter
    @Nullable
    private NegotiationRecord negotiation;

    @Setter
    @Nullable
    private InspectionRecord inspection;

    // ========================================================================
    // Engine access
    // ========================================================================

    /**
     * Hidden quality scalar. Engine-internal: never pass it to the presentation layer.
     */
    public double readHiddenQuality() {
        return hiddenQuality;
    }

    public boolean isRevealed(ConditionField field) {
        return revealed.contains(field);
    }

    public Set<ConditionField> getRevealed() {
        return Collections.unmodifiableSet(revealed);
    }

    public void reveal(Set<ConditionField> fields) {
        revealed.addAll(fields);
    }

    public void openOfferWindow() {
        this.offerWindowOpen = true;
    }

    public void incrementPeriodsOnMarket() {
        periodsOnMarket++;
    }

    public int daysOnMarket(long currentHour) {
        return (int) Math.max(0, (currentHour - createdAtHour) / 24);
    }

    public boolean isInspectionInProgress() {
        return inspection != null && inspection.isInProgress();
    }

    /**
     * Whether the TTL runs this hour: live status, not on hold, and for found listings
     * only once the offer window has opened.
     */
    public boolean isTtlRunning() {
        if (onHold) {
            return false;
        }
        switch (status) {
            case SEARCHING:
            case NEGOTIATING:
                return true;
            case FOUND:
                return offerWindowOpen;
            default:
                return false;
        }
    }

    /**
     * Advance the TTL by one hour if it is running.
     *
     * @return true if the TTL reached zero on this tick
     */
    public boolean tickTtl() {
        if (!isTtlRunning() || ttlHours <= 0) {
            return false;
        }
        ttlHours--;
        return ttlHours == 0;
    }

    // ========================================================================
    // Views
    // ========================================================================

    /**
     * Snapshot for queries. Unrevealed condition fields are null.
     */
    public ListingView toView() {
        ListingView.ListingViewBuilder view = ListingView.builder()
                .id(id)
                .origin(origin)
                .categoryId(categoryId)
                .categoryName(categoryName)
                .ownerId(ownerId)
                .sourceId(sourceId)
                .status(status)
                .createdAtHour(createdAtHour)
                .ttlHours(ttlHours)
                .offerWindowOpen(offerWindowOpen)
                .onHold(onHold)
                .basePrice(basePrice)
                .askingPrice(askingPrice)
                .commission(commission)
                .periodsOnMarket(periodsOnMarket)
                .revealed(Collections.unmodifiableSet(EnumSet.copyOf(revealed)));

        if (isRevealed(ConditionField.AGE)) {
            view.age(age);
        }
        if (isRevealed(ConditionField.OPERATING_HOURS)) {
            view.operatingHours(operatingHours);
        }
        if (isRevealed(ConditionField.GENERATION)) {
            view.generation(generation);
        }
        if (isRevealed(ConditionField.DAMAGE)) {
            view.damage(damage);
        }
        if (isRevealed(ConditionField.WEAR)) {
            view.wear(wear);
        }
        if (isRevealed(ConditionField.OVERALL_RATING)) {
            view.rating(ConditionRating.fromDegradation(damage, wear));
        }
        if (isRevealed(ConditionField.RELIABILITY) && reliability != null) {
            view.overallReliability(reliability.overall());
        }
        if (isRevealed(ConditionField.RELIABILITY_DETAIL) && reliability != null) {
            view.reliability(reliability);
        }
        if (isRevealed(ConditionField.QUALITY_HINT)) {
            QualityHint hint = QualityHint.fromHiddenQuality(hiddenQuality);
            view.qualityHint(hint).qualityQuoteKey(hint.quoteKey(quoteIndex));
        }
        if (negotiation != null) {
            view.negotiationState(negotiation.getState())
                    .counterAmount(negotiation.getCounterAmount())
                    .negotiationRounds(negotiation.getRoundCount());
        }
        if (inspection != null) {
            view.inspectionTier(inspection.getTier())
                    .inspectionCompletesAtHour(inspection.getCompletesAtHour())
                    .inspectionComplete(inspection.isComplete());
        }
        return view.build();
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("origin", origin.name());
        json.addProperty("categoryId", categoryId);
        json.addProperty("categoryName", categoryName);
        json.addProperty("ownerId", ownerId);
        json.addProperty("sourceId", sourceId);
        if (itemId != null) {
            json.addProperty("itemId", itemId);
        }
        json.addProperty("status", status.name());
        json.addProperty("createdAtHour", createdAtHour);
        json.addProperty("ttlHours", ttlHours);
        json.addProperty("offerWindowOpen", offerWindowOpen);
        json.addProperty("onHold", onHold);
        json.addProperty("hiddenQuality", hiddenQuality);
        json.addProperty("generation", generation.name());
        json.addProperty("age", age);
        json.addProperty("operatingHours", operatingHours);
        json.addProperty("damage", damage);
        json.addProperty("wear", wear);
        if (reliability != null) {
            json.addProperty("reliability.engine", reliability.getEngine());
            json.addProperty("reliability.hydraulic", reliability.getHydraulic());
            json.addProperty("reliability.electrical", reliability.getElectrical());
        }
        json.addProperty("basePrice", basePrice);
        json.addProperty("askingPrice", askingPrice);
        json.addProperty("commission", commission);
        json.addProperty("quoteIndex", quoteIndex);
        json.addProperty("periodsOnMarket", periodsOnMarket);
        json.addProperty("revealed", FlatRecordReader.joinList(revealed));

        if (negotiation != null) {
            json.addProperty("negotiation.state", negotiation.getState().name());
            json.addProperty("negotiation.lastOffer", negotiation.getLastOfferAmount());
            json.addProperty("negotiation.counter", negotiation.getCounterAmount());
            json.addProperty("negotiation.rounds", negotiation.getRoundCount());
            json.addProperty("negotiation.weatherModifier", negotiation.getWeatherModifier());
            json.addProperty("negotiation.cooldownUntilHour", negotiation.getCooldownUntilHour());
        }
        if (inspection != null) {
            json.addProperty("inspection.tier", inspection.getTier().name());
            json.addProperty("inspection.requestedAtHour", inspection.getRequestedAtHour());
            json.addProperty("inspection.completesAtHour", inspection.getCompletesAtHour());
            json.addProperty("inspection.feePaid", inspection.getFeePaid());
            json.addProperty("inspection.complete", inspection.isComplete());
        }
        return json;
    }

    /**
     * Restore a listing. Personality is re-derived from the stored hidden quality, never
     * read back, so it can't drift from the scalar.
     *
     * @throws CorruptRecordException if identity, ownership or pricing is missing or invalid
     */
    public static ListingRecord deserialize(JsonObject json) throws CorruptRecordException {
        FlatRecordReader r = new FlatRecordReader(json, RECORD_TYPE);

        double hiddenQuality = r.optionalDouble("hiddenQuality", -1);
        if (hiddenQuality < 0 || hiddenQuality > 1) {
            throw new CorruptRecordException("listing " + r.optionalString("id", "?")
                    + " has hidden quality outside [0, 1]: " + hiddenQuality);
        }
        SellerPersonality personality = SellerPersonality.fromHiddenQuality(hiddenQuality);

        ReliabilityScores reliability = null;
        if (r.has("reliability.engine")) {
            reliability = new ReliabilityScores(
                    r.optionalDouble("reliability.engine", 1.0),
                    r.optionalDouble("reliability.hydraulic", 1.0),
                    r.optionalDouble("reliability.electrical", 1.0));
        }

        EnumSet<ConditionField> revealed = EnumSet.copyOf(ConditionField.VISIBLE_ON_LISTING);
        for (String name : r.optionalList("revealed")) {
            try {
                revealed.add(ConditionField.valueOf(name));
            } catch (IllegalArgumentException e) {
                throw new CorruptRecordException("listing has unknown revealed field '" + name + "'", e);
            }
        }

        long askingPrice = r.requireLong("askingPrice");
        if (askingPrice <= 0) {
            throw new CorruptRecordException("listing has non-positive asking price " + askingPrice);
        }

        ListingRecord record = ListingRecord.builder()
                .id(r.requireString("id"))
                .origin(r.requireEnum("origin", ListingOrigin.class))
                .categoryId(r.optionalString("categoryId", "unknown"))
                .categoryName(r.optionalString("categoryName", "Unknown"))
                .ownerId(r.requireString("ownerId"))
                .sourceId(r.requireString("sourceId"))
                .itemId(r.optionalString("itemId", null))
                .status(r.requireEnum("status", ListingStatus.class))
                .createdAtHour(r.optionalLong("createdAtHour", 0))
                .ttlHours(r.optionalInt("ttlHours", 0))
                .offerWindowOpen(r.optionalBoolean("offerWindowOpen", false))
                .onHold(r.optionalBoolean("onHold", false))
                .hiddenQuality(hiddenQuality)
                .personality(personality)
                .generation(r.optionalEnum("generation", Generation.class, Generation.MID_AGE))
                .age(r.optionalInt("age", 0))
                .operatingHours(r.optionalInt("operatingHours", 0))
                .damage(r.optionalDouble("damage", 0.0))
                .wear(r.optionalDouble("wear", 0.0))
                .reliability(reliability)
                .basePrice(r.optionalLong("basePrice", askingPrice))
                .askingPrice(askingPrice)
                .commission(r.optionalLong("commission", 0))
                .quoteIndex(r.optionalInt("quoteIndex", 1))
                .periodsOnMarket(r.optionalInt("periodsOnMarket", 0))
                .revealed(revealed)
                .build();

        if (r.has("negotiation.state")) {
            record.setNegotiation(new NegotiationRecord(
                    personality,
                    r.optionalEnum("negotiation.state", NegotiationState.class, NegotiationState.AWAITING_OFFER),
                    r.optionalLong("negotiation.lastOffer", 0),
                    r.optionalLong("negotiation.counter", 0),
                    r.optionalInt("negotiation.rounds", 0),
                    r.optionalDouble("negotiation.weatherModifier", 0.0),
                    r.optionalLong("negotiation.cooldownUntilHour", 0)));
        }
        if (r.has("inspection.tier")) {
            InspectionTier tier = r.requireEnum("inspection.tier", InspectionTier.class);
            long requestedAt = r.optionalLong("inspection.requestedAtHour", record.getCreatedAtHour());
            record.setInspection(new InspectionRecord(
                    tier,
                    requestedAt,
                    r.optionalLong("inspection.completesAtHour", requestedAt + tier.getDurationHours()),
                    r.optionalLong("inspection.feePaid", 0),
                    r.optionalBoolean("inspection.complete", false)));
        }
        return record;
    }
}
