package com.secondhand.state;

import com.secondhand.condition.ConditionRating;
import com.secondhand.condition.Generation;
import com.secondhand.condition.QualityHint;
import com.secondhand.condition.ReliabilityScores;
import com.secondhand.inspection.InspectionTier;
import com.secondhand.negotiation.NegotiationState;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.Set;

/**
 * Read-only snapshot of a listing as its viewer may see it.
 *
 * <p>Condition fields are null until revealed; {@link #getRevealed()} says which are set.
 */
@Value
@Builder
public class ListingView {

    String id;
    ListingOrigin origin;
    String categoryId;
    String categoryName;
    String ownerId;
    String sourceId;
    ListingStatus status;
    long createdAtHour;
    int ttlHours;
    boolean offerWindowOpen;
    boolean onHold;

    long basePrice;
    long askingPrice;
    long commission;
    int periodsOnMarket;

    Set<ConditionField> revealed;

    @Nullable
    Integer age;

    @Nullable
    Integer operatingHours;

    @Nullable
    Generation generation;

    @Nullable
    Double damage;

    @Nullable
    Double wear;

    @Nullable
    ConditionRating rating;

    @Nullable
    Double overallReliability;

    @Nullable
    ReliabilityScores reliability;

    @Nullable
    QualityHint qualityHint;

    @Nullable
    String qualityQuoteKey;

    @Nullable
    NegotiationState negotiationState;

    long counterAmount;

    int negotiationRounds;

    @Nullable
    InspectionTier inspectionTier;

    long inspectionCompletesAtHour;

    boolean inspectionComplete;
}
