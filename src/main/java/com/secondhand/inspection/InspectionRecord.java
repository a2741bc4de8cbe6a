package com.secondhand.inspection;

import lombok.Getter;

/**
 * One inspection of one listing. Timestamps are simulated hours.
 */
@Getter
public class InspectionRecord {

    private final InspectionTier tier;
    private final long requestedAtHour;
    private final long completesAtHour;
    private final long feePaid;
    private boolean complete;

    public InspectionRecord(InspectionTier tier, long requestedAtHour, long feePaid) {
        this(tier, requestedAtHour, requestedAtHour + tier.getDurationHours(), feePaid, false);
    }

    public InspectionRecord(InspectionTier tier, long requestedAtHour, long completesAtHour,
                            long feePaid, boolean complete) {
        this.tier = tier;
        this.requestedAtHour = requestedAtHour;
        this.completesAtHour = completesAtHour;
        this.feePaid = feePaid;
        this.complete = complete;
    }

    public boolean isInProgress() {
        return !complete;
    }

    public boolean isDue(long currentHour) {
        return !complete && currentHour >= completesAtHour;
    }

    public long hoursRemaining(long currentHour) {
        return complete ? 0 : Math.max(0, completesAtHour - currentHour);
    }

    void markComplete() {
        this.complete = true;
    }
}
