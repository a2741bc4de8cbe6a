package com.secondhand.state;

import lombok.Value;

/**
 * A buyer offer awaiting the owner's answer.
 */
@Value
public class PendingOffer {

    long amount;

    long offeredAtHour;

    long expiresAtHour;

    public boolean isLapsed(long currentHour) {
        return currentHour >= expiresAtHour;
    }

    public long hoursRemaining(long currentHour) {
        return Math.max(0, expiresAtHour - currentHour);
    }
}
