package com.secondhand.state;

import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;

/**
 * The session's view of the host's monotonic simulated-hour counter.
 */
@Slf4j
@Singleton
public class MarketClock {

    private long currentHour;

    public long currentHour() {
        return currentHour;
    }

    /**
     * Move to {@code hour}. Hours behind the current one are refused.
     *
     * @return true if the clock moved forward
     */
    public boolean advanceTo(long hour) {
        if (hour < currentHour) {
            log.warn("Ignoring hour {} behind current hour {}", hour, currentHour);
            return false;
        }
        if (hour == currentHour) {
            return false;
        }
        currentHour = hour;
        return true;
    }

    /**
     * Set the hour from a save file.
     */
    public void restore(long hour) {
        currentHour = hour;
    }
}
