package com.secondhand.state;

/**
 * Lifecycle of a {@link SearchRequest}.
 */
public enum SearchStatus {

    /**
     * Agent still looking.
     */
    ACTIVE,

    /**
     * Finished with results; stays live until every found listing is consumed.
     */
    RESOLVED,

    /**
     * Finished with nothing found.
     */
    FAILED,

    CANCELLED;

    public boolean isFinished() {
        return this != ACTIVE;
    }
}
