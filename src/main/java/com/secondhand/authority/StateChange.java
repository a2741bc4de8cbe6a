package com.secondhand.authority;

import lombok.Value;

/**
 * One applied request, as sent to every participant.
 */
@Value
public class StateChange {

    long sequence;

    long hour;

    String participantId;

    RequestType type;

    /**
     * Search, listing or sale the change touched; for new searches and sales, the new id.
     */
    String targetId;

    /**
     * Short human-readable account of the result.
     */
    String summary;
}
