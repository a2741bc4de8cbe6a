package com.secondhand.authority;

import lombok.Getter;

/**
 * Player actions a participant can send to the authority.
 */
@Getter
public enum RequestType {
    REQUEST_SEARCH(false),
    RENEW_SEARCH(true),
    CANCEL_SEARCH(true),
    VIEW_LISTING(true),
    SUBMIT_OFFER(true),
    ACCEPT_COUNTER(true),
    STAND_FIRM(true),
    PURCHASE_LISTING(true),
    LIST_FOR_SALE(false),
    CANCEL_SALE(true),
    ACCEPT_OFFER(true),
    DECLINE_OFFER(true),
    REQUEST_INSPECTION(true),
    CANCEL_INSPECTION(true);

    /**
     * Whether the request names an existing search, listing or sale that must belong to
     * the sender.
     */
    private final boolean targeted;

    RequestType(boolean targeted) {
        this.targeted = targeted;
    }
}
