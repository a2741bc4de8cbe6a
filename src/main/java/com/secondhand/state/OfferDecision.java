package com.secondhand.state;

/**
 * How a buyer offer on a sale listing ended.
 */
public enum OfferDecision {
    ACCEPTED,
    DECLINED,

    /**
     * Owner didn't answer within the offer window.
     */
    LAPSED
}
