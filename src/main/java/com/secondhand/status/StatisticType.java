package com.secondhand.status;

/**
 * Per-owner market counters.
 */
public enum StatisticType {
    SEARCHES_STARTED,
    SEARCHES_SUCCEEDED,
    SEARCHES_FAILED,
    SEARCHES_CANCELLED,
    ITEMS_FOUND,
    LISTINGS_PURCHASED,
    LISTINGS_WITHDRAWN,
    LISTINGS_EXPIRED,
    SALES_LISTED,
    SALES_COMPLETED,
    SALES_CANCELLED,
    SALES_EXPIRED,
    OFFERS_RECEIVED,
    INSPECTIONS_COMPLETED
}
