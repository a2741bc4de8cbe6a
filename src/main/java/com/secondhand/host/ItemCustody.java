package com.secondhand.host;

import com.secondhand.state.ListingView;

/**
 * Host inventory hooks for items entering and leaving the market.
 */
public interface ItemCustody {

    /**
     * Lock an owned item while it is listed for sale.
     *
     * @return false if the owner doesn't hold the item or it is already reserved
     */
    boolean reserve(String ownerId, String itemId);

    /**
     * Return a reserved item to the owner's free inventory.
     */
    void release(String ownerId, String itemId);

    /**
     * Remove a reserved item from the owner's inventory after it sold.
     */
    void surrender(String ownerId, String itemId);

    /**
     * Hand a purchased listing to its buyer.
     */
    void deliver(String buyerId, ListingView listing);
}
