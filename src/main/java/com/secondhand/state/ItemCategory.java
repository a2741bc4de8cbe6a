package com.secondhand.state;

import lombok.NonNull;
import lombok.Value;

/**
 * Kind of equipment a search looks for, with its new price.
 */
@Value
public class ItemCategory {

    @NonNull
    String id;

    @NonNull
    String name;

    long basePrice;
}
