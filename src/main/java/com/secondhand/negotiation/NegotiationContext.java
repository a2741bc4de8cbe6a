package com.secondhand.negotiation;

import com.secondhand.host.WeatherCondition;
import lombok.Builder;
import lombok.Value;

/**
 * Listing facts the seller weighs when answering an offer.
 */
@Value
@Builder
public class NegotiationContext {

    String listingId;

    long askingPrice;

    long basePrice;

    double damage;

    int operatingHours;

    int daysOnMarket;

    @Builder.Default
    WeatherCondition weather = WeatherCondition.SUN;
}
