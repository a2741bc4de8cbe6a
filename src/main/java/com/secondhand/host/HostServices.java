package com.secondhand.host;

import com.secondhand.authority.StateBroadcaster;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Collaborators the embedding application supplies when it opens a market session.
 */
@Value
@Builder
public class HostServices {

    @NonNull
    MoneyLedger ledger;

    @NonNull
    WeatherService weather;

    @NonNull
    NotificationSink notifications;

    @NonNull
    ItemCustody custody;

    @Builder.Default
    CreditScoreProvider creditScores = CreditScoreProvider.NEUTRAL;

    @Builder.Default
    StateBroadcaster broadcaster = StateBroadcaster.NONE;
}
