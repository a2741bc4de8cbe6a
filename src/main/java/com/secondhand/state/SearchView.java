package com.secondhand.state;

import com.secondhand.condition.AgentTier;
import com.secondhand.condition.QualityTier;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchView {

    String id;
    String requesterId;
    String categoryId;
    String categoryName;
    QualityTier qualityTier;
    AgentTier agentTier;
    long feePaid;
    long createdAtHour;
    long completesAtHour;
    int remainingHours;
    SearchStatus status;
    List<String> listingIds;
}
