package com.hookmetrics.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PrSummary {
    int totalCommits;
    int totalReviews;
    int totalCheckRuns;
    int totalComments;

    int checkRunsPassed;
    int checkRunsFailed;
    int reviewsApproved;
    int reviewsChangesRequested;
}
