package com.hookmetrics.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Current state of a pull request as reconstructed from its pull_request deliveries.
 */
@Value
@Builder
public class PrMetadata {
    int number;
    String repository;
    String title;
    String author;
    PrState state;
    Instant createdAt;
    Instant mergedAt;
    Instant closedAt;

    // Every head SHA the PR has pointed at, used to find CI notifications
    @Singular
    Set<String> allHeadShas;

    public boolean isMerged() {
        return state == PrState.MERGED;
    }
}
