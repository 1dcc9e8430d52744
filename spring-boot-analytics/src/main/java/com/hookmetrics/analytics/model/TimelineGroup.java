package com.hookmetrics.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Events that happened within one grouping window, anchored at the time of the first of them.
 */
@Value
@Builder
public class TimelineGroup {
    Instant timestamp;

    @Singular
    List<TimedEvent> events;

    CollapsedSummary collapsed;

    public Optional<CollapsedSummary> collapsedSummary() {
        return Optional.ofNullable(collapsed);
    }
}
