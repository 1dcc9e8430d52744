package com.hookmetrics.analytics.model;

import java.time.Instant;

/**
 * A timeline event paired with the time of the delivery that produced it.
 */
public record TimedEvent(Instant occurredAt, TimelineEvent event) {

    public EventKind kind() {
        return event.getKind();
    }
}
