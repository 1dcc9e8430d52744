package com.hookmetrics.analytics.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One canonical fact on a pull request timeline. It has no timestamp of its own;
 * the time comes from the webhook delivery it was derived from (see {@link TimedEvent}).
 */
@Value
@Builder
public class TimelineEvent {

    @NonNull
    EventKind kind;

    String actor;

    @NonNull
    @Builder.Default
    EventDetails details = EventDetails.NONE;

    String sourceDeliveryId;

    /**
     * Details cast to the shape of this event's kind.
     */
    public <T extends EventDetails> T detailsAs(Class<T> type) {
        return type.cast(details);
    }
}
