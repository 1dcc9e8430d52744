package com.hookmetrics.analytics.store;

import com.hookmetrics.analytics.model.WebhookEvent;

import java.util.List;

public record CheckAndStatusEvents(List<WebhookEvent> checkRunEvents, List<WebhookEvent> statusEvents) {

    public static CheckAndStatusEvents empty() {
        return new CheckAndStatusEvents(List.of(), List.of());
    }
}
