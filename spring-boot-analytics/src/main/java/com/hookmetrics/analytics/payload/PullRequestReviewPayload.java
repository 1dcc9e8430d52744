package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Decoder for "pull_request_review" deliveries.
 */
public class PullRequestReviewPayload extends WebhookPayload {

    public PullRequestReviewPayload(JsonNode root) {
        super(root);
    }

    /**
     * Review state, lower-cased ("approved", "changes_requested", "commented", ...).
     */
    public Optional<String> state() {
        return text("review", "state").map(state -> state.toLowerCase(Locale.ROOT));
    }

    /**
     * Author of the review, which is not necessarily the sender of the delivery.
     */
    public Optional<String> reviewer() {
        return text("review", "user", "login");
    }
}
