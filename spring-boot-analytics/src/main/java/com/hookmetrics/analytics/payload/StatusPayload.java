package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Decoder for commit "status" deliveries.
 */
public class StatusPayload extends WebhookPayload {

    public StatusPayload(JsonNode root) {
        super(root);
    }

    public Optional<String> context() {
        return text("context");
    }

    public Optional<String> sha() {
        return text("sha");
    }

    // pending, success, failure or error
    public Optional<String> state() {
        return text("state");
    }
}
