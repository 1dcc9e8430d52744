package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Decoder for "check_run" deliveries. These carry no PR number, only the commit SHA.
 */
public class CheckRunPayload extends WebhookPayload {

    public CheckRunPayload(JsonNode root) {
        super(root);
    }

    public Optional<String> name() {
        return text("check_run", "name");
    }

    public Optional<String> headSha() {
        return text("check_run", "head_sha");
    }

    public Optional<String> status() {
        return text("check_run", "status");
    }

    // null while queued or in progress
    public Optional<String> conclusion() {
        return text("check_run", "conclusion");
    }
}
