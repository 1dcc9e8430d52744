package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * Decoder for "pull_request" deliveries.
 */
public class PullRequestPayload extends WebhookPayload {

    public PullRequestPayload(JsonNode root) {
        super(root);
    }

    public Optional<String> title() {
        return text("pull_request", "title");
    }

    public Optional<Boolean> draft() {
        return bool("pull_request", "draft");
    }

    public Optional<String> state() {
        return text("pull_request", "state");
    }

    public boolean merged() {
        return bool("pull_request", "merged").orElse(false);
    }

    public Optional<String> mergedBy() {
        return text("pull_request", "merged_by", "login");
    }

    public Optional<String> author() {
        return text("pull_request", "user", "login");
    }

    public Optional<String> headSha() {
        return text("pull_request", "head", "sha").filter(sha -> !sha.isEmpty());
    }

    public Optional<Integer> commits() {
        return integer("pull_request", "commits");
    }

    public Optional<Instant> createdAt() {
        return instant("pull_request", "created_at");
    }

    public Optional<Instant> mergedAt() {
        return instant("pull_request", "merged_at");
    }

    public Optional<Instant> closedAt() {
        return instant("pull_request", "closed_at");
    }

    public Optional<String> requestedReviewer() {
        return text("requested_reviewer", "login");
    }

    public Optional<String> labelName() {
        return text("label", "name");
    }
}
