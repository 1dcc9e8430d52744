package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Decoder for "issue_comment" deliveries.
 */
public class IssueCommentPayload extends WebhookPayload {

    public IssueCommentPayload(JsonNode root) {
        super(root);
    }

    /**
     * GitHub marks issues that are pull requests with a "pull_request" object.
     */
    public boolean onPullRequest() {
        return has("issue", "pull_request");
    }

    public Optional<String> body() {
        return text("comment", "body");
    }

    public Optional<String> url() {
        return text("comment", "html_url");
    }
}
