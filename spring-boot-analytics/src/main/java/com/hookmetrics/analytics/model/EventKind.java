package com.hookmetrics.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical timeline event kinds. The wire name is what the dashboard receives as event_type.
 */
public enum EventKind {
    PR_OPENED("pr_opened"),
    PR_CLOSED("pr_closed"),
    PR_MERGED("pr_merged"),
    PR_REOPENED("pr_reopened"),
    COMMIT("commit"),
    READY_FOR_REVIEW("ready_for_review"),
    REVIEW_REQUESTED("review_requested"),
    VERIFIED("verified"),
    APPROVED_LABEL("approved_label"),
    LGTM("lgtm"),
    LABEL_ADDED("label_added"),
    LABEL_REMOVED("label_removed"),
    REVIEW_APPROVED("review_approved"),
    REVIEW_CHANGES("review_changes"),
    REVIEW_COMMENT("review_comment"),
    COMMENT("comment"),
    CHECK_RUN("check_run");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
