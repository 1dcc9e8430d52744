package com.hookmetrics.analytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.TimelineEvent;
import com.hookmetrics.analytics.payload.IssueCommentPayload;
import com.hookmetrics.analytics.payload.PullRequestPayload;
import com.hookmetrics.analytics.payload.PullRequestReviewPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Projects one raw webhook delivery onto zero or more canonical timeline events.
 * Pure: no I/O, and unknown event types or actions simply produce nothing.
 */
@Component
public class EventExtractor {

    static final String UNKNOWN_ACTOR = "unknown";
    static final int COMMENT_BODY_LIMIT = 500;

    private static final String APPROVED_PREFIX = "approved-";
    private static final String LGTM_PREFIX = "lgtm-";

    public List<TimelineEvent> extract(String eventType, String action, JsonNode payload, String deliveryId) {
        if (eventType == null || action == null) {
            return List.of();
        }
        switch (eventType) {
            case "pull_request":
                return fromPullRequest(action, new PullRequestPayload(payload), deliveryId);
            case "pull_request_review":
                return fromReview(action, new PullRequestReviewPayload(payload), deliveryId);
            case "issue_comment":
                return fromIssueComment(action, new IssueCommentPayload(payload), deliveryId);
            default:
                return List.of();
        }
    }

    private List<TimelineEvent> fromPullRequest(String action, PullRequestPayload payload, String deliveryId) {
        String actor = payload.sender().orElse(UNKNOWN_ACTOR);

        switch (action) {
            case "opened":
                return single(EventKind.PR_OPENED, actor, deliveryId,
                        new EventDetails.Opened(payload.title().orElse(""), payload.draft().orElse(false)));
            case "closed":
                if (payload.merged()) {
                    return single(EventKind.PR_MERGED, actor, deliveryId,
                            new EventDetails.Merged(payload.mergedBy().orElse(actor)));
                }
                return single(EventKind.PR_CLOSED, actor, deliveryId, EventDetails.NONE);
            case "reopened":
                return single(EventKind.PR_REOPENED, actor, deliveryId, EventDetails.NONE);
            case "synchronize":
                return single(EventKind.COMMIT, actor, deliveryId,
                        new EventDetails.Commit(payload.commits().orElse(0), payload.headSha().orElse("")));
            case "ready_for_review":
                return single(EventKind.READY_FOR_REVIEW, actor, deliveryId, EventDetails.NONE);
            case "review_requested":
                return single(EventKind.REVIEW_REQUESTED, actor, deliveryId,
                        new EventDetails.ReviewRequest(payload.requestedReviewer().orElse(UNKNOWN_ACTOR)));
            case "labeled":
                return List.of(fromLabel(payload.labelName().orElse(""), actor, deliveryId));
            case "unlabeled":
                return single(EventKind.LABEL_REMOVED, actor, deliveryId,
                        new EventDetails.Label(payload.labelName().orElse("")));
            default:
                return List.of();
        }
    }

    // Branch order matters when a label matches several rules: verified, then approved-, then lgtm-
    private TimelineEvent fromLabel(String label, String sender, String deliveryId) {
        EventDetails details = new EventDetails.Label(label);

        if (label.toLowerCase(Locale.ROOT).contains("verified")) {
            return event(EventKind.VERIFIED, sender, deliveryId, details);
        }
        if (label.startsWith(APPROVED_PREFIX)) {
            // approved-<username>: the approver is named by the label, not the sender
            return event(EventKind.APPROVED_LABEL, label.substring(APPROVED_PREFIX.length()), deliveryId, details);
        }
        if (label.startsWith(LGTM_PREFIX)) {
            return event(EventKind.LGTM, label.substring(LGTM_PREFIX.length()), deliveryId, details);
        }
        return event(EventKind.LABEL_ADDED, sender, deliveryId, details);
    }

    private List<TimelineEvent> fromReview(String action, PullRequestReviewPayload payload, String deliveryId) {
        if (!"submitted".equals(action)) {
            return List.of();
        }
        String reviewer = payload.reviewer().orElseGet(() -> payload.sender().orElse(UNKNOWN_ACTOR));

        switch (payload.state().orElse("")) {
            case "approved":
                return single(EventKind.REVIEW_APPROVED, reviewer, deliveryId, EventDetails.NONE);
            case "changes_requested":
                return single(EventKind.REVIEW_CHANGES, reviewer, deliveryId, EventDetails.NONE);
            case "commented":
                return single(EventKind.REVIEW_COMMENT, reviewer, deliveryId, EventDetails.NONE);
            default:
                return List.of();
        }
    }

    private List<TimelineEvent> fromIssueComment(String action, IssueCommentPayload payload, String deliveryId) {
        if (!"created".equals(action) || !payload.onPullRequest()) {
            return List.of();
        }
        String body = payload.body().orElse("");
        boolean truncated = body.length() > COMMENT_BODY_LIMIT;

        return single(EventKind.COMMENT, payload.sender().orElse(UNKNOWN_ACTOR), deliveryId,
                new EventDetails.Comment(truncated ? body.substring(0, COMMENT_BODY_LIMIT) : body,
                        truncated,
                        payload.url().orElse("")));
    }

    private static List<TimelineEvent> single(EventKind kind, String actor, String deliveryId, EventDetails details) {
        return List.of(event(kind, actor, deliveryId, details));
    }

    private static TimelineEvent event(EventKind kind, String actor, String deliveryId, EventDetails details) {
        return TimelineEvent.builder()
                .kind(kind)
                .actor(actor)
                .details(details)
                .sourceDeliveryId(deliveryId)
                .build();
    }
}
