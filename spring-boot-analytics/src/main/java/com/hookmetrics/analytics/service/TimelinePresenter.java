package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.CheckRunChild;
import com.hookmetrics.analytics.model.DisplayEvent;
import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineEvent;
import com.hookmetrics.analytics.model.TimelineGroup;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens grouped timeline into the display list.
 *
 * <p>Within a group, non check run events are listed one by one. Check runs follow, one node per commit:
 * a commit with several checks becomes a single node with the checks as children. Display only; the
 * summary counts are computed from the canonical events, not from this list.
 */
@Component
public class TimelinePresenter {

    private static final String UNKNOWN_SHA = "unknown";

    public List<DisplayEvent> flatten(List<TimelineGroup> groups) {
        List<DisplayEvent> display = new ArrayList<>();

        for (TimelineGroup group : groups) {
            Instant timestamp = group.getTimestamp();
            Map<String, List<TimelineEvent>> checksBySha = new LinkedHashMap<>();

            for (TimedEvent timed : group.getEvents()) {
                TimelineEvent event = timed.event();
                if (event.getKind() == EventKind.CHECK_RUN) {
                    String sha = event.detailsAs(EventDetails.CheckRun.class).headSha();
                    checksBySha.computeIfAbsent(sha == null ? UNKNOWN_SHA : sha,
                            key -> new ArrayList<>()).add(event);
                } else {
                    display.add(toDisplay(event, timestamp));
                }
            }

            checksBySha.forEach((sha, checks) -> {
                if (checks.size() == 1) {
                    display.add(toDisplay(checks.get(0), timestamp));
                } else {
                    display.add(commitChecks(sha, checks, timestamp));
                }
            });
        }
        return display;
    }

    private DisplayEvent commitChecks(String sha, List<TimelineEvent> checks, Instant timestamp) {
        int passed = 0;
        int failed = 0;
        List<CheckRunChild> children = new ArrayList<>();
        for (TimelineEvent event : checks) {
            EventDetails.CheckRun check = event.detailsAs(EventDetails.CheckRun.class);
            if (check.passed()) {
                passed++;
            } else if (check.failed()) {
                failed++;
            }
            children.add(new CheckRunChild(check.name(), check.conclusion(), check.status()));
        }

        return DisplayEvent.builder()
                .eventType(EventKind.CHECK_RUN)
                .timestamp(timestamp)
                .description(String.format("%d Check Runs (%d ✓, %d ✗)", checks.size(), passed, failed))
                .commit(sha)
                .children(children)
                .build();
    }

    DisplayEvent toDisplay(TimelineEvent event, Instant timestamp) {
        DisplayEvent.DisplayEventBuilder builder = DisplayEvent.builder()
                .eventType(event.getKind())
                .timestamp(timestamp)
                .description(describe(event));

        EventDetails details = event.getDetails();
        if (details instanceof EventDetails.CheckRun) {
            EventDetails.CheckRun check = (EventDetails.CheckRun) details;
            builder.name(check.name())
                    .conclusion(Optional.ofNullable(check.conclusion()))
                    .status(check.status());
        } else if (details instanceof EventDetails.Comment) {
            EventDetails.Comment comment = (EventDetails.Comment) details;
            builder.body(comment.body())
                    .truncated(comment.truncated())
                    .url(comment.url());
        }
        return builder.build();
    }

    static String describe(TimelineEvent event) {
        String actor = "@" + event.getActor();
        return switch (event.getKind()) {
            case PR_OPENED -> actor + " opened this pull request";
            case PR_CLOSED -> actor + " closed this pull request";
            case PR_MERGED -> "@" + event.detailsAs(EventDetails.Merged.class).mergedBy() + " merged this pull request";
            case PR_REOPENED -> actor + " reopened this pull request";
            case COMMIT -> actor + " pushed commits";
            case READY_FOR_REVIEW -> actor + " marked ready for review";
            case REVIEW_REQUESTED -> actor + " requested review from @"
                    + event.detailsAs(EventDetails.ReviewRequest.class).reviewer();
            case REVIEW_APPROVED -> actor + " approved";
            case REVIEW_CHANGES -> actor + " requested changes";
            case REVIEW_COMMENT, COMMENT -> actor + " commented";
            case LABEL_ADDED -> actor + " added label '" + event.detailsAs(EventDetails.Label.class).label() + "'";
            case LABEL_REMOVED -> actor + " removed label '" + event.detailsAs(EventDetails.Label.class).label() + "'";
            case VERIFIED -> actor + " verified";
            case APPROVED_LABEL -> actor + " approved via label";
            case LGTM -> actor + " gave LGTM";
            case CHECK_RUN -> {
                EventDetails.CheckRun check = event.detailsAs(EventDetails.CheckRun.class);
                yield check.name() + " - " + (check.conclusion() != null ? check.conclusion() : "running");
            }
        };
    }
}
