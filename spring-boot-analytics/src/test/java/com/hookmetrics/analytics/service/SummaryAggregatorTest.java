package com.hookmetrics.analytics.service;

import static com.hookmetrics.analytics.WebhookFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.PrSummary;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SummaryAggregatorTest {

    private final SummaryAggregator aggregator = new SummaryAggregator();

    private static TimedEvent event(EventKind kind, EventDetails details) {
        return new TimedEvent(T0, TimelineEvent.builder().kind(kind).actor("a").details(details).build());
    }

    private static TimedEvent event(EventKind kind) {
        return event(kind, EventDetails.NONE);
    }

    private static TimedEvent check(String conclusion) {
        return event(EventKind.CHECK_RUN, new EventDetails.CheckRun("ci", "completed", conclusion, "abc1234"));
    }

    @Test
    void countsReviewsChecksAndComments() {
        List<TimedEvent> events = List.of(
                event(EventKind.PR_OPENED, new EventDetails.Opened("t", false)),
                event(EventKind.REVIEW_APPROVED),
                event(EventKind.REVIEW_CHANGES),
                event(EventKind.REVIEW_COMMENT),
                event(EventKind.COMMENT, new EventDetails.Comment("hi", false, "")),
                event(EventKind.LGTM, new EventDetails.Label("lgtm-bob")),
                check("success"),
                check("cancelled"),
                check(null));

        PrSummary summary = aggregator.summarize(events, Set.of("sha1", "sha2"));

        assertThat(summary.getTotalCommits()).isEqualTo(2);
        assertThat(summary.getTotalReviews()).isEqualTo(3);
        assertThat(summary.getReviewsApproved()).isEqualTo(1);
        assertThat(summary.getReviewsChangesRequested()).isEqualTo(1);
        assertThat(summary.getTotalCheckRuns()).isEqualTo(3);
        assertThat(summary.getCheckRunsPassed()).isEqualTo(1);
        assertThat(summary.getCheckRunsFailed()).isEqualTo(1);
        assertThat(summary.getTotalComments()).isEqualTo(1);
    }

    @Test
    void orderDoesNotMatter() {
        List<TimedEvent> events = new ArrayList<>(List.of(
                event(EventKind.REVIEW_APPROVED), check("success"), event(EventKind.COMMENT,
                        new EventDetails.Comment("x", false, "")), check("failure")));
        PrSummary forward = aggregator.summarize(events, Set.of("a"));

        Collections.reverse(events);

        assertThat(aggregator.summarize(events, Set.of("a"))).isEqualTo(forward);
    }

    @Test
    void emptyTimeline() {
        PrSummary summary = aggregator.summarize(List.of(), Set.of());

        assertThat(summary.getTotalCommits()).isZero();
        assertThat(summary.getTotalReviews()).isZero();
        assertThat(summary.getTotalCheckRuns()).isZero();
        assertThat(summary.getTotalComments()).isZero();
    }
}
