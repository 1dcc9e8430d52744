package com.hookmetrics.analytics.service;

import static com.hookmetrics.analytics.WebhookFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

import com.hookmetrics.analytics.model.CollapsedSummary;
import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineEvent;
import com.hookmetrics.analytics.model.TimelineGroup;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimelineGrouperTest {

    private final TimelineGrouper grouper = new TimelineGrouper(60);

    private static TimedEvent at(long seconds, EventKind kind) {
        return at(seconds, kind, EventDetails.NONE);
    }

    private static TimedEvent at(long seconds, EventKind kind, EventDetails details) {
        return new TimedEvent(T0.plusSeconds(seconds),
                TimelineEvent.builder().kind(kind).actor("someone").details(details).sourceDeliveryId("d" + seconds).build());
    }

    private static TimedEvent check(long seconds, String conclusion) {
        return at(seconds, EventKind.CHECK_RUN, new EventDetails.CheckRun("ci", "completed", conclusion, "abc1234"));
    }

    @Test
    void emptyInputHasNoGroups() {
        assertThat(grouper.group(List.of())).isEmpty();
    }

    @Test
    void eventsWithinWindowShareAGroup() {
        List<TimelineGroup> groups = grouper.group(List.of(
                at(0, EventKind.PR_OPENED),
                at(10, EventKind.REVIEW_APPROVED)));

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.getTimestamp()).isEqualTo(T0);
            assertThat(group.getEvents()).extracting(TimedEvent::kind)
                    .containsExactly(EventKind.PR_OPENED, EventKind.REVIEW_APPROVED);
            assertThat(group.collapsedSummary()).isEmpty();
        });
    }

    @Test
    void windowBoundaryIsInclusive() {
        List<TimelineGroup> groups = grouper.group(List.of(
                at(0, EventKind.PR_OPENED),
                at(60, EventKind.COMMIT),
                at(61, EventKind.COMMENT)));

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).getEvents()).hasSize(2);
        assertThat(groups.get(1).getTimestamp()).isEqualTo(T0.plusSeconds(61));
    }

    @Test
    void windowIsMeasuredFromTheAnchorNotThePreviousEvent() {
        List<TimelineGroup> groups = grouper.group(List.of(
                at(0, EventKind.PR_OPENED),
                at(50, EventKind.COMMIT),
                at(100, EventKind.LABEL_ADDED),
                at(150, EventKind.COMMENT)));

        assertThat(groups).extracting(TimelineGroup::getTimestamp)
                .containsExactly(T0, T0.plusSeconds(100));
        assertThat(groups.get(0).getEvents()).extracting(TimedEvent::kind)
                .containsExactly(EventKind.PR_OPENED, EventKind.COMMIT);
        assertThat(groups.get(1).getEvents()).extracting(TimedEvent::kind)
                .containsExactly(EventKind.LABEL_ADDED, EventKind.COMMENT);
    }

    @Test
    void groupsAreOrderedAndEveryEventLandsInExactlyOneWithinItsWindow() {
        List<TimedEvent> events = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            events.add(at(i * 17L, i % 2 == 0 ? EventKind.COMMENT : EventKind.COMMIT));
        }

        List<TimelineGroup> groups = grouper.group(events);

        assertThat(groups.stream().mapToInt(group -> group.getEvents().size()).sum()).isEqualTo(events.size());
        for (int i = 1; i < groups.size(); i++) {
            assertThat(groups.get(i - 1).getTimestamp()).isBefore(groups.get(i).getTimestamp());
        }
        for (TimelineGroup group : groups) {
            for (TimedEvent event : group.getEvents()) {
                Duration offset = Duration.between(group.getTimestamp(), event.occurredAt());
                assertThat(offset).isBetween(Duration.ZERO, Duration.ofSeconds(60));
            }
        }
    }

    @Test
    void repeatedKindCollapsesGenerically() {
        TimelineGroup group = grouper.group(List.of(
                at(0, EventKind.LABEL_ADDED),
                at(1, EventKind.COMMENT),
                at(2, EventKind.LABEL_ADDED),
                at(3, EventKind.LABEL_ADDED))).get(0);

        assertThat(group.collapsedSummary()).contains(
                new CollapsedSummary(EventKind.LABEL_ADDED, 3, "3 label_added events"));
        assertThat(group.getEvents()).hasSize(4);
    }

    @Test
    void checkRunsCollapseWithPassFailCounts() {
        TimelineGroup group = grouper.group(List.of(
                check(0, "success"),
                check(1, "failure"),
                check(2, "cancelled"),
                check(3, "success"),
                check(4, null))).get(0);

        assertThat(group.getCollapsed()).isEqualTo(
                new CollapsedSummary(EventKind.CHECK_RUN, 5, "5 check runs (2 passed, 2 failed)"));
    }

    @Test
    void onlyTheFirstRepeatedKindCollapses() {
        TimelineGroup group = grouper.group(List.of(
                at(0, EventKind.COMMENT),
                at(1, EventKind.COMMIT),
                at(2, EventKind.COMMIT),
                at(3, EventKind.COMMENT))).get(0);

        assertThat(group.getCollapsed().kind()).isEqualTo(EventKind.COMMENT);
        assertThat(group.getCollapsed().count()).isEqualTo(2);
    }

    @Test
    void windowIsConfigurable() {
        TimelineGrouper tight = new TimelineGrouper(5);

        List<TimelineGroup> groups = tight.group(List.of(at(0, EventKind.PR_OPENED), at(10, EventKind.COMMIT)));

        assertThat(groups).extracting(TimelineGroup::getTimestamp)
                .containsExactly(T0, Instant.parse("2024-01-15T10:00:10Z"));
    }
}
