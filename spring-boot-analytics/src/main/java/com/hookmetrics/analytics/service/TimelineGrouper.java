package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.CollapsedSummary;
import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineGroup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets time-ordered events into groups of near-simultaneous activity.
 *
 * <p>A group is anchored at its first event and takes every following event that is at most one window
 * after the anchor. The window is measured from the anchor, not from the previous event, so a slow
 * drift of events does not stretch a group.
 */
@Component
public class TimelineGrouper {

    private final Duration window;

    public TimelineGrouper(@Value("${prstory.grouping-window-seconds:60}") long windowSeconds) {
        this.window = Duration.ofSeconds(windowSeconds);
    }

    /**
     * @param events events sorted ascending by time
     */
    public List<TimelineGroup> group(List<TimedEvent> events) {
        List<TimelineGroup> groups = new ArrayList<>();
        List<TimedEvent> current = new ArrayList<>();
        Instant anchor = null;

        for (TimedEvent event : events) {
            if (anchor == null || Duration.between(anchor, event.occurredAt()).compareTo(window) > 0) {
                if (!current.isEmpty()) {
                    groups.add(close(anchor, current));
                }
                current = new ArrayList<>();
                anchor = event.occurredAt();
            }
            current.add(event);
        }
        if (!current.isEmpty()) {
            groups.add(close(anchor, current));
        }
        return groups;
    }

    private TimelineGroup close(Instant anchor, List<TimedEvent> events) {
        return TimelineGroup.builder()
                .timestamp(anchor)
                .events(events)
                .collapsed(collapse(events))
                .build();
    }

    /**
     * Summary for the first kind (in order of appearance) that occurs more than once, if any.
     */
    static CollapsedSummary collapse(List<TimedEvent> events) {
        Map<EventKind, Integer> counts = new LinkedHashMap<>();
        for (TimedEvent event : events) {
            counts.merge(event.kind(), 1, Integer::sum);
        }

        for (Map.Entry<EventKind, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count < 2) {
                continue;
            }
            EventKind kind = entry.getKey();
            if (kind == EventKind.CHECK_RUN) {
                int passed = 0;
                int failed = 0;
                for (TimedEvent event : events) {
                    if (event.kind() != EventKind.CHECK_RUN) {
                        continue;
                    }
                    EventDetails.CheckRun check = event.event().detailsAs(EventDetails.CheckRun.class);
                    if (check.passed()) {
                        passed++;
                    } else if (check.failed()) {
                        failed++;
                    }
                }
                return new CollapsedSummary(kind, count,
                        String.format("%d check runs (%d passed, %d failed)", count, passed, failed));
            }
            return new CollapsedSummary(kind, count, String.format("%d %s events", count, kind.wireName()));
        }
        return null;
    }
}
