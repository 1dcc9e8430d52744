package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.CheckEntry;
import com.hookmetrics.analytics.model.PrMetadata;
import com.hookmetrics.analytics.model.PrStory;
import com.hookmetrics.analytics.model.PrView;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineEvent;
import com.hookmetrics.analytics.model.TimelineGroup;
import com.hookmetrics.analytics.model.WebhookEvent;
import com.hookmetrics.analytics.payload.PayloadReader;
import com.hookmetrics.analytics.store.CheckAndStatusEvents;
import com.hookmetrics.analytics.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the story of one pull request from the webhook event log.
 *
 * <p>Stateless and side-effect free: every call reads the log afresh, so repeated calls against an
 * unchanged log give identical results. Store failures propagate to the caller untouched; nothing is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PrStoryService {

    private static final Comparator<TimedEvent> BY_TIME = Comparator.comparing(TimedEvent::occurredAt);

    private final PayloadReader payloadReader;
    private final EventExtractor extractor;
    private final PrMetadataResolver metadataResolver;
    private final CheckRunReconciler checkRunReconciler;
    private final TimelineGrouper grouper;
    private final SummaryAggregator summaryAggregator;
    private final TimelinePresenter presenter;

    /**
     * @param store event log to read from
     * @param repository repository full name, already validated by the caller
     * @param prNumber positive PR number, already validated by the caller
     * @return empty when the log holds no pull_request delivery for the PR
     */
    public Optional<PrStory> getPrStory(EventStore store, String repository, int prNumber) {
        log.debug("Fetching PR story for {} #{}", repository, prNumber);

        List<WebhookEvent> prEvents = withTime(store.fetchEventsForPr(repository, prNumber));

        Optional<PrMetadata> resolved = metadataResolver.resolve(repository, prNumber, prEvents);
        if (resolved.isEmpty()) {
            log.debug("No pull_request events found for {} #{}", repository, prNumber);
            return Optional.empty();
        }
        PrMetadata metadata = resolved.get();

        List<TimedEvent> timeline = new ArrayList<>();
        for (WebhookEvent raw : prEvents) {
            List<TimelineEvent> extracted = extractor.extract(
                    raw.getEventType(), raw.getAction(), payloadReader.read(raw.getPayload()), raw.getDeliveryId());
            for (TimelineEvent event : extracted) {
                timeline.add(new TimedEvent(raw.getOccurredAt(), event));
            }
        }

        // check_run and status deliveries carry no PR number; without a head SHA there is nothing to match on
        if (!metadata.getAllHeadShas().isEmpty()) {
            CheckAndStatusEvents ci = store.fetchCheckAndStatusEvents(repository, metadata.getAllHeadShas());
            Map<String, List<CheckEntry>> checks = checkRunReconciler.reconcile(
                    withTime(ci.checkRunEvents()), withTime(ci.statusEvents()));
            timeline.addAll(checkRunReconciler.toTimelineEvents(checks));
        }

        // stable: events of one delivery keep their extraction order
        timeline.sort(BY_TIME);
        List<TimelineGroup> groups = grouper.group(timeline);

        log.debug("PR {} #{}: {} deliveries, {} timeline events in {} groups",
                repository, prNumber, prEvents.size(), timeline.size(), groups.size());

        return Optional.of(PrStory.builder()
                .pr(PrView.from(metadata))
                .events(presenter.flatten(groups))
                .summary(summaryAggregator.summarize(timeline, metadata.getAllHeadShas()))
                .build());
    }

    // A delivery without a timestamp cannot be placed on the timeline
    private static List<WebhookEvent> withTime(List<WebhookEvent> events) {
        List<WebhookEvent> timed = new ArrayList<>(events.size());
        for (WebhookEvent event : events) {
            if (event.getOccurredAt() == null) {
                log.warn("Skipping delivery {} without occurrence time", event.getDeliveryId());
                continue;
            }
            timed.add(event);
        }
        return timed;
    }
}
