package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.CheckEntry;
import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.EventKind;
import com.hookmetrics.analytics.model.TimedEvent;
import com.hookmetrics.analytics.model.TimelineEvent;
import com.hookmetrics.analytics.model.WebhookEvent;
import com.hookmetrics.analytics.payload.CheckRunPayload;
import com.hookmetrics.analytics.payload.PayloadReader;
import com.hookmetrics.analytics.payload.StatusPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges check_run and commit status notifications into one entry per (check name, commit).
 *
 * <p>check_run deliveries overwrite whatever is stored for their key, so the last one processed wins.
 * A status delivery only replaces an existing entry when it is strictly newer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CheckRunReconciler {

    static final String CI_ACTOR = "github-actions";
    static final int SHORT_SHA_LENGTH = 7;

    private final PayloadReader payloadReader;

    /**
     * @param checkRunEvents check_run deliveries, ascending by time
     * @param statusEvents status deliveries, ascending by time
     * @return surviving entries grouped by short head SHA, in first-seen order
     */
    public Map<String, List<CheckEntry>> reconcile(List<WebhookEvent> checkRunEvents, List<WebhookEvent> statusEvents) {
        Map<CheckKey, CheckEntry> entries = new LinkedHashMap<>();

        for (WebhookEvent event : checkRunEvents) {
            CheckRunPayload payload = payloadReader.checkRun(event);
            String name = payload.name().orElse(EventExtractor.UNKNOWN_ACTOR);
            String headSha = payload.headSha().orElse("");

            entries.put(new CheckKey(name, headSha), CheckEntry.builder()
                    .name(name)
                    .headSha(shortSha(headSha))
                    .status(payload.status().orElse(EventExtractor.UNKNOWN_ACTOR))
                    .conclusion(payload.conclusion().orElse(null))
                    .deliveryId(event.getDeliveryId())
                    .occurredAt(event.getOccurredAt())
                    .build());
        }

        for (WebhookEvent event : statusEvents) {
            StatusPayload payload = payloadReader.status(event);
            String context = payload.context().orElse(EventExtractor.UNKNOWN_ACTOR);
            String sha = payload.sha().orElse("");
            CheckKey key = new CheckKey(context, sha);

            CheckEntry existing = entries.get(key);
            if (existing != null && !isAfter(event.getOccurredAt(), existing.getOccurredAt())) {
                continue;
            }
            String state = payload.state().orElse(EventExtractor.UNKNOWN_ACTOR);
            entries.put(key, CheckEntry.builder()
                    .name(context)
                    .headSha(shortSha(sha))
                    .status(statusOf(state))
                    .conclusion(conclusionOf(state))
                    .deliveryId(event.getDeliveryId())
                    .occurredAt(event.getOccurredAt())
                    .build());
        }

        Map<String, List<CheckEntry>> bySha = new LinkedHashMap<>();
        for (CheckEntry entry : entries.values()) {
            bySha.computeIfAbsent(entry.getHeadSha(), sha -> new ArrayList<>()).add(entry);
        }
        log.debug("Reconciled {} check_run and {} status deliveries into {} checks across {} commits",
                checkRunEvents.size(), statusEvents.size(), entries.size(), bySha.size());
        return bySha;
    }

    /**
     * Timeline events for reconciled checks. Every check of a commit is stamped with the latest time
     * among that commit's checks so they land in the same timeline group.
     */
    public List<TimedEvent> toTimelineEvents(Map<String, List<CheckEntry>> checksBySha) {
        List<TimedEvent> events = new ArrayList<>();
        for (List<CheckEntry> checks : checksBySha.values()) {
            Instant latest = checks.stream()
                    .map(CheckEntry::getOccurredAt)
                    .filter(Objects::nonNull)
                    .max(Comparator.naturalOrder())
                    .orElse(null);

            for (CheckEntry check : checks) {
                events.add(new TimedEvent(latest, TimelineEvent.builder()
                        .kind(EventKind.CHECK_RUN)
                        .actor(CI_ACTOR)
                        .details(new EventDetails.CheckRun(
                                check.getName(), check.getStatus(), check.getConclusion(), check.getHeadSha()))
                        .sourceDeliveryId(check.getDeliveryId())
                        .build()));
            }
        }
        return events;
    }

    static String statusOf(String state) {
        switch (state) {
            case "success":
            case "failure":
            case "error":
                return "completed";
            default:
                return "pending";
        }
    }

    static String conclusionOf(String state) {
        switch (state) {
            case "success":
                return "success";
            case "failure":
            case "error":
                return "failure";
            default:
                return null;
        }
    }

    private static String shortSha(String sha) {
        return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
    }

    private static boolean isAfter(Instant candidate, Instant current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    private record CheckKey(String name, String headSha) {
    }
}
