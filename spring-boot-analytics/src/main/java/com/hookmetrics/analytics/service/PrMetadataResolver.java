package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.PrMetadata;
import com.hookmetrics.analytics.model.PrState;
import com.hookmetrics.analytics.model.WebhookEvent;
import com.hookmetrics.analytics.payload.PayloadReader;
import com.hookmetrics.analytics.payload.PullRequestPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds PR metadata from the PR's pull_request deliveries in a single ordered pass.
 *
 * <p>Title, author and creation time come from the first delivery. State, merge/close times and head
 * SHAs are taken from every delivery, the last one winning. Once any delivery reports the PR as merged
 * the state stays merged.
 */
@Component
@RequiredArgsConstructor
public class PrMetadataResolver {

    static final String PULL_REQUEST = "pull_request";

    private final PayloadReader payloadReader;

    /**
     * @param events deliveries of the PR in ascending time order; non pull_request deliveries are ignored
     * @return empty when none of the deliveries is a pull_request delivery
     */
    public Optional<PrMetadata> resolve(String repository, int prNumber, List<WebhookEvent> events) {
        boolean seen = false;
        String title = "";
        String author = EventExtractor.UNKNOWN_ACTOR;
        Instant createdAt = null;
        PrState state = PrState.UNKNOWN;
        boolean merged = false;
        Instant mergedAt = null;
        Instant closedAt = null;
        Set<String> headShas = new LinkedHashSet<>();

        for (WebhookEvent event : events) {
            if (!PULL_REQUEST.equals(event.getEventType())) {
                continue;
            }
            PullRequestPayload payload = payloadReader.pullRequest(event);

            if (!seen) {
                title = payload.title().orElse("");
                author = payload.author().orElse(EventExtractor.UNKNOWN_ACTOR);
                createdAt = payload.createdAt().orElse(null);
                seen = true;
            }

            state = PrState.fromPayload(payload.state().orElse(null));
            merged = merged || payload.merged();
            payload.headSha().ifPresent(headShas::add);

            Optional<Instant> merge = payload.mergedAt();
            if (merge.isPresent()) {
                mergedAt = merge.get();
            }
            Optional<Instant> close = payload.closedAt();
            if (close.isPresent()) {
                closedAt = close.get();
            }
        }

        if (!seen) {
            return Optional.empty();
        }

        return Optional.of(PrMetadata.builder()
                .number(prNumber)
                .repository(repository)
                .title(title)
                .author(author)
                .state(merged ? PrState.MERGED : state)
                .createdAt(createdAt)
                .mergedAt(mergedAt)
                .closedAt(closedAt)
                .allHeadShas(headShas)
                .build());
    }
}
