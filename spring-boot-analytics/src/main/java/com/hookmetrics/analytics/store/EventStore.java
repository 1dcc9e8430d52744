package com.hookmetrics.analytics.store;

import com.hookmetrics.analytics.model.WebhookEvent;

import java.util.List;
import java.util.Set;

/**
 * Read access to the immutable webhook event log.
 * Implementations throw Spring {@code DataAccessException}s (or {@link EventStoreException}) on read failures
 * and never retry on their own.
 */
public interface EventStore {

    /**
     * All deliveries recorded against a pull request, ascending by occurrence time.
     * An empty list means nothing is known about the PR.
     */
    List<WebhookEvent> fetchEventsForPr(String repository, int prNumber);

    /**
     * check_run and status deliveries of a repository whose commit is one of {@code headShas},
     * each list ascending by occurrence time.
     *
     * @throws AggregationCancelledException if the calling thread is interrupted while waiting
     */
    CheckAndStatusEvents fetchCheckAndStatusEvents(String repository, Set<String> headShas);
}
