package com.hookmetrics.analytics.store;

import com.hookmetrics.analytics.model.WebhookEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * {@link EventStore} over the "webhooks" collection written by the consumer service.
 */
@Repository
@Slf4j
public class MongoEventStore implements EventStore {

    static final String CHECK_RUN_SHA = "payload.check_run.head_sha";
    static final String STATUS_SHA = "payload.sha";

    private final MongoTemplate mongoTemplate;
    private final AsyncTaskExecutor executor;
    private final Duration queryMaxTime;

    public MongoEventStore(
            MongoTemplate mongoTemplate,
            @Qualifier("eventStoreExecutor") AsyncTaskExecutor executor,
            @Value("${prstory.query-max-time-ms:10000}") long queryMaxTimeMs) {
        this.mongoTemplate = mongoTemplate;
        this.executor = executor;
        this.queryMaxTime = Duration.ofMillis(queryMaxTimeMs);
    }

    @Override
    public List<WebhookEvent> fetchEventsForPr(String repository, int prNumber) {
        Query query = Query.query(Criteria.where("repository").is(repository).and("prNumber").is(prNumber));
        return find(query);
    }

    @Override
    public CheckAndStatusEvents fetchCheckAndStatusEvents(String repository, Set<String> headShas) {
        if (headShas.isEmpty()) {
            return CheckAndStatusEvents.empty();
        }

        // Both reads are independent; run them side by side and wait for both
        Future<List<WebhookEvent>> checkRuns = executor.submit(() -> find(bySha("check_run", repository, CHECK_RUN_SHA, headShas)));
        Future<List<WebhookEvent>> statuses = executor.submit(() -> find(bySha("status", repository, STATUS_SHA, headShas)));

        try {
            return new CheckAndStatusEvents(checkRuns.get(), statuses.get());
        } catch (InterruptedException e) {
            checkRuns.cancel(true);
            statuses.cancel(true);
            Thread.currentThread().interrupt();
            throw new AggregationCancelledException("Interrupted while reading CI events for " + repository, e);
        } catch (ExecutionException e) {
            checkRuns.cancel(true);
            statuses.cancel(true);
            Throwable cause = e.getCause();
            log.error("Failed to read CI events for {}: {}", repository, cause.getMessage(), cause);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EventStoreException("Failed to read CI events for " + repository, cause);
        }
    }

    private static Query bySha(String eventType, String repository, String shaField, Set<String> headShas) {
        return Query.query(Criteria.where("eventType").is(eventType)
                .and("repository").is(repository)
                .and(shaField).in(headShas));
    }

    private List<WebhookEvent> find(Query query) {
        query.with(Sort.by(Sort.Direction.ASC, "occurredAt")).maxTime(queryMaxTime);
        return mongoTemplate.find(query, WebhookEvent.class);
    }
}
