package com.hookmetrics.analytics.controller;

import com.hookmetrics.analytics.model.PrStory;
import com.hookmetrics.analytics.service.PrStoryService;
import com.hookmetrics.analytics.store.AggregationCancelledException;
import com.hookmetrics.analytics.store.EventStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.regex.Pattern;

// Validates the PR key, runs the aggregation against the Mongo event log and maps the outcome to HTTP
@RestController
@RequestMapping("/api/metrics")
@Slf4j
public class PrStoryController {

    private static final Pattern NAME_PART = Pattern.compile("[A-Za-z0-9_.-]+");

    private final PrStoryService prStoryService;
    private final EventStore eventStore;

    private final Timer storyTimer;
    private final Counter notFound;

    public PrStoryController(PrStoryService prStoryService, EventStore eventStore, MeterRegistry meterRegistry) {
        this.prStoryService = prStoryService;
        this.eventStore = eventStore;

        this.storyTimer = Timer.builder("prstory.requests")
                .description("Time spent aggregating PR stories")
                .register(meterRegistry);
        this.notFound = Counter.builder("prstory.not_found")
                .description("PR story requests for PRs without pull_request events")
                .register(meterRegistry);
    }

    @GetMapping("/pr-story/{owner}/{repo}/{prNumber}")
    public ResponseEntity<?> getPrStory(
            @PathVariable String owner,
            @PathVariable String repo,
            @PathVariable int prNumber) {

        if (prNumber <= 0) {
            return ResponseEntity.badRequest().body(new ErrorResponse("PR number must be positive"));
        }
        if (!NAME_PART.matcher(owner).matches() || !NAME_PART.matcher(repo).matches()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("Repository must be in owner/name format"));
        }
        String repository = owner + "/" + repo;

        try {
            Optional<PrStory> story = storyTimer.record(
                    () -> prStoryService.getPrStory(eventStore, repository, prNumber));

            if (story.isEmpty()) {
                notFound.increment();
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("PR #" + prNumber + " not found in " + repository));
            }
            return ResponseEntity.ok(story.get());

        } catch (AggregationCancelledException e) {
            log.warn("PR story for {} #{} cancelled: {}", repository, prNumber, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("PR story request was cancelled"));
        } catch (RuntimeException e) {
            log.error("Failed to fetch PR story for {} #{}: {}", repository, prNumber, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(new ErrorResponse("Failed to fetch PR story"));
        }
    }

    record ErrorResponse(String detail) {}
}
