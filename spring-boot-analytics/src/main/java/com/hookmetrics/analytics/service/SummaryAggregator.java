package com.hookmetrics.analytics.service;

import com.hookmetrics.analytics.model.EventDetails;
import com.hookmetrics.analytics.model.PrSummary;
import com.hookmetrics.analytics.model.TimedEvent;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Roll-up counts over all canonical events of a PR. Order independent.
 */
@Component
public class SummaryAggregator {

    public PrSummary summarize(Collection<TimedEvent> events, Set<String> allHeadShas) {
        int reviews = 0;
        int approved = 0;
        int changesRequested = 0;
        int checkRuns = 0;
        int passed = 0;
        int failed = 0;
        int comments = 0;

        for (TimedEvent timed : events) {
            switch (timed.kind()) {
                case REVIEW_APPROVED:
                    approved++;
                    reviews++;
                    break;
                case REVIEW_CHANGES:
                    changesRequested++;
                    reviews++;
                    break;
                case REVIEW_COMMENT:
                    reviews++;
                    break;
                case CHECK_RUN:
                    checkRuns++;
                    EventDetails.CheckRun check = timed.event().detailsAs(EventDetails.CheckRun.class);
                    if (check.passed()) {
                        passed++;
                    } else if (check.failed()) {
                        failed++;
                    }
                    break;
                case COMMENT:
                    comments++;
                    break;
                default:
                    break;
            }
        }

        return PrSummary.builder()
                // each head SHA is one push to the PR branch
                .totalCommits(allHeadShas.size())
                .totalReviews(reviews)
                .totalCheckRuns(checkRuns)
                .totalComments(comments)
                .checkRunsPassed(passed)
                .checkRunsFailed(failed)
                .reviewsApproved(approved)
                .reviewsChangesRequested(changesRequested)
                .build();
    }
}
