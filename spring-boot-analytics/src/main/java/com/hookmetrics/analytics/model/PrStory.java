package com.hookmetrics.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Complete history of one pull request: metadata, display timeline and roll-up counts.
 */
@Value
@Builder
public class PrStory {
    PrView pr;
    List<DisplayEvent> events;
    PrSummary summary;
}
