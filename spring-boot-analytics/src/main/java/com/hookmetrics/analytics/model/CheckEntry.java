package com.hookmetrics.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Reconciled CI result for one (check name, commit) pair, from either a check_run or a status delivery.
 */
@Value
@Builder
public class CheckEntry {
    String name;
    String headSha;
    String status;
    String conclusion;
    String deliveryId;
    Instant occurredAt;
}
