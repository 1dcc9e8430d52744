package com.hookmetrics.analytics.model;

/**
 * Summary standing in for several same-kind events of one timeline group.
 */
public record CollapsedSummary(EventKind kind, int count, String summary) {
}
