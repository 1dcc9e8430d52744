package com.hookmetrics.analytics.model;

/**
 * One check inside a per-commit check run node of the display timeline.
 */
public record CheckRunChild(String name, String conclusion, String status) {
}
