package com.hookmetrics.analytics.store;

/**
 * Thrown when the caller is interrupted while event log reads are in flight.
 * The in-flight reads are cancelled and no partial result exists.
 */
public class AggregationCancelledException extends RuntimeException {

    public AggregationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
