package com.hookmetrics.analytics.store;

/**
 * Read failure of the event log that did not already surface as a runtime exception.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
