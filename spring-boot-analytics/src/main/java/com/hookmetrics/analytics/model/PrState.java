package com.hookmetrics.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PrState {
    OPEN,
    CLOSED,
    MERGED,
    UNKNOWN;

    public static PrState fromPayload(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        switch (state.toLowerCase(Locale.ROOT)) {
            case "open":
                return OPEN;
            case "closed":
                return CLOSED;
            case "merged":
                return MERGED;
            default:
                return UNKNOWN;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
