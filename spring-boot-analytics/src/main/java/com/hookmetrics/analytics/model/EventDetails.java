package com.hookmetrics.analytics.model;

/**
 * Kind-specific payload of a {@link TimelineEvent}. Each kind has exactly one details shape.
 */
public interface EventDetails {

    EventDetails NONE = new None();

    record None() implements EventDetails {
    }

    record Opened(String title, boolean draft) implements EventDetails {
    }

    record Merged(String mergedBy) implements EventDetails {
    }

    record Commit(int commitsCount, String headSha) implements EventDetails {
    }

    record ReviewRequest(String reviewer) implements EventDetails {
    }

    record Label(String label) implements EventDetails {
    }

    record Comment(String body, boolean truncated, String url) implements EventDetails {
    }

    /**
     * @param headSha short (7 character) form of the commit the check ran against
     */
    record CheckRun(String name, String status, String conclusion, String headSha) implements EventDetails {

        public boolean passed() {
            return "success".equals(conclusion);
        }

        public boolean failed() {
            return "failure".equals(conclusion) || "cancelled".equals(conclusion);
        }
    }
}
