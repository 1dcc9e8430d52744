package com.hookmetrics.analytics.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Display-ready timeline entry. Check run and comment entries carry their extra fields;
 * a per-commit check run node carries the commit and its children.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DisplayEvent {
    EventKind eventType;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;

    String description;

    // check_run; a pending check has an empty conclusion, serialized as null
    String name;
    Optional<String> conclusion;
    String status;

    // comment
    String body;
    Boolean truncated;
    String url;

    // grouped check runs of one commit
    String commit;
    List<CheckRunChild> children;
}
