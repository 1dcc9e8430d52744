package com.hookmetrics.analytics.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PrView {
    int number;
    String repository;
    String title;
    PrState state;
    boolean merged;
    String author;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant mergedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant closedAt;

    public static PrView from(PrMetadata metadata) {
        return PrView.builder()
                .number(metadata.getNumber())
                .repository(metadata.getRepository())
                .title(metadata.getTitle())
                .state(metadata.getState())
                .merged(metadata.isMerged())
                .author(metadata.getAuthor())
                .createdAt(metadata.getCreatedAt())
                .mergedAt(metadata.getMergedAt())
                .closedAt(metadata.getClosedAt())
                .build();
    }
}
