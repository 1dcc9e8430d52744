package com.hookmetrics.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A stored webhook delivery, read back from the "webhooks" collection.
 * Written by the consumer service; analytics never modifies it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document(collection = "webhooks")
public class WebhookEvent {

    @Id
    private String deliveryId;

    private String eventType;
    private String action;
    private String repository;
    private Integer prNumber;
    private Map<String, Object> payload;
    private Instant occurredAt;
}
