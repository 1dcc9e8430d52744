package com.hookmetrics.consumer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One webhook delivery as stored in the append-only "webhooks" collection.
 * The delivery id is the document id, so a redelivered message cannot be stored twice.
 */
@Document(collection = "webhooks")
@CompoundIndexes({
        @CompoundIndex(name = "repo_pr_time", def = "{'repository': 1, 'prNumber': 1, 'occurredAt': 1}"),
        @CompoundIndex(name = "check_run_sha", def = "{'eventType': 1, 'repository': 1, 'payload.check_run.head_sha': 1}"),
        @CompoundIndex(name = "status_sha", def = "{'eventType': 1, 'repository': 1, 'payload.sha': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    @Id
    private String deliveryId;

    private String eventType;
    private String action;
    private String repository;
    private Integer prNumber;

    // Raw GitHub payload, kept as-is
    private Map<String, Object> payload;

    private Instant occurredAt;

    // When the consumer wrote the document
    private Instant storedAt;
}
