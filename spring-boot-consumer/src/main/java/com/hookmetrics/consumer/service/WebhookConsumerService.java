package com.hookmetrics.consumer.service;

import com.hookmetrics.consumer.model.WebhookDelivery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Consumes webhook deliveries from Kafka and appends them to the MongoDB event log.
 * Upstream delivery is at-least-once, so a delivery id that is already stored is skipped.
 */
@Service
@Slf4j
public class WebhookConsumerService {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    private final Counter deliveriesStored;
    private final Counter duplicatesSkipped;

    public WebhookConsumerService(MongoTemplate mongoTemplate, MeterRegistry meterRegistry) {
        this(mongoTemplate, meterRegistry, Clock.systemUTC());
    }

    WebhookConsumerService(MongoTemplate mongoTemplate, MeterRegistry meterRegistry, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;

        this.deliveriesStored = Counter.builder("webhooks.deliveries.stored")
                .description("Webhook deliveries appended to the event log")
                .register(meterRegistry);

        this.duplicatesSkipped = Counter.builder("webhooks.deliveries.duplicates")
                .description("Redelivered webhooks skipped because the delivery id was already stored")
                .register(meterRegistry);
    }

    @KafkaListener(
        topics = "${kafka.topic.webhook-deliveries}",
        groupId = "${spring.kafka.consumer.group-id}"
    )
    public void consumeDelivery(
            @Payload WebhookDelivery delivery,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset) {

        log.info("Received webhook delivery: id={}, event={}, action={}, partition={}, offset={}",
                 delivery.getDeliveryId(),
                 delivery.getEventType(),
                 delivery.getAction(),
                 partition,
                 offset);

        store(delivery);
    }

    /**
     * Normalizes the envelope and inserts the delivery.
     *
     * @return true if the delivery was written, false if it was a redelivery
     */
    public boolean store(WebhookDelivery delivery) {
        if (delivery.getDeliveryId() == null || delivery.getDeliveryId().isBlank()) {
            throw new IllegalArgumentException("Webhook delivery without delivery id: event="
                    + delivery.getEventType());
        }

        normalize(delivery);
        delivery.setStoredAt(clock.instant());

        try {
            mongoTemplate.insert(delivery);
        } catch (DuplicateKeyException e) {
            log.debug("Delivery {} already stored, skipping redelivery", delivery.getDeliveryId());
            duplicatesSkipped.increment();
            return false;
        }

        deliveriesStored.increment();
        log.debug("Stored delivery {}: repository={}, pr={}",
                delivery.getDeliveryId(), delivery.getRepository(), delivery.getPrNumber());
        return true;
    }

    void normalize(WebhookDelivery delivery) {
        Map<String, Object> payload = delivery.getPayload() != null ? delivery.getPayload() : Map.of();

        if (delivery.getAction() == null) {
            Object action = payload.get("action");
            delivery.setAction(action instanceof String ? (String) action : "");
        }

        if (delivery.getRepository() == null) {
            Object fullName = child(payload, "repository").get("full_name");
            delivery.setRepository(fullName instanceof String ? (String) fullName : "unknown");
        }

        if (delivery.getPrNumber() == null) {
            delivery.setPrNumber(prNumber(payload));
        }

        if (delivery.getOccurredAt() == null) {
            delivery.setOccurredAt(clock.instant());
        }
    }

    // pull_request payloads carry the number directly; comments carry it on an issue flagged as a PR
    private static Integer prNumber(Map<String, Object> payload) {
        if (payload.containsKey("pull_request")) {
            return asInteger(child(payload, "pull_request").get("number"));
        }
        Map<?, ?> issue = child(payload, "issue");
        if (issue.containsKey("pull_request")) {
            return asInteger(issue.get("number"));
        }
        return null;
    }

    private static Map<?, ?> child(Map<?, ?> parent, String key) {
        Object value = parent.get(key);
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }
}
