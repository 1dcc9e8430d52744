package com.hookmetrics.consumer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.hookmetrics.consumer.model.WebhookDelivery;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;

@ExtendWith(MockitoExtension.class)
class WebhookConsumerServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    MongoTemplate mongoTemplate;

    private SimpleMeterRegistry meterRegistry;
    private WebhookConsumerService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new WebhookConsumerService(mongoTemplate, meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    void storesPullRequestDeliveryWithDerivedEnvelope() {
        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId("d1")
                .eventType("pull_request")
                .payload(payload(
                        "action", "opened",
                        "repository", payload("full_name", "testorg/testrepo"),
                        "pull_request", payload("number", 123)))
                .build();

        assertThat(service.store(delivery)).isTrue();

        verify(mongoTemplate).insert(delivery);
        assertThat(delivery.getAction()).isEqualTo("opened");
        assertThat(delivery.getRepository()).isEqualTo("testorg/testrepo");
        assertThat(delivery.getPrNumber()).isEqualTo(123);
        assertThat(delivery.getOccurredAt()).isEqualTo(NOW);
        assertThat(delivery.getStoredAt()).isEqualTo(NOW);
        assertThat(counter("webhooks.deliveries.stored")).isEqualTo(1.0);
    }

    @Test
    void commentOnPullRequestTakesNumberFromIssue() {
        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId("d2")
                .eventType("issue_comment")
                .payload(payload("issue", payload("number", 7, "pull_request", payload())))
                .build();

        service.normalize(delivery);

        assertThat(delivery.getPrNumber()).isEqualTo(7);
    }

    @Test
    void commentOnPlainIssueHasNoPrNumber() {
        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId("d3")
                .eventType("issue_comment")
                .payload(payload("issue", payload("number", 7)))
                .build();

        service.normalize(delivery);

        assertThat(delivery.getPrNumber()).isNull();
    }

    @Test
    void envelopeFieldsFromProducerAreKept() {
        Instant occurredAt = Instant.parse("2024-01-15T09:00:00Z");
        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId("d4")
                .eventType("check_run")
                .action("completed")
                .repository("other/repo")
                .occurredAt(occurredAt)
                .payload(payload("repository", payload("full_name", "testorg/testrepo")))
                .build();

        service.normalize(delivery);

        assertThat(delivery.getRepository()).isEqualTo("other/repo");
        assertThat(delivery.getAction()).isEqualTo("completed");
        assertThat(delivery.getOccurredAt()).isEqualTo(occurredAt);
    }

    @Test
    void missingRepositoryFallsBackToUnknown() {
        WebhookDelivery delivery = WebhookDelivery.builder().deliveryId("d5").eventType("status").build();

        service.normalize(delivery);

        assertThat(delivery.getRepository()).isEqualTo("unknown");
        assertThat(delivery.getAction()).isEmpty();
    }

    @Test
    void redeliveryIsSkipped() {
        WebhookDelivery delivery = WebhookDelivery.builder().deliveryId("d1").eventType("ping").build();
        when(mongoTemplate.insert(any(WebhookDelivery.class))).thenThrow(new DuplicateKeyException("E11000"));

        assertThat(service.store(delivery)).isFalse();

        assertThat(counter("webhooks.deliveries.duplicates")).isEqualTo(1.0);
        assertThat(counter("webhooks.deliveries.stored")).isZero();
    }

    @Test
    void deliveryWithoutIdIsRejected() {
        WebhookDelivery delivery = WebhookDelivery.builder().deliveryId(" ").eventType("ping").build();

        assertThatThrownBy(() -> service.store(delivery)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mongoTemplate);
    }
}
