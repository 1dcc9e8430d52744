package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Base for the typed views over raw webhook payloads.
 * Every accessor is partial: a missing or mistyped field yields an empty Optional, never an exception.
 */
@Slf4j
public abstract class WebhookPayload {

    private final JsonNode root;

    protected WebhookPayload(JsonNode root) {
        this.root = root != null ? root : MissingNode.getInstance();
    }

    /**
     * Login of the account that triggered the delivery.
     */
    public Optional<String> sender() {
        return text("sender", "login");
    }

    protected JsonNode at(String... path) {
        JsonNode node = root;
        for (String field : path) {
            node = node.path(field);
        }
        return node;
    }

    protected boolean has(String... path) {
        return !at(path).isMissingNode();
    }

    protected Optional<String> text(String... path) {
        JsonNode node = at(path);
        return node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }

    protected Optional<Boolean> bool(String... path) {
        JsonNode node = at(path);
        return node.isBoolean() ? Optional.of(node.asBoolean()) : Optional.empty();
    }

    protected Optional<Integer> integer(String... path) {
        JsonNode node = at(path);
        return node.isIntegralNumber() && node.canConvertToInt() ? Optional.of(node.asInt()) : Optional.empty();
    }

    protected Optional<Instant> instant(String... path) {
        return text(path).flatMap(value -> {
            try {
                return Optional.of(OffsetDateTime.parse(value).toInstant());
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparseable timestamp at {}: {}", String.join(".", path), value);
                return Optional.empty();
            }
        });
    }
}
