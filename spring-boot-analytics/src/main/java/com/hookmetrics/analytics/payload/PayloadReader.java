package com.hookmetrics.analytics.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.hookmetrics.analytics.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns the stored payload document into a JSON tree for the typed decoders.
 */
@Component
@RequiredArgsConstructor
public class PayloadReader {

    private final ObjectMapper objectMapper;

    public JsonNode read(Map<String, Object> payload) {
        if (payload == null) {
            return MissingNode.getInstance();
        }
        return objectMapper.valueToTree(payload);
    }

    public PullRequestPayload pullRequest(WebhookEvent event) {
        return new PullRequestPayload(read(event.getPayload()));
    }

    public CheckRunPayload checkRun(WebhookEvent event) {
        return new CheckRunPayload(read(event.getPayload()));
    }

    public StatusPayload status(WebhookEvent event) {
        return new StatusPayload(read(event.getPayload()));
    }
}
