package com.hookrelay.webhook.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An event callback that passed signature verification.
 *
 * @param payload the inner {@code event} object, passed through uninterpreted
 */
public record WebhookEvent(String eventId, String teamId, String eventType, JsonNode payload) {
}
