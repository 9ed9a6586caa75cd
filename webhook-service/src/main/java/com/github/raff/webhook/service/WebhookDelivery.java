package com.github.raff.webhook.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.normalize.WebhookEventKind;

/** A verified, parsed delivery ready for dispatch. */
public record WebhookDelivery(
        Platform platform,
        String eventType,
        WebhookEventKind kind,
        JsonNode payload,
        byte[] body,
        String deliveryId
) {
}
