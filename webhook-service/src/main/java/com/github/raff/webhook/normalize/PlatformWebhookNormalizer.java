package com.github.raff.webhook.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.raff.webhook.domain.model.Platform;

/**
 * Reads one platform's webhook payloads. Field-name quirks stay behind this
 * interface; everything downstream sees {@link NormalizedOrderEvent}.
 */
public interface PlatformWebhookNormalizer {

    Platform platform();

    /** Trimmed, lower-cased event name, or null when the payload carries none. */
    String eventType(JsonNode payload);

    /** External store id for product and order events, or null. */
    String storeId(JsonNode payload);

    /** External store id for app lifecycle events, which nest it differently. */
    String appStoreId(JsonNode payload);

    /** Product id for product events, or null. */
    String productId(JsonNode payload);

    /**
     * @throws com.github.raff.webhook.error.PayloadValidationException when order or store id is missing
     */
    NormalizedOrderEvent normalizeOrder(String eventType, JsonNode payload);
}
