package com.github.raff.webhook.audit;

import com.github.raff.webhook.domain.model.Platform;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One line of the processed-webhook audit log. */
@Value
@Builder
public class ProcessedWebhookRecord {
    String idempotencyKey;
    String event;
    String orderId;
    String orderKey;
    Platform platform;
    String storeId;
    String merchantId;
    boolean processed;
    String error;
    /** Redacted JSON. */
    String payload;
    Instant processedAt;
}
