package com.github.raff.webhook.ledger;

import com.github.raff.webhook.domain.model.Platform;
import lombok.Builder;
import lombok.Value;

/** What gets registered for one delivery. */
@Value
@Builder
public class LedgerEntry {
    Platform platform;
    String storeId;
    String eventType;
    String idempotencyKey;
    /** Platform's own delivery id header, if sent. */
    String deliveryHeaderId;
    /** Redacted JSON snapshot. */
    String payload;
}
