package com.github.raff.webhook.fraud;

import com.github.raff.webhook.domain.model.ClickTracking;
import com.github.raff.webhook.domain.model.Commission;
import java.time.Instant;

/**
 * Inputs to fraud rules for one order event.
 *
 * @param existing the order's commission, or null when this event will create it
 */
public record FraudContext(ClickTracking click, String merchantId, String orderId, Commission existing, Instant now) {

    /** True when the order's own commission falls inside a window starting at {@code since}. */
    public boolean orderCreatedSince(Instant since) {
        return existing == null || existing.getCreatedAt() == null || !existing.getCreatedAt().isBefore(since);
    }
}
