package com.github.raff.webhook.normalize;

import com.github.raff.webhook.domain.model.Platform;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Platform-neutral view of an order webhook. */
@Value
@Builder(toBuilder = true)
public class NormalizedOrderEvent {
    Platform platform;
    /** Lower-cased platform event name, e.g. "order.updated". */
    String eventType;
    String orderId;
    String storeId;
    String orderKey;
    BigDecimal total;
    String currency;
    /** Affiliate tracking id captured at checkout; null for organic orders. */
    String referrerCode;
    String paymentStatus;
    String orderStatus;
    Instant createdAt;
    Instant updatedAt;
    String idempotencyKey;

    public boolean isPaymentConfirmed() {
        return OrderStatusClassifier.isPaymentConfirmed(paymentStatus, orderStatus);
    }

    public boolean isOrderCancelled() {
        return OrderStatusClassifier.isOrderCancelled(paymentStatus, orderStatus);
    }
}
