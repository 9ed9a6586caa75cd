package com.github.raff.webhook.normalize;

import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Platform;
import org.springframework.stereotype.Component;

/** Salla payloads: {event, merchant, created_at, data:{...}}. */
@Component
public class SallaWebhookNormalizer extends TableDrivenNormalizer {

    private static final FieldPaths PATHS = FieldPaths.builder()
            .eventType("event").eventType("event_type").eventType("type")
            .orderId("data.id").orderId("order.id")
            .storeId("merchant.id").storeId("merchant").storeId("data.merchant.id").storeId("store_id")
            .appStoreId("merchant.id").appStoreId("merchant").appStoreId("data.merchant.id")
            .appStoreId("data.store.id").appStoreId("data.id")
            .productId("data.id")
            .total("data.total.amount").total("data.amounts.total.amount").total("data.amounts.total")
            .total("data.total")
            .currency("data.total.currency").currency("data.currency").currency("data.currency_code")
            .currency("data.amounts.total.currency")
            .referrer("data.referrer").referrer("data.source").referrer("data.referer_code")
            .paymentStatus("data.payment.status").paymentStatus("data.payment_status")
            .orderStatus("data.status.code").orderStatus("data.status.slug").orderStatus("data.status")
            .createdAt("data.created_at").createdAt("data.date.created")
            .updatedAt("data.updated_at").updatedAt("data.date.updated")
            .build();

    public SallaWebhookNormalizer(WebhookProperties props) {
        super(props);
    }

    @Override
    public Platform platform() {
        return Platform.SALLA;
    }

    @Override
    protected FieldPaths paths() {
        return PATHS;
    }
}
