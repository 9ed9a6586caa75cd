package com.github.raff.webhook.normalize;

import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Platform;
import org.springframework.stereotype.Component;

/** Zid payloads: flat fields at the top level, with a nested data/order variant. */
@Component
public class ZidWebhookNormalizer extends TableDrivenNormalizer {

    private static final FieldPaths PATHS = FieldPaths.builder()
            .eventType("event").eventType("event_type").eventType("type")
            .orderId("order_id").orderId("data.id").orderId("data.order_id").orderId("order.id")
            .storeId("store_id").storeId("data.store_id").storeId("store.id").storeId("data.store.id")
            .appStoreId("store_id").appStoreId("data.store_id").appStoreId("store.id").appStoreId("data.store.id")
            .productId("product_id").productId("data.id")
            .total("total").total("order_total").total("data.total").total("data.order_total")
            .total("data.amounts.total").total("order.total")
            .currency("currency").currency("currency_code").currency("data.currency_code").currency("data.currency")
            .referrer("referer_code").referrer("referrer_code").referrer("data.referer_code")
            .referrer("data.referrer_code").referrer("order.referer_code")
            .paymentStatus("payment_status").paymentStatus("data.payment_status").paymentStatus("order.payment_status")
            .orderStatus("status").orderStatus("order_status").orderStatus("data.status")
            .orderStatus("data.order_status.code").orderStatus("order.status")
            .createdAt("created_at").createdAt("issue_date").createdAt("data.created_at").createdAt("data.issue_date")
            .updatedAt("updated_at").updatedAt("data.updated_at")
            .build();

    public ZidWebhookNormalizer(WebhookProperties props) {
        super(props);
    }

    @Override
    public Platform platform() {
        return Platform.ZID;
    }

    @Override
    protected FieldPaths paths() {
        return PATHS;
    }
}
