package com.github.raff.webhook.normalize;

import java.util.Locale;
import java.util.Map;
import static java.util.Map.entry;

/**
 * Event kinds this service reacts to. Known names come from a literal table; any other
 * {@code order.*} name is still an order event. Everything else is {@link #UNHANDLED}
 * and acknowledged without side effects.
 */
public enum WebhookEventKind {
    ORDER,
    PRODUCT_UPSERT,
    PRODUCT_DELETE,
    APP_INSTALLED,
    APP_UNINSTALLED,
    AUTHORIZATION_GRANTED,
    UNHANDLED;

    private static final Map<String, WebhookEventKind> VOCABULARY = Map.ofEntries(
            entry("order.created", ORDER),
            entry("order.create", ORDER),
            entry("order.updated", ORDER),
            entry("order.update", ORDER),
            entry("order.paid", ORDER),
            entry("order.status.updated", ORDER),
            entry("order.status.update", ORDER),
            entry("order.payment.updated", ORDER),
            entry("order.payment_status.update", ORDER),
            entry("order.cancelled", ORDER),
            entry("order.canceled", ORDER),
            entry("order.refunded", ORDER),
            entry("order.delivered", ORDER),
            entry("product.created", PRODUCT_UPSERT),
            entry("product.create", PRODUCT_UPSERT),
            entry("product.updated", PRODUCT_UPSERT),
            entry("product.update", PRODUCT_UPSERT),
            entry("product.deleted", PRODUCT_DELETE),
            entry("product.delete", PRODUCT_DELETE),
            entry("product.removed", PRODUCT_DELETE),
            entry("product.remove", PRODUCT_DELETE),
            entry("app.installed", APP_INSTALLED),
            entry("app.uninstalled", APP_UNINSTALLED),
            entry("app.store.authorize", AUTHORIZATION_GRANTED)
    );

    private static final String ORDER_PREFIX = "order.";

    public static WebhookEventKind classify(String eventType) {
        if (eventType == null) return UNHANDLED;
        String name = eventType.trim().toLowerCase(Locale.ROOT);
        WebhookEventKind known = VOCABULARY.get(name);
        if (known != null) return known;
        // order.total.price.updated, order.products.updated, order.deleted, ...
        if (name.startsWith(ORDER_PREFIX) && name.length() > ORDER_PREFIX.length()) return ORDER;
        return UNHANDLED;
    }
}
