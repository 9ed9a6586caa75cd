package com.github.raff.webhook.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.raff.common.json.JsonPaths;
import com.github.raff.common.money.Money;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.error.PayloadValidationException;
import java.math.BigDecimal;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

import static com.github.raff.webhook.normalize.FieldPaths.array;

/**
 * Shared normalization driven by a per-platform {@link FieldPaths} table.
 * Missing currency falls back to the configured default, an unreadable total to zero,
 * both with a warning.
 */
@Slf4j
public abstract class TableDrivenNormalizer implements PlatformWebhookNormalizer {

    private final WebhookProperties props;

    protected TableDrivenNormalizer(WebhookProperties props) {
        this.props = props;
    }

    protected abstract FieldPaths paths();

    @Override
    public String eventType(JsonNode payload) {
        String raw = JsonPaths.firstText(payload, array(paths().getEventTypes()));
        return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String storeId(JsonNode payload) {
        return JsonPaths.firstText(payload, array(paths().getStoreIds()));
    }

    @Override
    public String appStoreId(JsonNode payload) {
        return JsonPaths.firstText(payload, array(paths().getAppStoreIds()));
    }

    @Override
    public String productId(JsonNode payload) {
        return JsonPaths.firstText(payload, array(paths().getProductIds()));
    }

    @Override
    public NormalizedOrderEvent normalizeOrder(String eventType, JsonNode payload) {
        FieldPaths p = paths();
        String orderId = JsonPaths.firstText(payload, array(p.getOrderIds()));
        String storeId = storeId(payload);
        if (orderId == null || storeId == null) {
            log.warn("Missing required fields in {} webhook: hasOrderId={}, hasStoreId={}",
                    platform().path(), orderId != null, storeId != null);
            throw new PayloadValidationException("Invalid order payload");
        }

        JsonNode totalNode = JsonPaths.firstPresent(payload, array(p.getTotals()));
        BigDecimal total = JsonPaths.decimal(totalNode);
        if (total == null) {
            log.warn("Order total defaulted to 0 for {} store={} order={} (raw={})",
                    platform().path(), storeId, orderId, totalNode);
            total = BigDecimal.ZERO;
        }

        String currency = currency(JsonPaths.firstText(payload, array(p.getCurrencies())), storeId, orderId);
        String paymentStatus = JsonPaths.firstText(payload, array(p.getPaymentStatuses()));
        String orderStatus = JsonPaths.firstText(payload, array(p.getOrderStatuses()));
        String referrer = JsonPaths.firstText(payload, array(p.getReferrers()));

        return NormalizedOrderEvent.builder()
                .platform(platform())
                .eventType(eventType)
                .orderId(orderId)
                .storeId(storeId)
                .orderKey(IdempotencyKeys.orderKey(platform(), storeId, orderId))
                .total(Money.of(currency, total).amount())
                .currency(currency)
                .referrerCode(referrer == null ? null : referrer.trim())
                .paymentStatus(paymentStatus)
                .orderStatus(orderStatus)
                .createdAt(JsonPaths.instant(JsonPaths.firstPresent(payload, array(p.getCreatedAts()))))
                .updatedAt(JsonPaths.instant(JsonPaths.firstPresent(payload, array(p.getUpdatedAts()))))
                .idempotencyKey(IdempotencyKeys.orderEvent(platform(), storeId, eventType, orderId,
                        paymentStatus, orderStatus))
                .build();
    }

    private String currency(String raw, String storeId, String orderId) {
        String fallback = props.getAttribution().getDefaultCurrency();
        if (raw == null) {
            log.warn("Currency missing from {} webhook store={} order={}, defaulting to {}",
                    platform().path(), storeId, orderId, fallback);
            return Money.normalizeCurrency(fallback);
        }
        try {
            return Money.normalizeCurrency(raw);
        } catch (IllegalArgumentException e) {
            throw new PayloadValidationException("Invalid currency: " + raw, e);
        }
    }
}
