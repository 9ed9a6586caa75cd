package com.github.raff.webhook.service;

import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.audit.ProcessedWebhookRecord;
import com.github.raff.webhook.audit.WebhookAuditSink;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.error.MerchantNotFoundException;
import com.github.raff.webhook.ledger.IdempotencyLedger;
import com.github.raff.webhook.ledger.LedgerEntry;
import com.github.raff.webhook.merchant.MerchantDirectory;
import com.github.raff.webhook.normalize.NormalizedOrderEvent;
import com.github.raff.webhook.normalize.NormalizerRegistry;
import com.github.raff.webhook.normalize.PayloadRedactor;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Order events: normalize, resolve the merchant, then attribute once per idempotency
 * key. Each handled event is written to the audit log without waiting for it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderWebhookHandler {

    private final NormalizerRegistry normalizers;
    private final MerchantDirectory merchants;
    private final IdempotencyLedger ledger;
    private final OrderAttributionService attribution;
    private final PayloadRedactor redactor;
    private final WebhookAuditSink audit;
    private final Clock clock;

    public Mono<WebhookResponse> handle(WebhookDelivery delivery) {
        NormalizedOrderEvent event = normalizers.forPlatform(delivery.platform())
                .normalizeOrder(delivery.eventType(), delivery.payload());

        return merchants.findByExternalStoreId(delivery.platform(), event.getStoreId())
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("{} order {} for unknown store {}", delivery.platform().path(),
                            event.getOrderId(), event.getStoreId());
                    return new MerchantNotFoundException(delivery.platform(), event.getStoreId());
                }))
                .flatMap(merchant -> attributeOnce(delivery, event, merchant));
    }

    private Mono<WebhookResponse> attributeOnce(WebhookDelivery delivery, NormalizedOrderEvent event, Merchant merchant) {
        String snapshot = redactor.redact(delivery.payload());
        LedgerEntry entry = LedgerEntry.builder()
                .platform(delivery.platform())
                .storeId(event.getStoreId())
                .eventType(event.getEventType())
                .idempotencyKey(event.getIdempotencyKey())
                .deliveryHeaderId(delivery.deliveryId())
                .payload(snapshot)
                .build();

        return ledger.runOnce(entry,
                        () -> attribution.attribute(event, merchant).map(OrderWebhookHandler::toResponse),
                        WebhookResponse::duplicateDelivery)
                .doOnSuccess(response -> audit(event, merchant, snapshot, null))
                .doOnError(err -> audit(event, merchant, snapshot, err));
    }

    private static WebhookResponse toResponse(OrderOutcome outcome) {
        return WebhookResponse.builder()
                .success(true)
                .message(outcome.message())
                .status(outcome.status() == null ? null : outcome.status().name())
                .commission(outcome.commission())
                .build();
    }

    private void audit(NormalizedOrderEvent event, Merchant merchant, String snapshot, Throwable error) {
        ProcessedWebhookRecord record = ProcessedWebhookRecord.builder()
                .idempotencyKey(event.getIdempotencyKey())
                .event(event.getEventType())
                .orderId(event.getOrderId())
                .orderKey(event.getOrderKey())
                .platform(event.getPlatform())
                .storeId(event.getStoreId())
                .merchantId(merchant.getId())
                .processed(error == null)
                .error(error == null ? null : String.valueOf(error.getMessage()))
                .payload(snapshot)
                .processedAt(clock.instant())
                .build();

        Mono.defer(() -> audit.record(record))
                .onErrorResume(e -> {
                    log.warn("Audit log write failed for order {} key {}", event.getOrderId(),
                            event.getIdempotencyKey(), e);
                    return Mono.empty();
                })
                .subscribe();
    }
}
