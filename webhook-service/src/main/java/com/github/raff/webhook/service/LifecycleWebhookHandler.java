package com.github.raff.webhook.service;

import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.error.MerchantNotFoundException;
import com.github.raff.webhook.error.PayloadValidationException;
import com.github.raff.webhook.ledger.IdempotencyLedger;
import com.github.raff.webhook.ledger.LedgerEntry;
import com.github.raff.webhook.merchant.MerchantDirectory;
import com.github.raff.webhook.normalize.IdempotencyKeys;
import com.github.raff.webhook.normalize.NormalizerRegistry;
import com.github.raff.webhook.normalize.PayloadRedactor;
import com.github.raff.webhook.normalize.PlatformWebhookNormalizer;
import com.github.raff.webhook.normalize.WebhookEventKind;
import com.github.raff.webhook.sync.PlatformSyncGateway;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Product and app lifecycle events. Each one is routed to the {@link PlatformSyncGateway};
 * gateway failures surface as 5xx so the platform retries, and never touch attribution.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleWebhookHandler {

    private final NormalizerRegistry normalizers;
    private final MerchantDirectory merchants;
    private final IdempotencyLedger ledger;
    private final PlatformSyncGateway gateway;
    private final PayloadRedactor redactor;
    private final WebhookProperties props;
    private final Clock clock;

    public Mono<WebhookResponse> handle(WebhookDelivery delivery) {
        return switch (delivery.kind()) {
            case PRODUCT_UPSERT, PRODUCT_DELETE -> product(delivery);
            case APP_INSTALLED -> appInstalled(delivery);
            case APP_UNINSTALLED -> appUninstalled(delivery);
            case AUTHORIZATION_GRANTED -> authorization(delivery);
            case ORDER, UNHANDLED -> Mono.error(new IllegalArgumentException(
                    "Not a lifecycle event: " + delivery.eventType()));
        };
    }

  /* ===========================
     Products
     =========================== */

    private Mono<WebhookResponse> product(WebhookDelivery delivery) {
        PlatformWebhookNormalizer normalizer = normalizers.forPlatform(delivery.platform());
        String productId = normalizer.productId(delivery.payload());
        String storeId = normalizer.storeId(delivery.payload());
        if (productId == null || storeId == null) {
            log.warn("{} {} missing product id or store id", delivery.platform().path(), delivery.eventType());
            return Mono.error(new PayloadValidationException("Missing data"));
        }

        Platform platform = delivery.platform();
        return requireMerchant(platform, storeId).flatMap(merchant -> once(delivery, storeId, () -> {
            if (delivery.kind() == WebhookEventKind.PRODUCT_DELETE) {
                return gateway.deactivateProduct(platform, merchant, productId)
                        .thenReturn(WebhookResponse.ok("Product deactivated"));
            }
            if (!merchant.hasAccessToken(platform)) {
                log.info("{} product sync skipped for merchant {}: no access token", platform.path(), merchant.getId());
                return Mono.just(WebhookResponse.ok("Product sync skipped"));
            }
            return gateway.syncProduct(platform, merchant, productId)
                    .thenReturn(WebhookResponse.ok("Product synced"));
        }));
    }

  /* ===========================
     App lifecycle
     =========================== */

    private Mono<WebhookResponse> appInstalled(WebhookDelivery delivery) {
        Platform platform = delivery.platform();
        String storeId = normalizers.forPlatform(platform).appStoreId(delivery.payload());
        if (storeId == null) {
            log.warn("{} app.installed without store id", platform.path());
            return Mono.just(WebhookResponse.ok("App installed"));
        }

        return merchants.findByExternalStoreId(platform, storeId)
                .flatMap(merchant -> {
                    if (recentlyUpdated(merchant)) {
                        log.debug("{} app.installed for merchant {} skipped: synced recently", platform.path(), merchant.getId());
                        return Mono.just(WebhookResponse.ok("Store recently synced; skipped"));
                    }
                    if (!merchant.hasAccessToken(platform)) {
                        log.warn("{} app.installed: missing access token for store {}", platform.path(), storeId);
                        return Mono.just(WebhookResponse.ok("App installed"));
                    }
                    return once(delivery, storeId, () -> gateway.syncStoreInfo(platform, merchant)
                            .thenReturn(WebhookResponse.ok("Store info synced")));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    // merchant row is created by the OAuth flow, which may not have finished yet
                    log.warn("{} app.installed: merchant not found for store {}", platform.path(), storeId);
                    return WebhookResponse.ok("App installed");
                }));
    }

    private Mono<WebhookResponse> appUninstalled(WebhookDelivery delivery) {
        Platform platform = delivery.platform();
        String storeId = normalizers.forPlatform(platform).appStoreId(delivery.payload());
        if (storeId == null) {
            return Mono.error(new PayloadValidationException("Missing store id"));
        }
        return merchants.findByExternalStoreId(platform, storeId)
                .flatMap(merchant -> once(delivery, storeId, () -> gateway.markUninstalled(platform, merchant)
                        .thenReturn(WebhookResponse.ok("App uninstalled"))))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("{} app.uninstalled: merchant not found for store {}", platform.path(), storeId);
                    return WebhookResponse.ok("App uninstalled");
                }));
    }

    private Mono<WebhookResponse> authorization(WebhookDelivery delivery) {
        Platform platform = delivery.platform();
        String storeId = normalizers.forPlatform(platform).appStoreId(delivery.payload());
        if (storeId == null) {
            return Mono.error(new PayloadValidationException("Missing store id"));
        }
        return once(delivery, storeId, () -> gateway.acceptAuthorization(platform, storeId, delivery.payload().get("data"))
                .thenReturn(WebhookResponse.ok("Authorization received")));
    }

  /* ===========================
     Helpers
     =========================== */

    private Mono<Merchant> requireMerchant(Platform platform, String storeId) {
        return merchants.findByExternalStoreId(platform, storeId)
                .switchIfEmpty(Mono.error(() -> {
                    log.warn("{} merchant not found for store {}", platform.path(), storeId);
                    return new MerchantNotFoundException(platform, storeId);
                }));
    }

    private Mono<WebhookResponse> once(WebhookDelivery delivery, String storeId, Supplier<Mono<WebhookResponse>> work) {
        LedgerEntry entry = LedgerEntry.builder()
                .platform(delivery.platform())
                .storeId(storeId)
                .eventType(delivery.eventType())
                .idempotencyKey(IdempotencyKeys.lifecycleEvent(delivery.platform(), storeId,
                        delivery.eventType(), delivery.body()))
                .deliveryHeaderId(delivery.deliveryId())
                .payload(redactor.redact(delivery.payload()))
                .build();
        return ledger.runOnce(entry, work, WebhookResponse::duplicateDelivery);
    }

    private boolean recentlyUpdated(Merchant merchant) {
        Instant updatedAt = merchant.getUpdatedAt();
        if (updatedAt == null) return false;
        Duration cooldown = props.getAppInstall().getResyncCooldown();
        return Duration.between(updatedAt, clock.instant()).compareTo(cooldown) < 0;
    }
}
