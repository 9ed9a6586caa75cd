package com.github.raff.webhook.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import reactor.core.publisher.Mono;

/**
 * Catalog and store synchronisation triggered by lifecycle webhooks. The pull-based
 * platform clients live outside this service; an implementation bridges to them.
 */
public interface PlatformSyncGateway {

    Mono<Void> syncProduct(Platform platform, Merchant merchant, String productId);

    Mono<Void> deactivateProduct(Platform platform, Merchant merchant, String productId);

    Mono<Void> syncStoreInfo(Platform platform, Merchant merchant);

    Mono<Void> markUninstalled(Platform platform, Merchant merchant);

    /** OAuth grant pushed by the platform (e.g. Salla's app.store.authorize). */
    Mono<Void> acceptAuthorization(Platform platform, String storeId, JsonNode data);
}
