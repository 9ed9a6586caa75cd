package com.github.raff.webhook.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/** Default gateway when no platform client is wired: records the trigger and does nothing. */
@Slf4j
public class LoggingPlatformSyncGateway implements PlatformSyncGateway {

    @Override
    public Mono<Void> syncProduct(Platform platform, Merchant merchant, String productId) {
        log.info("[{}] product sync requested: merchant={} product={}", platform.path(), merchant.getId(), productId);
        return Mono.empty();
    }

    @Override
    public Mono<Void> deactivateProduct(Platform platform, Merchant merchant, String productId) {
        log.info("[{}] product deactivation requested: merchant={} product={}", platform.path(), merchant.getId(), productId);
        return Mono.empty();
    }

    @Override
    public Mono<Void> syncStoreInfo(Platform platform, Merchant merchant) {
        log.info("[{}] store info sync requested: merchant={}", platform.path(), merchant.getId());
        return Mono.empty();
    }

    @Override
    public Mono<Void> markUninstalled(Platform platform, Merchant merchant) {
        log.info("[{}] app uninstalled: merchant={}", platform.path(), merchant.getId());
        return Mono.empty();
    }

    @Override
    public Mono<Void> acceptAuthorization(Platform platform, String storeId, JsonNode data) {
        log.info("[{}] authorization grant received for store {}", platform.path(), storeId);
        return Mono.empty();
    }
}
