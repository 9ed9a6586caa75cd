package com.github.raff.webhook.merchant;

import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import reactor.core.publisher.Mono;

/** Resolves the merchant that owns an external store. */
public interface MerchantDirectory {

    /** Empty when no merchant is connected to that store. */
    Mono<Merchant> findByExternalStoreId(Platform platform, String storeId);
}
