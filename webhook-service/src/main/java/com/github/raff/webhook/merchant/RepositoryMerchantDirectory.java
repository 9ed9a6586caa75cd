package com.github.raff.webhook.merchant;

import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.domain.store.MerchantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class RepositoryMerchantDirectory implements MerchantDirectory {

    private final MerchantRepository merchants;

    @Override
    public Mono<Merchant> findByExternalStoreId(Platform platform, String storeId) {
        if (storeId == null || storeId.isBlank()) return Mono.empty();
        return switch (platform) {
            case SALLA -> merchants.findBySallaStoreId(storeId);
            case ZID -> merchants.findByZidStoreId(storeId);
        };
    }
}
