package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.Merchant;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

public interface MerchantRepository extends ReactiveCrudRepository<Merchant, String> {

    Mono<Merchant> findBySallaStoreId(String sallaStoreId);

    Mono<Merchant> findByZidStoreId(String zidStoreId);
}
