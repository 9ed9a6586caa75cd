package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.FraudSignal;
import reactor.core.publisher.Mono;

public interface FraudSignalStore {

    /**
     * Append a signal unless one of the same type is already recorded for the commission.
     *
     * @return true when a row was inserted
     */
    Mono<Boolean> insertIfAbsent(FraudSignal signal);
}
