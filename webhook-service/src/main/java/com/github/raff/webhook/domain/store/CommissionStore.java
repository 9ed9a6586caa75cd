package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.Commission;
import java.time.Instant;
import reactor.core.publisher.Mono;

/**
 * Reactive persistence for 'commissions'. Callers run these inside one transaction.
 */
public interface CommissionStore {

    /** Read and row-lock the commission for an order; empty when none exists. */
    Mono<Commission> findForUpdate(String merchantId, String orderId);

    /**
     * Insert unless (merchant_id, order_id) already exists.
     *
     * @return the inserted row with its id, or empty when another writer got there first
     */
    Mono<Commission> insertIfAbsent(Commission commission);

    /** Overwrite status and monetary fields of an existing row. */
    Mono<Commission> update(Commission commission);

    /**
     * Commissions attributed to a click with created_at at or after {@code since},
     * not counting the (merchant, order) commission itself.
     */
    Mono<Long> countOthersCreatedSince(Long clickTrackingId, String merchantId, String orderId, Instant since);
}
