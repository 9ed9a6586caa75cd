package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.WebhookEvent;
import com.github.raff.webhook.domain.model.WebhookProcessingStatus;
import java.time.Instant;
import reactor.core.publisher.Mono;

/**
 * Reactive persistence for the webhook ledger ('webhook_events').
 */
public interface WebhookEventStore {

    /**
     * Insert a RECEIVED row unless the idempotency key already exists.
     *
     * @return true when this call created the row
     */
    Mono<Boolean> insertIfAbsent(WebhookEvent event);

    /**
     * Re-claim an existing row for another attempt: allowed when it is FAILED, or
     * RECEIVED and last touched before {@code staleBefore}. Bumps attempts.
     *
     * @return true when this call took the row over
     */
    Mono<Boolean> reclaim(String idempotencyKey, Instant staleBefore, Instant now);

    /** Record the final status of the current attempt. */
    Mono<Void> markOutcome(String idempotencyKey, WebhookProcessingStatus status, String errorMessage, Instant now);
}
