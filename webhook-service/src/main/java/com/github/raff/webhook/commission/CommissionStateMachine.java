package com.github.raff.webhook.commission;

import com.github.raff.webhook.attribution.Attribution;
import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.CommissionStatus;
import com.github.raff.webhook.domain.store.CommissionStore;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Owns the commission row per (merchant, order). Each event upserts it: the status
 * goes through {@link CommissionTransitionTable}, the monetary terms always take the
 * latest observed values, and an event that changes nothing skips the write.
 *
 * Must run inside the caller's transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommissionStateMachine {

    private final CommissionStore store;
    private final Clock clock;

    /** Status an event asks for: cancellation first, then hold, then payment. */
    public static CommissionStatus observedStatus(boolean cancelled, boolean paymentConfirmed, boolean onHold) {
        if (cancelled) return CommissionStatus.CANCELLED;
        if (onHold) return CommissionStatus.ON_HOLD;
        if (paymentConfirmed) return CommissionStatus.APPROVED;
        return CommissionStatus.PENDING;
    }

    public Mono<CommissionTransition> apply(Attribution attribution, OrderTerms terms, CommissionStatus observed) {
        if (!attribution.isFirstAttribution()) {
            return merge(attribution.existing(), terms, observed);
        }
        Instant now = clock.instant();
        Commission fresh = Commission.builder()
                .clickTrackingId(attribution.click().getId())
                .merchantId(terms.merchantId())
                .orderId(terms.orderId())
                .orderTotal(terms.total().amount())
                .orderCurrency(terms.total().currency())
                .commissionRate(terms.rate())
                .commissionAmount(terms.amount().amount())
                .status(CommissionTransitionTable.next(null, observed))
                .createdAt(now)
                .updatedAt(now)
                .build();

        return store.insertIfAbsent(fresh)
                .map(CommissionTransition::created)
                .switchIfEmpty(Mono.defer(() -> {
                    // lost the race on (merchant_id, order_id): merge into the winner's row
                    log.info("Concurrent insert for merchant={} order={}; merging", terms.merchantId(), terms.orderId());
                    return store.findForUpdate(terms.merchantId(), terms.orderId())
                            .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                                    "Commission vanished after insert conflict: order " + terms.orderId())))
                            .flatMap(existing -> merge(existing, terms, observed));
                }));
    }

    private Mono<CommissionTransition> merge(Commission existing, OrderTerms terms, CommissionStatus observed) {
        CommissionStatus next = CommissionTransitionTable.next(existing.getStatus(), observed);
        Commission candidate = existing.toBuilder()
                .orderTotal(terms.total().amount())
                .orderCurrency(terms.total().currency())
                .commissionRate(terms.rate())
                .commissionAmount(terms.amount().amount())
                .status(next)
                .build();

        if (candidate.sameStateAs(existing)) {
            log.debug("Commission {} unchanged ({}); skipping write", existing.getId(), next);
            return Mono.just(CommissionTransition.unchanged(existing));
        }
        if (next != observed) {
            log.info("Commission {} kept {} (event asked for {})", existing.getId(), next, observed);
        }
        Commission updated = candidate.toBuilder().updatedAt(clock.instant()).build();
        return store.update(updated)
                .map(saved -> CommissionTransition.updated(existing, saved));
    }
}
