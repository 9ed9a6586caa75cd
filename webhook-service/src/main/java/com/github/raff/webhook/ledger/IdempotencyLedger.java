package com.github.raff.webhook.ledger;

import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.WebhookEvent;
import com.github.raff.webhook.domain.model.WebhookProcessingStatus;
import com.github.raff.webhook.domain.store.WebhookEventStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reactive idempotency ledger backed by the 'webhook_events' table.
 *
 * Usage pattern in a handler:
 * <pre>
 * return ledger.runOnce(
 *     entry,                         // key + redacted snapshot
 *     () -> attribution.attribute(), // Mono<T>, runs only for an ACCEPTED registration
 *     () -> duplicateResult          // returned as-is for a DUPLICATE
 * );
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyLedger {

    private final WebhookEventStore store;
    private final WebhookProperties props;
    private final Clock clock;

    /**
     * Register a delivery by its idempotency key. The insert wins on first delivery;
     * on conflict the row is re-claimed only when FAILED or stuck in RECEIVED past
     * {@code webhook.ledger.reclaim-after}.
     */
    public Mono<Registration> register(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        final String key = requireNonBlank(entry.getIdempotencyKey(), "idempotencyKey");
        final Instant now = clock.instant();

        WebhookEvent row = WebhookEvent.builder()
                .platform(entry.getPlatform())
                .storeId(entry.getStoreId())
                .eventType(entry.getEventType())
                .idempotencyKey(key)
                .deliveryHeaderId(entry.getDeliveryHeaderId())
                .payload(entry.getPayload())
                .processingStatus(WebhookProcessingStatus.RECEIVED)
                .attempts(1)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return store.insertIfAbsent(row)
                .flatMap(inserted -> {
                    if (inserted) return Mono.just(Registration.ACCEPTED);
                    Instant staleBefore = now.minus(props.getLedger().getReclaimAfter());
                    return store.reclaim(key, staleBefore, now)
                            .map(reclaimed -> {
                                if (reclaimed) {
                                    log.info("Re-claimed ledger entry for retry: event={} key={}",
                                            entry.getEventType(), shortKey(key));
                                    return Registration.ACCEPTED;
                                }
                                log.info("Duplicate delivery ignored: event={} key={} deliveryId={}",
                                        entry.getEventType(), shortKey(key), entry.getDeliveryHeaderId());
                                return Registration.DUPLICATE;
                            });
                });
    }

    /**
     * Run {@code work} once per idempotency key. The ledger row is marked PROCESSED or
     * FAILED afterwards; that write is best-effort and never changes the result.
     * {@code work} must not complete empty.
     */
    public <T> Mono<T> runOnce(LedgerEntry entry, Supplier<Mono<T>> work, Supplier<T> onDuplicate) {
        return register(entry).flatMap(registration -> {
            if (registration == Registration.DUPLICATE) {
                return Mono.fromSupplier(onDuplicate);
            }
            String key = entry.getIdempotencyKey();
            return Mono.defer(work)
                    .flatMap(result -> markOutcome(key, WebhookProcessingStatus.PROCESSED, null).thenReturn(result))
                    .onErrorResume(err -> markOutcome(key, WebhookProcessingStatus.FAILED, describe(err))
                            .then(Mono.error(err)));
        });
    }

    /* ======================================================================
       Helpers
       ====================================================================== */

    private Mono<Void> markOutcome(String key, WebhookProcessingStatus status, String error) {
        return store.markOutcome(key, status, error, clock.instant())
                .onErrorResume(e -> {
                    log.warn("Could not mark ledger entry {} as {}", shortKey(key), status, e);
                    return Mono.empty();
                });
    }

    private static String describe(Throwable err) {
        String message = err.getMessage();
        return message == null ? err.getClass().getSimpleName() : message;
    }

    private static String shortKey(String key) {
        return key.length() <= 12 ? key : key.substring(0, 12);
    }

    private static String requireNonBlank(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
        return v;
    }
}
