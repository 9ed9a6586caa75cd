package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.WebhookEvent;
import com.github.raff.webhook.domain.model.WebhookProcessingStatus;
import io.r2dbc.postgresql.codec.Json;
import java.time.Instant;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import static com.github.raff.webhook.domain.store.SqlTimes.utc;

/**
 * Postgres/R2DBC ledger. Deduplication relies on the unique index on idempotency_key.
 */
@Repository
@RequiredArgsConstructor
public class WebhookEventStoreImpl implements WebhookEventStore {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final DatabaseClient db;

    @Override
    public Mono<Boolean> insertIfAbsent(WebhookEvent e) {
        return db.sql("""
                INSERT INTO webhook_events
                  (platform, store_id, event_type, idempotency_key, delivery_header_id, payload,
                   processing_status, attempts, created_at, updated_at)
                VALUES
                  (:platform, :store_id, :event_type, :key, :delivery_id, :payload,
                   :status, 1, :now, :now)
                ON CONFLICT (idempotency_key) DO NOTHING
                """)
                .bind("platform", e.getPlatform().name())
                .bind("store_id", Parameter.fromOrEmpty(e.getStoreId(), String.class))
                .bind("event_type", e.getEventType())
                .bind("key", e.getIdempotencyKey())
                .bind("delivery_id", Parameter.fromOrEmpty(e.getDeliveryHeaderId(), String.class))
                .bind("payload", Parameter.fromOrEmpty(e.getPayload() == null ? null : Json.of(e.getPayload()), Json.class))
                .bind("status", WebhookProcessingStatus.RECEIVED.name())
                .bind("now", utc(e.getCreatedAt()))
                .fetch().rowsUpdated()
                .map(rows -> rows != null && rows > 0);
    }

    @Override
    public Mono<Boolean> reclaim(String idempotencyKey, Instant staleBefore, Instant now) {
        return db.sql("""
                UPDATE webhook_events
                   SET processing_status = 'RECEIVED', error_message = NULL,
                       attempts = attempts + 1, updated_at = :now
                 WHERE idempotency_key = :key
                   AND (processing_status = 'FAILED'
                        OR (processing_status = 'RECEIVED' AND updated_at < :stale))
                """)
                .bind("key", idempotencyKey)
                .bind("stale", utc(staleBefore))
                .bind("now", utc(now))
                .fetch().rowsUpdated()
                .map(rows -> rows != null && rows > 0);
    }

    @Override
    public Mono<Void> markOutcome(String idempotencyKey, WebhookProcessingStatus status, String errorMessage, Instant now) {
        return db.sql("""
                UPDATE webhook_events
                   SET processing_status = :status, error_message = :error,
                       processed_at = COALESCE(:processed_at, processed_at),
                       updated_at = :now
                 WHERE idempotency_key = :key
                """)
                .bind("status", status.name())
                .bind("error", Parameter.fromOrEmpty(truncate(errorMessage), String.class))
                .bind("processed_at", Parameter.fromOrEmpty(
                        status == WebhookProcessingStatus.PROCESSED ? utc(now) : null, OffsetDateTime.class))
                .bind("now", utc(now))
                .bind("key", idempotencyKey)
                .fetch().rowsUpdated()
                .then();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) return message;
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
