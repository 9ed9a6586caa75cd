package com.github.raff.webhook.audit;

import io.r2dbc.postgresql.codec.Json;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/** Upserts 'webhook_log' by idempotency key; the latest attempt's outcome wins. */
@Repository
@RequiredArgsConstructor
public class WebhookLogAuditSink implements WebhookAuditSink {

    private final DatabaseClient db;

    @Override
    public Mono<Void> record(ProcessedWebhookRecord r) {
        return db.sql("""
                INSERT INTO webhook_log
                  (idempotency_key, event, order_id, order_key, platform, store_id, merchant_id,
                   processed, error, payload, processed_at)
                VALUES
                  (:key, :event, :order_id, :order_key, :platform, :store_id, :merchant_id,
                   :processed, :error, :payload, :at)
                ON CONFLICT (idempotency_key) DO UPDATE
                   SET processed = EXCLUDED.processed,
                       error = EXCLUDED.error,
                       processed_at = EXCLUDED.processed_at
                """)
                .bind("key", r.getIdempotencyKey())
                .bind("event", r.getEvent())
                .bind("order_id", r.getOrderId())
                .bind("order_key", r.getOrderKey())
                .bind("platform", r.getPlatform().name())
                .bind("store_id", r.getStoreId())
                .bind("merchant_id", r.getMerchantId())
                .bind("processed", r.isProcessed())
                .bind("error", Parameter.fromOrEmpty(r.getError(), String.class))
                .bind("payload", Parameter.fromOrEmpty(r.getPayload() == null ? null : Json.of(r.getPayload()), Json.class))
                .bind("at", OffsetDateTime.ofInstant(r.getProcessedAt(), ZoneOffset.UTC))
                .fetch().rowsUpdated()
                .then();
    }
}
