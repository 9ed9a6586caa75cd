package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.FraudSignal;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import static com.github.raff.webhook.domain.store.SqlTimes.utc;

@Repository
@RequiredArgsConstructor
public class FraudSignalStoreImpl implements FraudSignalStore {

    private final DatabaseClient db;

    @Override
    public Mono<Boolean> insertIfAbsent(FraudSignal s) {
        return db.sql("""
                INSERT INTO fraud_signals
                  (click_tracking_id, commission_id, merchant_id, order_id, signal_type,
                   severity, score, reason, metadata, created_at)
                VALUES
                  (:click, :commission, :m, :o, :type, :severity, :score, :reason, :metadata, :now)
                ON CONFLICT (commission_id, signal_type) DO NOTHING
                """)
                .bind("click", s.getClickTrackingId())
                .bind("commission", s.getCommissionId())
                .bind("m", s.getMerchantId())
                .bind("o", s.getOrderId())
                .bind("type", s.getSignalType().name())
                .bind("severity", s.getSeverity().name())
                .bind("score", s.getScore())
                .bind("reason", s.getReason())
                .bind("metadata", Parameter.fromOrEmpty(s.getMetadata() == null ? null : Json.of(s.getMetadata()), Json.class))
                .bind("now", utc(s.getCreatedAt()))
                .fetch().rowsUpdated()
                .map(rows -> rows != null && rows > 0);
    }
}
