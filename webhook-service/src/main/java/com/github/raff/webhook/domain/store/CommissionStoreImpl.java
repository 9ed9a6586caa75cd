package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.CommissionStatus;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import static com.github.raff.webhook.domain.store.SqlTimes.instant;
import static com.github.raff.webhook.domain.store.SqlTimes.utc;

/**
 * Postgres/R2DBC commission store. The unique (merchant_id, order_id) index is what
 * concurrent deliveries for one order race on.
 */
@Repository
@RequiredArgsConstructor
public class CommissionStoreImpl implements CommissionStore {

    private static final String COLUMNS = """
            id, click_tracking_id, merchant_id, order_id, order_total, order_currency,
            commission_rate, commission_amount, status, created_at, updated_at
            """;

    private final DatabaseClient db;

    @Override
    public Mono<Commission> findForUpdate(String merchantId, String orderId) {
        return db.sql("SELECT " + COLUMNS + """
                  FROM commissions
                 WHERE merchant_id = :m AND order_id = :o
                 FOR UPDATE
                """)
                .bind("m", merchantId)
                .bind("o", orderId)
                .map(CommissionStoreImpl::map)
                .one();
    }

    @Override
    public Mono<Commission> insertIfAbsent(Commission c) {
        return db.sql("""
                INSERT INTO commissions
                  (click_tracking_id, merchant_id, order_id, order_total, order_currency,
                   commission_rate, commission_amount, status, created_at, updated_at)
                VALUES
                  (:click, :m, :o, :total, :currency, :rate, :amount, :status, :now, :now)
                ON CONFLICT (merchant_id, order_id) DO NOTHING
                RETURNING\s""" + COLUMNS)
                .bind("click", c.getClickTrackingId())
                .bind("m", c.getMerchantId())
                .bind("o", c.getOrderId())
                .bind("total", c.getOrderTotal())
                .bind("currency", c.getOrderCurrency())
                .bind("rate", c.getCommissionRate())
                .bind("amount", c.getCommissionAmount())
                .bind("status", c.getStatus().name())
                .bind("now", utc(c.getCreatedAt()))
                .map(CommissionStoreImpl::map)
                .one();
    }

    @Override
    public Mono<Commission> update(Commission c) {
        return db.sql("""
                UPDATE commissions
                   SET order_total = :total, order_currency = :currency, commission_rate = :rate,
                       commission_amount = :amount, status = :status, updated_at = :now
                 WHERE id = :id
                RETURNING\s""" + COLUMNS)
                .bind("total", c.getOrderTotal())
                .bind("currency", c.getOrderCurrency())
                .bind("rate", c.getCommissionRate())
                .bind("amount", c.getCommissionAmount())
                .bind("status", c.getStatus().name())
                .bind("now", utc(c.getUpdatedAt()))
                .bind("id", c.getId())
                .map(CommissionStoreImpl::map)
                .one();
    }

    @Override
    public Mono<Long> countOthersCreatedSince(Long clickTrackingId, String merchantId, String orderId, Instant since) {
        return db.sql("""
                SELECT COUNT(*) AS n
                  FROM commissions
                 WHERE click_tracking_id = :click AND created_at >= :since
                   AND NOT (merchant_id = :merchant AND order_id = :order)
                """)
                .bind("click", clickTrackingId)
                .bind("merchant", merchantId)
                .bind("order", orderId)
                .bind("since", utc(since))
                .map((row, meta) -> row.get("n", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private static Commission map(Row row, RowMetadata meta) {
        return Commission.builder()
                .id(row.get("id", Long.class))
                .clickTrackingId(row.get("click_tracking_id", Long.class))
                .merchantId(row.get("merchant_id", String.class))
                .orderId(row.get("order_id", String.class))
                .orderTotal(row.get("order_total", BigDecimal.class))
                .orderCurrency(row.get("order_currency", String.class))
                .commissionRate(row.get("commission_rate", BigDecimal.class))
                .commissionAmount(row.get("commission_amount", BigDecimal.class))
                .status(CommissionStatus.valueOf(row.get("status", String.class)))
                .createdAt(instant(row.get("created_at", OffsetDateTime.class)))
                .updatedAt(instant(row.get("updated_at", OffsetDateTime.class)))
                .build();
    }
}
