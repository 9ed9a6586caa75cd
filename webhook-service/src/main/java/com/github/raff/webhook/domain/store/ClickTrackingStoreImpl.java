package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.ClickTracking;
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

@Repository
@RequiredArgsConstructor
public class ClickTrackingStoreImpl implements ClickTrackingStore {

    private static final String COLUMNS = """
            id, tracking_id, merchant_id, commission_rate, clicked_at, expires_at, converted,
            converted_count, conversion_value, commission_value, converted_at, last_converted_at
            """;

    private final DatabaseClient db;

    @Override
    public Mono<ClickTracking> findById(Long id) {
        return db.sql("SELECT " + COLUMNS + " FROM click_tracking WHERE id = :id")
                .bind("id", id)
                .map(ClickTrackingStoreImpl::map)
                .one();
    }

    @Override
    public Mono<ClickTracking> findActive(String trackingId, String merchantId, Instant now) {
        return db.sql("SELECT " + COLUMNS + """
                  FROM click_tracking
                 WHERE tracking_id = :t AND merchant_id = :m AND expires_at >= :now
                 ORDER BY clicked_at DESC
                 LIMIT 1
                """)
                .bind("t", trackingId)
                .bind("m", merchantId)
                .bind("now", utc(now))
                .map(ClickTrackingStoreImpl::map)
                .one();
    }

    @Override
    public Mono<Void> applyConversionDelta(Long id, int countDelta, BigDecimal valueDelta,
                                           BigDecimal commissionDelta, Instant now) {
        // SET expressions all read the pre-update row
        return db.sql("""
                UPDATE click_tracking
                   SET converted_count   = GREATEST(converted_count + :dc, 0),
                       conversion_value  = GREATEST(conversion_value + :dv, 0),
                       commission_value  = GREATEST(commission_value + :dcm, 0),
                       converted         = GREATEST(converted_count + :dc, 0) > 0,
                       converted_at      = CASE
                                             WHEN GREATEST(converted_count + :dc, 0) = 0 THEN NULL
                                             WHEN :dc > 0 AND converted_at IS NULL THEN :now
                                             ELSE converted_at
                                           END,
                       last_converted_at = CASE WHEN :dc > 0 THEN :now ELSE last_converted_at END
                 WHERE id = :id
                """)
                .bind("dc", countDelta)
                .bind("dv", valueDelta)
                .bind("dcm", commissionDelta)
                .bind("now", utc(now))
                .bind("id", id)
                .fetch().rowsUpdated()
                .then();
    }

    private static ClickTracking map(Row row, RowMetadata meta) {
        Boolean converted = row.get("converted", Boolean.class);
        Integer count = row.get("converted_count", Integer.class);
        return ClickTracking.builder()
                .id(row.get("id", Long.class))
                .trackingId(row.get("tracking_id", String.class))
                .merchantId(row.get("merchant_id", String.class))
                .commissionRate(row.get("commission_rate", BigDecimal.class))
                .clickedAt(instant(row.get("clicked_at", OffsetDateTime.class)))
                .expiresAt(instant(row.get("expires_at", OffsetDateTime.class)))
                .converted(Boolean.TRUE.equals(converted))
                .convertedCount(count == null ? 0 : count)
                .conversionValue(row.get("conversion_value", BigDecimal.class))
                .commissionValue(row.get("commission_value", BigDecimal.class))
                .convertedAt(instant(row.get("converted_at", OffsetDateTime.class)))
                .lastConvertedAt(instant(row.get("last_converted_at", OffsetDateTime.class)))
                .build();
    }
}
