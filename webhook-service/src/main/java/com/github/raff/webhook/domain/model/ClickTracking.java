package com.github.raff.webhook.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.*;
import lombok.experimental.FieldNameConstants;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One referral click. Created by the click tracker; this service only reads it
 * and maintains the conversion aggregates.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldNameConstants
@Table("click_tracking")
public class ClickTracking {

    @Id
    private Long id;

    @Column("tracking_id")
    private String trackingId;

    @Column("merchant_id")
    private String merchantId;

    /** Rate snapshot taken at click time; null falls back to the merchant default. */
    @Column("commission_rate")
    private BigDecimal commissionRate;

    @Column("clicked_at")
    private Instant clickedAt;

    @Column("expires_at")
    private Instant expiresAt;

    private boolean converted;

    @Column("converted_count")
    private int convertedCount;

    @Column("conversion_value")
    private BigDecimal conversionValue;

    @Column("commission_value")
    private BigDecimal commissionValue;

    @Column("converted_at")
    private Instant convertedAt;

    @Column("last_converted_at")
    private Instant lastConvertedAt;

    public boolean isActiveAt(Instant now) {
        return expiresAt != null && !expiresAt.isBefore(now);
    }
}
