package com.github.raff.webhook.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import lombok.*;
import lombok.experimental.FieldNameConstants;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/** Commission owed for one attributed order; unique per (merchant_id, order_id). */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldNameConstants
@Table("commissions")
public class Commission {

    @Id
    private Long id;

    @Column("click_tracking_id")
    private Long clickTrackingId;

    @Column("merchant_id")
    private String merchantId;

    @Column("order_id")
    private String orderId;

    @Column("order_total")
    private BigDecimal orderTotal;

    @Column("order_currency")
    private String orderCurrency;

    @Column("commission_rate")
    private BigDecimal commissionRate;

    @Column("commission_amount")
    private BigDecimal commissionAmount;

    private CommissionStatus status;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    /** True when status and every monetary field match {@code other}. */
    public boolean sameStateAs(Commission other) {
        return other != null
                && status == other.status
                && sameAmount(orderTotal, other.orderTotal)
                && sameAmount(commissionRate, other.commissionRate)
                && sameAmount(commissionAmount, other.commissionAmount)
                && Objects.equals(orderCurrency, other.orderCurrency);
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }
}
