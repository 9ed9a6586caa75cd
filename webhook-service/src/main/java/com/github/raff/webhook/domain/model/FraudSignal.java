package com.github.raff.webhook.domain.model;

import java.time.Instant;
import lombok.*;
import lombok.experimental.FieldNameConstants;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/** Append-only fraud flag; unique per (commission_id, signal_type). */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldNameConstants
@Table("fraud_signals")
public class FraudSignal {

    @Id
    private Long id;

    @Column("click_tracking_id")
    private Long clickTrackingId;

    @Column("commission_id")
    private Long commissionId;

    @Column("merchant_id")
    private String merchantId;

    @Column("order_id")
    private String orderId;

    @Column("signal_type")
    private FraudSignalType signalType;

    private FraudSeverity severity;

    private int score;

    private String reason;

    /** JSON object. */
    private String metadata;

    @Column("created_at")
    private Instant createdAt;
}
