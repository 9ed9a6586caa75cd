package com.github.raff.webhook.domain.model;

import java.time.Instant;
import lombok.*;
import lombok.experimental.FieldNameConstants;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/** Ledger row for an accepted delivery, deduplicated by idempotency_key. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldNameConstants
@Table("webhook_events")
public class WebhookEvent {

    @Id
    private Long id;

    private Platform platform;

    @Column("store_id")
    private String storeId;

    @Column("event_type")
    private String eventType;

    @Column("idempotency_key")
    private String idempotencyKey;

    @Column("delivery_header_id")
    private String deliveryHeaderId;

    /** Redacted JSON snapshot. */
    private String payload;

    @Column("processing_status")
    private WebhookProcessingStatus processingStatus;

    @Column("error_message")
    private String errorMessage;

    private int attempts;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    @Column("processed_at")
    private Instant processedAt;
}
