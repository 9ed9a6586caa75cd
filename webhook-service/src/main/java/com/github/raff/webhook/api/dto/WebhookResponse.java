package com.github.raff.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Body of every 200 answer to a platform. */
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResponse(
        boolean success,
        boolean duplicate,
        String message,
        /** Commission status after this event, when one was touched. */
        String status,
        BigDecimal commission
) {
    public static WebhookResponse ok(String message) {
        return WebhookResponse.builder().success(true).message(message).build();
    }

    public static WebhookResponse duplicateDelivery() {
        return WebhookResponse.builder().success(true).duplicate(true).message("Duplicate delivery ignored").build();
    }
}
