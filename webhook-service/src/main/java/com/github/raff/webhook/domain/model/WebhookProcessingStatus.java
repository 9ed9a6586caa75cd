package com.github.raff.webhook.domain.model;

public enum WebhookProcessingStatus {
    RECEIVED,
    PROCESSED,
    FAILED
}
