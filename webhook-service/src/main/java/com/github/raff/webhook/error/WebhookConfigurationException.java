package com.github.raff.webhook.error;

import org.springframework.http.HttpStatus;

/** Server-side misconfiguration, e.g. a missing secret in production. */
public class WebhookConfigurationException extends WebhookException {
    public WebhookConfigurationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "WEBHOOK_MISCONFIGURED", message);
    }
}
