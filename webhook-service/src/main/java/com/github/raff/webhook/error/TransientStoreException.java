package com.github.raff.webhook.error;

import org.springframework.http.HttpStatus;

/** Backing store unavailable or failing; the platform is expected to retry. */
public class TransientStoreException extends WebhookException {
    public TransientStoreException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_UNAVAILABLE", message, cause);
    }
}
