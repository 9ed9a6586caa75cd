package com.github.raff.webhook.error;

import org.springframework.http.HttpStatus;

/** Missing or invalid signature, or an unexpected security strategy. */
public class WebhookAuthenticationException extends WebhookException {
    public WebhookAuthenticationException(String message) {
        super(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", message);
    }
}
