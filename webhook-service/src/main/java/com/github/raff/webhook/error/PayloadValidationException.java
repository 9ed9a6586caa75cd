package com.github.raff.webhook.error;

import org.springframework.http.HttpStatus;

/** Payload cannot be parsed or normalized. */
public class PayloadValidationException extends WebhookException {
    public PayloadValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", message);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", message, cause);
    }
}
