package com.github.raff.webhook.error;

import java.util.Map;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base failure of webhook handling, carrying the HTTP status and machine code
 * reported to the calling platform.
 */
@Getter
public abstract class WebhookException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected WebhookException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected WebhookException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    /** Context reported in the error body; none by default. */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
