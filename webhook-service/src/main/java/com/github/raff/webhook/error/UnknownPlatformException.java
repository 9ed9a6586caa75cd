package com.github.raff.webhook.error;

import org.springframework.http.HttpStatus;

public class UnknownPlatformException extends WebhookException {
    public UnknownPlatformException(String platform) {
        super(HttpStatus.NOT_FOUND, "UNKNOWN_PLATFORM", "Unsupported platform: " + platform);
    }
}
