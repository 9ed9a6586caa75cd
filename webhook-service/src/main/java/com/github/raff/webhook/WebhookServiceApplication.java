package com.github.raff.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Webhook Service.
 * Receives store-platform webhooks and attributes orders to affiliate clicks.
 */
@Slf4j
@SpringBootApplication
public class WebhookServiceApplication {

    /**
     * Main method to launch the Webhook Service application.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(final String[] args) {
        SpringApplication.run(WebhookServiceApplication.class, args);
        log.info("Webhook Service application started successfully.");
    }
}
