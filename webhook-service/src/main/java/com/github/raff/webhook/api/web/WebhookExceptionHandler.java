package com.github.raff.webhook.api.web;

import com.github.raff.webhook.api.dto.ApiError;
import com.github.raff.webhook.error.WebhookException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.server.ServerWebExchange;

/**
 * Maps webhook failures to {@link ApiError} bodies. 4xx answers tell the platform to stop
 * retrying; 5xx answers ask it to redeliver.
 */
@Slf4j
@RestControllerAdvice
public class WebhookExceptionHandler {

    @ExceptionHandler(WebhookException.class)
    public ResponseEntity<ApiError> handleWebhookException(WebhookException ex, ServerWebExchange exchange) {
        String platform = platform(exchange);
        if (ex.getStatus().is5xxServerError()) {
            log.error("{} webhook failed [{}]: {}", platform, ex.getCode(), ex.getMessage(), ex);
        } else {
            log.info("{} webhook rejected [{}]: {} {}", platform, ex.getCode(), ex.getMessage(), ex.getDetails());
        }
        ApiError body = ApiError.builder()
                .code(ex.getCode())
                .message(ex.getMessage())
                .platform(platform)
                .timestamp(Instant.now())
                .details(ex.getDetails())
                .build();
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException ex, ServerWebExchange exchange) {
        log.error("Backing store failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("STORE_UNAVAILABLE", "Webhook processing failed", platform(exchange)));
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(TimeoutException ex, ServerWebExchange exchange) {
        log.error("Webhook processing timed out: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("PROCESSING_TIMEOUT", "Webhook processing timed out", platform(exchange)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected webhook failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("INTERNAL_ERROR", "Webhook processing failed", platform(exchange)));
    }

    private static String platform(ServerWebExchange exchange) {
        Map<String, String> vars = exchange.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return vars == null ? null : vars.get("platform");
    }
}
