package com.github.raff.webhook.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.error.PayloadValidationException;
import com.github.raff.webhook.error.TransientStoreException;
import com.github.raff.webhook.error.UnknownPlatformException;
import com.github.raff.webhook.normalize.NormalizerRegistry;
import com.github.raff.webhook.normalize.WebhookEventKind;
import com.github.raff.webhook.verify.SignatureVerifier;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point for one webhook delivery:
 * verify signature -> parse -> classify event kind -> dispatch.
 *
 * Verification and parsing fail before any side effect. The whole delivery runs
 * under {@code webhook.processing-timeout}; store failures surface as 500 so the
 * platform retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionService {

    static final String UNHANDLED_MESSAGE = "Event received but not processed";

    private final SignatureVerifier verifier;
    private final NormalizerRegistry normalizers;
    private final OrderWebhookHandler orders;
    private final LifecycleWebhookHandler lifecycle;
    private final WebhookProperties props;
    private final ObjectMapper objectMapper;

    public Mono<WebhookResponse> ingest(String platformPath, byte[] body, HttpHeaders headers) {
        return Mono.defer(() -> dispatch(accept(platformPath, body, headers)))
                .timeout(props.getProcessingTimeout())
                .onErrorMap(DataAccessException.class, e -> {
                    log.error("Store failure while handling {} webhook", platformPath, e);
                    return new TransientStoreException("Webhook processing failed", e);
                });
    }

    private WebhookDelivery accept(String platformPath, byte[] body, HttpHeaders headers) {
        Platform platform = Platform.fromPath(platformPath)
                .orElseThrow(() -> new UnknownPlatformException(platformPath));

        verifier.verify(platform, body, headers);

        JsonNode payload = parse(body);
        String eventType = normalizers.forPlatform(platform).eventType(payload);
        if (eventType == null || eventType.isEmpty()) {
            log.warn("{} webhook without event type", platform.path());
            throw new PayloadValidationException("Missing event type");
        }
        WebhookEventKind kind = WebhookEventKind.classify(eventType);
        String deliveryId = deliveryId(platform, headers);
        log.info("{} webhook received: event={} kind={} deliveryId={}", platform.path(), eventType, kind, deliveryId);
        return new WebhookDelivery(platform, eventType, kind, payload, body, deliveryId);
    }

    private Mono<WebhookResponse> dispatch(WebhookDelivery delivery) {
        return switch (delivery.kind()) {
            case ORDER -> orders.handle(delivery);
            case PRODUCT_UPSERT, PRODUCT_DELETE, APP_INSTALLED, APP_UNINSTALLED, AUTHORIZATION_GRANTED ->
                    lifecycle.handle(delivery);
            case UNHANDLED -> {
                log.info("{} event {} not handled", delivery.platform().path(), delivery.eventType());
                yield Mono.just(WebhookResponse.ok(UNHANDLED_MESSAGE));
            }
        };
    }

    private JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new PayloadValidationException("Empty body");
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new PayloadValidationException("Payload must be a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new PayloadValidationException("Malformed JSON payload", e);
        }
    }

    private String deliveryId(Platform platform, HttpHeaders headers) {
        for (String name : props.endpoint(platform).getDeliveryIdHeaders()) {
            String value = headers.getFirst(name);
            if (value != null && !value.isBlank()) return value.trim();
        }
        return null;
    }
}
