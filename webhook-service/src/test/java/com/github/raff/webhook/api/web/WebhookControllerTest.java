package com.github.raff.webhook.api.web;

import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.error.MerchantNotFoundException;
import com.github.raff.webhook.error.PayloadValidationException;
import com.github.raff.webhook.error.TransientStoreException;
import com.github.raff.webhook.error.WebhookAuthenticationException;
import com.github.raff.webhook.service.WebhookIngestionService;
import java.math.BigDecimal;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    @Mock
    private WebhookIngestionService ingestion;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new WebhookController(ingestion))
                .controllerAdvice(new WebhookExceptionHandler())
                .build();
    }

    @Test
    void returnsOutcome() {
        when(ingestion.ingest(eq("salla"), any(), any(HttpHeaders.class))).thenReturn(Mono.just(
                WebhookResponse.builder().success(true).message("Commission approved")
                        .status("APPROVED").commission(new BigDecimal("10.00")).build()));

        client.post().uri("/webhooks/salla")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"event\":\"order.updated\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.status").isEqualTo("APPROVED")
                .jsonPath("$.commission").isEqualTo(10.0)
                .jsonPath("$.message").isEqualTo("Commission approved");
    }

    @Test
    void duplicateIsStillOk() {
        when(ingestion.ingest(eq("zid"), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.just(WebhookResponse.duplicateDelivery()));

        client.post().uri("/webhooks/zid")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.duplicate").isEqualTo(true)
                .jsonPath("$.status").doesNotExist();
    }

    @Test
    void invalidSignatureIs401() {
        when(ingestion.ingest(any(), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.error(new WebhookAuthenticationException("Invalid signature")));

        client.post().uri("/webhooks/salla").bodyValue("{}").exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_SIGNATURE")
                .jsonPath("$.message").isEqualTo("Invalid signature")
                .jsonPath("$.platform").isEqualTo("salla")
                .jsonPath("$.details").doesNotExist();
    }

    @Test
    void invalidPayloadIs400() {
        when(ingestion.ingest(any(), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.error(new PayloadValidationException("Invalid order payload")));

        client.post().uri("/webhooks/salla").bodyValue("{}").exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.code").isEqualTo("INVALID_PAYLOAD");
    }

    @Test
    @DisplayName("Unknown store answers 404 naming the platform and the store id")
    void unknownMerchantIs404() {
        when(ingestion.ingest(any(), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.error(new MerchantNotFoundException(Platform.ZID, "Z9")));

        client.post().uri("/webhooks/zid").bodyValue("{}").exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("MERCHANT_NOT_FOUND")
                .jsonPath("$.platform").isEqualTo("zid")
                .jsonPath("$.details.storeId").isEqualTo("Z9");
    }

    @Test
    void transientFailuresAre500() {
        when(ingestion.ingest(eq("salla"), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.error(new TransientStoreException("Webhook processing failed", new RuntimeException("db"))));
        when(ingestion.ingest(eq("zid"), any(), any(HttpHeaders.class)))
                .thenReturn(Mono.error(new TimeoutException("Did not observe any item")));

        client.post().uri("/webhooks/salla").bodyValue("{}").exchange()
                .expectStatus().is5xxServerError()
                .expectBody().jsonPath("$.code").isEqualTo("STORE_UNAVAILABLE");
        client.post().uri("/webhooks/zid").bodyValue("{}").exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.code").isEqualTo("PROCESSING_TIMEOUT")
                .jsonPath("$.platform").isEqualTo("zid");
    }
}
