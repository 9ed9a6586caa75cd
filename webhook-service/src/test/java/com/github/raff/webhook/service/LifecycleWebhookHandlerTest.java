package com.github.raff.webhook.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.domain.model.WebhookProcessingStatus;
import com.github.raff.webhook.error.MerchantNotFoundException;
import com.github.raff.webhook.error.PayloadValidationException;
import com.github.raff.webhook.ledger.IdempotencyLedger;
import com.github.raff.webhook.normalize.IdempotencyKeys;
import com.github.raff.webhook.normalize.NormalizerRegistry;
import com.github.raff.webhook.normalize.PayloadRedactor;
import com.github.raff.webhook.normalize.SallaWebhookNormalizer;
import com.github.raff.webhook.normalize.WebhookEventKind;
import com.github.raff.webhook.normalize.ZidWebhookNormalizer;
import com.github.raff.webhook.support.InMemoryWebhookEventStore;
import com.github.raff.webhook.support.MutableClock;
import com.github.raff.webhook.sync.PlatformSyncGateway;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LifecycleWebhookHandlerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private PlatformSyncGateway gateway;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private InMemoryWebhookEventStore events;
    private Merchant merchant;
    private LifecycleWebhookHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        events = new InMemoryWebhookEventStore();
        WebhookProperties props = new WebhookProperties();
        merchant = Merchant.builder().id("M1").zidStoreId("Z1").zidAccessToken("tok")
                .updatedAt(T0.minus(Duration.ofHours(1))).build();
        handler = new LifecycleWebhookHandler(
                new NormalizerRegistry(List.of(new SallaWebhookNormalizer(props), new ZidWebhookNormalizer(props))),
                (platform, storeId) -> "Z1".equals(storeId) ? Mono.just(merchant) : Mono.empty(),
                new IdempotencyLedger(events, props, clock),
                gateway,
                new PayloadRedactor(objectMapper),
                props,
                clock);
    }

    @Test
    @DisplayName("Product update triggers one sync per distinct body")
    void productSync() throws Exception {
        when(gateway.syncProduct(Platform.ZID, merchant, "P1")).thenReturn(Mono.empty());
        String json = """
                {"event":"product.update","store_id":"Z1","product_id":"P1"}
                """;

        StepVerifier.create(handler.handle(delivery(json, WebhookEventKind.PRODUCT_UPSERT)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("Product synced"))
                .verifyComplete();
        StepVerifier.create(handler.handle(delivery(json, WebhookEventKind.PRODUCT_UPSERT)))
                .assertNext(r -> assertThat(r.duplicate()).isTrue())
                .verifyComplete();

        verify(gateway, times(1)).syncProduct(Platform.ZID, merchant, "P1");
    }

    @Test
    void productDeleteDeactivates() throws Exception {
        when(gateway.deactivateProduct(Platform.ZID, merchant, "P1")).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(delivery("""
                        {"event":"product.delete","store_id":"Z1","product_id":"P1"}
                        """, WebhookEventKind.PRODUCT_DELETE)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("Product deactivated"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Product event for an unknown store is a 404 without a ledger row")
    void productUnknownStore() throws Exception {
        StepVerifier.create(handler.handle(delivery("""
                        {"event":"product.update","store_id":"Z9","product_id":"P1"}
                        """, WebhookEventKind.PRODUCT_UPSERT)))
                .expectError(MerchantNotFoundException.class)
                .verify();
        assertThat(events.size()).isZero();
    }

    @Test
    void productWithoutIdIsRejected() throws Exception {
        StepVerifier.create(handler.handle(delivery("""
                        {"event":"product.update","store_id":"Z1"}
                        """, WebhookEventKind.PRODUCT_UPSERT)))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(PayloadValidationException.class)
                        .hasMessage("Missing data"))
                .verify();
    }

    @Test
    @DisplayName("Gateway failure fails the delivery and leaves the ledger row retryable")
    void gatewayFailure() throws Exception {
        when(gateway.syncProduct(any(), any(), eq("P1"))).thenReturn(Mono.error(new IllegalStateException("platform down")));
        String json = """
                {"event":"product.update","store_id":"Z1","product_id":"P1"}
                """;

        StepVerifier.create(handler.handle(delivery(json, WebhookEventKind.PRODUCT_UPSERT)))
                .expectErrorMessage("platform down")
                .verify();

        String key = IdempotencyKeys.lifecycleEvent(Platform.ZID, "Z1", "product.update",
                json.getBytes(StandardCharsets.UTF_8));
        assertThat(events.get(key).getProcessingStatus()).isEqualTo(WebhookProcessingStatus.FAILED);
    }

    @Test
    @DisplayName("App install syncs store info unless the merchant was refreshed recently")
    void appInstalled() throws Exception {
        when(gateway.syncStoreInfo(Platform.ZID, merchant)).thenReturn(Mono.empty());
        String json = """
                {"event":"app.installed","store_id":"Z1"}
                """;

        StepVerifier.create(handler.handle(delivery(json, WebhookEventKind.APP_INSTALLED)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("Store info synced"))
                .verifyComplete();

        merchant.setUpdatedAt(T0.minus(Duration.ofMinutes(1)));
        StepVerifier.create(handler.handle(delivery("""
                        {"event":"app.installed","store_id":"Z1","attempt":2}
                        """, WebhookEventKind.APP_INSTALLED)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("Store recently synced; skipped"))
                .verifyComplete();

        verify(gateway, times(1)).syncStoreInfo(Platform.ZID, merchant);
    }

    @Test
    @DisplayName("App install for a store not yet linked is acknowledged")
    void appInstalledUnknownStore() throws Exception {
        StepVerifier.create(handler.handle(delivery("""
                        {"event":"app.installed","store_id":"Z9"}
                        """, WebhookEventKind.APP_INSTALLED)))
                .assertNext(r -> {
                    assertThat(r.success()).isTrue();
                    assertThat(r.message()).isEqualTo("App installed");
                })
                .verifyComplete();
        verifyNoInteractions(gateway);
    }

    @Test
    void appUninstalled() throws Exception {
        when(gateway.markUninstalled(Platform.ZID, merchant)).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(delivery("""
                        {"event":"app.uninstalled","store_id":"Z1"}
                        """, WebhookEventKind.APP_UNINSTALLED)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("App uninstalled"))
                .verifyComplete();

        StepVerifier.create(handler.handle(delivery("""
                        {"event":"app.uninstalled"}
                        """, WebhookEventKind.APP_UNINSTALLED)))
                .expectError(PayloadValidationException.class)
                .verify();
    }

    @Test
    @DisplayName("Authorization grant is forwarded with its data block")
    void authorization() throws Exception {
        when(gateway.acceptAuthorization(eq(Platform.ZID), eq("Z7"), any(JsonNode.class))).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(delivery("""
                        {"event":"app.store.authorize","store_id":"Z7","data":{"access_token":"a","expires":3600}}
                        """, WebhookEventKind.AUTHORIZATION_GRANTED)))
                .assertNext(r -> assertThat(r.message()).isEqualTo("Authorization received"))
                .verifyComplete();

        verify(gateway).acceptAuthorization(eq(Platform.ZID), eq("Z7"), any(JsonNode.class));
        verify(gateway, never()).syncStoreInfo(any(), any());
    }

    private WebhookDelivery delivery(String json, WebhookEventKind kind) throws Exception {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        JsonNode payload = objectMapper.readTree(body);
        return new WebhookDelivery(Platform.ZID, payload.get("event").asText(), kind, payload, body, null);
    }
}
