package com.github.raff.webhook.fraud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.ClickTracking;
import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.FraudSeverity;
import com.github.raff.webhook.domain.model.FraudSignalType;
import com.github.raff.webhook.domain.store.CommissionStore;
import com.github.raff.webhook.support.InMemoryCommissionStore;
import com.github.raff.webhook.support.InMemoryFraudSignalStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FraudSignalDetectorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private CommissionStore commissions;

    private WebhookProperties props;
    private InMemoryFraudSignalStore signals;
    private FraudSignalDetector detector;
    private FraudContext context;

    @BeforeEach
    void setUp() {
        props = new WebhookProperties();
        props.getRisk().setEnabled(true);
        signals = new InMemoryFraudSignalStore();
        detector = new FraudSignalDetector(List.of(new HighFrequencyOrdersRule(commissions, props)),
                signals, props, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        ClickTracking click = ClickTracking.builder().id(5L).trackingId("RAFF-X").merchantId("M1").build();
        context = new FraudContext(click, "M1", "O9", null, NOW);
    }

    @Test
    @DisplayName("Third order inside the window raises a high-frequency signal and a hold")
    void highFrequency() {
        when(commissions.countOthersCreatedSince(eq(5L), eq("M1"), eq("O9"), eq(NOW.minus(Duration.ofMinutes(10)))))
                .thenReturn(Mono.just(2L));

        StepVerifier.create(detector.assess(context))
                .assertNext(risk -> {
                    assertThat(risk.hold()).isTrue();
                    assertThat(risk.score()).isEqualTo(70);
                    assertThat(risk.signals()).singleElement().satisfies(s -> {
                        assertThat(s.type()).isEqualTo(FraudSignalType.HIGH_FREQUENCY_ORDERS);
                        assertThat(s.severity()).isEqualTo(FraudSeverity.HIGH);
                        assertThat(s.reason()).isEqualTo("High frequency orders: 3 in 10m");
                        assertThat(s.metadata()).containsEntry("orderCount", 3L).containsEntry("windowMinutes", 10L);
                    });
                })
                .verifyComplete();
    }

    @Test
    void belowThresholdIsClean() {
        when(commissions.countOthersCreatedSince(eq(5L), eq("M1"), eq("O9"), eq(NOW.minus(Duration.ofMinutes(10)))))
                .thenReturn(Mono.just(1L));

        StepVerifier.create(detector.assess(context))
                .assertNext(risk -> {
                    assertThat(risk.hold()).isFalse();
                    assertThat(risk.signals()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("The order's own commission is counted once, and only when it was created inside the window")
    void ownCommissionCountedOnce() {
        when(commissions.countOthersCreatedSince(eq(5L), eq("M1"), eq("O9"), eq(NOW.minus(Duration.ofMinutes(10)))))
                .thenReturn(Mono.just(2L));
        Commission recent = Commission.builder().id(11L).merchantId("M1").orderId("O9")
                .createdAt(NOW.minus(Duration.ofMinutes(2))).build();
        Commission old = recent.toBuilder().createdAt(NOW.minus(Duration.ofHours(2))).build();

        StepVerifier.create(detector.assess(new FraudContext(context.click(), "M1", "O9", recent, NOW)))
                .assertNext(risk -> assertThat(risk.signals()).singleElement()
                        .satisfies(s -> assertThat(s.metadata()).containsEntry("orderCount", 3L)))
                .verifyComplete();
        StepVerifier.create(detector.assess(new FraudContext(context.click(), "M1", "O9", old, NOW)))
                .assertNext(risk -> assertThat(risk.hold()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("An event that lost the insert race to its own order does not count that order twice")
    void concurrentInsertIsNotDoubleCounted() {
        InMemoryCommissionStore store = new InMemoryCommissionStore();
        for (String orderId : List.of("O1", "O2", "O9")) {
            store.put(Commission.builder().clickTrackingId(5L).merchantId("M1").orderId(orderId)
                    .createdAt(NOW.minus(Duration.ofMinutes(1))).build());
        }
        props.getRisk().setOrderThreshold(4);
        FraudSignalDetector racing = new FraudSignalDetector(List.of(new HighFrequencyOrdersRule(store, props)),
                signals, props, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

        // attribution ran before the concurrent writer inserted O9
        StepVerifier.create(racing.assess(context))
                .assertNext(risk -> assertThat(risk.hold()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("Scoring is off unless enabled")
    void disabled() {
        props.getRisk().setEnabled(false);

        StepVerifier.create(detector.assess(context))
                .expectNext(RiskAssessment.NONE)
                .verifyComplete();
        verifyNoInteractions(commissions);
    }

    @Test
    @DisplayName("Signals are stored once per commission and type")
    void recordIsIdempotent() {
        DetectedSignal signal = new DetectedSignal(FraudSignalType.HIGH_FREQUENCY_ORDERS, FraudSeverity.HIGH, 80,
                "High frequency orders: 4 in 10m", Map.of("orderCount", 4));
        RiskAssessment risk = new RiskAssessment(List.of(signal), 80, true);
        Commission commission = Commission.builder().id(11L).clickTrackingId(5L).merchantId("M1").orderId("O9").build();

        StepVerifier.create(detector.record(commission, risk)).expectNext(1L).verifyComplete();
        StepVerifier.create(detector.record(commission, risk)).expectNext(0L).verifyComplete();
        StepVerifier.create(detector.record(commission, new RiskAssessment(List.of(signal), 40, false)))
                .expectNext(0L).verifyComplete();

        assertThat(signals.all()).singleElement().satisfies(row -> {
            assertThat(row.getCommissionId()).isEqualTo(11L);
            assertThat(row.getMetadata()).isEqualTo("{\"orderCount\":4}");
            assertThat(row.getCreatedAt()).isEqualTo(NOW);
        });
    }
}
