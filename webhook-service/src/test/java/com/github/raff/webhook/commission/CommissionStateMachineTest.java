package com.github.raff.webhook.commission;

import com.github.raff.common.money.Money;
import com.github.raff.webhook.attribution.Attribution;
import com.github.raff.webhook.domain.model.ClickTracking;
import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.CommissionStatus;
import com.github.raff.webhook.domain.store.CommissionStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommissionStateMachineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private CommissionStore store;

    private CommissionStateMachine stateMachine;
    private ClickTracking click;
    private OrderTerms terms;

    @BeforeEach
    void setUp() {
        stateMachine = new CommissionStateMachine(store, Clock.fixed(NOW, ZoneOffset.UTC));
        click = ClickTracking.builder().id(7L).trackingId("RAFF-1").merchantId("M1").build();
        terms = OrderTerms.of("M1", "O1", Money.of("SAR", new BigDecimal("100")), new BigDecimal("10"));
    }

    @Test
    @DisplayName("Losing the insert race merges into the row the other writer created")
    void mergesAfterInsertConflict() {
        Commission winner = existing(CommissionStatus.PENDING);
        when(store.insertIfAbsent(any())).thenReturn(Mono.empty());
        when(store.findForUpdate("M1", "O1")).thenReturn(Mono.just(winner));
        when(store.update(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(stateMachine.apply(new Attribution(click, null), terms, CommissionStatus.APPROVED))
                .assertNext(t -> {
                    assertThat(t.isCreated()).isFalse();
                    assertThat(t.previous().getStatus()).isEqualTo(CommissionStatus.PENDING);
                    assertThat(t.current().getStatus()).isEqualTo(CommissionStatus.APPROVED);
                    assertThat(t.current().getUpdatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("An event that changes nothing skips the write")
    void unchangedSkipsWrite() {
        Commission current = existing(CommissionStatus.APPROVED);

        StepVerifier.create(stateMachine.apply(new Attribution(click, current), terms, CommissionStatus.PENDING))
                .assertNext(t -> {
                    assertThat(t.written()).isFalse();
                    assertThat(t.current()).isSameAs(current);
                })
                .verifyComplete();
        verify(store, never()).update(any());
    }

    @Test
    void createsWithObservedStatusAndComputedAmount() {
        when(store.insertIfAbsent(any())).thenAnswer(inv -> Mono.just(
                ((Commission) inv.getArgument(0)).toBuilder().id(1L).build()));

        StepVerifier.create(stateMachine.apply(new Attribution(click, null), terms, CommissionStatus.PENDING))
                .assertNext(t -> {
                    assertThat(t.isCreated()).isTrue();
                    assertThat(t.current().getClickTrackingId()).isEqualTo(7L);
                    assertThat(t.current().getCommissionAmount()).isEqualByComparingTo("10.00");
                    assertThat(t.current().getOrderCurrency()).isEqualTo("SAR");
                    assertThat(t.current().getCreatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    private static Commission existing(CommissionStatus status) {
        return Commission.builder()
                .id(1L).clickTrackingId(7L).merchantId("M1").orderId("O1")
                .orderTotal(new BigDecimal("100.00")).orderCurrency("SAR")
                .commissionRate(new BigDecimal("10")).commissionAmount(new BigDecimal("10.00"))
                .status(status)
                .createdAt(NOW.minusSeconds(60)).updatedAt(NOW.minusSeconds(60))
                .build();
    }
}
