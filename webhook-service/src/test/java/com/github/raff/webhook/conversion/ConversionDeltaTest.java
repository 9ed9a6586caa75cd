package com.github.raff.webhook.conversion;

import com.github.raff.webhook.commission.CommissionTransition;
import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.CommissionStatus;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionDeltaTest {

    @Test
    @DisplayName("Entering a counted state adds the order; leaving it removes the previously counted values")
    void enterAndLeaveCountedState() {
        Commission pending = commission(CommissionStatus.PENDING, "100.00", "10.00");
        Commission approved = commission(CommissionStatus.APPROVED, "100.00", "10.00");
        Commission cancelled = commission(CommissionStatus.CANCELLED, "120.00", "12.00");

        ConversionDelta in = ConversionDelta.between(pending, approved);
        ConversionDelta out = ConversionDelta.between(approved, cancelled);

        assertThat(in.count()).isEqualTo(1);
        assertThat(in.value()).isEqualByComparingTo("100.00");
        assertThat(out.count()).isEqualTo(-1);
        assertThat(out.value()).isEqualByComparingTo("-100.00");
        assertThat(out.commission()).isEqualByComparingTo("-10.00");
    }

    @Test
    void amountChangeWhileCountedMovesOnlyTheValues() {
        ConversionDelta delta = ConversionDelta.between(
                commission(CommissionStatus.APPROVED, "100.00", "10.00"),
                commission(CommissionStatus.APPROVED, "80.00", "8.00"));

        assertThat(delta.count()).isZero();
        assertThat(delta.value()).isEqualByComparingTo("-20.00");
        assertThat(delta.commission()).isEqualByComparingTo("-2.00");
    }

    @Test
    void uncountedTransitionsAndSkippedWritesAreZero() {
        Commission pending = commission(CommissionStatus.PENDING, "100.00", "10.00");
        Commission hold = commission(CommissionStatus.ON_HOLD, "100.00", "10.00");

        assertThat(ConversionDelta.between(null, pending).isZero()).isTrue();
        assertThat(ConversionDelta.between(pending, hold).isZero()).isTrue();
        assertThat(ConversionDelta.of(CommissionTransition.unchanged(commission(CommissionStatus.APPROVED, "1", "1"))))
                .isEqualTo(ConversionDelta.NONE);
    }

    private static Commission commission(CommissionStatus status, String total, String amount) {
        return Commission.builder()
                .id(1L).clickTrackingId(1L).merchantId("M1").orderId("O1")
                .orderTotal(new BigDecimal(total)).orderCurrency("SAR")
                .commissionRate(BigDecimal.TEN).commissionAmount(new BigDecimal(amount))
                .status(status)
                .build();
    }
}
