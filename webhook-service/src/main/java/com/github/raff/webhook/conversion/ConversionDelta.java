package com.github.raff.webhook.conversion;

import com.github.raff.webhook.commission.CommissionTransition;
import com.github.raff.webhook.domain.model.Commission;
import java.math.BigDecimal;

/**
 * Change to a click's conversion aggregates implied by one commission transition.
 * Only APPROVED and PAID commissions are counted.
 */
public record ConversionDelta(int count, BigDecimal value, BigDecimal commission) {

    public static final ConversionDelta NONE = new ConversionDelta(0, BigDecimal.ZERO, BigDecimal.ZERO);

    public static ConversionDelta of(CommissionTransition t) {
        if (!t.written()) return NONE;
        return between(t.previous(), t.current());
    }

    /** {@code previous} may be null for a newly created commission. */
    public static ConversionDelta between(Commission previous, Commission next) {
        boolean wasCounted = previous != null && previous.getStatus().isCounted();
        boolean isCounted = next.getStatus().isCounted();

        if (!wasCounted && isCounted) {
            return new ConversionDelta(1, next.getOrderTotal(), next.getCommissionAmount());
        }
        if (wasCounted && !isCounted) {
            return new ConversionDelta(-1, previous.getOrderTotal().negate(), previous.getCommissionAmount().negate());
        }
        if (wasCounted) {
            return new ConversionDelta(0,
                    next.getOrderTotal().subtract(previous.getOrderTotal()),
                    next.getCommissionAmount().subtract(previous.getCommissionAmount()));
        }
        return NONE;
    }

    public boolean isZero() {
        return count == 0 && value.signum() == 0 && commission.signum() == 0;
    }
}
