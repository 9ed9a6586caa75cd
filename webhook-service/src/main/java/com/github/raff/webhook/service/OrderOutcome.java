package com.github.raff.webhook.service;

import com.github.raff.webhook.commission.CommissionTransition;
import com.github.raff.webhook.domain.model.CommissionStatus;
import java.math.BigDecimal;
import java.util.Locale;

/** What an order event did; status and commission are null when nothing was attributed. */
public record OrderOutcome(String message, CommissionStatus status, BigDecimal commission) {

    public static final String NO_REFERRER = "No valid referrer code";
    public static final String NO_CLICK = "No matching click tracking found";

    public static OrderOutcome noReferrer() {
        return new OrderOutcome(NO_REFERRER, null, null);
    }

    public static OrderOutcome noClick() {
        return new OrderOutcome(NO_CLICK, null, null);
    }

    public static OrderOutcome of(CommissionTransition t) {
        CommissionStatus status = t.current().getStatus();
        return new OrderOutcome("Commission " + status.name().toLowerCase(Locale.ROOT),
                status, t.current().getCommissionAmount());
    }
}
