package com.github.raff.webhook.domain.model;

/**
 * Commission lifecycle. Ordinal order is relied upon by the transition table.
 */
public enum CommissionStatus {
    PENDING,
    APPROVED,
    ON_HOLD,
    CANCELLED,
    PAID;

    /** States whose order value is counted in the click's conversion aggregates. */
    public boolean isCounted() {
        return this == APPROVED || this == PAID;
    }
}
