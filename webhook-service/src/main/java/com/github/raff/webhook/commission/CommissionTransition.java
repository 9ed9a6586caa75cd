package com.github.raff.webhook.commission;

import com.github.raff.webhook.domain.model.Commission;

/**
 * Result of applying one event to a commission.
 *
 * @param previous row before this event, null when it was created now
 * @param current row after this event
 * @param written false when nothing changed and the write was skipped
 */
public record CommissionTransition(Commission previous, Commission current, boolean written) {

    public static CommissionTransition created(Commission current) {
        return new CommissionTransition(null, current, true);
    }

    public static CommissionTransition updated(Commission previous, Commission current) {
        return new CommissionTransition(previous, current, true);
    }

    public static CommissionTransition unchanged(Commission current) {
        return new CommissionTransition(current, current, false);
    }

    public boolean isCreated() {
        return previous == null;
    }
}
