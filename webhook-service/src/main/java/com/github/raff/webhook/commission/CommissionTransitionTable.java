package com.github.raff.webhook.commission;

import com.github.raff.webhook.domain.model.CommissionStatus;

import static com.github.raff.webhook.domain.model.CommissionStatus.APPROVED;
import static com.github.raff.webhook.domain.model.CommissionStatus.CANCELLED;
import static com.github.raff.webhook.domain.model.CommissionStatus.ON_HOLD;
import static com.github.raff.webhook.domain.model.CommissionStatus.PAID;
import static com.github.raff.webhook.domain.model.CommissionStatus.PENDING;

/**
 * Merge policy for (stored status, status observed now) -> status to store.
 *
 * PAID is absorbing, CANCELLED is terminal, APPROVED never drops back to PENDING or
 * into a hold, and a confirmed payment releases a hold. Every pair of observed statuses
 * ends in the same state whichever arrives first. PAID is never a webhook-derived status.
 */
public final class CommissionTransitionTable {

    /** Columns, in order: observed PENDING, APPROVED, ON_HOLD, CANCELLED. */
    private static final CommissionStatus[] OBSERVABLE = {PENDING, APPROVED, ON_HOLD, CANCELLED};

    private static final CommissionStatus[] NEW_ROW = {PENDING, APPROVED, ON_HOLD, CANCELLED};

    /** Rows indexed by stored status ordinal. */
    private static final CommissionStatus[][] TABLE = {
            /* PENDING   */ {PENDING,   APPROVED,  ON_HOLD,   CANCELLED},
            /* APPROVED  */ {APPROVED,  APPROVED,  APPROVED,  CANCELLED},
            /* ON_HOLD   */ {ON_HOLD,   APPROVED,  ON_HOLD,   CANCELLED},
            /* CANCELLED */ {CANCELLED, CANCELLED, CANCELLED, CANCELLED},
            /* PAID      */ {PAID,      PAID,      PAID,      PAID},
    };

    private CommissionTransitionTable() {
    }

    /**
     * @param current stored status, or null when the commission does not exist yet
     * @param observed status derived from the current event; never PAID
     */
    public static CommissionStatus next(CommissionStatus current, CommissionStatus observed) {
        int column = column(observed);
        return current == null ? NEW_ROW[column] : TABLE[current.ordinal()][column];
    }

    private static int column(CommissionStatus observed) {
        if (observed == null) {
            throw new IllegalArgumentException("observed status must not be null");
        }
        for (int i = 0; i < OBSERVABLE.length; i++) {
            if (OBSERVABLE[i] == observed) return i;
        }
        throw new IllegalArgumentException("Not derivable from a webhook: " + observed);
    }
}
