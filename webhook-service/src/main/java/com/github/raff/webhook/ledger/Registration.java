package com.github.raff.webhook.ledger;

public enum Registration {
    /** First delivery, or a retry taking over a failed/abandoned attempt. */
    ACCEPTED,
    /** Already handled or in flight; side effects must not run again. */
    DUPLICATE
}
