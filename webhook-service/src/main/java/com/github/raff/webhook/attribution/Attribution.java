package com.github.raff.webhook.attribution;

import com.github.raff.webhook.domain.model.ClickTracking;
import com.github.raff.webhook.domain.model.Commission;

/**
 * Click credited for an order, plus the already-recorded commission when this is a
 * re-delivery. {@code existing} is null for a first attribution.
 */
public record Attribution(ClickTracking click, Commission existing) {

    public boolean isFirstAttribution() {
        return existing == null;
    }
}
