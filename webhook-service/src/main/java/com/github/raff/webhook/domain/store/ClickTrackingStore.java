package com.github.raff.webhook.domain.store;

import com.github.raff.webhook.domain.model.ClickTracking;
import java.math.BigDecimal;
import java.time.Instant;
import reactor.core.publisher.Mono;

/**
 * Reactive access to 'click_tracking'. Clicks are created elsewhere; this service
 * reads them and adjusts their conversion aggregates.
 */
public interface ClickTrackingStore {

    Mono<ClickTracking> findById(Long id);

    /** Most recent click for the code and merchant that has not expired at {@code now}. */
    Mono<ClickTracking> findActive(String trackingId, String merchantId, Instant now);

    /**
     * Apply an incremental change to the conversion aggregates in one atomic update.
     * Totals are clamped at zero. A positive {@code countDelta} stamps last_converted_at
     * (and converted_at when unset); a count reaching zero clears converted/converted_at.
     */
    Mono<Void> applyConversionDelta(Long id, int countDelta, BigDecimal valueDelta,
                                    BigDecimal commissionDelta, Instant now);
}
