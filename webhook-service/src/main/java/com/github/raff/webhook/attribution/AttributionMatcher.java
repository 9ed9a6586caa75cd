package com.github.raff.webhook.attribution;

import com.github.raff.webhook.domain.store.ClickTrackingStore;
import com.github.raff.webhook.domain.store.CommissionStore;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Finds the click credited for an order. Must run inside the caller's transaction:
 * the existing commission is read with a row lock.
 *
 * Lookup order:
 * 1. the click already linked to this order's commission, regardless of expiry;
 * 2. the latest unexpired click with this tracking id for the merchant.
 * Empty means "no attribution" (organic order or expired/unknown click).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttributionMatcher {

    private final CommissionStore commissions;
    private final ClickTrackingStore clicks;
    private final ReferrerCodePolicy policy;
    private final Clock clock;

    public Mono<Attribution> match(String referrerCode, String merchantId, String orderId) {
        if (!policy.isValid(referrerCode)) {
            return Mono.empty();
        }
        String code = referrerCode.trim();
        return commissions.findForUpdate(merchantId, orderId)
                .flatMap(existing -> clicks.findById(existing.getClickTrackingId())
                        .map(click -> new Attribution(click, existing))
                        .switchIfEmpty(Mono.defer(() -> {
                            log.warn("Commission {} references missing click {}", existing.getId(),
                                    existing.getClickTrackingId());
                            return Mono.empty();
                        })))
                .switchIfEmpty(Mono.defer(() -> clicks.findActive(code, merchantId, clock.instant())
                        .map(click -> new Attribution(click, null))));
    }
}
