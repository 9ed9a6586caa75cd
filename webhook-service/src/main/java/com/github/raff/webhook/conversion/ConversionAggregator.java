package com.github.raff.webhook.conversion;

import com.github.raff.webhook.commission.CommissionTransition;
import com.github.raff.webhook.domain.store.ClickTrackingStore;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Keeps the click's running conversion totals in step with its commissions, from the
 * delta of each transition. Runs in the same transaction as the commission write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionAggregator {

    private final ClickTrackingStore clicks;
    private final Clock clock;

    public Mono<ConversionDelta> apply(CommissionTransition transition) {
        ConversionDelta delta = ConversionDelta.of(transition);
        if (delta.isZero()) {
            return Mono.just(delta);
        }
        Long clickId = transition.current().getClickTrackingId();
        log.info("Click {} aggregates: count {}{}, value {}, commission {}", clickId,
                delta.count() >= 0 ? "+" : "", delta.count(), delta.value().toPlainString(),
                delta.commission().toPlainString());
        return clicks.applyConversionDelta(clickId, delta.count(), delta.value(), delta.commission(), clock.instant())
                .thenReturn(delta);
    }
}
