package com.github.raff.webhook.service;

import com.github.raff.common.money.Money;
import com.github.raff.webhook.attribution.Attribution;
import com.github.raff.webhook.attribution.AttributionMatcher;
import com.github.raff.webhook.attribution.ReferrerCodePolicy;
import com.github.raff.webhook.commission.CommissionStateMachine;
import com.github.raff.webhook.commission.OrderTerms;
import com.github.raff.webhook.conversion.ConversionAggregator;
import com.github.raff.webhook.domain.model.CommissionStatus;
import com.github.raff.webhook.domain.model.Merchant;
import com.github.raff.webhook.fraud.FraudContext;
import com.github.raff.webhook.fraud.FraudSignalDetector;
import com.github.raff.webhook.normalize.NormalizedOrderEvent;
import java.math.BigDecimal;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * Attributes one order event in a single transaction: click lookup, fraud scoring,
 * commission upsert, aggregate delta and signal insert commit or roll back together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderAttributionService {

    private final AttributionMatcher matcher;
    private final ReferrerCodePolicy referrerPolicy;
    private final CommissionStateMachine stateMachine;
    private final ConversionAggregator aggregator;
    private final FraudSignalDetector fraud;
    private final TransactionalOperator tx;
    private final Clock clock;

    public Mono<OrderOutcome> attribute(NormalizedOrderEvent event, Merchant merchant) {
        if (!referrerPolicy.isValid(event.getReferrerCode())) {
            log.info("Order {} has no valid referrer code; treating as organic", event.getOrderId());
            return Mono.just(OrderOutcome.noReferrer());
        }

        Mono<OrderOutcome> work = matcher.match(event.getReferrerCode(), merchant.getId(), event.getOrderId())
                .flatMap(attribution -> process(attribution, event, merchant))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.info("No click for referrer {} merchant={} order={}",
                            event.getReferrerCode(), merchant.getId(), event.getOrderId());
                    return OrderOutcome.noClick();
                }));

        return tx.transactional(work);
    }

    private Mono<OrderOutcome> process(Attribution attribution, NormalizedOrderEvent event, Merchant merchant) {
        OrderTerms terms = OrderTerms.of(merchant.getId(), event.getOrderId(),
                Money.of(event.getCurrency(), event.getTotal()), rate(attribution, merchant));

        FraudContext context = new FraudContext(attribution.click(), merchant.getId(), event.getOrderId(),
                attribution.existing(), clock.instant());

        return fraud.assess(context).flatMap(risk -> {
            CommissionStatus observed = CommissionStateMachine.observedStatus(
                    event.isOrderCancelled(), event.isPaymentConfirmed(), risk.hold());

            return stateMachine.apply(attribution, terms, observed)
                    .flatMap(transition -> aggregator.apply(transition)
                            .then(fraud.record(transition.current(), risk))
                            .thenReturn(transition))
                    .map(transition -> {
                        log.info("Commission {}: {} {} for order {} (click {})",
                                transition.current().getStatus(),
                                transition.current().getCommissionAmount().toPlainString(),
                                transition.current().getOrderCurrency(),
                                event.getOrderId(),
                                attribution.click().getTrackingId());
                        return OrderOutcome.of(transition);
                    });
        });
    }

    private static BigDecimal rate(Attribution attribution, Merchant merchant) {
        BigDecimal clickRate = attribution.click().getCommissionRate();
        if (clickRate != null) return clickRate;
        if (merchant.getCommissionRate() != null) return merchant.getCommissionRate();
        log.warn("No commission rate on click {} or merchant {}; using 0",
                attribution.click().getId(), merchant.getId());
        return BigDecimal.ZERO;
    }
}
