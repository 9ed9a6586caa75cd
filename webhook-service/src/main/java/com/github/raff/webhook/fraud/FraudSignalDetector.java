package com.github.raff.webhook.fraud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Commission;
import com.github.raff.webhook.domain.model.FraudSignal;
import com.github.raff.webhook.domain.store.FraudSignalStore;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Scores an order event with the registered {@link FraudRule}s and records the
 * resulting signals once the commission row exists. Disabled unless
 * {@code webhook.risk.enabled} is set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudSignalDetector {

    static final int MAX_SCORE = 100;

    private final List<FraudRule> rules;
    private final FraudSignalStore store;
    private final WebhookProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Mono<RiskAssessment> assess(FraudContext context) {
        if (!props.getRisk().isEnabled()) {
            return Mono.just(RiskAssessment.NONE);
        }
        return Flux.fromIterable(rules)
                .concatMap(rule -> rule.evaluate(context))
                .collectList()
                .map(signals -> {
                    int score = Math.min(MAX_SCORE, signals.stream().mapToInt(DetectedSignal::score).sum());
                    boolean hold = score >= props.getRisk().getScoreThreshold();
                    if (!signals.isEmpty()) {
                        log.warn("Risk score {} for order {} click {} (hold={})", score, context.orderId(),
                                context.click().getTrackingId(), hold);
                    }
                    return new RiskAssessment(List.copyOf(signals), score, hold);
                });
    }

    /**
     * Persist signals for a held commission, at most once per (commission, signal type).
     *
     * @return number of newly inserted rows
     */
    public Mono<Long> record(Commission commission, RiskAssessment risk) {
        if (!risk.hold() || risk.signals().isEmpty()) {
            return Mono.just(0L);
        }
        return Flux.fromIterable(risk.signals())
                .concatMap(signal -> store.insertIfAbsent(toRow(commission, signal)))
                .filter(Boolean::booleanValue)
                .count();
    }

    private FraudSignal toRow(Commission commission, DetectedSignal signal) {
        return FraudSignal.builder()
                .clickTrackingId(commission.getClickTrackingId())
                .commissionId(commission.getId())
                .merchantId(commission.getMerchantId())
                .orderId(commission.getOrderId())
                .signalType(signal.type())
                .severity(signal.severity())
                .score(signal.score())
                .reason(signal.reason())
                .metadata(json(signal))
                .createdAt(clock.instant())
                .build();
    }

    private String json(DetectedSignal signal) {
        try {
            return objectMapper.writeValueAsString(signal.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fraud metadata", e);
        }
    }
}
