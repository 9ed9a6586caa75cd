package com.github.raff.webhook.fraud;

import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.FraudSeverity;
import com.github.raff.webhook.domain.model.FraudSignalType;
import com.github.raff.webhook.domain.store.CommissionStore;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Too many commissions against one click inside the rolling window.
 * Other orders are counted from the store and this order is added once, so the
 * count is the same whether or not this event's insert lost a race.
 */
@Component
@RequiredArgsConstructor
public class HighFrequencyOrdersRule implements FraudRule {

    private final CommissionStore commissions;
    private final WebhookProperties props;

    @Override
    public Mono<DetectedSignal> evaluate(FraudContext ctx) {
        WebhookProperties.Risk risk = props.getRisk();
        Duration window = risk.getWindow();
        Instant since = ctx.now().minus(window);
        return commissions.countOthersCreatedSince(ctx.click().getId(), ctx.merchantId(), ctx.orderId(), since)
                .map(others -> others + (ctx.orderCreatedSince(since) ? 1 : 0))
                .filter(count -> count >= risk.getOrderThreshold())
                .map(count -> {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("trackingId", ctx.click().getTrackingId());
                    metadata.put("orderCount", count);
                    metadata.put("windowMinutes", window.toMinutes());
                    metadata.put("riskScore", risk.getHighFrequencyScore());
                    return new DetectedSignal(
                            FraudSignalType.HIGH_FREQUENCY_ORDERS,
                            FraudSeverity.HIGH,
                            risk.getHighFrequencyScore(),
                            "High frequency orders: " + count + " in " + window.toMinutes() + "m",
                            metadata);
                });
    }
}
