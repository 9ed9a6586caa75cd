package com.github.raff.webhook.fraud;

import com.github.raff.webhook.domain.model.FraudSeverity;
import com.github.raff.webhook.domain.model.FraudSignalType;
import java.util.Map;

public record DetectedSignal(FraudSignalType type, FraudSeverity severity, int score, String reason,
                             Map<String, Object> metadata) {
}
