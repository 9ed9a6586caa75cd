package com.github.raff.webhook.fraud;

import java.util.List;

/**
 * @param score sum of signal scores, capped at 100
 * @param hold true when the score reached the configured threshold
 */
public record RiskAssessment(List<DetectedSignal> signals, int score, boolean hold) {

    public static final RiskAssessment NONE = new RiskAssessment(List.of(), 0, false);
}
