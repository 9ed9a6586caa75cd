package com.github.raff.webhook.domain.model;

public enum FraudSeverity {
    LOW,
    MEDIUM,
    HIGH
}
