package com.github.raff.webhook.domain.model;

public enum FraudSignalType {
    HIGH_FREQUENCY_ORDERS
}
