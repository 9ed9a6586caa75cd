package com.github.raff.webhook.fraud;

import reactor.core.publisher.Mono;

/** One risk heuristic. Runs synchronously in the request path, so keep it to one bounded query. */
public interface FraudRule {

    /** The signal raised for this event, or empty. */
    Mono<DetectedSignal> evaluate(FraudContext context);
}
