package com.github.raff.webhook.audit;

import reactor.core.publisher.Mono;

/** Audit trail of handled order webhooks. Callers do not wait on or fail because of it. */
public interface WebhookAuditSink {

    Mono<Void> record(ProcessedWebhookRecord record);
}
