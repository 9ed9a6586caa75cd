package com.github.raff.webhook.api.web;

import com.github.raff.webhook.api.dto.WebhookResponse;
import com.github.raff.webhook.service.WebhookIngestionService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Inbound webhook endpoint, one path per platform ({@code /webhooks/salla}, {@code /webhooks/zid}).
 * The body is taken as raw bytes so the signature is checked over exactly what was sent.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestion;

    public WebhookController(WebhookIngestionService ingestion) {
        this.ingestion = ingestion;
    }

    @PostMapping("/{platform}")
    public Mono<WebhookResponse> receive(@PathVariable String platform,
                                         @RequestBody(required = false) byte[] body,
                                         @RequestHeader HttpHeaders headers) {
        return ingestion.ingest(platform, body, headers);
    }
}
