package com.github.raff.webhook.config;

import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.verify.Sha256Order;
import com.github.raff.webhook.verify.SignatureMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Unified configuration for webhook ingestion.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    /** Production deployment: a missing secret is a 500, never an unsigned pass. */
    private boolean production = false;

    /** Development escape hatch for platforms without a configured secret. Invalid in production. */
    private boolean allowUnsigned = false;

    /** Verbose signature diagnostics (lengths and short prefixes only). */
    private boolean debug = false;

    /** Deadline for handling one delivery, shorter than the platforms' own retry timeout. */
    @NotNull
    private Duration processingTimeout = Duration.ofSeconds(8);

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Endpoint salla = Endpoint.salla();

    @Valid
    private Endpoint zid = Endpoint.zid();

    @Valid
    private Attribution attribution = new Attribution();

    @Valid
    private Risk risk = new Risk();

    @Valid
    private AppInstall appInstall = new AppInstall();

    public Endpoint endpoint(Platform platform) {
        return switch (platform) {
            case SALLA -> salla;
            case ZID -> zid;
        };
    }

  /* ===========================
     Sub-sections
     =========================== */

    @Getter @Setter
    @Validated
    public static class Ledger {
        /** A RECEIVED row older than this is treated as abandoned and may be re-claimed. */
        @NotNull
        private Duration reclaimAfter = Duration.ofMinutes(2);
    }

    @Getter @Setter
    @ToString
    @Validated
    public static class Endpoint {
        /** Shared webhook secret. Keep redacted from toString. */
        @ToString.Exclude
        private String secret;

        @NotBlank
        private String signatureHeader;

        @NotNull
        private SignatureMode signatureMode = SignatureMode.HMAC_SHA256;

        @NotNull
        private Sha256Order sha256Order = Sha256Order.SECRET_FIRST;

        /** Headers that may carry the platform's own delivery id, first present wins. */
        private List<String> deliveryIdHeaders = new ArrayList<>();

        /** Optional header that must equal {@link #expectedStrategy} before the signature is checked. */
        private String strategyHeader;

        private String expectedStrategy;

        public boolean hasSecret() {
            return secret != null && !secret.isBlank();
        }

        static Endpoint salla() {
            Endpoint e = new Endpoint();
            e.setSignatureHeader("x-salla-signature");
            e.setSignatureMode(SignatureMode.HMAC_SHA256);
            e.setDeliveryIdHeaders(new ArrayList<>(List.of("x-salla-event-id", "x-webhook-id")));
            e.setStrategyHeader("x-salla-security-strategy");
            return e;
        }

        static Endpoint zid() {
            Endpoint e = new Endpoint();
            e.setSignatureHeader("x-zid-signature");
            e.setSignatureMode(SignatureMode.PLAIN);
            e.setDeliveryIdHeaders(new ArrayList<>(List.of("x-zid-webhook-id", "x-webhook-id")));
            return e;
        }
    }

    @Getter @Setter
    @Validated
    public static class Attribution {
        /** Referrer codes not matching this are treated as organic orders. */
        @NotBlank
        private String referrerPattern = "(?i)^(raff[-_:]|click_)[a-z0-9_:-]{1,120}$";

        /** Currency assumed when a payload carries none. */
        @NotBlank
        private String defaultCurrency = "SAR";
    }

    @Getter @Setter
    @Validated
    public static class Risk {
        private boolean enabled = false;

        /** Aggregate score at or above which a commission is put on hold. */
        @Min(0) @Max(100)
        private int scoreThreshold = 70;

        @NotNull
        private Duration window = Duration.ofMinutes(10);

        /** Commissions per click inside the window that trigger the high-frequency rule. */
        @Min(1)
        private int orderThreshold = 3;

        @Min(0) @Max(100)
        private int highFrequencyScore = 70;
    }

    @Getter @Setter
    @Validated
    public static class AppInstall {
        /** Skip store-info sync when the merchant row changed more recently than this. */
        @NotNull
        private Duration resyncCooldown = Duration.ofMinutes(5);
    }
}
