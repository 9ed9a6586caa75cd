package com.github.raff.webhook.verify;

import com.github.raff.webhook.config.WebhookProperties;
import com.github.raff.webhook.domain.model.Platform;
import com.github.raff.webhook.error.WebhookAuthenticationException;
import com.github.raff.webhook.error.WebhookConfigurationException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Webhook signature verification over the exact request bytes.
 *
 * Order of checks: deployment sanity, security-strategy header, secret presence,
 * signature header, then the configured {@link SignatureMode}. A signature that is
 * valid under a mode other than the configured one is still rejected.
 * All comparisons are constant-time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignatureVerifier {

    private static final HexFormat HEX = HexFormat.of();

    private final WebhookProperties props;

  /* ===========================
     Public API
     =========================== */

    /**
     * Accepts the request or throws.
     *
     * @throws WebhookConfigurationException production misconfiguration (500)
     * @throws WebhookAuthenticationException bad strategy, missing or invalid signature (401)
     */
    public void verify(Platform platform, byte[] body, HttpHeaders headers) {
        if (props.isProduction() && props.isAllowUnsigned()) {
            log.error("allow-unsigned is enabled in production; refusing {} webhook", platform.path());
            throw new WebhookConfigurationException("Webhook security misconfigured");
        }

        WebhookProperties.Endpoint cfg = props.endpoint(platform);
        if (!cfg.hasSecret() && props.isProduction()) {
            log.error("{} webhook secret missing in production", platform.path());
            throw new WebhookConfigurationException("Webhook not configured");
        }

        checkStrategy(platform, cfg, headers);

        if (!cfg.hasSecret()) {
            if (props.isAllowUnsigned()) {
                log.warn("{} webhook secret missing; accepting unsigned delivery (allow-unsigned)", platform.path());
                return;
            }
            log.warn("{} webhook secret missing; rejecting delivery", platform.path());
            throw new WebhookAuthenticationException("Webhook secret not configured");
        }

        String raw = headers.getFirst(cfg.getSignatureHeader());
        if (raw == null || raw.isBlank()) {
            log.warn("Missing {} signature header '{}'", platform.path(), cfg.getSignatureHeader());
            throw new WebhookAuthenticationException("Missing signature");
        }

        byte[] payload = body == null ? new byte[0] : body;
        if (props.isDebug()) {
            log.debug("[{}] signature header length={} prefix={} body length={}",
                    platform.path(), raw.trim().length(),
                    cfg.getSignatureMode() == SignatureMode.PLAIN ? "<redacted>" : safePrefix(raw.trim()),
                    payload.length);
        }

        if (matches(cfg.getSignatureMode(), cfg.getSha256Order(), cfg.getSecret(), payload, raw)) {
            return;
        }
        if (matchesAnyOtherMode(cfg, payload, raw)) {
            log.warn("{} signature matched a mode other than configured {}", platform.path(), cfg.getSignatureMode());
            throw new WebhookAuthenticationException("Invalid signature mode");
        }
        log.warn("{} webhook signature verification failed", platform.path());
        throw new WebhookAuthenticationException("Invalid signature");
    }

    /** True when {@code header} is a valid signature of {@code body} under exactly this mode. */
    public static boolean matches(SignatureMode mode, Sha256Order order, String secret, byte[] body, String header) {
        if (secret == null || header == null) return false;
        return switch (mode) {
            case PLAIN -> {
                String expected = secret.trim();
                String provided = header.trim();
                yield constantTimeEquals(provided, expected) || constantTimeEquals(normalizeHex(provided), expected);
            }
            case HMAC_SHA256 -> constantTimeEquals(normalizeHex(header), hmacSha256Hex(secret, body));
            case SHA256 -> constantTimeEquals(normalizeHex(header), sha256Hex(secret, body, order));
        };
    }

    /** Hex signature for the given mode; used by tests and platform simulators. */
    public static String sign(SignatureMode mode, Sha256Order order, String secret, byte[] body) {
        return switch (mode) {
            case PLAIN -> secret;
            case HMAC_SHA256 -> hmacSha256Hex(secret, body);
            case SHA256 -> sha256Hex(secret, body, order);
        };
    }

  /* ===========================
     Helpers
     =========================== */

    private void checkStrategy(Platform platform, WebhookProperties.Endpoint cfg, HttpHeaders headers) {
        String expected = cfg.getExpectedStrategy();
        if (expected == null || expected.isBlank()) return;
        String actual = cfg.getStrategyHeader() == null ? null : headers.getFirst(cfg.getStrategyHeader());
        if (actual == null || !expected.trim().equalsIgnoreCase(actual.trim())) {
            log.warn("{} webhook security strategy mismatch (got '{}')", platform.path(), actual);
            throw new WebhookAuthenticationException("Invalid security strategy");
        }
    }

    private static boolean matchesAnyOtherMode(WebhookProperties.Endpoint cfg, byte[] body, String header) {
        for (SignatureMode mode : SignatureMode.values()) {
            if (mode == cfg.getSignatureMode()) continue;
            if (mode == SignatureMode.SHA256) {
                for (Sha256Order order : Sha256Order.values()) {
                    if (matches(mode, order, cfg.getSecret(), body, header)) return true;
                }
            } else if (matches(mode, cfg.getSha256Order(), cfg.getSecret(), body, header)) {
                return true;
            }
        }
        return false;
    }

    /** "sha256=ABC" -> "abc"; a bare value is trimmed and lower-cased. */
    static String normalizeHex(String header) {
        String trimmed = header.trim();
        int eq = trimmed.indexOf('=');
        String candidate = (eq >= 0 && eq == trimmed.lastIndexOf('=')) ? trimmed.substring(eq + 1) : trimmed;
        return candidate.trim().toLowerCase(Locale.ROOT);
    }

    private static String hmacSha256Hex(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HEX.formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static String sha256Hex(String secret, byte[] body, Sha256Order order) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] key = secret.getBytes(StandardCharsets.UTF_8);
            if (order == Sha256Order.BODY_FIRST) {
                md.update(body);
                md.update(key);
            } else {
                md.update(key);
                md.update(body);
            }
            return HEX.formatHex(md.digest());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static String safePrefix(String value) {
        return value.length() <= 12 ? value : value.substring(0, 12) + "...";
    }
}
