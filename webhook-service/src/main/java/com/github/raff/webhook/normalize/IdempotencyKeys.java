package com.github.raff.webhook.normalize;

import com.github.raff.webhook.domain.model.Platform;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived keys. Wrapper metadata (delivery ids, timestamps) never takes part,
 * so a redelivery of the same logical event hashes to the same key.
 */
public final class IdempotencyKeys {

    private static final String UNKNOWN = "unknown";

    private IdempotencyKeys() {
    }

    /** Order events: platform|store|event|order|paymentStatus|orderStatus. */
    public static String orderEvent(Platform platform, String storeId, String eventType, String orderId,
                                    String paymentStatus, String orderStatus) {
        return sha256Hex(String.join("|",
                platform.path(),
                storeId,
                eventType,
                orderId,
                orElseUnknown(OrderStatusClassifier.normalize(paymentStatus)),
                orElseUnknown(OrderStatusClassifier.normalize(orderStatus))));
    }

    /**
     * Non-order events: platform|store|event|sha256(body). Only byte-identical redeliveries
     * collapse; a later product update with new content is a new event.
     */
    public static String lifecycleEvent(Platform platform, String storeId, String eventType, byte[] body) {
        return sha256Hex(String.join("|", platform.path(), orElseUnknown(storeId), eventType,
                sha256Hex(body == null ? new byte[0] : body)));
    }

    /** Stable per-order key: sha256("platform:store:order"). */
    public static String orderKey(Platform platform, String storeId, String orderId) {
        return sha256Hex(platform.path() + ":" + storeId + ":" + orderId);
    }

    public static String sha256Hex(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    private static String orElseUnknown(String value) {
        return (value == null || value.isBlank()) ? UNKNOWN : value;
    }
}
