package com.github.raff.webhook.normalize;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies upstream payment/order status strings. Both platforms share one
 * vocabulary table; spellings drift ("canceled"/"cancelled", "delivered"/"completed").
 */
public final class OrderStatusClassifier {

    private static final Set<String> PAID_PAYMENT = Set.of(
            "paid", "completed", "success", "successful", "confirmed", "approved");

    private static final Set<String> DELIVERED_ORDER = Set.of(
            "delivered", "completed", "complete", "fulfilled");

    private static final Set<String> CANCELLED_PAYMENT = Set.of(
            "refunded", "refund", "voided", "void", "canceled", "cancelled", "cancel");

    private static final Set<String> CANCELLED_ORDER = Set.of(
            "refunded", "refund", "voided", "void", "canceled", "cancelled", "cancel", "rejected");

    private OrderStatusClassifier() {
    }

    public static boolean isPaymentConfirmed(String paymentStatus, String orderStatus) {
        return in(PAID_PAYMENT, paymentStatus) || in(DELIVERED_ORDER, orderStatus);
    }

    public static boolean isOrderCancelled(String paymentStatus, String orderStatus) {
        return in(CANCELLED_PAYMENT, paymentStatus) || in(CANCELLED_ORDER, orderStatus);
    }

    /** Trimmed lower-case status, or null when blank. */
    public static String normalize(String status) {
        if (status == null) return null;
        String trimmed = status.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    private static boolean in(Set<String> vocabulary, String status) {
        String s = normalize(status);
        return s != null && vocabulary.contains(s);
    }
}
