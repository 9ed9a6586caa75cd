package com.github.raff.webhook.commission;

import com.github.raff.common.money.Money;
import java.math.BigDecimal;

/** Monetary terms of an order as observed in the latest event. */
public record OrderTerms(String merchantId, String orderId, Money total, BigDecimal rate, Money amount) {

    /** Commission amount = total x rate / 100, rounded HALF_UP to the currency's minor unit. */
    public static OrderTerms of(String merchantId, String orderId, Money total, BigDecimal rate) {
        return new OrderTerms(merchantId, orderId, total, rate, total.percent(rate));
    }
}
