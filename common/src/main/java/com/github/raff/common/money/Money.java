package com.github.raff.common.money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Objects;

/**
 * Decimal amount in an ISO-4217 currency, scaled to the currency's minor unit.
 */
public record Money(String currency, BigDecimal amount) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Money {
        currency = normalizeCurrency(currency);
        Objects.requireNonNull(amount, "amount");
        amount = amount.setScale(fractionDigits(currency), RoundingMode.HALF_UP);
    }

    public static Money of(String currency, BigDecimal amount) {
        return new Money(currency, amount);
    }

    /** {@code rate} percent of this amount, e.g. 10 -> one tenth. Rounded once, HALF_UP, to the minor unit. */
    public Money percent(BigDecimal rate) {
        Objects.requireNonNull(rate, "rate");
        BigDecimal value = amount.multiply(rate).divide(HUNDRED, fractionDigits(currency), RoundingMode.HALF_UP);
        return new Money(currency, value);
    }

    /** Upper-cases and validates an ISO-4217 code; throws for unknown codes. */
    public static String normalizeCurrency(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("currency must not be blank");
        }
        String cur = code.trim().toUpperCase();
        try {
            Currency.getInstance(cur);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid ISO currency code: " + cur, e);
        }
        return cur;
    }

    private static int fractionDigits(String currency) {
        return Math.max(0, Currency.getInstance(currency).getDefaultFractionDigits()); // JPY = 0
    }
}
