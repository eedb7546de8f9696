package com.evfinder.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rules for ledger amounts: two decimals, half-up.
 */
public final class Money {

    public static final int SCALE = 2;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    public static BigDecimal of(double amount) {
        return BigDecimal.valueOf(amount).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** stake * odds, rounded. */
    public static BigDecimal payout(BigDecimal stake, double odds) {
        return round(stake.multiply(BigDecimal.valueOf(odds)));
    }
}
