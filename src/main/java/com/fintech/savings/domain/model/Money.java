package com.fintech.savings.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary constants and the emission rounding rule.
 *
 * Amounts are accumulated at full precision and only rounded when a result is built.
 */
public final class Money {

    public static final int EMISSION_SCALE = 2;

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(EMISSION_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount.signum() > 0;
    }
}
