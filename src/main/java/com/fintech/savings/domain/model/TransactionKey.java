package com.fintech.savings.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Identity of a transaction for duplicate detection.
 *
 * The amount is normalised so that {@code 950} and {@code 950.00} compare equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionKey {

    LocalDateTime date;
    BigDecimal amount;

    public static TransactionKey of(LocalDateTime date, BigDecimal amount) {
        return new TransactionKey(date, amount.stripTrailingZeros());
    }
}
