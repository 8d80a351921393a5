package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raw ledger entry as supplied by the caller.
 *
 * Two transactions with the same date and amount share a {@link TransactionKey}
 * and are treated as duplicates.
 */
@Value
@Builder
@Jacksonized
public class Transaction {

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime date;

    @NotNull
    BigDecimal amount;

    public TransactionKey key() {
        return TransactionKey.of(date, amount);
    }
}
