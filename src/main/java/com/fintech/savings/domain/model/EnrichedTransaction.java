package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Transaction with its ceiling (next multiple of 100) and remnant (ceiling minus amount).
 */
@Value
@Builder
@Jacksonized
public class EnrichedTransaction {

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime date;

    @NotNull
    BigDecimal amount;

    BigDecimal ceiling;

    // older clients send the misspelt "remanent"
    @JsonAlias("remanent")
    BigDecimal remnant;

    public TransactionKey key() {
        return TransactionKey.of(date, amount);
    }
}
