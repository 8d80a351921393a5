package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Rejected transaction with its joined error message.
 *
 * Ceiling and remnant are only present where the caller supplied them (validation endpoint).
 */
@Value
@Builder
public class InvalidTransaction {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime date;

    BigDecimal amount;
    BigDecimal ceiling;
    BigDecimal remnant;
    String message;
}
