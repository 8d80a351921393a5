package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Projection for one evaluation period. Monetary fields are already rounded for emission.
 */
@Value
@Builder
public class PeriodSavings {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime start;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime end;

    BigDecimal amount;
    BigDecimal profits;
    BigDecimal taxBenefit;
}
