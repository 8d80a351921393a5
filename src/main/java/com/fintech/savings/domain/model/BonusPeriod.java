package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Period "p": adds {@code extra} to the remnant of every covered transaction. Matches stack.
 */
@Value
@Builder
@Jacksonized
public class BonusPeriod implements TimeWindow {

    @NotNull
    BigDecimal extra;

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime start;

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime end;
}
