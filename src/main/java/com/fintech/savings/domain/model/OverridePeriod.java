package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Period "q": replaces the remnant of every covered transaction with {@code fixed}.
 */
@Value
@Builder
@Jacksonized
public class OverridePeriod implements TimeWindow {

    @NotNull
    BigDecimal fixed;

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime start;

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime end;
}
