package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * Period "k": membership filter and aggregation bucket for a returns projection.
 *
 * Expected to lie within one calendar year; not enforced here.
 */
@Value
@Builder
@Jacksonized
public class EvaluationPeriod implements TimeWindow {

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime start;

    @NotNull
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime end;
}
