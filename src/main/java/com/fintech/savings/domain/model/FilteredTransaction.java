package com.fintech.savings.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Valid transaction after override and bonus adjustment, flagged with evaluation-period membership.
 */
@Value
@Builder
public class FilteredTransaction {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = Timestamps.PATTERN)
    LocalDateTime date;

    BigDecimal amount;
    BigDecimal ceiling;
    BigDecimal remnant;

    @JsonProperty("inKPeriod")
    boolean inKPeriod;
}
