package com.fintech.savings.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Totals over every valid transaction plus one entry per evaluation period, in request order.
 */
@Value
@Builder
public class ReturnsResult {

    BigDecimal totalTransactionAmount;
    BigDecimal totalCeiling;

    @Singular("periodSavings")
    List<PeriodSavings> savingsByDates;
}
