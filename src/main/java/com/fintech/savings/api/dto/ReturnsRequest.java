package com.fintech.savings.api.dto;

import com.fintech.savings.domain.model.BonusPeriod;
import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.OverridePeriod;
import com.fintech.savings.domain.model.Transaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of {@code returns:nps} and {@code returns:index}.
 *
 * Wage is monthly; inflation is a percentage (5.5 for 5.5%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReturnsRequest {

    @NotNull
    @PositiveOrZero
    private Integer age;

    @NotNull
    @PositiveOrZero
    private BigDecimal wage;

    @NotNull
    @DecimalMin(value = "-100", inclusive = false)
    private BigDecimal inflation;

    private List<@Valid @NotNull OverridePeriod> q;
    private List<@Valid @NotNull BonusPeriod> p;
    private List<@Valid @NotNull EvaluationPeriod> k;

    @NotNull
    private List<@Valid @NotNull Transaction> transactions;
}
