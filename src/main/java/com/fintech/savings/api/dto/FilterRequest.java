package com.fintech.savings.api.dto;

import com.fintech.savings.domain.model.BonusPeriod;
import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.OverridePeriod;
import com.fintech.savings.domain.model.Transaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code transactions:filter}. Missing period lists are treated as empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterRequest {

    private List<@Valid @NotNull OverridePeriod> q;
    private List<@Valid @NotNull BonusPeriod> p;
    private List<@Valid @NotNull EvaluationPeriod> k;

    @NotNull
    private List<@Valid @NotNull Transaction> transactions;
}
