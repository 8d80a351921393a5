package com.fintech.savings.api.dto;

import com.fintech.savings.domain.model.EnrichedTransaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of {@code transactions:validator}. The wage is accepted for compatibility but unused.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidatorRequest {

    private BigDecimal wage;

    @NotNull
    private List<@Valid @NotNull EnrichedTransaction> transactions;
}
