package com.fintech.savings.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationResult {

    @Singular("validTransaction")
    List<EnrichedTransaction> valid;

    @Singular("invalidTransaction")
    List<InvalidTransaction> invalid;
}
