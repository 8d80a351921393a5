package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.TransactionKey;
import com.fintech.savings.domain.model.ValidationError;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransactionValidatorTest {

    private final TransactionValidator validator = new TransactionValidator();

    private static final LocalDateTime DATE = LocalDateTime.of(2023, 10, 12, 20, 15, 30);

    @Test
    void check_firstOccurrence_isValidAndRemembered() {
        Set<TransactionKey> seen = new HashSet<>();

        List<ValidationError> errors = validator.check(enriched("250"), seen);

        assertTrue(errors.isEmpty());
        assertTrue(seen.contains(TransactionKey.of(DATE, new BigDecimal("250"))));
    }

    @Test
    void check_sameDateAndAmount_isDuplicate() {
        Set<TransactionKey> seen = new HashSet<>();
        validator.check(enriched("250"), seen);

        List<ValidationError> errors = validator.check(enriched("250.00"), seen);

        assertEquals(List.of(ValidationError.DUPLICATE), errors);
    }

    @Test
    void check_sameDateDifferentAmount_isNotDuplicate() {
        Set<TransactionKey> seen = new HashSet<>();
        validator.check(enriched("250"), seen);

        assertTrue(validator.check(enriched("251"), seen).isEmpty());
    }

    @Test
    void check_negativeAmount_isRejectedAndNotRemembered() {
        Set<TransactionKey> seen = new HashSet<>();

        assertEquals(List.of(ValidationError.NEGATIVE_AMOUNT), validator.check(enriched("-10"), seen));
        assertEquals(List.of(ValidationError.NEGATIVE_AMOUNT), validator.check(enriched("-10"), seen));
        assertTrue(seen.isEmpty());
    }

    @Test
    void errorsFor_reportsBothInFixedOrder() {
        Set<TransactionKey> seen = new HashSet<>();
        TransactionKey key = TransactionKey.of(DATE, new BigDecimal("-10"));
        seen.add(key);

        List<ValidationError> errors = validator.errorsFor(new BigDecimal("-10"), key, seen);

        assertEquals(List.of(ValidationError.NEGATIVE_AMOUNT, ValidationError.DUPLICATE), errors);
        assertEquals("Negative amounts are not allowed; Duplicate transaction", ValidationError.join(errors));
    }

    private EnrichedTransaction enriched(String amount) {
        return EnrichedTransaction.builder()
                .date(DATE)
                .amount(new BigDecimal(amount))
                .ceiling(BigDecimal.ZERO)
                .remnant(BigDecimal.ZERO)
                .build();
    }
}
