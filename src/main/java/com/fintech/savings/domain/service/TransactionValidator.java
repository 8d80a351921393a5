package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.TransactionKey;
import com.fintech.savings.domain.model.ValidationError;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Negative-amount and duplicate detection.
 *
 * Duplicate detection is keyed on (date, amount) against a set of keys already
 * accepted in the same request. The set is owned by the caller and threaded
 * through explicitly; nothing is remembered between requests.
 *
 * Rules:
 * - amount &lt; 0 yields {@link ValidationError#NEGATIVE_AMOUNT}
 * - key already seen yields {@link ValidationError#DUPLICATE}
 * - both checks always run, in that order
 * - only error-free transactions are added to the seen set
 */
@Service
public class TransactionValidator {

    public List<ValidationError> errorsFor(BigDecimal amount, TransactionKey key, Set<TransactionKey> seen) {
        List<ValidationError> errors = new ArrayList<>(2);
        if (amount.signum() < 0) {
            errors.add(ValidationError.NEGATIVE_AMOUNT);
        }
        if (seen.contains(key)) {
            errors.add(ValidationError.DUPLICATE);
        }
        return errors;
    }

    /**
     * Checks one transaction and records its key in {@code seen} when it passes.
     *
     * @return the errors found, empty when the transaction is valid
     */
    public List<ValidationError> check(EnrichedTransaction transaction, Set<TransactionKey> seen) {
        TransactionKey key = transaction.key();
        List<ValidationError> errors = errorsFor(transaction.getAmount(), key, seen);
        if (errors.isEmpty()) {
            seen.add(key);
        }
        return errors;
    }
}
