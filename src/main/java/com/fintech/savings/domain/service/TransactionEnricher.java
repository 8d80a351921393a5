package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.Money;
import com.fintech.savings.domain.model.Timestamps;
import com.fintech.savings.domain.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rounds each transaction up to the next multiple of 100.
 *
 * The round-up amount (remnant) is what gets invested. An amount that is already
 * a multiple of 100 has a remnant of zero. Negative amounts are enriched with the
 * same arithmetic and rejected later by {@link TransactionValidator}.
 */
@Slf4j
@Service
public class TransactionEnricher {

    public EnrichedTransaction enrich(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction must not be null");

        BigDecimal amount = transaction.getAmount();
        BigDecimal ceiling = ceilingOf(amount);
        BigDecimal remnant = ceiling.subtract(amount);

        log.debug("Transaction {}: amount={}, ceiling={}, remnant={}",
                Timestamps.format(transaction.getDate()), amount, ceiling, remnant);

        return EnrichedTransaction.builder()
                .date(transaction.getDate())
                .amount(amount)
                .ceiling(ceiling)
                .remnant(remnant)
                .build();
    }

    public List<EnrichedTransaction> enrich(List<Transaction> transactions) {
        log.info("Enriching {} transactions", transactions.size());

        List<EnrichedTransaction> enriched = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            enriched.add(enrich(transaction));
        }

        log.info("Enriched {} transactions successfully", enriched.size());
        return enriched;
    }

    static BigDecimal ceilingOf(BigDecimal amount) {
        return amount.divide(Money.HUNDRED, 0, RoundingMode.CEILING).multiply(Money.HUNDRED);
    }
}
