package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.BonusPeriod;
import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.FilterResult;
import com.fintech.savings.domain.model.FilteredTransaction;
import com.fintech.savings.domain.model.InvalidTransaction;
import com.fintech.savings.domain.model.Money;
import com.fintech.savings.domain.model.OverridePeriod;
import com.fintech.savings.domain.model.PeriodSavings;
import com.fintech.savings.domain.model.ReturnsPreset;
import com.fintech.savings.domain.model.ReturnsResult;
import com.fintech.savings.domain.model.Timestamps;
import com.fintech.savings.domain.model.Transaction;
import com.fintech.savings.domain.model.TransactionKey;
import com.fintech.savings.domain.model.ValidationError;
import com.fintech.savings.domain.model.ValidationResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orchestrates the round-up savings computation for one request.
 *
 * Processing Flow:
 * 1. Enrich (ceiling, remnant)
 * 2. Validate (negative amount, duplicate) against a request-local seen set
 * 3. Apply override then bonus periods to each valid transaction
 * 4. Aggregate remnants per evaluation period
 * 5. Project returns and tax benefit per evaluation period
 *
 * Invalid transactions are surfaced by the filter and validation entry points
 * but only logged and dropped by the returns projections. A valid transaction
 * whose adjusted remnant is not positive is never an error; it is simply left
 * out of the filtered output and of every period sum, while still counting
 * towards the amount and ceiling totals.
 */
@Slf4j
@Service
public class SavingsPipeline {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final TransactionEnricher enricher;
    private final TransactionValidator validator;
    private final PeriodRuleEngine ruleEngine;
    private final ReturnsProjector projector;
    private final PipelineObserver observer;

    @Autowired
    public SavingsPipeline(TransactionEnricher enricher,
                           TransactionValidator validator,
                           PeriodRuleEngine ruleEngine,
                           ReturnsProjector projector,
                           ObjectProvider<PipelineObserver> observers) {
        this(enricher, validator, ruleEngine, projector, observers.getIfAvailable(() -> PipelineObserver.NO_OP));
    }

    public SavingsPipeline(TransactionEnricher enricher,
                           TransactionValidator validator,
                           PeriodRuleEngine ruleEngine,
                           ReturnsProjector projector,
                           PipelineObserver observer) {
        this.enricher = enricher;
        this.validator = validator;
        this.ruleEngine = ruleEngine;
        this.projector = projector;
        this.observer = observer;
    }

    public List<EnrichedTransaction> enrich(List<Transaction> transactions) {
        List<EnrichedTransaction> enriched = enricher.enrich(transactions);
        observer.transactionsEnriched(enriched.size());
        return enriched;
    }

    /**
     * Validates caller-supplied enriched transactions; ceiling and remnant are taken as given.
     */
    public ValidationResult validate(List<EnrichedTransaction> transactions) {
        Set<TransactionKey> seen = new HashSet<>();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        for (EnrichedTransaction transaction : transactions) {
            List<ValidationError> errors = validator.check(transaction, seen);
            if (errors.isEmpty()) {
                result.validTransaction(transaction);
                continue;
            }
            observer.transactionRejected(PipelineStage.VALIDATION, errors);
            result.invalidTransaction(InvalidTransaction.builder()
                    .date(transaction.getDate())
                    .amount(transaction.getAmount())
                    .ceiling(transaction.getCeiling())
                    .remnant(transaction.getRemnant())
                    .message(ValidationError.join(errors))
                    .build());
        }

        ValidationResult built = result.build();
        log.info("Validated {} transactions: {} valid, {} invalid",
                transactions.size(), built.getValid().size(), built.getInvalid().size());
        return built;
    }

    public FilterResult filterByPeriods(List<Transaction> transactions,
                                        List<OverridePeriod> overridePeriods,
                                        List<BonusPeriod> bonusPeriods,
                                        List<EvaluationPeriod> evaluationPeriods) {
        List<OverridePeriod> q = orEmpty(overridePeriods);
        List<BonusPeriod> p = orEmpty(bonusPeriods);
        List<EvaluationPeriod> k = orEmpty(evaluationPeriods);

        Set<TransactionKey> seen = new HashSet<>();
        FilterResult.FilterResultBuilder result = FilterResult.builder();

        for (EnrichedTransaction transaction : enrich(transactions)) {
            List<ValidationError> errors = validator.check(transaction, seen);
            if (!errors.isEmpty()) {
                observer.transactionRejected(PipelineStage.FILTER, errors);
                result.invalidTransaction(InvalidTransaction.builder()
                        .date(transaction.getDate())
                        .amount(transaction.getAmount())
                        .message(ValidationError.join(errors))
                        .build());
                continue;
            }

            BigDecimal remnant = ruleEngine.adjust(transaction, q, p);
            if (!Money.isPositive(remnant)) {
                log.debug("Skipped transaction {}: remnant={} <= 0", Timestamps.format(transaction.getDate()), remnant);
                observer.transactionSkipped(PipelineStage.FILTER);
                continue;
            }

            result.validTransaction(FilteredTransaction.builder()
                    .date(transaction.getDate())
                    .amount(transaction.getAmount())
                    .ceiling(transaction.getCeiling())
                    .remnant(remnant)
                    .inKPeriod(ruleEngine.inEvaluationPeriod(transaction.getDate(), k))
                    .build());
        }

        FilterResult built = result.build();
        log.info("Filtered {} transactions: {} valid, {} invalid",
                transactions.size(), built.getValid().size(), built.getInvalid().size());
        return built;
    }

    public ReturnsResult projectNpsReturns(List<Transaction> transactions,
                                           List<OverridePeriod> overridePeriods,
                                           List<BonusPeriod> bonusPeriods,
                                           List<EvaluationPeriod> evaluationPeriods,
                                           int age,
                                           BigDecimal wage,
                                           BigDecimal inflationPercent) {
        return projectReturns(transactions, overridePeriods, bonusPeriods, evaluationPeriods,
                age, wage, inflationPercent, ReturnsPreset.NPS);
    }

    public ReturnsResult projectIndexReturns(List<Transaction> transactions,
                                             List<OverridePeriod> overridePeriods,
                                             List<BonusPeriod> bonusPeriods,
                                             List<EvaluationPeriod> evaluationPeriods,
                                             int age,
                                             BigDecimal wage,
                                             BigDecimal inflationPercent) {
        return projectReturns(transactions, overridePeriods, bonusPeriods, evaluationPeriods,
                age, wage, inflationPercent, ReturnsPreset.INDEX);
    }

    /**
     * Runs the full pipeline and projects each evaluation period under {@code preset}.
     *
     * @param wage             monthly wage; annual income is twelve times this
     * @param inflationPercent inflation as a percentage (5.5 for 5.5%)
     */
    public ReturnsResult projectReturns(List<Transaction> transactions,
                                        List<OverridePeriod> overridePeriods,
                                        List<BonusPeriod> bonusPeriods,
                                        List<EvaluationPeriod> evaluationPeriods,
                                        int age,
                                        BigDecimal wage,
                                        BigDecimal inflationPercent,
                                        ReturnsPreset preset) {
        List<OverridePeriod> q = orEmpty(overridePeriods);
        List<BonusPeriod> p = orEmpty(bonusPeriods);
        List<EvaluationPeriod> k = orEmpty(evaluationPeriods);

        log.info("Calculating {} returns: age={}, wage={}, inflation={}, transactions={}, q={}, p={}, k={}",
                preset, age, wage, inflationPercent, transactions.size(), q.size(), p.size(), k.size());

        List<EnrichedTransaction> valid = retainValid(enrich(transactions));

        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalCeiling = BigDecimal.ZERO;
        List<AdjustedTransaction> investable = new ArrayList<>(valid.size());

        for (EnrichedTransaction transaction : valid) {
            totalAmount = totalAmount.add(transaction.getAmount());
            totalCeiling = totalCeiling.add(transaction.getCeiling());

            BigDecimal remnant = ruleEngine.adjust(transaction, q, p);
            if (Money.isPositive(remnant)) {
                investable.add(new AdjustedTransaction(transaction.getDate(), remnant));
            } else {
                log.debug("Skipped transaction {}: remnant={} <= 0", Timestamps.format(transaction.getDate()), remnant);
                observer.transactionSkipped(PipelineStage.RETURNS);
            }
        }

        log.info("Total transactions processed: {}, totalAmount={}, totalCeiling={}",
                investable.size(), totalAmount, totalCeiling);

        BigDecimal annualIncome = wage.multiply(MONTHS_PER_YEAR);
        BigDecimal inflation = inflationPercent.divide(Money.HUNDRED);

        ReturnsResult.ReturnsResultBuilder result = ReturnsResult.builder()
                .totalTransactionAmount(Money.round(totalAmount))
                .totalCeiling(Money.round(totalCeiling));

        for (EvaluationPeriod period : k) {
            BigDecimal periodInvestment = sumWithin(period, investable);
            log.info("Evaluation period {} to {}: investment={}",
                    Timestamps.format(period.getStart()), Timestamps.format(period.getEnd()), periodInvestment);

            PeriodSavings savings = projector.project(period, periodInvestment, age, annualIncome, inflation, preset);
            observer.periodProjected(preset);
            result.periodSavings(savings);
        }

        return result.build();
    }

    private List<EnrichedTransaction> retainValid(List<EnrichedTransaction> enriched) {
        Set<TransactionKey> seen = new HashSet<>();
        List<EnrichedTransaction> valid = new ArrayList<>(enriched.size());

        for (EnrichedTransaction transaction : enriched) {
            List<ValidationError> errors = validator.check(transaction, seen);
            if (errors.isEmpty()) {
                valid.add(transaction);
                continue;
            }
            log.warn("Skipping invalid transaction {}: {}",
                    Timestamps.format(transaction.getDate()), ValidationError.join(errors));
            observer.transactionRejected(PipelineStage.RETURNS, errors);
        }

        log.info("Valid transactions after validation: {} out of {}", valid.size(), enriched.size());
        return valid;
    }

    private static BigDecimal sumWithin(EvaluationPeriod period, List<AdjustedTransaction> transactions) {
        BigDecimal sum = BigDecimal.ZERO;
        for (AdjustedTransaction transaction : transactions) {
            if (period.contains(transaction.getDate())) {
                sum = sum.add(transaction.getRemnant());
            }
        }
        return sum;
    }

    private static <T> List<T> orEmpty(List<T> periods) {
        return periods == null ? Collections.emptyList() : periods;
    }

    @Value
    private static class AdjustedTransaction {
        LocalDateTime date;
        BigDecimal remnant;
    }
}
