package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.BonusPeriod;
import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.FilterResult;
import com.fintech.savings.domain.model.FilteredTransaction;
import com.fintech.savings.domain.model.OverridePeriod;
import com.fintech.savings.domain.model.PeriodSavings;
import com.fintech.savings.domain.model.ReturnsPreset;
import com.fintech.savings.domain.model.ReturnsResult;
import com.fintech.savings.domain.model.Timestamps;
import com.fintech.savings.domain.model.Transaction;
import com.fintech.savings.domain.model.ValidationError;
import com.fintech.savings.domain.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SavingsPipelineTest {

    @Mock private PipelineObserver observer;

    private SavingsPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new SavingsPipeline(
                new TransactionEnricher(),
                new TransactionValidator(),
                new PeriodRuleEngine(),
                new ReturnsProjector(),
                observer
        );
    }

    @Test
    void filterByPeriods_noPeriods_keepsEnrichedRemnant() {
        FilterResult result = pipeline.filterByPeriods(
                List.of(transaction("2024-01-15 00:00:00", "950")), null, null, null);

        assertEquals(1, result.getValid().size());
        assertTrue(result.getInvalid().isEmpty());

        FilteredTransaction valid = result.getValid().get(0);
        assertThat(valid.getCeiling()).isEqualByComparingTo("1000");
        assertThat(valid.getRemnant()).isEqualByComparingTo("50");
        assertFalse(valid.isInKPeriod());
        verify(observer).transactionsEnriched(1);
    }

    @Test
    void filterByPeriods_duplicate_secondIsInvalid() {
        FilterResult result = pipeline.filterByPeriods(List.of(
                transaction("2023-10-12 20:15:30", "250"),
                transaction("2023-10-12 20:15:30", "250")), List.of(), List.of(), List.of());

        assertEquals(1, result.getValid().size());
        assertEquals(1, result.getInvalid().size());
        assertEquals("Duplicate transaction", result.getInvalid().get(0).getMessage());
        assertNull(result.getInvalid().get(0).getRemnant());
        verify(observer).transactionRejected(PipelineStage.FILTER, List.of(ValidationError.DUPLICATE));
    }

    @Test
    void filterByPeriods_negativeAmount_isInvalid() {
        FilterResult result = pipeline.filterByPeriods(List.of(
                transaction("2023-10-12 20:15:30", "-250")), List.of(), List.of(), List.of());

        assertTrue(result.getValid().isEmpty());
        assertEquals("Negative amounts are not allowed", result.getInvalid().get(0).getMessage());
    }

    @Test
    void filterByPeriods_nonPositiveRemnant_isSilentlyExcluded() {
        FilterResult result = pipeline.filterByPeriods(List.of(
                transaction("2023-07-10 09:00:00", "1000"),
                transaction("2023-07-11 09:00:00", "620")),
                List.of(override("0", "2023-07-11 00:00:00", "2023-07-31 23:59:59")),
                List.of(),
                List.of());

        assertTrue(result.getValid().isEmpty());
        assertTrue(result.getInvalid().isEmpty());
        verify(observer, times(2)).transactionSkipped(PipelineStage.FILTER);
        verify(observer, never()).transactionRejected(any(), anyList());
    }

    @Test
    void filterByPeriods_flagsEvaluationMembershipWithAdjustedRemnant() {
        FilterResult result = pipeline.filterByPeriods(List.of(
                transaction("2023-10-12 20:15:30", "250"),
                transaction("2023-02-28 15:49:20", "375")),
                List.of(),
                List.of(bonus("25", "2023-10-01 08:00:00", "2023-12-31 19:59:59")),
                List.of(evaluation("2023-10-01 00:00:00", "2023-10-31 23:59:59")));

        assertEquals(2, result.getValid().size());
        assertThat(result.getValid().get(0).getRemnant()).isEqualByComparingTo("75");
        assertTrue(result.getValid().get(0).isInKPeriod());
        assertThat(result.getValid().get(1).getRemnant()).isEqualByComparingTo("25");
        assertFalse(result.getValid().get(1).isInKPeriod());
    }

    @Test
    void validate_surfacesInvalidWithSuppliedFields() {
        EnrichedTransaction first = EnrichedTransaction.builder()
                .date(Timestamps.parse("2023-01-01 10:00:00"))
                .amount(new BigDecimal("120"))
                .ceiling(new BigDecimal("200"))
                .remnant(new BigDecimal("80"))
                .build();

        ValidationResult result = pipeline.validate(List.of(first, first));

        assertEquals(List.of(first), result.getValid());
        assertEquals(1, result.getInvalid().size());
        assertThat(result.getInvalid().get(0).getRemnant()).isEqualByComparingTo("80");
        assertEquals("Duplicate transaction", result.getInvalid().get(0).getMessage());
        verify(observer).transactionRejected(PipelineStage.VALIDATION, List.of(ValidationError.DUPLICATE));
    }

    @Test
    void projectNpsReturns_aggregatesPerEvaluationPeriod() {
        ReturnsResult result = pipeline.projectNpsReturns(
                ledger(), overrides(), bonuses(), evaluations(), 29, new BigDecimal("50000"), new BigDecimal("5.5"));

        assertEquals(new BigDecimal("1725.00"), result.getTotalTransactionAmount());
        assertEquals(new BigDecimal("1900.00"), result.getTotalCeiling());
        assertEquals(2, result.getSavingsByDates().size());

        PeriodSavings marchToNovember = result.getSavingsByDates().get(0);
        assertEquals(Timestamps.parse("2023-03-01 00:00:00"), marchToNovember.getStart());
        assertEquals(new BigDecimal("75.00"), marchToNovember.getAmount());
        assertEquals(new BigDecimal("44.94"), marchToNovember.getProfits());

        PeriodSavings wholeYear = result.getSavingsByDates().get(1);
        assertEquals(new BigDecimal("145.00"), wholeYear.getAmount());
        assertEquals(new BigDecimal("86.88"), wholeYear.getProfits());
        assertEquals(new BigDecimal("0.00"), wholeYear.getTaxBenefit());

        verify(observer, times(2)).periodProjected(ReturnsPreset.NPS);
    }

    @Test
    void projectIndexReturns_usesIndexRate() {
        ReturnsResult result = pipeline.projectIndexReturns(
                ledger(), overrides(), bonuses(), evaluations(), 29, new BigDecimal("50000"), new BigDecimal("5.5"));

        assertEquals(new BigDecimal("871.30"), result.getSavingsByDates().get(0).getProfits());
        assertEquals(new BigDecimal("1684.51"), result.getSavingsByDates().get(1).getProfits());
    }

    @Test
    void projectReturns_dropsInvalidFromTotals() {
        List<Transaction> withInvalid = new ArrayList<>(ledger());
        withInvalid.add(transaction("2023-10-12 20:15:30", "250"));
        withInvalid.add(transaction("2023-11-01 10:00:00", "-40"));

        ReturnsResult result = pipeline.projectReturns(
                withInvalid, overrides(), bonuses(), evaluations(), 29,
                new BigDecimal("50000"), new BigDecimal("5.5"), ReturnsPreset.NPS);

        assertEquals(new BigDecimal("1725.00"), result.getTotalTransactionAmount());
        assertEquals(new BigDecimal("145.00"), result.getSavingsByDates().get(1).getAmount());
        verify(observer).transactionRejected(PipelineStage.RETURNS, List.of(ValidationError.DUPLICATE));
        verify(observer).transactionRejected(PipelineStage.RETURNS, List.of(ValidationError.NEGATIVE_AMOUNT));
    }

    @Test
    void projectReturns_taxBenefitForTaxableIncome() {
        ReturnsResult result = pipeline.projectReturns(
                List.of(transaction("2023-05-05 10:00:00", "1")),
                List.of(override("50000", "2023-05-01 00:00:00", "2023-05-31 23:59:59")),
                List.of(),
                List.of(evaluation("2023-01-01 00:00:00", "2023-12-31 23:59:59")),
                59, new BigDecimal("100000"), BigDecimal.ZERO, ReturnsPreset.NPS);

        PeriodSavings savings = result.getSavingsByDates().get(0);
        assertEquals(new BigDecimal("50000.00"), savings.getAmount());
        assertEquals(new BigDecimal("7500.00"), savings.getTaxBenefit());
    }

    @Test
    void projectReturns_noEvaluationPeriods_onlyTotals() {
        ReturnsResult result = pipeline.projectReturns(
                ledger(), null, null, null, 30, new BigDecimal("50000"), new BigDecimal("5.5"), ReturnsPreset.INDEX);

        assertEquals(new BigDecimal("1900.00"), result.getTotalCeiling());
        assertTrue(result.getSavingsByDates().isEmpty());
        verify(observer, never()).periodProjected(any());
    }

    @Test
    void projectReturns_withNoOpObserver_computesSameResult() {
        SavingsPipeline unobserved = new SavingsPipeline(
                new TransactionEnricher(),
                new TransactionValidator(),
                new PeriodRuleEngine(),
                new ReturnsProjector(),
                PipelineObserver.NO_OP
        );

        ReturnsResult result = unobserved.projectNpsReturns(
                ledger(), overrides(), bonuses(), evaluations(), 29, new BigDecimal("50000"), new BigDecimal("5.5"));

        assertEquals(new BigDecimal("86.88"), result.getSavingsByDates().get(1).getProfits());
        verifyNoInteractions(observer);
    }

    private static List<Transaction> ledger() {
        return List.of(
                transaction("2023-02-28 15:49:20", "375"),
                transaction("2023-07-01 21:59:00", "620"),
                transaction("2023-10-12 20:15:30", "250"),
                transaction("2023-12-17 08:09:45", "480"));
    }

    private static List<OverridePeriod> overrides() {
        return List.of(override("0", "2023-07-01 00:00:00", "2023-07-31 23:59:59"));
    }

    private static List<BonusPeriod> bonuses() {
        return List.of(bonus("25", "2023-10-01 08:00:00", "2023-12-31 19:59:59"));
    }

    private static List<EvaluationPeriod> evaluations() {
        return List.of(
                evaluation("2023-03-01 00:00:00", "2023-11-30 23:59:59"),
                evaluation("2023-01-01 00:00:00", "2023-12-31 23:59:59"));
    }

    private static Transaction transaction(String date, String amount) {
        return Transaction.builder().date(Timestamps.parse(date)).amount(new BigDecimal(amount)).build();
    }

    private static OverridePeriod override(String fixed, String start, String end) {
        return OverridePeriod.builder()
                .fixed(new BigDecimal(fixed))
                .start(Timestamps.parse(start))
                .end(Timestamps.parse(end))
                .build();
    }

    private static BonusPeriod bonus(String extra, String start, String end) {
        return BonusPeriod.builder()
                .extra(new BigDecimal(extra))
                .start(Timestamps.parse(start))
                .end(Timestamps.parse(end))
                .build();
    }

    private static EvaluationPeriod evaluation(String start, String end) {
        return EvaluationPeriod.builder().start(Timestamps.parse(start)).end(Timestamps.parse(end)).build();
    }
}
