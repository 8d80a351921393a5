package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.BonusPeriod;
import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.OverridePeriod;
import com.fintech.savings.domain.model.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies time-bounded adjustments to a transaction's remnant.
 *
 * Per transaction, in this order:
 * 1. Override (q): the matching period with the latest start replaces the remnant.
 *    Equal starts resolve to the last match in input order.
 * 2. Bonus (p): every matching period adds its extra, in input order.
 *
 * Evaluation (k) periods are only tested for membership here. All intervals are inclusive.
 */
@Slf4j
@Service
public class PeriodRuleEngine {

    public BigDecimal applyOverride(LocalDateTime date, BigDecimal baseRemnant, List<OverridePeriod> overridePeriods) {
        OverridePeriod best = null;
        for (OverridePeriod period : overridePeriods) {
            if (period.contains(date) && (best == null || !period.getStart().isBefore(best.getStart()))) {
                best = period;
            }
        }

        if (best == null) {
            return baseRemnant;
        }

        log.debug("Override applied for {}: remnant changed from {} to {}",
                Timestamps.format(date), baseRemnant, best.getFixed());
        return best.getFixed();
    }

    public BigDecimal applyBonus(LocalDateTime date, BigDecimal remnant, List<BonusPeriod> bonusPeriods) {
        BigDecimal adjusted = remnant;
        for (BonusPeriod period : bonusPeriods) {
            if (period.contains(date)) {
                adjusted = adjusted.add(period.getExtra());
                log.debug("Bonus applied for {}: added {}, remnant now {}",
                        Timestamps.format(date), period.getExtra(), adjusted);
            }
        }

        if (adjusted.compareTo(remnant) != 0) {
            log.debug("Total bonus adjustment for {}: {} -> {}", Timestamps.format(date), remnant, adjusted);
        }
        return adjusted;
    }

    public boolean inEvaluationPeriod(LocalDateTime date, List<EvaluationPeriod> evaluationPeriods) {
        for (EvaluationPeriod period : evaluationPeriods) {
            if (period.contains(date)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Override then bonus, starting from the enriched remnant.
     */
    public BigDecimal adjust(EnrichedTransaction transaction,
                             List<OverridePeriod> overridePeriods,
                             List<BonusPeriod> bonusPeriods) {
        BigDecimal remnant = applyOverride(transaction.getDate(), transaction.getRemnant(), overridePeriods);
        return applyBonus(transaction.getDate(), remnant, bonusPeriods);
    }
}
