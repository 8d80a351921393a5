package com.fintech.savings.domain.service;

import com.fintech.savings.domain.model.EvaluationPeriod;
import com.fintech.savings.domain.model.Money;
import com.fintech.savings.domain.model.PeriodSavings;
import com.fintech.savings.domain.model.ReturnsPreset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Compound growth, inflation deflation and NPS tax benefit.
 *
 * Growth compounds once a year over a horizon of {@code 60 - age} years,
 * or {@value #MIN_HORIZON_YEARS} years from age 60 on. The real value is the
 * nominal value divided by {@code (1 + inflation)^years}.
 *
 * Tax uses a single simplified progressive slab table:
 * <pre>
 *   up to   7,00,000   nil
 *   up to  10,00,000   10% above  7,00,000
 *   up to  12,00,000   15% above 10,00,000  (+ 30,000)
 *   up to  15,00,000   20% above 12,00,000  (+ 60,000)
 *   beyond             30% above 15,00,000  (+ 1,20,000)
 * </pre>
 * The NPS deduction is capped at 10% of annual income and at 2,00,000.
 */
@Slf4j
@Service
public class ReturnsProjector {

    public static final int RETIREMENT_AGE = 60;
    public static final int MIN_HORIZON_YEARS = 5;

    private static final MathContext MATH_CONTEXT = MathContext.DECIMAL128;

    private static final BigDecimal SLAB_1 = new BigDecimal("700000");
    private static final BigDecimal SLAB_2 = new BigDecimal("1000000");
    private static final BigDecimal SLAB_3 = new BigDecimal("1200000");
    private static final BigDecimal SLAB_4 = new BigDecimal("1500000");

    private static final BigDecimal RATE_2 = new BigDecimal("0.10");
    private static final BigDecimal RATE_3 = new BigDecimal("0.15");
    private static final BigDecimal RATE_4 = new BigDecimal("0.20");
    private static final BigDecimal RATE_5 = new BigDecimal("0.30");

    // tax due on the full width of the lower slabs
    private static final BigDecimal BASE_3 = new BigDecimal("30000");
    private static final BigDecimal BASE_4 = new BigDecimal("60000");
    private static final BigDecimal BASE_5 = new BigDecimal("120000");

    private static final BigDecimal DEDUCTION_INCOME_SHARE = new BigDecimal("0.10");
    private static final BigDecimal DEDUCTION_CAP = new BigDecimal("200000");

    public int horizonYears(int age) {
        return age < RETIREMENT_AGE ? RETIREMENT_AGE - age : MIN_HORIZON_YEARS;
    }

    /**
     * Inflation-adjusted value of {@code invested} after {@code years} of annual compounding.
     *
     * @param inflation inflation as a decimal (0.055 for 5.5%)
     */
    public BigDecimal compoundReturn(BigDecimal invested, int years, BigDecimal annualRate, BigDecimal inflation) {
        if (years < 0) {
            throw new IllegalArgumentException("years must not be negative: " + years);
        }
        BigDecimal deflator = BigDecimal.ONE.add(inflation).pow(years, MATH_CONTEXT);
        if (deflator.signum() <= 0) {
            throw new IllegalArgumentException("inflation must be greater than -100%: " + inflation);
        }

        BigDecimal nominal = invested.multiply(BigDecimal.ONE.add(annualRate).pow(years, MATH_CONTEXT), MATH_CONTEXT);
        BigDecimal real = nominal.divide(deflator, MATH_CONTEXT);

        log.debug("Compound return: nominal={}, real={}", nominal, real);
        return real;
    }

    public BigDecimal calculateTax(BigDecimal income) {
        if (income.compareTo(SLAB_1) <= 0) {
            return BigDecimal.ZERO;
        }
        if (income.compareTo(SLAB_2) <= 0) {
            return income.subtract(SLAB_1).multiply(RATE_2);
        }
        if (income.compareTo(SLAB_3) <= 0) {
            return BASE_3.add(income.subtract(SLAB_2).multiply(RATE_3));
        }
        if (income.compareTo(SLAB_4) <= 0) {
            return BASE_4.add(income.subtract(SLAB_3).multiply(RATE_4));
        }
        return BASE_5.add(income.subtract(SLAB_4).multiply(RATE_5));
    }

    public BigDecimal taxBenefit(BigDecimal periodInvestment, BigDecimal annualIncome) {
        if (!Money.isPositive(periodInvestment)) {
            return BigDecimal.ZERO;
        }

        BigDecimal deduction = periodInvestment
                .min(annualIncome.multiply(DEDUCTION_INCOME_SHARE))
                .min(DEDUCTION_CAP);
        BigDecimal taxWithout = calculateTax(annualIncome);
        BigDecimal taxWith = calculateTax(annualIncome.subtract(deduction));
        BigDecimal benefit = taxWithout.subtract(taxWith);

        log.info("Tax benefit calculation: deduction={}, taxWithout={}, taxWith={}, benefit={}",
                deduction, taxWithout, taxWith, benefit);
        return benefit;
    }

    /**
     * Projects one evaluation period's aggregated remnant under the given preset.
     */
    public PeriodSavings project(EvaluationPeriod period,
                                 BigDecimal periodInvestment,
                                 int age,
                                 BigDecimal annualIncome,
                                 BigDecimal inflation,
                                 ReturnsPreset preset) {
        int years = horizonYears(age);
        BigDecimal realValue = compoundReturn(periodInvestment, years, preset.getAnnualRate(), inflation);
        BigDecimal profit = realValue.subtract(periodInvestment);

        log.info("Returns calculation: investment={}, years={}, rate={}, inflation={}, realValue={}, profit={}",
                periodInvestment, years, preset.getAnnualRate(), inflation, realValue, profit);

        BigDecimal benefit = preset.isTaxBenefitEnabled()
                ? taxBenefit(periodInvestment, annualIncome)
                : BigDecimal.ZERO;

        return PeriodSavings.builder()
                .start(period.getStart())
                .end(period.getEnd())
                .amount(Money.round(periodInvestment))
                .profits(Money.round(profit))
                .taxBenefit(Money.round(benefit))
                .build();
    }
}
