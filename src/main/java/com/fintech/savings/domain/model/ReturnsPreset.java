package com.fintech.savings.domain.model;

import java.math.BigDecimal;

/**
 * Fixed rate presets behind the two public projections.
 */
public enum ReturnsPreset {

    /** National Pension System: 7.11% with the income-tax deduction benefit. */
    NPS(new BigDecimal("0.0711"), true),

    /** NIFTY 50 index fund: 14.49%, no tax benefit. */
    INDEX(new BigDecimal("0.1449"), false);

    private final BigDecimal annualRate;
    private final boolean taxBenefitEnabled;

    ReturnsPreset(BigDecimal annualRate, boolean taxBenefitEnabled) {
        this.annualRate = annualRate;
        this.taxBenefitEnabled = taxBenefitEnabled;
    }

    public BigDecimal getAnnualRate() {
        return annualRate;
    }

    public boolean isTaxBenefitEnabled() {
        return taxBenefitEnabled;
    }
}
