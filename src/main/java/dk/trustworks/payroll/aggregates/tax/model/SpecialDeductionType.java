package dk.trustworks.payroll.aggregates.tax.model;

import java.math.BigDecimal;

/**
 * Special additional deductions with their statutory monthly limit.
 */
public enum SpecialDeductionType {
    CHILD_EDUCATION("1000"),
    CONTINUING_EDUCATION("400"),
    HOUSING_LOAN("1000"),
    HOUSING_RENT("1500"),
    ELDERLY_CARE("2000"),
    SERIOUS_ILLNESS("80000");

    private final BigDecimal monthlyLimit;

    SpecialDeductionType(String monthlyLimit) {
        this.monthlyLimit = new BigDecimal(monthlyLimit);
    }

    public BigDecimal monthlyLimit() {
        return monthlyLimit;
    }
}
