package dk.trustworks.payroll.aggregates.tax.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Figures for one withholding computation. Null amounts count as zero.
 *
 * @param accumulatedPriorTaxable taxable amount already accumulated earlier in the tax year
 * @param accumulatedPriorTax     tax already withheld earlier in the tax year
 */
public record TaxInput(@NotNull @PositiveOrZero BigDecimal grossIncome,
                       @PositiveOrZero BigDecimal preTaxDeductions,
                       @PositiveOrZero BigDecimal specialDeductions,
                       @PositiveOrZero BigDecimal additionalDeductions,
                       @PositiveOrZero BigDecimal accumulatedPriorTaxable,
                       @PositiveOrZero BigDecimal accumulatedPriorTax,
                       PeriodKind periodKind) {

    public TaxInput {
        grossIncome = orZero(grossIncome);
        preTaxDeductions = orZero(preTaxDeductions);
        specialDeductions = orZero(specialDeductions);
        additionalDeductions = orZero(additionalDeductions);
        accumulatedPriorTaxable = orZero(accumulatedPriorTaxable);
        accumulatedPriorTax = orZero(accumulatedPriorTax);
        periodKind = periodKind == null ? PeriodKind.MONTHLY : periodKind;
    }

    public static TaxInput monthly(BigDecimal grossIncome, BigDecimal preTaxDeductions, BigDecimal specialDeductions) {
        return new TaxInput(grossIncome, preTaxDeductions, specialDeductions, null, null, null, PeriodKind.MONTHLY);
    }

    /**
     * Same figures carried onto a prior accumulation.
     */
    public TaxInput withPriorAccumulation(BigDecimal priorTaxable, BigDecimal priorTax) {
        return new TaxInput(grossIncome, preTaxDeductions, specialDeductions, additionalDeductions,
                priorTaxable, priorTax, periodKind);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
