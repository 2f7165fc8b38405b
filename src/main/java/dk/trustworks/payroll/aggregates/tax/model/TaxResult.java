package dk.trustworks.payroll.aggregates.tax.model;

import java.math.BigDecimal;

/**
 * Outcome of one withholding computation. Money at scale 2, rate at scale 4.
 *
 * @param taxDue         tax on the whole accumulated taxable amount
 * @param incrementalTax what has to be withheld in this period
 * @param accumulatedTax tax withheld in the year including this period
 */
public record TaxResult(BigDecimal taxableIncome,
                        BigDecimal taxableAmount,
                        BigDecimal accumulatedTaxable,
                        int bracketLevel,
                        BigDecimal rate,
                        BigDecimal quickDeduction,
                        BigDecimal taxDue,
                        BigDecimal incrementalTax,
                        BigDecimal accumulatedTax,
                        PeriodKind periodKind) {
}
