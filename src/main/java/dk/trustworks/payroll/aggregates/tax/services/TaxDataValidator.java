package dk.trustworks.payroll.aggregates.tax.services;

import dk.trustworks.payroll.aggregates.tax.model.SpecialDeduction;
import dk.trustworks.payroll.aggregates.tax.model.TaxBracket;
import dk.trustworks.payroll.aggregates.tax.model.TaxBracketTable;
import dk.trustworks.payroll.aggregates.tax.model.TaxValidationResult;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Sanity checks for tax figures entered by hand or imported from a provider,
 * before they are written onto a payroll.
 */
@ApplicationScoped
public class TaxDataValidator {

    private static final BigDecimal MAX_EFFECTIVE_RATE = new BigDecimal("0.45");
    private static final BigDecimal MAX_DEVIATION = new BigDecimal("0.10");
    private static final BigDecimal ZERO_TAX_HINT_LIMIT = new BigDecimal("5000");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TaxValidationResult validate(BigDecimal taxableIncome, BigDecimal taxAmount, List<SpecialDeduction> specialDeductions) {
        BigDecimal income = taxableIncome == null ? BigDecimal.ZERO : taxableIncome;
        BigDecimal tax = taxAmount == null ? BigDecimal.ZERO : taxAmount;
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (income.signum() < 0) {
            errors.add("Taxable income cannot be negative");
        }
        if (tax.signum() < 0) {
            errors.add("Tax amount cannot be negative");
        }
        if (tax.compareTo(income) > 0) {
            errors.add("Tax amount cannot exceed taxable income");
        }

        if (income.signum() > 0 && tax.signum() > 0) {
            BigDecimal effectiveRate = tax.divide(income, 6, RoundingMode.HALF_UP);
            if (effectiveRate.compareTo(MAX_EFFECTIVE_RATE) > 0) {
                warnings.add(String.format("Effective tax rate %s%% is unusually high",
                        effectiveRate.multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP).toPlainString()));
            }

            BigDecimal expected = expectedMonthlyTax(income);
            if (expected.signum() > 0) {
                BigDecimal deviation = tax.subtract(expected).abs().divide(expected, 6, RoundingMode.HALF_UP);
                if (deviation.compareTo(MAX_DEVIATION) > 0) {
                    warnings.add(String.format("Tax amount deviates %s%% from the expected %s",
                            deviation.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString(),
                            expected.toPlainString()));
                }
            }
        }

        if (specialDeductions != null) {
            for (SpecialDeduction deduction : specialDeductions) {
                if (deduction.amount().signum() < 0) {
                    errors.add(String.format("Special deduction '%s' cannot be negative", deduction.displayName()));
                }
                BigDecimal limit = deduction.type().monthlyLimit();
                if (deduction.amount().compareTo(limit) > 0) {
                    warnings.add(String.format("Special deduction '%s' of %s exceeds the monthly limit %s",
                            deduction.displayName(), deduction.amount().toPlainString(), limit.toPlainString()));
                }
            }
        }

        if (tax.signum() == 0 && income.compareTo(ZERO_TAX_HINT_LIMIT) > 0) {
            suggestions.add("Taxable income is above 5000 but no tax is withheld; check for undeclared special deductions");
        }

        return new TaxValidationResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    /**
     * Tax the monthly table gives for the figure, rounded to whole units.
     */
    BigDecimal expectedMonthlyTax(BigDecimal taxableIncome) {
        TaxBracket bracket = TaxBracketTable.MONTHLY.bracketFor(taxableIncome);
        return taxableIncome.multiply(bracket.rate())
                .subtract(bracket.quickDeduction())
                .max(BigDecimal.ZERO)
                .setScale(0, RoundingMode.HALF_UP);
    }
}
