package dk.trustworks.payroll.aggregates.tax.services;

import dk.trustworks.payroll.aggregates.tax.model.SpecialDeduction;
import dk.trustworks.payroll.aggregates.tax.model.SpecialDeductionType;
import dk.trustworks.payroll.aggregates.tax.model.TaxValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaxDataValidator")
class TaxDataValidatorTest {

    private final TaxDataValidator validator = new TaxDataValidator();

    @Test
    @DisplayName("Tax matching the monthly table is accepted without remarks")
    void consistentFigures() {
        TaxValidationResult result = validator.validate(new BigDecimal("10000"), new BigDecimal("790"), List.of());

        assertTrue(result.valid());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.suggestions().isEmpty());
    }

    @Test
    @DisplayName("Tax above income and negative income are errors")
    void hardErrors() {
        TaxValidationResult aboveIncome = validator.validate(new BigDecimal("1000"), new BigDecimal("1500"), null);
        TaxValidationResult negative = validator.validate(new BigDecimal("-1"), BigDecimal.ZERO, null);

        assertFalse(aboveIncome.valid());
        assertTrue(aboveIncome.errors().contains("Tax amount cannot exceed taxable income"));
        assertFalse(negative.valid());
        assertTrue(negative.errors().contains("Taxable income cannot be negative"));
    }

    @Test
    @DisplayName("Large deviation from the expected tax is a warning")
    void deviation() {
        TaxValidationResult result = validator.validate(new BigDecimal("10000"), new BigDecimal("1000"), List.of());

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("deviates"));
    }

    @Test
    @DisplayName("Effective rate above 45 percent is a warning")
    void highEffectiveRate() {
        TaxValidationResult result = validator.validate(new BigDecimal("1000"), new BigDecimal("500"), List.of());

        assertTrue(result.valid());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("unusually high")));
    }

    @Test
    @DisplayName("Special deductions are checked against their monthly limit")
    void deductionLimits() {
        List<SpecialDeduction> deductions = List.of(
                new SpecialDeduction(SpecialDeductionType.CONTINUING_EDUCATION, null, new BigDecimal("500")),
                new SpecialDeduction(SpecialDeductionType.HOUSING_RENT, "Rent", new BigDecimal("-10")));

        TaxValidationResult result = validator.validate(new BigDecimal("10000"), new BigDecimal("790"), deductions);

        assertFalse(result.valid());
        assertTrue(result.errors().contains("Special deduction 'Rent' cannot be negative"));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("continuing education") && w.contains("400")));
    }

    @Test
    @DisplayName("Zero tax on income above 5000 gives a suggestion")
    void zeroTaxSuggestion() {
        TaxValidationResult result = validator.validate(new BigDecimal("6000"), BigDecimal.ZERO, List.of());

        assertTrue(result.valid());
        assertEquals(1, result.suggestions().size());
    }

    @Test
    @DisplayName("Expected tax is rounded to whole units")
    void expectedTax() {
        assertEquals(new BigDecimal("790"), validator.expectedMonthlyTax(new BigDecimal("10000")));
        assertEquals(new BigDecimal("30"), validator.expectedMonthlyTax(new BigDecimal("1000")));
    }
}
