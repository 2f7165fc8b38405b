package dk.trustworks.payroll.aggregates.tax.dto;

import dk.trustworks.payroll.aggregates.tax.model.SpecialDeduction;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

public record TaxValidationRequest(@NotNull BigDecimal taxableIncome,
                                   @NotNull BigDecimal taxAmount,
                                   List<SpecialDeduction> specialDeductions) {

    public TaxValidationRequest {
        specialDeductions = specialDeductions == null ? List.of() : List.copyOf(specialDeductions);
    }
}
