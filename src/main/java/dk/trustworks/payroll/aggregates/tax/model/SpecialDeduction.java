package dk.trustworks.payroll.aggregates.tax.model;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record SpecialDeduction(@NotNull SpecialDeductionType type, String name, @NotNull BigDecimal amount) {

    public String displayName() {
        return name != null && !name.isBlank() ? name : type.name().toLowerCase().replace('_', ' ');
    }
}
