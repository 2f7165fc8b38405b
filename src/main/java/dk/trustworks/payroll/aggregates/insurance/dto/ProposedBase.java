package dk.trustworks.payroll.aggregates.insurance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ProposedBase(@NotBlank String insuranceTypeId, @NotNull BigDecimal baseAmount) {
}
