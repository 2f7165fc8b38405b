package dk.trustworks.payroll.aggregates.payroll.dto;

import jakarta.validation.constraints.NotBlank;

public record CreatePayrollRequest(@NotBlank String employeeId, @NotBlank String periodId) {
}
