package dk.trustworks.payroll.aggregates.insurance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record BatchResolveRequest(@NotNull List<String> employeeIds, @NotBlank String periodId) {
}
