package dk.trustworks.payroll.aggregates.insurance.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record BaseValidationRequest(@NotBlank String employeeId,
                                    @NotBlank String periodId,
                                    @NotNull List<@Valid ProposedBase> bases) {
}
