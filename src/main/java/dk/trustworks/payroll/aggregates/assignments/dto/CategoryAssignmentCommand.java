package dk.trustworks.payroll.aggregates.assignments.dto;

import jakarta.validation.constraints.NotBlank;

public record CategoryAssignmentCommand(@NotBlank String employeeId,
                                        @NotBlank String categoryId,
                                        @NotBlank String periodId,
                                        String notes) {
}
