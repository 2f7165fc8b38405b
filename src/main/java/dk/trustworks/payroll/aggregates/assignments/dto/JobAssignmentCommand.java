package dk.trustworks.payroll.aggregates.assignments.dto;

import jakarta.validation.constraints.NotBlank;

public record JobAssignmentCommand(@NotBlank String employeeId,
                                   @NotBlank String positionId,
                                   @NotBlank String departmentId,
                                   @NotBlank String periodId) {
}
