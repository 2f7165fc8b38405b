package dk.trustworks.payroll.aggregates.workflow.model;

import jakarta.validation.constraints.NotBlank;

public record PositionPlacement(@NotBlank String positionId, @NotBlank String departmentId) {
}
