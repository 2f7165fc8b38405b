package dk.trustworks.payroll.aggregates.workflow.dto;

import jakarta.validation.constraints.NotBlank;

public record CategoryBatchRequest(@NotBlank String categoryId) {
}
