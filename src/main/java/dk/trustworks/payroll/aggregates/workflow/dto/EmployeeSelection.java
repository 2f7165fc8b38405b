package dk.trustworks.payroll.aggregates.workflow.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record EmployeeSelection(@NotNull List<String> employeeIds) {
}
