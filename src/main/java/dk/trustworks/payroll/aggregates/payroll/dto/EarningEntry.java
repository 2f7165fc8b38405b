package dk.trustworks.payroll.aggregates.payroll.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * One earning line to write onto an employee's payroll for the selected period.
 */
public record EarningEntry(@NotBlank String employeeId,
                           @NotBlank String componentId,
                           @NotNull @PositiveOrZero BigDecimal amount,
                           String notes) {
}
