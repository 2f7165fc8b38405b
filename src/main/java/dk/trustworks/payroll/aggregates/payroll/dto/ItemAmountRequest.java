package dk.trustworks.payroll.aggregates.payroll.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record ItemAmountRequest(@NotNull @PositiveOrZero BigDecimal amount, String notes) {
}
