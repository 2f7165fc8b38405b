package dk.trustworks.payroll.aggregates.period.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record PeriodCommand(@Min(2000) int year,
                            @Min(1) @Max(12) int month,
                            @NotNull LocalDate startDate,
                            @NotNull LocalDate endDate,
                            @NotNull LocalDate payDate) {
}
