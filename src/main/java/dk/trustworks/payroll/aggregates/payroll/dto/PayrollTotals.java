package dk.trustworks.payroll.aggregates.payroll.dto;

import java.math.BigDecimal;

public record PayrollTotals(BigDecimal grossPay, BigDecimal totalDeductions, BigDecimal netPay) {
}
