package dk.trustworks.payroll.aggregates.payroll.dto;

import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;

import java.math.BigDecimal;
import java.util.Map;

public record PeriodPayrollStatistics(String periodId,
                                      int payrollCount,
                                      Map<PayrollStatus, Long> countByStatus,
                                      BigDecimal totalGrossPay,
                                      BigDecimal totalDeductions,
                                      BigDecimal totalNetPay) {
}
