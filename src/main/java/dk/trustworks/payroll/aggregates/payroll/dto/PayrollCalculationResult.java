package dk.trustworks.payroll.aggregates.payroll.dto;

import dk.trustworks.payroll.aggregates.insurance.dto.InsuranceContributions;
import dk.trustworks.payroll.aggregates.tax.model.TaxResult;

public record PayrollCalculationResult(String payrollId,
                                       String employeeId,
                                       String periodId,
                                       InsuranceContributions contributions,
                                       TaxResult tax,
                                       PayrollTotals totals) {
}
