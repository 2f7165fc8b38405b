package dk.trustworks.payroll.aggregates.insurance.dto;

import java.math.BigDecimal;
import java.util.List;

public record InsuranceContributions(String employeeId,
                                     String periodId,
                                     List<InsuranceContribution> contributions,
                                     BigDecimal totalEmployee,
                                     BigDecimal totalEmployer) {
}
