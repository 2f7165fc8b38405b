package dk.trustworks.payroll.aggregates.insurance.dto;

import java.math.BigDecimal;

public record InsuranceContribution(String insuranceTypeId,
                                    String insuranceTypeKey,
                                    BigDecimal baseAmount,
                                    BigDecimal employeeRate,
                                    BigDecimal employerRate,
                                    BigDecimal employeeAmount,
                                    BigDecimal employerAmount) {
}
