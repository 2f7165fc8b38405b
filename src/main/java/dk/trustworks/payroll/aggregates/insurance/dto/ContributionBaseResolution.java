package dk.trustworks.payroll.aggregates.insurance.dto;

import java.math.BigDecimal;

/**
 * Outcome of resolving one contribution base.
 *
 * @param applicable false when the insurance type does not apply to the employee's category;
 *                   no base must be written then
 * @param resolved   false when resolution failed; reason carries the error
 */
public record ContributionBaseResolution(String employeeId,
                                         String insuranceTypeId,
                                         String periodId,
                                         BigDecimal baseAmount,
                                         boolean applicable,
                                         boolean resolved,
                                         String reason) {

    public static ContributionBaseResolution applied(String employeeId, String insuranceTypeId, String periodId,
                                                     BigDecimal baseAmount, String reason) {
        return new ContributionBaseResolution(employeeId, insuranceTypeId, periodId, baseAmount, true, true, reason);
    }

    public static ContributionBaseResolution notApplicable(String employeeId, String insuranceTypeId, String periodId,
                                                           String reason) {
        return new ContributionBaseResolution(employeeId, insuranceTypeId, periodId, null, false, true, reason);
    }

    public static ContributionBaseResolution failed(String employeeId, String insuranceTypeId, String periodId,
                                                    String reason) {
        return new ContributionBaseResolution(employeeId, insuranceTypeId, periodId, null, false, false, reason);
    }
}
