package dk.trustworks.payroll.aggregates.insurance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ContributionBaseCommand(@NotBlank String employeeId,
                                      @NotBlank String insuranceTypeId,
                                      @NotBlank String periodId,
                                      @NotNull BigDecimal baseAmount) {

    /** Batch item id: one base per employee and insurance type. */
    public String itemId() {
        return employeeId + "/" + insuranceTypeId;
    }
}
