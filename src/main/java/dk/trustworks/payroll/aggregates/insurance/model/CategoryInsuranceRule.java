package dk.trustworks.payroll.aggregates.insurance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Whether and how an insurance type applies to a personnel category.
 *
 * Rules for the same (category, insurance type) are time sliced over
 * {@code [effectiveDate, endDate)} and never overlap. A null endDate is open ended,
 * a null baseFloor means 0 and a null baseCeiling means unbounded.
 */
@Entity
@Table(name = "category_insurance_rules")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CategoryInsuranceRule {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "category_id", nullable = false, length = 36)
    private String categoryId;

    @Column(name = "insurance_type_id", nullable = false, length = 36)
    private String insuranceTypeId;

    private boolean applicable;

    @Column(name = "employee_rate", precision = 6, scale = 4)
    @Builder.Default
    private BigDecimal employeeRate = BigDecimal.ZERO;

    @Column(name = "employer_rate", precision = 6, scale = 4)
    @Builder.Default
    private BigDecimal employerRate = BigDecimal.ZERO;

    @Column(name = "base_floor", precision = 12, scale = 2)
    private BigDecimal baseFloor;

    @Column(name = "base_ceiling", precision = 12, scale = 2)
    private BigDecimal baseCeiling;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    public BigDecimal floorOrZero() {
        return baseFloor == null ? BigDecimal.ZERO : baseFloor;
    }

    public boolean isEffectiveOn(LocalDate date) {
        return !date.isBefore(effectiveDate) && (endDate == null || date.isBefore(endDate));
    }
}
