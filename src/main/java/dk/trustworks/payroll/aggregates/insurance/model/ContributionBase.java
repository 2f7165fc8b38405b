package dk.trustworks.payroll.aggregates.insurance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "employee_contribution_bases",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "insurance_type_id", "period_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContributionBase {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "employee_id", nullable = false, length = 36)
    private String employeeId;

    @Column(name = "insurance_type_id", nullable = false, length = 36)
    private String insuranceTypeId;

    @Column(name = "period_id", nullable = false, length = 36)
    private String periodId;

    @Column(name = "base_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal baseAmount;
}
