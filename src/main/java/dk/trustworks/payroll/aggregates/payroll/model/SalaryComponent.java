package dk.trustworks.payroll.aggregates.payroll.model;

import dk.trustworks.payroll.aggregates.payroll.model.enums.ComponentCategory;
import dk.trustworks.payroll.aggregates.payroll.model.enums.ComponentKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference data describing one line type on a payslip.
 */
@Entity
@Table(name = "salary_components")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalaryComponent {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ComponentKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ComponentCategory category;

    /**
     * Whether an earning counts towards taxable income. Ignored for deductions.
     */
    @Builder.Default
    private boolean taxable = true;

    public boolean isEarning() {
        return kind == ComponentKind.EARNING;
    }
}
