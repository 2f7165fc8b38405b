package dk.trustworks.payroll.aggregates.assignments.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Personnel category of an employee in a period. Drives insurance applicability.
 */
@Entity
@Table(name = "employee_category_assignments",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "period_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CategoryAssignment {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "employee_id", nullable = false, length = 36)
    private String employeeId;

    @Column(name = "category_id", nullable = false, length = 36)
    private String categoryId;

    @Column(name = "period_id", nullable = false, length = 36)
    private String periodId;

    @Column(length = 500)
    private String notes;
}
