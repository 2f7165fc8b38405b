package dk.trustworks.payroll.aggregates.assignments.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "employee_job_history",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "period_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobAssignment {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "employee_id", nullable = false, length = 36)
    private String employeeId;

    @Column(name = "position_id", nullable = false, length = 36)
    private String positionId;

    @Column(name = "department_id", nullable = false, length = 36)
    private String departmentId;

    @Column(name = "period_id", nullable = false, length = 36)
    private String periodId;
}
