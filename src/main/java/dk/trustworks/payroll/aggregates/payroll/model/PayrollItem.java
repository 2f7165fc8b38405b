package dk.trustworks.payroll.aggregates.payroll.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "payroll_items",
        uniqueConstraints = @UniqueConstraint(columnNames = {"payroll_id", "component_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollItem {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "payroll_id", nullable = false, length = 36)
    private String payrollId;

    @Column(name = "component_id", nullable = false, length = 36)
    private String componentId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(length = 500)
    private String notes;
}
