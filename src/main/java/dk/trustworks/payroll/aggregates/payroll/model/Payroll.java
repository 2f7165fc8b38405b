package dk.trustworks.payroll.aggregates.payroll.model;

import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One employee's payroll for one period.
 *
 * Totals are cached sums over the payroll's items and are rewritten in the same transaction
 * as any item change, so netPay always equals grossPay minus totalDeductions.
 * accumulatedTaxable and accumulatedTax hold the year-to-date withholding figures after
 * this period and seed the next period's tax computation.
 */
@Entity
@Table(name = "payrolls")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payroll {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "employee_id", nullable = false, length = 36)
    private String employeeId;

    @Column(name = "period_id", nullable = false, length = 36)
    private String periodId;

    @Column(name = "pay_date")
    private LocalDate payDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PayrollStatus status = PayrollStatus.DRAFT;

    @Column(name = "gross_pay", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal grossPay = BigDecimal.ZERO;

    @Column(name = "total_deductions", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal totalDeductions = BigDecimal.ZERO;

    @Column(name = "net_pay", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal netPay = BigDecimal.ZERO;

    @Column(name = "accumulated_taxable", precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal accumulatedTaxable = BigDecimal.ZERO;

    @Column(name = "accumulated_tax", precision = 14, scale = 2)
    @Builder.Default
    private BigDecimal accumulatedTax = BigDecimal.ZERO;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isBalanced() {
        return netPay != null && grossPay != null && totalDeductions != null
                && netPay.compareTo(grossPay.subtract(totalDeductions)) == 0;
    }
}
