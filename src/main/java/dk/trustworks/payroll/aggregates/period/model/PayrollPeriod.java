package dk.trustworks.payroll.aggregates.period.model;

import dk.trustworks.payroll.aggregates.period.model.enums.PeriodStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A pay period. Dates and year/month are frozen once a payroll in the period has left draft.
 */
@Entity
@Table(name = "payroll_periods",
        uniqueConstraints = @UniqueConstraint(columnNames = {"period_year", "period_month"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollPeriod {

    @Id
    @Column(length = 36)
    private String uuid;

    @Column(name = "period_year", nullable = false)
    private int year;

    @Column(name = "period_month", nullable = false)
    private int month;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "pay_date")
    private LocalDate payDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PeriodStatus status = PeriodStatus.DRAFT;

    /**
     * Date used for every rule lookup in this period.
     */
    public LocalDate referenceDate() {
        return startDate;
    }

    public boolean isClosed() {
        return status == PeriodStatus.CLOSED;
    }
}
