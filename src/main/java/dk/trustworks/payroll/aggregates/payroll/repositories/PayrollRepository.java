package dk.trustworks.payroll.aggregates.payroll.repositories;

import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Payroll lookups. "Active" means any status except CANCELLED.
 */
@ApplicationScoped
public class PayrollRepository implements PanacheRepositoryBase<Payroll, String> {

    public Optional<Payroll> findActiveByEmployeeAndPeriod(String employeeId, String periodId) {
        return find("employeeId = ?1 AND periodId = ?2 AND status <> ?3",
                employeeId, periodId, PayrollStatus.CANCELLED).firstResultOptional();
    }

    public Optional<Payroll> findActiveByEmployeeAndPeriodForUpdate(String employeeId, String periodId) {
        return find("employeeId = ?1 AND periodId = ?2 AND status <> ?3",
                employeeId, periodId, PayrollStatus.CANCELLED)
                .withLock(LockModeType.PESSIMISTIC_WRITE)
                .firstResultOptional();
    }

    public Optional<Payroll> findByIdForUpdate(String payrollId) {
        return findByIdOptional(payrollId, LockModeType.PESSIMISTIC_WRITE);
    }

    public List<Payroll> findActiveByPeriod(String periodId) {
        return find("periodId = ?1 AND status <> ?2", periodId, PayrollStatus.CANCELLED).list();
    }

    public List<Payroll> findActiveByPeriodAndEmployees(String periodId, Collection<String> employeeIds) {
        if (employeeIds.isEmpty()) {
            return List.of();
        }
        return find("periodId = ?1 AND employeeId IN ?2 AND status <> ?3",
                periodId, employeeIds, PayrollStatus.CANCELLED).list();
    }

    public List<Payroll> findByEmployee(String employeeId) {
        return find("employeeId = ?1 ORDER BY payDate DESC", employeeId).list();
    }

    /**
     * Number of payrolls in the period that have progressed beyond draft.
     */
    public long countNonDraftByPeriod(String periodId) {
        return count("periodId = ?1 AND status NOT IN ?2",
                periodId, List.of(PayrollStatus.DRAFT, PayrollStatus.CANCELLED));
    }

    /**
     * Gross pay of the employee's most recent calculated payroll in a period that ended
     * before the given date. Drafts and the payrolls of the period being resolved never count.
     */
    public Optional<BigDecimal> findLatestGrossPayBefore(String employeeId, LocalDate before) {
        return find("employeeId = ?1 AND status IN ?2 AND payDate IS NOT NULL AND periodId IN "
                        + "(SELECT p.uuid FROM PayrollPeriod p WHERE p.endDate < ?3) ORDER BY payDate DESC",
                employeeId, PayrollStatus.CALCULATED_OR_LATER, before)
                .firstResultOptional()
                .map(Payroll::getGrossPay);
    }

    /**
     * The latest calculated payroll of the employee earlier in the same tax year.
     */
    public Optional<Payroll> findPriorCalculatedInYear(String employeeId, int year, int month) {
        List<Payroll> candidates = find("employeeId = ?1 AND status IN ?2 AND periodId IN "
                        + "(SELECT p.uuid FROM PayrollPeriod p WHERE p.year = ?3 AND p.month < ?4)",
                employeeId, PayrollStatus.CALCULATED_OR_LATER, year, month).list();
        return candidates.stream()
                .filter(p -> p.getAccumulatedTax() != null)
                .max(Comparator.comparing(Payroll::getAccumulatedTaxable, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(Payroll::getPayDate, Comparator.nullsFirst(Comparator.naturalOrder())));
    }
}
