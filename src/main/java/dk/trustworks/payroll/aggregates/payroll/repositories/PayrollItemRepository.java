package dk.trustworks.payroll.aggregates.payroll.repositories;

import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class PayrollItemRepository implements PanacheRepositoryBase<PayrollItem, String> {

    public List<PayrollItem> findByPayroll(String payrollId) {
        return find("payrollId", payrollId).list();
    }

    public Optional<PayrollItem> findByPayrollAndComponent(String payrollId, String componentId) {
        return find("payrollId = ?1 AND componentId = ?2", payrollId, componentId).firstResultOptional();
    }
}
