package dk.trustworks.payroll.aggregates.insurance.repositories;

import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class ContributionBaseRepository implements PanacheRepositoryBase<ContributionBase, String> {

    public Optional<ContributionBase> findByKey(String employeeId, String insuranceTypeId, String periodId) {
        return find("employeeId = ?1 AND insuranceTypeId = ?2 AND periodId = ?3",
                employeeId, insuranceTypeId, periodId).firstResultOptional();
    }

    public List<ContributionBase> findByEmployeeAndPeriod(String employeeId, String periodId) {
        return find("employeeId = ?1 AND periodId = ?2", employeeId, periodId).list();
    }

    public List<ContributionBase> findByPeriodAndEmployees(String periodId, Collection<String> employeeIds) {
        if (employeeIds.isEmpty()) {
            return List.of();
        }
        return find("periodId = ?1 AND employeeId IN ?2", periodId, employeeIds).list();
    }

    public List<ContributionBase> findByPeriod(String periodId) {
        return find("periodId", periodId).list();
    }
}
