package dk.trustworks.payroll.aggregates.assignments.repositories;

import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class JobAssignmentRepository implements PanacheRepositoryBase<JobAssignment, String> {

    public Optional<JobAssignment> findByEmployeeAndPeriod(String employeeId, String periodId) {
        return find("employeeId = ?1 AND periodId = ?2", employeeId, periodId).firstResultOptional();
    }

    public List<JobAssignment> findByPeriodAndEmployees(String periodId, Collection<String> employeeIds) {
        if (employeeIds.isEmpty()) {
            return List.of();
        }
        return find("periodId = ?1 AND employeeId IN ?2", periodId, employeeIds).list();
    }
}
