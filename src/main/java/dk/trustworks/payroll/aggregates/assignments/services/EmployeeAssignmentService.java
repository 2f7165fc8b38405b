package dk.trustworks.payroll.aggregates.assignments.services;

import dk.trustworks.payroll.aggregates.assignments.dto.CategoryAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.dto.JobAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.assignments.repositories.JobAssignmentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.cache.CacheEvent;
import dk.trustworks.payroll.cache.InvalidationContext;
import dk.trustworks.payroll.cache.PayrollMutationEvent;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.util.UUID;

/**
 * Writes category and job assignments. Both are upserted on (employee, period), so
 * repeating an assignment leaves a single row with the latest values.
 */
@JBossLog
@ApplicationScoped
public class EmployeeAssignmentService {

    @Inject
    CategoryAssignmentRepository categoryRepository;

    @Inject
    JobAssignmentRepository jobRepository;

    @Inject
    PayrollPeriodService periodService;

    @Inject
    Event<PayrollMutationEvent> mutationEvent;

    @Transactional
    public CategoryAssignment assignCategory(CategoryAssignmentCommand command) {
        requireWritablePeriod(command.periodId());
        CategoryAssignment assignment = categoryRepository
                .findByEmployeeAndPeriod(command.employeeId(), command.periodId())
                .orElseGet(() -> {
                    CategoryAssignment created = CategoryAssignment.builder()
                            .uuid(UUID.randomUUID().toString())
                            .employeeId(command.employeeId())
                            .periodId(command.periodId())
                            .build();
                    categoryRepository.persist(created);
                    return created;
                });
        assignment.setCategoryId(command.categoryId());
        assignment.setNotes(command.notes());
        log.debugf("Employee %s assigned category %s in period %s",
                command.employeeId(), command.categoryId(), command.periodId());
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.CATEGORY_ASSIGNED,
                InvalidationContext.forEmployee(command.employeeId(), command.periodId())));
        return assignment;
    }

    @Transactional
    public JobAssignment assignPosition(JobAssignmentCommand command) {
        requireWritablePeriod(command.periodId());
        JobAssignment assignment = jobRepository
                .findByEmployeeAndPeriod(command.employeeId(), command.periodId())
                .orElseGet(() -> {
                    JobAssignment created = JobAssignment.builder()
                            .uuid(UUID.randomUUID().toString())
                            .employeeId(command.employeeId())
                            .periodId(command.periodId())
                            .build();
                    jobRepository.persist(created);
                    return created;
                });
        assignment.setPositionId(command.positionId());
        assignment.setDepartmentId(command.departmentId());
        log.debugf("Employee %s assigned position %s in department %s for period %s",
                command.employeeId(), command.positionId(), command.departmentId(), command.periodId());
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.POSITION_ASSIGNED,
                InvalidationContext.forEmployee(command.employeeId(), command.periodId())));
        return assignment;
    }

    private void requireWritablePeriod(String periodId) {
        PayrollPeriod period = periodService.require(periodId);
        if (period.isClosed()) {
            throw new PayrollValidationException("Period " + periodId + " is closed");
        }
    }
}
