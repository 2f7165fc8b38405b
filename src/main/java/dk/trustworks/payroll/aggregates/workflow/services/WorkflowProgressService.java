package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.assignments.repositories.JobAssignmentRepository;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import dk.trustworks.payroll.aggregates.insurance.repositories.CategoryInsuranceRuleRepository;
import dk.trustworks.payroll.aggregates.insurance.repositories.ContributionBaseRepository;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowProgress;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Counts how many of the selected employees have the data each workflow step needs.
 *
 * An employee is base complete when a category is assigned and a contribution base exists
 * for every insurance type applicable to that category at the period reference date.
 */
@ApplicationScoped
public class WorkflowProgressService {

    @Inject
    PayrollPeriodService periodService;

    @Inject
    CategoryAssignmentRepository categoryRepository;

    @Inject
    JobAssignmentRepository jobRepository;

    @Inject
    ContributionBaseRepository baseRepository;

    @Inject
    CategoryInsuranceRuleRepository ruleRepository;

    @Inject
    PayrollRepository payrollRepository;

    public WorkflowProgress progress(String periodId, List<String> employeeIds) {
        PayrollPeriod period = periodService.require(periodId);

        Map<String, String> categoryByEmployee = categoryRepository.findByPeriodAndEmployees(periodId, employeeIds)
                .stream()
                .collect(Collectors.toMap(CategoryAssignment::getEmployeeId, CategoryAssignment::getCategoryId, (a, b) -> a));
        Set<String> withPosition = jobRepository.findByPeriodAndEmployees(periodId, employeeIds).stream()
                .map(JobAssignment::getEmployeeId)
                .collect(Collectors.toSet());
        Map<String, Set<String>> baseTypesByEmployee = baseRepository.findByPeriodAndEmployees(periodId, employeeIds)
                .stream()
                .collect(Collectors.groupingBy(ContributionBase::getEmployeeId,
                        Collectors.mapping(ContributionBase::getInsuranceTypeId, Collectors.toSet())));
        Map<String, Payroll> payrollByEmployee = payrollRepository.findActiveByPeriodAndEmployees(periodId, employeeIds)
                .stream()
                .collect(Collectors.toMap(Payroll::getEmployeeId, p -> p, (a, b) -> a));

        Map<String, Set<String>> applicableTypesByCategory = new HashMap<>();
        List<String> missingCategory = new ArrayList<>();
        List<String> missingPosition = new ArrayList<>();
        List<String> missingBases = new ArrayList<>();
        List<String> missingPayroll = new ArrayList<>();
        int calculated = 0;

        Set<String> distinctEmployees = new LinkedHashSet<>(employeeIds);
        for (String employeeId : distinctEmployees) {
            String categoryId = categoryByEmployee.get(employeeId);
            if (categoryId == null) {
                missingCategory.add(employeeId);
                missingBases.add(employeeId);
            } else {
                Set<String> required = applicableTypesByCategory.computeIfAbsent(categoryId, c ->
                        ruleRepository.findEffectiveForCategory(c, period.referenceDate()).stream()
                                .filter(CategoryInsuranceRule::isApplicable)
                                .map(CategoryInsuranceRule::getInsuranceTypeId)
                                .collect(Collectors.toSet()));
                if (!baseTypesByEmployee.getOrDefault(employeeId, Set.of()).containsAll(required)) {
                    missingBases.add(employeeId);
                }
            }
            if (!withPosition.contains(employeeId)) {
                missingPosition.add(employeeId);
            }
            Payroll payroll = payrollByEmployee.get(employeeId);
            if (payroll == null) {
                missingPayroll.add(employeeId);
            } else if (PayrollStatus.CALCULATED_OR_LATER.contains(payroll.getStatus())) {
                calculated++;
            }
        }

        int total = distinctEmployees.size();
        return new WorkflowProgress(periodId, total,
                total - missingCategory.size(),
                total - missingPosition.size(),
                total - missingBases.size(),
                total - missingPayroll.size(),
                calculated,
                missingCategory, missingPosition, missingBases, missingPayroll);
    }
}
