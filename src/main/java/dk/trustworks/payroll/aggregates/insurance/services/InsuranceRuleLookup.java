package dk.trustworks.payroll.aggregates.insurance.services;

import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.repositories.CategoryInsuranceRuleRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Finds the insurance rules that govern an employee in a period: the employee's category
 * assignment for the period, then the rules effective at the period reference date.
 */
@ApplicationScoped
public class InsuranceRuleLookup {

    @Inject
    CategoryAssignmentRepository categoryRepository;

    @Inject
    CategoryInsuranceRuleRepository ruleRepository;

    public Optional<String> categoryOf(String employeeId, PayrollPeriod period) {
        return categoryRepository.findByEmployeeAndPeriod(employeeId, period.getUuid())
                .map(CategoryAssignment::getCategoryId);
    }

    public Optional<CategoryInsuranceRule> ruleFor(String categoryId, String insuranceTypeId, PayrollPeriod period) {
        return ruleRepository.findEffective(categoryId, insuranceTypeId, period.referenceDate());
    }

    /**
     * Rules marked applicable for the employee's category. Empty when no category is assigned.
     */
    public List<CategoryInsuranceRule> applicableRules(String employeeId, PayrollPeriod period) {
        return categoryOf(employeeId, period)
                .map(categoryId -> ruleRepository.findEffectiveForCategory(categoryId, period.referenceDate())
                        .stream()
                        .filter(CategoryInsuranceRule::isApplicable)
                        .toList())
                .orElse(List.of());
    }
}
