package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.assignments.dto.EmployeeAssignmentView;
import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.assignments.repositories.JobAssignmentRepository;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import dk.trustworks.payroll.aggregates.insurance.repositories.CategoryInsuranceRuleRepository;
import dk.trustworks.payroll.aggregates.insurance.repositories.ContributionBaseRepository;
import dk.trustworks.payroll.aggregates.payroll.dto.PeriodPayrollStatistics;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollItemRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.SalaryComponentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.cache.PayrollCacheNames;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cached reads over payroll data. {@code CacheInvalidationManager} evicts these caches when
 * the data behind them changes.
 */
@ApplicationScoped
public class PayrollQueryService {

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    PayrollItemRepository itemRepository;

    @Inject
    SalaryComponentRepository componentRepository;

    @Inject
    ContributionBaseRepository baseRepository;

    @Inject
    CategoryAssignmentRepository categoryRepository;

    @Inject
    JobAssignmentRepository jobRepository;

    @Inject
    CategoryInsuranceRuleRepository ruleRepository;

    @Inject
    PayrollPeriodService periodService;

    @CacheResult(cacheName = PayrollCacheNames.PAYROLL_DETAIL)
    public Payroll getPayroll(String payrollId) {
        return payrollRepository.findByIdOptional(payrollId)
                .orElseThrow(() -> new NotFoundException("Payroll not found: " + payrollId));
    }

    @CacheResult(cacheName = PayrollCacheNames.PAYROLL_ITEMS)
    public List<PayrollItem> getItems(String payrollId) {
        return itemRepository.findByPayroll(payrollId);
    }

    @CacheResult(cacheName = PayrollCacheNames.PAYROLL_LIST)
    public List<Payroll> listByPeriod(String periodId) {
        return payrollRepository.findActiveByPeriod(periodId);
    }

    @CacheResult(cacheName = PayrollCacheNames.EMPLOYEE_PAYROLLS)
    public List<Payroll> listByEmployee(String employeeId) {
        return payrollRepository.findByEmployee(employeeId);
    }

    @CacheResult(cacheName = PayrollCacheNames.PAYROLL_STATISTICS)
    public PeriodPayrollStatistics periodStatistics(String periodId) {
        return statistics(periodId, payrollRepository.findActiveByPeriod(periodId));
    }

    @CacheResult(cacheName = PayrollCacheNames.CONTRIBUTION_BASES)
    public List<ContributionBase> contributionBases(String employeeId, String periodId) {
        return baseRepository.findByEmployeeAndPeriod(employeeId, periodId);
    }

    @CacheResult(cacheName = PayrollCacheNames.PERIOD_CONTRIBUTION_BASES)
    public List<ContributionBase> periodContributionBases(String periodId) {
        return baseRepository.findByPeriod(periodId);
    }

    @CacheResult(cacheName = PayrollCacheNames.EMPLOYEE_ASSIGNMENTS)
    public EmployeeAssignmentView assignments(String employeeId, String periodId) {
        Optional<CategoryAssignment> category = categoryRepository.findByEmployeeAndPeriod(employeeId, periodId);
        Optional<JobAssignment> job = jobRepository.findByEmployeeAndPeriod(employeeId, periodId);
        return new EmployeeAssignmentView(employeeId, periodId,
                category.map(CategoryAssignment::getCategoryId).orElse(null),
                job.map(JobAssignment::getPositionId).orElse(null),
                job.map(JobAssignment::getDepartmentId).orElse(null));
    }

    @CacheResult(cacheName = PayrollCacheNames.PAYROLL_PERIODS)
    public PayrollPeriod getPeriod(String periodId) {
        return periodService.require(periodId);
    }

    @CacheResult(cacheName = PayrollCacheNames.SALARY_COMPONENTS)
    public List<SalaryComponent> salaryComponents() {
        return componentRepository.listAll();
    }

    @CacheResult(cacheName = PayrollCacheNames.INSURANCE_RULES)
    public List<CategoryInsuranceRule> insuranceRules(String categoryId, LocalDate date) {
        return ruleRepository.findEffectiveForCategory(categoryId, date);
    }

    static PeriodPayrollStatistics statistics(String periodId, List<Payroll> payrolls) {
        Map<PayrollStatus, Long> byStatus = new EnumMap<>(PayrollStatus.class);
        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal deductions = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        for (Payroll payroll : payrolls) {
            byStatus.merge(payroll.getStatus(), 1L, Long::sum);
            gross = gross.add(payroll.getGrossPay());
            deductions = deductions.add(payroll.getTotalDeductions());
            net = net.add(payroll.getNetPay());
        }
        return new PeriodPayrollStatistics(periodId, payrolls.size(), byStatus, gross, deductions, net);
    }
}
