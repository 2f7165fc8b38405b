package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.insurance.dto.InsuranceContribution;
import dk.trustworks.payroll.aggregates.insurance.dto.InsuranceContributions;
import dk.trustworks.payroll.aggregates.insurance.services.SocialInsuranceCalculator;
import dk.trustworks.payroll.aggregates.payroll.dto.PayrollCalculationResult;
import dk.trustworks.payroll.aggregates.payroll.dto.PayrollTotals;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.ComponentCategory;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollItemRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.SalaryComponentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.aggregates.tax.model.PeriodKind;
import dk.trustworks.payroll.aggregates.tax.model.TaxInput;
import dk.trustworks.payroll.aggregates.tax.model.TaxResult;
import dk.trustworks.payroll.aggregates.tax.services.ProgressiveTaxCalculator;
import dk.trustworks.payroll.cache.CacheEvent;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import io.micrometer.core.annotation.Timed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The calculation step of a payroll: social insurance deductions from the stored
 * contribution bases, then income tax withheld on a year-to-date basis, both written back
 * as deduction items before the totals are refreshed.
 */
@JBossLog
@ApplicationScoped
public class PayrollCalculationService {

    static final String HOUSING_FUND_KEY = "housing_fund";

    @Inject
    PayrollService payrollService;

    @Inject
    PayrollStateMachine stateMachine;

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    PayrollItemRepository itemRepository;

    @Inject
    SalaryComponentRepository componentRepository;

    @Inject
    PayrollPeriodService periodService;

    @Inject
    SocialInsuranceCalculator insuranceCalculator;

    @Inject
    ProgressiveTaxCalculator taxCalculator;

    @Transactional
    @Timed(value = "payroll.calculation.duration", description = "Payroll calculation timing")
    public PayrollCalculationResult calculateForEmployee(String employeeId, String periodId) {
        Payroll payroll = payrollRepository.findActiveByEmployeeAndPeriodForUpdate(employeeId, periodId)
                .orElseThrow(() -> new PayrollValidationException(
                        "Employee " + employeeId + " has no payroll in period " + periodId));
        return calculate(payroll, BigDecimal.ZERO);
    }

    @Transactional
    @Timed(value = "payroll.calculation.duration", description = "Payroll calculation timing")
    public PayrollCalculationResult calculate(String payrollId, BigDecimal specialDeductions) {
        return calculate(payrollService.requireForUpdate(payrollId), specialDeductions);
    }

    PayrollCalculationResult calculate(Payroll payroll, BigDecimal specialDeductions) {
        PayrollPeriod period = periodService.require(payroll.getPeriodId());
        if (payroll.getStatus() == PayrollStatus.CALCULATED) {
            stateMachine.transition(payroll, PayrollStatus.DRAFT);
        }
        stateMachine.transition(payroll, PayrollStatus.CALCULATING);

        Map<String, SalaryComponent> components = componentRepository.findAllById();
        List<PayrollItem> items = itemRepository.findByPayroll(payroll.getUuid());
        BigDecimal taxableGross = taxableGross(items, components);

        InsuranceContributions contributions = insuranceCalculator.calculate(payroll.getEmployeeId(), period);
        BigDecimal housingFund = BigDecimal.ZERO;
        BigDecimal socialInsurance = BigDecimal.ZERO;
        for (InsuranceContribution contribution : contributions.contributions()) {
            if (HOUSING_FUND_KEY.equals(contribution.insuranceTypeKey())) {
                housingFund = housingFund.add(contribution.employeeAmount());
            } else {
                socialInsurance = socialInsurance.add(contribution.employeeAmount());
            }
        }
        writeDeduction(payroll, ComponentCategory.SOCIAL_INSURANCE, socialInsurance);
        writeDeduction(payroll, ComponentCategory.HOUSING_FUND, housingFund);

        Optional<Payroll> prior = payrollRepository.findPriorCalculatedInYear(
                payroll.getEmployeeId(), period.getYear(), period.getMonth());
        TaxInput input = new TaxInput(
                taxableGross,
                contributions.totalEmployee(),
                specialDeductions,
                BigDecimal.ZERO,
                prior.map(Payroll::getAccumulatedTaxable).orElse(BigDecimal.ZERO),
                prior.map(Payroll::getAccumulatedTax).orElse(BigDecimal.ZERO),
                PeriodKind.CUMULATIVE);
        TaxResult tax = taxCalculator.compute(input);
        writeDeduction(payroll, ComponentCategory.INCOME_TAX, tax.incrementalTax());
        payroll.setAccumulatedTaxable(tax.accumulatedTaxable());
        payroll.setAccumulatedTax(tax.accumulatedTax());

        PayrollTotals totals = payrollService.refreshTotals(payroll);
        stateMachine.transition(payroll, PayrollStatus.CALCULATED);
        payrollService.fire(CacheEvent.PAYROLL_UPDATED, payroll);

        log.infof("Calculated payroll %s: gross %s, deductions %s, net %s, tax %s",
                payroll.getUuid(), totals.grossPay(), totals.totalDeductions(), totals.netPay(), tax.incrementalTax());
        return new PayrollCalculationResult(payroll.getUuid(), payroll.getEmployeeId(), payroll.getPeriodId(),
                contributions, tax, totals);
    }

    static BigDecimal taxableGross(List<PayrollItem> items, Map<String, SalaryComponent> components) {
        BigDecimal sum = BigDecimal.ZERO;
        for (PayrollItem item : items) {
            SalaryComponent component = components.get(item.getComponentId());
            if (component != null && component.isEarning() && component.isTaxable()) {
                sum = sum.add(item.getAmount());
            }
        }
        return sum;
    }

    private void writeDeduction(Payroll payroll, ComponentCategory category, BigDecimal amount) {
        SalaryComponent component = componentRepository.findFirstByCategory(category)
                .orElseThrow(() -> new PayrollValidationException("No salary component configured for " + category));
        payrollService.upsertItem(payroll, component.getUuid(), amount, "Calculated");
    }
}
