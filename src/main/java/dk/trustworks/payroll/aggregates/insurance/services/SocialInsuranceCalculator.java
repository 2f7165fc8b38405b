package dk.trustworks.payroll.aggregates.insurance.services;

import dk.trustworks.payroll.aggregates.insurance.dto.InsuranceContribution;
import dk.trustworks.payroll.aggregates.insurance.dto.InsuranceContributions;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import dk.trustworks.payroll.aggregates.insurance.model.InsuranceType;
import dk.trustworks.payroll.aggregates.insurance.repositories.ContributionBaseRepository;
import dk.trustworks.payroll.aggregates.insurance.repositories.InsuranceTypeRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Employee and employer social insurance amounts for a period: base × rate per applicable
 * insurance type.
 */
@JBossLog
@ApplicationScoped
public class SocialInsuranceCalculator {

    private static final int SCALE = 2;
    private static final RoundingMode RM = RoundingMode.HALF_UP;

    @Inject
    ContributionBaseRepository baseRepository;

    @Inject
    InsuranceTypeRepository insuranceTypeRepository;

    @Inject
    InsuranceRuleLookup ruleLookup;

    public InsuranceContributions calculate(String employeeId, PayrollPeriod period) {
        List<ContributionBase> bases = baseRepository.findByEmployeeAndPeriod(employeeId, period.getUuid());
        List<CategoryInsuranceRule> rules = ruleLookup.applicableRules(employeeId, period);
        Map<String, InsuranceType> types = insuranceTypeRepository.listAll().stream()
                .collect(Collectors.toMap(InsuranceType::getUuid, Function.identity()));
        return calculate(employeeId, period.getUuid(), bases, rules, types);
    }

    /**
     * Bases without an applicable rule are skipped; applicable rules without a base
     * contribute nothing. Amounts are rounded per line and totals are sums of the lines.
     */
    public InsuranceContributions calculate(String employeeId, String periodId,
                                            List<ContributionBase> bases,
                                            List<CategoryInsuranceRule> applicableRules,
                                            Map<String, InsuranceType> typesById) {
        Map<String, CategoryInsuranceRule> ruleByType = applicableRules.stream()
                .collect(Collectors.toMap(CategoryInsuranceRule::getInsuranceTypeId, Function.identity(), (a, b) -> a));

        List<InsuranceContribution> contributions = new ArrayList<>();
        BigDecimal totalEmployee = BigDecimal.ZERO.setScale(SCALE);
        BigDecimal totalEmployer = BigDecimal.ZERO.setScale(SCALE);
        for (ContributionBase base : bases) {
            CategoryInsuranceRule rule = ruleByType.get(base.getInsuranceTypeId());
            if (rule == null) {
                log.debugf("Ignoring base for insurance %s of employee %s: no applicable rule",
                        base.getInsuranceTypeId(), employeeId);
                continue;
            }
            BigDecimal employeeRate = orZero(rule.getEmployeeRate());
            BigDecimal employerRate = orZero(rule.getEmployerRate());
            BigDecimal employeeAmount = base.getBaseAmount().multiply(employeeRate).setScale(SCALE, RM);
            BigDecimal employerAmount = base.getBaseAmount().multiply(employerRate).setScale(SCALE, RM);
            totalEmployee = totalEmployee.add(employeeAmount);
            totalEmployer = totalEmployer.add(employerAmount);

            InsuranceType type = typesById.get(base.getInsuranceTypeId());
            contributions.add(new InsuranceContribution(
                    base.getInsuranceTypeId(),
                    type != null ? type.getKey() : null,
                    base.getBaseAmount().setScale(SCALE, RM),
                    employeeRate.setScale(4, RM),
                    employerRate.setScale(4, RM),
                    employeeAmount,
                    employerAmount));
        }
        return new InsuranceContributions(employeeId, periodId, contributions, totalEmployee, totalEmployer);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
