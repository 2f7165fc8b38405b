package dk.trustworks.payroll.aggregates.insurance.services;

import dk.trustworks.payroll.aggregates.insurance.dto.BaseValidationResult;
import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseResolution;
import dk.trustworks.payroll.aggregates.insurance.dto.ProposedBase;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.model.InsuranceType;
import dk.trustworks.payroll.aggregates.insurance.repositories.InsuranceTypeRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.config.PayrollEngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Determines the contribution base of an employee for an insurance type in a period.
 *
 * <p>Applicability comes only from the {@link CategoryInsuranceRule} effective at the
 * period's reference date for the employee's category. The base is the candidate amount
 * clamped into the rule's {@code [floor, ceiling]}. When no candidate is given, the gross pay
 * of the employee's latest payroll is used, and the rule floor when there is no payroll history.
 *
 * <p>Resolution only reads; writing bases is {@link ContributionBaseService}'s job.
 */
@JBossLog
@ApplicationScoped
public class ContributionBaseResolver {

    private static final int SCALE = 2;
    private static final RoundingMode RM = RoundingMode.HALF_UP;

    @Inject
    PayrollPeriodService periodService;

    @Inject
    InsuranceRuleLookup ruleLookup;

    @Inject
    InsuranceTypeRepository insuranceTypeRepository;

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    PayrollEngineConfig config;

    /**
     * @param candidateAmount proposed base; null falls back to payroll history, then the floor
     */
    public ContributionBaseResolution resolve(String employeeId, String insuranceTypeId, String periodId,
                                              BigDecimal candidateAmount) {
        PayrollPeriod period = periodService.require(periodId);
        return resolve(employeeId, insuranceTypeId, period, candidateAmount);
    }

    ContributionBaseResolution resolve(String employeeId, String insuranceTypeId, PayrollPeriod period,
                                       BigDecimal candidateAmount) {
        String periodId = period.getUuid();
        Optional<String> category = ruleLookup.categoryOf(employeeId, period);
        if (category.isEmpty()) {
            return ContributionBaseResolution.notApplicable(employeeId, insuranceTypeId, periodId,
                    "No category assigned for the period");
        }
        Optional<CategoryInsuranceRule> rule = ruleLookup.ruleFor(category.get(), insuranceTypeId, period);
        if (rule.isEmpty()) {
            return ContributionBaseResolution.notApplicable(employeeId, insuranceTypeId, periodId,
                    "No insurance rule for category " + category.get() + " on " + period.referenceDate());
        }
        if (!rule.get().isApplicable()) {
            return ContributionBaseResolution.notApplicable(employeeId, insuranceTypeId, periodId,
                    "Insurance type is not applicable to category " + category.get());
        }

        String source;
        BigDecimal candidate = candidateAmount;
        if (candidate != null) {
            source = "candidate amount";
        } else {
            Optional<BigDecimal> latestGross = payrollRepository.findLatestGrossPayBefore(employeeId, period.referenceDate());
            if (latestGross.isPresent()) {
                candidate = latestGross.get();
                source = "latest gross pay";
            } else {
                candidate = rule.get().floorOrZero();
                source = "rule floor (no payroll history)";
            }
        }

        BigDecimal base = clamp(rule.get(), candidate);
        String reason = describeClamp(candidate, base, source);
        return ContributionBaseResolution.applied(employeeId, insuranceTypeId, periodId, base, reason);
    }

    /**
     * Resolves every active insurance type for each employee. A failing entry is reported
     * in its resolution and never aborts the other entries.
     */
    public Map<String, List<ContributionBaseResolution>> batchResolve(List<String> employeeIds, String periodId) {
        PayrollPeriod period = periodService.require(periodId);
        List<InsuranceType> types = insuranceTypeRepository.findActive();
        Map<String, List<ContributionBaseResolution>> result = new LinkedHashMap<>();
        for (String employeeId : employeeIds) {
            List<ContributionBaseResolution> resolutions = new ArrayList<>(types.size());
            for (InsuranceType type : types) {
                try {
                    resolutions.add(resolve(employeeId, type.getUuid(), period, null));
                } catch (RuntimeException e) {
                    log.warnf(e, "Could not resolve %s base for employee %s in period %s",
                            type.getKey(), employeeId, periodId);
                    resolutions.add(ContributionBaseResolution.failed(employeeId, type.getUuid(), periodId,
                            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
                }
            }
            result.put(employeeId, resolutions);
        }
        return result;
    }

    /**
     * Checks a proposed base set before it is saved.
     */
    public BaseValidationResult validate(String employeeId, String periodId, List<ProposedBase> proposedBases) {
        PayrollPeriod period = periodService.require(periodId);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, ProposedBase> proposedByType = new LinkedHashMap<>();
        for (ProposedBase proposed : proposedBases) {
            proposedByType.put(proposed.insuranceTypeId(), proposed);
        }

        Optional<String> category = ruleLookup.categoryOf(employeeId, period);
        if (category.isEmpty()) {
            errors.add("Employee " + employeeId + " has no category assigned for the period");
            return new BaseValidationResult(false, warnings, errors);
        }

        Optional<BigDecimal> latestGross = payrollRepository.findLatestGrossPayBefore(employeeId, period.referenceDate())
                .filter(gross -> gross.signum() > 0);

        for (ProposedBase proposed : proposedBases) {
            Optional<CategoryInsuranceRule> rule = ruleLookup.ruleFor(category.get(), proposed.insuranceTypeId(), period);
            if (rule.isEmpty() || !rule.get().isApplicable()) {
                warnings.add(String.format("Insurance type %s does not apply to category %s; its base is ignored",
                        proposed.insuranceTypeId(), category.get()));
                continue;
            }
            CategoryInsuranceRule r = rule.get();
            BigDecimal amount = proposed.baseAmount();
            if (amount.compareTo(r.floorOrZero()) < 0) {
                errors.add(String.format("Base %s for %s is below the floor %s",
                        amount.toPlainString(), proposed.insuranceTypeId(), r.floorOrZero().toPlainString()));
            }
            if (r.getBaseCeiling() != null && amount.compareTo(r.getBaseCeiling()) > 0) {
                errors.add(String.format("Base %s for %s is above the ceiling %s",
                        amount.toPlainString(), proposed.insuranceTypeId(), r.getBaseCeiling().toPlainString()));
            }
            if (latestGross.isPresent()) {
                BigDecimal ratio = amount.divide(latestGross.get(), 4, RM);
                if (ratio.compareTo(config.contribution().highRatio()) > 0) {
                    warnings.add(String.format("Base %s for %s is more than %s times the latest gross pay %s",
                            amount.toPlainString(), proposed.insuranceTypeId(),
                            config.contribution().highRatio().toPlainString(), latestGross.get().toPlainString()));
                } else if (ratio.compareTo(config.contribution().lowRatio()) < 0) {
                    warnings.add(String.format("Base %s for %s is less than %s times the latest gross pay %s",
                            amount.toPlainString(), proposed.insuranceTypeId(),
                            config.contribution().lowRatio().toPlainString(), latestGross.get().toPlainString()));
                }
            }
        }

        for (InsuranceType type : insuranceTypeRepository.findActive()) {
            if (!type.isMandatory()) {
                continue;
            }
            boolean applies = ruleLookup.ruleFor(category.get(), type.getUuid(), period)
                    .map(CategoryInsuranceRule::isApplicable)
                    .orElse(false);
            if (!applies) {
                continue;
            }
            ProposedBase proposed = proposedByType.get(type.getUuid());
            if (proposed == null) {
                errors.add("Mandatory insurance " + type.getName() + " is missing a base");
            } else if (proposed.baseAmount().signum() <= 0) {
                errors.add("Mandatory insurance " + type.getName() + " must have a positive base");
            }
        }

        return new BaseValidationResult(errors.isEmpty(), warnings, errors);
    }

    /**
     * Clamps the candidate into the rule's inclusive bounds. A null floor is 0, a null
     * ceiling is unbounded.
     */
    public static BigDecimal clamp(CategoryInsuranceRule rule, BigDecimal candidate) {
        BigDecimal value = candidate == null ? BigDecimal.ZERO : candidate;
        BigDecimal floor = rule.floorOrZero();
        if (value.compareTo(floor) < 0) {
            value = floor;
        }
        BigDecimal ceiling = rule.getBaseCeiling();
        if (ceiling != null && value.compareTo(ceiling) > 0) {
            value = ceiling;
        }
        return value.setScale(SCALE, RM);
    }

    private static String describeClamp(BigDecimal candidate, BigDecimal base, String source) {
        int cmp = candidate.compareTo(base);
        if (cmp < 0) {
            return "Raised to floor from " + source;
        }
        if (cmp > 0) {
            return "Capped at ceiling from " + source;
        }
        return "Within bounds, from " + source;
    }
}
