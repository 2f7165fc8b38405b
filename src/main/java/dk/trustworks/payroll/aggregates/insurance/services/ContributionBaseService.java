package dk.trustworks.payroll.aggregates.insurance.services;

import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseCommand;
import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import dk.trustworks.payroll.aggregates.insurance.repositories.ContributionBaseRepository;
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Stores contribution bases, one row per (employee, insurance type, period).
 * Refuses bases for inapplicable insurance types and bases outside the rule bounds.
 */
@JBossLog
@ApplicationScoped
public class ContributionBaseService {

    @Inject
    ContributionBaseRepository baseRepository;

    @Inject
    InsuranceRuleLookup ruleLookup;

    @Inject
    PayrollPeriodService periodService;

    @Inject
    Event<PayrollMutationEvent> mutationEvent;

    @Transactional
    public ContributionBase upsert(ContributionBaseCommand command) {
        PayrollPeriod period = periodService.require(command.periodId());
        if (period.isClosed()) {
            throw new PayrollValidationException("Period " + command.periodId() + " is closed");
        }
        String categoryId = ruleLookup.categoryOf(command.employeeId(), period)
                .orElseThrow(() -> new PayrollValidationException(
                        "Employee " + command.employeeId() + " has no category assigned for the period"));
        CategoryInsuranceRule rule = ruleLookup.ruleFor(categoryId, command.insuranceTypeId(), period)
                .filter(CategoryInsuranceRule::isApplicable)
                .orElseThrow(() -> new PayrollValidationException(String.format(
                        "Insurance type %s is not applicable to category %s", command.insuranceTypeId(), categoryId)));

        BigDecimal amount = command.baseAmount().setScale(2, RoundingMode.HALF_UP);
        if (ContributionBaseResolver.clamp(rule, amount).compareTo(amount) != 0) {
            throw new PayrollValidationException(String.format(
                    "Base %s for insurance type %s is outside [%s, %s]", amount.toPlainString(),
                    command.insuranceTypeId(), rule.floorOrZero().toPlainString(),
                    rule.getBaseCeiling() == null ? "unbounded" : rule.getBaseCeiling().toPlainString()));
        }

        ContributionBase base = baseRepository
                .findByKey(command.employeeId(), command.insuranceTypeId(), command.periodId())
                .orElse(null);
        if (base == null) {
            base = ContributionBase.builder()
                    .uuid(UUID.randomUUID().toString())
                    .employeeId(command.employeeId())
                    .insuranceTypeId(command.insuranceTypeId())
                    .periodId(command.periodId())
                    .baseAmount(amount)
                    .build();
            baseRepository.persist(base);
        } else {
            base.setBaseAmount(amount);
        }
        log.debugf("Contribution base %s set for employee %s, insurance %s, period %s",
                amount, command.employeeId(), command.insuranceTypeId(), command.periodId());
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.CONTRIBUTION_BASE_UPDATED,
                InvalidationContext.forEmployee(command.employeeId(), command.periodId())));
        return base;
    }
}
