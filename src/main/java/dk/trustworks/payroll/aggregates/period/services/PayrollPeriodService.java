package dk.trustworks.payroll.aggregates.period.services;

import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.model.enums.PeriodStatus;
import dk.trustworks.payroll.aggregates.period.repositories.PayrollPeriodRepository;
import dk.trustworks.payroll.cache.CacheEvent;
import dk.trustworks.payroll.cache.InvalidationContext;
import dk.trustworks.payroll.cache.PayrollMutationEvent;
import dk.trustworks.payroll.exceptions.InvalidPayrollTransitionException;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.NotFoundException;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@JBossLog
@ApplicationScoped
public class PayrollPeriodService {

    @Inject
    PayrollPeriodRepository periodRepository;

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    Event<PayrollMutationEvent> mutationEvent;

    public PayrollPeriod require(String periodId) {
        return periodRepository.findByIdOptional(periodId)
                .orElseThrow(() -> new NotFoundException("Payroll period not found: " + periodId));
    }

    @Transactional
    public PayrollPeriod create(int year, int month, LocalDate startDate, LocalDate endDate, LocalDate payDate) {
        List<String> errors = validateDates(month, startDate, endDate);
        if (periodRepository.findByYearAndMonth(year, month).isPresent()) {
            errors.add(String.format("A payroll period for %d-%02d already exists", year, month));
        }
        if (!errors.isEmpty()) {
            throw new PayrollValidationException(errors);
        }

        PayrollPeriod period = PayrollPeriod.builder()
                .uuid(UUID.randomUUID().toString())
                .year(year)
                .month(month)
                .startDate(startDate)
                .endDate(endDate)
                .payDate(payDate)
                .status(PeriodStatus.DRAFT)
                .build();
        periodRepository.persist(period);
        log.infof("Created payroll period %s for %d-%02d", period.getUuid(), year, month);
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.PERIOD_UPDATED, InvalidationContext.forPeriod(period.getUuid())));
        return period;
    }

    /**
     * Changes the dates of a period. Rejected once any payroll in the period has left draft.
     */
    @Transactional
    public PayrollPeriod updateDates(String periodId, LocalDate startDate, LocalDate endDate, LocalDate payDate) {
        PayrollPeriod period = require(periodId);
        boolean changed = !Objects.equals(period.getStartDate(), startDate)
                || !Objects.equals(period.getEndDate(), endDate)
                || !Objects.equals(period.getPayDate(), payDate);
        if (!changed) {
            return period;
        }
        if (isFrozen(periodId)) {
            throw new PayrollValidationException("Period " + periodId + " is referenced by processed payrolls and cannot be changed");
        }
        List<String> errors = validateDates(period.getMonth(), startDate, endDate);
        if (!errors.isEmpty()) {
            throw new PayrollValidationException(errors);
        }
        period.setStartDate(startDate);
        period.setEndDate(endDate);
        period.setPayDate(payDate);
        log.infof("Updated dates of payroll period %s", periodId);
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.PERIOD_UPDATED, InvalidationContext.forPeriod(periodId)));
        return period;
    }

    @Transactional
    public PayrollPeriod open(String periodId) {
        return changeStatus(periodId, PeriodStatus.DRAFT, PeriodStatus.OPEN);
    }

    @Transactional
    public PayrollPeriod close(String periodId) {
        return changeStatus(periodId, PeriodStatus.OPEN, PeriodStatus.CLOSED);
    }

    public boolean isFrozen(String periodId) {
        return payrollRepository.countNonDraftByPeriod(periodId) > 0;
    }

    private PayrollPeriod changeStatus(String periodId, PeriodStatus expected, PeriodStatus target) {
        PayrollPeriod period = require(periodId);
        if (period.getStatus() == target) {
            return period;
        }
        if (period.getStatus() != expected) {
            throw new InvalidPayrollTransitionException(String.format("Period %s is %s and cannot become %s",
                    periodId, period.getStatus(), target));
        }
        period.setStatus(target);
        log.infof("Payroll period %s: %s → %s", periodId, expected, target);
        mutationEvent.fire(PayrollMutationEvent.of(CacheEvent.PERIOD_UPDATED, InvalidationContext.forPeriod(periodId)));
        return period;
    }

    private static List<String> validateDates(int month, LocalDate startDate, LocalDate endDate) {
        List<String> errors = new ArrayList<>();
        if (month < 1 || month > 12) {
            errors.add("Month must be between 1 and 12");
        }
        if (startDate == null || endDate == null) {
            errors.add("Start and end date are required");
        } else if (startDate.isAfter(endDate)) {
            errors.add("Start date must not be after end date");
        }
        return errors;
    }
}
