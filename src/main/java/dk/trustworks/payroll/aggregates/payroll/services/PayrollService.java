package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.payroll.dto.PayrollTotals;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollItemRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.SalaryComponentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes payrolls and their items.
 *
 * Every item change recomputes and stores the payroll totals inside the same transaction,
 * so readers never see items and totals out of step.
 */
@JBossLog
@ApplicationScoped
public class PayrollService {

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    PayrollItemRepository itemRepository;

    @Inject
    SalaryComponentRepository componentRepository;

    @Inject
    PayrollPeriodService periodService;

    @Inject
    PayrollAggregator aggregator;

    @Inject
    PayrollStateMachine stateMachine;

    @Inject
    Event<PayrollMutationEvent> mutationEvent;

    public Payroll require(String payrollId) {
        return payrollRepository.findByIdOptional(payrollId)
                .orElseThrow(() -> new NotFoundException("Payroll not found: " + payrollId));
    }

    /**
     * Loads the payroll with a row lock held until the surrounding transaction ends, so
     * writers of the same payroll refresh its totals one after another.
     */
    public Payroll requireForUpdate(String payrollId) {
        return payrollRepository.findByIdForUpdate(payrollId)
                .orElseThrow(() -> new NotFoundException("Payroll not found: " + payrollId));
    }

    /**
     * Creates a draft payroll for the employee in the period. When the employee already has a
     * non-cancelled payroll for the period that payroll is returned unchanged.
     */
    @Transactional
    public Payroll createPayroll(String employeeId, String periodId) {
        PayrollPeriod period = periodService.require(periodId);
        if (period.isClosed()) {
            throw new PayrollValidationException("Period " + periodId + " is closed");
        }
        Optional<Payroll> existing = payrollRepository.findActiveByEmployeeAndPeriod(employeeId, periodId);
        if (existing.isPresent()) {
            log.debugf("Employee %s already has payroll %s in period %s", employeeId, existing.get().getUuid(), periodId);
            return existing.get();
        }

        LocalDateTime now = LocalDateTime.now();
        Payroll payroll = Payroll.builder()
                .uuid(UUID.randomUUID().toString())
                .employeeId(employeeId)
                .periodId(periodId)
                .payDate(period.getPayDate())
                .status(PayrollStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();
        payrollRepository.persist(payroll);
        log.infof("Created payroll %s for employee %s in period %s", payroll.getUuid(), employeeId, periodId);
        fire(CacheEvent.PAYROLL_CREATED, payroll);
        return payroll;
    }

    /**
     * Writes the amount for a component onto a payroll, one row per component.
     */
    @Transactional
    public PayrollItem upsertItem(String payrollId, String componentId, BigDecimal amount, String notes) {
        Payroll payroll = requireForUpdate(payrollId);
        return upsertItem(payroll, componentId, amount, notes);
    }

    /**
     * Writes all earnings of one employee onto the employee's payroll for the period in a
     * single transaction. Writing the amount an item already has is accepted in any status.
     */
    @Transactional
    public List<PayrollItem> upsertEarnings(String periodId, String employeeId, List<EarningEntry> entries) {
        Payroll payroll = payrollRepository.findActiveByEmployeeAndPeriodForUpdate(employeeId, periodId)
                .orElseThrow(() -> new PayrollValidationException(
                        "Employee " + employeeId + " has no payroll in period " + periodId));
        List<PayrollItem> items = new ArrayList<>(entries.size());
        List<CacheEvent> events = new ArrayList<>();
        for (EarningEntry entry : entries) {
            if (!employeeId.equals(entry.employeeId())) {
                throw new PayrollValidationException("Earning for employee " + entry.employeeId()
                        + " cannot be written to the payroll of employee " + employeeId);
            }
            SalaryComponent component = requireComponent(entry.componentId());
            if (!component.isEarning()) {
                throw new PayrollValidationException("Component " + component.getName() + " is not an earning");
            }
            Optional<PayrollItem> current = itemRepository.findByPayrollAndComponent(payroll.getUuid(), entry.componentId());
            if (current.isPresent() && current.get().getAmount().compareTo(entry.amount()) == 0) {
                items.add(current.get());
                continue;
            }
            ItemWrite write = writeItem(payroll, entry.componentId(), entry.amount(), entry.notes());
            items.add(write.item());
            events.add(write.event());
        }
        if (!events.isEmpty()) {
            refreshTotals(payroll);
            events.forEach(event -> fire(event, payroll));
        }
        return items;
    }

    PayrollItem upsertItem(Payroll payroll, String componentId, BigDecimal amount, String notes) {
        ItemWrite write = writeItem(payroll, componentId, amount, notes);
        refreshTotals(payroll);
        fire(write.event(), payroll);
        return write.item();
    }

    private ItemWrite writeItem(Payroll payroll, String componentId, BigDecimal amount, String notes) {
        requireEditable(payroll);
        requireComponent(componentId);
        if (amount == null || amount.signum() < 0) {
            throw new PayrollValidationException("Item amount must be zero or positive");
        }

        BigDecimal scaled = amount.setScale(2, RoundingMode.HALF_UP);
        Optional<PayrollItem> existing = itemRepository.findByPayrollAndComponent(payroll.getUuid(), componentId);
        if (existing.isPresent()) {
            PayrollItem item = existing.get();
            item.setAmount(scaled);
            item.setNotes(notes);
            return new ItemWrite(item, CacheEvent.PAYROLL_ITEM_UPDATED);
        }
        PayrollItem item = PayrollItem.builder()
                .uuid(UUID.randomUUID().toString())
                .payrollId(payroll.getUuid())
                .componentId(componentId)
                .amount(scaled)
                .notes(notes)
                .build();
        itemRepository.persist(item);
        return new ItemWrite(item, CacheEvent.PAYROLL_ITEM_CREATED);
    }

    @Transactional
    public void deleteItem(String payrollId, String componentId) {
        Payroll payroll = requireForUpdate(payrollId);
        requireEditable(payroll);
        PayrollItem item = itemRepository.findByPayrollAndComponent(payrollId, componentId)
                .orElseThrow(() -> new NotFoundException("Payroll " + payrollId + " has no item for component " + componentId));
        itemRepository.delete(item);
        itemRepository.flush();
        refreshTotals(payroll);
        fire(CacheEvent.PAYROLL_ITEM_DELETED, payroll);
    }

    @Transactional
    public Payroll changeStatus(String payrollId, PayrollStatus status) {
        Payroll payroll = requireForUpdate(payrollId);
        PayrollStatus before = payroll.getStatus();
        stateMachine.transition(payroll, status);
        if (before != status) {
            fire(CacheEvent.PAYROLL_STATUS_CHANGED, payroll);
        }
        return payroll;
    }

    /**
     * Recomputes the stored totals from the payroll's current items.
     */
    public PayrollTotals refreshTotals(Payroll payroll) {
        PayrollTotals totals = aggregator.aggregate(itemRepository.findByPayroll(payroll.getUuid()),
                componentRepository.findAllById());
        payroll.setGrossPay(totals.grossPay());
        payroll.setTotalDeductions(totals.totalDeductions());
        payroll.setNetPay(totals.netPay());
        payroll.setUpdatedAt(LocalDateTime.now());
        return totals;
    }

    void fire(CacheEvent event, Payroll payroll) {
        mutationEvent.fire(PayrollMutationEvent.of(event,
                InvalidationContext.forPayroll(payroll.getUuid(), payroll.getEmployeeId(), payroll.getPeriodId())));
    }

    private SalaryComponent requireComponent(String componentId) {
        return componentRepository.findByIdOptional(componentId)
                .orElseThrow(() -> new PayrollValidationException("Unknown salary component " + componentId));
    }

    private static void requireEditable(Payroll payroll) {
        if (!payroll.getStatus().isEditable()) {
            throw new InvalidPayrollTransitionException(String.format("Payroll %s is %s; items can only change while DRAFT or CALCULATING",
                    payroll.getUuid(), payroll.getStatus()));
        }
    }

    private record ItemWrite(PayrollItem item, CacheEvent event) {
    }
}
