package dk.trustworks.payroll.aggregates.payroll.services;

import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.ComponentCategory;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollItemRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.payroll.repositories.SalaryComponentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.model.enums.PeriodStatus;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.cache.CacheEvent;
import dk.trustworks.payroll.cache.PayrollMutationEvent;
import dk.trustworks.payroll.exceptions.InvalidPayrollTransitionException;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.event.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dk.trustworks.payroll.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Pure unit tests for PayrollService mutation methods.
 *
 * Covers payroll creation (idempotent per employee and period), item upserts with
 * total refresh under a row lock, per-employee earning entry, item deletion and status changes.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PayrollService Mutation Tests")
class PayrollServiceTest {

    private static final String EMPLOYEE = "emp-1";
    private static final String PERIOD_ID = "per-2024-03";
    private static final String PAYROLL_ID = "pay-1";

    @InjectMocks
    private PayrollService payrollService;

    @Mock
    private PayrollRepository payrollRepository;

    @Mock
    private PayrollItemRepository itemRepository;

    @Mock
    private SalaryComponentRepository componentRepository;

    @Mock
    private PayrollPeriodService periodService;

    @Spy
    private PayrollAggregator aggregator = new PayrollAggregator();

    @Spy
    private PayrollStateMachine stateMachine = new PayrollStateMachine();

    @Mock
    private Event<PayrollMutationEvent> mutationEvent;

    private final SalaryComponent basic = earning("basic", ComponentCategory.BASIC_SALARY);
    private final SalaryComponent social = deduction("social", ComponentCategory.SOCIAL_INSURANCE);

    private CacheEvent firedEvent() {
        ArgumentCaptor<PayrollMutationEvent> captor = ArgumentCaptor.forClass(PayrollMutationEvent.class);
        verify(mutationEvent).fire(captor.capture());
        return captor.getValue().event();
    }

    @Nested
    @DisplayName("createPayroll")
    class CreatePayroll {

        @Test
        @DisplayName("Creates a draft payroll carrying the period pay date")
        void creates() {
            PayrollPeriod period = period(PERIOD_ID, 2024, 3);
            when(periodService.require(PERIOD_ID)).thenReturn(period);
            when(payrollRepository.findActiveByEmployeeAndPeriod(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.empty());

            Payroll payroll = payrollService.createPayroll(EMPLOYEE, PERIOD_ID);

            assertEquals(PayrollStatus.DRAFT, payroll.getStatus());
            assertEquals(period.getPayDate(), payroll.getPayDate());
            assertNotNull(payroll.getUuid());
            verify(payrollRepository).persist(payroll);
            assertEquals(CacheEvent.PAYROLL_CREATED, firedEvent());
        }

        @Test
        @DisplayName("Returns the existing payroll instead of creating a second one")
        void idempotent() {
            Payroll existing = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.CALCULATED);
            when(periodService.require(PERIOD_ID)).thenReturn(period(PERIOD_ID, 2024, 3));
            when(payrollRepository.findActiveByEmployeeAndPeriod(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.of(existing));

            assertSame(existing, payrollService.createPayroll(EMPLOYEE, PERIOD_ID));
            verify(payrollRepository, never()).persist(any(Payroll.class));
            verifyNoInteractions(mutationEvent);
        }

        @Test
        @DisplayName("Closed period is rejected")
        void closedPeriod() {
            PayrollPeriod period = period(PERIOD_ID, 2024, 3);
            period.setStatus(PeriodStatus.CLOSED);
            when(periodService.require(PERIOD_ID)).thenReturn(period);

            assertThrows(PayrollValidationException.class, () -> payrollService.createPayroll(EMPLOYEE, PERIOD_ID));
        }
    }

    @Nested
    @DisplayName("upsertItem")
    class UpsertItem {

        @Test
        @DisplayName("New item is persisted and totals refreshed")
        void createsItem() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("basic")).thenReturn(Optional.of(basic));
            when(itemRepository.findByPayrollAndComponent(PAYROLL_ID, "basic")).thenReturn(Optional.empty());
            when(itemRepository.findByPayroll(PAYROLL_ID)).thenReturn(List.of(
                    item(PAYROLL_ID, "basic", "15000"), item(PAYROLL_ID, "social", "1500")));
            when(componentRepository.findAllById()).thenReturn(Map.of("basic", basic, "social", social));

            PayrollItem item = payrollService.upsertItem(PAYROLL_ID, "basic", new BigDecimal("15000"), "March");

            assertEquals(new BigDecimal("15000.00"), item.getAmount());
            verify(itemRepository).persist(item);
            assertEquals(new BigDecimal("15000.00"), payroll.getGrossPay());
            assertEquals(new BigDecimal("1500.00"), payroll.getTotalDeductions());
            assertEquals(new BigDecimal("13500.00"), payroll.getNetPay());
            assertTrue(payroll.isBalanced());
            assertEquals(CacheEvent.PAYROLL_ITEM_CREATED, firedEvent());
        }

        @Test
        @DisplayName("Existing item for the component is updated")
        void updatesItem() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.CALCULATING);
            PayrollItem existing = item(PAYROLL_ID, "basic", "14000");
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("basic")).thenReturn(Optional.of(basic));
            when(itemRepository.findByPayrollAndComponent(PAYROLL_ID, "basic")).thenReturn(Optional.of(existing));
            when(itemRepository.findByPayroll(PAYROLL_ID)).thenReturn(List.of(existing));
            when(componentRepository.findAllById()).thenReturn(Map.of("basic", basic));

            PayrollItem item = payrollService.upsertItem(PAYROLL_ID, "basic", new BigDecimal("15000"), null);

            assertSame(existing, item);
            assertEquals(new BigDecimal("15000.00"), payroll.getGrossPay());
            verify(itemRepository, never()).persist(any(PayrollItem.class));
            assertEquals(CacheEvent.PAYROLL_ITEM_UPDATED, firedEvent());
        }

        @Test
        @DisplayName("Approved payroll is not editable")
        void notEditable() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.APPROVED);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));

            assertThrows(InvalidPayrollTransitionException.class,
                    () -> payrollService.upsertItem(PAYROLL_ID, "basic", BigDecimal.TEN, null));
            verifyNoInteractions(itemRepository);
        }

        @Test
        @DisplayName("Negative amount is rejected")
        void negativeAmount() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("basic")).thenReturn(Optional.of(basic));

            assertThrows(PayrollValidationException.class,
                    () -> payrollService.upsertItem(PAYROLL_ID, "basic", new BigDecimal("-1"), null));
        }

        @Test
        @DisplayName("Unknown component is rejected")
        void unknownComponent() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("nope")).thenReturn(Optional.empty());

            assertThrows(PayrollValidationException.class,
                    () -> payrollService.upsertItem(PAYROLL_ID, "nope", BigDecimal.TEN, null));
        }
    }

    @Nested
    @DisplayName("upsertEarnings")
    class UpsertEarnings {

        private final SalaryComponent bonus = earning("bonus", ComponentCategory.BONUS);

        @Test
        @DisplayName("Several components for one employee land in one locked write with totals from all of them")
        void severalComponents() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("basic")).thenReturn(Optional.of(basic));
            when(componentRepository.findByIdOptional("bonus")).thenReturn(Optional.of(bonus));
            when(itemRepository.findByPayrollAndComponent(eq(PAYROLL_ID), anyString())).thenReturn(Optional.empty());
            when(itemRepository.findByPayroll(PAYROLL_ID)).thenReturn(List.of(
                    item(PAYROLL_ID, "basic", "30000"), item(PAYROLL_ID, "bonus", "5000")));
            when(componentRepository.findAllById()).thenReturn(Map.of("basic", basic, "bonus", bonus));

            List<PayrollItem> items = payrollService.upsertEarnings(PERIOD_ID, EMPLOYEE, List.of(
                    new EarningEntry(EMPLOYEE, "basic", new BigDecimal("30000"), null),
                    new EarningEntry(EMPLOYEE, "bonus", new BigDecimal("5000"), "Q1")));

            assertEquals(2, items.size());
            assertEquals(new BigDecimal("35000.00"), payroll.getGrossPay());
            verify(payrollRepository, times(1)).findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID);
            verify(payrollRepository, never()).findActiveByEmployeeAndPeriod(anyString(), anyString());
            verify(itemRepository, times(2)).persist(any(PayrollItem.class));
            verify(itemRepository, times(1)).findByPayroll(PAYROLL_ID);
            verify(mutationEvent, times(2)).fire(any(PayrollMutationEvent.class));
        }

        @Test
        @DisplayName("Same amount again changes nothing")
        void unchangedAmount() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.CALCULATED);
            PayrollItem existing = item(PAYROLL_ID, "basic", "15000.00");
            when(payrollRepository.findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("basic")).thenReturn(Optional.of(basic));
            when(itemRepository.findByPayrollAndComponent(PAYROLL_ID, "basic")).thenReturn(Optional.of(existing));

            List<PayrollItem> items = payrollService.upsertEarnings(PERIOD_ID, EMPLOYEE,
                    List.of(new EarningEntry(EMPLOYEE, "basic", new BigDecimal("15000"), null)));

            assertSame(existing, items.get(0));
            verify(itemRepository, never()).findByPayroll(anyString());
            verifyNoInteractions(mutationEvent);
        }

        @Test
        @DisplayName("Deduction components cannot be entered as earnings")
        void deductionRejected() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.of(payroll));
            when(componentRepository.findByIdOptional("social")).thenReturn(Optional.of(social));

            assertThrows(PayrollValidationException.class, () -> payrollService.upsertEarnings(PERIOD_ID, EMPLOYEE,
                    List.of(new EarningEntry(EMPLOYEE, "social", BigDecimal.TEN, null))));
        }

        @Test
        @DisplayName("Lines of another employee are rejected")
        void otherEmployee() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.of(payroll));

            assertThrows(PayrollValidationException.class, () -> payrollService.upsertEarnings(PERIOD_ID, EMPLOYEE,
                    List.of(new EarningEntry("emp-2", "basic", BigDecimal.TEN, null))));
            verifyNoInteractions(itemRepository);
        }

        @Test
        @DisplayName("Employee without payroll is rejected")
        void noPayroll() {
            when(payrollRepository.findActiveByEmployeeAndPeriodForUpdate(EMPLOYEE, PERIOD_ID)).thenReturn(Optional.empty());

            assertThrows(PayrollValidationException.class, () -> payrollService.upsertEarnings(PERIOD_ID, EMPLOYEE,
                    List.of(new EarningEntry(EMPLOYEE, "basic", BigDecimal.TEN, null))));
        }
    }

    @Nested
    @DisplayName("deleteItem and changeStatus")
    class DeleteAndStatus {

        @Test
        @DisplayName("Deleting an item refreshes the totals")
        void deletes() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            PayrollItem bonus = item(PAYROLL_ID, "basic", "500");
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));
            when(itemRepository.findByPayrollAndComponent(PAYROLL_ID, "basic")).thenReturn(Optional.of(bonus));
            when(itemRepository.findByPayroll(PAYROLL_ID)).thenReturn(List.of());
            when(componentRepository.findAllById()).thenReturn(Map.of());

            payrollService.deleteItem(PAYROLL_ID, "basic");

            verify(itemRepository).delete(bonus);
            assertEquals(new BigDecimal("0.00"), payroll.getGrossPay());
            assertEquals(CacheEvent.PAYROLL_ITEM_DELETED, firedEvent());
        }

        @Test
        @DisplayName("Valid status change fires an event")
        void statusChange() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.CALCULATED);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));

            payrollService.changeStatus(PAYROLL_ID, PayrollStatus.APPROVED);

            assertEquals(PayrollStatus.APPROVED, payroll.getStatus());
            assertEquals(CacheEvent.PAYROLL_STATUS_CHANGED, firedEvent());
        }

        @Test
        @DisplayName("Invalid status change is rejected")
        void invalidStatusChange() {
            Payroll payroll = payroll(PAYROLL_ID, EMPLOYEE, PERIOD_ID, PayrollStatus.DRAFT);
            when(payrollRepository.findByIdForUpdate(PAYROLL_ID)).thenReturn(Optional.of(payroll));

            assertThrows(InvalidPayrollTransitionException.class, () -> payrollService.changeStatus(PAYROLL_ID, PayrollStatus.PAID));
            verifyNoInteractions(mutationEvent);
        }
    }
}
