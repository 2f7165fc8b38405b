package dk.trustworks.payroll.aggregates.period.services;

import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.model.enums.PeriodStatus;
import dk.trustworks.payroll.aggregates.period.repositories.PayrollPeriodRepository;
import dk.trustworks.payroll.cache.PayrollMutationEvent;
import dk.trustworks.payroll.exceptions.InvalidPayrollTransitionException;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.event.Event;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static dk.trustworks.payroll.utils.TestDataBuilders.period;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PayrollPeriodService")
class PayrollPeriodServiceTest {

    private static final String PERIOD_ID = "per-2024-03";

    @InjectMocks
    private PayrollPeriodService periodService;

    @Mock
    private PayrollPeriodRepository periodRepository;

    @Mock
    private PayrollRepository payrollRepository;

    @Mock
    private Event<PayrollMutationEvent> mutationEvent;

    @Test
    @DisplayName("New period starts as draft")
    void creates() {
        when(periodRepository.findByYearAndMonth(2024, 3)).thenReturn(Optional.empty());

        PayrollPeriod period = periodService.create(2024, 3,
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), LocalDate.of(2024, 3, 28));

        assertEquals(PeriodStatus.DRAFT, period.getStatus());
        verify(periodRepository).persist(period);
        verify(mutationEvent).fire(any(PayrollMutationEvent.class));
    }

    @Test
    @DisplayName("All date problems are reported together")
    void invalidDates() {
        when(periodRepository.findByYearAndMonth(2024, 13)).thenReturn(Optional.empty());

        PayrollValidationException e = assertThrows(PayrollValidationException.class, () -> periodService.create(2024, 13,
                LocalDate.of(2024, 3, 31), LocalDate.of(2024, 3, 1), null));

        assertEquals(2, e.getErrors().size());
    }

    @Test
    @DisplayName("Second period for the same month is rejected")
    void duplicate() {
        when(periodRepository.findByYearAndMonth(2024, 3)).thenReturn(Optional.of(period(PERIOD_ID, 2024, 3)));

        assertThrows(PayrollValidationException.class, () -> periodService.create(2024, 3,
                LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), null));
    }

    @Test
    @DisplayName("Dates are frozen once a payroll has left draft")
    void frozen() {
        when(periodRepository.findByIdOptional(PERIOD_ID)).thenReturn(Optional.of(period(PERIOD_ID, 2024, 3)));
        when(payrollRepository.countNonDraftByPeriod(PERIOD_ID)).thenReturn(1L);

        assertThrows(PayrollValidationException.class, () -> periodService.updateDates(PERIOD_ID,
                LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 31), LocalDate.of(2024, 3, 31)));
    }

    @Test
    @DisplayName("Unchanged dates are accepted even when frozen")
    void unchangedDates() {
        PayrollPeriod period = period(PERIOD_ID, 2024, 3);
        when(periodRepository.findByIdOptional(PERIOD_ID)).thenReturn(Optional.of(period));

        assertSame(period, periodService.updateDates(PERIOD_ID, period.getStartDate(), period.getEndDate(), period.getPayDate()));
        verifyNoInteractions(payrollRepository, mutationEvent);
    }

    @Test
    @DisplayName("Dates of an untouched period can change")
    void updatesDates() {
        PayrollPeriod period = period(PERIOD_ID, 2024, 3);
        when(periodRepository.findByIdOptional(PERIOD_ID)).thenReturn(Optional.of(period));
        when(payrollRepository.countNonDraftByPeriod(PERIOD_ID)).thenReturn(0L);

        periodService.updateDates(PERIOD_ID, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 1));

        assertEquals(LocalDate.of(2024, 4, 1), period.getPayDate());
        verify(mutationEvent).fire(any(PayrollMutationEvent.class));
    }

    @Test
    @DisplayName("Period moves draft, open, closed and never back")
    void statusFlow() {
        PayrollPeriod period = period(PERIOD_ID, 2024, 3);
        period.setStatus(PeriodStatus.DRAFT);
        when(periodRepository.findByIdOptional(PERIOD_ID)).thenReturn(Optional.of(period));

        periodService.open(PERIOD_ID);
        assertEquals(PeriodStatus.OPEN, period.getStatus());
        periodService.close(PERIOD_ID);
        assertEquals(PeriodStatus.CLOSED, period.getStatus());
        assertThrows(InvalidPayrollTransitionException.class, () -> periodService.open(PERIOD_ID));
    }

    @Test
    @DisplayName("Unknown period is not found")
    void notFound() {
        when(periodRepository.findByIdOptional("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> periodService.require("missing"));
    }
}
