package dk.trustworks.payroll.aggregates.assignments.services;

import dk.trustworks.payroll.aggregates.assignments.dto.CategoryAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.dto.JobAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.assignments.repositories.JobAssignmentRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.model.enums.PeriodStatus;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.cache.CacheEvent;
import dk.trustworks.payroll.cache.PayrollMutationEvent;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.event.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static dk.trustworks.payroll.utils.TestDataBuilders.categoryAssignment;
import static dk.trustworks.payroll.utils.TestDataBuilders.period;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmployeeAssignmentService")
class EmployeeAssignmentServiceTest {

    private static final String PERIOD_ID = "per-2024-03";

    @InjectMocks
    private EmployeeAssignmentService assignmentService;

    @Mock
    private CategoryAssignmentRepository categoryRepository;

    @Mock
    private JobAssignmentRepository jobRepository;

    @Mock
    private PayrollPeriodService periodService;

    @Mock
    private Event<PayrollMutationEvent> mutationEvent;

    @Test
    @DisplayName("First category assignment creates a row")
    void createsCategory() {
        when(periodService.require(PERIOD_ID)).thenReturn(period(PERIOD_ID, 2024, 3));
        when(categoryRepository.findByEmployeeAndPeriod("emp-1", PERIOD_ID)).thenReturn(Optional.empty());

        CategoryAssignment assignment = assignmentService.assignCategory(
                new CategoryAssignmentCommand("emp-1", "cat-intern", PERIOD_ID, null));

        assertEquals("cat-intern", assignment.getCategoryId());
        verify(categoryRepository).persist(assignment);
        ArgumentCaptor<PayrollMutationEvent> captor = ArgumentCaptor.forClass(PayrollMutationEvent.class);
        verify(mutationEvent).fire(captor.capture());
        assertEquals(CacheEvent.CATEGORY_ASSIGNED, captor.getValue().event());
    }

    @Test
    @DisplayName("Repeated category assignment overwrites the existing row")
    void overwritesCategory() {
        CategoryAssignment existing = categoryAssignment("emp-1", PERIOD_ID);
        when(periodService.require(PERIOD_ID)).thenReturn(period(PERIOD_ID, 2024, 3));
        when(categoryRepository.findByEmployeeAndPeriod("emp-1", PERIOD_ID)).thenReturn(Optional.of(existing));

        CategoryAssignment assignment = assignmentService.assignCategory(
                new CategoryAssignmentCommand("emp-1", "cat-intern", PERIOD_ID, "promoted"));

        assertSame(existing, assignment);
        assertEquals("cat-intern", existing.getCategoryId());
        verify(categoryRepository, never()).persist(any(CategoryAssignment.class));
    }

    @Test
    @DisplayName("Position assignment stores position and department")
    void assignsPosition() {
        when(periodService.require(PERIOD_ID)).thenReturn(period(PERIOD_ID, 2024, 3));
        when(jobRepository.findByEmployeeAndPeriod("emp-1", PERIOD_ID)).thenReturn(Optional.empty());

        JobAssignment assignment = assignmentService.assignPosition(
                new JobAssignmentCommand("emp-1", "pos-dev", "dep-tech", PERIOD_ID));

        assertEquals("pos-dev", assignment.getPositionId());
        assertEquals("dep-tech", assignment.getDepartmentId());
    }

    @Test
    @DisplayName("Closed period rejects assignments")
    void closedPeriod() {
        PayrollPeriod period = period(PERIOD_ID, 2024, 3);
        period.setStatus(PeriodStatus.CLOSED);
        when(periodService.require(PERIOD_ID)).thenReturn(period);

        assertThrows(PayrollValidationException.class, () -> assignmentService.assignCategory(
                new CategoryAssignmentCommand("emp-1", "cat-intern", PERIOD_ID, null)));
        verifyNoInteractions(categoryRepository, mutationEvent);
    }
}
