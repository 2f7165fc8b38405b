package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.repositories.CategoryAssignmentRepository;
import dk.trustworks.payroll.aggregates.assignments.repositories.JobAssignmentRepository;
import dk.trustworks.payroll.aggregates.insurance.repositories.CategoryInsuranceRuleRepository;
import dk.trustworks.payroll.aggregates.insurance.repositories.ContributionBaseRepository;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowProgress;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static dk.trustworks.payroll.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkflowProgressService")
class WorkflowProgressServiceTest {

    private static final String PERIOD_ID = "per-2024-03";
    private static final List<String> EMPLOYEES = List.of("emp-1", "emp-2", "emp-3");

    @InjectMocks
    private WorkflowProgressService progressService;

    @Mock
    private PayrollPeriodService periodService;

    @Mock
    private CategoryAssignmentRepository categoryRepository;

    @Mock
    private JobAssignmentRepository jobRepository;

    @Mock
    private ContributionBaseRepository baseRepository;

    @Mock
    private CategoryInsuranceRuleRepository ruleRepository;

    @Mock
    private PayrollRepository payrollRepository;

    @Test
    @DisplayName("Counts each employee against every step")
    void counts() {
        PayrollPeriod period = period(PERIOD_ID, 2024, 3);
        when(periodService.require(PERIOD_ID)).thenReturn(period);
        when(categoryRepository.findByPeriodAndEmployees(PERIOD_ID, EMPLOYEES)).thenReturn(List.of(
                categoryAssignment("emp-1", PERIOD_ID),
                categoryAssignment("emp-2", PERIOD_ID)));
        when(jobRepository.findByPeriodAndEmployees(PERIOD_ID, EMPLOYEES)).thenReturn(List.of(
                JobAssignment.builder().uuid("job-1").employeeId("emp-1").positionId("pos-dev")
                        .departmentId("dep-it").periodId(PERIOD_ID).build()));
        when(baseRepository.findByPeriodAndEmployees(PERIOD_ID, EMPLOYEES)).thenReturn(List.of(
                base("emp-1", "ins-pension", PERIOD_ID, "30000.00"),
                base("emp-1", "ins-unemployment", PERIOD_ID, "30000.00"),
                base("emp-2", "ins-pension", PERIOD_ID, "28000.00")));
        when(ruleRepository.findEffectiveForCategory(CATEGORY_ID, period.referenceDate())).thenReturn(List.of(
                rule("ins-pension", true, "3000.00", "30000.00"),
                rule("ins-unemployment", true, null, null),
                rule("ins-health", false, null, null)));
        when(payrollRepository.findActiveByPeriodAndEmployees(PERIOD_ID, EMPLOYEES)).thenReturn(List.of(
                payroll("pay-1", "emp-1", PERIOD_ID, PayrollStatus.CALCULATED),
                payroll("pay-2", "emp-2", PERIOD_ID, PayrollStatus.DRAFT)));

        WorkflowProgress progress = progressService.progress(PERIOD_ID, EMPLOYEES);

        assertEquals(3, progress.totalEmployees());
        assertEquals(2, progress.categoriesAssigned());
        assertEquals(1, progress.positionsAssigned());
        assertEquals(1, progress.basesComplete());
        assertEquals(2, progress.payrollsCreated());
        assertEquals(1, progress.payrollsCalculated());
        assertEquals(List.of("emp-3"), progress.missingCategory());
        assertEquals(List.of("emp-2", "emp-3"), progress.missingPosition());
        assertEquals(List.of("emp-2", "emp-3"), progress.missingBases());
        assertEquals(List.of("emp-3"), progress.missingPayroll());
        assertEquals(67, progress.percentFor(WorkflowStep.EMPLOYEE_CATEGORY));
        verify(ruleRepository, times(1)).findEffectiveForCategory(CATEGORY_ID, period.referenceDate());
    }

    @Test
    @DisplayName("Duplicate employee ids are counted once")
    void duplicates() {
        List<String> employees = List.of("emp-1", "emp-1");
        when(periodService.require(PERIOD_ID)).thenReturn(period(PERIOD_ID, 2024, 3));
        when(categoryRepository.findByPeriodAndEmployees(PERIOD_ID, employees)).thenReturn(List.of());
        when(jobRepository.findByPeriodAndEmployees(PERIOD_ID, employees)).thenReturn(List.of());
        when(baseRepository.findByPeriodAndEmployees(PERIOD_ID, employees)).thenReturn(List.of());
        when(payrollRepository.findActiveByPeriodAndEmployees(PERIOD_ID, employees)).thenReturn(List.of());

        WorkflowProgress progress = progressService.progress(PERIOD_ID, employees);

        assertEquals(1, progress.totalEmployees());
        assertEquals(0, progress.categoriesAssigned());
        assertEquals(List.of("emp-1"), progress.missingBases());
        verifyNoInteractions(ruleRepository);
    }
}
