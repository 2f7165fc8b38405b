package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.repositories.PayrollRepository;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.repositories.PayrollPeriodRepository;
import dk.trustworks.payroll.aggregates.workflow.model.StepValidationResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowProgress;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowState;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowStep;
import dk.trustworks.payroll.config.PayrollEngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decides whether the workflow may leave a step.
 */
@ApplicationScoped
public class WorkflowStepValidator {

    @Inject
    PayrollEngineConfig config;

    @Inject
    PayrollPeriodRepository periodRepository;

    @Inject
    PayrollRepository payrollRepository;

    @Inject
    WorkflowProgressService progressService;

    public boolean isOptional(WorkflowStep step) {
        return config.workflow().optionalSteps()
                .map(steps -> steps.stream()
                        .map(WorkflowStep::parse)
                        .flatMap(Optional::stream)
                        .anyMatch(step::equals))
                .orElse(false);
    }

    public StepValidationResult validate(WorkflowStep step, WorkflowState state) {
        if (!config.workflow().validationEnabled()) {
            return StepValidationResult.ok();
        }
        return switch (step) {
            case PERIOD_SELECTION -> validatePeriodSelection(state);
            case EMPLOYEE_CATEGORY, EMPLOYEE_POSITION, CONTRIBUTION_BASE -> validateCompleteness(step, state);
            case EARNINGS_SETUP -> validateEarningsSetup(state);
            case CALCULATION -> validateCalculation(state);
            case REVIEW -> validateReview(state);
            case COMPLETION -> StepValidationResult.ok();
        };
    }

    private StepValidationResult validatePeriodSelection(WorkflowState state) {
        StepValidationResult.Builder result = StepValidationResult.builder();
        if (state.selectedPeriod() == null) {
            result.error("Select a payroll period");
        } else {
            Optional<PayrollPeriod> period = periodRepository.findByIdOptional(state.selectedPeriod());
            if (period.isEmpty()) {
                result.error("Payroll period " + state.selectedPeriod() + " does not exist");
            } else if (period.get().isClosed()) {
                result.error("Payroll period " + state.selectedPeriod() + " is closed");
            }
        }
        if (state.selectedEmployees().isEmpty()) {
            result.error("Select at least one employee");
        }
        return result.build();
    }

    private StepValidationResult validateCompleteness(WorkflowStep step, WorkflowState state) {
        if (!state.hasSelection()) {
            return StepValidationResult.rejected("No period or employees selected");
        }
        WorkflowProgress progress = progressService.progress(state.selectedPeriod(), state.selectedEmployees());
        StepValidationResult.Builder result = StepValidationResult.builder();
        int completed = progress.completedFor(step);
        if (completed < progress.totalEmployees()) {
            result.shortfall(String.format("%d of %d employees are missing %s",
                    progress.totalEmployees() - completed, progress.totalEmployees(), describe(step)), isOptional(step));
            result.missing(progress.missingFor(step));
        }
        return result.build();
    }

    private StepValidationResult validateEarningsSetup(WorkflowState state) {
        if (state.selectedPeriod() == null) {
            return StepValidationResult.rejected("Select a payroll period");
        }
        return StepValidationResult.ok();
    }

    private StepValidationResult validateCalculation(WorkflowState state) {
        if (!state.hasSelection()) {
            return StepValidationResult.rejected("No period or employees selected");
        }
        Map<String, Payroll> payrolls = payrollsOf(state);
        List<String> notCalculated = state.selectedEmployees().stream()
                .filter(id -> payrolls.get(id) == null
                        || !PayrollStatus.CALCULATED_OR_LATER.contains(payrolls.get(id).getStatus()))
                .toList();
        StepValidationResult.Builder result = StepValidationResult.builder();
        if (!notCalculated.isEmpty()) {
            result.error(String.format("%d of %d payrolls are not calculated",
                    notCalculated.size(), state.selectedEmployees().size()));
            result.missing(notCalculated);
        }
        return result.build();
    }

    private StepValidationResult validateReview(WorkflowState state) {
        if (!state.hasSelection()) {
            return StepValidationResult.rejected("No period or employees selected");
        }
        Set<PayrollStatus> unfinished = EnumSet.of(PayrollStatus.DRAFT, PayrollStatus.CALCULATING);
        StepValidationResult.Builder result = StepValidationResult.builder();
        for (Payroll payroll : payrollsOf(state).values()) {
            if (unfinished.contains(payroll.getStatus())) {
                result.error("Payroll " + payroll.getUuid() + " for employee " + payroll.getEmployeeId()
                        + " is still " + payroll.getStatus());
            } else if (!payroll.isBalanced()) {
                result.error("Payroll " + payroll.getUuid() + " for employee " + payroll.getEmployeeId()
                        + " has net pay that does not equal gross pay minus deductions");
            }
        }
        return result.build();
    }

    private Map<String, Payroll> payrollsOf(WorkflowState state) {
        return payrollRepository.findActiveByPeriodAndEmployees(state.selectedPeriod(), state.selectedEmployees())
                .stream()
                .collect(Collectors.toMap(Payroll::getEmployeeId, Function.identity(), (a, b) -> a));
    }

    private static String describe(WorkflowStep step) {
        return switch (step) {
            case EMPLOYEE_CATEGORY -> "a category assignment";
            case EMPLOYEE_POSITION -> "a position assignment";
            case CONTRIBUTION_BASE -> "contribution bases";
            default -> step.wireId();
        };
    }
}
