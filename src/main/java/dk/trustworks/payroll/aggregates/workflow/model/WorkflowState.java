package dk.trustworks.payroll.aggregates.workflow.model;

import java.util.List;

/**
 * Snapshot of a workflow session. Immutable; every operation produces a new snapshot.
 *
 * completedSteps is always the prefix of the step order ending just before currentStep.
 */
public record WorkflowState(WorkflowStep currentStep,
                            String selectedPeriod,
                            List<String> selectedEmployees,
                            List<WorkflowStep> completedSteps,
                            List<String> errors,
                            List<String> warnings,
                            boolean processing) {

    public WorkflowState {
        selectedEmployees = List.copyOf(selectedEmployees);
        completedSteps = List.copyOf(completedSteps);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static WorkflowState initial() {
        return new WorkflowState(WorkflowStep.PERIOD_SELECTION, null, List.of(), List.of(), List.of(), List.of(), false);
    }

    public boolean isCompleted(WorkflowStep step) {
        return completedSteps.contains(step);
    }

    public boolean hasSelection() {
        return selectedPeriod != null && !selectedEmployees.isEmpty();
    }

    /**
     * Moves to the step and rebuilds completedSteps as the steps before it.
     */
    public WorkflowState atStep(WorkflowStep step) {
        return new WorkflowState(step, selectedPeriod, selectedEmployees, step.predecessors(), errors, warnings, processing);
    }

    public WorkflowState withPeriod(String periodId) {
        return new WorkflowState(currentStep, periodId, selectedEmployees, completedSteps, errors, warnings, processing);
    }

    public WorkflowState withEmployees(List<String> employeeIds) {
        return new WorkflowState(currentStep, selectedPeriod, employeeIds, completedSteps, errors, warnings, processing);
    }

    public WorkflowState withMessages(List<String> newErrors, List<String> newWarnings) {
        return new WorkflowState(currentStep, selectedPeriod, selectedEmployees, completedSteps, newErrors, newWarnings, processing);
    }

    public WorkflowState clearMessages() {
        return withMessages(List.of(), List.of());
    }

    public WorkflowState withProcessing(boolean value) {
        return new WorkflowState(currentStep, selectedPeriod, selectedEmployees, completedSteps, errors, warnings, value);
    }
}
