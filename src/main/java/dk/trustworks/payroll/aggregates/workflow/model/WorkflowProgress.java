package dk.trustworks.payroll.aggregates.workflow.model;

import java.util.List;

/**
 * How far the selected employees have come in a period.
 */
public record WorkflowProgress(String periodId,
                               int totalEmployees,
                               int categoriesAssigned,
                               int positionsAssigned,
                               int basesComplete,
                               int payrollsCreated,
                               int payrollsCalculated,
                               List<String> missingCategory,
                               List<String> missingPosition,
                               List<String> missingBases,
                               List<String> missingPayroll) {

    public WorkflowProgress {
        missingCategory = List.copyOf(missingCategory);
        missingPosition = List.copyOf(missingPosition);
        missingBases = List.copyOf(missingBases);
        missingPayroll = List.copyOf(missingPayroll);
    }

    /**
     * Completed count for a step whose completeness is tracked per employee, -1 otherwise.
     */
    public int completedFor(WorkflowStep step) {
        return switch (step) {
            case EMPLOYEE_CATEGORY -> categoriesAssigned;
            case EMPLOYEE_POSITION -> positionsAssigned;
            case CONTRIBUTION_BASE -> basesComplete;
            case EARNINGS_SETUP -> payrollsCreated;
            case CALCULATION -> payrollsCalculated;
            default -> -1;
        };
    }

    public List<String> missingFor(WorkflowStep step) {
        return switch (step) {
            case EMPLOYEE_CATEGORY -> missingCategory;
            case EMPLOYEE_POSITION -> missingPosition;
            case CONTRIBUTION_BASE -> missingBases;
            case EARNINGS_SETUP -> missingPayroll;
            default -> List.of();
        };
    }

    /**
     * Share of employees done with the step, 0-100.
     */
    public int percentFor(WorkflowStep step) {
        int completed = completedFor(step);
        if (completed < 0 || totalEmployees == 0) {
            return 0;
        }
        return (int) Math.round(completed * 100.0 / totalEmployees);
    }
}
