package dk.trustworks.payroll.aggregates.workflow.model;

/**
 * Stages of a complete workflow run and the step each belongs to.
 */
public enum WorkflowStage {
    CATEGORY_ASSIGNMENT(WorkflowStep.EMPLOYEE_CATEGORY),
    POSITION_ASSIGNMENT(WorkflowStep.EMPLOYEE_POSITION),
    CONTRIBUTION_BASES(WorkflowStep.CONTRIBUTION_BASE),
    PAYROLL_CREATION(WorkflowStep.EARNINGS_SETUP),
    EARNINGS_ENTRY(WorkflowStep.EARNINGS_SETUP),
    CALCULATION(WorkflowStep.CALCULATION);

    private final WorkflowStep step;

    WorkflowStage(WorkflowStep step) {
        this.step = step;
    }

    public WorkflowStep step() {
        return step;
    }
}
