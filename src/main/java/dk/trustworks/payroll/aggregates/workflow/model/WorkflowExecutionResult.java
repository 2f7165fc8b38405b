package dk.trustworks.payroll.aggregates.workflow.model;

import java.util.List;

/**
 * Outcome of a complete workflow run. On failure, failedStage names the stage that aborted
 * the run; stages before it stay committed.
 */
public record WorkflowExecutionResult(boolean success,
                                      List<StageResult> stages,
                                      WorkflowStage failedStage,
                                      String message,
                                      WorkflowState state) {

    public WorkflowExecutionResult {
        stages = List.copyOf(stages);
    }
}
