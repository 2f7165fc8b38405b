package dk.trustworks.payroll.aggregates.workflow.dto;

import dk.trustworks.payroll.aggregates.workflow.model.StepValidationResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowState;

public record WorkflowStepResponse(String sessionId, WorkflowState state, StepValidationResult validation) {
}
