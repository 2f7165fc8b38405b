package dk.trustworks.payroll.aggregates.workflow.dto;

import dk.trustworks.payroll.aggregates.workflow.model.WorkflowState;
import dk.trustworks.payroll.batch.BatchOperationResult;

public record BatchResponse(BatchOperationResult result, WorkflowState state) {
}
