package dk.trustworks.payroll.aggregates.workflow.model;

import dk.trustworks.payroll.batch.BatchOperationResult;

public record StageResult(WorkflowStage stage, BatchOperationResult result) {
}
