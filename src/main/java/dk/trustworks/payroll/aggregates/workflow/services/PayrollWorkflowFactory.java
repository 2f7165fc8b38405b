package dk.trustworks.payroll.aggregates.workflow.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.UUID;

@ApplicationScoped
public class PayrollWorkflowFactory {

    @Inject
    WorkflowStepValidator validator;

    @Inject
    PayrollBatchOperations operations;

    public PayrollWorkflow create() {
        return new PayrollWorkflow(UUID.randomUUID().toString(), validator, operations);
    }
}
