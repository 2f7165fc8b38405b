package dk.trustworks.payroll.aggregates.workflow.resources;

import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseCommand;
import dk.trustworks.payroll.aggregates.payroll.dto.EarningEntry;
import dk.trustworks.payroll.aggregates.workflow.dto.BatchResponse;
import dk.trustworks.payroll.aggregates.workflow.dto.CategoryBatchRequest;
import dk.trustworks.payroll.aggregates.workflow.dto.EmployeeSelection;
import dk.trustworks.payroll.aggregates.workflow.dto.PeriodSelection;
import dk.trustworks.payroll.aggregates.workflow.dto.WorkflowStepResponse;
import dk.trustworks.payroll.aggregates.workflow.model.CompleteWorkflowRequest;
import dk.trustworks.payroll.aggregates.workflow.model.PositionPlacement;
import dk.trustworks.payroll.aggregates.workflow.model.StepValidationResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowExecutionResult;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowProgress;
import dk.trustworks.payroll.aggregates.workflow.model.WorkflowStep;
import dk.trustworks.payroll.aggregates.workflow.services.PayrollWorkflow;
import dk.trustworks.payroll.aggregates.workflow.services.WorkflowProgressService;
import dk.trustworks.payroll.aggregates.workflow.services.WorkflowSessionRegistry;
import dk.trustworks.payroll.batch.BatchOperationResult;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "payroll-workflow")
@Path("/payroll/workflows")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class PayrollWorkflowResource {

    @Inject
    WorkflowSessionRegistry sessions;

    @Inject
    WorkflowProgressService progressService;

    @POST
    public Response open() {
        PayrollWorkflow workflow = sessions.open();
        return Response.status(Response.Status.CREATED)
                .entity(new WorkflowStepResponse(workflow.getId(), workflow.state(), null))
                .build();
    }

    @GET
    @Path("/{sessionId}")
    public WorkflowStepResponse get(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        return new WorkflowStepResponse(sessionId, workflow.state(), null);
    }

    @DELETE
    @Path("/{sessionId}")
    public void close(@PathParam("sessionId") String sessionId) {
        sessions.close(sessionId);
    }

    @POST
    @Path("/{sessionId}/advance")
    public WorkflowStepResponse advance(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            StepValidationResult validation = workflow.advance();
            return new WorkflowStepResponse(sessionId, workflow.state(), validation);
        }
    }

    @POST
    @Path("/{sessionId}/retreat")
    public WorkflowStepResponse retreat(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            return new WorkflowStepResponse(sessionId, workflow.retreat(), null);
        }
    }

    @POST
    @Path("/{sessionId}/jump/{step}")
    public Response jumpTo(@PathParam("sessionId") String sessionId, @PathParam("step") String step) {
        WorkflowStep target = WorkflowStep.parse(step)
                .orElseThrow(() -> new PayrollValidationException("Unknown workflow step: " + step));
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            boolean accepted = workflow.jumpTo(target);
            return Response.status(accepted ? Response.Status.OK : Response.Status.CONFLICT)
                    .entity(new WorkflowStepResponse(sessionId, workflow.state(), null))
                    .build();
        }
    }

    @POST
    @Path("/{sessionId}/reset")
    public WorkflowStepResponse reset(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            return new WorkflowStepResponse(sessionId, workflow.reset(), null);
        }
    }

    @PUT
    @Path("/{sessionId}/period")
    public Response selectPeriod(@PathParam("sessionId") String sessionId, @Valid PeriodSelection selection) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            return selectionResponse(sessionId, workflow, workflow.selectPeriod(selection.periodId()));
        }
    }

    @PUT
    @Path("/{sessionId}/employees")
    public Response selectEmployees(@PathParam("sessionId") String sessionId, @Valid EmployeeSelection selection) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            return selectionResponse(sessionId, workflow, workflow.selectEmployees(selection.employeeIds()));
        }
    }

    @GET
    @Path("/{sessionId}/progress")
    public WorkflowProgress progress(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        if (!workflow.state().hasSelection()) {
            throw new PayrollValidationException("No period or employees selected");
        }
        return progressService.progress(workflow.state().selectedPeriod(), workflow.state().selectedEmployees());
    }

    @POST
    @Path("/{sessionId}/batches/categories")
    public BatchResponse assignCategories(@PathParam("sessionId") String sessionId, @Valid CategoryBatchRequest request) {
        return batch(sessionId, workflow -> workflow.batchAssignCategories(request.categoryId()));
    }

    @POST
    @Path("/{sessionId}/batches/positions")
    public BatchResponse assignPositions(@PathParam("sessionId") String sessionId,
                                         Map<String, @Valid PositionPlacement> placements) {
        return batch(sessionId, workflow -> workflow.batchAssignPositions(placements));
    }

    @POST
    @Path("/{sessionId}/batches/contribution-bases")
    public BatchResponse setContributionBases(@PathParam("sessionId") String sessionId,
                                              List<@Valid ContributionBaseCommand> commands) {
        return batch(sessionId, workflow -> workflow.batchSetContributionBases(commands));
    }

    @POST
    @Path("/{sessionId}/batches/contribution-bases/resolve")
    public BatchResponse resolveContributionBases(@PathParam("sessionId") String sessionId) {
        return batch(sessionId, PayrollWorkflow::batchResolveContributionBases);
    }

    @POST
    @Path("/{sessionId}/batches/payrolls")
    public BatchResponse createPayrolls(@PathParam("sessionId") String sessionId) {
        return batch(sessionId, PayrollWorkflow::batchCreatePayrolls);
    }

    @POST
    @Path("/{sessionId}/batches/earnings")
    public BatchResponse enterEarnings(@PathParam("sessionId") String sessionId, List<@Valid EarningEntry> entries) {
        return batch(sessionId, workflow -> workflow.batchEnterEarnings(entries));
    }

    @POST
    @Path("/{sessionId}/batches/calculations")
    public BatchResponse calculatePayrolls(@PathParam("sessionId") String sessionId) {
        return batch(sessionId, PayrollWorkflow::batchCalculatePayrolls);
    }

    @POST
    @Path("/{sessionId}/cancel")
    public WorkflowStepResponse cancel(@PathParam("sessionId") String sessionId) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        workflow.cancel();
        return new WorkflowStepResponse(sessionId, workflow.state(), null);
    }

    @POST
    @Path("/{sessionId}/execute")
    @WithSpan("payroll.workflow.execute")
    public WorkflowExecutionResult execute(@PathParam("sessionId") String sessionId, @Valid CompleteWorkflowRequest request) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        log.infof("Executing complete workflow for session %s, period %s", sessionId, request.periodId());
        synchronized (workflow) {
            return workflow.executeCompleteWorkflow(request);
        }
    }

    private BatchResponse batch(String sessionId, Function<PayrollWorkflow, BatchOperationResult> operation) {
        PayrollWorkflow workflow = sessions.get(sessionId);
        synchronized (workflow) {
            BatchOperationResult result = operation.apply(workflow);
            return new BatchResponse(result, workflow.state());
        }
    }

    private static Response selectionResponse(String sessionId, PayrollWorkflow workflow, boolean accepted) {
        return Response.status(accepted ? Response.Status.OK : Response.Status.CONFLICT)
                .entity(new WorkflowStepResponse(sessionId, workflow.state(), null))
                .build();
    }
}
