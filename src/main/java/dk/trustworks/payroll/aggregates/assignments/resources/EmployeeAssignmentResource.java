package dk.trustworks.payroll.aggregates.assignments.resources;

import dk.trustworks.payroll.aggregates.assignments.dto.CategoryAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.dto.EmployeeAssignmentView;
import dk.trustworks.payroll.aggregates.assignments.dto.JobAssignmentCommand;
import dk.trustworks.payroll.aggregates.assignments.model.CategoryAssignment;
import dk.trustworks.payroll.aggregates.assignments.model.JobAssignment;
import dk.trustworks.payroll.aggregates.assignments.services.EmployeeAssignmentService;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollQueryService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@Tag(name = "payroll-assignments")
@Path("/payroll/assignments")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class EmployeeAssignmentResource {

    @Inject
    EmployeeAssignmentService assignmentService;

    @Inject
    PayrollQueryService queryService;

    @GET
    @Path("/{employeeId}/{periodId}")
    public EmployeeAssignmentView get(@PathParam("employeeId") String employeeId, @PathParam("periodId") String periodId) {
        return queryService.assignments(employeeId, periodId);
    }

    @PUT
    @Path("/category")
    public CategoryAssignment assignCategory(@Valid @NotNull CategoryAssignmentCommand command) {
        return assignmentService.assignCategory(command);
    }

    @PUT
    @Path("/position")
    public JobAssignment assignPosition(@Valid @NotNull JobAssignmentCommand command) {
        return assignmentService.assignPosition(command);
    }
}
