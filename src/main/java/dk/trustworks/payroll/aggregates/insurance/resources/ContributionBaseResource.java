package dk.trustworks.payroll.aggregates.insurance.resources;

import dk.trustworks.payroll.aggregates.insurance.dto.BaseValidationRequest;
import dk.trustworks.payroll.aggregates.insurance.dto.BaseValidationResult;
import dk.trustworks.payroll.aggregates.insurance.dto.BatchResolveRequest;
import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseCommand;
import dk.trustworks.payroll.aggregates.insurance.dto.ContributionBaseResolution;
import dk.trustworks.payroll.aggregates.insurance.model.ContributionBase;
import dk.trustworks.payroll.aggregates.insurance.services.ContributionBaseResolver;
import dk.trustworks.payroll.aggregates.insurance.services.ContributionBaseService;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollQueryService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "payroll-contribution-bases")
@Path("/payroll/contribution-bases")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class ContributionBaseResource {

    @Inject
    ContributionBaseResolver resolver;

    @Inject
    ContributionBaseService contributionBaseService;

    @Inject
    PayrollQueryService queryService;

    @GET
    public List<ContributionBase> findBases(@QueryParam("employeeId") String employeeId,
                                            @QueryParam("periodId") String periodId) {
        if (periodId == null) throw new BadRequestException("periodId is required");
        return employeeId == null
                ? queryService.periodContributionBases(periodId)
                : queryService.contributionBases(employeeId, periodId);
    }

    @GET
    @Path("/resolve")
    public ContributionBaseResolution resolve(@QueryParam("employeeId") String employeeId,
                                              @QueryParam("insuranceTypeId") String insuranceTypeId,
                                              @QueryParam("periodId") String periodId,
                                              @QueryParam("candidate") BigDecimal candidate) {
        if (employeeId == null || insuranceTypeId == null || periodId == null) {
            throw new BadRequestException("employeeId, insuranceTypeId and periodId are required");
        }
        return resolver.resolve(employeeId, insuranceTypeId, periodId, candidate);
    }

    @POST
    @Path("/batch-resolve")
    public Map<String, List<ContributionBaseResolution>> batchResolve(@Valid @NotNull BatchResolveRequest request) {
        return resolver.batchResolve(request.employeeIds(), request.periodId());
    }

    @POST
    @Path("/validate")
    public BaseValidationResult validate(@Valid @NotNull BaseValidationRequest request) {
        return resolver.validate(request.employeeId(), request.periodId(), request.bases());
    }

    @PUT
    public ContributionBase upsert(@Valid @NotNull ContributionBaseCommand command) {
        log.debugf("Upserting contribution base %s in period %s", command.itemId(), command.periodId());
        return contributionBaseService.upsert(command);
    }
}
