package dk.trustworks.payroll.aggregates.period.resources;

import dk.trustworks.payroll.aggregates.payroll.services.PayrollQueryService;
import dk.trustworks.payroll.aggregates.period.dto.PeriodCommand;
import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import dk.trustworks.payroll.aggregates.period.services.PayrollPeriodService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "payroll-periods")
@Path("/payroll/periods")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class PayrollPeriodResource {

    @Inject
    PayrollPeriodService periodService;

    @Inject
    PayrollQueryService queryService;

    @POST
    public PayrollPeriod create(@Valid @NotNull PeriodCommand command) {
        return periodService.create(command.year(), command.month(), command.startDate(), command.endDate(), command.payDate());
    }

    @GET
    @Path("/{periodId}")
    public PayrollPeriod get(@PathParam("periodId") String periodId) {
        return queryService.getPeriod(periodId);
    }

    @PUT
    @Path("/{periodId}")
    public PayrollPeriod updateDates(@PathParam("periodId") String periodId, @Valid @NotNull PeriodCommand command) {
        return periodService.updateDates(periodId, command.startDate(), command.endDate(), command.payDate());
    }

    @POST
    @Path("/{periodId}/open")
    public PayrollPeriod open(@PathParam("periodId") String periodId) {
        return periodService.open(periodId);
    }

    @POST
    @Path("/{periodId}/close")
    public PayrollPeriod close(@PathParam("periodId") String periodId) {
        log.infof("Closing payroll period %s", periodId);
        return periodService.close(periodId);
    }
}
