package dk.trustworks.payroll.aggregates.payroll.resources;

import dk.trustworks.payroll.aggregates.payroll.dto.CreatePayrollRequest;
import dk.trustworks.payroll.aggregates.payroll.dto.ItemAmountRequest;
import dk.trustworks.payroll.aggregates.payroll.dto.PayrollCalculationResult;
import dk.trustworks.payroll.aggregates.payroll.dto.PeriodPayrollStatistics;
import dk.trustworks.payroll.aggregates.payroll.model.Payroll;
import dk.trustworks.payroll.aggregates.payroll.model.PayrollItem;
import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.PayrollStatus;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollCalculationService;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollQueryService;
import dk.trustworks.payroll.aggregates.payroll.services.PayrollService;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.math.BigDecimal;
import java.util.List;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "payroll")
@Path("/payroll/payrolls")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class PayrollResource {

    @Inject
    PayrollService payrollService;

    @Inject
    PayrollCalculationService calculationService;

    @Inject
    PayrollQueryService queryService;

    @GET
    public List<Payroll> list(@QueryParam("periodId") String periodId, @QueryParam("employeeId") String employeeId) {
        if (periodId != null) return queryService.listByPeriod(periodId);
        if (employeeId != null) return queryService.listByEmployee(employeeId);
        throw new BadRequestException("periodId or employeeId is required");
    }

    @POST
    public Payroll create(@Valid @NotNull CreatePayrollRequest request) {
        return payrollService.createPayroll(request.employeeId(), request.periodId());
    }

    @GET
    @Path("/statistics")
    public PeriodPayrollStatistics statistics(@QueryParam("periodId") String periodId) {
        if (periodId == null) throw new BadRequestException("periodId is required");
        return queryService.periodStatistics(periodId);
    }

    @GET
    @Path("/components")
    public List<SalaryComponent> components() {
        return queryService.salaryComponents();
    }

    @GET
    @Path("/{payrollId}")
    public Payroll get(@PathParam("payrollId") String payrollId) {
        return queryService.getPayroll(payrollId);
    }

    @GET
    @Path("/{payrollId}/items")
    public List<PayrollItem> items(@PathParam("payrollId") String payrollId) {
        return queryService.getItems(payrollId);
    }

    @PUT
    @Path("/{payrollId}/items/{componentId}")
    public PayrollItem upsertItem(@PathParam("payrollId") String payrollId,
                                  @PathParam("componentId") String componentId,
                                  @Valid @NotNull ItemAmountRequest request) {
        return payrollService.upsertItem(payrollId, componentId, request.amount(), request.notes());
    }

    @DELETE
    @Path("/{payrollId}/items/{componentId}")
    public void deleteItem(@PathParam("payrollId") String payrollId, @PathParam("componentId") String componentId) {
        payrollService.deleteItem(payrollId, componentId);
    }

    @POST
    @Path("/{payrollId}/calculate")
    public PayrollCalculationResult calculate(@PathParam("payrollId") String payrollId,
                                              @QueryParam("specialDeductions") BigDecimal specialDeductions) {
        return calculationService.calculate(payrollId, specialDeductions);
    }

    @POST
    @Path("/{payrollId}/status/{status}")
    public Payroll changeStatus(@PathParam("payrollId") String payrollId, @PathParam("status") String status) {
        PayrollStatus target;
        try {
            target = PayrollStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new PayrollValidationException("Unknown payroll status: " + status);
        }
        log.infof("Changing payroll %s to %s", payrollId, target);
        return payrollService.changeStatus(payrollId, target);
    }
}
