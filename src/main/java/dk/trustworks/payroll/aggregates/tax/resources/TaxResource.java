package dk.trustworks.payroll.aggregates.tax.resources;

import dk.trustworks.payroll.aggregates.tax.dto.TaxValidationRequest;
import dk.trustworks.payroll.aggregates.tax.model.PeriodKind;
import dk.trustworks.payroll.aggregates.tax.model.TaxBracket;
import dk.trustworks.payroll.aggregates.tax.model.TaxInput;
import dk.trustworks.payroll.aggregates.tax.model.TaxResult;
import dk.trustworks.payroll.aggregates.tax.model.TaxValidationResult;
import dk.trustworks.payroll.aggregates.tax.services.ProgressiveTaxCalculator;
import dk.trustworks.payroll.aggregates.tax.services.TaxDataValidator;
import dk.trustworks.payroll.exceptions.PayrollValidationException;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

import static jakarta.ws.rs.core.MediaType.APPLICATION_JSON;

@JBossLog
@Tag(name = "payroll-tax")
@Path("/payroll/tax")
@RequestScoped
@Produces(APPLICATION_JSON)
@Consumes(APPLICATION_JSON)
public class TaxResource {

    @Inject
    ProgressiveTaxCalculator calculator;

    @Inject
    TaxDataValidator validator;

    @POST
    @Path("/compute")
    public TaxResult compute(@Valid @NotNull TaxInput input) {
        return calculator.compute(input);
    }

    @POST
    @Path("/year-to-date")
    public List<TaxResult> computeYearToDate(@NotNull List<@Valid TaxInput> periods) {
        return calculator.computeYearToDate(periods);
    }

    @POST
    @Path("/validate")
    public TaxValidationResult validate(@Valid @NotNull TaxValidationRequest request) {
        return validator.validate(request.taxableIncome(), request.taxAmount(), request.specialDeductions());
    }

    @GET
    @Path("/brackets")
    public List<TaxBracket> brackets(@QueryParam("kind") @DefaultValue("MONTHLY") String kind) {
        try {
            return PeriodKind.valueOf(kind.toUpperCase()).table().brackets();
        } catch (IllegalArgumentException e) {
            throw new PayrollValidationException("Unknown period kind: " + kind);
        }
    }
}
