package dk.trustworks.payroll.exceptions;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

@Provider
public class PayrollValidationExceptionMapper implements ExceptionMapper<PayrollValidationException> {

    @Override
    public Response toResponse(PayrollValidationException exception) {
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("errors", exception.getErrors()))
                .build();
    }
}
