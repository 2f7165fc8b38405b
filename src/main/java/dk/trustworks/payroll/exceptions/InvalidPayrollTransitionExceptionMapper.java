package dk.trustworks.payroll.exceptions;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

@Provider
public class InvalidPayrollTransitionExceptionMapper implements ExceptionMapper<InvalidPayrollTransitionException> {

    @Override
    public Response toResponse(InvalidPayrollTransitionException exception) {
        return Response.status(Response.Status.CONFLICT)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", String.valueOf(exception.getMessage())))
                .build();
    }
}
