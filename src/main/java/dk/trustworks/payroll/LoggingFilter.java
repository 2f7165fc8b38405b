package dk.trustworks.payroll;


import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Logs mutating JSON requests against the payroll endpoints. Bodies carry salary figures
 * and are only logged at debug level.
 */
@JBossLog
@Provider
public class LoggingFilter implements ContainerRequestFilter {

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        String method = requestContext.getMethod();
        boolean mutating = HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method) || HttpMethod.DELETE.equals(method);
        if (mutating && requestContext.getMediaType() != null
                && requestContext.getMediaType().isCompatible(MediaType.APPLICATION_JSON_TYPE)) {
            logRequest(requestContext);
        }
    }

    private void logRequest(ContainerRequestContext requestContext) throws IOException {
        log.infof("%s /%s", requestContext.getMethod(), requestContext.getUriInfo().getPath());
        requestContext.getUriInfo().getPathParameters().forEach((k, v) -> log.debugf("%s: %s", k, v));
        if (!log.isDebugEnabled()) return;

        InputStream originalStream = requestContext.getEntityStream();
        byte[] requestEntity = originalStream.readAllBytes();
        if (requestEntity.length > 0) {
            log.debugf("Request body: %d bytes", requestEntity.length);
        }
        // Restore the original input stream
        requestContext.setEntityStream(new ByteArrayInputStream(requestEntity));
    }
}
