package dk.trustworks.payroll;

import dk.trustworks.payroll.aggregates.workflow.services.WorkflowSessionRegistry;
import dk.trustworks.payroll.config.PayrollEngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

@Liveness
@ApplicationScoped
public class PayrollEngineHealthCheck implements HealthCheck {

    @Inject
    WorkflowSessionRegistry sessions;

    @Inject
    PayrollEngineConfig config;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("payroll-engine")
                .up()
                .withData("workflowSessions", sessions.size())
                .withData("batchMaxConcurrency", config.batch().maxConcurrency())
                .build();
    }
}
