package dk.trustworks.payroll.aggregates.workflow.services;

import dk.trustworks.payroll.config.PayrollEngineConfig;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import lombok.extern.jbosslog.JBossLog;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open workflow sessions by id. Sessions live in memory only and are dropped once they have
 * not been touched for {@code payroll.workflow.session-idle-timeout}.
 */
@JBossLog
@ApplicationScoped
public class WorkflowSessionRegistry {

    @Inject
    PayrollWorkflowFactory factory;

    @Inject
    PayrollEngineConfig config;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public PayrollWorkflow open() {
        PayrollWorkflow workflow = factory.create();
        sessions.put(workflow.getId(), new Session(workflow, Instant.now()));
        log.infof("Opened payroll workflow session %s", workflow.getId());
        return workflow;
    }

    public PayrollWorkflow get(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("Workflow session not found: " + sessionId);
        }
        session.touch(Instant.now());
        return session.workflow;
    }

    public void close(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            throw new NotFoundException("Workflow session not found: " + sessionId);
        }
        session.workflow.cancel();
        log.infof("Closed payroll workflow session %s", sessionId);
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(every = "5m", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeIdleSessions() {
        purgeIdle(Instant.now());
    }

    /**
     * Drops every session last touched before {@code now} minus the idle timeout, cancelling
     * any batch still running in it.
     *
     * @return number of sessions dropped
     */
    int purgeIdle(Instant now) {
        Duration idleTimeout = config.workflow().sessionIdleTimeout();
        Instant cutoff = now.minus(idleTimeout);
        int purged = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.lastAccess.isBefore(cutoff) && sessions.remove(entry.getKey(), session)) {
                session.workflow.cancel();
                purged++;
                log.infof("Dropped payroll workflow session %s after %s idle", entry.getKey(), idleTimeout);
            }
        }
        return purged;
    }

    private static final class Session {
        private final PayrollWorkflow workflow;
        private volatile Instant lastAccess;

        Session(PayrollWorkflow workflow, Instant lastAccess) {
            this.workflow = workflow;
            this.lastAccess = lastAccess;
        }

        void touch(Instant now) {
            lastAccess = now;
        }
    }
}
