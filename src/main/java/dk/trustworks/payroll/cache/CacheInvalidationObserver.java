package dk.trustworks.payroll.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.TransactionPhase;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@ApplicationScoped
public class CacheInvalidationObserver {

    @Inject
    CacheInvalidationManager invalidationManager;

    void onMutation(@Observes(during = TransactionPhase.AFTER_SUCCESS) PayrollMutationEvent event) {
        log.debugf("Payroll data changed: %s %s", event.event().wireName(), event.context());
        invalidationManager.invalidate(event.event(), event.context());
    }
}
