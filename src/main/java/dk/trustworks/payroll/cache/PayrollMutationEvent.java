package dk.trustworks.payroll.cache;

import java.time.LocalDateTime;

/**
 * CDI event fired by services after they changed payroll data.
 * Observed once the surrounding transaction has committed.
 */
public record PayrollMutationEvent(CacheEvent event, InvalidationContext context, LocalDateTime occurredAt) {

    public PayrollMutationEvent {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (context == null) {
            context = InvalidationContext.empty();
        }
        if (occurredAt == null) {
            occurredAt = LocalDateTime.now();
        }
    }

    public static PayrollMutationEvent of(CacheEvent event, InvalidationContext context) {
        return new PayrollMutationEvent(event, context, LocalDateTime.now());
    }
}
