package dk.trustworks.payroll.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a running batch. Items not yet dispatched when it is
 * cancelled are reported as cancelled; items already running finish.
 */
public class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
