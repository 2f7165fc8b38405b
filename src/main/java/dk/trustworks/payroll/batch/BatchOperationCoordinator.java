package dk.trustworks.payroll.batch;

import dk.trustworks.payroll.config.PayrollEngineConfig;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.context.ManagedExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Applies an operation to every item of a batch and reports per-item success or failure.
 *
 * <p>A failing item never stops the batch. At most {@code payroll.batch.max-concurrency}
 * items run at once on the managed executor; with a limit of 1 the items run in order on the
 * calling thread. Items are dispatched in order, completion order is unspecified.
 *
 * <p>Each operation is expected to run in its own transaction and to upsert by natural key,
 * so running the same batch again is safe.
 */
@JBossLog
@ApplicationScoped
public class BatchOperationCoordinator {

    @Inject
    PayrollEngineConfig config;

    @Inject
    ManagedExecutor managedExecutor;

    @Inject
    MeterRegistry registry;

    public <T> BatchOperationResult execute(String operation, List<T> items, Function<T, String> itemId,
                                            Consumer<T> op) {
        return execute(operation, items, itemId, op, BatchCancellation.none());
    }

    public <T> BatchOperationResult execute(String operation, List<T> items, Function<T, String> itemId,
                                            Consumer<T> op, BatchCancellation cancellation) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(op, "op");
        BatchCancellation stop = cancellation == null ? BatchCancellation.none() : cancellation;
        if (items.isEmpty()) {
            return BatchOperationResult.empty();
        }

        int maxConcurrency = Math.max(1, config.batch().maxConcurrency());
        Tally tally = new Tally();
        long start = System.nanoTime();
        if (maxConcurrency == 1) {
            runSequential(operation, items, itemId, op, stop, tally);
        } else {
            runConcurrent(operation, items, itemId, op, stop, tally, maxConcurrency);
        }
        BatchOperationResult result = tally.toResult();

        long durMs = (System.nanoTime() - start) / 1_000_000;
        log.infof("Batch %s finished: %d succeeded, %d failed, %d cancelled of %d items in %d ms",
                operation, result.getSuccessCount(), result.getFailedCount(), result.getCancelledCount(),
                items.size(), durMs);
        registry.counter("payroll.batch.items", "operation", operation, "result", "success").increment(result.getSuccessCount());
        registry.counter("payroll.batch.items", "operation", operation, "result", "failed").increment(result.getFailedCount());
        registry.counter("payroll.batch.items", "operation", operation, "result", "cancelled").increment(result.getCancelledCount());
        return result;
    }

    private <T> void runSequential(String operation, List<T> items, Function<T, String> itemId, Consumer<T> op,
                                   BatchCancellation stop, Tally tally) {
        for (T item : items) {
            String id = itemId.apply(item);
            if (stop.isCancelled()) {
                tally.cancelled(id);
                continue;
            }
            runItem(operation, item, id, op, tally);
        }
    }

    private <T> void runConcurrent(String operation, List<T> items, Function<T, String> itemId, Consumer<T> op,
                                   BatchCancellation stop, Tally tally, int maxConcurrency) {
        Semaphore permits = new Semaphore(maxConcurrency);
        List<CompletableFuture<Void>> inFlight = new ArrayList<>(items.size());
        int index = 0;
        try {
            for (; index < items.size(); index++) {
                T item = items.get(index);
                String id = itemId.apply(item);
                if (stop.isCancelled()) {
                    tally.cancelled(id);
                    continue;
                }
                permits.acquire();
                if (stop.isCancelled()) {
                    permits.release();
                    tally.cancelled(id);
                    continue;
                }
                try {
                    inFlight.add(CompletableFuture
                            .runAsync(() -> runItem(operation, item, id, op, tally), managedExecutor)
                            .whenComplete((ignored, failure) -> permits.release()));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    log.warnf(e, "Batch %s could not dispatch item %s", operation, id);
                    tally.failed(id, "Rejected by executor: " + e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Batch %s interrupted; %d items not dispatched", operation, items.size() - index);
            for (; index < items.size(); index++) {
                tally.cancelled(itemId.apply(items.get(index)));
            }
        }
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
    }

    private <T> void runItem(String operation, T item, String id, Consumer<T> op, Tally tally) {
        try {
            op.accept(item);
            tally.succeeded(id);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warnf("Batch %s failed for item %s: %s", operation, id, message);
            log.debugf(e, "Batch %s failure detail for item %s", operation, id);
            tally.failed(id, message);
        }
    }

    private static final class Tally {
        private final AtomicInteger success = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger cancelled = new AtomicInteger();
        private final ConcurrentLinkedQueue<BatchItemError> errors = new ConcurrentLinkedQueue<>();
        private final Set<String> succeededIds = ConcurrentHashMap.newKeySet();

        void succeeded(String id) {
            success.incrementAndGet();
            succeededIds.add(id);
        }

        void failed(String id, String message) {
            failed.incrementAndGet();
            errors.add(new BatchItemError(id, message));
        }

        void cancelled(String id) {
            cancelled.incrementAndGet();
            errors.add(new BatchItemError(id, "Cancelled before dispatch"));
        }

        BatchOperationResult toResult() {
            return new BatchOperationResult(success.get(), failed.get(), cancelled.get(),
                    new ArrayList<>(errors), succeededIds);
        }
    }
}
