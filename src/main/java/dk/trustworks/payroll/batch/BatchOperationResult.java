package dk.trustworks.payroll.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;

/**
 * Outcome of applying one operation to many items.
 */
@Getter
@ToString
@EqualsAndHashCode
public class BatchOperationResult {

    private final int successCount;
    private final int failedCount;
    private final int cancelledCount;
    private final List<BatchItemError> errors;
    @JsonIgnore
    private final Set<String> succeededItemIds;

    public BatchOperationResult(int successCount, int failedCount, int cancelledCount,
                                List<BatchItemError> errors, Set<String> succeededItemIds) {
        this.successCount = successCount;
        this.failedCount = failedCount;
        this.cancelledCount = cancelledCount;
        this.errors = List.copyOf(errors);
        this.succeededItemIds = Set.copyOf(succeededItemIds);
    }

    public static BatchOperationResult empty() {
        return new BatchOperationResult(0, 0, 0, List.of(), Set.of());
    }

    public int getTotalCount() {
        return successCount + failedCount + cancelledCount;
    }

    /**
     * True when there were items and none of them succeeded.
     */
    public boolean isTotalFailure() {
        return getTotalCount() > 0 && successCount == 0;
    }

    public boolean hasFailures() {
        return failedCount > 0 || cancelledCount > 0;
    }

    public boolean isSucceeded(String itemId) {
        return succeededItemIds.contains(itemId);
    }
}
